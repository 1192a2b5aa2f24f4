/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.optree.tree;

/**
 * Computes the value of a deferred child slot from inputs captured when
 * the owning operation was constructed.
 *
 * Implementations must be deterministic and must not touch shared compiler
 * state: under contention the factory can run more than once for the same
 * slot and all but one result is thrown away.
 *
 * @param <V> an operation, or a list of operations for sequence slots
 */
public interface ChildFactory<V> {
  V create();
}
