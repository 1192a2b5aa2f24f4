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

import java.util.concurrent.atomic.AtomicReference;

import org.apache.log4j.Logger;

import exm.optree.common.Logging;

/**
 * Publish-once storage for a deferred child slot.
 *
 * The cell starts out holding a private sentinel.  The first reader runs
 * the factory, links the result to the slot's owner and tries to swap it in
 * with a single compare-and-set.  Readers never block: if several threads
 * race, each computes a value, exactly one publishes, and the others throw
 * their result away and return the published one.  Null is a valid
 * published value and means the child is absent.
 *
 * Parent links are stamped before the compare-and-set so any thread that
 * sees the value also sees its parent.  Only the publishing thread verifies
 * the links.
 *
 * @param <V> an operation, or an immutable list of operations
 */
final class LazyCell<V> {
  private static final Logger logger = Logging.getOpTreeLogger();

  private static final Object UNSET = new Object();

  private final ChildFactory<? extends V> factory;

  private final AtomicReference<Object> value =
                                  new AtomicReference<Object>(UNSET);

  LazyCell(ChildFactory<? extends V> factory) {
    assert(factory != null);
    this.factory = factory;
  }

  boolean isPublished() {
    return value.get() != UNSET;
  }

  @SuppressWarnings("unchecked")
  V get(SlotBinding slot) {
    Object current = value.get();
    if (current != UNSET) {
      return (V)current;
    }

    V created = factory.create();
    slot.checkValue(created);
    Operation owner = slot.owner();
    ParentLinks.stamp(owner, created, slot.exemption());

    if (value.compareAndSet(UNSET, created)) {
      assert(ParentLinks.verifyInstalled(owner, slot.name(), created,
                                         slot.exemption()));
      if (logger.isTraceEnabled()) {
        logger.trace("Materialized " + slot.name() + " of " + owner);
      }
      return created;
    }

    if (logger.isDebugEnabled()) {
      logger.debug("Discarded duplicate materialization of " + slot.name()
                   + " of " + owner);
    }
    return (V)value.get();
  }
}
