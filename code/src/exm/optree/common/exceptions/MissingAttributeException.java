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
package exm.optree.common.exceptions;

import exm.optree.tree.OperationKind;

/**
 * Thrown when an operation is constructed without one of the attributes
 * its kind requires, e.g. a binary operation with no operator kind.
 */
public class MissingAttributeException extends OpTreeRuntimeError {

  private final OperationKind kind;
  private final String attribute;

  public MissingAttributeException(OperationKind kind, String attribute) {
    super("Cannot construct " + kind + " operation: missing required "
          + "attribute '" + attribute + "'");
    this.kind = kind;
    this.attribute = attribute;
  }

  public MissingAttributeException(OperationKind kind, String attribute,
                                   String detail) {
    super("Cannot construct " + kind + " operation: attribute '"
          + attribute + "' " + detail);
    this.kind = kind;
    this.attribute = attribute;
  }

  public OperationKind getKind() {
    return kind;
  }

  public String getAttribute() {
    return attribute;
  }

  private static final long serialVersionUID = 1L;
}
