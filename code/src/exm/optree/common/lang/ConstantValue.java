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
package exm.optree.common.lang;

import exm.optree.common.exceptions.OpTreeRuntimeError;

/**
 * Compile-time constant value of an operation.  Distinguishes "no constant"
 * from a known constant that happens to be null.
 */
public class ConstantValue {

  public static final ConstantValue NONE = new ConstantValue(false, null);

  private static final ConstantValue NULL = new ConstantValue(true, null);

  private final boolean hasValue;
  private final Object value;

  private ConstantValue(boolean hasValue, Object value) {
    this.hasValue = hasValue;
    this.value = value;
  }

  public static ConstantValue of(Object value) {
    if (value == null) {
      return NULL;
    }
    return new ConstantValue(true, value);
  }

  public boolean hasValue() {
    return hasValue;
  }

  /**
   * @return the constant, possibly null
   * @throws OpTreeRuntimeError if there is no constant
   */
  public Object value() {
    if (!hasValue) {
      throw new OpTreeRuntimeError("Operation has no constant value");
    }
    return value;
  }

  @Override
  public int hashCode() {
    if (!hasValue) {
      return 0;
    }
    return value == null ? 1 : value.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof ConstantValue))
      return false;
    ConstantValue other = (ConstantValue) obj;
    if (hasValue != other.hasValue) {
      return false;
    }
    return value == null ? other.value == null : value.equals(other.value);
  }

  @Override
  public String toString() {
    if (!hasValue) {
      return "<none>";
    } else if (value instanceof String) {
      return "\"" + value + "\"";
    }
    return String.valueOf(value);
  }
}
