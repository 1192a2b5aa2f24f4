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

import exm.optree.common.exceptions.MissingAttributeException;
import exm.optree.common.exceptions.OpTreeRuntimeError;

/**
 * A named child slot holding at most one operation.
 *
 * Eager slots are given their value up front and link it to the owner when
 * installed.  Lazy slots run a {@link ChildFactory} on first read and
 * publish the result once; see {@link LazyCell}.
 *
 * @param <T> static type of the child
 */
public abstract class Slot<T extends Operation> extends SlotBinding {

  /**
   * @param value the child, must not be null
   */
  public static <T extends Operation> Slot<T> of(T value) {
    if (value == null) {
      throw new OpTreeRuntimeError("Slot.of needs a value: use "
                                 + "Slot.absent() for a missing child");
    }
    return new EagerSlot<T>(value);
  }

  /**
   * @param value the child, or null if it is absent
   */
  public static <T extends Operation> Slot<T> optional(T value) {
    return new EagerSlot<T>(value);
  }

  public static <T extends Operation> Slot<T> absent() {
    return new EagerSlot<T>(null);
  }

  public static <T extends Operation> Slot<T> lazy(
                                      ChildFactory<? extends T> factory) {
    if (factory == null) {
      throw new OpTreeRuntimeError("Lazy slot needs a factory");
    }
    return new LazySlot<T>(factory);
  }

  /**
   * @return the child, or null if absent.  Materializes lazy slots.
   */
  public abstract T get();

  @Override
  void checkValue(Object value) {
    if (value == null && isRequired()) {
      throw new OpTreeRuntimeError("Required child " + name() + " of "
          + owner().kind() + " operation was not created");
    }
  }

  private static class EagerSlot<T extends Operation> extends Slot<T> {
    private final T value;

    EagerSlot(T value) {
      this.value = value;
    }

    @Override
    protected void onAttach() {
      if (value == null && isRequired()) {
        throw new MissingAttributeException(owner().kind(), name());
      }
    }

    @Override
    protected void onLink() {
      ParentLinks.install(owner(), name(), value, exemption());
    }

    @Override
    public T get() {
      return value;
    }

    @Override
    public boolean isMaterialized() {
      return true;
    }
  }

  private static class LazySlot<T extends Operation> extends Slot<T> {
    private final LazyCell<T> cell;

    LazySlot(ChildFactory<? extends T> factory) {
      this.cell = new LazyCell<T>(factory);
    }

    @Override
    protected void onAttach() {
      // Nothing to check until first read
    }

    @Override
    protected void onLink() {
      // Linked when published
    }

    @Override
    public T get() {
      return cell.get(this);
    }

    @Override
    public boolean isMaterialized() {
      return cell.isPublished();
    }
  }
}
