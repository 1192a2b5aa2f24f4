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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.optree.common.exceptions.OpTreeRuntimeError;

/**
 * A child slot holding an ordered sequence of operations.  The sequence is
 * published as one unit: it is computed in full, copied into an immutable
 * list and only then made visible.  Entries are never null.
 *
 * @param <T> static type of the elements
 */
public abstract class ListSlot<T extends Operation> extends SlotBinding {

  public static <T extends Operation> ListSlot<T> of(List<? extends T> values) {
    if (values == null) {
      throw new OpTreeRuntimeError("ListSlot.of needs a list: use "
                                 + "ListSlot.empty() for no elements");
    }
    return new EagerListSlot<T>(seal(values));
  }

  @SafeVarargs
  public static <T extends Operation> ListSlot<T> of(T... values) {
    ImmutableList.Builder<T> builder = ImmutableList.builder();
    for (T value: values) {
      if (value == null) {
        throw new OpTreeRuntimeError("Null entry in child sequence");
      }
      builder.add(value);
    }
    return new EagerListSlot<T>(builder.build());
  }

  public static <T extends Operation> ListSlot<T> empty() {
    return new EagerListSlot<T>(ImmutableList.<T>of());
  }

  public static <T extends Operation> ListSlot<T> lazy(
                  final ChildFactory<? extends List<? extends T>> factory) {
    if (factory == null) {
      throw new OpTreeRuntimeError("Lazy slot needs a factory");
    }
    return new LazyListSlot<T>(new ChildFactory<ImmutableList<T>>() {
      @Override
      public ImmutableList<T> create() {
        List<? extends T> values = factory.create();
        if (values == null) {
          throw new OpTreeRuntimeError("Child sequence factory returned "
                                     + "null instead of a list");
        }
        return seal(values);
      }
    });
  }

  /**
   * @return the elements in evaluation order.  Materializes lazy slots.
   */
  public abstract ImmutableList<T> get();

  private static <T extends Operation> ImmutableList<T> seal(
                                                List<? extends T> values) {
    for (int i = 0; i < values.size(); i++) {
      if (values.get(i) == null) {
        throw new OpTreeRuntimeError("Null entry at index " + i +
                                     " of child sequence");
      }
    }
    return ImmutableList.copyOf(values);
  }

  private static class EagerListSlot<T extends Operation>
                                              extends ListSlot<T> {
    private final ImmutableList<T> values;

    EagerListSlot(ImmutableList<T> values) {
      this.values = values;
    }

    @Override
    protected void onAttach() {
      // Entries were checked when the slot was made
    }

    @Override
    protected void onLink() {
      ParentLinks.install(owner(), name(), values, exemption());
    }

    @Override
    public ImmutableList<T> get() {
      return values;
    }

    @Override
    public boolean isMaterialized() {
      return true;
    }
  }

  private static class LazyListSlot<T extends Operation>
                                              extends ListSlot<T> {
    private final LazyCell<ImmutableList<T>> cell;

    LazyListSlot(ChildFactory<ImmutableList<T>> factory) {
      this.cell = new LazyCell<ImmutableList<T>>(factory);
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
    public ImmutableList<T> get() {
      return cell.get(this);
    }

    @Override
    public boolean isMaterialized() {
      return cell.isPublished();
    }
  }
}
