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

import exm.optree.common.exceptions.OpTreeRuntimeError;
import exm.optree.tree.ParentLinks.Exemption;

/**
 * Bookkeeping common to single and sequence child slots: which operation
 * owns the slot and how its value is linked back to the owner.
 * A slot is installed into exactly one operation.
 */
abstract class SlotBinding {
  private Operation owner;
  private String name;
  private boolean required;
  private Exemption exemption = Exemption.NONE;

  final void attach(Operation owner, String name, boolean required,
                    Exemption exemption) {
    assert(owner != null);
    if (this.owner != null) {
      throw new OpTreeRuntimeError("Slot " + name + " of " + owner
          + " is already installed as " + this.name + " of " + this.owner);
    }
    this.owner = owner;
    this.name = name;
    this.required = required;
    this.exemption = exemption;
    onAttach();
  }

  /**
   * Link the slot's value to its owner.  Called once the owner's
   * constructor has finished its checks.
   */
  final void link() {
    owner();
    onLink();
  }

  /** Called once the slot knows its owner; checks but doesn't link */
  protected abstract void onAttach();

  /** Link any value that is already known */
  protected abstract void onLink();

  /** @return true once the slot's value is fixed */
  public abstract boolean isMaterialized();

  final Operation owner() {
    if (owner == null) {
      throw new OpTreeRuntimeError("Slot read before being installed");
    }
    return owner;
  }

  final String name() {
    return name;
  }

  final boolean isRequired() {
    return required;
  }

  final Exemption exemption() {
    return exemption;
  }

  /**
   * Sanity check a value about to be installed
   * @param value
   */
  void checkValue(Object value) {
    // Nothing by default
  }
}
