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

import org.apache.log4j.Logger;

import exm.optree.common.Logging;
import exm.optree.common.Settings;

/**
 * Maintains the rule that each child's parent is the operation that
 * installed it.
 *
 * Links are stamped whenever a slot value is installed: at construction for
 * eager slots, at publication for lazy ones.  Verification is only run
 * inside assert statements, so it costs nothing unless the JVM runs with
 * assertions enabled.
 */
public class ParentLinks {
  private static final Logger logger = Logging.getOpTreeLogger();

  /**
   * Slots whose values are deliberately not linked to the installing
   * operation.
   */
  public static enum Exemption {
    NONE,
    /**
     * Combined condition of a switch case.  It aliases expressions that are
     * already owned by the case's clauses, so it keeps whatever parents
     * those expressions have.
     */
    ALIASED_CASE_CONDITION,
    ;
  }

  /**
   * Link an eagerly supplied value and check the result.
   */
  static void install(Operation owner, String slotName, Object value,
                      Exemption exemption) {
    stamp(owner, value, exemption);
    assert(verifyInstalled(owner, slotName, value, exemption));
  }

  /**
   * Set the parent of each operation in value to owner, unless it
   * already has one.  An operation that already belongs to another node
   * keeps that parent, which verification then reports.
   * @param value null, an operation, or a list of operations
   */
  static void stamp(Operation owner, Object value, Exemption exemption) {
    if (value == null || exemption != Exemption.NONE) {
      return;
    }
    if (value instanceof Operation) {
      stampOne(owner, (Operation)value);
    } else {
      for (Object child: (List<?>)value) {
        stampOne(owner, (Operation)child);
      }
    }
  }

  private static void stampOne(Operation owner, Operation child) {
    if (!child.linkParent(owner) && logger.isDebugEnabled()) {
      logger.debug("Not relinking " + child + " to " + owner
                 + ": already owned by " + child.parent());
    }
  }

  /**
   * Check that every operation in value has owner as its parent.
   * Intended to be called as the condition of an assert statement.
   * @return true, failures are raised as AssertionErrors
   */
  static boolean verifyInstalled(Operation owner, String slotName,
                                 Object value, Exemption exemption) {
    if (value == null) {
      return true;
    }
    if (exemption != Exemption.NONE) {
      if (logger.isTraceEnabled()) {
        logger.trace("Skipped parent check of " + slotName + " of " + owner
                   + ": " + exemption);
      }
      return true;
    }
    boolean deep = Settings.getBooleanUnchecked(Settings.VERIFY_DEEP);
    if (value instanceof Operation) {
      verifyOne(owner, slotName, (Operation)value, deep);
    } else {
      for (Object child: (List<?>)value) {
        verifyOne(owner, slotName, (Operation)child, deep);
      }
    }
    return true;
  }

  private static void verifyOne(Operation owner, String slotName,
                                Operation child, boolean deep) {
    assert(child != owner) : "Operation " + owner + " installed as its own "
                              + slotName;
    assert(child.parent() == owner) : "Bad parent for " + slotName
        + " child " + child + "\n\nis " + child.parent()
        + "\n\nbut should be: " + owner;
    if (deep) {
      verifySubtree(child);
    }
  }

  /**
   * Check links of the whole subtree under op.  Forces materialization of
   * any lazy slots below it.
   */
  static void verifySubtree(Operation op) {
    for (Operation child: op.children()) {
      assert(child.parent() == op) : "Bad parent for child " + child
          + " of " + op + "\n\nis " + child.parent();
      verifySubtree(child);
    }
  }

  /**
   * @return true if child is linked to parent and listed among its children
   */
  public static boolean isLinked(Operation parent, Operation child) {
    if (child.parent() != parent) {
      return false;
    }
    for (Operation c: parent.children()) {
      if (c == child) {
        return true;
      }
    }
    return false;
  }
}
