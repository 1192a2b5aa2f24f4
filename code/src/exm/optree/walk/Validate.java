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
package exm.optree.walk;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.optree.common.Logging;
import exm.optree.common.Settings;
import exm.optree.tree.Operation;
import exm.optree.tree.OperationKind.Family;
import exm.optree.tree.Switches.SwitchCaseOperation;

/**
 * Sanity checks over a whole operation tree, for use in tests and debug
 * builds.  Reads every slot, so lazy slots are materialized.
 *
 * Checks:
 * - each child's parent is the operation listing it as a child
 * - no operation is reachable twice
 * - flow graph operations have no semantic model
 *
 * The combined condition of a switch case is not a child and is skipped.
 */
public class Validate {

  /**
   * Check tree, logging and returning any problems found.  Stops after
   * {@link Settings#VALIDATE_MAX_VIOLATIONS} problems.
   * @param root
   * @return descriptions of violations, empty if tree is consistent
   */
  public static List<String> findViolations(Operation root) {
    Logger logger = Logging.getOpTreeLogger();
    long max = Settings.getLongUnchecked(Settings.VALIDATE_MAX_VIOLATIONS);

    List<String> violations = new ArrayList<String>();
    Set<Operation> seen = Collections.newSetFromMap(
                          new IdentityHashMap<Operation, Boolean>());
    Deque<Operation> stack = new ArrayDeque<Operation>();
    stack.push(root);
    seen.add(root);

    while (!stack.isEmpty() && violations.size() < max) {
      Operation op = stack.pop();
      checkOperation(op, violations);

      for (Operation child: op.children()) {
        if (child.parent() != op) {
          violations.add("Bad parent for child " + child + " of " + op
                       + ": is " + child.parent());
        }
        if (!seen.add(child)) {
          violations.add("Operation " + child + " reachable more than once,"
                       + " second time from " + op);
        } else {
          stack.push(child);
        }
      }
    }

    if (violations.size() > max) {
      violations = new ArrayList<String>(violations.subList(0, (int)max));
    }

    if (logger.isDebugEnabled()) {
      for (String violation: violations) {
        logger.debug(violation);
      }
    }
    if (!violations.isEmpty()) {
      logger.warn("Operation tree rooted at " + root + " has "
          + violations.size() + " violation(s)"
          + (violations.size() >= max ? " (stopped at limit)" : ""));
    }
    return violations;
  }

  private static void checkOperation(Operation op, List<String> violations) {
    if (op.kind().family() == Family.FLOW && op.semanticModel() != null) {
      violations.add("Flow graph operation " + op + " has a semantic model");
    }
    if (op instanceof SwitchCaseOperation) {
      Operation condition = ((SwitchCaseOperation)op).condition();
      if (condition != null && condition.parent() == op) {
        violations.add("Combined condition of " + op + " is linked to it");
      }
    }
  }

  /**
   * Check tree with assertions.  Only warns, once, if assertions are
   * disabled.
   * @param logger
   * @param root
   */
  public static void checkTree(Logger logger, Operation root) {
    boolean assertsOn = false;
    assert(assertsOn = true);
    if (!assertsOn) {
      Logging.uniqueWarn("Assertions disabled: operation tree checks "
                         + "skipped");
      return;
    }
    assert(checkTreeAssert(logger, root));
  }

  private static boolean checkTreeAssert(Logger logger, Operation root) {
    List<String> violations = findViolations(root);
    if (!violations.isEmpty() && logger != null) {
      logger.error("Invalid operation tree:\n" + root.dump());
    }
    assert(violations.isEmpty()) : "Invalid operation tree: " + violations;
    return true;
  }
}
