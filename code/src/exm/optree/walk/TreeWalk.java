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
import java.util.Deque;
import java.util.List;

import org.apache.log4j.Logger;

import exm.optree.tree.Operation;

/**
 * Generic walks over operation trees.  Walking reads every child slot, so
 * lazy slots in the walked subtree are materialized.
 */
public class TreeWalk {

  /**
   * Top-down pre-order walk, children in evaluation order
   * @param logger
   * @param root
   * @param walker
   */
  public static void walk(Logger logger, Operation root, TreeWalker walker) {
    walk(logger, root, walker, true);
  }

  /**
   * Walk pre-order
   * @param logger
   * @param root
   * @param walker
   * @param recursive if false, only visit root and its direct children
   */
  public static void walk(Logger logger, Operation root, TreeWalker walker,
                          boolean recursive) {
    if (!recursive) {
      walker.visit(logger, root);
      for (Operation child: root.children()) {
        walker.visit(logger, child);
      }
      return;
    }

    Deque<Operation> stack = new ArrayDeque<Operation>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Operation curr = stack.pop();
      walker.visit(logger, curr);
      List<Operation> children = curr.children();
      // Push in reverse so that first child is visited first
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
  }

  /**
   * @return all operations below root in pre-order, not including root
   */
  public static List<Operation> descendants(Operation root) {
    final List<Operation> result = new ArrayList<Operation>();
    walk(null, root, new TreeWalker() {
      @Override
      protected void visit(Operation op) {
        result.add(op);
      }
    });
    result.remove(0);
    return result;
  }

  public static abstract class TreeWalker {
    public void visit(Logger logger, Operation op) {
      visit(op);
    }

    protected void visit(Operation op) {
      // Nothing
    }
  }
}
