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

import org.apache.commons.lang3.StringUtils;

import exm.optree.common.lang.ConstantValue;
import exm.optree.common.lang.Symbols.Symbol;

/**
 * Helpers for describing operations in log and assertion messages.
 */
public class TreeUtil {
  public static final String indent = "  ";

  private static final int MAX_DESCRIBED_CONSTANT = 40;

  /**
   * @return the symbol's name, or "null" if there isn't one.  Safe to call
   *         on a partially constructed operation.
   */
  public static String name(Symbol symbol) {
    return symbol == null ? "null" : symbol.name();
  }

  public static void prettyPrintSymbolList(StringBuilder sb,
                                           List<? extends Symbol> symbols) {
    if (symbols == null) {
      sb.append("null");
      return;
    }
    sb.append('[');
    boolean first = true;
    for (Symbol symbol: symbols) {
      if (first) {
        first = false;
      } else {
        sb.append(", ");
      }
      sb.append(name(symbol));
    }
    sb.append(']');
  }

  /**
   * Append " locals=[...]" if there are any locals
   */
  public static void describeLocals(StringBuilder sb,
                                    List<? extends Symbol> locals) {
    if (locals != null && !locals.isEmpty()) {
      sb.append(" locals=");
      prettyPrintSymbolList(sb, locals);
    }
  }

  /**
   * @return printable constant, shortened with "..." if too long
   */
  public static String describeConstant(ConstantValue constant) {
    return StringUtils.abbreviate(String.valueOf(constant),
                                  MAX_DESCRIBED_CONSTANT);
  }
}
