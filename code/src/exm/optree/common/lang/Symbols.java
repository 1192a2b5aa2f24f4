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

/**
 * Symbols resolved by the binder.  The operation tree stores them as
 * opaque handles and never resolves anything itself.
 */
public class Symbols {

  public static enum SymbolKind {
    TYPE,
    LOCAL,
    PARAMETER,
    FIELD,
    PROPERTY,
    EVENT,
    METHOD,
    LABEL,
  }

  public static interface Symbol {
    String name();
    SymbolKind symbolKind();
  }

  public static interface TypeSymbol extends Symbol {
  }

  public static interface LocalSymbol extends Symbol {
    /** @return true for locals with static lifetime */
    boolean isStatic();
  }

  public static interface ParameterSymbol extends Symbol {
    int ordinal();
  }

  public static interface FieldSymbol extends Symbol {
  }

  public static interface PropertySymbol extends Symbol {
  }

  public static interface EventSymbol extends Symbol {
  }

  public static interface MethodSymbol extends Symbol {
  }

  public static interface LabelSymbol extends Symbol {
  }
}
