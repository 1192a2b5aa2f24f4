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
import exm.optree.common.lang.Symbols.MethodSymbol;

/**
 * Classification of a conversion, as computed by the binder.
 */
public class Conversion {

  public static enum ConversionKind {
    IDENTITY,
    NUMERIC,
    REFERENCE,
    BOXING,
    UNBOXING,
    NULLABLE,
    USER_DEFINED,
    DYNAMIC,
    OTHER,
  }

  public static final Conversion IDENTITY =
            new Conversion(ConversionKind.IDENTITY, true, null);

  private final ConversionKind conversionKind;
  private final boolean isImplicit;
  private final MethodSymbol method;

  public Conversion(ConversionKind conversionKind, boolean isImplicit,
                    MethodSymbol method) {
    if (conversionKind == null) {
      throw new OpTreeRuntimeError("Conversion kind must be given");
    }
    if (conversionKind == ConversionKind.USER_DEFINED && method == null) {
      throw new OpTreeRuntimeError("User-defined conversion needs a method");
    }
    this.conversionKind = conversionKind;
    this.isImplicit = isImplicit;
    this.method = method;
  }

  public ConversionKind conversionKind() {
    return conversionKind;
  }

  public boolean isIdentity() {
    return conversionKind == ConversionKind.IDENTITY;
  }

  public boolean isImplicit() {
    return isImplicit;
  }

  public boolean isUserDefined() {
    return conversionKind == ConversionKind.USER_DEFINED;
  }

  /** @return operator method for user-defined conversions, otherwise null */
  public MethodSymbol method() {
    return method;
  }

  @Override
  public String toString() {
    return conversionKind.toString().toLowerCase() +
          (isImplicit ? "(implicit)" : "(explicit)") +
          (method == null ? "" : " via " + method.name());
  }
}
