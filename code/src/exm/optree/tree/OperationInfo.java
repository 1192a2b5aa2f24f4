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
import exm.optree.common.lang.ConstantValue;
import exm.optree.common.lang.SemanticModel;
import exm.optree.common.lang.SourceLocus;
import exm.optree.common.lang.Symbols.TypeSymbol;

/**
 * Attributes shared by every operation regardless of kind: where it came
 * from, what it evaluates to and whether the user wrote it.
 *
 * Operations created by the flow graph builder have no syntax of their own
 * and are never attached to a semantic model; they are built from
 * {@link #forFlowGraph} infos.
 */
public class OperationInfo {
  private final SemanticModel semanticModel;
  private final SourceLocus syntax;
  private final TypeSymbol type;
  private final ConstantValue constantValue;
  private final boolean isImplicit;
  private final boolean flowOnly;

  private OperationInfo(SemanticModel semanticModel, SourceLocus syntax,
                        TypeSymbol type, ConstantValue constantValue,
                        boolean isImplicit, boolean flowOnly) {
    if (syntax == null) {
      throw new OpTreeRuntimeError("Operations need a source locus");
    }
    this.semanticModel = semanticModel;
    this.syntax = syntax;
    this.type = type;
    this.constantValue = constantValue == null ? ConstantValue.NONE
                                               : constantValue;
    this.isImplicit = isImplicit;
    this.flowOnly = flowOnly;
  }

  public static OperationInfo create(SemanticModel semanticModel,
      SourceLocus syntax, TypeSymbol type, ConstantValue constantValue,
      boolean isImplicit) {
    return new OperationInfo(semanticModel, syntax, type, constantValue,
                             isImplicit, false);
  }

  /**
   * Info for an operation producing a value of the given type
   */
  public static OperationInfo expression(SemanticModel semanticModel,
      SourceLocus syntax, TypeSymbol type) {
    return create(semanticModel, syntax, type, ConstantValue.NONE, false);
  }

  /**
   * Info for an operation that produces no value
   */
  public static OperationInfo statement(SemanticModel semanticModel,
      SourceLocus syntax, boolean isImplicit) {
    return create(semanticModel, syntax, null, ConstantValue.NONE,
                  isImplicit);
  }

  /**
   * Info for an operation synthesized while building the flow graph.
   * @param syntax locus borrowed from the construct the operation summarizes
   */
  public static OperationInfo forFlowGraph(SourceLocus syntax,
      TypeSymbol type, ConstantValue constantValue, boolean isImplicit) {
    return new OperationInfo(null, syntax, type, constantValue, isImplicit,
                             true);
  }

  public OperationInfo withType(TypeSymbol newType) {
    return new OperationInfo(semanticModel, syntax, newType, constantValue,
                             isImplicit, flowOnly);
  }

  public OperationInfo withConstantValue(ConstantValue newConstant) {
    return new OperationInfo(semanticModel, syntax, type, newConstant,
                             isImplicit, flowOnly);
  }

  public OperationInfo asImplicit() {
    return new OperationInfo(semanticModel, syntax, type, constantValue,
                             true, flowOnly);
  }

  public SemanticModel semanticModel() {
    return semanticModel;
  }

  public SourceLocus syntax() {
    return syntax;
  }

  public TypeSymbol type() {
    return type;
  }

  public ConstantValue constantValue() {
    return constantValue;
  }

  public boolean isImplicit() {
    return isImplicit;
  }

  /** @return true if this info was made by the flow graph builder */
  public boolean isFlowOnly() {
    return flowOnly;
  }
}
