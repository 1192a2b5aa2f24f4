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

import exm.optree.common.exceptions.KindMismatchException;
import exm.optree.common.lang.Symbols.Symbol;
import exm.optree.common.lang.Symbols.TypeSymbol;
import exm.optree.tree.Operators.BinaryOperatorKind;

/**
 * Pattern matching: the is-pattern expression and the patterns
 * themselves.
 *
 * Every pattern knows the type of the value it is matched against and the
 * type that value is known to have once the match succeeds.
 */
public class Patterns {

  /** value is pattern */
  public static final class IsPatternOperation extends Operation {
    private final Slot<Operation> value;
    private final Slot<PatternOperation> pattern;

    public IsPatternOperation(OperationInfo info, Slot<Operation> value,
                              Slot<PatternOperation> pattern) {
      super(OperationKind.IS_PATTERN, info);
      this.value = install(value, "value");
      this.pattern = install(pattern, "pattern");
      linkChildren();
    }

    public Operation value() {
      return value.get();
    }

    public PatternOperation pattern() {
      return pattern.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(value()).add(pattern());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitIsPattern(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitIsPattern(this, argument);
    }
  }

  public static abstract class PatternOperation extends Operation {
    private final TypeSymbol inputType;
    private final TypeSymbol narrowedType;

    protected PatternOperation(OperationKind kind, OperationInfo info,
                               TypeSymbol inputType, TypeSymbol narrowedType) {
      super(kind, info);
      this.inputType = require(inputType, "inputType");
      this.narrowedType = require(narrowedType, "narrowedType");
    }

    /** @return type of the value being matched */
    public TypeSymbol inputType() {
      return inputType;
    }

    /** @return type the value has after a successful match */
    public TypeSymbol narrowedType() {
      return narrowedType;
    }
  }

  public static final class ConstantPatternOperation
                                                extends PatternOperation {
    private final Slot<Operation> value;

    public ConstantPatternOperation(OperationInfo info, TypeSymbol inputType,
        TypeSymbol narrowedType, Slot<Operation> value) {
      super(OperationKind.CONSTANT_PATTERN, info, inputType, narrowedType);
      this.value = install(value, "value");
      linkChildren();
    }

    public Operation value() {
      return value.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(value());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitConstantPattern(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitConstantPattern(this, argument);
    }
  }

  /**
   * T x, var x.  The matched type is null for var, which also matches
   * null.
   */
  public static final class DeclarationPatternOperation
                                                extends PatternOperation {
    private final TypeSymbol matchedType;
    private final boolean matchesNull;
    private final Symbol declaredSymbol;

    public DeclarationPatternOperation(OperationInfo info,
        TypeSymbol inputType, TypeSymbol narrowedType,
        TypeSymbol matchedType, boolean matchesNull, Symbol declaredSymbol) {
      super(OperationKind.DECLARATION_PATTERN, info, inputType,
            narrowedType);
      this.matchedType = matchedType;
      this.matchesNull = matchesNull;
      this.declaredSymbol = declaredSymbol;
      linkChildren();
    }

    public TypeSymbol matchedType() {
      return matchedType;
    }

    public boolean matchesNull() {
      return matchesNull;
    }

    /** @return declared variable, null for a discard designation */
    public Symbol declaredSymbol() {
      return declaredSymbol;
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(TreeUtil.name(matchedType));
      sb.append(' ');
      sb.append(TreeUtil.name(declaredSymbol));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitDeclarationPattern(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitDeclarationPattern(this, argument);
    }
  }

  public static final class TypePatternOperation extends PatternOperation {
    private final TypeSymbol matchedType;

    public TypePatternOperation(OperationInfo info, TypeSymbol inputType,
        TypeSymbol narrowedType, TypeSymbol matchedType) {
      super(OperationKind.TYPE_PATTERN, info, inputType, narrowedType);
      this.matchedType = require(matchedType, "matchedType");
      linkChildren();
    }

    public TypeSymbol matchedType() {
      return matchedType;
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(TreeUtil.name(matchedType));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitTypePattern(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitTypePattern(this, argument);
    }
  }

  /** _, matches anything */
  public static final class DiscardPatternOperation extends PatternOperation {
    public DiscardPatternOperation(OperationInfo info, TypeSymbol inputType,
                                   TypeSymbol narrowedType) {
      super(OperationKind.DISCARD_PATTERN, info, inputType, narrowedType);
      linkChildren();
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitDiscardPattern(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitDiscardPattern(this, argument);
    }
  }

  /**
   * T (p1, p2) { A: p3 } x: positional subpatterns matched against the
   * deconstructed value, then property subpatterns.
   */
  public static final class RecursivePatternOperation
                                                extends PatternOperation {
    private final TypeSymbol matchedType;
    private final Symbol deconstructSymbol;
    private final Symbol declaredSymbol;
    private final ListSlot<PatternOperation> deconstructionSubpatterns;
    private final ListSlot<PropertySubpatternOperation> propertySubpatterns;

    public RecursivePatternOperation(OperationInfo info,
        TypeSymbol inputType, TypeSymbol narrowedType,
        TypeSymbol matchedType, Symbol deconstructSymbol,
        Symbol declaredSymbol,
        ListSlot<PatternOperation> deconstructionSubpatterns,
        ListSlot<PropertySubpatternOperation> propertySubpatterns) {
      super(OperationKind.RECURSIVE_PATTERN, info, inputType, narrowedType);
      this.matchedType = require(matchedType, "matchedType");
      this.deconstructSymbol = deconstructSymbol;
      this.declaredSymbol = declaredSymbol;
      this.deconstructionSubpatterns = install(deconstructionSubpatterns,
                                               "deconstructionSubpatterns");
      this.propertySubpatterns = install(propertySubpatterns,
                                         "propertySubpatterns");
      linkChildren();
    }

    public TypeSymbol matchedType() {
      return matchedType;
    }

    /**
     * @return Deconstruct method or tuple type used, null if there are no
     *         positional subpatterns
     */
    public Symbol deconstructSymbol() {
      return deconstructSymbol;
    }

    public Symbol declaredSymbol() {
      return declaredSymbol;
    }

    public List<PatternOperation> deconstructionSubpatterns() {
      return deconstructionSubpatterns.get();
    }

    public List<PropertySubpatternOperation> propertySubpatterns() {
      return propertySubpatterns.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(deconstructionSubpatterns());
      children.addAll(propertySubpatterns());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitRecursivePattern(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitRecursivePattern(this, argument);
    }
  }

  /**
   * member: pattern inside a recursive pattern.  Not itself a pattern.
   */
  public static final class PropertySubpatternOperation extends Operation {
    private final Slot<Operation> member;
    private final Slot<PatternOperation> pattern;

    public PropertySubpatternOperation(OperationInfo info,
        Slot<Operation> member, Slot<PatternOperation> pattern) {
      super(OperationKind.PROPERTY_SUBPATTERN, info);
      this.member = install(member, "member");
      this.pattern = install(pattern, "pattern");
      linkChildren();
    }

    public Operation member() {
      return member.get();
    }

    public PatternOperation pattern() {
      return pattern.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(member()).add(pattern());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitPropertySubpattern(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitPropertySubpattern(this, argument);
    }
  }

  /** < value, >= value, ... */
  public static final class RelationalPatternOperation
                                                extends PatternOperation {
    private final BinaryOperatorKind operatorKind;
    private final Slot<Operation> value;

    public RelationalPatternOperation(OperationInfo info,
        TypeSymbol inputType, TypeSymbol narrowedType,
        BinaryOperatorKind operatorKind, Slot<Operation> value) {
      super(OperationKind.RELATIONAL_PATTERN, info, inputType, narrowedType);
      this.operatorKind = require(operatorKind, "operatorKind");
      if (!operatorKind.isRelational()) {
        throw new KindMismatchException(OperationKind.RELATIONAL_PATTERN,
            operatorKind + " is not a relational operator");
      }
      this.value = install(value, "value");
      linkChildren();
    }

    public BinaryOperatorKind operatorKind() {
      return operatorKind;
    }

    public Operation value() {
      return value.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(value());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(operatorKind);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitRelationalPattern(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitRelationalPattern(this, argument);
    }
  }

  public static final class NegatedPatternOperation extends PatternOperation {
    private final Slot<PatternOperation> pattern;

    public NegatedPatternOperation(OperationInfo info, TypeSymbol inputType,
        TypeSymbol narrowedType, Slot<PatternOperation> pattern) {
      super(OperationKind.NEGATED_PATTERN, info, inputType, narrowedType);
      this.pattern = install(pattern, "pattern");
      linkChildren();
    }

    public PatternOperation pattern() {
      return pattern.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(pattern());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitNegatedPattern(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitNegatedPattern(this, argument);
    }
  }

  /** p1 and p2, p1 or p2 */
  public static final class BinaryPatternOperation extends PatternOperation {
    private final BinaryOperatorKind operatorKind;
    private final Slot<PatternOperation> leftPattern;
    private final Slot<PatternOperation> rightPattern;

    public BinaryPatternOperation(OperationInfo info, TypeSymbol inputType,
        TypeSymbol narrowedType, BinaryOperatorKind operatorKind,
        Slot<PatternOperation> leftPattern,
        Slot<PatternOperation> rightPattern) {
      super(OperationKind.BINARY_PATTERN, info, inputType, narrowedType);
      this.operatorKind = require(operatorKind, "operatorKind");
      if (operatorKind != BinaryOperatorKind.AND &&
          operatorKind != BinaryOperatorKind.OR) {
        throw new KindMismatchException(OperationKind.BINARY_PATTERN,
            "pattern combinator must be AND or OR, not " + operatorKind);
      }
      this.leftPattern = install(leftPattern, "leftPattern");
      this.rightPattern = install(rightPattern, "rightPattern");
      linkChildren();
    }

    public BinaryOperatorKind operatorKind() {
      return operatorKind;
    }

    public PatternOperation leftPattern() {
      return leftPattern.get();
    }

    public PatternOperation rightPattern() {
      return rightPattern.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(leftPattern()).add(rightPattern());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(operatorKind);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitBinaryPattern(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitBinaryPattern(this, argument);
    }
  }

  /** [p1, p2, .. rest] */
  public static final class ListPatternOperation extends PatternOperation {
    private final Symbol lengthSymbol;
    private final Symbol indexerSymbol;
    private final Symbol declaredSymbol;
    private final ListSlot<PatternOperation> patterns;

    public ListPatternOperation(OperationInfo info, TypeSymbol inputType,
        TypeSymbol narrowedType, Symbol lengthSymbol, Symbol indexerSymbol,
        Symbol declaredSymbol, ListSlot<PatternOperation> patterns) {
      super(OperationKind.LIST_PATTERN, info, inputType, narrowedType);
      this.lengthSymbol = lengthSymbol;
      this.indexerSymbol = indexerSymbol;
      this.declaredSymbol = declaredSymbol;
      this.patterns = install(patterns, "patterns");
      linkChildren();
    }

    public Symbol lengthSymbol() {
      return lengthSymbol;
    }

    public Symbol indexerSymbol() {
      return indexerSymbol;
    }

    public Symbol declaredSymbol() {
      return declaredSymbol;
    }

    public List<PatternOperation> patterns() {
      return patterns.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(patterns());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitListPattern(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitListPattern(this, argument);
    }
  }

  /** .. or .. pattern inside a list pattern */
  public static final class SlicePatternOperation extends PatternOperation {
    private final Symbol sliceSymbol;
    private final Slot<PatternOperation> pattern;

    public SlicePatternOperation(OperationInfo info, TypeSymbol inputType,
        TypeSymbol narrowedType, Symbol sliceSymbol,
        Slot<PatternOperation> pattern) {
      super(OperationKind.SLICE_PATTERN, info, inputType, narrowedType);
      this.sliceSymbol = sliceSymbol;
      this.pattern = installOptional(pattern, "pattern");
      linkChildren();
    }

    /** @return slice method, null if the slice isn't captured */
    public Symbol sliceSymbol() {
      return sliceSymbol;
    }

    public PatternOperation pattern() {
      return pattern.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(pattern());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitSlicePattern(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitSlicePattern(this, argument);
    }
  }
}
