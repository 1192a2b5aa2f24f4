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
import exm.optree.common.lang.Conversion;
import exm.optree.common.lang.Symbols.MethodSymbol;
import exm.optree.common.lang.Symbols.TypeSymbol;

/**
 * Unary, binary and assignment operators along with the other
 * expression forms that combine or wrap operand values.
 */
public class Operators {

  public static enum UnaryOperatorKind {
    BITWISE_NEGATION,
    NOT,
    PLUS,
    MINUS,
    /** User-defined truth test */
    TRUE,
    /** User-defined falsity test */
    FALSE,
    /** Index from end, ^i */
    HAT,
  }

  public static enum BinaryOperatorKind {
    ADD,
    SUBTRACT,
    MULTIPLY,
    DIVIDE,
    INTEGER_DIVIDE,
    REMAINDER,
    POWER,
    LEFT_SHIFT,
    RIGHT_SHIFT,
    UNSIGNED_RIGHT_SHIFT,
    AND,
    OR,
    EXCLUSIVE_OR,
    CONDITIONAL_AND,
    CONDITIONAL_OR,
    CONCATENATE,
    EQUALS,
    OBJECT_VALUE_EQUALS,
    NOT_EQUALS,
    OBJECT_VALUE_NOT_EQUALS,
    LESS_THAN,
    LESS_THAN_OR_EQUAL,
    GREATER_THAN_OR_EQUAL,
    GREATER_THAN,
    LIKE;

    public boolean isEquality() {
      switch (this) {
        case EQUALS:
        case NOT_EQUALS:
        case OBJECT_VALUE_EQUALS:
        case OBJECT_VALUE_NOT_EQUALS:
          return true;
        default:
          return false;
      }
    }

    /**
     * @return true for the ordering comparisons and for equality
     */
    public boolean isRelational() {
      switch (this) {
        case LESS_THAN:
        case LESS_THAN_OR_EQUAL:
        case GREATER_THAN_OR_EQUAL:
        case GREATER_THAN:
        case EQUALS:
        case NOT_EQUALS:
          return true;
        default:
          return false;
      }
    }
  }

  public static final class UnaryOperation extends Operation {
    private final UnaryOperatorKind operatorKind;
    private final boolean isLifted;
    private final boolean isChecked;
    private final MethodSymbol operatorMethod;
    private final Slot<Operation> operand;

    public UnaryOperation(OperationInfo info, UnaryOperatorKind operatorKind,
        boolean isLifted, boolean isChecked, MethodSymbol operatorMethod,
        Slot<Operation> operand) {
      super(OperationKind.UNARY, info);
      this.operatorKind = require(operatorKind, "operatorKind");
      this.isLifted = isLifted;
      this.isChecked = isChecked;
      this.operatorMethod = operatorMethod;
      this.operand = install(operand, "operand");
      linkChildren();
    }

    public UnaryOperatorKind operatorKind() {
      return operatorKind;
    }

    public boolean isLifted() {
      return isLifted;
    }

    public boolean isChecked() {
      return isChecked;
    }

    /** @return user-defined operator, null for built-in */
    public MethodSymbol operatorMethod() {
      return operatorMethod;
    }

    public Operation operand() {
      return operand.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(operand());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(operatorKind);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitUnary(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitUnary(this, argument);
    }
  }

  public static final class BinaryOperation extends Operation {
    private final BinaryOperatorKind operatorKind;
    private final boolean isLifted;
    private final boolean isChecked;
    private final boolean isCompareText;
    private final MethodSymbol operatorMethod;
    private final Slot<Operation> leftOperand;
    private final Slot<Operation> rightOperand;

    public BinaryOperation(OperationInfo info,
        BinaryOperatorKind operatorKind, boolean isLifted, boolean isChecked,
        boolean isCompareText, MethodSymbol operatorMethod,
        Slot<Operation> leftOperand, Slot<Operation> rightOperand) {
      super(OperationKind.BINARY, info);
      this.operatorKind = require(operatorKind, "operatorKind");
      this.isLifted = isLifted;
      this.isChecked = isChecked;
      this.isCompareText = isCompareText;
      this.operatorMethod = operatorMethod;
      this.leftOperand = install(leftOperand, "leftOperand");
      this.rightOperand = install(rightOperand, "rightOperand");
      linkChildren();
    }

    public BinaryOperatorKind operatorKind() {
      return operatorKind;
    }

    public boolean isLifted() {
      return isLifted;
    }

    public boolean isChecked() {
      return isChecked;
    }

    /** @return true if string comparison is textual (case insensitive) */
    public boolean isCompareText() {
      return isCompareText;
    }

    public MethodSymbol operatorMethod() {
      return operatorMethod;
    }

    public Operation leftOperand() {
      return leftOperand.get();
    }

    public Operation rightOperand() {
      return rightOperand.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(leftOperand()).add(rightOperand());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(operatorKind);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitBinary(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitBinary(this, argument);
    }
  }

  /**
   * Element-wise tuple comparison.  Only equality and inequality.
   */
  public static final class TupleBinaryOperation extends Operation {
    private final BinaryOperatorKind operatorKind;
    private final Slot<Operation> leftOperand;
    private final Slot<Operation> rightOperand;

    public TupleBinaryOperation(OperationInfo info,
        BinaryOperatorKind operatorKind, Slot<Operation> leftOperand,
        Slot<Operation> rightOperand) {
      super(OperationKind.TUPLE_BINARY, info);
      this.operatorKind = require(operatorKind, "operatorKind");
      if (operatorKind != BinaryOperatorKind.EQUALS &&
          operatorKind != BinaryOperatorKind.NOT_EQUALS) {
        throw new KindMismatchException(OperationKind.TUPLE_BINARY,
            "tuple comparison must be EQUALS or NOT_EQUALS, not "
            + operatorKind);
      }
      this.leftOperand = install(leftOperand, "leftOperand");
      this.rightOperand = install(rightOperand, "rightOperand");
      linkChildren();
    }

    public BinaryOperatorKind operatorKind() {
      return operatorKind;
    }

    public Operation leftOperand() {
      return leftOperand.get();
    }

    public Operation rightOperand() {
      return rightOperand.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(leftOperand()).add(rightOperand());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(operatorKind);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitTupleBinary(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitTupleBinary(this, argument);
    }
  }

  /**
   * ++ and --, prefix or postfix.  The kind tells increment from
   * decrement.
   */
  public static final class IncrementOrDecrementOperation
                                                      extends Operation {
    private final boolean isPostfix;
    private final boolean isLifted;
    private final boolean isChecked;
    private final MethodSymbol operatorMethod;
    private final Slot<Operation> target;

    public IncrementOrDecrementOperation(OperationKind kind,
        OperationInfo info, boolean isPostfix, boolean isLifted,
        boolean isChecked, MethodSymbol operatorMethod,
        Slot<Operation> target) {
      super(checkKind(kind), info);
      this.isPostfix = isPostfix;
      this.isLifted = isLifted;
      this.isChecked = isChecked;
      this.operatorMethod = operatorMethod;
      this.target = install(target, "target");
      linkChildren();
    }

    private static OperationKind checkKind(OperationKind kind) {
      if (kind != null && kind != OperationKind.INCREMENT &&
          kind != OperationKind.DECREMENT) {
        throw new KindMismatchException(kind,
            "expected INCREMENT or DECREMENT");
      }
      return kind;
    }

    public boolean isIncrement() {
      return kind() == OperationKind.INCREMENT;
    }

    public boolean isPostfix() {
      return isPostfix;
    }

    public boolean isLifted() {
      return isLifted;
    }

    public boolean isChecked() {
      return isChecked;
    }

    public MethodSymbol operatorMethod() {
      return operatorMethod;
    }

    public Operation target() {
      return target.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(target());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(isPostfix ? " postfix" : " prefix");
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitIncrementOrDecrement(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitIncrementOrDecrement(this, argument);
    }
  }

  public static final class ConversionOperation extends Operation {
    private final Conversion conversion;
    private final boolean isTryCast;
    private final boolean isChecked;
    private final Slot<Operation> operand;

    public ConversionOperation(OperationInfo info, Conversion conversion,
        boolean isTryCast, boolean isChecked, Slot<Operation> operand) {
      super(OperationKind.CONVERSION, info);
      this.conversion = require(conversion, "conversion");
      this.isTryCast = isTryCast;
      this.isChecked = isChecked;
      this.operand = install(operand, "operand");
      linkChildren();
    }

    public Conversion conversion() {
      return conversion;
    }

    /** @return true if a failed conversion yields null instead of throwing */
    public boolean isTryCast() {
      return isTryCast;
    }

    public boolean isChecked() {
      return isChecked;
    }

    public Operation operand() {
      return operand.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(operand());
    }

    @Override
    protected void describe(StringBuilder sb) {
      if (conversion != null) {
        sb.append(' ');
        sb.append(conversion.conversionKind());
      }
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitConversion(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitConversion(this, argument);
    }
  }

  public static final class SimpleAssignmentOperation extends Operation {
    private final boolean isRef;
    private final Slot<Operation> target;
    private final Slot<Operation> value;

    public SimpleAssignmentOperation(OperationInfo info, boolean isRef,
        Slot<Operation> target, Slot<Operation> value) {
      super(OperationKind.SIMPLE_ASSIGNMENT, info);
      this.isRef = isRef;
      this.target = install(target, "target");
      this.value = install(value, "value");
      linkChildren();
    }

    /** @return true if the target is rebound to refer to the value */
    public boolean isRef() {
      return isRef;
    }

    public Operation target() {
      return target.get();
    }

    public Operation value() {
      return value.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(target()).add(value());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitSimpleAssignment(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitSimpleAssignment(this, argument);
    }
  }

  /**
   * target op= value.  Conversions are applied to the target before the
   * operator and to the result before storing it back.
   */
  public static final class CompoundAssignmentOperation extends Operation {
    private final BinaryOperatorKind operatorKind;
    private final Conversion inConversion;
    private final Conversion outConversion;
    private final boolean isLifted;
    private final boolean isChecked;
    private final MethodSymbol operatorMethod;
    private final Slot<Operation> target;
    private final Slot<Operation> value;

    public CompoundAssignmentOperation(OperationInfo info,
        BinaryOperatorKind operatorKind, Conversion inConversion,
        Conversion outConversion, boolean isLifted, boolean isChecked,
        MethodSymbol operatorMethod, Slot<Operation> target,
        Slot<Operation> value) {
      super(OperationKind.COMPOUND_ASSIGNMENT, info);
      this.operatorKind = require(operatorKind, "operatorKind");
      this.inConversion = inConversion != null ? inConversion
                                               : Conversion.IDENTITY;
      this.outConversion = outConversion != null ? outConversion
                                                 : Conversion.IDENTITY;
      this.isLifted = isLifted;
      this.isChecked = isChecked;
      this.operatorMethod = operatorMethod;
      this.target = install(target, "target");
      this.value = install(value, "value");
      linkChildren();
    }

    public BinaryOperatorKind operatorKind() {
      return operatorKind;
    }

    public Conversion inConversion() {
      return inConversion;
    }

    public Conversion outConversion() {
      return outConversion;
    }

    public boolean isLifted() {
      return isLifted;
    }

    public boolean isChecked() {
      return isChecked;
    }

    public MethodSymbol operatorMethod() {
      return operatorMethod;
    }

    public Operation target() {
      return target.get();
    }

    public Operation value() {
      return value.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(target()).add(value());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(operatorKind);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitCompoundAssignment(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitCompoundAssignment(this, argument);
    }
  }

  /** (a, b) = value */
  public static final class DeconstructionAssignmentOperation
                                                      extends Operation {
    private final Slot<Operation> target;
    private final Slot<Operation> value;

    public DeconstructionAssignmentOperation(OperationInfo info,
        Slot<Operation> target, Slot<Operation> value) {
      super(OperationKind.DECONSTRUCTION_ASSIGNMENT, info);
      this.target = install(target, "target");
      this.value = install(value, "value");
      linkChildren();
    }

    public Operation target() {
      return target.get();
    }

    public Operation value() {
      return value.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(target()).add(value());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitDeconstructionAssignment(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitDeconstructionAssignment(this, argument);
    }
  }

  public static final class CoalesceOperation extends Operation {
    private final Conversion valueConversion;
    private final Slot<Operation> value;
    private final Slot<Operation> whenNull;

    public CoalesceOperation(OperationInfo info, Conversion valueConversion,
        Slot<Operation> value, Slot<Operation> whenNull) {
      super(OperationKind.COALESCE, info);
      this.valueConversion = valueConversion != null ? valueConversion
                                                     : Conversion.IDENTITY;
      this.value = install(value, "value");
      this.whenNull = install(whenNull, "whenNull");
      linkChildren();
    }

    /** @return conversion applied to value when it isn't null */
    public Conversion valueConversion() {
      return valueConversion;
    }

    public Operation value() {
      return value.get();
    }

    public Operation whenNull() {
      return whenNull.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(value()).add(whenNull());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitCoalesce(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitCoalesce(this, argument);
    }
  }

  public static final class CoalesceAssignmentOperation extends Operation {
    private final Slot<Operation> target;
    private final Slot<Operation> value;

    public CoalesceAssignmentOperation(OperationInfo info,
        Slot<Operation> target, Slot<Operation> value) {
      super(OperationKind.COALESCE_ASSIGNMENT, info);
      this.target = install(target, "target");
      this.value = install(value, "value");
      linkChildren();
    }

    public Operation target() {
      return target.get();
    }

    public Operation value() {
      return value.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(target()).add(value());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitCoalesceAssignment(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitCoalesceAssignment(this, argument);
    }
  }

  /**
   * Conditional expression or if statement.  An if statement with no
   * else branch has no whenFalse.
   */
  public static final class ConditionalOperation extends Operation {
    private final boolean isRef;
    private final Slot<Operation> condition;
    private final Slot<Operation> whenTrue;
    private final Slot<Operation> whenFalse;

    public ConditionalOperation(OperationInfo info, boolean isRef,
        Slot<Operation> condition, Slot<Operation> whenTrue,
        Slot<Operation> whenFalse) {
      super(OperationKind.CONDITIONAL, info);
      this.isRef = isRef;
      this.condition = install(condition, "condition");
      this.whenTrue = install(whenTrue, "whenTrue");
      this.whenFalse = installOptional(whenFalse, "whenFalse");
      linkChildren();
    }

    public boolean isRef() {
      return isRef;
    }

    public Operation condition() {
      return condition.get();
    }

    public Operation whenTrue() {
      return whenTrue.get();
    }

    public Operation whenFalse() {
      return whenFalse.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(condition()).add(whenTrue()).add(whenFalse());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitConditional(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitConditional(this, argument);
    }
  }

  public static final class IsTypeOperation extends Operation {
    private final TypeSymbol typeOperand;
    private final boolean isNegated;
    private final Slot<Operation> valueOperand;

    public IsTypeOperation(OperationInfo info, TypeSymbol typeOperand,
        boolean isNegated, Slot<Operation> valueOperand) {
      super(OperationKind.IS_TYPE, info);
      this.typeOperand = require(typeOperand, "typeOperand");
      this.isNegated = isNegated;
      this.valueOperand = install(valueOperand, "valueOperand");
      linkChildren();
    }

    public TypeSymbol typeOperand() {
      return typeOperand;
    }

    public boolean isNegated() {
      return isNegated;
    }

    public Operation valueOperand() {
      return valueOperand.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(valueOperand());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(isNegated ? " isnot " : " is ");
      sb.append(TreeUtil.name(typeOperand));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitIsType(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitIsType(this, argument);
    }
  }

  public static final class AwaitOperation extends Operation {
    private final Slot<Operation> operation;

    public AwaitOperation(OperationInfo info, Slot<Operation> operation) {
      super(OperationKind.AWAIT, info);
      this.operation = install(operation, "operation");
      linkChildren();
    }

    public Operation operation() {
      return operation.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(operation());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitAwait(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitAwait(this, argument);
    }
  }

  /**
   * Throw expression or statement.  No exception means rethrow.
   */
  public static final class ThrowOperation extends Operation {
    private final Slot<Operation> exception;

    public ThrowOperation(OperationInfo info, Slot<Operation> exception) {
      super(OperationKind.THROW, info);
      this.exception = installOptional(exception, "exception");
      linkChildren();
    }

    public Operation exception() {
      return exception.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(exception());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitThrow(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitThrow(this, argument);
    }
  }

  public static final class ParenthesizedOperation extends Operation {
    private final Slot<Operation> operand;

    public ParenthesizedOperation(OperationInfo info,
                                  Slot<Operation> operand) {
      super(OperationKind.PARENTHESIZED, info);
      this.operand = install(operand, "operand");
      linkChildren();
    }

    public Operation operand() {
      return operand.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(operand());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitParenthesized(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitParenthesized(this, argument);
    }
  }

  public static final class TupleOperation extends Operation {
    private final TypeSymbol naturalType;
    private final ListSlot<Operation> elements;

    public TupleOperation(OperationInfo info, TypeSymbol naturalType,
                          ListSlot<Operation> elements) {
      super(OperationKind.TUPLE, info);
      this.naturalType = naturalType;
      this.elements = install(elements, "elements");
      linkChildren();
    }

    /** @return type of the tuple before any target typing, may be null */
    public TypeSymbol naturalType() {
      return naturalType;
    }

    public List<Operation> elements() {
      return elements.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(elements());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitTuple(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitTuple(this, argument);
    }
  }

  /** start..end, either end may be omitted */
  public static final class RangeOperation extends Operation {
    private final boolean isLifted;
    private final MethodSymbol method;
    private final Slot<Operation> leftOperand;
    private final Slot<Operation> rightOperand;

    public RangeOperation(OperationInfo info, boolean isLifted,
        MethodSymbol method, Slot<Operation> leftOperand,
        Slot<Operation> rightOperand) {
      super(OperationKind.RANGE, info);
      this.isLifted = isLifted;
      this.method = method;
      this.leftOperand = installOptional(leftOperand, "leftOperand");
      this.rightOperand = installOptional(rightOperand, "rightOperand");
      linkChildren();
    }

    public boolean isLifted() {
      return isLifted;
    }

    /** @return factory method or constructor used, may be null */
    public MethodSymbol method() {
      return method;
    }

    public Operation leftOperand() {
      return leftOperand.get();
    }

    public Operation rightOperand() {
      return rightOperand.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(leftOperand()).add(rightOperand());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitRange(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitRange(this, argument);
    }
  }
}
