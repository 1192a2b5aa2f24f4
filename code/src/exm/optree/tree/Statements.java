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

import com.google.common.collect.ImmutableList;

import exm.optree.common.exceptions.KindMismatchException;
import exm.optree.common.lang.Symbols.LabelSymbol;
import exm.optree.common.lang.Symbols.LocalSymbol;
import exm.optree.common.lang.Symbols.MethodSymbol;

/**
 * Statements that aren't loops, switches or exception handling.
 */
public class Statements {

  public static final class BlockOperation extends Operation {
    private final ImmutableList<LocalSymbol> locals;
    private final ListSlot<Operation> operations;

    public BlockOperation(OperationInfo info, List<LocalSymbol> locals,
                          ListSlot<Operation> operations) {
      super(OperationKind.BLOCK, info);
      this.locals = listOrEmpty(locals);
      this.operations = install(operations, "operations");
      linkChildren();
    }

    /** @return locals declared directly in the block */
    public List<LocalSymbol> locals() {
      return locals;
    }

    public List<Operation> operations() {
      return operations.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(operations());
    }

    @Override
    protected void describe(StringBuilder sb) {
      TreeUtil.describeLocals(sb, locals);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitBlock(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitBlock(this, argument);
    }
  }

  public static final class EmptyOperation extends Operation {
    public EmptyOperation(OperationInfo info) {
      super(OperationKind.EMPTY, info);
      linkChildren();
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitEmpty(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitEmpty(this, argument);
    }
  }

  /**
   * return, yield return and yield break.  A yield break never has a
   * value.
   */
  public static final class ReturnOperation extends Operation {
    private final Slot<Operation> returnedValue;

    public ReturnOperation(OperationKind kind, OperationInfo info,
                           Slot<Operation> returnedValue) {
      super(checkKind(kind), info);
      this.returnedValue = installOptional(returnedValue, "returnedValue");
      if (kind == OperationKind.YIELD_BREAK &&
          returnedValue.isMaterialized() && returnedValue.get() != null) {
        throw new KindMismatchException(kind, "yield break has no value");
      }
      linkChildren();
    }

    private static OperationKind checkKind(OperationKind kind) {
      if (kind != null && kind != OperationKind.RETURN &&
          kind != OperationKind.YIELD_RETURN &&
          kind != OperationKind.YIELD_BREAK) {
        throw new KindMismatchException(kind,
            "expected RETURN, YIELD_RETURN or YIELD_BREAK");
      }
      return kind;
    }

    /**
     * @return value returned or yielded, null if none
     */
    public Operation returnedValue() {
      Operation value = returnedValue.get();
      if (value != null && kind() == OperationKind.YIELD_BREAK) {
        throw new KindMismatchException(kind(), "yield break has no value");
      }
      return value;
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(returnedValue());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitReturn(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitReturn(this, argument);
    }
  }

  public static final class ExpressionStatementOperation extends Operation {
    private final Slot<Operation> operation;

    public ExpressionStatementOperation(OperationInfo info,
                                        Slot<Operation> operation) {
      super(OperationKind.EXPRESSION_STATEMENT, info);
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
      visitor.visitExpressionStatement(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitExpressionStatement(this, argument);
    }
  }

  public static enum BranchKind {
    CONTINUE,
    BREAK,
    GO_TO,
  }

  public static final class BranchOperation extends Operation {
    private final LabelSymbol target;
    private final BranchKind branchKind;

    public BranchOperation(OperationInfo info, LabelSymbol target,
                           BranchKind branchKind) {
      super(OperationKind.BRANCH, info);
      this.target = require(target, "target");
      this.branchKind = require(branchKind, "branchKind");
      linkChildren();
    }

    public LabelSymbol target() {
      return target;
    }

    public BranchKind branchKind() {
      return branchKind;
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(branchKind);
      sb.append(' ');
      sb.append(TreeUtil.name(target));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitBranch(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitBranch(this, argument);
    }
  }

  public static final class LabeledOperation extends Operation {
    private final LabelSymbol label;
    private final Slot<Operation> operation;

    public LabeledOperation(OperationInfo info, LabelSymbol label,
                            Slot<Operation> operation) {
      super(OperationKind.LABELED, info);
      this.label = require(label, "label");
      this.operation = installOptional(operation, "operation");
      linkChildren();
    }

    public LabelSymbol label() {
      return label;
    }

    /** @return labeled statement, null for a label on its own */
    public Operation operation() {
      return operation.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(operation());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(TreeUtil.name(label));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitLabeled(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitLabeled(this, argument);
    }
  }

  /** Suspends execution for a debugger */
  public static final class StopOperation extends Operation {
    public StopOperation(OperationInfo info) {
      super(OperationKind.STOP, info);
      linkChildren();
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitStop(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitStop(this, argument);
    }
  }

  /** Terminates the program */
  public static final class EndOperation extends Operation {
    public EndOperation(OperationInfo info) {
      super(OperationKind.END, info);
      linkChildren();
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitEnd(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitEnd(this, argument);
    }
  }

  public static final class RaiseEventOperation extends Operation {
    private final Slot<References.EventReferenceOperation> eventReference;
    private final ListSlot<Invocations.ArgumentOperation> arguments;

    public RaiseEventOperation(OperationInfo info,
        Slot<References.EventReferenceOperation> eventReference,
        ListSlot<Invocations.ArgumentOperation> arguments) {
      super(OperationKind.RAISE_EVENT, info);
      this.eventReference = install(eventReference, "eventReference");
      this.arguments = install(arguments, "arguments");
      linkChildren();
    }

    public References.EventReferenceOperation eventReference() {
      return eventReference.get();
    }

    public List<Invocations.ArgumentOperation> arguments() {
      return arguments.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(eventReference());
      children.addAll(arguments());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitRaiseEvent(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitRaiseEvent(this, argument);
    }
  }

  /**
   * A function declared inside another.  When both block and expression
   * bodies were written, the one not used is kept as ignoredBody.
   */
  public static final class LocalFunctionOperation extends Operation {
    private final MethodSymbol symbol;
    private final Slot<BlockOperation> body;
    private final Slot<BlockOperation> ignoredBody;

    public LocalFunctionOperation(OperationInfo info, MethodSymbol symbol,
        Slot<BlockOperation> body, Slot<BlockOperation> ignoredBody) {
      super(OperationKind.LOCAL_FUNCTION, info);
      this.symbol = require(symbol, "symbol");
      this.body = installOptional(body, "body");
      this.ignoredBody = installOptional(ignoredBody, "ignoredBody");
      linkChildren();
    }

    public MethodSymbol symbol() {
      return symbol;
    }

    /** @return body, null for an extern declaration */
    public BlockOperation body() {
      return body.get();
    }

    public BlockOperation ignoredBody() {
      return ignoredBody.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(body()).add(ignoredBody());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(TreeUtil.name(symbol));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitLocalFunction(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitLocalFunction(this, argument);
    }
  }

  /** Array re-dimensioning statement, optionally keeping contents */
  public static final class ReDimOperation extends Operation {
    private final boolean preserve;
    private final ListSlot<ReDimClauseOperation> clauses;

    public ReDimOperation(OperationInfo info, boolean preserve,
                          ListSlot<ReDimClauseOperation> clauses) {
      super(OperationKind.RE_DIM, info);
      this.preserve = preserve;
      this.clauses = install(clauses, "clauses");
      linkChildren();
    }

    public boolean preserve() {
      return preserve;
    }

    public List<ReDimClauseOperation> clauses() {
      return clauses.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(clauses());
    }

    @Override
    protected void describe(StringBuilder sb) {
      if (preserve) {
        sb.append(" preserve");
      }
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitReDim(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitReDim(this, argument);
    }
  }

  public static final class ReDimClauseOperation extends Operation {
    private final Slot<Operation> operand;
    private final ListSlot<Operation> dimensionSizes;

    public ReDimClauseOperation(OperationInfo info, Slot<Operation> operand,
                                ListSlot<Operation> dimensionSizes) {
      super(OperationKind.RE_DIM_CLAUSE, info);
      this.operand = install(operand, "operand");
      this.dimensionSizes = install(dimensionSizes, "dimensionSizes");
      linkChildren();
    }

    public Operation operand() {
      return operand.get();
    }

    public List<Operation> dimensionSizes() {
      return dimensionSizes.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(operand());
      children.addAll(dimensionSizes());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitReDimClause(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitReDimClause(this, argument);
    }
  }
}
