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

import exm.optree.common.lang.Symbols.LocalSymbol;
import exm.optree.common.lang.Symbols.MethodSymbol;
import exm.optree.tree.Bodies.AnonymousFunctionOperation;

/**
 * Operations that only the flow graph builder creates.  They are built
 * from {@link OperationInfo#forFlowGraph} infos, so they never carry a
 * semantic model, and they dispatch through the visitors like any other
 * operation.
 */
public class FlowOperations {

  /**
   * Identifies a value captured at one point in the flow graph and read
   * back elsewhere.
   */
  public static final class CaptureId {
    private final int id;

    public CaptureId(int id) {
      this.id = id;
    }

    public int id() {
      return id;
    }

    @Override
    public boolean equals(Object other) {
      if (this == other) {
        return true;
      }
      if (!(other instanceof CaptureId)) {
        return false;
      }
      return id == ((CaptureId)other).id;
    }

    @Override
    public int hashCode() {
      return id;
    }

    @Override
    public String toString() {
      return "#" + id;
    }
  }

  /** Evaluates value and stores it under captureId */
  public static final class FlowCaptureOperation extends Operation {
    private final CaptureId captureId;
    private final Slot<Operation> value;

    public FlowCaptureOperation(OperationInfo info, CaptureId captureId,
                                Slot<Operation> value) {
      super(OperationKind.FLOW_CAPTURE, info);
      this.captureId = require(captureId, "captureId");
      this.value = install(value, "value");
      linkChildren();
    }

    public CaptureId captureId() {
      return captureId;
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
      sb.append(captureId);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitFlowCapture(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitFlowCapture(this, argument);
    }
  }

  /** Reads the value stored under captureId */
  public static final class FlowCaptureReferenceOperation extends Operation {
    private final CaptureId captureId;
    private final boolean isInitialization;

    public FlowCaptureReferenceOperation(OperationInfo info,
                          CaptureId captureId, boolean isInitialization) {
      super(OperationKind.FLOW_CAPTURE_REFERENCE, info);
      this.captureId = require(captureId, "captureId");
      this.isInitialization = isInitialization;
      linkChildren();
    }

    public CaptureId captureId() {
      return captureId;
    }

    /** @return true if this reference is the target of the initial store */
    public boolean isInitialization() {
      return isInitialization;
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(captureId);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitFlowCaptureReference(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitFlowCaptureReference(this, argument);
    }
  }

  /** Null check inserted for ?. ?? and similar */
  public static final class IsNullOperation extends Operation {
    private final Slot<Operation> operand;

    public IsNullOperation(OperationInfo info, Slot<Operation> operand) {
      super(OperationKind.IS_NULL, info);
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
      visitor.visitIsNull(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitIsNull(this, argument);
    }
  }

  /** The exception being handled at the start of a catch region */
  public static final class CaughtExceptionOperation extends Operation {
    public CaughtExceptionOperation(OperationInfo info) {
      super(OperationKind.CAUGHT_EXCEPTION, info);
      linkChildren();
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitCaughtException(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitCaughtException(this, argument);
    }
  }

  /**
   * Refers to a lambda whose body gets its own flow graph.  The original
   * anonymous function is kept for lookup only and is not a child.
   */
  public static final class FlowAnonymousFunctionOperation
                                                      extends Operation {
    private final MethodSymbol symbol;
    private final AnonymousFunctionOperation original;

    public FlowAnonymousFunctionOperation(OperationInfo info,
        MethodSymbol symbol, AnonymousFunctionOperation original) {
      super(OperationKind.FLOW_ANONYMOUS_FUNCTION, info);
      this.symbol = require(symbol, "symbol");
      this.original = require(original, "original");
      linkChildren();
    }

    public MethodSymbol symbol() {
      return symbol;
    }

    public AnonymousFunctionOperation original() {
      return original;
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(TreeUtil.name(symbol));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitFlowAnonymousFunction(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitFlowAnonymousFunction(this, argument);
    }
  }

  /**
   * True if this thread should run the initializer of a static local.
   */
  public static final class StaticLocalInitializationSemaphoreOperation
                                                      extends Operation {
    private final LocalSymbol local;

    public StaticLocalInitializationSemaphoreOperation(OperationInfo info,
                                                       LocalSymbol local) {
      super(OperationKind.STATIC_LOCAL_INITIALIZATION_SEMAPHORE, info);
      this.local = require(local, "local");
      linkChildren();
    }

    public LocalSymbol local() {
      return local;
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(TreeUtil.name(local));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitStaticLocalInitializationSemaphore(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitStaticLocalInitializationSemaphore(this, argument);
    }
  }
}
