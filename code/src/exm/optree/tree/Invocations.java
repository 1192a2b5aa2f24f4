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

import exm.optree.common.lang.Conversion;
import exm.optree.common.lang.Symbols.MethodSymbol;
import exm.optree.common.lang.Symbols.ParameterSymbol;

/**
 * Calls and the arguments passed to them.
 */
public class Invocations {

  public static final class InvocationOperation extends Operation {
    private final MethodSymbol targetMethod;
    private final boolean isVirtual;
    private final Slot<Operation> instance;
    private final ListSlot<ArgumentOperation> arguments;

    public InvocationOperation(OperationInfo info, MethodSymbol targetMethod,
        boolean isVirtual, Slot<Operation> instance,
        ListSlot<ArgumentOperation> arguments) {
      super(OperationKind.INVOCATION, info);
      this.targetMethod = require(targetMethod, "targetMethod");
      this.isVirtual = isVirtual;
      this.instance = installOptional(instance, "instance");
      this.arguments = install(arguments, "arguments");
      linkChildren();
    }

    public MethodSymbol targetMethod() {
      return targetMethod;
    }

    public boolean isVirtual() {
      return isVirtual;
    }

    /** @return receiver, null for static methods */
    public Operation instance() {
      return instance.get();
    }

    /** @return arguments in evaluation order, not parameter order */
    public List<ArgumentOperation> arguments() {
      return arguments.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(instance());
      children.addAll(arguments());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(TreeUtil.name(targetMethod));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitInvocation(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitInvocation(this, argument);
    }
  }

  public static enum ArgumentKind {
    /** Written at the call site */
    EXPLICIT,
    /** Trailing arguments packed into a params array */
    PARAMS_ARRAY,
    /** Omitted argument filled in from the parameter's default */
    DEFAULT_VALUE,
    /** Trailing arguments packed into a params collection */
    PARAMS_COLLECTION,
  }

  /**
   * An argument bound to a parameter.  Conversions are applied to the
   * value going in and, for by-reference parameters, to the value coming
   * back out.
   */
  public static final class ArgumentOperation extends Operation {
    private final ArgumentKind argumentKind;
    private final ParameterSymbol parameter;
    private final Conversion inConversion;
    private final Conversion outConversion;
    private final Slot<Operation> value;

    public ArgumentOperation(OperationInfo info, ArgumentKind argumentKind,
        ParameterSymbol parameter, Conversion inConversion,
        Conversion outConversion, Slot<Operation> value) {
      super(OperationKind.ARGUMENT, info);
      this.argumentKind = require(argumentKind, "argumentKind");
      this.parameter = parameter;
      this.inConversion = inConversion != null ? inConversion
                                               : Conversion.IDENTITY;
      this.outConversion = outConversion != null ? outConversion
                                                 : Conversion.IDENTITY;
      this.value = install(value, "value");
      linkChildren();
    }

    public ArgumentKind argumentKind() {
      return argumentKind;
    }

    /** @return matched parameter, null for arglist arguments */
    public ParameterSymbol parameter() {
      return parameter;
    }

    public Conversion inConversion() {
      return inConversion;
    }

    public Conversion outConversion() {
      return outConversion;
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
      sb.append(argumentKind);
      if (parameter != null) {
        sb.append(' ');
        sb.append(parameter.name());
      }
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitArgument(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitArgument(this, argument);
    }
  }

  public static final class FunctionPointerInvocationOperation
                                                      extends Operation {
    private final Slot<Operation> target;
    private final ListSlot<ArgumentOperation> arguments;

    public FunctionPointerInvocationOperation(OperationInfo info,
        Slot<Operation> target, ListSlot<ArgumentOperation> arguments) {
      super(OperationKind.FUNCTION_POINTER_INVOCATION, info);
      this.target = install(target, "target");
      this.arguments = install(arguments, "arguments");
      linkChildren();
    }

    public Operation target() {
      return target.get();
    }

    public List<ArgumentOperation> arguments() {
      return arguments.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(target());
      children.addAll(arguments());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitFunctionPointerInvocation(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitFunctionPointerInvocation(this, argument);
    }
  }

  /**
   * An attribute applied to a declaration.  The operation is the
   * attribute's constructor call, or a none/invalid operation when it
   * couldn't be bound.
   */
  public static final class AttributeOperation extends Operation {
    private final Slot<Operation> operation;

    public AttributeOperation(OperationInfo info, Slot<Operation> operation) {
      super(OperationKind.ATTRIBUTE, info);
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
      visitor.visitAttribute(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitAttribute(this, argument);
    }
  }
}
