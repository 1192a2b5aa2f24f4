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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.optree.common.exceptions.KindMismatchException;
import exm.optree.common.lang.RefKind;
import exm.optree.common.lang.Symbols.TypeSymbol;
import exm.optree.tree.Creations.ObjectOrCollectionInitializerOperation;

/**
 * Operations whose target is only resolved at run time.
 *
 * Arguments are plain values rather than argument operations, since there
 * is no parameter to bind them to.  Names and ref kinds are kept in
 * parallel lists that are either empty or have one entry per argument.
 */
public class Dynamics {

  public static abstract class DynamicArgumentsOperation extends Operation {
    /** Null entries are unnamed arguments */
    private final List<String> argumentNames;
    private final ImmutableList<RefKind> argumentRefKinds;
    private final ListSlot<Operation> arguments;

    protected DynamicArgumentsOperation(OperationKind kind,
        OperationInfo info, List<String> argumentNames,
        List<RefKind> argumentRefKinds, ListSlot<Operation> arguments) {
      super(kind, info);
      this.argumentNames = argumentNames == null
          ? Collections.<String>emptyList()
          : Collections.unmodifiableList(
                          new ArrayList<String>(argumentNames));
      this.argumentRefKinds = listOrEmpty(argumentRefKinds);
      this.arguments = install(arguments, "arguments");
      if (arguments.isMaterialized()) {
        checkParallel(arguments.get().size());
      }
    }

    private void checkParallel(int argumentCount) {
      if (!argumentNames.isEmpty() && argumentNames.size() != argumentCount) {
        throw new KindMismatchException(kind(), "has " + argumentCount
            + " arguments but " + argumentNames.size() + " argument names");
      }
      if (!argumentRefKinds.isEmpty() &&
          argumentRefKinds.size() != argumentCount) {
        throw new KindMismatchException(kind(), "has " + argumentCount
            + " arguments but " + argumentRefKinds.size() + " ref kinds");
      }
    }

    /**
     * @return names, with null for unnamed arguments, or empty if no
     *         argument was named
     */
    public List<String> argumentNames() {
      return argumentNames;
    }

    /** @return ref kinds, empty if every argument is passed by value */
    public List<RefKind> argumentRefKinds() {
      return argumentRefKinds;
    }

    public List<Operation> arguments() {
      List<Operation> result = arguments.get();
      checkParallel(result.size());
      return result;
    }

    /**
     * @return name of argument i, null if unnamed
     */
    public String argumentName(int i) {
      return argumentNames.isEmpty() ? null : argumentNames.get(i);
    }

    public RefKind argumentRefKind(int i) {
      return argumentRefKinds.isEmpty() ? RefKind.NONE
                                        : argumentRefKinds.get(i);
    }
  }

  public static final class DynamicObjectCreationOperation
                                      extends DynamicArgumentsOperation {
    private final Slot<ObjectOrCollectionInitializerOperation> initializer;

    public DynamicObjectCreationOperation(OperationInfo info,
        List<String> argumentNames, List<RefKind> argumentRefKinds,
        ListSlot<Operation> arguments,
        Slot<ObjectOrCollectionInitializerOperation> initializer) {
      super(OperationKind.DYNAMIC_OBJECT_CREATION, info, argumentNames,
            argumentRefKinds, arguments);
      this.initializer = installOptional(initializer, "initializer");
      linkChildren();
    }

    public ObjectOrCollectionInitializerOperation initializer() {
      return initializer.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(arguments());
      children.add(initializer());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitDynamicObjectCreation(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitDynamicObjectCreation(this, argument);
    }
  }

  public static final class DynamicInvocationOperation
                                      extends DynamicArgumentsOperation {
    private final Slot<Operation> operation;

    public DynamicInvocationOperation(OperationInfo info,
        List<String> argumentNames, List<RefKind> argumentRefKinds,
        Slot<Operation> operation, ListSlot<Operation> arguments) {
      super(OperationKind.DYNAMIC_INVOCATION, info, argumentNames,
            argumentRefKinds, arguments);
      this.operation = install(operation, "operation");
      linkChildren();
    }

    /** @return expression being invoked */
    public Operation operation() {
      return operation.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(operation());
      children.addAll(arguments());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitDynamicInvocation(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitDynamicInvocation(this, argument);
    }
  }

  public static final class DynamicIndexerAccessOperation
                                      extends DynamicArgumentsOperation {
    private final Slot<Operation> operation;

    public DynamicIndexerAccessOperation(OperationInfo info,
        List<String> argumentNames, List<RefKind> argumentRefKinds,
        Slot<Operation> operation, ListSlot<Operation> arguments) {
      super(OperationKind.DYNAMIC_INDEXER_ACCESS, info, argumentNames,
            argumentRefKinds, arguments);
      this.operation = install(operation, "operation");
      linkChildren();
    }

    /** @return expression being indexed */
    public Operation operation() {
      return operation.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(operation());
      children.addAll(arguments());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitDynamicIndexerAccess(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitDynamicIndexerAccess(this, argument);
    }
  }

  /**
   * Late-bound member access.  Not a call, so it has no arguments.
   */
  public static final class DynamicMemberReferenceOperation
                                                      extends Operation {
    private final String memberName;
    private final ImmutableList<TypeSymbol> typeArguments;
    private final TypeSymbol containingType;
    private final Slot<Operation> instance;

    public DynamicMemberReferenceOperation(OperationInfo info,
        String memberName, List<TypeSymbol> typeArguments,
        TypeSymbol containingType, Slot<Operation> instance) {
      super(OperationKind.DYNAMIC_MEMBER_REFERENCE, info);
      this.memberName = require(memberName, "memberName");
      this.typeArguments = listOrEmpty(typeArguments);
      this.containingType = containingType;
      this.instance = installOptional(instance, "instance");
      linkChildren();
    }

    public String memberName() {
      return memberName;
    }

    public List<TypeSymbol> typeArguments() {
      return typeArguments;
    }

    /** @return type containing a static member, null for instance access */
    public TypeSymbol containingType() {
      return containingType;
    }

    public Operation instance() {
      return instance.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(instance());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(memberName);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitDynamicMemberReference(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitDynamicMemberReference(this, argument);
    }
  }
}
