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

import exm.optree.common.lang.Symbols.MethodSymbol;
import exm.optree.common.lang.Symbols.TypeSymbol;
import exm.optree.tree.Invocations.ArgumentOperation;

/**
 * Creation of objects, arrays, delegates and collections, together with
 * their initializers.
 */
public class Creations {

  public static final class ObjectCreationOperation extends Operation {
    private final MethodSymbol constructor;
    private final ListSlot<ArgumentOperation> arguments;
    private final Slot<ObjectOrCollectionInitializerOperation> initializer;

    public ObjectCreationOperation(OperationInfo info,
        MethodSymbol constructor, ListSlot<ArgumentOperation> arguments,
        Slot<ObjectOrCollectionInitializerOperation> initializer) {
      super(OperationKind.OBJECT_CREATION, info);
      this.constructor = constructor;
      this.arguments = install(arguments, "arguments");
      this.initializer = installOptional(initializer, "initializer");
      linkChildren();
    }

    /** @return constructor called, null for a struct default constructor */
    public MethodSymbol constructor() {
      return constructor;
    }

    public List<ArgumentOperation> arguments() {
      return arguments.get();
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
    protected void describe(StringBuilder sb) {
      if (constructor != null) {
        sb.append(' ');
        sb.append(constructor.name());
      }
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitObjectCreation(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitObjectCreation(this, argument);
    }
  }

  /** new T() where T is a type parameter */
  public static final class TypeParameterObjectCreationOperation
                                                      extends Operation {
    private final Slot<ObjectOrCollectionInitializerOperation> initializer;

    public TypeParameterObjectCreationOperation(OperationInfo info,
        Slot<ObjectOrCollectionInitializerOperation> initializer) {
      super(OperationKind.TYPE_PARAMETER_OBJECT_CREATION, info);
      this.initializer = installOptional(initializer, "initializer");
      linkChildren();
    }

    public ObjectOrCollectionInitializerOperation initializer() {
      return initializer.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(initializer());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitTypeParameterObjectCreation(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitTypeParameterObjectCreation(this, argument);
    }
  }

  /** Creation of a foreign runtime object through its coclass */
  public static final class InteropObjectCreationOperation
                                                      extends Operation {
    private final Slot<ObjectOrCollectionInitializerOperation> initializer;

    public InteropObjectCreationOperation(OperationInfo info,
        Slot<ObjectOrCollectionInitializerOperation> initializer) {
      super(OperationKind.INTEROP_OBJECT_CREATION, info);
      this.initializer = installOptional(initializer, "initializer");
      linkChildren();
    }

    public ObjectOrCollectionInitializerOperation initializer() {
      return initializer.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(initializer());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitInteropObjectCreation(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitInteropObjectCreation(this, argument);
    }
  }

  /** new { A = 1, B } */
  public static final class AnonymousObjectCreationOperation
                                                      extends Operation {
    private final ListSlot<Operation> initializers;

    public AnonymousObjectCreationOperation(OperationInfo info,
                                      ListSlot<Operation> initializers) {
      super(OperationKind.ANONYMOUS_OBJECT_CREATION, info);
      this.initializers = install(initializers, "initializers");
      linkChildren();
    }

    public List<Operation> initializers() {
      return initializers.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(initializers());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitAnonymousObjectCreation(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitAnonymousObjectCreation(this, argument);
    }
  }

  public static final class ArrayCreationOperation extends Operation {
    private final ListSlot<Operation> dimensionSizes;
    private final Slot<ArrayInitializerOperation> initializer;

    public ArrayCreationOperation(OperationInfo info,
        ListSlot<Operation> dimensionSizes,
        Slot<ArrayInitializerOperation> initializer) {
      super(OperationKind.ARRAY_CREATION, info);
      this.dimensionSizes = install(dimensionSizes, "dimensionSizes");
      this.initializer = installOptional(initializer, "initializer");
      linkChildren();
    }

    public List<Operation> dimensionSizes() {
      return dimensionSizes.get();
    }

    public ArrayInitializerOperation initializer() {
      return initializer.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(dimensionSizes());
      children.add(initializer());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitArrayCreation(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitArrayCreation(this, argument);
    }
  }

  /**
   * { a, b, c }.  Nested initializers appear as elements for
   * multi-dimensional and jagged arrays.
   */
  public static final class ArrayInitializerOperation extends Operation {
    private final ListSlot<Operation> elementValues;

    public ArrayInitializerOperation(OperationInfo info,
                                     ListSlot<Operation> elementValues) {
      super(OperationKind.ARRAY_INITIALIZER, info);
      this.elementValues = install(elementValues, "elementValues");
      linkChildren();
    }

    public List<Operation> elementValues() {
      return elementValues.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(elementValues());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitArrayInitializer(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitArrayInitializer(this, argument);
    }
  }

  /**
   * { X = 1, Y = 2 } or { 1, 2, 3 } following an object creation.
   * Members are assignments or member initializers, collection elements
   * are invocations of the add method.
   */
  public static final class ObjectOrCollectionInitializerOperation
                                                      extends Operation {
    private final ListSlot<Operation> initializers;

    public ObjectOrCollectionInitializerOperation(OperationInfo info,
                                      ListSlot<Operation> initializers) {
      super(OperationKind.OBJECT_OR_COLLECTION_INITIALIZER, info);
      this.initializers = install(initializers, "initializers");
      linkChildren();
    }

    public List<Operation> initializers() {
      return initializers.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(initializers());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitObjectOrCollectionInitializer(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitObjectOrCollectionInitializer(this, argument);
    }
  }

  /** Member = { ... }: nested initializer applied to a member's value */
  public static final class MemberInitializerOperation extends Operation {
    private final Slot<Operation> initializedMember;
    private final Slot<ObjectOrCollectionInitializerOperation> initializer;

    public MemberInitializerOperation(OperationInfo info,
        Slot<Operation> initializedMember,
        Slot<ObjectOrCollectionInitializerOperation> initializer) {
      super(OperationKind.MEMBER_INITIALIZER, info);
      this.initializedMember = install(initializedMember,
                                       "initializedMember");
      this.initializer = install(initializer, "initializer");
      linkChildren();
    }

    public Operation initializedMember() {
      return initializedMember.get();
    }

    public ObjectOrCollectionInitializerOperation initializer() {
      return initializer.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(initializedMember()).add(initializer());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitMemberInitializer(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitMemberInitializer(this, argument);
    }
  }

  /**
   * Collection initializer element that couldn't be bound to a single
   * add method, or that is bound dynamically.
   */
  public static final class CollectionElementInitializerOperation
                                                      extends Operation {
    private final MethodSymbol addMethod;
    private final boolean isDynamic;
    private final ListSlot<Operation> arguments;

    public CollectionElementInitializerOperation(OperationInfo info,
        MethodSymbol addMethod, boolean isDynamic,
        ListSlot<Operation> arguments) {
      super(OperationKind.COLLECTION_ELEMENT_INITIALIZER, info);
      this.addMethod = addMethod;
      this.isDynamic = isDynamic;
      this.arguments = install(arguments, "arguments");
      linkChildren();
    }

    public MethodSymbol addMethod() {
      return addMethod;
    }

    public boolean isDynamic() {
      return isDynamic;
    }

    public List<Operation> arguments() {
      return arguments.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(arguments());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitCollectionElementInitializer(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitCollectionElementInitializer(this, argument);
    }
  }

  /**
   * Delegate created from a method reference or an anonymous function
   */
  public static final class DelegateCreationOperation extends Operation {
    private final Slot<Operation> target;

    public DelegateCreationOperation(OperationInfo info,
                                     Slot<Operation> target) {
      super(OperationKind.DELEGATE_CREATION, info);
      this.target = install(target, "target");
      linkChildren();
    }

    public Operation target() {
      return target.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(target());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitDelegateCreation(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitDelegateCreation(this, argument);
    }
  }

  /** operand with { X = 1 }: copy then initialize */
  public static final class WithOperation extends Operation {
    private final MethodSymbol cloneMethod;
    private final Slot<Operation> operand;
    private final Slot<ObjectOrCollectionInitializerOperation> initializer;

    public WithOperation(OperationInfo info, MethodSymbol cloneMethod,
        Slot<Operation> operand,
        Slot<ObjectOrCollectionInitializerOperation> initializer) {
      super(OperationKind.WITH, info);
      this.cloneMethod = cloneMethod;
      this.operand = install(operand, "operand");
      this.initializer = install(initializer, "initializer");
      linkChildren();
    }

    /** @return clone method, null for value types */
    public MethodSymbol cloneMethod() {
      return cloneMethod;
    }

    public Operation operand() {
      return operand.get();
    }

    public ObjectOrCollectionInitializerOperation initializer() {
      return initializer.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(operand()).add(initializer());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitWith(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitWith(this, argument);
    }
  }

  /** [a, b, ..c] */
  public static final class CollectionExpressionOperation extends Operation {
    private final MethodSymbol constructMethod;
    private final ListSlot<Operation> elements;

    public CollectionExpressionOperation(OperationInfo info,
        MethodSymbol constructMethod, ListSlot<Operation> elements) {
      super(OperationKind.COLLECTION_EXPRESSION, info);
      this.constructMethod = constructMethod;
      this.elements = install(elements, "elements");
      linkChildren();
    }

    /** @return builder or constructor, null when none was used */
    public MethodSymbol constructMethod() {
      return constructMethod;
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
      visitor.visitCollectionExpression(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitCollectionExpression(this, argument);
    }
  }

  /** ..operand inside a collection expression */
  public static final class SpreadOperation extends Operation {
    private final TypeSymbol elementType;
    private final Slot<Operation> operand;

    public SpreadOperation(OperationInfo info, TypeSymbol elementType,
                           Slot<Operation> operand) {
      super(OperationKind.SPREAD, info);
      this.elementType = elementType;
      this.operand = install(operand, "operand");
      linkChildren();
    }

    public TypeSymbol elementType() {
      return elementType;
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
      visitor.visitSpread(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitSpread(this, argument);
    }
  }
}
