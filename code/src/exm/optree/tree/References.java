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

import exm.optree.common.lang.Symbols.EventSymbol;
import exm.optree.common.lang.Symbols.FieldSymbol;
import exm.optree.common.lang.Symbols.LocalSymbol;
import exm.optree.common.lang.Symbols.MethodSymbol;
import exm.optree.common.lang.Symbols.ParameterSymbol;
import exm.optree.common.lang.Symbols.PropertySymbol;
import exm.optree.common.lang.Symbols.Symbol;
import exm.optree.tree.Invocations.ArgumentOperation;

/**
 * Operations referring to storage locations and members: locals,
 * parameters, fields, properties, events, methods, array elements and the
 * implicit instance.
 *
 * Member references carry an optional instance child, absent for static
 * members.
 */
public class References {

  public static final class LocalReferenceOperation extends Operation {
    private final LocalSymbol local;
    private final boolean isDeclaration;

    public LocalReferenceOperation(OperationInfo info, LocalSymbol local,
                                   boolean isDeclaration) {
      super(OperationKind.LOCAL_REFERENCE, info);
      this.local = require(local, "local");
      this.isDeclaration = isDeclaration;
      linkChildren();
    }

    public LocalSymbol local() {
      return local;
    }

    /** @return true if this reference also declares the local */
    public boolean isDeclaration() {
      return isDeclaration;
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(TreeUtil.name(local));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitLocalReference(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitLocalReference(this, argument);
    }
  }

  public static final class ParameterReferenceOperation extends Operation {
    private final ParameterSymbol parameter;

    public ParameterReferenceOperation(OperationInfo info,
                                       ParameterSymbol parameter) {
      super(OperationKind.PARAMETER_REFERENCE, info);
      this.parameter = require(parameter, "parameter");
      linkChildren();
    }

    public ParameterSymbol parameter() {
      return parameter;
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(TreeUtil.name(parameter));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitParameterReference(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitParameterReference(this, argument);
    }
  }

  public static final class FieldReferenceOperation extends Operation {
    private final FieldSymbol field;
    private final boolean isDeclaration;
    private final Slot<Operation> instance;

    public FieldReferenceOperation(OperationInfo info, FieldSymbol field,
        boolean isDeclaration, Slot<Operation> instance) {
      super(OperationKind.FIELD_REFERENCE, info);
      this.field = require(field, "field");
      this.isDeclaration = isDeclaration;
      this.instance = installOptional(instance, "instance");
      linkChildren();
    }

    public FieldSymbol field() {
      return field;
    }

    public boolean isDeclaration() {
      return isDeclaration;
    }

    /** @return receiver, null for static fields */
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
      sb.append(TreeUtil.name(field));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitFieldReference(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitFieldReference(this, argument);
    }
  }

  /**
   * Property or indexer access.  Indexers have arguments.
   */
  public static final class PropertyReferenceOperation extends Operation {
    private final PropertySymbol property;
    private final Slot<Operation> instance;
    private final ListSlot<ArgumentOperation> arguments;

    public PropertyReferenceOperation(OperationInfo info,
        PropertySymbol property, Slot<Operation> instance,
        ListSlot<ArgumentOperation> arguments) {
      super(OperationKind.PROPERTY_REFERENCE, info);
      this.property = require(property, "property");
      this.instance = installOptional(instance, "instance");
      this.arguments = install(arguments, "arguments");
      linkChildren();
    }

    public PropertySymbol property() {
      return property;
    }

    public Operation instance() {
      return instance.get();
    }

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
      sb.append(TreeUtil.name(property));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitPropertyReference(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitPropertyReference(this, argument);
    }
  }

  public static final class EventReferenceOperation extends Operation {
    private final EventSymbol event;
    private final Slot<Operation> instance;

    public EventReferenceOperation(OperationInfo info, EventSymbol event,
                                   Slot<Operation> instance) {
      super(OperationKind.EVENT_REFERENCE, info);
      this.event = require(event, "event");
      this.instance = installOptional(instance, "instance");
      linkChildren();
    }

    public EventSymbol event() {
      return event;
    }

    public Operation instance() {
      return instance.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(instance());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitEventReference(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitEventReference(this, argument);
    }
  }

  /**
   * Method group converted to a delegate or function pointer.
   */
  public static final class MethodReferenceOperation extends Operation {
    private final MethodSymbol method;
    private final boolean isVirtual;
    private final Slot<Operation> instance;

    public MethodReferenceOperation(OperationInfo info, MethodSymbol method,
        boolean isVirtual, Slot<Operation> instance) {
      super(OperationKind.METHOD_REFERENCE, info);
      this.method = require(method, "method");
      this.isVirtual = isVirtual;
      this.instance = installOptional(instance, "instance");
      linkChildren();
    }

    public MethodSymbol method() {
      return method;
    }

    public boolean isVirtual() {
      return isVirtual;
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
      sb.append(TreeUtil.name(method));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitMethodReference(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitMethodReference(this, argument);
    }
  }

  public static enum InstanceReferenceKind {
    /** this/Me, explicit or implicit */
    CONTAINING_TYPE_INSTANCE,
    /** Object being initialized by an object or collection initializer */
    IMPLICIT_RECEIVER,
    /** Value being matched by a pattern */
    PATTERN_INPUT,
    /** Handler instance inside an interpolated string handler */
    INTERPOLATED_STRING_HANDLER,
  }

  public static final class InstanceReferenceOperation extends Operation {
    private final InstanceReferenceKind referenceKind;

    public InstanceReferenceOperation(OperationInfo info,
                                      InstanceReferenceKind referenceKind) {
      super(OperationKind.INSTANCE_REFERENCE, info);
      this.referenceKind = require(referenceKind, "referenceKind");
      linkChildren();
    }

    public InstanceReferenceKind referenceKind() {
      return referenceKind;
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(referenceKind);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitInstanceReference(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitInstanceReference(this, argument);
    }
  }

  public static final class ArrayElementReferenceOperation
                                                      extends Operation {
    private final Slot<Operation> arrayReference;
    private final ListSlot<Operation> indices;

    public ArrayElementReferenceOperation(OperationInfo info,
        Slot<Operation> arrayReference, ListSlot<Operation> indices) {
      super(OperationKind.ARRAY_ELEMENT_REFERENCE, info);
      this.arrayReference = install(arrayReference, "arrayReference");
      this.indices = install(indices, "indices");
      linkChildren();
    }

    public Operation arrayReference() {
      return arrayReference.get();
    }

    public List<Operation> indices() {
      return indices.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(arrayReference());
      children.addAll(indices());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitArrayElementReference(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitArrayElementReference(this, argument);
    }
  }

  public static final class PointerIndirectionReferenceOperation
                                                      extends Operation {
    private final Slot<Operation> pointer;

    public PointerIndirectionReferenceOperation(OperationInfo info,
                                                Slot<Operation> pointer) {
      super(OperationKind.POINTER_INDIRECTION_REFERENCE, info);
      this.pointer = install(pointer, "pointer");
      linkChildren();
    }

    public Operation pointer() {
      return pointer.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(pointer());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitPointerIndirectionReference(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitPointerIndirectionReference(this, argument);
    }
  }

  /**
   * Index or range applied to a type that only has a length and an
   * int indexer or slice method.
   */
  public static final class ImplicitIndexerReferenceOperation
                                                      extends Operation {
    private final Slot<Operation> instance;
    private final Slot<Operation> argument;
    private final Symbol lengthSymbol;
    private final Symbol indexerSymbol;

    public ImplicitIndexerReferenceOperation(OperationInfo info,
        Slot<Operation> instance, Slot<Operation> argument,
        Symbol lengthSymbol, Symbol indexerSymbol) {
      super(OperationKind.IMPLICIT_INDEXER_REFERENCE, info);
      this.instance = install(instance, "instance");
      this.argument = install(argument, "argument");
      this.lengthSymbol = require(lengthSymbol, "lengthSymbol");
      this.indexerSymbol = require(indexerSymbol, "indexerSymbol");
      linkChildren();
    }

    public Operation instance() {
      return instance.get();
    }

    public Operation argument() {
      return argument.get();
    }

    public Symbol lengthSymbol() {
      return lengthSymbol;
    }

    public Symbol indexerSymbol() {
      return indexerSymbol;
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(instance()).add(argument());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitImplicitIndexerReference(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitImplicitIndexerReference(this, argument);
    }
  }

  public static final class InlineArrayAccessOperation extends Operation {
    private final Slot<Operation> instance;
    private final Slot<Operation> argument;

    public InlineArrayAccessOperation(OperationInfo info,
        Slot<Operation> instance, Slot<Operation> argument) {
      super(OperationKind.INLINE_ARRAY_ACCESS, info);
      this.instance = install(instance, "instance");
      this.argument = install(argument, "argument");
      linkChildren();
    }

    public Operation instance() {
      return instance.get();
    }

    public Operation argument() {
      return argument.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(instance()).add(argument());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitInlineArrayAccess(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitInlineArrayAccess(this, argument);
    }
  }

  /**
   * a?.b: evaluates operation once and, if not null, whenNotNull with
   * the value standing in for each conditional access instance inside it.
   */
  public static final class ConditionalAccessOperation extends Operation {
    private final Slot<Operation> operation;
    private final Slot<Operation> whenNotNull;

    public ConditionalAccessOperation(OperationInfo info,
        Slot<Operation> operation, Slot<Operation> whenNotNull) {
      super(OperationKind.CONDITIONAL_ACCESS, info);
      this.operation = install(operation, "operation");
      this.whenNotNull = install(whenNotNull, "whenNotNull");
      linkChildren();
    }

    public Operation operation() {
      return operation.get();
    }

    public Operation whenNotNull() {
      return whenNotNull.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(operation()).add(whenNotNull());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitConditionalAccess(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitConditionalAccess(this, argument);
    }
  }

  public static final class ConditionalAccessInstanceOperation
                                                      extends Operation {
    public ConditionalAccessInstanceOperation(OperationInfo info) {
      super(OperationKind.CONDITIONAL_ACCESS_INSTANCE, info);
      linkChildren();
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitConditionalAccessInstance(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitConditionalAccessInstance(this, argument);
    }
  }

  /**
   * Adding a handler to, or removing one from, an event.
   */
  public static final class EventAssignmentOperation extends Operation {
    private final Slot<Operation> eventReference;
    private final Slot<Operation> handlerValue;
    private final boolean adds;

    public EventAssignmentOperation(OperationInfo info,
        Slot<Operation> eventReference, Slot<Operation> handlerValue,
        boolean adds) {
      super(OperationKind.EVENT_ASSIGNMENT, info);
      this.eventReference = install(eventReference, "eventReference");
      this.handlerValue = install(handlerValue, "handlerValue");
      this.adds = adds;
      linkChildren();
    }

    public Operation eventReference() {
      return eventReference.get();
    }

    public Operation handlerValue() {
      return handlerValue.get();
    }

    /** @return true for adding a handler, false for removing */
    public boolean adds() {
      return adds;
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(eventReference()).add(handlerValue());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(adds ? " add" : " remove");
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitEventAssignment(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitEventAssignment(this, argument);
    }
  }

  public static final class AddressOfOperation extends Operation {
    private final Slot<Operation> reference;

    public AddressOfOperation(OperationInfo info, Slot<Operation> reference) {
      super(OperationKind.ADDRESS_OF, info);
      this.reference = install(reference, "reference");
      linkChildren();
    }

    public Operation reference() {
      return reference.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(reference());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitAddressOf(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitAddressOf(this, argument);
    }
  }
}
