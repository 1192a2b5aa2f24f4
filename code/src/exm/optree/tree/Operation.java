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
import java.util.List;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import com.google.common.collect.ImmutableList;

import exm.optree.common.exceptions.KindMismatchException;
import exm.optree.common.exceptions.MissingAttributeException;
import exm.optree.common.exceptions.OpTreeRuntimeError;
import exm.optree.common.lang.ConstantValue;
import exm.optree.common.lang.SemanticModel;
import exm.optree.common.lang.SourceLocus;
import exm.optree.common.lang.Symbols.TypeSymbol;
import exm.optree.tree.OperationKind.Family;
import exm.optree.tree.ParentLinks.Exemption;

/**
 * Base class of every node in the operation tree.
 *
 * An operation models one semantic construct.  Its kind fixes which concrete
 * class it is, which visitor method handles it and which child slots it has.
 * Operations are immutable once constructed apart from the one-time
 * publication of lazy child slots and the one-time linking of the parent.
 *
 * The tree looks like:
 *
 * Operation -> named child slot     -> Operation
 *           -> named child slot     -> (absent)
 *           -> child sequence slot  -> Operation
 *                                   -> Operation
 *
 * and {@link #children()} lists those operations in evaluation order.
 */
public abstract class Operation {

  private static final AtomicReferenceFieldUpdater<Operation, Operation>
      PARENT = AtomicReferenceFieldUpdater.newUpdater(Operation.class,
                                             Operation.class, "parent");

  private final OperationKind kind;
  private final OperationInfo info;

  /** Set once, when this operation is installed as a child */
  private volatile Operation parent;

  /**
   * Slots installed by the constructor so far.  Their values are only
   * linked by {@link #linkChildren()}, once every check has passed.
   */
  private List<SlotBinding> pendingSlots = new ArrayList<SlotBinding>();

  protected Operation(OperationKind kind, OperationInfo info) {
    if (kind == null) {
      throw new OpTreeRuntimeError("Operation constructed without a kind");
    }
    if (info == null) {
      throw new MissingAttributeException(kind, "info");
    }
    if (!kind.shape().isInstance(this)) {
      throw new KindMismatchException(kind, "represented by "
          + kind.shape().getSimpleName() + ", not "
          + getClass().getSimpleName());
    }
    if (kind.family() == Family.FLOW && !info.isFlowOnly()) {
      throw new KindMismatchException(kind, "flow graph operations must be "
          + "built from OperationInfo.forFlowGraph and carry no semantic "
          + "model");
    }
    this.kind = kind;
    this.info = info;
    this.parent = null;
  }

  public OperationKind kind() {
    return kind;
  }

  /**
   * Result type of this operation.
   * @return type of the value produced, or null if none (e.g. statements)
   */
  public TypeSymbol type() {
    return info.type();
  }

  /**
   * @return constant value, {@link ConstantValue#NONE} if not constant
   */
  public ConstantValue constantValue() {
    return info.constantValue();
  }

  /** @return true if synthesized by the compiler rather than written */
  public boolean isImplicit() {
    return info.isImplicit();
  }

  public SourceLocus syntax() {
    return info.syntax();
  }

  /**
   * @return the semantic model that bound this operation, null for
   *         operations synthesized by the flow graph builder
   */
  public SemanticModel semanticModel() {
    return info.semanticModel();
  }

  public String language() {
    return info.syntax().language();
  }

  /**
   * @return operation that installed this one as a child, null for roots
   *         and for operations held in an exempt slot
   */
  public Operation parent() {
    return parent;
  }

  /**
   * Link this operation to its parent.  Only the first call has any effect.
   * @return true if parent is now the parent
   */
  boolean linkParent(Operation newParent) {
    assert(newParent != null);
    return PARENT.compareAndSet(this, null, newParent) ||
           this.parent == newParent;
  }

  /**
   * Child operations in evaluation order, with absent children omitted.
   * Materializes any lazy slots that haven't been read yet.
   * @return immutable list, never containing nulls
   */
  public final List<Operation> children() {
    ChildList children = new ChildList();
    addChildren(children);
    return children.build();
  }

  /**
   * Append children in evaluation order
   * @param children
   */
  protected void addChildren(ChildList children) {
    // No children by default
  }

  public abstract void accept(OperationVisitor visitor);

  public abstract <A, R> R accept(OperationArgVisitor<A, R> visitor,
                                  A argument);

  /**
   * Install a slot that must hold a child
   */
  protected final <S extends SlotBinding> S install(S slot, String name) {
    return install(slot, name, true, Exemption.NONE);
  }

  /**
   * Install a slot whose child may be absent
   */
  protected final <S extends SlotBinding> S installOptional(S slot,
                                                            String name) {
    return install(slot, name, false, Exemption.NONE);
  }

  /**
   * Install a slot whose values are not linked back to this operation
   */
  protected final <S extends SlotBinding> S installUnlinked(S slot,
                                   String name, Exemption exemption) {
    assert(exemption != Exemption.NONE);
    return install(slot, name, false, exemption);
  }

  private <S extends SlotBinding> S install(S slot, String name,
                            boolean required, Exemption exemption) {
    if (slot == null) {
      throw new MissingAttributeException(kind, name);
    }
    if (pendingSlots == null) {
      throw new OpTreeRuntimeError("Slot " + name + " installed into "
                                 + kind + " after its children were linked");
    }
    slot.attach(this, name, required, exemption);
    pendingSlots.add(slot);
    return slot;
  }

  /**
   * Link eagerly supplied children to this operation.  Must be the last
   * statement of every concrete constructor, so that a constructor that
   * throws leaves its would-be children unowned.
   */
  protected final void linkChildren() {
    if (pendingSlots == null) {
      throw new OpTreeRuntimeError("Children of " + kind
                                 + " operation linked twice");
    }
    for (SlotBinding slot: pendingSlots) {
      slot.link();
    }
    pendingSlots = null;
  }

  /**
   * Check that a kind-specific attribute was supplied
   * @return value
   */
  protected final <T> T require(T value, String attribute) {
    if (value == null) {
      throw new MissingAttributeException(kind, attribute);
    }
    return value;
  }

  /**
   * Check that a list-valued attribute was supplied and copy it
   */
  protected final <T> ImmutableList<T> requireList(List<? extends T> value,
                                                  String attribute) {
    if (value == null) {
      throw new MissingAttributeException(kind, attribute);
    }
    return ImmutableList.copyOf(value);
  }

  /**
   * Copy an attribute list, treating null as empty
   */
  protected static <T> ImmutableList<T> listOrEmpty(List<? extends T> value) {
    if (value == null) {
      return ImmutableList.of();
    }
    return ImmutableList.copyOf(value);
  }

  /**
   * Append kind-specific attributes for diagnostics
   * @param sb
   */
  protected void describe(StringBuilder sb) {
    // Nothing by default
  }

  /**
   * Print this operation and everything below it, one per line.
   * Materializes lazy slots.
   */
  public void prettyPrint(StringBuilder sb, String currentIndent) {
    sb.append(currentIndent);
    sb.append(this.toString());
    if (type() != null) {
      sb.append(" : ");
      sb.append(type().name());
    }
    if (constantValue().hasValue()) {
      sb.append(" = ");
      sb.append(TreeUtil.describeConstant(constantValue()));
    }
    if (isImplicit()) {
      sb.append(" (implicit)");
    }
    sb.append("\n");
    for (Operation child: children()) {
      child.prettyPrint(sb, currentIndent + TreeUtil.indent);
    }
  }

  public String dump() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb, "");
    return sb.toString();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind.toString());
    describe(sb);
    sb.append(" @");
    sb.append(info.syntax());
    return sb.toString();
  }

  /**
   * Accumulates children while skipping absent ones
   */
  protected static final class ChildList {
    private final ImmutableList.Builder<Operation> builder =
                                          ImmutableList.builder();

    public ChildList add(Operation child) {
      if (child != null) {
        builder.add(child);
      }
      return this;
    }

    public ChildList addAll(List<? extends Operation> children) {
      builder.addAll(children);
      return this;
    }

    ImmutableList<Operation> build() {
      return builder.build();
    }
  }
}
