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

import exm.optree.common.exceptions.MissingAttributeException;
import exm.optree.common.lang.Symbols.LocalSymbol;
import exm.optree.common.lang.Symbols.TypeSymbol;

/**
 * Operations producing values that are not references to storage:
 * literals, type queries, placeholders and the catch-all kinds for
 * constructs with no dedicated kind or that failed to bind.
 */
public class Literals {

  /**
   * A construct the tree doesn't model in detail.  Its children are
   * whatever operations the binder could produce for its parts.
   */
  public static final class NoneOperation extends Operation {
    private final ListSlot<Operation> children;

    public NoneOperation(OperationInfo info, ListSlot<Operation> children) {
      super(OperationKind.NONE, info);
      this.children = install(children, "children");
      linkChildren();
    }

    @Override
    protected void addChildren(ChildList out) {
      out.addAll(children.get());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitNone(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitNone(this, argument);
    }
  }

  /**
   * A construct that had binding errors.
   */
  public static final class InvalidOperation extends Operation {
    private final ListSlot<Operation> children;

    public InvalidOperation(OperationInfo info, ListSlot<Operation> children) {
      super(OperationKind.INVALID, info);
      this.children = install(children, "children");
      linkChildren();
    }

    @Override
    protected void addChildren(ChildList out) {
      out.addAll(children.get());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitInvalid(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitInvalid(this, argument);
    }
  }

  /**
   * A literal.  The value is the operation's constant value, which must
   * be present (possibly as a known null).
   */
  public static final class LiteralOperation extends Operation {
    public LiteralOperation(OperationInfo info) {
      super(OperationKind.LITERAL, info);
      if (!info.constantValue().hasValue()) {
        throw new MissingAttributeException(OperationKind.LITERAL,
                                            "constantValue");
      }
      linkChildren();
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(TreeUtil.describeConstant(constantValue()));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitLiteral(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitLiteral(this, argument);
    }
  }

  /** Default value of the operation's type */
  public static final class DefaultValueOperation extends Operation {
    public DefaultValueOperation(OperationInfo info) {
      super(OperationKind.DEFAULT_VALUE, info);
      linkChildren();
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitDefaultValue(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitDefaultValue(this, argument);
    }
  }

  public static final class TypeOfOperation extends Operation {
    private final TypeSymbol typeOperand;

    public TypeOfOperation(OperationInfo info, TypeSymbol typeOperand) {
      super(OperationKind.TYPE_OF, info);
      this.typeOperand = require(typeOperand, "typeOperand");
      linkChildren();
    }

    public TypeSymbol typeOperand() {
      return typeOperand;
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(TreeUtil.name(typeOperand));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitTypeOf(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitTypeOf(this, argument);
    }
  }

  public static final class SizeOfOperation extends Operation {
    private final TypeSymbol typeOperand;

    public SizeOfOperation(OperationInfo info, TypeSymbol typeOperand) {
      super(OperationKind.SIZE_OF, info);
      this.typeOperand = require(typeOperand, "typeOperand");
      linkChildren();
    }

    public TypeSymbol typeOperand() {
      return typeOperand;
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitSizeOf(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitSizeOf(this, argument);
    }
  }

  /**
   * Name of a symbol as a string constant.  The argument is kept so that
   * references inside it are still visible to consumers.
   */
  public static final class NameOfOperation extends Operation {
    private final Slot<Operation> argument;

    public NameOfOperation(OperationInfo info, Slot<Operation> argument) {
      super(OperationKind.NAME_OF, info);
      this.argument = install(argument, "argument");
      linkChildren();
    }

    public Operation argument() {
      return argument.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(argument());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitNameOf(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitNameOf(this, argument);
    }
  }

  /** Argument left out of a call that allows omitting it */
  public static final class OmittedArgumentOperation extends Operation {
    public OmittedArgumentOperation(OperationInfo info) {
      super(OperationKind.OMITTED_ARGUMENT, info);
      linkChildren();
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitOmittedArgument(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitOmittedArgument(this, argument);
    }
  }

  /**
   * Discard designation.  The symbol is absent where the language has no
   * symbol for discards.
   */
  public static final class DiscardOperation extends Operation {
    private final LocalSymbol discardSymbol;

    public DiscardOperation(OperationInfo info, LocalSymbol discardSymbol) {
      super(OperationKind.DISCARD, info);
      this.discardSymbol = discardSymbol;
      linkChildren();
    }

    public LocalSymbol discardSymbol() {
      return discardSymbol;
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitDiscard(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitDiscard(this, argument);
    }
  }

  public static enum PlaceholderKind {
    UNSPECIFIED,
    SWITCH_OPERATION_EXPRESSION,
    AGGREGATION_GROUP,
  }

  /**
   * Stands for a value supplied by an enclosing construct, e.g. the
   * group being aggregated in a query.
   */
  public static final class PlaceholderOperation extends Operation {
    private final PlaceholderKind placeholderKind;

    public PlaceholderOperation(OperationInfo info,
                                PlaceholderKind placeholderKind) {
      super(OperationKind.PLACEHOLDER, info);
      this.placeholderKind = require(placeholderKind, "placeholderKind");
      linkChildren();
    }

    public PlaceholderKind placeholderKind() {
      return placeholderKind;
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(placeholderKind);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitPlaceholder(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitPlaceholder(this, argument);
    }
  }

  public static final class Utf8StringOperation extends Operation {
    private final String value;

    public Utf8StringOperation(OperationInfo info, String value) {
      super(OperationKind.UTF8_STRING, info);
      this.value = require(value, "value");
      linkChildren();
    }

    public String value() {
      return value;
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(" \"");
      sb.append(value);
      sb.append("\"");
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitUtf8String(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitUtf8String(this, argument);
    }
  }
}
