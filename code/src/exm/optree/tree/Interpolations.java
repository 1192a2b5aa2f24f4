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
import exm.optree.common.exceptions.MissingAttributeException;

/**
 * Interpolated strings, both the plain form and the form lowered onto an
 * interpolated string handler.
 */
public class Interpolations {

  /** $"text {expr,align:format} text" */
  public static final class InterpolatedStringOperation extends Operation {
    private final ListSlot<Operation> parts;

    public InterpolatedStringOperation(OperationInfo info,
                                       ListSlot<Operation> parts) {
      super(OperationKind.INTERPOLATED_STRING, info);
      this.parts = install(parts, "parts");
      linkChildren();
    }

    /**
     * @return text, interpolation and append operations in source order
     */
    public List<Operation> parts() {
      return parts.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(parts());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitInterpolatedString(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitInterpolatedString(this, argument);
    }
  }

  public static final class InterpolatedStringTextOperation
                                                      extends Operation {
    private final Slot<Operation> text;

    public InterpolatedStringTextOperation(OperationInfo info,
                                           Slot<Operation> text) {
      super(OperationKind.INTERPOLATED_STRING_TEXT, info);
      this.text = install(text, "text");
      linkChildren();
    }

    /** @return literal holding the text */
    public Operation text() {
      return text.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(text());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitInterpolatedStringText(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitInterpolatedStringText(this, argument);
    }
  }

  public static final class InterpolationOperation extends Operation {
    private final Slot<Operation> expression;
    private final Slot<Operation> alignment;
    private final Slot<Operation> formatString;

    public InterpolationOperation(OperationInfo info,
        Slot<Operation> expression, Slot<Operation> alignment,
        Slot<Operation> formatString) {
      super(OperationKind.INTERPOLATION, info);
      this.expression = install(expression, "expression");
      this.alignment = installOptional(alignment, "alignment");
      this.formatString = installOptional(formatString, "formatString");
      linkChildren();
    }

    public Operation expression() {
      return expression.get();
    }

    public Operation alignment() {
      return alignment.get();
    }

    public Operation formatString() {
      return formatString.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(expression()).add(alignment()).add(formatString());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitInterpolation(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitInterpolation(this, argument);
    }
  }

  /**
   * Interpolated string built with a handler: the handler is created,
   * then content appends to it.
   */
  public static final class InterpolatedStringHandlerCreationOperation
                                                      extends Operation {
    private final boolean handlerAppendCallsReturnBool;
    private final boolean handlerCreationHasSuccessParameter;
    private final Slot<Operation> handlerCreation;
    private final Slot<Operation> content;

    public InterpolatedStringHandlerCreationOperation(OperationInfo info,
        boolean handlerAppendCallsReturnBool,
        boolean handlerCreationHasSuccessParameter,
        Slot<Operation> handlerCreation, Slot<Operation> content) {
      super(OperationKind.INTERPOLATED_STRING_HANDLER_CREATION, info);
      this.handlerAppendCallsReturnBool = handlerAppendCallsReturnBool;
      this.handlerCreationHasSuccessParameter =
                                handlerCreationHasSuccessParameter;
      this.handlerCreation = install(handlerCreation, "handlerCreation");
      this.content = install(content, "content");
      linkChildren();
    }

    /** @return true if appending stops once an append returns false */
    public boolean handlerAppendCallsReturnBool() {
      return handlerAppendCallsReturnBool;
    }

    /** @return true if the constructor can veto all appends */
    public boolean handlerCreationHasSuccessParameter() {
      return handlerCreationHasSuccessParameter;
    }

    public Operation handlerCreation() {
      return handlerCreation.get();
    }

    /**
     * @return interpolated string or addition of interpolated strings
     */
    public Operation content() {
      return content.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(handlerCreation()).add(content());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitInterpolatedStringHandlerCreation(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitInterpolatedStringHandlerCreation(this, argument);
    }
  }

  /** $"a" + $"b" sharing one handler */
  public static final class InterpolatedStringAdditionOperation
                                                      extends Operation {
    private final Slot<Operation> left;
    private final Slot<Operation> right;

    public InterpolatedStringAdditionOperation(OperationInfo info,
        Slot<Operation> left, Slot<Operation> right) {
      super(OperationKind.INTERPOLATED_STRING_ADDITION, info);
      this.left = install(left, "left");
      this.right = install(right, "right");
      linkChildren();
    }

    public Operation left() {
      return left.get();
    }

    public Operation right() {
      return right.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(left()).add(right());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitInterpolatedStringAddition(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitInterpolatedStringAddition(this, argument);
    }
  }

  /**
   * A call appending one part to the handler.  The kind says whether the
   * part was literal text, a formatted hole, or something that failed to
   * bind.
   */
  public static final class InterpolatedStringAppendOperation
                                                      extends Operation {
    private final Slot<Operation> appendCall;

    public InterpolatedStringAppendOperation(OperationKind kind,
        OperationInfo info, Slot<Operation> appendCall) {
      super(checkKind(kind), info);
      this.appendCall = install(appendCall, "appendCall");
      linkChildren();
    }

    private static OperationKind checkKind(OperationKind kind) {
      if (kind != null &&
          kind != OperationKind.INTERPOLATED_STRING_APPEND_LITERAL &&
          kind != OperationKind.INTERPOLATED_STRING_APPEND_FORMATTED &&
          kind != OperationKind.INTERPOLATED_STRING_APPEND_INVALID) {
        throw new KindMismatchException(kind,
            "expected one of the INTERPOLATED_STRING_APPEND kinds");
      }
      return kind;
    }

    public Operation appendCall() {
      return appendCall.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(appendCall());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitInterpolatedStringAppend(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitInterpolatedStringAppend(this, argument);
    }
  }

  public static enum HandlerArgumentPlaceholderKind {
    CALL_SITE_ARGUMENT,
    CALL_SITE_RECEIVER,
    TRAILING_VALIDITY_ARGUMENT,
  }

  /**
   * Stands in for an argument of the enclosing call that is passed on to
   * the handler constructor.
   */
  public static final class
      InterpolatedStringHandlerArgumentPlaceholderOperation
                                                      extends Operation {
    private final int argumentIndex;
    private final HandlerArgumentPlaceholderKind placeholderKind;

    public InterpolatedStringHandlerArgumentPlaceholderOperation(
        OperationInfo info, int argumentIndex,
        HandlerArgumentPlaceholderKind placeholderKind) {
      super(OperationKind.INTERPOLATED_STRING_HANDLER_ARGUMENT_PLACEHOLDER,
            info);
      this.placeholderKind = require(placeholderKind, "placeholderKind");
      if (placeholderKind == HandlerArgumentPlaceholderKind.CALL_SITE_ARGUMENT
          && argumentIndex < 0) {
        throw new MissingAttributeException(kind(), "argumentIndex",
                                     "must be set for a call site argument");
      }
      this.argumentIndex = argumentIndex;
      linkChildren();
    }

    /** @return index into the call's arguments, -1 if not an argument */
    public int argumentIndex() {
      return argumentIndex;
    }

    public HandlerArgumentPlaceholderKind placeholderKind() {
      return placeholderKind;
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(placeholderKind);
      if (argumentIndex >= 0) {
        sb.append(' ');
        sb.append(argumentIndex);
      }
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitInterpolatedStringHandlerArgumentPlaceholder(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitInterpolatedStringHandlerArgumentPlaceholder(this,
                                                                 argument);
    }
  }
}
