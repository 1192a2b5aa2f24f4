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

import exm.optree.common.lang.Symbols.LabelSymbol;
import exm.optree.common.lang.Symbols.LocalSymbol;

/**
 * Loop statements.  Every loop has a body, the locals it declares and the
 * labels that continue and exit it; the rest depends on the loop form.
 */
public class Loops {

  public static enum LoopKind {
    FOR,
    FOR_EACH,
    FOR_TO,
    WHILE,
  }

  public static abstract class LoopOperation extends Operation {
    private final LoopKind loopKind;
    private final ImmutableList<LocalSymbol> locals;
    private final LabelSymbol continueLabel;
    private final LabelSymbol exitLabel;
    private final Slot<Operation> body;

    protected LoopOperation(OperationKind kind, OperationInfo info,
        LoopKind loopKind, List<LocalSymbol> locals,
        LabelSymbol continueLabel, LabelSymbol exitLabel,
        Slot<Operation> body) {
      super(kind, info);
      this.loopKind = require(loopKind, "loopKind");
      this.locals = listOrEmpty(locals);
      this.continueLabel = require(continueLabel, "continueLabel");
      this.exitLabel = require(exitLabel, "exitLabel");
      this.body = install(body, "body");
    }

    public LoopKind loopKind() {
      return loopKind;
    }

    /** @return locals scoped to the whole loop */
    public List<LocalSymbol> locals() {
      return locals;
    }

    public LabelSymbol continueLabel() {
      return continueLabel;
    }

    public LabelSymbol exitLabel() {
      return exitLabel;
    }

    public Operation body() {
      return body.get();
    }

    @Override
    protected void describe(StringBuilder sb) {
      TreeUtil.describeLocals(sb, locals);
    }
  }

  /**
   * C-style for loop.  Condition may be absent (loop forever).
   */
  public static final class ForLoopOperation extends LoopOperation {
    private final ImmutableList<LocalSymbol> conditionLocals;
    private final ListSlot<Operation> before;
    private final Slot<Operation> condition;
    private final ListSlot<Operation> atLoopBottom;

    public ForLoopOperation(OperationInfo info, List<LocalSymbol> locals,
        List<LocalSymbol> conditionLocals, LabelSymbol continueLabel,
        LabelSymbol exitLabel, ListSlot<Operation> before,
        Slot<Operation> condition, Slot<Operation> body,
        ListSlot<Operation> atLoopBottom) {
      super(OperationKind.FOR_LOOP, info, LoopKind.FOR, locals,
            continueLabel, exitLabel, body);
      this.conditionLocals = listOrEmpty(conditionLocals);
      this.before = install(before, "before");
      this.condition = installOptional(condition, "condition");
      this.atLoopBottom = install(atLoopBottom, "atLoopBottom");
      linkChildren();
    }

    /** @return locals declared in the condition, fresh each iteration */
    public List<LocalSymbol> conditionLocals() {
      return conditionLocals;
    }

    public List<Operation> before() {
      return before.get();
    }

    public Operation condition() {
      return condition.get();
    }

    public List<Operation> atLoopBottom() {
      return atLoopBottom.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(before());
      children.add(condition());
      children.add(body());
      children.addAll(atLoopBottom());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitForLoop(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitForLoop(this, argument);
    }
  }

  public static final class ForEachLoopOperation extends LoopOperation {
    private final boolean isAsynchronous;
    private final Slot<Operation> collection;
    private final Slot<Operation> loopControlVariable;
    private final ListSlot<Operation> nextVariables;

    public ForEachLoopOperation(OperationInfo info, List<LocalSymbol> locals,
        LabelSymbol continueLabel, LabelSymbol exitLabel,
        boolean isAsynchronous, Slot<Operation> collection,
        Slot<Operation> loopControlVariable, Slot<Operation> body,
        ListSlot<Operation> nextVariables) {
      super(OperationKind.FOR_EACH_LOOP, info, LoopKind.FOR_EACH, locals,
            continueLabel, exitLabel, body);
      this.isAsynchronous = isAsynchronous;
      this.collection = install(collection, "collection");
      this.loopControlVariable = install(loopControlVariable,
                                         "loopControlVariable");
      this.nextVariables = install(nextVariables, "nextVariables");
      linkChildren();
    }

    public boolean isAsynchronous() {
      return isAsynchronous;
    }

    public Operation collection() {
      return collection.get();
    }

    public Operation loopControlVariable() {
      return loopControlVariable.get();
    }

    /** @return variables listed after Next, empty in most languages */
    public List<Operation> nextVariables() {
      return nextVariables.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(collection());
      children.add(loopControlVariable());
      children.add(body());
      children.addAll(nextVariables());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitForEachLoop(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitForEachLoop(this, argument);
    }
  }

  /**
   * For i = initial To limit Step step.  Step is always present; the
   * binder supplies an implicit one when none was written.
   */
  public static final class ForToLoopOperation extends LoopOperation {
    private final boolean isChecked;
    private final Slot<Operation> loopControlVariable;
    private final Slot<Operation> initialValue;
    private final Slot<Operation> limitValue;
    private final Slot<Operation> stepValue;
    private final ListSlot<Operation> nextVariables;

    public ForToLoopOperation(OperationInfo info, List<LocalSymbol> locals,
        LabelSymbol continueLabel, LabelSymbol exitLabel, boolean isChecked,
        Slot<Operation> loopControlVariable, Slot<Operation> initialValue,
        Slot<Operation> limitValue, Slot<Operation> stepValue,
        Slot<Operation> body, ListSlot<Operation> nextVariables) {
      super(OperationKind.FOR_TO_LOOP, info, LoopKind.FOR_TO, locals,
            continueLabel, exitLabel, body);
      this.isChecked = isChecked;
      this.loopControlVariable = install(loopControlVariable,
                                         "loopControlVariable");
      this.initialValue = install(initialValue, "initialValue");
      this.limitValue = install(limitValue, "limitValue");
      this.stepValue = install(stepValue, "stepValue");
      this.nextVariables = install(nextVariables, "nextVariables");
      linkChildren();
    }

    public boolean isChecked() {
      return isChecked;
    }

    public Operation loopControlVariable() {
      return loopControlVariable.get();
    }

    public Operation initialValue() {
      return initialValue.get();
    }

    public Operation limitValue() {
      return limitValue.get();
    }

    public Operation stepValue() {
      return stepValue.get();
    }

    public List<Operation> nextVariables() {
      return nextVariables.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(loopControlVariable());
      children.add(initialValue());
      children.add(limitValue());
      children.add(stepValue());
      children.add(body());
      children.addAll(nextVariables());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitForToLoop(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitForToLoop(this, argument);
    }
  }

  /**
   * while, do-while, do-until and friends.  The condition is evaluated
   * before the body when conditionIsTop, otherwise after it.  A loop
   * written with conditions at both ends keeps the bottom one as
   * ignoredCondition.
   */
  public static final class WhileLoopOperation extends LoopOperation {
    private final boolean conditionIsTop;
    private final boolean conditionIsUntil;
    private final Slot<Operation> condition;
    private final Slot<Operation> ignoredCondition;

    public WhileLoopOperation(OperationInfo info, List<LocalSymbol> locals,
        LabelSymbol continueLabel, LabelSymbol exitLabel,
        boolean conditionIsTop, boolean conditionIsUntil,
        Slot<Operation> condition, Slot<Operation> body,
        Slot<Operation> ignoredCondition) {
      super(OperationKind.WHILE_LOOP, info, LoopKind.WHILE, locals,
            continueLabel, exitLabel, body);
      this.conditionIsTop = conditionIsTop;
      this.conditionIsUntil = conditionIsUntil;
      this.condition = installOptional(condition, "condition");
      this.ignoredCondition = installOptional(ignoredCondition,
                                              "ignoredCondition");
      linkChildren();
    }

    public boolean conditionIsTop() {
      return conditionIsTop;
    }

    /** @return true if the loop runs until the condition becomes true */
    public boolean conditionIsUntil() {
      return conditionIsUntil;
    }

    public Operation condition() {
      return condition.get();
    }

    public Operation ignoredCondition() {
      return ignoredCondition.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      if (conditionIsTop) {
        children.add(condition());
        children.add(body());
      } else {
        children.add(body());
        children.add(condition());
      }
      children.add(ignoredCondition());
    }

    @Override
    protected void describe(StringBuilder sb) {
      super.describe(sb);
      sb.append(conditionIsTop ? " top" : " bottom");
      if (conditionIsUntil) {
        sb.append(" until");
      }
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitWhileLoop(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitWhileLoop(this, argument);
    }
  }
}
