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
import exm.optree.tree.Operators.BinaryOperatorKind;
import exm.optree.tree.ParentLinks.Exemption;
import exm.optree.tree.Patterns.PatternOperation;

/**
 * Switch statements with their cases and clauses, and switch expressions
 * with their arms.
 */
public class Switches {

  public static final class SwitchOperation extends Operation {
    private final ImmutableList<LocalSymbol> locals;
    private final LabelSymbol exitLabel;
    private final Slot<Operation> value;
    private final ListSlot<SwitchCaseOperation> cases;

    public SwitchOperation(OperationInfo info, List<LocalSymbol> locals,
        LabelSymbol exitLabel, Slot<Operation> value,
        ListSlot<SwitchCaseOperation> cases) {
      super(OperationKind.SWITCH, info);
      this.locals = listOrEmpty(locals);
      this.exitLabel = require(exitLabel, "exitLabel");
      this.value = install(value, "value");
      this.cases = install(cases, "cases");
      linkChildren();
    }

    public List<LocalSymbol> locals() {
      return locals;
    }

    public LabelSymbol exitLabel() {
      return exitLabel;
    }

    public Operation value() {
      return value.get();
    }

    public List<SwitchCaseOperation> cases() {
      return cases.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(value());
      children.addAll(cases());
    }

    @Override
    protected void describe(StringBuilder sb) {
      TreeUtil.describeLocals(sb, locals);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitSwitch(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitSwitch(this, argument);
    }
  }

  /**
   * One section of a switch: the clauses that select it and the
   * statements run when selected.
   *
   * Some front ends also supply a single condition equivalent to all the
   * clauses.  That condition reuses the clause values, which already
   * belong to the clauses, so it is held without linking and is not one
   * of the case's children.
   */
  public static final class SwitchCaseOperation extends Operation {
    private final ImmutableList<LocalSymbol> locals;
    private final ListSlot<CaseClauseOperation> clauses;
    private final ListSlot<Operation> body;
    private final Slot<Operation> condition;

    public SwitchCaseOperation(OperationInfo info, List<LocalSymbol> locals,
        ListSlot<CaseClauseOperation> clauses, ListSlot<Operation> body,
        Slot<Operation> condition) {
      super(OperationKind.SWITCH_CASE, info);
      this.locals = listOrEmpty(locals);
      this.clauses = install(clauses, "clauses");
      this.body = install(body, "body");
      this.condition = installUnlinked(condition, "condition",
                                       Exemption.ALIASED_CASE_CONDITION);
      linkChildren();
    }

    public List<LocalSymbol> locals() {
      return locals;
    }

    public List<CaseClauseOperation> clauses() {
      return clauses.get();
    }

    public List<Operation> body() {
      return body.get();
    }

    /**
     * @return combined condition, or null if the front end didn't build
     *         one.  Its parent is not this case.
     */
    public Operation condition() {
      return condition.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(clauses());
      children.addAll(body());
    }

    @Override
    protected void describe(StringBuilder sb) {
      TreeUtil.describeLocals(sb, locals);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitSwitchCase(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitSwitchCase(this, argument);
    }
  }

  public static enum CaseKind {
    SINGLE_VALUE,
    RELATIONAL,
    RANGE,
    DEFAULT,
    PATTERN,
  }

  /**
   * A clause selecting a switch case.  The label is set when the clause
   * can be the target of a goto.
   */
  public static abstract class CaseClauseOperation extends Operation {
    private final CaseKind caseKind;
    private final LabelSymbol label;

    protected CaseClauseOperation(OperationKind kind, OperationInfo info,
                                  CaseKind caseKind, LabelSymbol label) {
      super(kind, info);
      this.caseKind = require(caseKind, "caseKind");
      this.label = label;
    }

    public CaseKind caseKind() {
      return caseKind;
    }

    /** @return label, may be null */
    public LabelSymbol label() {
      return label;
    }
  }

  public static final class SingleValueCaseClauseOperation
                                              extends CaseClauseOperation {
    private final Slot<Operation> value;

    public SingleValueCaseClauseOperation(OperationInfo info,
                              LabelSymbol label, Slot<Operation> value) {
      super(OperationKind.SINGLE_VALUE_CASE_CLAUSE, info,
            CaseKind.SINGLE_VALUE, label);
      this.value = install(value, "value");
      linkChildren();
    }

    public Operation value() {
      return value.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(value());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitSingleValueCaseClause(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitSingleValueCaseClause(this, argument);
    }
  }

  /** Case Is < value */
  public static final class RelationalCaseClauseOperation
                                              extends CaseClauseOperation {
    private final BinaryOperatorKind relation;
    private final Slot<Operation> value;

    public RelationalCaseClauseOperation(OperationInfo info,
        LabelSymbol label, BinaryOperatorKind relation,
        Slot<Operation> value) {
      super(OperationKind.RELATIONAL_CASE_CLAUSE, info, CaseKind.RELATIONAL,
            label);
      this.relation = require(relation, "relation");
      this.value = install(value, "value");
      linkChildren();
    }

    public BinaryOperatorKind relation() {
      return relation;
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
      sb.append(relation);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitRelationalCaseClause(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitRelationalCaseClause(this, argument);
    }
  }

  /** Case min To max */
  public static final class RangeCaseClauseOperation
                                              extends CaseClauseOperation {
    private final Slot<Operation> minimumValue;
    private final Slot<Operation> maximumValue;

    public RangeCaseClauseOperation(OperationInfo info, LabelSymbol label,
        Slot<Operation> minimumValue, Slot<Operation> maximumValue) {
      super(OperationKind.RANGE_CASE_CLAUSE, info, CaseKind.RANGE, label);
      this.minimumValue = install(minimumValue, "minimumValue");
      this.maximumValue = install(maximumValue, "maximumValue");
      linkChildren();
    }

    public Operation minimumValue() {
      return minimumValue.get();
    }

    public Operation maximumValue() {
      return maximumValue.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(minimumValue()).add(maximumValue());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitRangeCaseClause(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitRangeCaseClause(this, argument);
    }
  }

  public static final class DefaultCaseClauseOperation
                                              extends CaseClauseOperation {
    public DefaultCaseClauseOperation(OperationInfo info, LabelSymbol label) {
      super(OperationKind.DEFAULT_CASE_CLAUSE, info, CaseKind.DEFAULT, label);
      linkChildren();
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitDefaultCaseClause(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitDefaultCaseClause(this, argument);
    }
  }

  /** case pattern when guard */
  public static final class PatternCaseClauseOperation
                                              extends CaseClauseOperation {
    private final Slot<PatternOperation> pattern;
    private final Slot<Operation> guard;

    public PatternCaseClauseOperation(OperationInfo info, LabelSymbol label,
        Slot<PatternOperation> pattern, Slot<Operation> guard) {
      super(OperationKind.PATTERN_CASE_CLAUSE, info, CaseKind.PATTERN, label);
      this.pattern = install(pattern, "pattern");
      this.guard = installOptional(guard, "guard");
      linkChildren();
    }

    public PatternOperation pattern() {
      return pattern.get();
    }

    /** @return when-clause, null if there isn't one */
    public Operation guard() {
      return guard.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(pattern()).add(guard());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitPatternCaseClause(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitPatternCaseClause(this, argument);
    }
  }

  public static final class SwitchExpressionOperation extends Operation {
    private final boolean isExhaustive;
    private final Slot<Operation> value;
    private final ListSlot<SwitchExpressionArmOperation> arms;

    public SwitchExpressionOperation(OperationInfo info,
        boolean isExhaustive, Slot<Operation> value,
        ListSlot<SwitchExpressionArmOperation> arms) {
      super(OperationKind.SWITCH_EXPRESSION, info);
      this.isExhaustive = isExhaustive;
      this.value = install(value, "value");
      this.arms = install(arms, "arms");
      linkChildren();
    }

    /** @return true if the arms cover every input value */
    public boolean isExhaustive() {
      return isExhaustive;
    }

    public Operation value() {
      return value.get();
    }

    public List<SwitchExpressionArmOperation> arms() {
      return arms.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(value());
      children.addAll(arms());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitSwitchExpression(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitSwitchExpression(this, argument);
    }
  }

  public static final class SwitchExpressionArmOperation extends Operation {
    private final ImmutableList<LocalSymbol> locals;
    private final Slot<PatternOperation> pattern;
    private final Slot<Operation> guard;
    private final Slot<Operation> value;

    public SwitchExpressionArmOperation(OperationInfo info,
        List<LocalSymbol> locals, Slot<PatternOperation> pattern,
        Slot<Operation> guard, Slot<Operation> value) {
      super(OperationKind.SWITCH_EXPRESSION_ARM, info);
      this.locals = listOrEmpty(locals);
      this.pattern = install(pattern, "pattern");
      this.guard = installOptional(guard, "guard");
      this.value = install(value, "value");
      linkChildren();
    }

    public List<LocalSymbol> locals() {
      return locals;
    }

    public PatternOperation pattern() {
      return pattern.get();
    }

    public Operation guard() {
      return guard.get();
    }

    public Operation value() {
      return value.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(pattern()).add(guard()).add(value());
    }

    @Override
    protected void describe(StringBuilder sb) {
      TreeUtil.describeLocals(sb, locals);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitSwitchExpressionArm(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitSwitchExpressionArm(this, argument);
    }
  }
}
