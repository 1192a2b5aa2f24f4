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

import exm.optree.common.lang.Symbols.LocalSymbol;
import exm.optree.tree.Declarations.VariableDeclarationGroupOperation;

/**
 * Statements that hold a resource or value for the duration of a body.
 */
public class ResourceStatements {

  /**
   * using (resources) body.  Resources are a declaration group or an
   * expression.
   */
  public static final class UsingOperation extends Operation {
    private final ImmutableList<LocalSymbol> locals;
    private final boolean isAsynchronous;
    private final Slot<Operation> resources;
    private final Slot<Operation> body;

    public UsingOperation(OperationInfo info, List<LocalSymbol> locals,
        boolean isAsynchronous, Slot<Operation> resources,
        Slot<Operation> body) {
      super(OperationKind.USING, info);
      this.locals = listOrEmpty(locals);
      this.isAsynchronous = isAsynchronous;
      this.resources = install(resources, "resources");
      this.body = install(body, "body");
      linkChildren();
    }

    public List<LocalSymbol> locals() {
      return locals;
    }

    public boolean isAsynchronous() {
      return isAsynchronous;
    }

    public Operation resources() {
      return resources.get();
    }

    public Operation body() {
      return body.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(resources()).add(body());
    }

    @Override
    protected void describe(StringBuilder sb) {
      if (isAsynchronous) {
        sb.append(" async");
      }
      TreeUtil.describeLocals(sb, locals);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitUsing(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitUsing(this, argument);
    }
  }

  /** using declaration, disposed at the end of the enclosing scope */
  public static final class UsingDeclarationOperation extends Operation {
    private final boolean isAsynchronous;
    private final Slot<VariableDeclarationGroupOperation> declarationGroup;

    public UsingDeclarationOperation(OperationInfo info,
        boolean isAsynchronous,
        Slot<VariableDeclarationGroupOperation> declarationGroup) {
      super(OperationKind.USING_DECLARATION, info);
      this.isAsynchronous = isAsynchronous;
      this.declarationGroup = install(declarationGroup, "declarationGroup");
      linkChildren();
    }

    public boolean isAsynchronous() {
      return isAsynchronous;
    }

    public VariableDeclarationGroupOperation declarationGroup() {
      return declarationGroup.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(declarationGroup());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitUsingDeclaration(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitUsingDeclaration(this, argument);
    }
  }

  public static final class LockOperation extends Operation {
    private final Slot<Operation> lockedValue;
    private final Slot<Operation> body;

    public LockOperation(OperationInfo info, Slot<Operation> lockedValue,
                         Slot<Operation> body) {
      super(OperationKind.LOCK, info);
      this.lockedValue = install(lockedValue, "lockedValue");
      this.body = install(body, "body");
      linkChildren();
    }

    public Operation lockedValue() {
      return lockedValue.get();
    }

    public Operation body() {
      return body.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(lockedValue()).add(body());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitLock(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitLock(this, argument);
    }
  }

  /** Pins variables in memory for the body */
  public static final class FixedOperation extends Operation {
    private final ImmutableList<LocalSymbol> locals;
    private final Slot<VariableDeclarationGroupOperation> variables;
    private final Slot<Operation> body;

    public FixedOperation(OperationInfo info, List<LocalSymbol> locals,
        Slot<VariableDeclarationGroupOperation> variables,
        Slot<Operation> body) {
      super(OperationKind.FIXED, info);
      this.locals = listOrEmpty(locals);
      this.variables = install(variables, "variables");
      this.body = install(body, "body");
      linkChildren();
    }

    public List<LocalSymbol> locals() {
      return locals;
    }

    public VariableDeclarationGroupOperation variables() {
      return variables.get();
    }

    public Operation body() {
      return body.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(variables()).add(body());
    }

    @Override
    protected void describe(StringBuilder sb) {
      TreeUtil.describeLocals(sb, locals);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitFixed(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitFixed(this, argument);
    }
  }

  /** With value ... End With: body accesses members of value implicitly */
  public static final class WithStatementOperation extends Operation {
    private final Slot<Operation> value;
    private final Slot<Operation> body;

    public WithStatementOperation(OperationInfo info, Slot<Operation> value,
                                  Slot<Operation> body) {
      super(OperationKind.WITH_STATEMENT, info);
      this.value = install(value, "value");
      this.body = install(body, "body");
      linkChildren();
    }

    public Operation value() {
      return value.get();
    }

    public Operation body() {
      return body.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(value()).add(body());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitWithStatement(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitWithStatement(this, argument);
    }
  }
}
