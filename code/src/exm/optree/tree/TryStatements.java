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
import exm.optree.common.lang.Symbols.TypeSymbol;
import exm.optree.tree.Statements.BlockOperation;

/**
 * try/catch/finally
 */
public class TryStatements {

  public static final class TryOperation extends Operation {
    private final LabelSymbol exitLabel;
    private final Slot<BlockOperation> body;
    private final ListSlot<CatchClauseOperation> catches;
    private final Slot<BlockOperation> finallyBlock;

    public TryOperation(OperationInfo info, LabelSymbol exitLabel,
        Slot<BlockOperation> body, ListSlot<CatchClauseOperation> catches,
        Slot<BlockOperation> finallyBlock) {
      super(OperationKind.TRY, info);
      this.exitLabel = exitLabel;
      this.body = install(body, "body");
      this.catches = install(catches, "catches");
      this.finallyBlock = installOptional(finallyBlock, "finally");
      linkChildren();
    }

    /** @return label for Exit Try, null where the language has none */
    public LabelSymbol exitLabel() {
      return exitLabel;
    }

    public BlockOperation body() {
      return body.get();
    }

    public List<CatchClauseOperation> catches() {
      return catches.get();
    }

    public BlockOperation finallyBlock() {
      return finallyBlock.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(body());
      children.addAll(catches());
      children.add(finallyBlock());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitTry(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitTry(this, argument);
    }
  }

  /**
   * catch (T e) when (filter) { handler }.  The declaration is a variable
   * declarator, or in some languages an expression naming an existing
   * variable.
   */
  public static final class CatchClauseOperation extends Operation {
    private final TypeSymbol exceptionType;
    private final ImmutableList<LocalSymbol> locals;
    private final Slot<Operation> exceptionDeclarationOrExpression;
    private final Slot<Operation> filter;
    private final Slot<BlockOperation> handler;

    public CatchClauseOperation(OperationInfo info, TypeSymbol exceptionType,
        List<LocalSymbol> locals,
        Slot<Operation> exceptionDeclarationOrExpression,
        Slot<Operation> filter, Slot<BlockOperation> handler) {
      super(OperationKind.CATCH_CLAUSE, info);
      this.exceptionType = require(exceptionType, "exceptionType");
      this.locals = listOrEmpty(locals);
      this.exceptionDeclarationOrExpression = installOptional(
          exceptionDeclarationOrExpression,
          "exceptionDeclarationOrExpression");
      this.filter = installOptional(filter, "filter");
      this.handler = install(handler, "handler");
      linkChildren();
    }

    public TypeSymbol exceptionType() {
      return exceptionType;
    }

    public List<LocalSymbol> locals() {
      return locals;
    }

    public Operation exceptionDeclarationOrExpression() {
      return exceptionDeclarationOrExpression.get();
    }

    public Operation filter() {
      return filter.get();
    }

    public BlockOperation handler() {
      return handler.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(exceptionDeclarationOrExpression());
      children.add(filter());
      children.add(handler());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(TreeUtil.name(exceptionType));
      TreeUtil.describeLocals(sb, locals);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitCatchClause(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitCatchClause(this, argument);
    }
  }
}
