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

import exm.optree.common.exceptions.MissingAttributeException;
import exm.optree.common.lang.Symbols.LocalSymbol;
import exm.optree.common.lang.Symbols.MethodSymbol;
import exm.optree.tree.Statements.BlockOperation;

/**
 * Roots of member bodies, anonymous functions and translated queries.
 */
public class Bodies {

  /**
   * A query expression.  The operation is the chain of method calls the
   * query was translated into.
   */
  public static final class TranslatedQueryOperation extends Operation {
    private final Slot<Operation> operation;

    public TranslatedQueryOperation(OperationInfo info,
                                    Slot<Operation> operation) {
      super(OperationKind.TRANSLATED_QUERY, info);
      this.operation = install(operation, "operation");
      linkChildren();
    }

    public Operation operation() {
      return operation.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(operation());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitTranslatedQuery(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitTranslatedQuery(this, argument);
    }
  }

  /** Lambda or anonymous method.  Expression bodies become a block. */
  public static final class AnonymousFunctionOperation extends Operation {
    private final MethodSymbol symbol;
    private final Slot<BlockOperation> body;

    public AnonymousFunctionOperation(OperationInfo info, MethodSymbol symbol,
                                      Slot<BlockOperation> body) {
      super(OperationKind.ANONYMOUS_FUNCTION, info);
      this.symbol = require(symbol, "symbol");
      this.body = install(body, "body");
      linkChildren();
    }

    public MethodSymbol symbol() {
      return symbol;
    }

    public BlockOperation body() {
      return body.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(body());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(TreeUtil.name(symbol));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitAnonymousFunction(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitAnonymousFunction(this, argument);
    }
  }

  /**
   * Body of a method, accessor or operator.  Erroneous code can supply
   * both a block and an expression body, but never neither.
   */
  public static final class MethodBodyOperation extends Operation {
    private final Slot<BlockOperation> blockBody;
    private final Slot<BlockOperation> expressionBody;

    public MethodBodyOperation(OperationInfo info,
        Slot<BlockOperation> blockBody, Slot<BlockOperation> expressionBody) {
      super(OperationKind.METHOD_BODY, info);
      this.blockBody = installOptional(blockBody, "blockBody");
      this.expressionBody = installOptional(expressionBody,
                                            "expressionBody");
      if (blockBody.isMaterialized() && expressionBody.isMaterialized()) {
        checkHasBody(blockBody.get(), expressionBody.get());
      }
      linkChildren();
    }

    private void checkHasBody(BlockOperation block,
                              BlockOperation expression) {
      if (block == null && expression == null) {
        throw new MissingAttributeException(kind(), "blockBody",
            "or expressionBody must be present");
      }
    }

    public BlockOperation blockBody() {
      return blockBody.get();
    }

    public BlockOperation expressionBody() {
      return expressionBody.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      BlockOperation block = blockBody();
      BlockOperation expression = expressionBody();
      checkHasBody(block, expression);
      children.add(block).add(expression);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitMethodBody(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitMethodBody(this, argument);
    }
  }

  /**
   * Body of a constructor, including the call to another constructor
   * when there is one.
   */
  public static final class ConstructorBodyOperation extends Operation {
    private final ImmutableList<LocalSymbol> locals;
    private final Slot<Operation> initializer;
    private final Slot<BlockOperation> blockBody;
    private final Slot<BlockOperation> expressionBody;

    public ConstructorBodyOperation(OperationInfo info,
        List<LocalSymbol> locals, Slot<Operation> initializer,
        Slot<BlockOperation> blockBody, Slot<BlockOperation> expressionBody) {
      super(OperationKind.CONSTRUCTOR_BODY, info);
      this.locals = listOrEmpty(locals);
      this.initializer = installOptional(initializer, "initializer");
      this.blockBody = installOptional(blockBody, "blockBody");
      this.expressionBody = installOptional(expressionBody,
                                            "expressionBody");
      linkChildren();
    }

    /** @return locals declared in the constructor initializer */
    public List<LocalSymbol> locals() {
      return locals;
    }

    /** @return this(...) or base(...) call, null if there isn't one */
    public Operation initializer() {
      return initializer.get();
    }

    public BlockOperation blockBody() {
      return blockBody.get();
    }

    public BlockOperation expressionBody() {
      return expressionBody.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(initializer());
      children.add(blockBody());
      children.add(expressionBody());
    }

    @Override
    protected void describe(StringBuilder sb) {
      TreeUtil.describeLocals(sb, locals);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitConstructorBody(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitConstructorBody(this, argument);
    }
  }
}
