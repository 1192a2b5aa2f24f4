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
import exm.optree.common.lang.Symbols.FieldSymbol;
import exm.optree.common.lang.Symbols.LocalSymbol;
import exm.optree.common.lang.Symbols.ParameterSymbol;
import exm.optree.common.lang.Symbols.PropertySymbol;
import exm.optree.common.lang.Symbols.Symbol;

/**
 * Variable declarations and the initializers of locals, fields,
 * properties and parameters.
 *
 * A declaration statement is a group of declarations, each declaring one
 * or more variables with declarators:
 *
 * Dim a, b As Integer = 1, c As String
 *   group -> declaration (a, b As Integer = 1) -> declarator a
 *                                               -> declarator b
 *                                               -> initializer 1
 *         -> declaration (c As String)         -> declarator c
 */
public class Declarations {

  public static final class VariableDeclarationGroupOperation
                                                      extends Operation {
    private final ListSlot<VariableDeclarationOperation> declarations;

    public VariableDeclarationGroupOperation(OperationInfo info,
        ListSlot<VariableDeclarationOperation> declarations) {
      super(OperationKind.VARIABLE_DECLARATION_GROUP, info);
      this.declarations = install(declarations, "declarations");
      linkChildren();
    }

    public List<VariableDeclarationOperation> declarations() {
      return declarations.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(declarations());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitVariableDeclarationGroup(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitVariableDeclarationGroup(this, argument);
    }
  }

  /**
   * One or more declarators sharing a type.  The initializer here is set
   * when one initializer applies to all declarators.
   */
  public static final class VariableDeclarationOperation extends Operation {
    private final ListSlot<Operation> ignoredDimensions;
    private final ListSlot<VariableDeclaratorOperation> declarators;
    private final Slot<VariableInitializerOperation> initializer;

    public VariableDeclarationOperation(OperationInfo info,
        ListSlot<Operation> ignoredDimensions,
        ListSlot<VariableDeclaratorOperation> declarators,
        Slot<VariableInitializerOperation> initializer) {
      super(OperationKind.VARIABLE_DECLARATION, info);
      this.ignoredDimensions = install(ignoredDimensions,
                                       "ignoredDimensions");
      this.declarators = install(declarators, "declarators");
      this.initializer = installOptional(initializer, "initializer");
      linkChildren();
    }

    /** @return array bounds written on the type and not used */
    public List<Operation> ignoredDimensions() {
      return ignoredDimensions.get();
    }

    public List<VariableDeclaratorOperation> declarators() {
      return declarators.get();
    }

    public VariableInitializerOperation initializer() {
      return initializer.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(ignoredDimensions());
      children.addAll(declarators());
      children.add(initializer());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitVariableDeclaration(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitVariableDeclaration(this, argument);
    }
  }

  public static final class VariableDeclaratorOperation extends Operation {
    private final LocalSymbol symbol;
    private final ListSlot<Operation> ignoredArguments;
    private final Slot<VariableInitializerOperation> initializer;

    public VariableDeclaratorOperation(OperationInfo info,
        LocalSymbol symbol, ListSlot<Operation> ignoredArguments,
        Slot<VariableInitializerOperation> initializer) {
      super(OperationKind.VARIABLE_DECLARATOR, info);
      this.symbol = require(symbol, "symbol");
      this.ignoredArguments = install(ignoredArguments, "ignoredArguments");
      this.initializer = installOptional(initializer, "initializer");
      linkChildren();
    }

    public LocalSymbol symbol() {
      return symbol;
    }

    /** @return array bounds written on the name, as in int a[3] */
    public List<Operation> ignoredArguments() {
      return ignoredArguments.get();
    }

    public VariableInitializerOperation initializer() {
      return initializer.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.addAll(ignoredArguments());
      children.add(initializer());
    }

    @Override
    protected void describe(StringBuilder sb) {
      sb.append(' ');
      sb.append(TreeUtil.name(symbol));
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitVariableDeclarator(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitVariableDeclarator(this, argument);
    }
  }

  /** var x used as an expression, e.g. out var x or (var a, var b) */
  public static final class DeclarationExpressionOperation
                                                      extends Operation {
    private final Slot<Operation> expression;

    public DeclarationExpressionOperation(OperationInfo info,
                                          Slot<Operation> expression) {
      super(OperationKind.DECLARATION_EXPRESSION, info);
      this.expression = install(expression, "expression");
      linkChildren();
    }

    public Operation expression() {
      return expression.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(expression());
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitDeclarationExpression(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitDeclarationExpression(this, argument);
    }
  }

  /**
   * Shared structure of the initializers: a value and the locals
   * declared while computing it.
   */
  public static abstract class SymbolInitializerOperation extends Operation {
    private final ImmutableList<LocalSymbol> locals;
    private final Slot<Operation> value;

    protected SymbolInitializerOperation(OperationKind kind,
        OperationInfo info, List<LocalSymbol> locals, Slot<Operation> value) {
      super(kind, info);
      this.locals = listOrEmpty(locals);
      this.value = install(value, "value");
    }

    public List<LocalSymbol> locals() {
      return locals;
    }

    public Operation value() {
      return value.get();
    }

    @Override
    protected void addChildren(ChildList children) {
      children.add(value());
    }

    protected void describeInitialized(StringBuilder sb,
                                       List<? extends Symbol> symbols) {
      sb.append(' ');
      TreeUtil.prettyPrintSymbolList(sb, symbols);
      TreeUtil.describeLocals(sb, locals);
    }
  }

  public static final class VariableInitializerOperation
                                        extends SymbolInitializerOperation {
    public VariableInitializerOperation(OperationInfo info,
        List<LocalSymbol> locals, Slot<Operation> value) {
      super(OperationKind.VARIABLE_INITIALIZER, info, locals, value);
      linkChildren();
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitVariableInitializer(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitVariableInitializer(this, argument);
    }
  }

  /**
   * Initializer shared by one or more fields, e.g. Dim a, b As New C()
   */
  public static final class FieldInitializerOperation
                                        extends SymbolInitializerOperation {
    private final ImmutableList<FieldSymbol> initializedFields;

    public FieldInitializerOperation(OperationInfo info,
        List<FieldSymbol> initializedFields, List<LocalSymbol> locals,
        Slot<Operation> value) {
      super(OperationKind.FIELD_INITIALIZER, info, locals, value);
      this.initializedFields = requireList(initializedFields,
                                           "initializedFields");
      if (this.initializedFields.isEmpty()) {
        throw new MissingAttributeException(
            OperationKind.FIELD_INITIALIZER, "initializedFields",
            "needs at least one field");
      }
      linkChildren();
    }

    public List<FieldSymbol> initializedFields() {
      return initializedFields;
    }

    @Override
    protected void describe(StringBuilder sb) {
      describeInitialized(sb, initializedFields);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitFieldInitializer(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitFieldInitializer(this, argument);
    }
  }

  public static final class PropertyInitializerOperation
                                        extends SymbolInitializerOperation {
    private final ImmutableList<PropertySymbol> initializedProperties;

    public PropertyInitializerOperation(OperationInfo info,
        List<PropertySymbol> initializedProperties, List<LocalSymbol> locals,
        Slot<Operation> value) {
      super(OperationKind.PROPERTY_INITIALIZER, info, locals, value);
      this.initializedProperties = requireList(initializedProperties,
                                               "initializedProperties");
      if (this.initializedProperties.isEmpty()) {
        throw new MissingAttributeException(
            OperationKind.PROPERTY_INITIALIZER, "initializedProperties",
            "needs at least one property");
      }
      linkChildren();
    }

    public List<PropertySymbol> initializedProperties() {
      return initializedProperties;
    }

    @Override
    protected void describe(StringBuilder sb) {
      describeInitialized(sb, initializedProperties);
    }

    @Override
    public void accept(OperationVisitor visitor) {
      visitor.visitPropertyInitializer(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitPropertyInitializer(this, argument);
    }
  }

  /** Default value of an optional parameter */
  public static final class ParameterInitializerOperation
                                        extends SymbolInitializerOperation {
    private final ParameterSymbol parameter;

    public ParameterInitializerOperation(OperationInfo info,
        ParameterSymbol parameter, List<LocalSymbol> locals,
        Slot<Operation> value) {
      super(OperationKind.PARAMETER_INITIALIZER, info, locals, value);
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
      visitor.visitParameterInitializer(this);
    }

    @Override
    public <A, R> R accept(OperationArgVisitor<A, R> visitor, A argument) {
      return visitor.visitParameterInitializer(this, argument);
    }
  }
}
