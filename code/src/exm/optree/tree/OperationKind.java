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

/**
 * Closed set of operation kinds.  Each kind is represented by exactly one
 * concrete operation class; a few classes represent more than one kind
 * and tell them apart with a discriminator (see the RETURN, INCREMENT and
 * INTERPOLATED_STRING_APPEND groups).
 *
 * Adding a kind means adding a constant here, its class, and one method to
 * each of {@link OperationVisitor} and {@link OperationArgVisitor}.
 */
public enum OperationKind {
  // Values that aren't references
  NONE(Family.VALUE_AND_REFERENCE, Literals.NoneOperation.class),
  INVALID(Family.VALUE_AND_REFERENCE, Literals.InvalidOperation.class),
  LITERAL(Family.VALUE_AND_REFERENCE, Literals.LiteralOperation.class),
  DEFAULT_VALUE(Family.VALUE_AND_REFERENCE,
                Literals.DefaultValueOperation.class),
  TYPE_OF(Family.VALUE_AND_REFERENCE, Literals.TypeOfOperation.class),
  SIZE_OF(Family.VALUE_AND_REFERENCE, Literals.SizeOfOperation.class),
  NAME_OF(Family.VALUE_AND_REFERENCE, Literals.NameOfOperation.class),
  OMITTED_ARGUMENT(Family.VALUE_AND_REFERENCE,
                   Literals.OmittedArgumentOperation.class),
  DISCARD(Family.VALUE_AND_REFERENCE, Literals.DiscardOperation.class),
  PLACEHOLDER(Family.VALUE_AND_REFERENCE,
              Literals.PlaceholderOperation.class),
  UTF8_STRING(Family.VALUE_AND_REFERENCE,
              Literals.Utf8StringOperation.class),

  // References to symbols and storage
  LOCAL_REFERENCE(Family.VALUE_AND_REFERENCE,
                  References.LocalReferenceOperation.class),
  PARAMETER_REFERENCE(Family.VALUE_AND_REFERENCE,
                      References.ParameterReferenceOperation.class),
  FIELD_REFERENCE(Family.VALUE_AND_REFERENCE,
                  References.FieldReferenceOperation.class),
  PROPERTY_REFERENCE(Family.VALUE_AND_REFERENCE,
                     References.PropertyReferenceOperation.class),
  EVENT_REFERENCE(Family.VALUE_AND_REFERENCE,
                  References.EventReferenceOperation.class),
  METHOD_REFERENCE(Family.VALUE_AND_REFERENCE,
                   References.MethodReferenceOperation.class),
  INSTANCE_REFERENCE(Family.VALUE_AND_REFERENCE,
                     References.InstanceReferenceOperation.class),
  ARRAY_ELEMENT_REFERENCE(Family.VALUE_AND_REFERENCE,
                          References.ArrayElementReferenceOperation.class),
  POINTER_INDIRECTION_REFERENCE(Family.VALUE_AND_REFERENCE,
                    References.PointerIndirectionReferenceOperation.class),
  IMPLICIT_INDEXER_REFERENCE(Family.VALUE_AND_REFERENCE,
                    References.ImplicitIndexerReferenceOperation.class),
  INLINE_ARRAY_ACCESS(Family.VALUE_AND_REFERENCE,
                      References.InlineArrayAccessOperation.class),
  CONDITIONAL_ACCESS(Family.VALUE_AND_REFERENCE,
                     References.ConditionalAccessOperation.class),
  CONDITIONAL_ACCESS_INSTANCE(Family.VALUE_AND_REFERENCE,
                      References.ConditionalAccessInstanceOperation.class),
  EVENT_ASSIGNMENT(Family.VALUE_AND_REFERENCE,
                   References.EventAssignmentOperation.class),
  ADDRESS_OF(Family.VALUE_AND_REFERENCE,
             References.AddressOfOperation.class),

  // Operators and assignments
  UNARY(Family.OPERATOR, Operators.UnaryOperation.class),
  BINARY(Family.OPERATOR, Operators.BinaryOperation.class),
  TUPLE_BINARY(Family.OPERATOR, Operators.TupleBinaryOperation.class),
  INCREMENT(Family.OPERATOR, Operators.IncrementOrDecrementOperation.class),
  DECREMENT(Family.OPERATOR, Operators.IncrementOrDecrementOperation.class),
  CONVERSION(Family.OPERATOR, Operators.ConversionOperation.class),
  SIMPLE_ASSIGNMENT(Family.OPERATOR,
                    Operators.SimpleAssignmentOperation.class),
  COMPOUND_ASSIGNMENT(Family.OPERATOR,
                      Operators.CompoundAssignmentOperation.class),
  DECONSTRUCTION_ASSIGNMENT(Family.OPERATOR,
                      Operators.DeconstructionAssignmentOperation.class),
  COALESCE(Family.OPERATOR, Operators.CoalesceOperation.class),
  COALESCE_ASSIGNMENT(Family.OPERATOR,
                      Operators.CoalesceAssignmentOperation.class),
  CONDITIONAL(Family.OPERATOR, Operators.ConditionalOperation.class),
  IS_TYPE(Family.OPERATOR, Operators.IsTypeOperation.class),
  AWAIT(Family.OPERATOR, Operators.AwaitOperation.class),
  THROW(Family.OPERATOR, Operators.ThrowOperation.class),
  PARENTHESIZED(Family.OPERATOR, Operators.ParenthesizedOperation.class),
  TUPLE(Family.OPERATOR, Operators.TupleOperation.class),
  RANGE(Family.OPERATOR, Operators.RangeOperation.class),

  // Statements
  BLOCK(Family.STATEMENT, Statements.BlockOperation.class),
  EMPTY(Family.STATEMENT, Statements.EmptyOperation.class),
  RETURN(Family.STATEMENT, Statements.ReturnOperation.class),
  YIELD_RETURN(Family.STATEMENT, Statements.ReturnOperation.class),
  YIELD_BREAK(Family.STATEMENT, Statements.ReturnOperation.class),
  EXPRESSION_STATEMENT(Family.STATEMENT,
                       Statements.ExpressionStatementOperation.class),
  BRANCH(Family.STATEMENT, Statements.BranchOperation.class),
  LABELED(Family.STATEMENT, Statements.LabeledOperation.class),
  STOP(Family.STATEMENT, Statements.StopOperation.class),
  END(Family.STATEMENT, Statements.EndOperation.class),
  RAISE_EVENT(Family.STATEMENT, Statements.RaiseEventOperation.class),
  LOCAL_FUNCTION(Family.STATEMENT, Statements.LocalFunctionOperation.class),
  RE_DIM(Family.STATEMENT, Statements.ReDimOperation.class),
  RE_DIM_CLAUSE(Family.STATEMENT, Statements.ReDimClauseOperation.class),

  // Loops
  FOR_LOOP(Family.LOOP, Loops.ForLoopOperation.class),
  FOR_EACH_LOOP(Family.LOOP, Loops.ForEachLoopOperation.class),
  FOR_TO_LOOP(Family.LOOP, Loops.ForToLoopOperation.class),
  WHILE_LOOP(Family.LOOP, Loops.WhileLoopOperation.class),

  // Switch statements, case clauses and switch expressions
  SWITCH(Family.SWITCH, Switches.SwitchOperation.class),
  SWITCH_CASE(Family.SWITCH, Switches.SwitchCaseOperation.class),
  SINGLE_VALUE_CASE_CLAUSE(Family.SWITCH,
                      Switches.SingleValueCaseClauseOperation.class),
  RELATIONAL_CASE_CLAUSE(Family.SWITCH,
                      Switches.RelationalCaseClauseOperation.class),
  RANGE_CASE_CLAUSE(Family.SWITCH, Switches.RangeCaseClauseOperation.class),
  DEFAULT_CASE_CLAUSE(Family.SWITCH,
                      Switches.DefaultCaseClauseOperation.class),
  PATTERN_CASE_CLAUSE(Family.SWITCH,
                      Switches.PatternCaseClauseOperation.class),
  SWITCH_EXPRESSION(Family.SWITCH, Switches.SwitchExpressionOperation.class),
  SWITCH_EXPRESSION_ARM(Family.SWITCH,
                      Switches.SwitchExpressionArmOperation.class),

  // Exception handling and scoped resources
  TRY(Family.EXCEPTION_AND_RESOURCE, TryStatements.TryOperation.class),
  CATCH_CLAUSE(Family.EXCEPTION_AND_RESOURCE,
               TryStatements.CatchClauseOperation.class),
  USING(Family.EXCEPTION_AND_RESOURCE,
        ResourceStatements.UsingOperation.class),
  USING_DECLARATION(Family.EXCEPTION_AND_RESOURCE,
        ResourceStatements.UsingDeclarationOperation.class),
  LOCK(Family.EXCEPTION_AND_RESOURCE,
       ResourceStatements.LockOperation.class),
  FIXED(Family.EXCEPTION_AND_RESOURCE,
        ResourceStatements.FixedOperation.class),
  WITH_STATEMENT(Family.EXCEPTION_AND_RESOURCE,
                 ResourceStatements.WithStatementOperation.class),

  // Declarations and symbol initializers
  VARIABLE_DECLARATION_GROUP(Family.DECLARATION,
                Declarations.VariableDeclarationGroupOperation.class),
  VARIABLE_DECLARATION(Family.DECLARATION,
                Declarations.VariableDeclarationOperation.class),
  VARIABLE_DECLARATOR(Family.DECLARATION,
                Declarations.VariableDeclaratorOperation.class),
  DECLARATION_EXPRESSION(Family.DECLARATION,
                Declarations.DeclarationExpressionOperation.class),
  VARIABLE_INITIALIZER(Family.DECLARATION,
                Declarations.VariableInitializerOperation.class),
  FIELD_INITIALIZER(Family.DECLARATION,
                Declarations.FieldInitializerOperation.class),
  PROPERTY_INITIALIZER(Family.DECLARATION,
                Declarations.PropertyInitializerOperation.class),
  PARAMETER_INITIALIZER(Family.DECLARATION,
                Declarations.ParameterInitializerOperation.class),

  // Object, array and delegate creation
  OBJECT_CREATION(Family.CREATION, Creations.ObjectCreationOperation.class),
  TYPE_PARAMETER_OBJECT_CREATION(Family.CREATION,
                Creations.TypeParameterObjectCreationOperation.class),
  INTEROP_OBJECT_CREATION(Family.CREATION,
                Creations.InteropObjectCreationOperation.class),
  ANONYMOUS_OBJECT_CREATION(Family.CREATION,
                Creations.AnonymousObjectCreationOperation.class),
  ARRAY_CREATION(Family.CREATION, Creations.ArrayCreationOperation.class),
  ARRAY_INITIALIZER(Family.CREATION,
                Creations.ArrayInitializerOperation.class),
  OBJECT_OR_COLLECTION_INITIALIZER(Family.CREATION,
                Creations.ObjectOrCollectionInitializerOperation.class),
  MEMBER_INITIALIZER(Family.CREATION,
                Creations.MemberInitializerOperation.class),
  COLLECTION_ELEMENT_INITIALIZER(Family.CREATION,
                Creations.CollectionElementInitializerOperation.class),
  DELEGATE_CREATION(Family.CREATION,
                Creations.DelegateCreationOperation.class),
  WITH(Family.CREATION, Creations.WithOperation.class),
  COLLECTION_EXPRESSION(Family.CREATION,
                Creations.CollectionExpressionOperation.class),
  SPREAD(Family.CREATION, Creations.SpreadOperation.class),

  // Calls and arguments
  INVOCATION(Family.INVOCATION, Invocations.InvocationOperation.class),
  ARGUMENT(Family.INVOCATION, Invocations.ArgumentOperation.class),
  FUNCTION_POINTER_INVOCATION(Family.INVOCATION,
                Invocations.FunctionPointerInvocationOperation.class),
  ATTRIBUTE(Family.INVOCATION, Invocations.AttributeOperation.class),

  // Late-bound counterparts, resolved at run time
  DYNAMIC_OBJECT_CREATION(Family.DYNAMIC,
                Dynamics.DynamicObjectCreationOperation.class),
  DYNAMIC_INVOCATION(Family.DYNAMIC,
                Dynamics.DynamicInvocationOperation.class),
  DYNAMIC_INDEXER_ACCESS(Family.DYNAMIC,
                Dynamics.DynamicIndexerAccessOperation.class),
  DYNAMIC_MEMBER_REFERENCE(Family.DYNAMIC,
                Dynamics.DynamicMemberReferenceOperation.class),

  // Pattern matching
  IS_PATTERN(Family.PATTERN, Patterns.IsPatternOperation.class),
  CONSTANT_PATTERN(Family.PATTERN, Patterns.ConstantPatternOperation.class),
  DECLARATION_PATTERN(Family.PATTERN,
                Patterns.DeclarationPatternOperation.class),
  TYPE_PATTERN(Family.PATTERN, Patterns.TypePatternOperation.class),
  DISCARD_PATTERN(Family.PATTERN, Patterns.DiscardPatternOperation.class),
  RECURSIVE_PATTERN(Family.PATTERN,
                Patterns.RecursivePatternOperation.class),
  PROPERTY_SUBPATTERN(Family.PATTERN,
                Patterns.PropertySubpatternOperation.class),
  RELATIONAL_PATTERN(Family.PATTERN,
                Patterns.RelationalPatternOperation.class),
  NEGATED_PATTERN(Family.PATTERN, Patterns.NegatedPatternOperation.class),
  BINARY_PATTERN(Family.PATTERN, Patterns.BinaryPatternOperation.class),
  LIST_PATTERN(Family.PATTERN, Patterns.ListPatternOperation.class),
  SLICE_PATTERN(Family.PATTERN, Patterns.SlicePatternOperation.class),

  // Interpolated strings
  INTERPOLATED_STRING(Family.INTERPOLATION,
                Interpolations.InterpolatedStringOperation.class),
  INTERPOLATED_STRING_TEXT(Family.INTERPOLATION,
                Interpolations.InterpolatedStringTextOperation.class),
  INTERPOLATION(Family.INTERPOLATION,
                Interpolations.InterpolationOperation.class),
  INTERPOLATED_STRING_HANDLER_CREATION(Family.INTERPOLATION,
        Interpolations.InterpolatedStringHandlerCreationOperation.class),
  INTERPOLATED_STRING_ADDITION(Family.INTERPOLATION,
        Interpolations.InterpolatedStringAdditionOperation.class),
  INTERPOLATED_STRING_APPEND_LITERAL(Family.INTERPOLATION,
        Interpolations.InterpolatedStringAppendOperation.class),
  INTERPOLATED_STRING_APPEND_FORMATTED(Family.INTERPOLATION,
        Interpolations.InterpolatedStringAppendOperation.class),
  INTERPOLATED_STRING_APPEND_INVALID(Family.INTERPOLATION,
        Interpolations.InterpolatedStringAppendOperation.class),
  INTERPOLATED_STRING_HANDLER_ARGUMENT_PLACEHOLDER(Family.INTERPOLATION,
  Interpolations.InterpolatedStringHandlerArgumentPlaceholderOperation.class),

  // Query translations and member bodies
  TRANSLATED_QUERY(Family.QUERY_AND_BODY,
                   Bodies.TranslatedQueryOperation.class),
  ANONYMOUS_FUNCTION(Family.QUERY_AND_BODY,
                     Bodies.AnonymousFunctionOperation.class),
  METHOD_BODY(Family.QUERY_AND_BODY, Bodies.MethodBodyOperation.class),
  CONSTRUCTOR_BODY(Family.QUERY_AND_BODY,
                   Bodies.ConstructorBodyOperation.class),

  // Only created by the flow graph builder
  FLOW_CAPTURE(Family.FLOW, FlowOperations.FlowCaptureOperation.class),
  FLOW_CAPTURE_REFERENCE(Family.FLOW,
                FlowOperations.FlowCaptureReferenceOperation.class),
  IS_NULL(Family.FLOW, FlowOperations.IsNullOperation.class),
  CAUGHT_EXCEPTION(Family.FLOW,
                FlowOperations.CaughtExceptionOperation.class),
  FLOW_ANONYMOUS_FUNCTION(Family.FLOW,
                FlowOperations.FlowAnonymousFunctionOperation.class),
  STATIC_LOCAL_INITIALIZATION_SEMAPHORE(Family.FLOW,
        FlowOperations.StaticLocalInitializationSemaphoreOperation.class),
  ;

  /**
   * Structural grouping of kinds
   */
  public static enum Family {
    VALUE_AND_REFERENCE,
    OPERATOR,
    STATEMENT,
    LOOP,
    SWITCH,
    EXCEPTION_AND_RESOURCE,
    DECLARATION,
    CREATION,
    INVOCATION,
    DYNAMIC,
    PATTERN,
    INTERPOLATION,
    QUERY_AND_BODY,
    FLOW,
  }

  private final Family family;
  private final Class<? extends Operation> shape;

  private OperationKind(Family family, Class<? extends Operation> shape) {
    this.family = family;
    this.shape = shape;
  }

  public Family family() {
    return family;
  }

  /**
   * @return the concrete class representing operations of this kind
   */
  public Class<? extends Operation> shape() {
    return shape;
  }

  /**
   * @return true if only the flow graph builder creates this kind
   */
  public boolean isFlowOnly() {
    return family == Family.FLOW;
  }
}
