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

import exm.optree.tree.Bodies.AnonymousFunctionOperation;
import exm.optree.tree.Bodies.ConstructorBodyOperation;
import exm.optree.tree.Bodies.MethodBodyOperation;
import exm.optree.tree.Bodies.TranslatedQueryOperation;
import exm.optree.tree.Creations.AnonymousObjectCreationOperation;
import exm.optree.tree.Creations.ArrayCreationOperation;
import exm.optree.tree.Creations.ArrayInitializerOperation;
import exm.optree.tree.Creations.CollectionElementInitializerOperation;
import exm.optree.tree.Creations.CollectionExpressionOperation;
import exm.optree.tree.Creations.DelegateCreationOperation;
import exm.optree.tree.Creations.InteropObjectCreationOperation;
import exm.optree.tree.Creations.MemberInitializerOperation;
import exm.optree.tree.Creations.ObjectCreationOperation;
import exm.optree.tree.Creations.ObjectOrCollectionInitializerOperation;
import exm.optree.tree.Creations.SpreadOperation;
import exm.optree.tree.Creations.TypeParameterObjectCreationOperation;
import exm.optree.tree.Creations.WithOperation;
import exm.optree.tree.Declarations.DeclarationExpressionOperation;
import exm.optree.tree.Declarations.FieldInitializerOperation;
import exm.optree.tree.Declarations.ParameterInitializerOperation;
import exm.optree.tree.Declarations.PropertyInitializerOperation;
import exm.optree.tree.Declarations.VariableDeclarationGroupOperation;
import exm.optree.tree.Declarations.VariableDeclarationOperation;
import exm.optree.tree.Declarations.VariableDeclaratorOperation;
import exm.optree.tree.Declarations.VariableInitializerOperation;
import exm.optree.tree.Dynamics.DynamicIndexerAccessOperation;
import exm.optree.tree.Dynamics.DynamicInvocationOperation;
import exm.optree.tree.Dynamics.DynamicMemberReferenceOperation;
import exm.optree.tree.Dynamics.DynamicObjectCreationOperation;
import exm.optree.tree.FlowOperations.CaughtExceptionOperation;
import exm.optree.tree.FlowOperations.FlowAnonymousFunctionOperation;
import exm.optree.tree.FlowOperations.FlowCaptureOperation;
import exm.optree.tree.FlowOperations.FlowCaptureReferenceOperation;
import exm.optree.tree.FlowOperations.IsNullOperation;
import exm.optree.tree.FlowOperations.StaticLocalInitializationSemaphoreOperation;
import exm.optree.tree.Interpolations.InterpolatedStringAdditionOperation;
import exm.optree.tree.Interpolations.InterpolatedStringAppendOperation;
import exm.optree.tree.Interpolations.InterpolatedStringHandlerArgumentPlaceholderOperation;
import exm.optree.tree.Interpolations.InterpolatedStringHandlerCreationOperation;
import exm.optree.tree.Interpolations.InterpolatedStringOperation;
import exm.optree.tree.Interpolations.InterpolatedStringTextOperation;
import exm.optree.tree.Interpolations.InterpolationOperation;
import exm.optree.tree.Invocations.ArgumentOperation;
import exm.optree.tree.Invocations.AttributeOperation;
import exm.optree.tree.Invocations.FunctionPointerInvocationOperation;
import exm.optree.tree.Invocations.InvocationOperation;
import exm.optree.tree.Literals.DefaultValueOperation;
import exm.optree.tree.Literals.DiscardOperation;
import exm.optree.tree.Literals.InvalidOperation;
import exm.optree.tree.Literals.LiteralOperation;
import exm.optree.tree.Literals.NameOfOperation;
import exm.optree.tree.Literals.NoneOperation;
import exm.optree.tree.Literals.OmittedArgumentOperation;
import exm.optree.tree.Literals.PlaceholderOperation;
import exm.optree.tree.Literals.SizeOfOperation;
import exm.optree.tree.Literals.TypeOfOperation;
import exm.optree.tree.Literals.Utf8StringOperation;
import exm.optree.tree.Loops.ForEachLoopOperation;
import exm.optree.tree.Loops.ForLoopOperation;
import exm.optree.tree.Loops.ForToLoopOperation;
import exm.optree.tree.Loops.WhileLoopOperation;
import exm.optree.tree.Operators.AwaitOperation;
import exm.optree.tree.Operators.BinaryOperation;
import exm.optree.tree.Operators.CoalesceAssignmentOperation;
import exm.optree.tree.Operators.CoalesceOperation;
import exm.optree.tree.Operators.CompoundAssignmentOperation;
import exm.optree.tree.Operators.ConditionalOperation;
import exm.optree.tree.Operators.ConversionOperation;
import exm.optree.tree.Operators.DeconstructionAssignmentOperation;
import exm.optree.tree.Operators.IncrementOrDecrementOperation;
import exm.optree.tree.Operators.IsTypeOperation;
import exm.optree.tree.Operators.ParenthesizedOperation;
import exm.optree.tree.Operators.RangeOperation;
import exm.optree.tree.Operators.SimpleAssignmentOperation;
import exm.optree.tree.Operators.ThrowOperation;
import exm.optree.tree.Operators.TupleBinaryOperation;
import exm.optree.tree.Operators.TupleOperation;
import exm.optree.tree.Operators.UnaryOperation;
import exm.optree.tree.Patterns.BinaryPatternOperation;
import exm.optree.tree.Patterns.ConstantPatternOperation;
import exm.optree.tree.Patterns.DeclarationPatternOperation;
import exm.optree.tree.Patterns.DiscardPatternOperation;
import exm.optree.tree.Patterns.IsPatternOperation;
import exm.optree.tree.Patterns.ListPatternOperation;
import exm.optree.tree.Patterns.NegatedPatternOperation;
import exm.optree.tree.Patterns.PropertySubpatternOperation;
import exm.optree.tree.Patterns.RecursivePatternOperation;
import exm.optree.tree.Patterns.RelationalPatternOperation;
import exm.optree.tree.Patterns.SlicePatternOperation;
import exm.optree.tree.Patterns.TypePatternOperation;
import exm.optree.tree.References.AddressOfOperation;
import exm.optree.tree.References.ArrayElementReferenceOperation;
import exm.optree.tree.References.ConditionalAccessInstanceOperation;
import exm.optree.tree.References.ConditionalAccessOperation;
import exm.optree.tree.References.EventAssignmentOperation;
import exm.optree.tree.References.EventReferenceOperation;
import exm.optree.tree.References.FieldReferenceOperation;
import exm.optree.tree.References.ImplicitIndexerReferenceOperation;
import exm.optree.tree.References.InlineArrayAccessOperation;
import exm.optree.tree.References.InstanceReferenceOperation;
import exm.optree.tree.References.LocalReferenceOperation;
import exm.optree.tree.References.MethodReferenceOperation;
import exm.optree.tree.References.ParameterReferenceOperation;
import exm.optree.tree.References.PointerIndirectionReferenceOperation;
import exm.optree.tree.References.PropertyReferenceOperation;
import exm.optree.tree.ResourceStatements.FixedOperation;
import exm.optree.tree.ResourceStatements.LockOperation;
import exm.optree.tree.ResourceStatements.UsingDeclarationOperation;
import exm.optree.tree.ResourceStatements.UsingOperation;
import exm.optree.tree.ResourceStatements.WithStatementOperation;
import exm.optree.tree.Statements.BlockOperation;
import exm.optree.tree.Statements.BranchOperation;
import exm.optree.tree.Statements.EmptyOperation;
import exm.optree.tree.Statements.EndOperation;
import exm.optree.tree.Statements.ExpressionStatementOperation;
import exm.optree.tree.Statements.LabeledOperation;
import exm.optree.tree.Statements.LocalFunctionOperation;
import exm.optree.tree.Statements.RaiseEventOperation;
import exm.optree.tree.Statements.ReDimClauseOperation;
import exm.optree.tree.Statements.ReDimOperation;
import exm.optree.tree.Statements.ReturnOperation;
import exm.optree.tree.Statements.StopOperation;
import exm.optree.tree.Switches.DefaultCaseClauseOperation;
import exm.optree.tree.Switches.PatternCaseClauseOperation;
import exm.optree.tree.Switches.RangeCaseClauseOperation;
import exm.optree.tree.Switches.RelationalCaseClauseOperation;
import exm.optree.tree.Switches.SingleValueCaseClauseOperation;
import exm.optree.tree.Switches.SwitchCaseOperation;
import exm.optree.tree.Switches.SwitchExpressionArmOperation;
import exm.optree.tree.Switches.SwitchExpressionOperation;
import exm.optree.tree.Switches.SwitchOperation;
import exm.optree.tree.TryStatements.CatchClauseOperation;
import exm.optree.tree.TryStatements.TryOperation;

/**
 * Visitor over operations that threads an argument through the walk and
 * returns a result.
 *
 * @param <A> argument type
 * @param <R> result type
 */
public interface OperationArgVisitor<A, R> {
  // Literals
  R visitNone(NoneOperation op, A arg);
  R visitInvalid(InvalidOperation op, A arg);
  R visitLiteral(LiteralOperation op, A arg);
  R visitDefaultValue(DefaultValueOperation op, A arg);
  R visitTypeOf(TypeOfOperation op, A arg);
  R visitSizeOf(SizeOfOperation op, A arg);
  R visitNameOf(NameOfOperation op, A arg);
  R visitOmittedArgument(OmittedArgumentOperation op, A arg);
  R visitDiscard(DiscardOperation op, A arg);
  R visitPlaceholder(PlaceholderOperation op, A arg);
  R visitUtf8String(Utf8StringOperation op, A arg);

  // References
  R visitLocalReference(LocalReferenceOperation op, A arg);
  R visitParameterReference(ParameterReferenceOperation op, A arg);
  R visitFieldReference(FieldReferenceOperation op, A arg);
  R visitPropertyReference(PropertyReferenceOperation op, A arg);
  R visitEventReference(EventReferenceOperation op, A arg);
  R visitMethodReference(MethodReferenceOperation op, A arg);
  R visitInstanceReference(InstanceReferenceOperation op, A arg);
  R visitArrayElementReference(ArrayElementReferenceOperation op, A arg);
  R visitPointerIndirectionReference(
      PointerIndirectionReferenceOperation op, A arg);
  R visitImplicitIndexerReference(ImplicitIndexerReferenceOperation op, A arg);
  R visitInlineArrayAccess(InlineArrayAccessOperation op, A arg);
  R visitConditionalAccess(ConditionalAccessOperation op, A arg);
  R visitConditionalAccessInstance(
      ConditionalAccessInstanceOperation op, A arg);
  R visitEventAssignment(EventAssignmentOperation op, A arg);
  R visitAddressOf(AddressOfOperation op, A arg);

  // Operators
  R visitUnary(UnaryOperation op, A arg);
  R visitBinary(BinaryOperation op, A arg);
  R visitTupleBinary(TupleBinaryOperation op, A arg);
  R visitIncrementOrDecrement(IncrementOrDecrementOperation op, A arg);
  R visitConversion(ConversionOperation op, A arg);
  R visitSimpleAssignment(SimpleAssignmentOperation op, A arg);
  R visitCompoundAssignment(CompoundAssignmentOperation op, A arg);
  R visitDeconstructionAssignment(DeconstructionAssignmentOperation op, A arg);
  R visitCoalesce(CoalesceOperation op, A arg);
  R visitCoalesceAssignment(CoalesceAssignmentOperation op, A arg);
  R visitConditional(ConditionalOperation op, A arg);
  R visitIsType(IsTypeOperation op, A arg);
  R visitAwait(AwaitOperation op, A arg);
  R visitThrow(ThrowOperation op, A arg);
  R visitParenthesized(ParenthesizedOperation op, A arg);
  R visitTuple(TupleOperation op, A arg);
  R visitRange(RangeOperation op, A arg);

  // Statements
  R visitBlock(BlockOperation op, A arg);
  R visitEmpty(EmptyOperation op, A arg);
  R visitReturn(ReturnOperation op, A arg);
  R visitExpressionStatement(ExpressionStatementOperation op, A arg);
  R visitBranch(BranchOperation op, A arg);
  R visitLabeled(LabeledOperation op, A arg);
  R visitStop(StopOperation op, A arg);
  R visitEnd(EndOperation op, A arg);
  R visitRaiseEvent(RaiseEventOperation op, A arg);
  R visitLocalFunction(LocalFunctionOperation op, A arg);
  R visitReDim(ReDimOperation op, A arg);
  R visitReDimClause(ReDimClauseOperation op, A arg);

  // Loops
  R visitForLoop(ForLoopOperation op, A arg);
  R visitForEachLoop(ForEachLoopOperation op, A arg);
  R visitForToLoop(ForToLoopOperation op, A arg);
  R visitWhileLoop(WhileLoopOperation op, A arg);

  // Switches
  R visitSwitch(SwitchOperation op, A arg);
  R visitSwitchCase(SwitchCaseOperation op, A arg);
  R visitSingleValueCaseClause(SingleValueCaseClauseOperation op, A arg);
  R visitRelationalCaseClause(RelationalCaseClauseOperation op, A arg);
  R visitRangeCaseClause(RangeCaseClauseOperation op, A arg);
  R visitDefaultCaseClause(DefaultCaseClauseOperation op, A arg);
  R visitPatternCaseClause(PatternCaseClauseOperation op, A arg);
  R visitSwitchExpression(SwitchExpressionOperation op, A arg);
  R visitSwitchExpressionArm(SwitchExpressionArmOperation op, A arg);

  // TryStatements
  R visitTry(TryOperation op, A arg);
  R visitCatchClause(CatchClauseOperation op, A arg);

  // ResourceStatements
  R visitUsing(UsingOperation op, A arg);
  R visitUsingDeclaration(UsingDeclarationOperation op, A arg);
  R visitLock(LockOperation op, A arg);
  R visitFixed(FixedOperation op, A arg);
  R visitWithStatement(WithStatementOperation op, A arg);

  // Declarations
  R visitVariableDeclarationGroup(VariableDeclarationGroupOperation op, A arg);
  R visitVariableDeclaration(VariableDeclarationOperation op, A arg);
  R visitVariableDeclarator(VariableDeclaratorOperation op, A arg);
  R visitDeclarationExpression(DeclarationExpressionOperation op, A arg);
  R visitVariableInitializer(VariableInitializerOperation op, A arg);
  R visitFieldInitializer(FieldInitializerOperation op, A arg);
  R visitPropertyInitializer(PropertyInitializerOperation op, A arg);
  R visitParameterInitializer(ParameterInitializerOperation op, A arg);

  // Creations
  R visitObjectCreation(ObjectCreationOperation op, A arg);
  R visitTypeParameterObjectCreation(
      TypeParameterObjectCreationOperation op, A arg);
  R visitInteropObjectCreation(InteropObjectCreationOperation op, A arg);
  R visitAnonymousObjectCreation(AnonymousObjectCreationOperation op, A arg);
  R visitArrayCreation(ArrayCreationOperation op, A arg);
  R visitArrayInitializer(ArrayInitializerOperation op, A arg);
  R visitObjectOrCollectionInitializer(
      ObjectOrCollectionInitializerOperation op, A arg);
  R visitMemberInitializer(MemberInitializerOperation op, A arg);
  R visitCollectionElementInitializer(
      CollectionElementInitializerOperation op, A arg);
  R visitDelegateCreation(DelegateCreationOperation op, A arg);
  R visitWith(WithOperation op, A arg);
  R visitCollectionExpression(CollectionExpressionOperation op, A arg);
  R visitSpread(SpreadOperation op, A arg);

  // Invocations
  R visitInvocation(InvocationOperation op, A arg);
  R visitArgument(ArgumentOperation op, A arg);
  R visitFunctionPointerInvocation(
      FunctionPointerInvocationOperation op, A arg);
  R visitAttribute(AttributeOperation op, A arg);

  // Dynamics
  R visitDynamicObjectCreation(DynamicObjectCreationOperation op, A arg);
  R visitDynamicInvocation(DynamicInvocationOperation op, A arg);
  R visitDynamicIndexerAccess(DynamicIndexerAccessOperation op, A arg);
  R visitDynamicMemberReference(DynamicMemberReferenceOperation op, A arg);

  // Patterns
  R visitIsPattern(IsPatternOperation op, A arg);
  R visitConstantPattern(ConstantPatternOperation op, A arg);
  R visitDeclarationPattern(DeclarationPatternOperation op, A arg);
  R visitTypePattern(TypePatternOperation op, A arg);
  R visitDiscardPattern(DiscardPatternOperation op, A arg);
  R visitRecursivePattern(RecursivePatternOperation op, A arg);
  R visitPropertySubpattern(PropertySubpatternOperation op, A arg);
  R visitRelationalPattern(RelationalPatternOperation op, A arg);
  R visitNegatedPattern(NegatedPatternOperation op, A arg);
  R visitBinaryPattern(BinaryPatternOperation op, A arg);
  R visitListPattern(ListPatternOperation op, A arg);
  R visitSlicePattern(SlicePatternOperation op, A arg);

  // Interpolations
  R visitInterpolatedString(InterpolatedStringOperation op, A arg);
  R visitInterpolatedStringText(InterpolatedStringTextOperation op, A arg);
  R visitInterpolation(InterpolationOperation op, A arg);
  R visitInterpolatedStringHandlerCreation(
      InterpolatedStringHandlerCreationOperation op, A arg);
  R visitInterpolatedStringAddition(
      InterpolatedStringAdditionOperation op, A arg);
  R visitInterpolatedStringAppend(InterpolatedStringAppendOperation op, A arg);
  R visitInterpolatedStringHandlerArgumentPlaceholder(
      InterpolatedStringHandlerArgumentPlaceholderOperation op, A arg);

  // Bodies
  R visitTranslatedQuery(TranslatedQueryOperation op, A arg);
  R visitAnonymousFunction(AnonymousFunctionOperation op, A arg);
  R visitMethodBody(MethodBodyOperation op, A arg);
  R visitConstructorBody(ConstructorBodyOperation op, A arg);

  // FlowOperations
  R visitFlowCapture(FlowCaptureOperation op, A arg);
  R visitFlowCaptureReference(FlowCaptureReferenceOperation op, A arg);
  R visitIsNull(IsNullOperation op, A arg);
  R visitCaughtException(CaughtExceptionOperation op, A arg);
  R visitFlowAnonymousFunction(FlowAnonymousFunctionOperation op, A arg);
  R visitStaticLocalInitializationSemaphore(
      StaticLocalInitializationSemaphoreOperation op, A arg);
}
