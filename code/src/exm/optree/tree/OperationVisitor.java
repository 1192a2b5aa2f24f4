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
 * Visitor over operations with no argument or result.  Each concrete
 * operation class calls exactly one of these methods from
 * {@link Operation#accept(OperationVisitor)}.
 *
 * There are no default implementations: a new operation class adds a
 * method here, and every visitor has to handle it before it compiles.
 */
public interface OperationVisitor {
  // Literals
  void visitNone(NoneOperation op);
  void visitInvalid(InvalidOperation op);
  void visitLiteral(LiteralOperation op);
  void visitDefaultValue(DefaultValueOperation op);
  void visitTypeOf(TypeOfOperation op);
  void visitSizeOf(SizeOfOperation op);
  void visitNameOf(NameOfOperation op);
  void visitOmittedArgument(OmittedArgumentOperation op);
  void visitDiscard(DiscardOperation op);
  void visitPlaceholder(PlaceholderOperation op);
  void visitUtf8String(Utf8StringOperation op);

  // References
  void visitLocalReference(LocalReferenceOperation op);
  void visitParameterReference(ParameterReferenceOperation op);
  void visitFieldReference(FieldReferenceOperation op);
  void visitPropertyReference(PropertyReferenceOperation op);
  void visitEventReference(EventReferenceOperation op);
  void visitMethodReference(MethodReferenceOperation op);
  void visitInstanceReference(InstanceReferenceOperation op);
  void visitArrayElementReference(ArrayElementReferenceOperation op);
  void visitPointerIndirectionReference(
      PointerIndirectionReferenceOperation op);
  void visitImplicitIndexerReference(ImplicitIndexerReferenceOperation op);
  void visitInlineArrayAccess(InlineArrayAccessOperation op);
  void visitConditionalAccess(ConditionalAccessOperation op);
  void visitConditionalAccessInstance(ConditionalAccessInstanceOperation op);
  void visitEventAssignment(EventAssignmentOperation op);
  void visitAddressOf(AddressOfOperation op);

  // Operators
  void visitUnary(UnaryOperation op);
  void visitBinary(BinaryOperation op);
  void visitTupleBinary(TupleBinaryOperation op);
  void visitIncrementOrDecrement(IncrementOrDecrementOperation op);
  void visitConversion(ConversionOperation op);
  void visitSimpleAssignment(SimpleAssignmentOperation op);
  void visitCompoundAssignment(CompoundAssignmentOperation op);
  void visitDeconstructionAssignment(DeconstructionAssignmentOperation op);
  void visitCoalesce(CoalesceOperation op);
  void visitCoalesceAssignment(CoalesceAssignmentOperation op);
  void visitConditional(ConditionalOperation op);
  void visitIsType(IsTypeOperation op);
  void visitAwait(AwaitOperation op);
  void visitThrow(ThrowOperation op);
  void visitParenthesized(ParenthesizedOperation op);
  void visitTuple(TupleOperation op);
  void visitRange(RangeOperation op);

  // Statements
  void visitBlock(BlockOperation op);
  void visitEmpty(EmptyOperation op);
  void visitReturn(ReturnOperation op);
  void visitExpressionStatement(ExpressionStatementOperation op);
  void visitBranch(BranchOperation op);
  void visitLabeled(LabeledOperation op);
  void visitStop(StopOperation op);
  void visitEnd(EndOperation op);
  void visitRaiseEvent(RaiseEventOperation op);
  void visitLocalFunction(LocalFunctionOperation op);
  void visitReDim(ReDimOperation op);
  void visitReDimClause(ReDimClauseOperation op);

  // Loops
  void visitForLoop(ForLoopOperation op);
  void visitForEachLoop(ForEachLoopOperation op);
  void visitForToLoop(ForToLoopOperation op);
  void visitWhileLoop(WhileLoopOperation op);

  // Switches
  void visitSwitch(SwitchOperation op);
  void visitSwitchCase(SwitchCaseOperation op);
  void visitSingleValueCaseClause(SingleValueCaseClauseOperation op);
  void visitRelationalCaseClause(RelationalCaseClauseOperation op);
  void visitRangeCaseClause(RangeCaseClauseOperation op);
  void visitDefaultCaseClause(DefaultCaseClauseOperation op);
  void visitPatternCaseClause(PatternCaseClauseOperation op);
  void visitSwitchExpression(SwitchExpressionOperation op);
  void visitSwitchExpressionArm(SwitchExpressionArmOperation op);

  // TryStatements
  void visitTry(TryOperation op);
  void visitCatchClause(CatchClauseOperation op);

  // ResourceStatements
  void visitUsing(UsingOperation op);
  void visitUsingDeclaration(UsingDeclarationOperation op);
  void visitLock(LockOperation op);
  void visitFixed(FixedOperation op);
  void visitWithStatement(WithStatementOperation op);

  // Declarations
  void visitVariableDeclarationGroup(VariableDeclarationGroupOperation op);
  void visitVariableDeclaration(VariableDeclarationOperation op);
  void visitVariableDeclarator(VariableDeclaratorOperation op);
  void visitDeclarationExpression(DeclarationExpressionOperation op);
  void visitVariableInitializer(VariableInitializerOperation op);
  void visitFieldInitializer(FieldInitializerOperation op);
  void visitPropertyInitializer(PropertyInitializerOperation op);
  void visitParameterInitializer(ParameterInitializerOperation op);

  // Creations
  void visitObjectCreation(ObjectCreationOperation op);
  void visitTypeParameterObjectCreation(
      TypeParameterObjectCreationOperation op);
  void visitInteropObjectCreation(InteropObjectCreationOperation op);
  void visitAnonymousObjectCreation(AnonymousObjectCreationOperation op);
  void visitArrayCreation(ArrayCreationOperation op);
  void visitArrayInitializer(ArrayInitializerOperation op);
  void visitObjectOrCollectionInitializer(
      ObjectOrCollectionInitializerOperation op);
  void visitMemberInitializer(MemberInitializerOperation op);
  void visitCollectionElementInitializer(
      CollectionElementInitializerOperation op);
  void visitDelegateCreation(DelegateCreationOperation op);
  void visitWith(WithOperation op);
  void visitCollectionExpression(CollectionExpressionOperation op);
  void visitSpread(SpreadOperation op);

  // Invocations
  void visitInvocation(InvocationOperation op);
  void visitArgument(ArgumentOperation op);
  void visitFunctionPointerInvocation(FunctionPointerInvocationOperation op);
  void visitAttribute(AttributeOperation op);

  // Dynamics
  void visitDynamicObjectCreation(DynamicObjectCreationOperation op);
  void visitDynamicInvocation(DynamicInvocationOperation op);
  void visitDynamicIndexerAccess(DynamicIndexerAccessOperation op);
  void visitDynamicMemberReference(DynamicMemberReferenceOperation op);

  // Patterns
  void visitIsPattern(IsPatternOperation op);
  void visitConstantPattern(ConstantPatternOperation op);
  void visitDeclarationPattern(DeclarationPatternOperation op);
  void visitTypePattern(TypePatternOperation op);
  void visitDiscardPattern(DiscardPatternOperation op);
  void visitRecursivePattern(RecursivePatternOperation op);
  void visitPropertySubpattern(PropertySubpatternOperation op);
  void visitRelationalPattern(RelationalPatternOperation op);
  void visitNegatedPattern(NegatedPatternOperation op);
  void visitBinaryPattern(BinaryPatternOperation op);
  void visitListPattern(ListPatternOperation op);
  void visitSlicePattern(SlicePatternOperation op);

  // Interpolations
  void visitInterpolatedString(InterpolatedStringOperation op);
  void visitInterpolatedStringText(InterpolatedStringTextOperation op);
  void visitInterpolation(InterpolationOperation op);
  void visitInterpolatedStringHandlerCreation(
      InterpolatedStringHandlerCreationOperation op);
  void visitInterpolatedStringAddition(InterpolatedStringAdditionOperation op);
  void visitInterpolatedStringAppend(InterpolatedStringAppendOperation op);
  void visitInterpolatedStringHandlerArgumentPlaceholder(
      InterpolatedStringHandlerArgumentPlaceholderOperation op);

  // Bodies
  void visitTranslatedQuery(TranslatedQueryOperation op);
  void visitAnonymousFunction(AnonymousFunctionOperation op);
  void visitMethodBody(MethodBodyOperation op);
  void visitConstructorBody(ConstructorBodyOperation op);

  // FlowOperations
  void visitFlowCapture(FlowCaptureOperation op);
  void visitFlowCaptureReference(FlowCaptureReferenceOperation op);
  void visitIsNull(IsNullOperation op);
  void visitCaughtException(CaughtExceptionOperation op);
  void visitFlowAnonymousFunction(FlowAnonymousFunctionOperation op);
  void visitStaticLocalInitializationSemaphore(
      StaticLocalInitializationSemaphoreOperation op);
}
