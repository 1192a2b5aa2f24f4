package exm.optree.tree;

import static exm.optree.tree.OpTrees.EXCEPTION;
import static exm.optree.tree.OpTrees.INT;
import static exm.optree.tree.OpTrees.OBJECT;
import static exm.optree.tree.OpTrees.STRING;
import static exm.optree.tree.OpTrees.assertChildren;
import static exm.optree.tree.OpTrees.assertDispatch;
import static exm.optree.tree.OpTrees.block;
import static exm.optree.tree.OpTrees.expr;
import static exm.optree.tree.OpTrees.exprStmt;
import static exm.optree.tree.OpTrees.literal;
import static exm.optree.tree.OpTrees.local;
import static exm.optree.tree.OpTrees.stmt;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import exm.optree.common.exceptions.KindMismatchException;
import exm.optree.common.lang.Conversion;
import exm.optree.common.lang.RefKind;
import exm.optree.common.lang.Symbols.SymbolKind;
import exm.optree.tree.Bodies.ConstructorBodyOperation;
import exm.optree.tree.Bodies.MethodBodyOperation;
import exm.optree.tree.Creations.ObjectCreationOperation;
import exm.optree.tree.Creations.ObjectOrCollectionInitializerOperation;
import exm.optree.tree.Declarations.VariableDeclarationGroupOperation;
import exm.optree.tree.Declarations.VariableDeclarationOperation;
import exm.optree.tree.Declarations.VariableDeclaratorOperation;
import exm.optree.tree.Declarations.VariableInitializerOperation;
import exm.optree.tree.Dynamics.DynamicIndexerAccessOperation;
import exm.optree.tree.Dynamics.DynamicInvocationOperation;
import exm.optree.tree.Dynamics.DynamicObjectCreationOperation;
import exm.optree.tree.Interpolations.InterpolatedStringOperation;
import exm.optree.tree.Interpolations.InterpolatedStringTextOperation;
import exm.optree.tree.Interpolations.InterpolationOperation;
import exm.optree.tree.Invocations.ArgumentKind;
import exm.optree.tree.Invocations.ArgumentOperation;
import exm.optree.tree.Invocations.InvocationOperation;
import exm.optree.tree.Loops.ForEachLoopOperation;
import exm.optree.tree.Loops.ForLoopOperation;
import exm.optree.tree.Loops.ForToLoopOperation;
import exm.optree.tree.Loops.WhileLoopOperation;
import exm.optree.tree.Operators.BinaryOperatorKind;
import exm.optree.tree.Operators.CompoundAssignmentOperation;
import exm.optree.tree.Operators.ConditionalOperation;
import exm.optree.tree.Patterns.BinaryPatternOperation;
import exm.optree.tree.Patterns.ConstantPatternOperation;
import exm.optree.tree.Patterns.DiscardPatternOperation;
import exm.optree.tree.Patterns.PatternOperation;
import exm.optree.tree.Patterns.PropertySubpatternOperation;
import exm.optree.tree.Patterns.RecursivePatternOperation;
import exm.optree.tree.References.ArrayElementReferenceOperation;
import exm.optree.tree.References.PropertyReferenceOperation;
import exm.optree.tree.ResourceStatements.UsingOperation;
import exm.optree.tree.Statements.BlockOperation;
import exm.optree.tree.Statements.LabeledOperation;
import exm.optree.tree.Switches.CaseClauseOperation;
import exm.optree.tree.Switches.DefaultCaseClauseOperation;
import exm.optree.tree.Switches.SingleValueCaseClauseOperation;
import exm.optree.tree.Switches.SwitchCaseOperation;
import exm.optree.tree.Switches.SwitchExpressionArmOperation;
import exm.optree.tree.Switches.SwitchExpressionOperation;
import exm.optree.tree.Switches.SwitchOperation;
import exm.optree.tree.TryStatements.CatchClauseOperation;
import exm.optree.tree.TryStatements.TryOperation;

/**
 * Child order of each family of operations
 */
public class FamilyOrderTest {

  private static ArgumentOperation argument(Operation value) {
    return new ArgumentOperation(stmt(), ArgumentKind.EXPLICIT, null, null,
                                 null, Slot.of(value));
  }

  private static PatternOperation constantPattern(int value) {
    return new ConstantPatternOperation(expr(INT), INT, INT,
                                        Slot.<Operation>of(literal(value)));
  }

  @Test
  public void testBlockAndLabeled() {
    Operation first = exprStmt(literal(1));
    Operation second = exprStmt(literal(2));
    BlockOperation b = block(first, second);
    assertChildren(b, first, second);
    assertDispatch(b);

    LabeledOperation labeled = new LabeledOperation(stmt(),
        FakeSymbol.label("L"), Slot.<Operation>of(b));
    assertChildren(labeled, b);
    assertDispatch(labeled);
  }

  @Test
  public void testForLoop() {
    Operation before1 = exprStmt(local("i"));
    Operation before2 = exprStmt(local("j"));
    Operation condition = literal(true);
    Operation body = block();
    Operation bottom = exprStmt(local("k"));
    ForLoopOperation loop = new ForLoopOperation(stmt(), null, null,
        FakeSymbol.label("continue"), FakeSymbol.label("exit"),
        ListSlot.<Operation>of(before1, before2),
        Slot.<Operation>of(condition), Slot.<Operation>of(body),
        ListSlot.<Operation>of(bottom));
    assertChildren(loop, before1, before2, condition, body, bottom);
    assertDispatch(loop);
  }

  @Test
  public void testForLoopWithoutCondition() {
    Operation body = block();
    ForLoopOperation loop = new ForLoopOperation(stmt(), null, null,
        FakeSymbol.label("continue"), FakeSymbol.label("exit"),
        ListSlot.<Operation>empty(), Slot.<Operation>absent(),
        Slot.<Operation>of(body), ListSlot.<Operation>empty());
    assertChildren(loop, body);
  }

  @Test
  public void testForEachAndForTo() {
    Operation collection = local("items");
    Operation variable = local("item");
    Operation body = block();
    ForEachLoopOperation forEach = new ForEachLoopOperation(stmt(), null,
        FakeSymbol.label("continue"), FakeSymbol.label("exit"), false,
        Slot.of(collection), Slot.of(variable), Slot.of(body),
        ListSlot.<Operation>empty());
    assertChildren(forEach, collection, variable, body);
    assertDispatch(forEach);

    Operation control = local("i");
    Operation initial = literal(0);
    Operation limit = literal(10);
    Operation step = literal(1);
    Operation toBody = block();
    Operation next = local("i");
    ForToLoopOperation forTo = new ForToLoopOperation(stmt(), null,
        FakeSymbol.label("continue"), FakeSymbol.label("exit"), false,
        Slot.of(control), Slot.of(initial), Slot.of(limit), Slot.of(step),
        Slot.of(toBody), ListSlot.<Operation>of(next));
    assertChildren(forTo, control, initial, limit, step, toBody, next);
    assertDispatch(forTo);
  }

  @Test
  public void testWhileConditionPosition() {
    Operation condition = literal(true);
    Operation body = block();
    WhileLoopOperation top = new WhileLoopOperation(stmt(), null,
        FakeSymbol.label("continue"), FakeSymbol.label("exit"), true, false,
        Slot.of(condition), Slot.of(body), Slot.<Operation>absent());
    assertChildren(top, condition, body);
    assertDispatch(top);

    Operation bottomCondition = literal(false);
    Operation bottomBody = block();
    Operation ignored = literal(true);
    WhileLoopOperation bottom = new WhileLoopOperation(stmt(), null,
        FakeSymbol.label("continue"), FakeSymbol.label("exit"), false, true,
        Slot.of(bottomCondition), Slot.of(bottomBody), Slot.of(ignored));
    assertChildren(bottom, bottomBody, bottomCondition, ignored);
  }

  @Test
  public void testTryWithFinally() {
    BlockOperation body = block();
    BlockOperation handler = block();
    Operation filter = literal(true);
    CatchClauseOperation catchClause = new CatchClauseOperation(stmt(),
        EXCEPTION, null, Slot.<Operation>absent(), Slot.of(filter),
        Slot.of(handler));
    assertChildren(catchClause, filter, handler);
    assertDispatch(catchClause);

    BlockOperation finallyBlock = block();
    TryOperation tryOp = new TryOperation(stmt(), null, Slot.of(body),
        ListSlot.<CatchClauseOperation>of(catchClause),
        Slot.of(finallyBlock));
    assertChildren(tryOp, body, catchClause, finallyBlock);
    assertDispatch(tryOp);
  }

  @Test
  public void testUsing() {
    Operation resources = local("stream");
    Operation body = block();
    UsingOperation using = new UsingOperation(stmt(), null, false,
        Slot.of(resources), Slot.of(body));
    assertChildren(using, resources, body);
    assertDispatch(using);
  }

  @Test
  public void testDeclarations() {
    VariableInitializerOperation init = new VariableInitializerOperation(
        stmt(), null, Slot.<Operation>of(literal(3)));
    VariableDeclaratorOperation declarator = new VariableDeclaratorOperation(
        stmt(), FakeSymbol.local("x"), ListSlot.<Operation>empty(),
        Slot.of(init));
    assertChildren(declarator, init);

    Operation dimension = literal(4);
    VariableDeclaratorOperation other = new VariableDeclaratorOperation(
        stmt(), FakeSymbol.local("y"), ListSlot.<Operation>empty(),
        Slot.<VariableInitializerOperation>absent());
    VariableDeclarationOperation declaration =
        new VariableDeclarationOperation(stmt(),
            ListSlot.<Operation>of(dimension),
            ListSlot.<VariableDeclaratorOperation>of(declarator, other),
            Slot.<VariableInitializerOperation>absent());
    assertChildren(declaration, dimension, declarator, other);

    VariableDeclarationGroupOperation group =
        new VariableDeclarationGroupOperation(stmt(),
            ListSlot.<VariableDeclarationOperation>of(declaration));
    assertChildren(group, declaration);
    assertDispatch(group);
    assertDispatch(declaration);
    assertDispatch(declarator);
    assertDispatch(init);
  }

  @Test
  public void testObjectCreation() {
    ArgumentOperation a1 = argument(literal(1));
    ArgumentOperation a2 = argument(literal(2));
    ObjectOrCollectionInitializerOperation initializer =
        new ObjectOrCollectionInitializerOperation(expr(OBJECT),
                                             ListSlot.<Operation>empty());
    ObjectCreationOperation creation = new ObjectCreationOperation(
        expr(OBJECT), FakeSymbol.method(".ctor"),
        ListSlot.<ArgumentOperation>of(a1, a2), Slot.of(initializer));
    assertChildren(creation, a1, a2, initializer);
    assertDispatch(creation);
    assertDispatch(initializer);
  }

  @Test
  public void testInvocationInstanceFirst() {
    Operation receiver = local("list");
    ArgumentOperation arg = argument(literal(1));
    InvocationOperation invocation = new InvocationOperation(expr(INT),
        FakeSymbol.method("Add"), true, Slot.of(receiver),
        ListSlot.<ArgumentOperation>of(arg));
    assertChildren(invocation, receiver, arg);
    assertDispatch(invocation);
    assertDispatch(arg);

    InvocationOperation staticCall = new InvocationOperation(expr(INT),
        FakeSymbol.method("Max"), false, Slot.<Operation>absent(),
        ListSlot.<ArgumentOperation>empty());
    assertNull(staticCall.instance());
    assertEquals(0, staticCall.children().size());
  }

  @Test
  public void testSwitchStatement() {
    Operation value = local("x");
    SingleValueCaseClauseOperation clause =
        new SingleValueCaseClauseOperation(stmt(), null,
                                           Slot.<Operation>of(literal(1)));
    DefaultCaseClauseOperation defaultClause =
        new DefaultCaseClauseOperation(stmt(), null);
    Operation statement = exprStmt(local("y"));
    SwitchCaseOperation switchCase = new SwitchCaseOperation(stmt(), null,
        ListSlot.<CaseClauseOperation>of(clause, defaultClause),
        ListSlot.<Operation>of(statement), Slot.<Operation>absent());
    assertChildren(switchCase, clause, defaultClause, statement);

    SwitchOperation switchOp = new SwitchOperation(stmt(), null,
        FakeSymbol.label("exit"), Slot.of(value),
        ListSlot.<SwitchCaseOperation>of(switchCase));
    assertChildren(switchOp, value, switchCase);
    assertDispatch(switchOp);
    assertDispatch(switchCase);
    assertDispatch(clause);
    assertDispatch(defaultClause);
  }

  @Test
  public void testSwitchExpression() {
    PatternOperation pattern = constantPattern(1);
    Operation guard = literal(true);
    Operation armValue = literal(10);
    SwitchExpressionArmOperation arm = new SwitchExpressionArmOperation(
        expr(INT), null, Slot.of(pattern), Slot.of(guard), Slot.of(armValue));
    assertChildren(arm, pattern, guard, armValue);

    PatternOperation discard = new DiscardPatternOperation(expr(INT), INT,
                                                           INT);
    Operation fallback = literal(0);
    SwitchExpressionArmOperation otherwise = new SwitchExpressionArmOperation(
        expr(INT), null, Slot.of(discard), Slot.<Operation>absent(),
        Slot.of(fallback));
    assertChildren(otherwise, discard, fallback);

    Operation value = local("x");
    SwitchExpressionOperation switchExpr = new SwitchExpressionOperation(
        expr(INT), true, Slot.of(value),
        ListSlot.<SwitchExpressionArmOperation>of(arm, otherwise));
    assertChildren(switchExpr, value, arm, otherwise);
    assertDispatch(switchExpr);
    assertDispatch(arm);
    assertDispatch(discard);
  }

  @Test
  public void testRecursivePattern() {
    PatternOperation first = constantPattern(1);
    PatternOperation second = constantPattern(2);
    Operation member = new PropertyReferenceOperation(expr(INT),
        new FakeSymbol("Length", SymbolKind.PROPERTY),
        Slot.<Operation>absent(), ListSlot.<ArgumentOperation>empty());
    PatternOperation lengthPattern = constantPattern(3);
    PropertySubpatternOperation property = new PropertySubpatternOperation(
        expr(INT), Slot.of(member), Slot.of(lengthPattern));
    assertChildren(property, member, lengthPattern);

    RecursivePatternOperation recursive = new RecursivePatternOperation(
        expr(OBJECT), OBJECT, OBJECT, OBJECT, null, null,
        ListSlot.<PatternOperation>of(first, second),
        ListSlot.<PropertySubpatternOperation>of(property));
    assertChildren(recursive, first, second, property);
    assertDispatch(recursive);
    assertDispatch(property);
  }

  @Test
  public void testBinaryPattern() {
    PatternOperation left = constantPattern(1);
    PatternOperation right = constantPattern(2);
    BinaryPatternOperation or = new BinaryPatternOperation(expr(INT), INT,
        INT, BinaryOperatorKind.OR, Slot.of(left), Slot.of(right));
    assertChildren(or, left, right);
    assertDispatch(or);
  }

  @Test
  public void testDynamicInvocation() {
    Operation target = local("d");
    Operation a1 = literal(1);
    Operation a2 = local("b");
    DynamicInvocationOperation call = new DynamicInvocationOperation(
        expr(OBJECT), Arrays.asList(null, "named"),
        Arrays.asList(RefKind.NONE, RefKind.REF), Slot.of(target),
        ListSlot.<Operation>of(a1, a2));
    assertChildren(call, target, a1, a2);
    assertEquals("named", call.argumentName(1));
    assertNull(call.argumentName(0));
    assertEquals(RefKind.REF, call.argumentRefKind(1));
    assertDispatch(call);
  }

  @Test
  public void testDynamicCreationAndIndexerWithMixedNames() {
    Operation a1 = literal(1);
    Operation a2 = literal(2);
    ObjectOrCollectionInitializerOperation initializer =
        new ObjectOrCollectionInitializerOperation(expr(OBJECT),
                                             ListSlot.<Operation>empty());
    DynamicObjectCreationOperation creation =
        new DynamicObjectCreationOperation(expr(OBJECT),
            Arrays.asList("capacity", null), null,
            ListSlot.<Operation>of(a1, a2), Slot.of(initializer));
    assertChildren(creation, a1, a2, initializer);
    assertEquals("capacity", creation.argumentName(0));
    assertNull(creation.argumentName(1));
    assertEquals(RefKind.NONE, creation.argumentRefKind(1));
    assertDispatch(creation);

    Operation receiver = local("d");
    Operation index = literal(0);
    DynamicIndexerAccessOperation indexer = new DynamicIndexerAccessOperation(
        expr(OBJECT), Arrays.asList((String)null), null, Slot.of(receiver),
        ListSlot.<Operation>of(index));
    assertChildren(indexer, receiver, index);
    assertEquals(Arrays.asList((String)null), indexer.argumentNames());
    assertDispatch(indexer);
  }

  @Test
  public void testLazyArgumentsDisagreeWithNames() {
    Operation target = local("d");
    ListSlot<Operation> arguments = ListSlot.lazy(
        new ChildFactory<List<Operation>>() {
          @Override
          public List<Operation> create() {
            return Arrays.<Operation>asList(literal(1), literal(2));
          }
        });
    DynamicInvocationOperation call = new DynamicInvocationOperation(
        expr(OBJECT), Arrays.asList("only"), null, Slot.of(target),
        arguments);
    for (int i = 0; i < 2; i++) {
      try {
        call.arguments();
        fail("Argument count mismatch not reported");
      } catch (KindMismatchException e) {
        assertEquals(OperationKind.DYNAMIC_INVOCATION, e.getKind());
      }
      try {
        call.children();
        fail("Argument count mismatch not reported");
      } catch (KindMismatchException e) {
        // Reported on every read
      }
    }
    assertSame(call, target.parent());
  }

  @Test
  public void testInterpolatedString() {
    InterpolatedStringTextOperation text = new InterpolatedStringTextOperation(
        stmt(), Slot.<Operation>of(literal(0)));
    Operation expression = local("x");
    Operation alignment = literal(5);
    InterpolationOperation hole = new InterpolationOperation(stmt(),
        Slot.of(expression), Slot.of(alignment), Slot.<Operation>absent());
    assertChildren(hole, expression, alignment);

    InterpolatedStringOperation string = new InterpolatedStringOperation(
        expr(STRING), ListSlot.<Operation>of(text, hole));
    assertChildren(string, text, hole);
    assertDispatch(string);
    assertDispatch(text);
    assertDispatch(hole);
  }

  @Test
  public void testBodies() {
    BlockOperation blockBody = block();
    MethodBodyOperation method = new MethodBodyOperation(stmt(),
        Slot.of(blockBody), Slot.<BlockOperation>absent());
    assertChildren(method, blockBody);
    assertDispatch(method);

    Operation initializer = exprStmt(local("base"));
    BlockOperation ctorBody = block();
    BlockOperation exprBody = block();
    ConstructorBodyOperation ctor = new ConstructorBodyOperation(stmt(),
        null, Slot.of(initializer), Slot.of(ctorBody), Slot.of(exprBody));
    assertChildren(ctor, initializer, ctorBody, exprBody);
    assertDispatch(ctor);
  }

  @Test
  public void testReferences() {
    Operation array = local("a");
    Operation i = literal(0);
    Operation j = literal(1);
    ArrayElementReferenceOperation element =
        new ArrayElementReferenceOperation(expr(INT), Slot.of(array),
                                           ListSlot.<Operation>of(i, j));
    assertChildren(element, array, i, j);
    assertDispatch(element);

    Operation receiver = local("list");
    ArgumentOperation index = argument(literal(2));
    PropertyReferenceOperation indexer = new PropertyReferenceOperation(
        expr(INT), new FakeSymbol("Item", SymbolKind.PROPERTY),
        Slot.of(receiver), ListSlot.<ArgumentOperation>of(index));
    assertChildren(indexer, receiver, index);
    assertDispatch(indexer);
  }

  @Test
  public void testOperators() {
    Operation condition = literal(true);
    Operation whenTrue = literal(1);
    Operation whenFalse = literal(2);
    ConditionalOperation conditional = new ConditionalOperation(expr(INT),
        false, Slot.of(condition), Slot.of(whenTrue), Slot.of(whenFalse));
    assertChildren(conditional, condition, whenTrue, whenFalse);
    assertDispatch(conditional);

    Operation ifCondition = literal(false);
    Operation thenBranch = block();
    ConditionalOperation ifStatement = new ConditionalOperation(stmt(),
        false, Slot.of(ifCondition), Slot.of(thenBranch),
        Slot.<Operation>absent());
    assertChildren(ifStatement, ifCondition, thenBranch);
    assertNull(ifStatement.whenFalse());

    Operation target = local("x");
    Operation value = literal(1);
    CompoundAssignmentOperation compound = new CompoundAssignmentOperation(
        expr(INT), BinaryOperatorKind.ADD, null, null, false, false, null,
        Slot.of(target), Slot.of(value));
    assertChildren(compound, target, value);
    assertSame(Conversion.IDENTITY, compound.inConversion());
    assertDispatch(compound);
  }
}
