package exm.optree.tree;

import static exm.optree.tree.OpTrees.BOOL;
import static exm.optree.tree.OpTrees.EXCEPTION;
import static exm.optree.tree.OpTrees.INT;
import static exm.optree.tree.OpTrees.MODEL;
import static exm.optree.tree.OpTrees.OBJECT;
import static exm.optree.tree.OpTrees.assertChildren;
import static exm.optree.tree.OpTrees.block;
import static exm.optree.tree.OpTrees.expr;
import static exm.optree.tree.OpTrees.literal;
import static exm.optree.tree.OpTrees.loc;
import static exm.optree.tree.OpTrees.local;
import static exm.optree.tree.OpTrees.stmt;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.optree.common.exceptions.KindMismatchException;
import exm.optree.common.exceptions.MissingAttributeException;
import exm.optree.common.exceptions.OpTreeRuntimeError;
import exm.optree.common.lang.ConstantValue;
import exm.optree.tree.Literals.LiteralOperation;
import exm.optree.tree.Operators.BinaryOperation;
import exm.optree.tree.Operators.BinaryOperatorKind;
import exm.optree.tree.Operators.IncrementOrDecrementOperation;
import exm.optree.tree.Operators.TupleBinaryOperation;
import exm.optree.tree.Patterns.ConstantPatternOperation;
import exm.optree.tree.Patterns.PatternOperation;
import exm.optree.tree.Statements.BlockOperation;
import exm.optree.tree.Statements.ReturnOperation;
import exm.optree.tree.Switches.CaseKind;
import exm.optree.tree.Switches.PatternCaseClauseOperation;
import exm.optree.tree.TryStatements.CatchClauseOperation;
import exm.optree.tree.TryStatements.TryOperation;

public class OperationTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static BinaryOperation add(Operation left, Operation right) {
    return new BinaryOperation(expr(INT), BinaryOperatorKind.ADD, false,
        false, false, null, Slot.of(left), Slot.of(right));
  }

  private static CatchClauseOperation catchClause() {
    return new CatchClauseOperation(stmt(), EXCEPTION, null,
        Slot.<Operation>absent(), Slot.<Operation>absent(),
        Slot.of(block()));
  }

  @Test
  public void testBinaryOfTwoLiterals() {
    LiteralOperation one = literal(1);
    LiteralOperation two = literal(2);
    BinaryOperation sum = add(one, two);

    assertEquals(OperationKind.BINARY, sum.kind());
    assertSame(INT, sum.type());
    assertFalse(sum.constantValue().hasValue());
    assertNull("Root has no parent", sum.parent());
    assertChildren(sum, one, two);
    assertSame(one, sum.leftOperand());
    assertSame(two, sum.rightOperand());
    assertSame(MODEL, sum.semanticModel());
    assertEquals("C#", sum.language());
    OpTrees.assertDispatch(sum);
  }

  @Test
  public void testChildrenStable() {
    BinaryOperation sum = add(literal(1), literal(2));
    assertEquals("Repeated reads should give same children",
                 sum.children(), sum.children());
  }

  @Test
  public void testTryWithTwoCatchesNoFinally() {
    BlockOperation body = block(OpTrees.exprStmt(local("x")));
    CatchClauseOperation c1 = catchClause();
    CatchClauseOperation c2 = catchClause();
    TryOperation tryOp = new TryOperation(stmt(), null, Slot.of(body),
        ListSlot.of(c1, c2), Slot.<BlockOperation>absent());

    assertChildren(tryOp, body, c1, c2);
    assertNull(tryOp.finallyBlock());
    assertEquals(2, tryOp.catches().size());
  }

  @Test
  public void testPatternCaseClauseGuard() {
    PatternOperation pattern = new ConstantPatternOperation(expr(null),
        OBJECT, INT, Slot.<Operation>of(literal(3)));
    PatternCaseClauseOperation noGuard = new PatternCaseClauseOperation(
        stmt(), null, Slot.of(pattern), Slot.<Operation>absent());
    assertEquals(CaseKind.PATTERN, noGuard.caseKind());
    assertChildren(noGuard, pattern);
    assertNull(noGuard.guard());

    PatternOperation pattern2 = new ConstantPatternOperation(expr(null),
        OBJECT, INT, Slot.<Operation>of(literal(4)));
    LiteralOperation guard = literal(true);
    PatternCaseClauseOperation withGuard = new PatternCaseClauseOperation(
        stmt(), null, Slot.of(pattern2), Slot.<Operation>of(guard));
    assertChildren(withGuard, pattern2, guard);
  }

  @Test
  public void testLiteralNeedsConstant() {
    exception.expect(MissingAttributeException.class);
    new LiteralOperation(expr(INT));
  }

  @Test
  public void testLiteralKnownNull() {
    LiteralOperation nullLit = new LiteralOperation(OperationInfo.create(
        MODEL, loc(), OBJECT, ConstantValue.of(null), false));
    assertTrue(nullLit.constantValue().hasValue());
    assertNull(nullLit.constantValue().value());
  }

  @Test
  public void testMissingOperatorKind() {
    try {
      new BinaryOperation(expr(INT), null, false, false, false, null,
          Slot.<Operation>of(literal(1)), Slot.<Operation>of(literal(2)));
      throw new AssertionError("Expected exception");
    } catch (MissingAttributeException e) {
      assertEquals(OperationKind.BINARY, e.getKind());
      assertEquals("operatorKind", e.getAttribute());
    }
  }

  @Test
  public void testMissingRequiredChild() {
    exception.expect(MissingAttributeException.class);
    new BinaryOperation(expr(INT), BinaryOperatorKind.ADD, false, false,
        false, null, Slot.<Operation>of(literal(1)),
        Slot.<Operation>absent());
  }

  @Test
  public void testMissingInfo() {
    exception.expect(MissingAttributeException.class);
    new BinaryOperation(null, BinaryOperatorKind.ADD, false, false, false,
        null, Slot.<Operation>of(literal(1)),
        Slot.<Operation>of(literal(2)));
  }

  @Test
  public void testNullSlotValue() {
    exception.expect(OpTreeRuntimeError.class);
    Slot.of(null);
  }

  @Test
  public void testWrongKindForShape() {
    exception.expect(KindMismatchException.class);
    new IncrementOrDecrementOperation(OperationKind.BINARY, expr(INT),
        false, false, false, null, Slot.<Operation>of(local("i")));
  }

  @Test
  public void testReturnKinds() {
    ReturnOperation ret = new ReturnOperation(OperationKind.RETURN, stmt(),
        Slot.<Operation>of(literal(1)));
    assertEquals(1, ret.children().size());

    ReturnOperation yieldBreak = new ReturnOperation(
        OperationKind.YIELD_BREAK, stmt(), Slot.<Operation>absent());
    assertTrue(yieldBreak.children().isEmpty());
    OpTrees.assertDispatch(yieldBreak);

    exception.expect(KindMismatchException.class);
    new ReturnOperation(OperationKind.YIELD_BREAK, stmt(),
                        Slot.<Operation>of(literal(2)));
  }

  @Test
  public void testTupleBinaryEqualityOnly() {
    TupleBinaryOperation eq = new TupleBinaryOperation(expr(BOOL),
        BinaryOperatorKind.EQUALS, Slot.<Operation>of(local("a")),
        Slot.<Operation>of(local("b")));
    assertEquals(BinaryOperatorKind.EQUALS, eq.operatorKind());

    exception.expect(KindMismatchException.class);
    new TupleBinaryOperation(expr(BOOL), BinaryOperatorKind.LESS_THAN,
        Slot.<Operation>of(local("a")), Slot.<Operation>of(local("b")));
  }

  @Test
  public void testSlotInstalledTwice() {
    Slot<Operation> shared = Slot.<Operation>of(literal(1));
    new Operators.ParenthesizedOperation(expr(INT), shared);
    exception.expect(OpTreeRuntimeError.class);
    new Operators.ParenthesizedOperation(expr(INT), shared);
  }

  @Test
  public void testNullSequenceEntry() {
    exception.expect(OpTreeRuntimeError.class);
    ListSlot.of(literal(1), null);
  }

  @Test
  public void testDump() {
    BinaryOperation sum = add(literal(1), literal(2));
    String dump = sum.dump();
    String[] lines = dump.split("\n");
    assertEquals(3, lines.length);
    assertTrue(lines[0], lines[0].startsWith("BINARY ADD @"));
    assertTrue(lines[0], lines[0].endsWith(": int"));
    assertTrue(lines[1], lines[1].startsWith(TreeUtil.indent + "LITERAL"));
    assertTrue(lines[1], lines[1].endsWith("= 1"));
  }

  @Test
  public void testDumpAbbreviatesLongConstants() {
    StringBuilder longString = new StringBuilder();
    for (int i = 0; i < 100; i++) {
      longString.append('x');
    }
    LiteralOperation lit = new LiteralOperation(OperationInfo.create(MODEL,
        loc(), OpTrees.STRING, ConstantValue.of(longString.toString()),
        false));
    String dump = lit.dump();
    assertTrue(dump, dump.contains("..."));
    assertFalse(dump, dump.contains(longString.toString()));
  }

  @Test
  public void testChildrenImmutable() {
    List<Operation> children = add(literal(1), literal(2)).children();
    exception.expect(UnsupportedOperationException.class);
    children.clear();
  }
}
