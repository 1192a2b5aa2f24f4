package exm.optree.tree;

import static exm.optree.tree.OpTrees.BOOL;
import static exm.optree.tree.OpTrees.INT;
import static exm.optree.tree.OpTrees.expr;
import static exm.optree.tree.OpTrees.flow;
import static exm.optree.tree.OpTrees.literal;
import static exm.optree.tree.OpTrees.local;
import static exm.optree.tree.OpTrees.stmt;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.optree.common.Settings;
import exm.optree.common.exceptions.KindMismatchException;
import exm.optree.tree.FlowOperations.CaptureId;
import exm.optree.tree.FlowOperations.CaughtExceptionOperation;
import exm.optree.tree.FlowOperations.FlowCaptureOperation;
import exm.optree.tree.Literals.LiteralOperation;
import exm.optree.tree.Operators.BinaryOperation;
import exm.optree.tree.Operators.BinaryOperatorKind;
import exm.optree.tree.Operators.ParenthesizedOperation;
import exm.optree.tree.Switches.CaseClauseOperation;
import exm.optree.tree.Switches.SingleValueCaseClauseOperation;
import exm.optree.tree.Switches.SwitchCaseOperation;

public class ParentLinksTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void resetSettings() {
    Settings.reset(Settings.VERIFY_DEEP);
  }

  private static ParenthesizedOperation paren(Slot<Operation> operand) {
    return new ParenthesizedOperation(expr(INT), operand);
  }

  @Test
  public void testEagerChildReused() {
    LiteralOperation one = literal(1);
    ParenthesizedOperation first = paren(Slot.<Operation>of(one));
    assertSame(first, one.parent());

    exception.expect(AssertionError.class);
    paren(Slot.<Operation>of(one));
  }

  @Test
  public void testLazyChildReused() {
    final LiteralOperation one = literal(1);
    paren(Slot.<Operation>of(one));

    ParenthesizedOperation second = paren(Slot.lazy(
        new ChildFactory<Operation>() {
          @Override
          public Operation create() {
            return one;
          }
        }));
    try {
      second.operand();
      fail("Reusing an owned child should fail verification");
    } catch (AssertionError e) {
      // Expected
    }
    assertFalse("First parent is kept", second == one.parent());
  }

  @Test
  public void testOwnChild() {
    final ParenthesizedOperation[] holder = new ParenthesizedOperation[1];
    holder[0] = paren(Slot.lazy(new ChildFactory<Operation>() {
      @Override
      public Operation create() {
        return holder[0];
      }
    }));
    exception.expect(AssertionError.class);
    holder[0].operand();
  }

  @Test
  public void testIsLinked() {
    LiteralOperation one = literal(1);
    LiteralOperation two = literal(2);
    ParenthesizedOperation p = paren(Slot.<Operation>of(one));
    assertTrue(ParentLinks.isLinked(p, one));
    assertFalse(ParentLinks.isLinked(p, two));
  }

  @Test
  public void testCaseConditionAliasesClauseValue() {
    LiteralOperation value = literal(1);
    SingleValueCaseClauseOperation clause =
        new SingleValueCaseClauseOperation(stmt(), null,
                                           Slot.<Operation>of(value));
    SwitchCaseOperation switchCase = new SwitchCaseOperation(stmt(), null,
        ListSlot.<CaseClauseOperation>of(clause),
        ListSlot.<Operation>of(OpTrees.exprStmt(local("x"))),
        Slot.<Operation>of(value));

    assertSame(value, switchCase.condition());
    assertSame("Condition keeps its owner", clause, value.parent());
    assertSame(switchCase, clause.parent());
    assertFalse(switchCase.children().contains(value));
  }

  @Test
  public void testCaseConditionStaysUnparented() {
    final LiteralOperation value = literal(1);
    SingleValueCaseClauseOperation clause =
        new SingleValueCaseClauseOperation(stmt(), null,
                                           Slot.<Operation>of(value));
    final BinaryOperation[] built = new BinaryOperation[1];
    SwitchCaseOperation switchCase = new SwitchCaseOperation(stmt(), null,
        ListSlot.<CaseClauseOperation>of(clause),
        ListSlot.<Operation>empty(),
        Slot.lazy(new ChildFactory<Operation>() {
          @Override
          public Operation create() {
            built[0] = new BinaryOperation(expr(BOOL),
                BinaryOperatorKind.EQUALS, false, false, false, null,
                Slot.<Operation>of(local("x")),
                Slot.<Operation>of(literal(1)));
            return built[0];
          }
        }));

    Operation condition = switchCase.condition();
    assertSame(built[0], condition);
    assertNull("Combined condition isn't linked", condition.parent());
    OpTrees.assertChildren(switchCase, clause);
  }

  @Test
  public void testFlowNodeHasNoModel() {
    LiteralOperation one = literal(1);
    FlowCaptureOperation capture = new FlowCaptureOperation(flow(INT),
        new CaptureId(0), Slot.<Operation>of(one));
    assertNull(capture.semanticModel());
    assertSame(capture, one.parent());
    assertTrue(capture.kind().isFlowOnly());
    OpTrees.assertDispatch(capture);
  }

  @Test
  public void testFlowNodeWithModel() {
    exception.expect(KindMismatchException.class);
    new CaughtExceptionOperation(expr(OpTrees.EXCEPTION));
  }

  /**
   * Parenthesized operation whose operand is only produced on demand
   * and is already owned by another node
   */
  private static ParenthesizedOperation lazilyBroken() {
    final LiteralOperation owned = literal(1);
    paren(Slot.<Operation>of(owned));
    return paren(Slot.lazy(new ChildFactory<Operation>() {
      @Override
      public Operation create() {
        return paren(Slot.lazy(new ChildFactory<Operation>() {
          @Override
          public Operation create() {
            return owned;
          }
        }));
      }
    }));
  }

  @Test
  public void testShallowVerification() {
    ParenthesizedOperation outer = lazilyBroken();
    Operation inner = outer.operand();
    assertSame(outer, inner.parent());
  }

  @Test
  public void testDeepVerification() {
    Settings.set(Settings.VERIFY_DEEP, "true");
    ParenthesizedOperation outer = lazilyBroken();
    exception.expect(AssertionError.class);
    outer.operand();
  }
}
