package exm.optree.walk;

import static exm.optree.tree.OpTrees.INT;
import static exm.optree.tree.OpTrees.block;
import static exm.optree.tree.OpTrees.expr;
import static exm.optree.tree.OpTrees.exprStmt;
import static exm.optree.tree.OpTrees.literal;
import static exm.optree.tree.OpTrees.local;
import static exm.optree.tree.OpTrees.stmt;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Test;

import exm.optree.common.Logging;
import exm.optree.common.Settings;
import exm.optree.tree.ChildFactory;
import exm.optree.tree.FakeSymbol;
import exm.optree.tree.ListSlot;
import exm.optree.tree.Operation;
import exm.optree.tree.Operators.ParenthesizedOperation;
import exm.optree.tree.Slot;
import exm.optree.tree.Statements.BlockOperation;
import exm.optree.tree.Switches.CaseClauseOperation;
import exm.optree.tree.Switches.SingleValueCaseClauseOperation;
import exm.optree.tree.Switches.SwitchCaseOperation;
import exm.optree.tree.Switches.SwitchOperation;

public class ValidateTest {
  private static final Logger logger = Logging.getOpTreeLogger();

  @After
  public void resetSettings() {
    Settings.reset(Settings.VALIDATE_MAX_VIOLATIONS);
  }

  /**
   * Block with two statements whose parenthesized operands share one
   * literal.  The second link is rejected when first read.
   */
  private static BlockOperation sharedLiteralTree() {
    final Operation shared = literal(1);
    ParenthesizedOperation owner = new ParenthesizedOperation(expr(INT),
                                                   Slot.of(shared));
    ParenthesizedOperation thief = new ParenthesizedOperation(expr(INT),
        Slot.lazy(new ChildFactory<Operation>() {
          @Override
          public Operation create() {
            return shared;
          }
        }));
    try {
      thief.operand();
      fail("Expected link verification to fail");
    } catch (AssertionError e) {
      // The bad value is still published
    }
    return block(exprStmt(owner), exprStmt(thief));
  }

  @Test
  public void testValidTree() {
    SingleValueCaseClauseOperation clause =
        new SingleValueCaseClauseOperation(stmt(), null,
                                           Slot.<Operation>of(literal(1)));
    SwitchCaseOperation switchCase = new SwitchCaseOperation(stmt(), null,
        ListSlot.<CaseClauseOperation>of(clause),
        ListSlot.<Operation>of(exprStmt(local("y"))),
        Slot.<Operation>of(literal(true)));
    SwitchOperation switchOp = new SwitchOperation(stmt(), null,
        FakeSymbol.label("exit"), Slot.<Operation>of(local("x")),
        ListSlot.<SwitchCaseOperation>of(switchCase));
    BlockOperation root = block(switchOp);

    assertTrue(Validate.findViolations(root).isEmpty());
    Validate.checkTree(logger, root);
  }

  @Test
  public void testSharedChild() {
    List<String> violations = Validate.findViolations(sharedLiteralTree());
    assertEquals(violations.toString(), 2, violations.size());
    boolean badParent = false;
    boolean twice = false;
    for (String v: violations) {
      badParent |= v.startsWith("Bad parent");
      twice |= v.contains("reachable more than once");
    }
    assertTrue(violations.toString(), badParent);
    assertTrue(violations.toString(), twice);
  }

  @Test
  public void testViolationLimit() {
    Settings.set(Settings.VALIDATE_MAX_VIOLATIONS, "1");
    assertEquals(1, Validate.findViolations(sharedLiteralTree()).size());
  }

  @Test
  public void testCheckTreeAsserts() {
    BlockOperation root = sharedLiteralTree();
    try {
      Validate.checkTree(null, root);
      fail("checkTree should reject the tree");
    } catch (AssertionError e) {
      assertTrue(e.getMessage().contains("Invalid operation tree"));
    }
  }
}
