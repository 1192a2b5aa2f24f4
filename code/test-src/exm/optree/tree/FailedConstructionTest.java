package exm.optree.tree;

import static exm.optree.tree.OpTrees.INT;
import static exm.optree.tree.OpTrees.OBJECT;
import static exm.optree.tree.OpTrees.expr;
import static exm.optree.tree.OpTrees.literal;
import static exm.optree.tree.OpTrees.local;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;

import exm.optree.common.exceptions.KindMismatchException;
import exm.optree.common.exceptions.MissingAttributeException;
import exm.optree.common.lang.RefKind;
import exm.optree.tree.Dynamics.DynamicInvocationOperation;
import exm.optree.tree.Operators.BinaryOperation;
import exm.optree.tree.Operators.BinaryOperatorKind;
import exm.optree.tree.Operators.ParenthesizedOperation;
import exm.optree.tree.References.ImplicitIndexerReferenceOperation;

/**
 * A constructor that throws must leave the children it was given unowned,
 * so they can be installed somewhere else.
 */
public class FailedConstructionTest {

  /**
   * Check op has no parent and can still be adopted
   */
  private static void assertReusable(Operation op) {
    assertNull("Left linked to failed operation", op.parent());
    ParenthesizedOperation adopter = new ParenthesizedOperation(expr(INT),
                                                        Slot.of(op));
    assertSame(adopter, op.parent());
  }

  @Test
  public void testLaterRequiredSlotAbsent() {
    Operation left = local("x");
    try {
      new BinaryOperation(expr(INT), BinaryOperatorKind.ADD, false, false,
          false, null, Slot.of(left), Slot.<Operation>absent());
      fail("Missing right operand not detected");
    } catch (MissingAttributeException e) {
      assertSame(OperationKind.BINARY, e.getKind());
    }
    assertReusable(left);
  }

  @Test
  public void testAttributeCheckedAfterSlots() {
    Operation instance = local("span");
    Operation argument = literal(1);
    try {
      new ImplicitIndexerReferenceOperation(expr(INT), Slot.of(instance),
          Slot.of(argument), FakeSymbol.method("Length"), null);
      fail("Missing indexer symbol not detected");
    } catch (MissingAttributeException e) {
      // Expected
    }
    assertReusable(instance);
    assertReusable(argument);
  }

  @Test
  public void testArgumentNameCountMismatch() {
    Operation target = local("d");
    Operation a1 = literal(1);
    Operation a2 = literal(2);
    try {
      new DynamicInvocationOperation(expr(OBJECT),
          Arrays.asList("only"), Arrays.asList(RefKind.NONE, RefKind.NONE),
          Slot.of(target), ListSlot.<Operation>of(a1, a2));
      fail("Mismatched names not detected");
    } catch (KindMismatchException e) {
      // Expected
    }
    assertReusable(a1);
    assertReusable(a2);
    assertReusable(target);
  }
}
