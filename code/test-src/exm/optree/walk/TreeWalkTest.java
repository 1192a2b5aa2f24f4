package exm.optree.walk;

import static exm.optree.tree.OpTrees.INT;
import static exm.optree.tree.OpTrees.block;
import static exm.optree.tree.OpTrees.expr;
import static exm.optree.tree.OpTrees.exprStmt;
import static exm.optree.tree.OpTrees.literal;
import static exm.optree.tree.OpTrees.local;
import static exm.optree.tree.OpTrees.stmt;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.optree.common.Logging;
import exm.optree.tree.ChildFactory;
import exm.optree.tree.ListSlot;
import exm.optree.tree.Operation;
import exm.optree.tree.Operators.BinaryOperation;
import exm.optree.tree.Operators.BinaryOperatorKind;
import exm.optree.tree.Slot;
import exm.optree.tree.Statements.BlockOperation;
import exm.optree.walk.TreeWalk.TreeWalker;

public class TreeWalkTest {
  private static final Logger logger = Logging.getOpTreeLogger();

  private static class Recorder extends TreeWalker {
    final List<Operation> visited = new ArrayList<Operation>();

    @Override
    protected void visit(Operation op) {
      visited.add(op);
    }
  }

  @Test
  public void testPreOrder() {
    Operation x = local("x");
    Operation one = literal(1);
    BinaryOperation sum = new BinaryOperation(expr(INT),
        BinaryOperatorKind.ADD, false, false, false, null,
        Slot.of(x), Slot.of(one));
    Operation s1 = exprStmt(sum);
    Operation y = local("y");
    Operation s2 = exprStmt(y);
    BlockOperation root = block(s1, s2);

    Recorder recorder = new Recorder();
    TreeWalk.walk(logger, root, recorder);
    assertEquals(Arrays.asList(root, s1, sum, x, one, s2, y),
                 recorder.visited);

    assertEquals(Arrays.asList(s1, sum, x, one, s2, y),
                 TreeWalk.descendants(root));
  }

  @Test
  public void testNonRecursive() {
    Operation s1 = exprStmt(local("a"));
    Operation s2 = exprStmt(local("b"));
    Operation s3 = exprStmt(local("c"));
    BlockOperation root = block(s1, s2, s3);

    Recorder recorder = new Recorder();
    TreeWalk.walk(logger, root, recorder, false);
    assertEquals(Arrays.asList(root, s1, s2, s3), recorder.visited);
  }

  @Test
  public void testLeaf() {
    Operation leaf = literal(7);
    assertTrue(TreeWalk.descendants(leaf).isEmpty());
  }

  @Test
  public void testWalkMaterializesLazySlots() {
    final List<Operation> made = new ArrayList<Operation>();
    ListSlot<Operation> statements = ListSlot.lazy(
        new ChildFactory<List<Operation>>() {
          @Override
          public List<Operation> create() {
            Operation s = exprStmt(literal(2));
            made.add(s);
            return Arrays.asList(s);
          }
        });
    BlockOperation root = new BlockOperation(stmt(), null,
                                             statements);
    assertFalse(statements.isMaterialized());

    List<Operation> all = TreeWalk.descendants(root);
    assertTrue(statements.isMaterialized());
    assertEquals(2, all.size());
    assertEquals(made.get(0), all.get(0));
  }
}
