package exm.optree.tree;

import static exm.optree.tree.OpTrees.INT;
import static exm.optree.tree.OpTrees.expr;
import static exm.optree.tree.OpTrees.literal;
import static exm.optree.tree.OpTrees.stmt;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.optree.common.exceptions.OpTreeRuntimeError;
import exm.optree.tree.Literals.LiteralOperation;
import exm.optree.tree.Operators.BinaryOperation;
import exm.optree.tree.Operators.BinaryOperatorKind;
import exm.optree.tree.Operators.ConditionalOperation;
import exm.optree.tree.Statements.BlockOperation;

public class LazySlotTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  /**
   * Factory counting calls and building a fresh literal each time
   */
  private static class CountingFactory implements ChildFactory<Operation> {
    final AtomicInteger calls = new AtomicInteger();
    private final int value;

    CountingFactory(int value) {
      this.value = value;
    }

    @Override
    public Operation create() {
      calls.incrementAndGet();
      return literal(value);
    }
  }

  @Test
  public void testLazyEmptyBlock() {
    final AtomicInteger calls = new AtomicInteger();
    BlockOperation block = new BlockOperation(stmt(), null,
        ListSlot.lazy(new ChildFactory<List<Operation>>() {
          @Override
          public List<Operation> create() {
            calls.incrementAndGet();
            return Collections.emptyList();
          }
        }));

    assertEquals("Nothing computed before first read", 0, calls.get());
    assertTrue(block.operations().isEmpty());
    assertTrue(block.children().isEmpty());
    assertEquals("Factory runs once", 1, calls.get());
  }

  @Test
  public void testLazyChildLinked() {
    CountingFactory left = new CountingFactory(1);
    CountingFactory right = new CountingFactory(2);
    Slot<Operation> leftSlot = Slot.lazy(left);
    BinaryOperation sum = new BinaryOperation(expr(INT),
        BinaryOperatorKind.ADD, false, false, false, null, leftSlot,
        Slot.lazy(right));

    assertFalse(leftSlot.isMaterialized());
    Operation l = sum.leftOperand();
    assertTrue(leftSlot.isMaterialized());
    assertSame(sum, l.parent());
    assertSame("Published value doesn't change", l, sum.leftOperand());
    assertEquals(1, left.calls.get());
    assertEquals("Other slot still deferred", 0, right.calls.get());

    OpTrees.assertChildren(sum, l, sum.rightOperand());
    assertEquals(1, right.calls.get());
  }

  @Test
  public void testLazyAbsentOptional() {
    final AtomicInteger calls = new AtomicInteger();
    ConditionalOperation ifThen = new ConditionalOperation(stmt(), false,
        Slot.<Operation>of(literal(true)),
        Slot.<Operation>of(OpTrees.block()),
        Slot.lazy(new ChildFactory<Operation>() {
          @Override
          public Operation create() {
            calls.incrementAndGet();
            return null;
          }
        }));
    assertNull(ifThen.whenFalse());
    assertNull(ifThen.whenFalse());
    assertEquals("Null is published like any other value", 1, calls.get());
    assertEquals(2, ifThen.children().size());
  }

  @Test
  public void testLazyRequiredNull() {
    BinaryOperation sum = new BinaryOperation(expr(INT),
        BinaryOperatorKind.ADD, false, false, false, null,
        Slot.lazy(new ChildFactory<Operation>() {
          @Override
          public Operation create() {
            return null;
          }
        }), Slot.<Operation>of(literal(2)));
    exception.expect(OpTreeRuntimeError.class);
    sum.leftOperand();
  }

  @Test
  public void testLazySequenceFactoryReturnsNull() {
    BlockOperation block = new BlockOperation(stmt(), null,
        ListSlot.lazy(new ChildFactory<List<Operation>>() {
          @Override
          public List<Operation> create() {
            return null;
          }
        }));
    exception.expect(OpTreeRuntimeError.class);
    block.operations();
  }

  @Test
  public void testLazySequenceCopied() {
    final List<Operation> source = new ArrayList<Operation>();
    source.add(literal(1));
    BlockOperation block = new BlockOperation(stmt(), null,
        ListSlot.lazy(new ChildFactory<List<Operation>>() {
          @Override
          public List<Operation> create() {
            return source;
          }
        }));
    List<Operation> ops = block.operations();
    source.add(literal(2));
    assertEquals("Later changes to the source list aren't seen",
                 1, ops.size());
    assertEquals(1, block.operations().size());
  }

  @Test
  public void testConcurrentPublication() throws Exception {
    final int threads = 8;
    final CountingFactory factory = new CountingFactory(42);
    final BinaryOperation sum = new BinaryOperation(expr(INT),
        BinaryOperatorKind.ADD, false, false, false, null,
        Slot.lazy(factory), Slot.<Operation>of(literal(1)));

    final CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<Operation>> results = new ArrayList<Future<Operation>>();
      for (int i = 0; i < threads; i++) {
        results.add(pool.submit(new Callable<Operation>() {
          @Override
          public Operation call() throws Exception {
            start.await();
            return sum.leftOperand();
          }
        }));
      }
      start.countDown();

      Operation first = results.get(0).get(10, TimeUnit.SECONDS);
      for (Future<Operation> result: results) {
        assertSame("All readers see the same published child",
                   first, result.get(10, TimeUnit.SECONDS));
      }
      assertSame(sum, first.parent());
      assertSame(first, sum.leftOperand());
      assertTrue(factory.calls.get() >= 1);
      assertTrue(factory.calls.get() <= threads);
      assertEquals(42, ((LiteralOperation)first).constantValue().value());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  public void testConcurrentSequencePublication() throws Exception {
    final int threads = 8;
    final BlockOperation block = new BlockOperation(stmt(), null,
        ListSlot.lazy(new ChildFactory<List<Operation>>() {
          @Override
          public List<Operation> create() {
            List<Operation> ops = new ArrayList<Operation>();
            for (int i = 0; i < 10; i++) {
              ops.add(OpTrees.exprStmt(literal(i)));
            }
            return ops;
          }
        }));

    final CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<List<Operation>>> results =
                            new ArrayList<Future<List<Operation>>>();
      for (int i = 0; i < threads; i++) {
        results.add(pool.submit(new Callable<List<Operation>>() {
          @Override
          public List<Operation> call() throws Exception {
            start.await();
            return block.operations();
          }
        }));
      }
      start.countDown();

      List<Operation> first = results.get(0).get(10, TimeUnit.SECONDS);
      assertEquals(10, first.size());
      for (Future<List<Operation>> result: results) {
        List<Operation> ops = result.get(10, TimeUnit.SECONDS);
        for (int i = 0; i < first.size(); i++) {
          assertSame(first.get(i), ops.get(i));
        }
      }
      for (Operation op: first) {
        assertSame(block, op.parent());
      }
    } finally {
      pool.shutdownNow();
    }
  }
}
