package exm.optree.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.List;

import exm.optree.common.lang.ConstantValue;
import exm.optree.common.lang.SemanticModel;
import exm.optree.common.lang.SourceLocus;
import exm.optree.common.lang.Symbols.TypeSymbol;
import exm.optree.tree.Literals.LiteralOperation;
import exm.optree.tree.References.LocalReferenceOperation;
import exm.optree.tree.Statements.BlockOperation;
import exm.optree.tree.Statements.ExpressionStatementOperation;

/**
 * Shorthand for building small trees in tests
 */
public class OpTrees {

  public static final SemanticModel MODEL = new SemanticModel() {
    @Override
    public String language() {
      return "C#";
    }
  };

  public static final TypeSymbol INT = FakeSymbol.type("int");
  public static final TypeSymbol BOOL = FakeSymbol.type("bool");
  public static final TypeSymbol STRING = FakeSymbol.type("string");
  public static final TypeSymbol OBJECT = FakeSymbol.type("object");
  public static final TypeSymbol EXCEPTION = FakeSymbol.type("Exception");

  private static int nextStart = 0;

  public static synchronized SourceLocus loc() {
    return new SourceLocus("C#", "Test.cs", nextStart++, 1);
  }

  public static OperationInfo expr(TypeSymbol type) {
    return OperationInfo.expression(MODEL, loc(), type);
  }

  public static OperationInfo stmt() {
    return OperationInfo.statement(MODEL, loc(), false);
  }

  public static OperationInfo flow(TypeSymbol type) {
    return OperationInfo.forFlowGraph(loc(), type, null, true);
  }

  public static LiteralOperation literal(int value) {
    return new LiteralOperation(OperationInfo.create(MODEL, loc(), INT,
                                       ConstantValue.of(value), false));
  }

  public static LiteralOperation literal(boolean value) {
    return new LiteralOperation(OperationInfo.create(MODEL, loc(), BOOL,
                                       ConstantValue.of(value), false));
  }

  public static LocalReferenceOperation local(String name) {
    return new LocalReferenceOperation(expr(INT), FakeSymbol.local(name),
                                       false);
  }

  public static ExpressionStatementOperation exprStmt(Operation op) {
    return new ExpressionStatementOperation(stmt(), Slot.of(op));
  }

  public static BlockOperation block(Operation... statements) {
    return new BlockOperation(stmt(), null,
                              ListSlot.<Operation>of(statements));
  }

  /**
   * Check that op's children are exactly expected, in order, and that
   * each is linked back to op
   */
  public static void assertChildren(Operation op, Operation... expected) {
    List<Operation> children = op.children();
    assertEquals("children of " + op, expected.length, children.size());
    for (int i = 0; i < expected.length; i++) {
      assertSame("child " + i + " of " + op, expected[i], children.get(i));
      assertSame("parent of child " + i + " of " + op, op,
                 children.get(i).parent());
    }
  }

  /**
   * Check that both accept overloads call visit method for op's class,
   * and only that method
   */
  public static void assertDispatch(Operation op) {
    String expected = "visit" + op.getClass().getSimpleName()
                         .replaceFirst("Operation$", "");

    RecordingHandler handler = new RecordingHandler();
    OperationVisitor visitor = (OperationVisitor)Proxy.newProxyInstance(
        OperationVisitor.class.getClassLoader(),
        new Class<?>[] {OperationVisitor.class}, handler);
    op.accept(visitor);
    assertEquals(1, handler.calls.size());
    assertEquals(expected, handler.calls.get(0).getName());
    assertSame(op, handler.args.get(0)[0]);

    handler = new RecordingHandler();
    @SuppressWarnings("unchecked")
    OperationArgVisitor<String, String> argVisitor =
        (OperationArgVisitor<String, String>)Proxy.newProxyInstance(
        OperationArgVisitor.class.getClassLoader(),
        new Class<?>[] {OperationArgVisitor.class}, handler);
    String result = op.accept(argVisitor, "arg");
    assertEquals(expected + ":arg", result);
    assertEquals(1, handler.calls.size());
    assertSame(op, handler.args.get(0)[0]);
  }

  private static class RecordingHandler implements InvocationHandler {
    final List<Method> calls = new ArrayList<Method>();
    final List<Object[]> args = new ArrayList<Object[]>();

    @Override
    public Object invoke(Object proxy, Method method, Object[] methodArgs) {
      calls.add(method);
      args.add(methodArgs);
      if (methodArgs.length == 2) {
        return method.getName() + ":" + methodArgs[1];
      }
      return null;
    }
  }
}
