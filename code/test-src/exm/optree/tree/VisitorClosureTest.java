package exm.optree.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

/**
 * Every kind has a concrete class, and both visitor interfaces have exactly
 * one method for each such class
 */
public class VisitorClosureTest {

  private static Set<Class<? extends Operation>> shapes() {
    Set<Class<? extends Operation>> shapes =
                    new LinkedHashSet<Class<? extends Operation>>();
    for (OperationKind kind: OperationKind.values()) {
      shapes.add(kind.shape());
    }
    return shapes;
  }

  private static String visitName(Class<?> shape) {
    return "visit" + shape.getSimpleName().replaceFirst("Operation$", "");
  }

  private static Map<Class<?>, Method> visitMethods(Class<?> visitor) {
    Map<Class<?>, Method> methods = new HashMap<Class<?>, Method>();
    for (Method m: visitor.getDeclaredMethods()) {
      assertTrue(m + " should take the operation first",
                 m.getParameterTypes().length >= 1);
      Class<?> shape = m.getParameterTypes()[0];
      assertFalse("Two methods for " + shape, methods.containsKey(shape));
      methods.put(shape, m);
    }
    return methods;
  }

  @Test
  public void testShapesAreConcrete() {
    for (OperationKind kind: OperationKind.values()) {
      Class<? extends Operation> shape = kind.shape();
      assertNotNull(kind.toString(), shape);
      int mods = shape.getModifiers();
      assertFalse(shape + " is abstract", Modifier.isAbstract(mods));
      assertTrue(shape + " isn't final", Modifier.isFinal(mods));
      assertTrue(shape + " isn't public", Modifier.isPublic(mods));
    }
  }

  @Test
  public void testKindAndShapeCounts() {
    assertEquals(138, OperationKind.values().length);
    assertEquals(133, shapes().size());
  }

  @Test
  public void testVoidVisitor() {
    Map<Class<?>, Method> methods = visitMethods(OperationVisitor.class);
    Set<Class<? extends Operation>> shapes = shapes();
    assertEquals(shapes.size(), methods.size());
    for (Class<? extends Operation> shape: shapes) {
      Method m = methods.get(shape);
      assertNotNull("No visit method for " + shape.getSimpleName(), m);
      assertEquals(visitName(shape), m.getName());
      assertEquals(1, m.getParameterTypes().length);
      assertEquals(void.class, m.getReturnType());
    }
  }

  @Test
  public void testArgVisitor() {
    Map<Class<?>, Method> methods = visitMethods(OperationArgVisitor.class);
    Set<Class<? extends Operation>> shapes = shapes();
    assertEquals(shapes.size(), methods.size());
    for (Class<? extends Operation> shape: shapes) {
      Method m = methods.get(shape);
      assertNotNull("No visit method for " + shape.getSimpleName(), m);
      assertEquals(visitName(shape), m.getName());
      assertEquals(2, m.getParameterTypes().length);
    }
  }

  @Test
  public void testShapesImplementAccept() throws NoSuchMethodException {
    for (Class<? extends Operation> shape: shapes()) {
      Method plain = shape.getDeclaredMethod("accept",
                                             OperationVisitor.class);
      assertFalse(Modifier.isAbstract(plain.getModifiers()));
      Method withArg = shape.getDeclaredMethod("accept",
          OperationArgVisitor.class, Object.class);
      assertFalse(Modifier.isAbstract(withArg.getModifiers()));
    }
  }
}
