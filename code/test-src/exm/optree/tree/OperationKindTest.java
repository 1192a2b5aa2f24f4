package exm.optree.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

import exm.optree.tree.Interpolations.InterpolatedStringAppendOperation;
import exm.optree.tree.OperationKind.Family;
import exm.optree.tree.Operators.IncrementOrDecrementOperation;
import exm.optree.tree.Statements.ReturnOperation;

public class OperationKindTest {

  @Test
  public void testSharedShapes() {
    Map<Class<?>, List<OperationKind>> byShape =
                        new HashMap<Class<?>, List<OperationKind>>();
    for (OperationKind kind: OperationKind.values()) {
      List<OperationKind> kinds = byShape.get(kind.shape());
      if (kinds == null) {
        kinds = new ArrayList<OperationKind>();
        byShape.put(kind.shape(), kinds);
      }
      kinds.add(kind);
    }

    Map<Class<?>, List<OperationKind>> shared =
                        new HashMap<Class<?>, List<OperationKind>>();
    for (Map.Entry<Class<?>, List<OperationKind>> e: byShape.entrySet()) {
      if (e.getValue().size() > 1) {
        shared.put(e.getKey(), e.getValue());
      }
    }

    assertEquals(3, shared.size());
    assertEquals(Arrays.asList(OperationKind.INCREMENT,
                               OperationKind.DECREMENT),
                 shared.get(IncrementOrDecrementOperation.class));
    assertEquals(Arrays.asList(OperationKind.RETURN,
                               OperationKind.YIELD_RETURN,
                               OperationKind.YIELD_BREAK),
                 shared.get(ReturnOperation.class));
    assertEquals(Arrays.asList(
                     OperationKind.INTERPOLATED_STRING_APPEND_LITERAL,
                     OperationKind.INTERPOLATED_STRING_APPEND_FORMATTED,
                     OperationKind.INTERPOLATED_STRING_APPEND_INVALID),
                 shared.get(InterpolatedStringAppendOperation.class));
  }

  @Test
  public void testFlowOnlyKinds() {
    Set<OperationKind> flowOnly = new HashSet<OperationKind>();
    for (OperationKind kind: OperationKind.values()) {
      assertEquals(kind.family() == Family.FLOW, kind.isFlowOnly());
      if (kind.isFlowOnly()) {
        flowOnly.add(kind);
      }
    }
    assertEquals(new HashSet<OperationKind>(Arrays.asList(
        OperationKind.FLOW_CAPTURE,
        OperationKind.FLOW_CAPTURE_REFERENCE,
        OperationKind.IS_NULL,
        OperationKind.CAUGHT_EXCEPTION,
        OperationKind.FLOW_ANONYMOUS_FUNCTION,
        OperationKind.STATIC_LOCAL_INITIALIZATION_SEMAPHORE)), flowOnly);
  }

  @Test
  public void testShapesNestedInFamilyFiles() {
    for (OperationKind kind: OperationKind.values()) {
      Class<?> outer = kind.shape().getEnclosingClass();
      assertTrue(kind + " shape should be nested", outer != null);
      assertTrue(kind.shape().getSimpleName().endsWith("Operation"));
    }
  }
}
