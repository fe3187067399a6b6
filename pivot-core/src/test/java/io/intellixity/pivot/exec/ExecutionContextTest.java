package io.intellixity.pivot.exec;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ExecutionContextTest {
  @Test
  void infoMayCarryNullValues() {
    Map<String, Object> info = new HashMap<>();
    info.put("executed-by", 7);
    info.put("card-id", null);

    ExecutionContext ctx = ExecutionContext.defaults().withInfo(info);

    assertEquals(7, ctx.info().get("executed-by"));
    assertTrue(ctx.info().containsKey("card-id"));
    assertNull(ctx.info().get("card-id"));
    assertThrows(UnsupportedOperationException.class, () -> ctx.info().put("x", 1));
  }

  @Test
  void infoIsCopiedAndDefaultsAreFilledIn() {
    Map<String, Object> info = new HashMap<>(Map.of("context", "ad-hoc"));
    ExecutionContext ctx = new ExecutionContext(null, info);
    info.put("context", "changed");

    assertEquals("ad-hoc", ctx.info().get("context"));
    assertSame(CancellationSignal.NONE, ctx.cancellation());
    assertEquals(Map.of(), new ExecutionContext(null, null).info());
    assertEquals(List.of("context"), List.copyOf(ctx.info().keySet()));
  }
}
