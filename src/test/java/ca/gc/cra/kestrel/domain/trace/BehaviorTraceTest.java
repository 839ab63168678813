package ca.gc.cra.kestrel.domain.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BehaviorTraceTest {

  @Test
  void missingSectionsYieldEmptyTrace() {
    assertTrue(BehaviorTrace.from(Map.of()).isEmpty());
    assertTrue(BehaviorTrace.from(Map.of("behavior", "not a map")).isEmpty());
    assertTrue(BehaviorTrace.from(Map.of("behavior", Map.of("summary", Map.of()))).isEmpty());
  }

  @Test
  void parsesProcessesAndCallsInOrder() {
    Map<String, Object> results = Map.of("behavior", Map.of("processes", List.of(
        Map.of("pid", 1337, "process_name", "invoice.exe", "first_seen", 1.5, "calls", List.of(
            Map.of("api", "NtOpenFile", "category", "filesystem",
                "arguments", Map.of("filepath", "C:\\x.txt")),
            Map.of("api", "NtClose", "category", "system"))),
        Map.of("pid", "2048", "process_name", "svchost.exe"))));

    BehaviorTrace trace = BehaviorTrace.from(results);

    assertEquals(2, trace.processes().size());
    assertEquals(2, trace.callCount());
    ProcessRecord first = trace.processes().get(0);
    assertEquals(1337L, first.pid());
    assertEquals(1.5, first.attributes().get("first_seen"));
    assertFalse(first.attributes().containsKey("calls"));
    CallRecord open = first.calls().get(0);
    assertEquals(0, open.index());
    assertEquals("C:\\x.txt", open.argument("filepath").orElseThrow());
    assertTrue(first.calls().get(1).arguments().isEmpty());
    assertEquals(2048L, trace.processes().get(1).pid());
  }

  @Test
  void toleratesMalformedEntries() {
    Map<String, Object> call = new HashMap<>();
    call.put("api", null);
    Map<String, Object> results = Map.of("behavior", Map.of("processes", List.of(
        "garbage",
        Map.of("pid", "abc", "calls", List.of(7, call)))));

    BehaviorTrace trace = BehaviorTrace.from(results);

    assertEquals(1, trace.processes().size());
    ProcessRecord process = trace.processes().get(0);
    assertEquals(-1L, process.pid());
    assertEquals("", process.processName());
    assertEquals(1, process.calls().size());
    CallRecord only = process.calls().get(0);
    assertEquals(1, only.index());
    assertEquals("", only.api());
    assertEquals("", only.category());
  }
}
