package ca.gc.cra.kestrel.domain.trace;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered process/call record replayed by the signature engine.
 *
 * <p>Built from the results map shape {@code behavior.processes[].calls[]}. Missing sections yield an
 * empty trace; entries that are not mappings are ignored. Unknown pids become {@code -1} and missing
 * API or category names become blank so that filters simply never match them.</p>
 *
 * @param processes processes in trace order
 * @since 0.1.0
 */
public record BehaviorTrace(List<ProcessRecord> processes) {
  /** Results key holding the behavioural section. */
  public static final String BEHAVIOR_KEY = "behavior";
  /** Key of the process list inside the behavioural section. */
  public static final String PROCESSES_KEY = "processes";

  private static final BehaviorTrace EMPTY = new BehaviorTrace(List.of());

  /**
   * Freezes the process list.
   *
   * @param processes processes in trace order; {@code null} becomes empty
   */
  public BehaviorTrace {
    processes = processes == null ? List.of() : List.copyOf(processes);
  }

  /**
   * Returns a trace without processes.
   *
   * @return empty trace
   */
  public static BehaviorTrace empty() {
    return EMPTY;
  }

  /**
   * Extracts the trace from an analysis results map.
   *
   * @param results results map; must not be {@code null}
   * @return parsed trace; empty when {@code behavior} or {@code processes} is absent
   */
  public static BehaviorTrace from(Map<String, Object> results) {
    Objects.requireNonNull(results, "results");
    if (!(results.get(BEHAVIOR_KEY) instanceof Map<?, ?> behavior)) {
      return EMPTY;
    }
    if (!(behavior.get(PROCESSES_KEY) instanceof Iterable<?> rawProcesses)) {
      return EMPTY;
    }
    List<ProcessRecord> processes = new ArrayList<>();
    for (Object rawProcess : rawProcesses) {
      if (rawProcess instanceof Map<?, ?> process) {
        processes.add(toProcess(process));
      }
    }
    return new BehaviorTrace(processes);
  }

  /**
   * Counts the calls across every process.
   *
   * @return total number of calls
   */
  public int callCount() {
    int total = 0;
    for (ProcessRecord process : processes) {
      total += process.calls().size();
    }
    return total;
  }

  /**
   * Indicates whether the trace holds no process.
   *
   * @return {@code true} when there is nothing to replay
   */
  public boolean isEmpty() {
    return processes.isEmpty();
  }

  private static ProcessRecord toProcess(Map<?, ?> raw) {
    Map<String, Object> attributes = TraceValues.stringKeyed(raw);
    long pid = toLong(attributes.get("pid"));
    String name = toText(attributes.get("process_name"));
    List<CallRecord> calls = new ArrayList<>();
    if (attributes.get("calls") instanceof Iterable<?> rawCalls) {
      int index = 0;
      for (Object rawCall : rawCalls) {
        if (rawCall instanceof Map<?, ?> call) {
          Map<String, Object> callAttributes = TraceValues.stringKeyed(call);
          calls.add(new CallRecord(
              index,
              toText(callAttributes.get("api")),
              toText(callAttributes.get("category")),
              callAttributes));
        }
        index++;
      }
    }
    Map<String, Object> remainder = new LinkedHashMap<>(attributes);
    remainder.remove("calls");
    return new ProcessRecord(pid, name, calls, remainder);
  }

  private static long toLong(Object value) {
    if (value instanceof Number number) {
      return number.longValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Long.parseLong(str.trim());
      } catch (NumberFormatException ex) {
        return -1L;
      }
    }
    return -1L;
  }

  private static String toText(Object value) {
    return value == null ? "" : value.toString();
  }
}
