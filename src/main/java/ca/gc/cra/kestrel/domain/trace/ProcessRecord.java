package ca.gc.cra.kestrel.domain.trace;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Monitored process together with its ordered API calls.
 *
 * @param pid process identifier
 * @param processName executable name, e.g. {@code malware.exe}
 * @param calls calls in observation order
 * @param attributes remaining process payload (parent pid, command line, first seen)
 * @since 0.1.0
 */
public record ProcessRecord(long pid, String processName, List<CallRecord> calls, Map<String, Object> attributes) {

  /**
   * Validates required fields and freezes collections.
   *
   * @param pid process identifier
   * @param processName executable name
   * @param calls ordered calls; {@code null} becomes empty
   * @param attributes remaining payload; {@code null} becomes empty
   */
  public ProcessRecord {
    processName = Objects.requireNonNull(processName, "processName");
    calls = calls == null ? List.of() : List.copyOf(calls);
    attributes = TraceValues.freeze(attributes);
  }
}
