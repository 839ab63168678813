package ca.gc.cra.kestrel.application.signatures;

import ca.gc.cra.kestrel.domain.trace.CallRecord;
import ca.gc.cra.kestrel.domain.trace.ProcessRecord;
import ca.gc.cra.kestrel.validation.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Convenience base for hand-written signatures.
 *
 * <p>Carries the descriptive attributes that end up in the detection (description, families, references, TTP
 * tags) and collects marks: evidence pointing at the calls or indicators that caused the match. The engine
 * keeps {@link #pid()} and {@link #callIndex()} pointed at the event being dispatched.</p>
 *
 * @since 0.1.0
 */
public abstract class AbstractSignature implements Signature {
  /** Position value used before replay and for process level events. */
  public static final int NO_CALL = -1;

  private final String name;
  private final int severity;
  private final List<Map<String, Object>> marks = new ArrayList<>();
  private long pid = -1L;
  private int callIndex = NO_CALL;

  /**
   * Creates the signature.
   *
   * @param name signature name
   * @param severity severity ordinal
   */
  protected AbstractSignature(String name, int severity) {
    this.name = Strings.requireNonBlank("name", name);
    this.severity = severity;
  }

  @Override
  public final String name() {
    return name;
  }

  @Override
  public final int severity() {
    return severity;
  }

  /**
   * Human readable description.
   *
   * @return description; empty by default
   */
  public String description() {
    return "";
  }

  /**
   * Malware families this signature attributes the sample to.
   *
   * @return family names
   */
  public List<String> families() {
    return List.of();
  }

  /**
   * External references (advisories, write-ups).
   *
   * @return reference URLs
   */
  public List<String> references() {
    return List.of();
  }

  /**
   * ATT&amp;CK technique identifiers.
   *
   * @return technique ids
   */
  public List<String> ttp() {
    return List.of();
  }

  /**
   * Records the current call as evidence.
   *
   * @param process process owning the call
   * @param call marked call
   */
  protected final void markCall(ProcessRecord process, CallRecord call) {
    Objects.requireNonNull(process, "process");
    Objects.requireNonNull(call, "call");
    Map<String, Object> mark = new LinkedHashMap<>();
    mark.put("type", "call");
    mark.put("pid", process.pid());
    mark.put("cid", call.index());
    mark.put("api", call.api());
    mark.put("category", call.category());
    marks.add(Collections.unmodifiableMap(mark));
  }

  /**
   * Records an indicator of compromise.
   *
   * @param category indicator category, e.g. {@code file} or {@code registry}
   * @param ioc indicator value
   */
  protected final void markIoc(String category, Object ioc) {
    Map<String, Object> mark = new LinkedHashMap<>();
    mark.put("type", "ioc");
    mark.put("category", Objects.requireNonNull(category, "category"));
    mark.put("ioc", Objects.requireNonNull(ioc, "ioc"));
    marks.add(Collections.unmodifiableMap(mark));
  }

  /**
   * Records free-form evidence.
   *
   * @param values mark attributes
   */
  protected final void mark(Map<String, Object> values) {
    Map<String, Object> mark = new LinkedHashMap<>();
    mark.put("type", "generic");
    mark.putAll(Objects.requireNonNull(values, "values"));
    marks.add(Collections.unmodifiableMap(mark));
  }

  /**
   * Indicates whether any evidence was recorded.
   *
   * @return {@code true} once a mark exists
   */
  protected final boolean hasMarks() {
    return !marks.isEmpty();
  }

  /**
   * Returns recorded marks.
   *
   * @return unmodifiable view in recording order
   */
  public final List<Map<String, Object>> marks() {
    return Collections.unmodifiableList(marks);
  }

  /**
   * Pid of the process being replayed.
   *
   * @return pid, or {@code -1} before replay
   */
  protected final long pid() {
    return pid;
  }

  /**
   * Index of the call being dispatched.
   *
   * @return call index, or {@link #NO_CALL} for process level events
   */
  protected final int callIndex() {
    return callIndex;
  }

  final void position(long currentPid, int currentCall) {
    this.pid = currentPid;
    this.callIndex = currentCall;
  }

  @Override
  public Map<String, Object> payload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    String description = description();
    if (description != null && !description.isBlank()) {
      payload.put("description", description);
    }
    putIfNotEmpty(payload, "families", families());
    putIfNotEmpty(payload, "references", references());
    putIfNotEmpty(payload, "ttp", ttp());
    if (!marks.isEmpty()) {
      payload.put("marks", List.copyOf(marks));
      payload.put("markcount", marks.size());
    }
    return payload;
  }

  private static void putIfNotEmpty(Map<String, Object> payload, String key, List<String> values) {
    if (values != null && !values.isEmpty()) {
      payload.put(key, List.copyOf(values));
    }
  }
}
