package ca.gc.cra.kestrel.application.signatures;

import ca.gc.cra.kestrel.domain.trace.CallRecord;
import ca.gc.cra.kestrel.domain.trace.ProcessRecord;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> A detection rule evaluated against the behavioural trace of one analysis.
 * <p><strong>Why:</strong> Every hook is present with a no-op default, so the engine dispatches without asking
 * which hooks a rule implements.</p>
 * <p><strong>Role:</strong> Plugin contract of the {@code signatures} group. A fresh instance is created per
 * engine run and sees the whole trace of that run; instances are never reused.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Declare identity ({@link #name()}, {@link #severity()}) and optional call filters.</li>
 *   <li>Return {@code true} from a hook to report a match; the engine records it and notifies every active
 *       signature through {@link #onSignature(Signature)}.</li>
 *   <li>Expose descriptive data for the detection through {@link #payload()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Hooks are invoked from the engine thread only; implementations need no
 * synchronization.</p>
 *
 * @since 0.1.0
 */
public interface Signature {
  /**
   * Returns the signature name; it becomes the detection name.
   *
   * @return stable name
   */
  String name();

  /**
   * Returns the severity ordinal; higher is more severe.
   *
   * @return severity
   */
  int severity();

  /**
   * Process names this signature cares about; empty means every process.
   *
   * @return process name filter
   */
  default Set<String> filterProcessNames() {
    return Set.of();
  }

  /**
   * API names this signature cares about; empty means every API.
   *
   * @return API name filter
   */
  default Set<String> filterApiNames() {
    return Set.of();
  }

  /**
   * Call categories this signature cares about; empty means every category.
   *
   * @return category filter
   */
  default Set<String> filterCategories() {
    return Set.of();
  }

  /**
   * Rule-specific enable state consulted before a hook result counts as a match.
   *
   * @return {@code false} to ignore hook results
   */
  default boolean isActive() {
    return true;
  }

  /**
   * Called once before replay.
   *
   * @param context run context
   */
  default void init(SignatureContext context) {}

  /**
   * Called once after {@link #init(SignatureContext)}; returning {@code true} removes the signature before replay.
   *
   * @return whether to skip this run
   */
  default boolean quickout() {
    return false;
  }

  /**
   * Called when replay enters a process.
   *
   * @param process process about to be replayed
   * @return match flag
   */
  default boolean onProcess(ProcessRecord process) {
    return false;
  }

  /**
   * Called for every call passing this signature's filters.
   *
   * @param call current call
   * @param process process owning the call
   * @return match flag
   */
  default boolean onCall(CallRecord call, ProcessRecord process) {
    return false;
  }

  /**
   * Called whenever a signature matches, including this one.
   *
   * @param matched signature that just matched
   * @return match flag
   */
  default boolean onSignature(Signature matched) {
    return false;
  }

  /**
   * Called once after the full trace was replayed.
   *
   * @return match flag
   */
  default boolean onComplete() {
    return false;
  }

  /**
   * Descriptive data copied into the detection next to {@code name} and {@code severity}.
   *
   * @return payload map; may be empty
   */
  default Map<String, Object> payload() {
    return Map.of();
  }
}
