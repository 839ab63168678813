package ca.gc.cra.kestrel.application.signatures;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view handed to {@link Signature#init(SignatureContext)}.
 *
 * @param results results map produced by the processing stage
 * @param engineVersion running engine version
 * @since 0.1.0
 */
public record SignatureContext(Map<String, Object> results, String engineVersion) {

  /**
   * Wraps the results map read-only.
   *
   * @param results results map
   * @param engineVersion engine version string
   */
  public SignatureContext {
    results = Collections.unmodifiableMap(Objects.requireNonNull(results, "results"));
    Objects.requireNonNull(engineVersion, "engineVersion");
  }
}
