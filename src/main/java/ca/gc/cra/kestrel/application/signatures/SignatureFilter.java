package ca.gc.cra.kestrel.application.signatures;

import ca.gc.cra.kestrel.domain.trace.CallRecord;
import ca.gc.cra.kestrel.domain.trace.ProcessRecord;
import java.util.Set;

/**
 * Set-based call filter compiled once per signature and run.
 *
 * @since 0.1.0
 */
final class SignatureFilter {
  private final Set<String> processNames;
  private final Set<String> apiNames;
  private final Set<String> categories;

  private SignatureFilter(Set<String> processNames, Set<String> apiNames, Set<String> categories) {
    this.processNames = processNames;
    this.apiNames = apiNames;
    this.categories = categories;
  }

  static SignatureFilter compile(Signature signature) {
    return new SignatureFilter(
        copy(signature.filterProcessNames()),
        copy(signature.filterApiNames()),
        copy(signature.filterCategories()));
  }

  /** Returns {@code true} when the call passes every non-empty filter. */
  boolean accepts(ProcessRecord process, CallRecord call) {
    if (!processNames.isEmpty() && !processNames.contains(process.processName())) {
      return false;
    }
    if (!apiNames.isEmpty() && !apiNames.contains(call.api())) {
      return false;
    }
    return categories.isEmpty() || categories.contains(call.category());
  }

  private static Set<String> copy(Set<String> values) {
    return values == null || values.isEmpty() ? Set.of() : Set.copyOf(values);
  }
}
