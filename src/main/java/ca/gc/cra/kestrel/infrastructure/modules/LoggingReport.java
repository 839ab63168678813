package ca.gc.cra.kestrel.infrastructure.modules;

import ca.gc.cra.kestrel.application.port.ReportException;
import ca.gc.cra.kestrel.application.port.ReportingModule;
import ca.gc.cra.kestrel.application.port.context.ExecutionContext;
import ca.gc.cra.kestrel.application.signatures.SignatureEngine;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one log line per detection plus a summary.
 *
 * <p>{@code minSeverity} hides lower detections; the per-analysis {@code analysis.yaml} may override it under a
 * {@code logreport} section.</p>
 *
 * @since 0.1.0
 */
public final class LoggingReport implements ReportingModule {
  /** Canonical module name. */
  public static final String NAME = "logreport";

  private static final Logger log = LoggerFactory.getLogger(LoggingReport.class);

  @Override
  public void run(ExecutionContext context) throws ReportException {
    Optional<Object> override = context.overrides().value(NAME, "minSeverity");
    int minSeverity = override.isPresent()
        ? toInt(override.get())
        : context.options().integer("minSeverity", 0);

    Object raw = context.results().getOrDefault(SignatureEngine.RESULTS_KEY, List.of());
    if (!(raw instanceof List<?> detections)) {
      throw new ReportException("Results key '" + SignatureEngine.RESULTS_KEY + "' is not a list");
    }

    int shown = 0;
    for (Object entry : detections) {
      if (!(entry instanceof Map<?, ?> detection)) {
        throw new ReportException("Malformed detection entry: " + entry);
      }
      int severity = detection.get("severity") instanceof Number number ? number.intValue() : 0;
      if (severity < minSeverity) {
        continue;
      }
      Object description = detection.get("description");
      log.info("Detection {} (severity {}){}", detection.get("name"), severity,
          description == null ? "" : ": " + description);
      shown++;
    }
    log.info("Analysis #{}: {} detection(s), {} at or above severity {}",
        context.task().id(), detections.size(), shown, minSeverity);
  }

  private static int toInt(Object value) throws ReportException {
    if (value instanceof Number number) {
      return number.intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new ReportException("Invalid minSeverity override: '" + value + "'", ex);
    }
  }
}
