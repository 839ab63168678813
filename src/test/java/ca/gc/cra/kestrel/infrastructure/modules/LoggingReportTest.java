package ca.gc.cra.kestrel.infrastructure.modules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.kestrel.application.port.ReportException;
import ca.gc.cra.kestrel.application.port.context.ExecutionContext;
import ca.gc.cra.kestrel.config.AnalysisOverrides;
import ca.gc.cra.kestrel.config.ModuleOptions;
import ca.gc.cra.kestrel.domain.analysis.AnalysisTask;
import ca.gc.cra.kestrel.support.LogCapture;
import ch.qos.logback.classic.Level;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LoggingReportTest {
  private static final List<Map<String, Object>> DETECTIONS = List.of(
      Map.of("name", "creates_service", "severity", 2, "description", "Creates a Windows service"),
      Map.of("name", "persistent_injector", "severity", 5));

  private final LoggingReport report = new LoggingReport();

  @Test
  void logsDetectionsAtOrAboveConfiguredSeverity() throws Exception {
    ModuleOptions options = new ModuleOptions("logreport", Map.of("enabled", true, "minSeverity", 3));

    try (LogCapture logs = LogCapture.of(LoggingReport.class)) {
      report.run(context(options, AnalysisOverrides.empty(), Map.of("signatures", DETECTIONS)));

      assertEquals(2, logs.events(Level.INFO).size());
      assertTrue(logs.contains(Level.INFO, "Detection persistent_injector (severity 5)"));
      assertTrue(logs.contains(Level.INFO, "Analysis #5: 2 detection(s), 1 at or above severity 3"));
    }
  }

  @Test
  void perAnalysisOverrideWinsOverModuleOption() throws Exception {
    AnalysisOverrides overrides = new AnalysisOverrides(Map.of("logreport", Map.of("minSeverity", "1")));

    try (LogCapture logs = LogCapture.of(LoggingReport.class)) {
      report.run(context(new ModuleOptions("logreport", Map.of("enabled", true, "minSeverity", 5)), overrides,
          Map.of("signatures", DETECTIONS)));

      assertTrue(logs.contains(Level.INFO, "Detection creates_service (severity 2): Creates a Windows service"));
    }
  }

  @Test
  void missingSignaturesKeyMeansNoDetections() throws Exception {
    try (LogCapture logs = LogCapture.of(LoggingReport.class)) {
      report.run(context(ModuleOptions.enabled("logreport"), AnalysisOverrides.empty(), Map.of()));

      assertTrue(logs.contains(Level.INFO, "0 detection(s)"));
    }
  }

  @Test
  void malformedInputsAreReportFailures() {
    assertThrows(ReportException.class, () -> report.run(
        context(ModuleOptions.enabled("logreport"), AnalysisOverrides.empty(), Map.of("signatures", "oops"))));
    AnalysisOverrides badOverride = new AnalysisOverrides(Map.of("logreport", Map.of("minSeverity", "high")));
    assertThrows(ReportException.class, () -> report.run(
        context(ModuleOptions.enabled("logreport"), badOverride, Map.of("signatures", DETECTIONS))));
  }

  private static ExecutionContext context(ModuleOptions options, AnalysisOverrides overrides,
      Map<String, Object> results) {
    return new ExecutionContext(AnalysisTask.of(5), Path.of("storage", "analyses", "5"), options, results,
        overrides, null);
  }
}
