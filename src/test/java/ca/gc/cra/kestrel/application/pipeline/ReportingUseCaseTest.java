package ca.gc.cra.kestrel.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.kestrel.application.plugin.PluginDescriptor;
import ca.gc.cra.kestrel.application.plugin.PluginRegistry;
import ca.gc.cra.kestrel.application.port.ReportException;
import ca.gc.cra.kestrel.application.port.ReportingModule;
import ca.gc.cra.kestrel.application.port.context.ExecutionContext;
import ca.gc.cra.kestrel.application.util.CancellationToken;
import ca.gc.cra.kestrel.config.KestrelConfig;
import ca.gc.cra.kestrel.config.ModuleConfig;
import ca.gc.cra.kestrel.config.ModuleOptions;
import ca.gc.cra.kestrel.domain.analysis.AnalysisTask;
import ca.gc.cra.kestrel.support.LogCapture;
import ca.gc.cra.kestrel.support.RecordingMetrics;
import ch.qos.logback.classic.Level;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReportingUseCaseTest {
  private static final AnalysisTask TASK = AnalysisTask.of(11);

  @TempDir Path storage;

  private final PluginRegistry registry = new PluginRegistry();
  private final List<ExecutionContext> seen = new ArrayList<>();

  @Test
  void reportsSeeResultsAndPerAnalysisOverrides() throws Exception {
    Path analysis = Files.createDirectories(storage.resolve("analyses").resolve("11"));
    Files.writeString(analysis.resolve("analysis.yaml"), "jsondump:\n  indent: 2\n");
    registry.register(PluginDescriptor.reporting("jsondump", RecordingReport.class, 1,
        () -> new RecordingReport(seen, null)));

    List<ModuleExecution<Void>> executions = useCase("jsondump").run(TASK, Map.of("info", Map.of("id", 11)),
        CancellationToken.NONE);

    assertEquals(1, executions.size());
    assertEquals(ModuleOutcome.SUCCEEDED, executions.get(0).outcome());
    ExecutionContext context = seen.get(0);
    assertEquals(analysis, context.analysisPath());
    assertTrue(context.results().containsKey("info"));
    assertEquals(2, context.overrides().value("jsondump", "indent").orElseThrow());
  }

  @Test
  void failingReportDoesNotBlockLaterReports() {
    registry.register(PluginDescriptor.reporting("mongodb", RecordingReport.class, 1,
        () -> new RecordingReport(seen, new ReportException("connection refused"))));
    registry.register(PluginDescriptor.reporting("jsondump", RecordingReport.class, 2,
        () -> new RecordingReport(seen, null)));

    List<ModuleExecution<Void>> executions =
        useCase("mongodb", "jsondump").run(TASK, Map.of(), CancellationToken.NONE);

    assertEquals(ModuleOutcome.FAILED, executions.get(0).outcome());
    assertEquals(ModuleOutcome.SUCCEEDED, executions.get(1).outcome());
    assertEquals(2, seen.size());
  }

  @Test
  void reportsRunInOrder() {
    registry.register(PluginDescriptor.reporting("late", RecordingReport.class, 9,
        () -> new RecordingReport(seen, null)));
    registry.register(PluginDescriptor.reporting("early", RecordingReport.class, 1,
        () -> new RecordingReport(seen, null)));

    List<ModuleExecution<Void>> executions =
        useCase("late", "early").run(TASK, Map.of(), CancellationToken.NONE);

    assertEquals(List.of("early", "late"), executions.stream().map(ModuleExecution::module).toList());
  }

  @Test
  void emptyRegistryLogsAndReturnsNoExecutions() {
    try (LogCapture logs = LogCapture.of(ReportingUseCase.class)) {
      List<ModuleExecution<Void>> executions = useCase().run(TASK, Map.of(), CancellationToken.NONE);

      assertTrue(executions.isEmpty());
      assertTrue(logs.contains(Level.INFO, "No reporting modules loaded"));
    }
  }

  private ReportingUseCase useCase(String... enabled) {
    List<ModuleOptions> sections = new ArrayList<>();
    for (String name : enabled) {
      sections.add(ModuleOptions.enabled(name));
    }
    KestrelConfig config = new KestrelConfig(storage, "2.0.0", 64, 1,
        ModuleConfig.empty(), ModuleConfig.empty(), ModuleConfig.of(sections.toArray(ModuleOptions[]::new)));
    return new ReportingUseCase(registry, config, new RecordingMetrics());
  }

  static final class RecordingReport implements ReportingModule {
    private final List<ExecutionContext> seen;
    private final ReportException failure;

    RecordingReport(List<ExecutionContext> seen, ReportException failure) {
      this.seen = seen;
      this.failure = failure;
    }

    @Override
    public void run(ExecutionContext context) throws ReportException {
      seen.add(context);
      if (failure != null) {
        throw failure;
      }
    }
  }
}
