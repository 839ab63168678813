package ca.gc.cra.kestrel.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.kestrel.application.plugin.PluginRegistry;
import ca.gc.cra.kestrel.application.signatures.SignatureEngine;
import ca.gc.cra.kestrel.application.signatures.rules.SignatureRuleProvider;
import ca.gc.cra.kestrel.application.util.CancellationToken;
import ca.gc.cra.kestrel.config.KestrelConfig;
import ca.gc.cra.kestrel.config.ModuleConfig;
import ca.gc.cra.kestrel.config.ModuleOptions;
import ca.gc.cra.kestrel.domain.analysis.AnalysisTask;
import ca.gc.cra.kestrel.domain.detection.Detection;
import ca.gc.cra.kestrel.domain.trace.BehaviorTrace;
import ca.gc.cra.kestrel.infrastructure.modules.AnalysisInfoProcessing;
import ca.gc.cra.kestrel.infrastructure.modules.BehaviorProcessing;
import ca.gc.cra.kestrel.infrastructure.modules.BundledPlugins;
import ca.gc.cra.kestrel.infrastructure.modules.LoggingReport;
import ca.gc.cra.kestrel.support.LogCapture;
import ca.gc.cra.kestrel.support.RecordingMetrics;
import ch.qos.logback.classic.Level;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class AnalysisPipelineTest {
  private static final Path STORAGE = Path.of("src", "test", "resources");
  private static final List<Path> RULES = List.of(
      STORAGE.resolve("signatures/injection.yaml"),
      STORAGE.resolve("signatures/network.yaml"));

  private final PluginRegistry registry = new PluginRegistry();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private KestrelConfig config;

  @BeforeEach
  void setUp() throws Exception {
    config = KestrelConfig.defaults()
        .withStorageRoot(STORAGE)
        .withModules(
            ModuleConfig.of(
                ModuleOptions.enabled(AnalysisInfoProcessing.NAME),
                ModuleOptions.enabled(BehaviorProcessing.NAME)),
            ModuleConfig.of(ModuleOptions.enabled(LoggingReport.NAME)));
    BundledPlugins.registerAll(registry, config, () -> 1_700_000_000_000L);
    new SignatureRuleProvider().registerAll(registry, RULES);
  }

  @Test
  void storedAnalysisFlowsThroughProcessingSignaturesAndReports() {
    try (LogCapture reportLogs = LogCapture.of(LoggingReport.class)) {
      AnalysisResult result = new AnalysisPipeline(registry, config, metrics)
          .run(AnalysisTask.of(5), CancellationToken.NONE);

      assertTrue(result.results().containsKey("info"));
      assertTrue(result.results().containsKey(BehaviorTrace.BEHAVIOR_KEY));
      assertTrue(result.results().containsKey(SignatureEngine.RESULTS_KEY));

      List<String> names = result.detections().stream().map(Detection::name).collect(Collectors.toList());
      assertEquals(List.of("contacts_pastebin", "creates_service", "writes_remote_memory", "persistent_injector"),
          names);

      assertEquals(1, result.reports().size());
      assertEquals(ModuleOutcome.SUCCEEDED, result.reports().get(0).outcome());
      assertTrue(reportLogs.contains(Level.INFO, "4 detection(s), 2 at or above severity 3"));
    }
    assertEquals(2, metrics.counter("processing.module.succeeded"));
    assertEquals(1, metrics.counter("reporting.module.succeeded"));
    assertEquals(4, metrics.counter("signatures.matched"));
  }

  @Test
  void detectionsAreVisibleToReportsAsPlainMaps() {
    AnalysisResult result = new AnalysisPipeline(registry, config, metrics)
        .run(AnalysisTask.of(5), CancellationToken.NONE);

    List<?> stored = (List<?>) result.results().get(SignatureEngine.RESULTS_KEY);
    assertEquals(result.detections().size(), stored.size());
    Map<?, ?> first = (Map<?, ?>) stored.get(0);
    assertEquals("contacts_pastebin", first.get("name"));
    assertEquals(1, first.get("severity"));
  }

  @Test
  void taskMdcIsRestoredAfterRun() {
    MDC.remove("task");
    new AnalysisPipeline(registry, config, metrics).run(AnalysisTask.of(5), CancellationToken.NONE);
    assertNull(MDC.get("task"));

    MDC.put("task", "outer");
    try {
      new AnalysisPipeline(registry, config, metrics).run(AnalysisTask.of(5), CancellationToken.NONE);
      assertEquals("outer", MDC.get("task"));
    } finally {
      MDC.remove("task");
    }
  }

  @Test
  void cancelledRunSkipsModulesAndMatchesNothing() {
    CancellationToken token = new CancellationToken();
    token.cancel();

    AnalysisResult result = new AnalysisPipeline(registry, config, metrics).run(AnalysisTask.of(5), token);

    assertTrue(result.detections().isEmpty());
    assertFalse(result.results().containsKey(BehaviorTrace.BEHAVIOR_KEY));
    assertEquals(0, metrics.counter("processing.module.succeeded"));
  }
}
