package ca.gc.cra.kestrel.application.pipeline;

import ca.gc.cra.kestrel.application.plugin.PluginRegistry;
import ca.gc.cra.kestrel.application.port.MetricsPort;
import ca.gc.cra.kestrel.application.signatures.SignatureEngine;
import ca.gc.cra.kestrel.application.util.CancellationToken;
import ca.gc.cra.kestrel.config.KestrelConfig;
import ca.gc.cra.kestrel.domain.analysis.AnalysisTask;
import ca.gc.cra.kestrel.domain.detection.Detection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Chains processing, signature evaluation and reporting for one analysis.
 * <p><strong>Why:</strong> Keeps the stage order and the results map hand-off in one place.</p>
 * <p><strong>Role:</strong> Entry point used by the CLI and by embedding schedulers.</p>
 * <p><strong>Thread-safety:</strong> Stateless between runs; concurrent runs are independent.</p>
 *
 * @since 0.1.0
 */
public final class AnalysisPipeline {
  private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

  private final ProcessingUseCase processing;
  private final SignatureEngine signatures;
  private final ReportingUseCase reporting;

  /**
   * Creates the pipeline from its stages.
   *
   * @param processing processing stage
   * @param signatures signature engine
   * @param reporting reporting stage
   */
  public AnalysisPipeline(ProcessingUseCase processing, SignatureEngine signatures, ReportingUseCase reporting) {
    this.processing = Objects.requireNonNull(processing, "processing");
    this.signatures = Objects.requireNonNull(signatures, "signatures");
    this.reporting = Objects.requireNonNull(reporting, "reporting");
  }

  /**
   * Creates the pipeline with every stage reading the same registry and configuration.
   *
   * @param registry plugin registry
   * @param config engine configuration
   * @param metrics metrics sink
   */
  public AnalysisPipeline(PluginRegistry registry, KestrelConfig config, MetricsPort metrics) {
    this(new ProcessingUseCase(registry, config, metrics),
        new SignatureEngine(registry, config, metrics),
        new ReportingUseCase(registry, config, metrics));
  }

  /**
   * Analyses one task.
   *
   * @param task analysis task
   * @param cancellation cooperative cancellation token shared by all stages
   * @return final results, detections and report outcomes
   */
  public AnalysisResult run(AnalysisTask task, CancellationToken cancellation) {
    Objects.requireNonNull(task, "task");
    CancellationToken token = Objects.requireNonNullElse(cancellation, CancellationToken.NONE);
    String previousTask = MDC.get("task");
    MDC.put("task", Long.toString(task.id()));
    try {
      log.info("Analysis #{} started", task.id());
      Map<String, Object> results = processing.run(task, token);
      List<Detection> detections = signatures.run(results, token);
      List<ModuleExecution<Void>> reports = reporting.run(task, results, token);
      log.info("Analysis #{} completed with {} detection(s)", task.id(), detections.size());
      return new AnalysisResult(results, detections, reports);
    } finally {
      if (previousTask == null) {
        MDC.remove("task");
      } else {
        MDC.put("task", previousTask);
      }
    }
  }
}
