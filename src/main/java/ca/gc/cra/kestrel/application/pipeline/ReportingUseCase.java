package ca.gc.cra.kestrel.application.pipeline;

import ca.gc.cra.kestrel.application.plugin.PluginDescriptor;
import ca.gc.cra.kestrel.application.plugin.PluginGroup;
import ca.gc.cra.kestrel.application.plugin.PluginRegistry;
import ca.gc.cra.kestrel.application.port.MetricsPort;
import ca.gc.cra.kestrel.application.port.ReportingModule;
import ca.gc.cra.kestrel.application.util.CancellationToken;
import ca.gc.cra.kestrel.config.AnalysisOverrides;
import ca.gc.cra.kestrel.config.KestrelConfig;
import ca.gc.cra.kestrel.domain.analysis.AnalysisTask;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs every reporting module against the finished results map.
 * <p><strong>Why:</strong> Reports are side effects (files, uploads, logs) that must each get a chance to run
 * even when a sibling fails.</p>
 * <p><strong>Role:</strong> Final stage of {@link AnalysisPipeline}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load the per-analysis {@value AnalysisOverrides#FILE_NAME} once and hand it to every module.</li>
 *   <li>Run modules sequentially in ascending {@code order} with the same isolation as processing.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Sequential; modules share the caller's results map.</p>
 *
 * @since 0.1.0
 */
public final class ReportingUseCase {
  private static final Logger log = LoggerFactory.getLogger(ReportingUseCase.class);

  private final PluginRegistry registry;
  private final KestrelConfig config;
  private final ModuleRunner runner;

  /**
   * Creates the use case.
   *
   * @param registry plugin registry
   * @param config engine configuration
   * @param metrics metrics sink
   */
  public ReportingUseCase(PluginRegistry registry, KestrelConfig config, MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.config = Objects.requireNonNull(config, "config");
    this.runner = new ModuleRunner("reporting", metrics);
  }

  /**
   * Runs all reporting modules.
   *
   * @param task analysis task
   * @param results finished results map, including {@code signatures}
   * @param cancellation cooperative cancellation token checked before each module
   * @return one execution per registered module, in execution order
   */
  public List<ModuleExecution<Void>> run(
      AnalysisTask task, Map<String, Object> results, CancellationToken cancellation) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(results, "results");
    List<PluginDescriptor<? extends ReportingModule>> modules =
        new ArrayList<>(registry.list(PluginGroup.REPORTING, ReportingModule.class));
    if (modules.isEmpty()) {
      log.info("No reporting modules loaded");
      return List.of();
    }
    modules.sort(Comparator.comparingInt(PluginDescriptor::order));

    Path analysisPath = config.analysisPath(task.id());
    ModuleScope scope = new ModuleScope(
        task, analysisPath, results, AnalysisOverrides.load(analysisPath), cancellation);
    List<ModuleExecution<Void>> executions = new ArrayList<>(modules.size());
    for (PluginDescriptor<? extends ReportingModule> descriptor : modules) {
      executions.add(runner.<ReportingModule, Void>run(descriptor, config.reporting(), scope, (module, context) -> {
        module.run(context);
        return null;
      }));
    }
    return List.copyOf(executions);
  }
}
