package ca.gc.cra.kestrel.application.pipeline;

import ca.gc.cra.kestrel.application.plugin.PluginDescriptor;
import ca.gc.cra.kestrel.application.port.MetricsPort;
import ca.gc.cra.kestrel.application.port.ModuleDependencyException;
import ca.gc.cra.kestrel.application.port.ModuleException;
import ca.gc.cra.kestrel.config.ModuleConfig;
import ca.gc.cra.kestrel.config.ModuleOptions;
import ca.gc.cra.kestrel.validation.Strings;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one plugin descriptor of a pipeline stage with full fault isolation.
 * <p><strong>Why:</strong> A single buggy module must only cost its own output, never the analysis.</p>
 * <p><strong>Role:</strong> Shared by the auxiliary, processing and reporting use cases.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Instantiate the module, then resolve its configuration section by canonical name.</li>
 *   <li>Skip unconfigured (DEBUG) and disabled modules.</li>
 *   <li>Inject the {@link ca.gc.cra.kestrel.application.port.context.ExecutionContext}, run the module and
 *       classify the outcome: dependency and declared failures at WARN, everything else at ERROR.</li>
 *   <li>Tag logs with {@code task} and {@code module} MDC keys while the module runs.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the metrics sink; safe to call from pool workers.</p>
 * <p><strong>Observability:</strong> Emits {@code <stage>.module.succeeded|failed|skipped} and
 * {@code <stage>.module.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class ModuleRunner {
  private static final Logger log = LoggerFactory.getLogger(ModuleRunner.class);

  private final String stage;
  private final MetricsPort metrics;

  /**
   * Creates a runner for one stage.
   *
   * @param stage stage label used in logs and metric names, e.g. {@code processing}
   * @param metrics metrics sink
   */
  public ModuleRunner(String stage, MetricsPort metrics) {
    this.stage = Strings.requireIdentifier("stage", stage);
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Runs one module. Never throws for module faults.
   *
   * @param descriptor module descriptor
   * @param config configuration sections of this stage
   * @param scope stage-wide execution state
   * @param invocation entry point call
   * @param <T> module contract
   * @param <R> produced value
   * @return classified execution
   */
  public <T, R> ModuleExecution<R> run(
      PluginDescriptor<? extends T> descriptor,
      ModuleConfig config,
      ModuleScope scope,
      ModuleInvocation<? super T, ? extends R> invocation) {
    Objects.requireNonNull(descriptor, "descriptor");
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(invocation, "invocation");

    String name = descriptor.name();
    if (scope.cancellation().isCancelled()) {
      log.info("Analysis #{} cancelled; not starting the {} module \"{}\"", scope.task().id(), stage, name);
      return ModuleExecution.of(name, ModuleOutcome.CANCELLED);
    }

    String previousTask = MDC.get("task");
    String previousModule = MDC.get("module");
    MDC.put("task", Long.toString(scope.task().id()));
    MDC.put("module", name);
    try {
      return execute(descriptor, config, scope, invocation);
    } finally {
      restore("task", previousTask);
      restore("module", previousModule);
    }
  }

  private <T, R> ModuleExecution<R> execute(
      PluginDescriptor<? extends T> descriptor,
      ModuleConfig config,
      ModuleScope scope,
      ModuleInvocation<? super T, ? extends R> invocation) {
    String name = descriptor.name();
    T module;
    try {
      module = descriptor.instantiate();
    } catch (Exception | LinkageError ex) {
      log.error("Failed to load the {} module \"{}\"", stage, name, ex);
      metrics.increment(stage + ".module.failed");
      return ModuleExecution.of(name, ModuleOutcome.LOAD_FAILED);
    }

    Optional<ModuleOptions> section = config.section(name);
    if (section.isEmpty()) {
      log.debug("No configuration section for the {} module \"{}\"; skipping", stage, name);
      metrics.increment(stage + ".module.skipped");
      return ModuleExecution.of(name, ModuleOutcome.SKIPPED_UNCONFIGURED);
    }
    ModuleOptions options = section.get();
    if (!options.enabled()) {
      log.debug("The {} module \"{}\" is disabled", stage, name);
      metrics.increment(stage + ".module.skipped");
      return ModuleExecution.of(name, ModuleOutcome.SKIPPED_DISABLED);
    }

    long started = System.nanoTime();
    try {
      log.debug("Executing {} module \"{}\" on analysis at \"{}\"", stage, name, scope.analysisPath());
      R value = invocation.invoke(module, scope.contextFor(options));
      metrics.increment(stage + ".module.succeeded");
      return new ModuleExecution<>(name, ModuleOutcome.SUCCEEDED, value);
    } catch (ModuleDependencyException ex) {
      log.warn("The {} module \"{}\" has missing dependencies: {}", stage, name, ex.getMessage());
      metrics.increment(stage + ".module.failed");
      return ModuleExecution.of(name, ModuleOutcome.DEPENDENCY_MISSING);
    } catch (ModuleException ex) {
      log.warn("The {} module \"{}\" returned the following error: {}", stage, name, ex.getMessage());
      metrics.increment(stage + ".module.failed");
      return ModuleExecution.of(name, ModuleOutcome.FAILED);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("The {} module \"{}\" was interrupted", stage, name);
      metrics.increment(stage + ".module.failed");
      return ModuleExecution.of(name, ModuleOutcome.UNEXPECTED_FAILURE);
    } catch (Exception | LinkageError ex) {
      log.error("Failed to run the {} module \"{}\" for task #{}", stage, name, scope.task().id(), ex);
      metrics.increment(stage + ".module.failed");
      return ModuleExecution.of(name, ModuleOutcome.UNEXPECTED_FAILURE);
    } finally {
      metrics.observe(stage + ".module.latencyNanos", System.nanoTime() - started);
    }
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
