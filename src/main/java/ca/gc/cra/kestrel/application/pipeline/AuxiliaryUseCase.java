package ca.gc.cra.kestrel.application.pipeline;

import ca.gc.cra.kestrel.application.plugin.PluginDescriptor;
import ca.gc.cra.kestrel.application.plugin.PluginGroup;
import ca.gc.cra.kestrel.application.plugin.PluginRegistry;
import ca.gc.cra.kestrel.application.port.AuxiliaryModule;
import ca.gc.cra.kestrel.application.port.MetricsPort;
import ca.gc.cra.kestrel.application.port.ModuleException;
import ca.gc.cra.kestrel.application.util.CancellationToken;
import ca.gc.cra.kestrel.config.KestrelConfig;
import ca.gc.cra.kestrel.domain.analysis.AnalysisTask;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Starts and stops the auxiliary modules that run alongside the sandboxed execution.
 *
 * <p>One instance covers one analysis: {@link #start} remembers the modules that started and {@link #stop}
 * stops them in start order.</p>
 *
 * @since 0.1.0
 */
public final class AuxiliaryUseCase {
  private static final Logger log = LoggerFactory.getLogger(AuxiliaryUseCase.class);

  private final PluginRegistry registry;
  private final KestrelConfig config;
  private final ModuleRunner runner;
  private final List<Started> started = new ArrayList<>();

  /**
   * Creates the use case.
   *
   * @param registry plugin registry
   * @param config engine configuration
   * @param metrics metrics sink
   */
  public AuxiliaryUseCase(PluginRegistry registry, KestrelConfig config, MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.config = Objects.requireNonNull(config, "config");
    this.runner = new ModuleRunner("auxiliary", metrics);
  }

  /**
   * Starts every configured and enabled auxiliary module.
   *
   * @param task analysis task
   * @param machine label of the machine running the task
   * @param cancellation cooperative cancellation token
   * @return executions in registration order
   */
  public synchronized List<ModuleExecution<AuxiliaryModule>> start(
      AnalysisTask task, String machine, CancellationToken cancellation) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(machine, "machine");
    List<PluginDescriptor<? extends AuxiliaryModule>> modules =
        registry.list(PluginGroup.AUXILIARY, AuxiliaryModule.class);
    if (modules.isEmpty()) {
      log.info("No auxiliary modules loaded");
      return List.of();
    }

    ModuleScope scope = new ModuleScope(task, config.analysisPath(task.id()), Map.of(), null, cancellation);
    List<ModuleExecution<AuxiliaryModule>> executions = new ArrayList<>(modules.size());
    for (PluginDescriptor<? extends AuxiliaryModule> descriptor : modules) {
      ModuleExecution<AuxiliaryModule> execution =
          runner.<AuxiliaryModule, AuxiliaryModule>run(descriptor, config.auxiliary(), scope, (module, context) -> {
            module.start(context, machine);
            return module;
          });
      execution.result().ifPresent(module -> {
        log.debug("Started auxiliary module: {}", descriptor.name());
        started.add(new Started(descriptor.name(), task.id(), module));
      });
      executions.add(execution);
    }
    return List.copyOf(executions);
  }

  /**
   * Stops every module started by {@link #start}, in start order. Failures are logged and skipped.
   *
   * @return number of modules stopped cleanly
   */
  public synchronized int stop() {
    int stopped = 0;
    for (Started entry : started) {
      String previousModule = MDC.get("module");
      MDC.put("module", entry.name());
      try {
        entry.module().stop();
        log.debug("Stopped auxiliary module: {}", entry.name());
        stopped++;
      } catch (ModuleException ex) {
        log.warn("Unable to stop auxiliary module \"{}\" for task #{}: {}", entry.name(), entry.taskId(),
            ex.getMessage());
      } catch (RuntimeException | LinkageError ex) {
        log.warn("Unable to stop auxiliary module \"{}\" for task #{}", entry.name(), entry.taskId(), ex);
      } finally {
        if (previousModule == null) {
          MDC.remove("module");
        } else {
          MDC.put("module", previousModule);
        }
      }
    }
    started.clear();
    return stopped;
  }

  private record Started(String name, long taskId, AuxiliaryModule module) {}
}
