package ca.gc.cra.kestrel.application.pipeline;

import ca.gc.cra.kestrel.application.plugin.PluginDescriptor;
import ca.gc.cra.kestrel.application.plugin.PluginGroup;
import ca.gc.cra.kestrel.application.plugin.PluginRegistry;
import ca.gc.cra.kestrel.application.port.MetricsPort;
import ca.gc.cra.kestrel.application.port.ProcessingModule;
import ca.gc.cra.kestrel.application.util.CancellationToken;
import ca.gc.cra.kestrel.config.KestrelConfig;
import ca.gc.cra.kestrel.domain.analysis.AnalysisTask;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs every processing module and builds the analysis results map.
 * <p><strong>Why:</strong> Processing modules turn raw analysis artefacts into keyed sections that signatures
 * and reports consume.</p>
 * <p><strong>Role:</strong> First stage of {@link AnalysisPipeline}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Sort descriptors by {@code order} (stable, so equal orders keep registration order).</li>
 *   <li>Run each through the {@link ModuleRunner}, merging {@code key -> data} unless the data is empty, false or zero.</li>
 *   <li>With {@code processingParallelism > 1}, run same-order modules concurrently against a snapshot of the
 *       results and merge their outputs in registration order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One instance may serve consecutive analyses; each run owns its map.</p>
 *
 * @since 0.1.0
 */
public final class ProcessingUseCase {
  private static final Logger log = LoggerFactory.getLogger(ProcessingUseCase.class);

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
  public ProcessingUseCase(PluginRegistry registry, KestrelConfig config, MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.config = Objects.requireNonNull(config, "config");
    this.runner = new ModuleRunner("processing", metrics);
  }

  /**
   * Runs all processing modules for a task.
   *
   * @param task analysis task
   * @return results map keyed by module key, in merge order
   */
  public Map<String, Object> run(AnalysisTask task) {
    return run(task, CancellationToken.NONE);
  }

  /**
   * Runs all processing modules for a task.
   *
   * @param task analysis task
   * @param cancellation cooperative cancellation token checked before each module
   * @return results map keyed by module key, in merge order
   */
  public Map<String, Object> run(AnalysisTask task, CancellationToken cancellation) {
    Objects.requireNonNull(task, "task");
    Map<String, Object> results = new LinkedHashMap<>();
    List<PluginDescriptor<? extends ProcessingModule>> modules = sorted();
    if (modules.isEmpty()) {
      log.info("No processing modules loaded");
      return results;
    }

    ModuleScope scope = new ModuleScope(task, config.analysisPath(task.id()), results, null, cancellation);
    if (config.processingParallelism() <= 1) {
      for (PluginDescriptor<? extends ProcessingModule> descriptor : modules) {
        merge(results, runOne(descriptor, scope));
      }
      return results;
    }

    for (List<PluginDescriptor<? extends ProcessingModule>> group : groupByOrder(modules)) {
      if (group.size() == 1) {
        merge(results, runOne(group.get(0), scope));
      } else if (!runGroup(group, scope, results)) {
        break;
      }
    }
    return results;
  }

  private List<PluginDescriptor<? extends ProcessingModule>> sorted() {
    List<PluginDescriptor<? extends ProcessingModule>> modules =
        new ArrayList<>(registry.list(PluginGroup.PROCESSING, ProcessingModule.class));
    modules.sort(Comparator.comparingInt(PluginDescriptor::order));
    return modules;
  }

  private ModuleExecution<KeyedOutput> runOne(PluginDescriptor<? extends ProcessingModule> descriptor,
      ModuleScope scope) {
    return runner.<ProcessingModule, KeyedOutput>run(descriptor, config.processing(), scope, (module, context) -> {
      Object data = module.run(context);
      return new KeyedOutput(module.key(), data);
    });
  }

  private void merge(Map<String, Object> results, ModuleExecution<KeyedOutput> execution) {
    execution.result()
        .filter(KeyedOutput::isMergeable)
        .ifPresent(output -> results.put(output.key(), output.data()));
  }

  /** Returns {@code false} when the group was interrupted and the stage must stop. */
  private boolean runGroup(List<PluginDescriptor<? extends ProcessingModule>> group, ModuleScope scope,
      Map<String, Object> results) {
    ModuleScope snapshot = scope.withResults(Collections.unmodifiableMap(new LinkedHashMap<>(results)));
    List<Callable<ModuleExecution<KeyedOutput>>> tasks = new ArrayList<>(group.size());
    for (PluginDescriptor<? extends ProcessingModule> descriptor : group) {
      tasks.add(() -> runOne(descriptor, snapshot));
    }

    int workers = Math.min(group.size(), config.processingParallelism());
    ExecutorService executor = Executors.newFixedThreadPool(workers, threadFactory());
    try {
      List<Future<ModuleExecution<KeyedOutput>>> futures = executor.invokeAll(tasks);
      Map<String, String> writers = new HashMap<>();
      for (int i = 0; i < futures.size(); i++) {
        String module = group.get(i).name();
        ModuleExecution<KeyedOutput> execution = await(futures.get(i), module);
        if (execution == null) {
          continue;
        }
        execution.result().filter(KeyedOutput::isMergeable).ifPresent(output -> {
          String previous = writers.putIfAbsent(output.key(), module);
          if (previous != null) {
            log.error("Processing modules \"{}\" and \"{}\" share order {} and both wrote key '{}'; "
                + "dropping the output of \"{}\"", previous, module, group.get(0).order(), output.key(), module);
          } else {
            results.put(output.key(), output.data());
          }
        });
      }
      return true;
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.warn("Processing interrupted; requesting worker shutdown");
      executor.shutdownNow();
      return false;
    } finally {
      executor.shutdown();
    }
  }

  private ModuleExecution<KeyedOutput> await(Future<ModuleExecution<KeyedOutput>> future, String module)
      throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      log.error("Processing worker for module \"{}\" failed", module, ex.getCause());
      return null;
    }
  }

  private static List<List<PluginDescriptor<? extends ProcessingModule>>> groupByOrder(
      List<PluginDescriptor<? extends ProcessingModule>> modules) {
    List<List<PluginDescriptor<? extends ProcessingModule>>> groups = new ArrayList<>();
    List<PluginDescriptor<? extends ProcessingModule>> current = new ArrayList<>();
    for (PluginDescriptor<? extends ProcessingModule> descriptor : modules) {
      if (!current.isEmpty() && current.get(0).order() != descriptor.order()) {
        groups.add(current);
        current = new ArrayList<>();
      }
      current.add(descriptor);
    }
    if (!current.isEmpty()) {
      groups.add(current);
    }
    return groups;
  }

  private static ThreadFactory threadFactory() {
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName("kestrel-processing-" + index.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    };
  }

  /** Output of one processing module. */
  record KeyedOutput(String key, Object data) {
    boolean isMergeable() {
      if (key == null || key.isBlank() || data == null) {
        return false;
      }
      if (data instanceof CharSequence text) {
        return text.length() > 0;
      }
      if (data instanceof Collection<?> collection) {
        return !collection.isEmpty();
      }
      if (data instanceof Map<?, ?> map) {
        return !map.isEmpty();
      }
      if (data instanceof Boolean flag) {
        return flag;
      }
      if (data instanceof Number number) {
        return number.doubleValue() != 0d;
      }
      return true;
    }
  }
}
