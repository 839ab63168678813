package ca.gc.cra.kestrel.api;

import ca.gc.cra.kestrel.application.pipeline.AnalysisPipeline;
import ca.gc.cra.kestrel.application.pipeline.AnalysisResult;
import ca.gc.cra.kestrel.application.pipeline.AuxiliaryUseCase;
import ca.gc.cra.kestrel.application.pipeline.ModuleExecution;
import ca.gc.cra.kestrel.application.plugin.PluginRegistry;
import ca.gc.cra.kestrel.application.port.MetricsPort;
import ca.gc.cra.kestrel.application.signatures.rules.SignatureRuleProvider;
import ca.gc.cra.kestrel.application.util.CancellationToken;
import ca.gc.cra.kestrel.config.KestrelConfig;
import ca.gc.cra.kestrel.config.ModuleConfig;
import ca.gc.cra.kestrel.config.ModuleOptions;
import ca.gc.cra.kestrel.config.YamlConfigLoader;
import ca.gc.cra.kestrel.domain.analysis.AnalysisTask;
import ca.gc.cra.kestrel.domain.detection.Detection;
import ca.gc.cra.kestrel.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.kestrel.infrastructure.modules.AnalysisInfoProcessing;
import ca.gc.cra.kestrel.infrastructure.modules.BehaviorProcessing;
import ca.gc.cra.kestrel.infrastructure.modules.BundledPlugins;
import ca.gc.cra.kestrel.infrastructure.modules.LoggingReport;
import ca.gc.cra.kestrel.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> CLI adapter that runs processing, signatures and reporting for one stored analysis.
 * <p><strong>Why:</strong> Lets operators re-analyse a task directory without the scheduler.</p>
 * <p><strong>Role:</strong> Adapter wiring configuration, bundled plugins and rule files into {@link AnalysisPipeline}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; each invocation builds its own registry.</p>
 *
 * @since 0.1.0
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final Path DEFAULT_CONFIG = Path.of("kestrel.yaml");
  private static final String DEFAULT_MACHINE = "local";
  private static final String SUMMARY_USAGE =
      "usage: analyze task=<id> [config=kestrel.yaml] [rules=a.yaml,b.yaml] [behavior=PATH] [storage=DIR]";
  private static final String HELP_TEXT = """
      KESTREL analysis runner

      Usage:
        analyze task=<id> [options]

      Options:
        task=ID              Numeric analysis task identifier (required)
        config=PATH          Engine configuration (default kestrel.yaml when present)
        rules=PATHS          Comma or semicolon separated list of signature rule files
        behavior=PATH        Behaviour log to load instead of logs/behavior.json
        storage=DIR          Override the storage root holding analyses/<id>
        machine=NAME         Machine label handed to auxiliary modules (default local)

      Flags:
        --help               Show this message
        --verbose            Enable DEBUG logging

      Example:
        kestrel analyze task=42 rules=signatures/injection.yaml
      """;

  private AnalyzeCli() {}

  /**
   * Runs one analysis and prints the detections.
   *
   * @param args CLI arguments in {@code key=value} form
   * @return exit code describing the outcome
   */
  public static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.strip());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for analyze");
    }

    Map<String, String> options;
    AnalysisTask task;
    List<Path> rules;
    try {
      options = CliArgsParser.toMap(input.keyValueArgs());
      task = AnalysisTask.of(parseTaskId(options.get("task")));
      rules = RulePaths.resolve(options.get("rules"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    KestrelConfig config;
    try {
      config = resolveConfig(options);
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      CliPrinter.println("Invalid configuration: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      return analyze(task, config, rules, options.getOrDefault("machine", DEFAULT_MACHINE), metrics);
    }
  }

  static ExitCode analyze(
      AnalysisTask task, KestrelConfig config, List<Path> rules, String machine, MetricsPort metrics) {
    PluginRegistry registry = new PluginRegistry();
    BundledPlugins.registerAll(registry, config);
    try {
      if (!rules.isEmpty()) {
        new SignatureRuleProvider().registerAll(registry, rules);
      }
    } catch (IOException ex) {
      log.error("Unable to read signature rules {}", rules, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid signature rules: {}", ex.getMessage());
      CliPrinter.println("Invalid signature rules: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    CancellationToken token = new CancellationToken();
    Thread hook = new Thread(token::cancel, "kestrel-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    AuxiliaryUseCase auxiliary = new AuxiliaryUseCase(registry, config, metrics);
    try {
      auxiliary.start(task, machine, token);
      AnalysisResult result = new AnalysisPipeline(registry, config, metrics).run(task, token);
      print(task, result);
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      log.error("Analysis of task {} failed", task.id(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      auxiliary.stop();
      removeHook(hook);
    }
  }

  private static KestrelConfig resolveConfig(Map<String, String> options) throws IOException {
    String configArg = options.get("config");
    KestrelConfig config;
    if (configArg != null) {
      Path path = Path.of(configArg);
      config = YamlConfigLoader.load(path)
          .orElseThrow(() -> new IllegalArgumentException("configuration file not found: " + path));
    } else {
      Optional<KestrelConfig> fromDefault = YamlConfigLoader.load(DEFAULT_CONFIG);
      config = fromDefault.orElseGet(AnalyzeCli::bundledDefaults);
    }
    String storage = options.get("storage");
    if (storage != null) {
      config = config.withStorageRoot(Path.of(storage));
    }
    String behavior = options.get("behavior");
    if (behavior != null) {
      ModuleOptions behaviorOptions = new ModuleOptions(
          BehaviorProcessing.NAME, Map.of("enabled", Boolean.TRUE, "file", behavior));
      config = config.withModules(config.processing().with(behaviorOptions), config.reporting());
    }
    return config;
  }

  static KestrelConfig bundledDefaults() {
    KestrelConfig defaults = KestrelConfig.defaults();
    return defaults.withModules(
        ModuleConfig.of(
            ModuleOptions.enabled(AnalysisInfoProcessing.NAME),
            ModuleOptions.enabled(BehaviorProcessing.NAME)),
        ModuleConfig.of(ModuleOptions.enabled(LoggingReport.NAME)));
  }

  private static long parseTaskId(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("task is required");
    }
    try {
      long id = Long.parseLong(raw.trim());
      if (id <= 0) {
        throw new IllegalArgumentException("task must be positive (was " + raw + ")");
      }
      return id;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("task must be numeric (was " + raw + ")", ex);
    }
  }

  private static void print(AnalysisTask task, AnalysisResult result) {
    List<Detection> detections = result.detections();
    CliPrinter.println("Task " + task.id() + ": " + detections.size() + " signature(s) matched");
    for (Detection detection : detections) {
      Object marks = detection.payload().getOrDefault("markcount", 0);
      CliPrinter.println("  [" + detection.severity() + "] " + detection.name() + " marks=" + marks);
    }
    long failedReports = result.reports().stream().filter(r -> r.outcome().failed()).count();
    long ranReports = result.reports().stream().filter(ModuleExecution::succeeded).count();
    CliPrinter.println("Reports: " + ranReports + " succeeded, " + failedReports + " failed");
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; shutdown hook left registered");
    }
  }
}
