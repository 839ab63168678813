package ca.gc.cra.kestrel.api.tools;

import ca.gc.cra.kestrel.api.CliArgsParser;
import ca.gc.cra.kestrel.api.CliInput;
import ca.gc.cra.kestrel.api.CliPrinter;
import ca.gc.cra.kestrel.api.ExitCode;
import ca.gc.cra.kestrel.api.RulePaths;
import ca.gc.cra.kestrel.application.plugin.PluginDescriptor;
import ca.gc.cra.kestrel.application.plugin.PluginRegistry;
import ca.gc.cra.kestrel.application.port.MetricsPort;
import ca.gc.cra.kestrel.application.signatures.SignatureEngine;
import ca.gc.cra.kestrel.application.signatures.rules.DeclarativeSignature;
import ca.gc.cra.kestrel.application.signatures.rules.SignatureRuleProvider;
import ca.gc.cra.kestrel.config.KestrelConfig;
import ca.gc.cra.kestrel.config.KestrelVersion;
import ca.gc.cra.kestrel.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI that compiles signature rule files and reports which rules this engine version would load.
 */
public final class SignatureRulesCli {
  private static final Logger log = LoggerFactory.getLogger(SignatureRulesCli.class);
  private static final String HELP_TEXT = """
      KESTREL signature rule check

      Usage:
        rules rules=a.yaml[,b.yaml] [version=2.0.0]

      Options:
        rules=PATHS           Comma or semicolon separated list of rule files to compile
        version=X.Y.Z         Engine version used for compatibility checks (default current)

      Flags:
        --help               Show this message
        --verbose            Enable verbose logging
      """;

  private SignatureRulesCli() {}

  /**
   * Compiles the requested rule files and prints one line per signature.
   *
   * @param args raw CLI arguments
   * @return success, or the failure class of the first problem found
   */
  public static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.strip());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.info("Verbose logging enabled for rule check");
    }

    List<Path> rulePaths;
    String version;
    try {
      Map<String, String> options = CliArgsParser.toMap(input.keyValueArgs());
      rulePaths = RulePaths.resolve(options.get("rules"));
      version = options.getOrDefault("version", KestrelVersion.CURRENT);
    } catch (IllegalArgumentException ex) {
      CliPrinter.println(ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }
    if (rulePaths.isEmpty()) {
      CliPrinter.println("No rule files supplied. Use rules=path/to/file.yaml");
      return ExitCode.INVALID_ARGS;
    }

    List<PluginDescriptor<DeclarativeSignature>> descriptors;
    try {
      descriptors = new SignatureRuleProvider().load(rulePaths);
    } catch (IOException ex) {
      log.error("Failed to read rule files {}", rulePaths, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      CliPrinter.println("Invalid rules: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    SignatureEngine engine = new SignatureEngine(
        new PluginRegistry(), version, KestrelConfig.DEFAULT_MAX_CASCADE_DEPTH, MetricsPort.NO_OP);
    int loadable = 0;
    for (PluginDescriptor<DeclarativeSignature> descriptor : descriptors) {
      boolean compatible = engine.isCompatible(descriptor);
      String status;
      if (!descriptor.enabled()) {
        status = "disabled";
      } else if (!compatible) {
        status = "incompatible";
      } else {
        status = "ok";
        loadable++;
      }
      CliPrinter.println("  - " + descriptor.name() + " -> " + status);
    }
    CliPrinter.println("\nCompiled " + descriptors.size() + " signature(s); "
        + loadable + " would load on engine " + version + ".");
    return ExitCode.SUCCESS;
  }
}
