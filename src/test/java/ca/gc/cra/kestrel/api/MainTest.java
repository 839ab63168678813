package ca.gc.cra.kestrel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  private static final String STORAGE = "storage=src/test/resources";
  private static final String RULES =
      "rules=src/test/resources/signatures/injection.yaml,src/test/resources/signatures/network.yaml";

  private StringWriter output;

  @BeforeEach
  void captureOutput() {
    output = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpWithoutCommandPrintsDispatcherHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(output.toString().contains("KESTREL command dispatcher"));
  }

  @Test
  void helpIsForwardedToSubcommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"analyze", "--help"}));
    assertTrue(output.toString().contains("KESTREL analysis runner"));
  }

  @Test
  void missingCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(output.toString().contains("usage: kestrel"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"replay"}));
  }

  @Test
  void analyzeRequiresTask() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"analyze", STORAGE}));
    assertTrue(output.toString().contains("task is required"));
  }

  @Test
  void analyzeRejectsNonNumericTask() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"analyze", "task=abc"}));
    assertTrue(output.toString().contains("task must be numeric"));
  }

  @Test
  void analyzeRejectsMissingRuleFile() {
    assertEquals(ExitCode.INVALID_ARGS,
        Main.run(new String[] {"analyze", "task=5", "rules=does/not/exist.yaml"}));
    assertTrue(output.toString().contains("Rule file not found"));
  }

  @Test
  void analyzeReportsMissingExplicitConfig(@TempDir Path dir) {
    String config = "config=" + dir.resolve("absent.yaml");
    assertEquals(ExitCode.CONFIG_ERROR, Main.run(new String[] {"analyze", "task=5", config}));
    assertTrue(output.toString().contains("configuration file not found"));
  }

  @Test
  void analyzeRunsStoredTaskWithBundledDefaults() {
    ExitCode exit = Main.run(new String[] {"analyze", "task=5", STORAGE, RULES});

    assertEquals(ExitCode.SUCCESS, exit);
    String text = output.toString();
    assertTrue(text.contains("Task 5: 4 signature(s) matched"), text);
    assertTrue(text.contains("[5] persistent_injector"), text);
    assertTrue(text.contains("Reports: 1 succeeded, 0 failed"), text);
  }

  @Test
  void analyzeHonoursExplicitConfigAndBehaviorOverride(@TempDir Path dir) throws Exception {
    Path config = dir.resolve("kestrel.yaml");
    Files.writeString(config, String.join("\n",
        "engine:",
        "  storageRoot: " + dir.toString().replace('\\', '/'),
        "processing:",
        "  behavior:",
        "    enabled: true",
        "reporting:",
        "  logreport:",
        "    enabled: false",
        ""));
    Path behavior = dir.resolve("trace.json");
    Files.writeString(behavior, "{\"processes\": [{\"pid\": 7, \"process_name\": \"a.exe\", \"calls\": ["
        + "{\"api\": \"getaddrinfo\", \"category\": \"network\", \"arguments\": {\"hostname\": \"www.pastebin.com\"}}"
        + "]}]}");

    ExitCode exit = Main.run(new String[] {
        "analyze", "task=9", "config=" + config, "behavior=" + behavior,
        "rules=src/test/resources/signatures/network.yaml"});

    assertEquals(ExitCode.SUCCESS, exit);
    String text = output.toString();
    assertTrue(text.contains("Task 9: 1 signature(s) matched"), text);
    assertTrue(text.contains("[1] contacts_pastebin marks=1"), text);
    assertTrue(text.contains("Reports: 0 succeeded, 0 failed"), text);
  }

  @Test
  void rulesCommandListsCompatibility() {
    ExitCode exit = Main.run(new String[] {"rules", "rules=src/test/resources/signatures/injection.yaml"});

    assertEquals(ExitCode.SUCCESS, exit);
    String text = output.toString();
    assertTrue(text.contains("  - creates_service -> ok"), text);
    assertTrue(text.contains("  - future_rule -> incompatible"), text);
    assertTrue(text.contains("  - disabled_rule -> disabled"), text);
    assertTrue(text.contains("Compiled 5 signature(s); 3 would load"), text);
  }

  @Test
  void rulesCommandRequiresFiles() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"rules"}));
    assertTrue(output.toString().contains("No rule files supplied"));
  }

  @Test
  void rulesCommandRejectsDuplicateNames() {
    ExitCode exit = Main.run(new String[] {
        "rules", "rules=src/test/resources/signatures/injection.yaml;src/test/resources/signatures/duplicate.yaml"});
    assertEquals(ExitCode.CONFIG_ERROR, exit);
    assertTrue(output.toString().contains("Invalid rules"));
  }
}
