package ca.gc.cra.kestrel.infrastructure.modules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.kestrel.application.port.ProcessingException;
import ca.gc.cra.kestrel.application.port.context.ExecutionContext;
import ca.gc.cra.kestrel.config.ModuleOptions;
import ca.gc.cra.kestrel.domain.analysis.AnalysisTask;
import ca.gc.cra.kestrel.domain.trace.BehaviorTrace;
import ca.gc.cra.kestrel.domain.trace.ProcessRecord;
import ca.gc.cra.kestrel.infrastructure.json.JsonSupport;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BehaviorProcessingTest {
  private static final Path ANALYSIS = Path.of("src/test/resources/analyses/5");

  @TempDir Path tempDir;

  private final BehaviorProcessing module = new BehaviorProcessing(new JsonSupport());

  @Test
  void loadsDefaultBehaviourLog() throws Exception {
    Object output = module.run(context(ANALYSIS, ModuleOptions.enabled("behavior")));

    BehaviorTrace trace = BehaviorTrace.from(Map.of(module.key(), output));
    assertEquals(2, trace.processes().size());
    ProcessRecord first = trace.processes().get(0);
    assertEquals(1337L, first.pid());
    assertEquals("invoice.exe", first.processName());
    assertEquals(3, first.calls().size());
    assertEquals("UpdaterSvc", first.calls().get(0).argument("service_name").orElseThrow());
    assertEquals(2, first.calls().get(2).index());
    assertTrue(((Map<?, ?>) output).containsKey("summary"));
  }

  @Test
  void fileOptionResolvesAgainstAnalysisPathAndAcceptsBareArrays() throws Exception {
    Files.writeString(tempDir.resolve("trace.json"),
        "[{\"pid\": \"9\", \"process_name\": \"a.exe\", \"calls\": [{\"api\": \"Sleep\", \"category\": \"system\"}]}]");
    ModuleOptions options = new ModuleOptions("behavior", Map.of("enabled", true, "file", "trace.json"));

    Object output = module.run(context(tempDir, options));

    BehaviorTrace trace = BehaviorTrace.from(Map.of("behavior", output));
    assertEquals(9L, trace.processes().get(0).pid());
    assertEquals(1, trace.callCount());
  }

  @Test
  void missingLogIsAProcessingFailure() {
    ProcessingException ex = assertThrows(ProcessingException.class,
        () -> module.run(context(tempDir, ModuleOptions.enabled("behavior"))));
    assertTrue(ex.getMessage().contains("behavior.json"));
  }

  @Test
  void malformedLogIsAProcessingFailure() throws Exception {
    Files.createDirectories(tempDir.resolve("logs"));
    Files.writeString(tempDir.resolve("logs").resolve("behavior.json"), "{\"processes\": [");

    assertThrows(ProcessingException.class, () -> module.run(context(tempDir, ModuleOptions.enabled("behavior"))));
  }

  @Test
  void scalarDocumentIsRejected() throws Exception {
    Files.createDirectories(tempDir.resolve("logs"));
    Files.writeString(tempDir.resolve("logs").resolve("behavior.json"), "42");

    assertThrows(ProcessingException.class, () -> module.run(context(tempDir, ModuleOptions.enabled("behavior"))));
  }

  private static ExecutionContext context(Path analysis, ModuleOptions options) {
    return new ExecutionContext(AnalysisTask.of(5), analysis, options, new HashMap<>(), null, null);
  }
}
