package ca.gc.cra.kestrel.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.kestrel.application.plugin.PluginDescriptor;
import ca.gc.cra.kestrel.application.plugin.PluginRegistry;
import ca.gc.cra.kestrel.application.port.AuxiliaryModule;
import ca.gc.cra.kestrel.application.port.ModuleException;
import ca.gc.cra.kestrel.application.port.context.ExecutionContext;
import ca.gc.cra.kestrel.application.util.CancellationToken;
import ca.gc.cra.kestrel.config.KestrelConfig;
import ca.gc.cra.kestrel.config.ModuleConfig;
import ca.gc.cra.kestrel.config.ModuleOptions;
import ca.gc.cra.kestrel.domain.analysis.AnalysisTask;
import ca.gc.cra.kestrel.support.LogCapture;
import ca.gc.cra.kestrel.support.RecordingMetrics;
import ch.qos.logback.classic.Level;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AuxiliaryUseCaseTest {
  @TempDir Path storage;

  private final PluginRegistry registry = new PluginRegistry();
  private final List<String> events = new ArrayList<>();

  @Test
  void startsConfiguredModulesAndStopsThemInStartOrder() {
    registry.register(PluginDescriptor.auxiliary("sniffer", RecordingAuxiliary.class,
        () -> new RecordingAuxiliary("sniffer", events, false, false)));
    registry.register(PluginDescriptor.auxiliary("screenshots", RecordingAuxiliary.class,
        () -> new RecordingAuxiliary("screenshots", events, false, false)));
    registry.register(PluginDescriptor.auxiliary("mitm", RecordingAuxiliary.class,
        () -> new RecordingAuxiliary("mitm", events, false, false)));
    AuxiliaryUseCase useCase = useCase(ModuleOptions.enabled("sniffer"), ModuleOptions.enabled("screenshots"));

    List<ModuleExecution<AuxiliaryModule>> executions =
        useCase.start(AnalysisTask.of(3), "win7-x64", CancellationToken.NONE);

    assertEquals(List.of(ModuleOutcome.SUCCEEDED, ModuleOutcome.SUCCEEDED, ModuleOutcome.SKIPPED_UNCONFIGURED),
        executions.stream().map(ModuleExecution::outcome).toList());
    assertEquals(2, useCase.stop());
    assertEquals(List.of("start sniffer@win7-x64", "start screenshots@win7-x64", "stop sniffer", "stop screenshots"),
        events);
    assertEquals(0, useCase.stop(), "stop forgets modules once stopped");
  }

  @Test
  void failedStartIsNotStoppedAndStopFailuresAreWarnings() {
    registry.register(PluginDescriptor.auxiliary("sniffer", RecordingAuxiliary.class,
        () -> new RecordingAuxiliary("sniffer", events, true, false)));
    registry.register(PluginDescriptor.auxiliary("human", RecordingAuxiliary.class,
        () -> new RecordingAuxiliary("human", events, false, true)));
    AuxiliaryUseCase useCase = useCase(ModuleOptions.enabled("sniffer"), ModuleOptions.enabled("human"));

    List<ModuleExecution<AuxiliaryModule>> executions =
        useCase.start(AnalysisTask.of(3), "win7", CancellationToken.NONE);
    assertEquals(ModuleOutcome.FAILED, executions.get(0).outcome());

    try (LogCapture logs = LogCapture.of(AuxiliaryUseCase.class)) {
      assertEquals(0, useCase.stop());
      assertTrue(logs.contains(Level.WARN, "Unable to stop auxiliary module \"human\" for task #3"));
    }
  }

  @Test
  void linkageErrorOnStopDoesNotSkipLaterModules() {
    registry.register(PluginDescriptor.auxiliary("memdump", UnlinkedAuxiliary.class, UnlinkedAuxiliary::new));
    registry.register(PluginDescriptor.auxiliary("sniffer", RecordingAuxiliary.class,
        () -> new RecordingAuxiliary("sniffer", events, false, false)));
    AuxiliaryUseCase useCase = useCase(ModuleOptions.enabled("memdump"), ModuleOptions.enabled("sniffer"));
    useCase.start(AnalysisTask.of(4), "win10", CancellationToken.NONE);

    try (LogCapture logs = LogCapture.of(AuxiliaryUseCase.class)) {
      assertEquals(1, useCase.stop());
      assertTrue(logs.contains(Level.WARN, "Unable to stop auxiliary module \"memdump\" for task #4"));
    }
    assertEquals(List.of("start sniffer@win10", "stop sniffer"), events);
  }

  private AuxiliaryUseCase useCase(ModuleOptions... sections) {
    KestrelConfig config = new KestrelConfig(storage, "2.0.0", 64, 1,
        ModuleConfig.of(sections), ModuleConfig.empty(), ModuleConfig.empty());
    return new AuxiliaryUseCase(registry, config, new RecordingMetrics());
  }

  static final class UnlinkedAuxiliary implements AuxiliaryModule {
    @Override
    public void start(ExecutionContext context, String machine) {
    }

    @Override
    public void stop() {
      throw new NoClassDefFoundError("com/volatility/Plugin");
    }
  }

  static final class RecordingAuxiliary implements AuxiliaryModule {
    private final String name;
    private final List<String> events;
    private final boolean failStart;
    private final boolean failStop;

    RecordingAuxiliary(String name, List<String> events, boolean failStart, boolean failStop) {
      this.name = name;
      this.events = events;
      this.failStart = failStart;
      this.failStop = failStop;
    }

    @Override
    public void start(ExecutionContext context, String machine) throws ModuleException {
      if (failStart) {
        throw new ModuleException("tcpdump not found");
      }
      events.add("start " + name + "@" + machine);
    }

    @Override
    public void stop() throws ModuleException {
      if (failStop) {
        throw new ModuleException("already stopped");
      }
      events.add("stop " + name);
    }
  }
}
