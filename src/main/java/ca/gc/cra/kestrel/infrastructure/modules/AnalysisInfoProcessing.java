package ca.gc.cra.kestrel.infrastructure.modules;

import ca.gc.cra.kestrel.application.port.ClockPort;
import ca.gc.cra.kestrel.application.port.ProcessingModule;
import ca.gc.cra.kestrel.application.port.context.ExecutionContext;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Records general facts about the analysis under the {@code info} results key.
 *
 * @since 0.1.0
 */
public final class AnalysisInfoProcessing implements ProcessingModule {
  /** Canonical module name. */
  public static final String NAME = "analysisinfo";

  private final ClockPort clock;
  private final String engineVersion;

  /**
   * Creates the module.
   *
   * @param clock timestamp source
   * @param engineVersion running engine version
   */
  public AnalysisInfoProcessing(ClockPort clock, String engineVersion) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.engineVersion = Objects.requireNonNull(engineVersion, "engineVersion");
  }

  @Override
  public String key() {
    return "info";
  }

  @Override
  public Object run(ExecutionContext context) {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("id", context.task().id());
    info.put("target", context.task().target());
    info.put("version", engineVersion);
    info.put("analysis_path", context.analysisPath().toString());
    info.put("ended", Instant.ofEpochMilli(clock.nowMillis()).toString());
    return info;
  }
}
