package ca.gc.cra.kestrel.infrastructure.modules;

import ca.gc.cra.kestrel.application.plugin.PluginDescriptor;
import ca.gc.cra.kestrel.application.plugin.PluginRegistry;
import ca.gc.cra.kestrel.application.port.ClockPort;
import ca.gc.cra.kestrel.config.KestrelConfig;
import ca.gc.cra.kestrel.infrastructure.json.JsonSupport;
import ca.gc.cra.kestrel.infrastructure.time.SystemClockAdapter;
import java.util.Objects;

/**
 * Registers the modules shipped with KESTREL.
 *
 * @since 0.1.0
 */
public final class BundledPlugins {
  private BundledPlugins() {}

  /**
   * Registers the bundled processing and reporting modules using the system clock.
   *
   * @param registry target registry
   * @param config engine configuration
   */
  public static void registerAll(PluginRegistry registry, KestrelConfig config) {
    registerAll(registry, config, SystemClockAdapter.INSTANCE);
  }

  /**
   * Registers the bundled processing and reporting modules.
   *
   * @param registry target registry
   * @param config engine configuration
   * @param clock timestamp source for {@code analysisinfo}
   */
  public static void registerAll(PluginRegistry registry, KestrelConfig config, ClockPort clock) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(clock, "clock");
    JsonSupport json = new JsonSupport();
    String version = config.engineVersion();
    registry.register(PluginDescriptor.processing(
        AnalysisInfoProcessing.NAME, AnalysisInfoProcessing.class, 0, () -> new AnalysisInfoProcessing(clock, version)));
    registry.register(PluginDescriptor.processing(
        BehaviorProcessing.NAME, BehaviorProcessing.class, PluginDescriptor.DEFAULT_ORDER,
        () -> new BehaviorProcessing(json)));
    registry.register(PluginDescriptor.reporting(
        LoggingReport.NAME, LoggingReport.class, PluginDescriptor.DEFAULT_ORDER, LoggingReport::new));
  }
}
