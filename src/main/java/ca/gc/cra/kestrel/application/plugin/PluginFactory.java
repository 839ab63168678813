package ca.gc.cra.kestrel.application.plugin;

/**
 * Creates a fresh plugin instance for one analysis run.
 *
 * @param <T> plugin contract
 * @since 0.1.0
 */
@FunctionalInterface
public interface PluginFactory<T> {
  /**
   * Instantiates the plugin.
   *
   * @return new plugin instance
   * @throws Exception when the plugin cannot be constructed
   */
  T create() throws Exception;
}
