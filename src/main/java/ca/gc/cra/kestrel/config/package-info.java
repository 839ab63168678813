/**
 * Configuration records and SnakeYAML loaders for the engine and its modules.
 *
 * <p>{@link ca.gc.cra.kestrel.config.YamlConfigLoader} resolves {@code kestrel.yaml};
 * {@link ca.gc.cra.kestrel.config.AnalysisOverrides} resolves the per-analysis override file.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.kestrel.config;
