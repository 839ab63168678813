package ca.gc.cra.kestrel.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Per-analysis settings read from {@code analysis.yaml} inside the analysis directory and handed to
 * reporting modules.
 *
 * <p>A missing file yields empty overrides. A malformed file is logged at WARN and also yields empty
 * overrides, so a bad override never blocks reporting.</p>
 *
 * @param values top-level override sections
 * @since 0.1.0
 */
public record AnalysisOverrides(Map<String, Object> values) {
  /** File name looked up inside the analysis directory. */
  public static final String FILE_NAME = "analysis.yaml";

  private static final Logger log = LoggerFactory.getLogger(AnalysisOverrides.class);
  private static final AnalysisOverrides EMPTY = new AnalysisOverrides(Map.of());

  /**
   * Freezes the override map.
   *
   * @param values override sections; {@code null} becomes empty
   */
  public AnalysisOverrides {
    values = values == null || values.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /**
   * Returns overrides without any value.
   *
   * @return empty overrides
   */
  public static AnalysisOverrides empty() {
    return EMPTY;
  }

  /**
   * Loads overrides from {@code <analysisPath>/analysis.yaml}.
   *
   * @param analysisPath analysis directory
   * @return parsed overrides; empty when the file is absent or unreadable
   */
  public static AnalysisOverrides load(Path analysisPath) {
    Objects.requireNonNull(analysisPath, "analysisPath");
    Path file = analysisPath.resolve(FILE_NAME);
    if (!Files.isRegularFile(file)) {
      return EMPTY;
    }
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return EMPTY;
      }
      return new AnalysisOverrides(YamlConfigLoader.asMap(document, FILE_NAME));
    } catch (IOException | YAMLException | IllegalArgumentException ex) {
      log.warn("Ignoring unreadable analysis overrides at {}: {}", file, ex.getMessage());
      return EMPTY;
    }
  }

  /**
   * Returns one override section.
   *
   * @param name section name
   * @return section entries; empty when absent or not a mapping
   */
  public Map<String, Object> section(String name) {
    Object section = values.get(Objects.requireNonNull(name, "name"));
    if (section instanceof Map<?, ?> map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      map.forEach((key, value) -> copy.put(String.valueOf(key), value));
      return Collections.unmodifiableMap(copy);
    }
    return Map.of();
  }

  /**
   * Returns a single override value.
   *
   * @param section section name
   * @param key entry name
   * @return value when present
   */
  public Optional<Object> value(String section, String key) {
    return Optional.ofNullable(section(section).get(key));
  }

  /**
   * Indicates whether no override was supplied.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return values.isEmpty();
  }
}
