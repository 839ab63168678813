package ca.gc.cra.kestrel.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@code kestrel.yaml}: an {@code engine} section plus one section per plugin group whose
 * entries are keyed by module short name.
 *
 * <pre>
 * engine:
 *   storageRoot: /srv/kestrel/storage
 *   maxCascadeDepth: 32
 * processing:
 *   behavior:
 *     enabled: true
 * </pre>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads configuration from {@code path}.
   *
   * @param path location of the YAML configuration
   * @return configuration, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<KestrelConfig> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(new Yaml().load(reader)));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  static KestrelConfig parse(Object document) {
    if (document == null) {
      return KestrelConfig.defaults();
    }
    Map<String, Object> root = asMap(document, "root");
    Map<String, Object> engine = sectionOrEmpty(root, "engine");

    Path storageRoot = engine.get("storageRoot") == null
        ? KestrelConfig.DEFAULT_STORAGE_ROOT
        : Path.of(engine.get("storageRoot").toString().trim());
    String version = engine.get("version") == null ? null : engine.get("version").toString();
    int maxDepth = toInt(engine.get("maxCascadeDepth"), KestrelConfig.DEFAULT_MAX_CASCADE_DEPTH, "engine.maxCascadeDepth");
    int parallelism = toInt(engine.get("processingParallelism"), 1, "engine.processingParallelism");

    return new KestrelConfig(
        storageRoot,
        version,
        maxDepth,
        parallelism,
        moduleConfig(root, "auxiliary"),
        moduleConfig(root, "processing"),
        moduleConfig(root, "reporting"));
  }

  private static ModuleConfig moduleConfig(Map<String, Object> root, String group) {
    Map<String, Object> section = sectionOrEmpty(root, group);
    Map<String, ModuleOptions> modules = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : section.entrySet()) {
      String name = entry.getKey().trim();
      if (name.isEmpty()) {
        throw new IllegalArgumentException(group + " section contains a blank module name");
      }
      Object value = entry.getValue();
      Map<String, Object> options = value == null ? Map.of() : asMap(value, group + "." + name);
      modules.put(name, new ModuleOptions(name, options));
    }
    return ModuleConfig.of(modules);
  }

  private static Map<String, Object> sectionOrEmpty(Map<String, Object> root, String key) {
    Object section = findSection(root, key);
    return section == null ? Map.of() : asMap(section, key);
  }

  static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static int toInt(Object value, int defaultValue, String context) {
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number number) {
      return number.intValue();
    }
    String text = value.toString().trim();
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + context + ": '" + text + "'");
    }
  }
}
