package ca.gc.cra.kestrel.application.signatures.rules;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads declarative signatures from YAML files into intermediate definitions.
 *
 * @since 0.1.0
 */
final class RuleSetLoader {
  List<SignatureRuleDefinition> load(List<Path> sources) throws IOException {
    Objects.requireNonNull(sources, "sources");
    List<SignatureRuleDefinition> rules = new ArrayList<>();
    Set<String> names = new LinkedHashSet<>();

    for (Path path : sources) {
      for (SignatureRuleDefinition rule : parseDocument(path)) {
        if (!names.add(rule.name())) {
          throw new IllegalArgumentException("Duplicate signature name detected: " + rule.name());
        }
        rules.add(rule);
      }
    }
    return List.copyOf(rules);
  }

  private List<SignatureRuleDefinition> parseDocument(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IOException("Rule file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object rootObj = new Yaml().load(reader);
      if (rootObj == null) {
        return List.of();
      }
      Map<String, Object> root = asMap(rootObj, "root");

      int version = toInt(root.get("version"), "version");
      if (version != 1) {
        throw new IllegalArgumentException("Unsupported rule version " + version + " in " + path);
      }

      List<SignatureRuleDefinition> definitions = new ArrayList<>();
      Object signaturesNode = root.get("signatures");
      if (signaturesNode instanceof Iterable<?> iterable) {
        for (Object node : iterable) {
          definitions.add(parseRule(asMap(node, "signature")));
        }
      } else if (signaturesNode != null) {
        throw new IllegalArgumentException("signatures must be a list in " + path);
      }
      return List.copyOf(definitions);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML rules at " + path, ex);
    }
  }

  private SignatureRuleDefinition parseRule(Map<String, Object> map) {
    String name = requireString(map, "name");
    int severity = toInt(map.getOrDefault("severity", 1), "severity");
    String description = toString(map.get("description"));
    boolean enabled = !map.containsKey("enabled") || toBoolean(map.get("enabled"), "enabled");
    int threshold = toInt(map.getOrDefault("threshold", 1), "threshold");
    if (threshold < 1) {
      throw new IllegalArgumentException("threshold of signature " + name + " must be at least 1");
    }

    return new SignatureRuleDefinition(
        name,
        severity,
        description,
        toStringList(map.get("families"), "families"),
        toStringList(map.get("references"), "references"),
        toStringList(map.get("ttp"), "ttp"),
        enabled,
        toOptionalString(map.get("minimum")),
        toOptionalString(map.get("maximum")),
        parseFilters(map.get("filters")),
        parseArguments(map.get("arguments")),
        threshold,
        toStringList(map.get("requires"), "requires"));
  }

  private FilterDefinition parseFilters(Object node) {
    if (node == null) {
      return FilterDefinition.NONE;
    }
    Map<String, Object> map = asMap(node, "filters");
    return new FilterDefinition(
        toStringList(map.get("processes"), "filters.processes"),
        toStringList(map.get("apis"), "filters.apis"),
        toStringList(map.get("categories"), "filters.categories"));
  }

  private Map<String, ArgumentConditionDefinition> parseArguments(Object node) {
    if (node == null) {
      return Map.of();
    }
    Map<String, Object> map = asMap(node, "arguments");
    Map<String, ArgumentConditionDefinition> result = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      String key = entry.getKey();
      Object value = entry.getValue();
      ArgumentConditionDefinition condition;
      if (value instanceof Map<?, ?> nested) {
        Map<String, Object> nestedMap = asMap(nested, key);
        condition = new ArgumentConditionDefinition(
            toOptionalString(nestedMap.get("equals")),
            toOptionalString(nestedMap.get("contains")),
            toOptionalString(nestedMap.get("regex")),
            nestedMap.containsKey("ignoreCase") && toBoolean(nestedMap.get("ignoreCase"), key + ".ignoreCase"));
      } else {
        condition = new ArgumentConditionDefinition(toString(value), null, null, false);
      }
      result.put(key, condition);
    }
    return Collections.unmodifiableMap(result);
  }

  private Map<String, Object> asMap(Object node, String context) {
    if (node == null) {
      throw new IllegalArgumentException(context + " section is missing");
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      Object keyObj = entry.getKey();
      if (!(keyObj instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private String requireString(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required field: " + key);
    }
    return toString(value);
  }

  private List<String> toStringList(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    List<String> values = new ArrayList<>();
    if (node instanceof String single) {
      values.add(single.strip());
    } else if (node instanceof Iterable<?> iterable) {
      for (Object value : iterable) {
        values.add(toString(value).strip());
      }
    } else {
      throw new IllegalArgumentException(context + " must be string or list");
    }
    values.removeIf(String::isEmpty);
    return List.copyOf(values);
  }

  private String toOptionalString(Object value) {
    if (value == null) {
      return null;
    }
    String str = toString(value);
    return str.isBlank() ? null : str;
  }

  private String toString(Object value) {
    if (value == null) {
      return "";
    }
    return value.toString();
  }

  private int toInt(Object value, String context) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Integer.parseInt(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid integer for " + context + ": '" + str + "'");
      }
    }
    throw new IllegalArgumentException("Invalid integer for " + context + ": " + value);
  }

  private boolean toBoolean(Object value, String context) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof String str) {
      String normalized = str.trim().toLowerCase(Locale.ROOT);
      if (normalized.equals("true") || normalized.equals("false")) {
        return Boolean.parseBoolean(normalized);
      }
    }
    throw new IllegalArgumentException("Invalid boolean for " + context + ": " + value);
  }
}
