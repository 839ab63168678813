package ca.gc.cra.kestrel.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolved configuration section of one module.
 *
 * <p>A section without an {@code enabled} entry counts as disabled.</p>
 *
 * @param name canonical short name of the module owning the section
 * @param values raw option values keyed by option name
 * @since 0.1.0
 */
public record ModuleOptions(String name, Map<String, Object> values) {

  /**
   * Validates the name and freezes the option map.
   *
   * @param name module short name
   * @param values option values; {@code null} becomes empty
   */
  public ModuleOptions {
    name = Objects.requireNonNull(name, "name");
    values = values == null || values.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /**
   * Creates an enabled section without further options.
   *
   * @param name module short name
   * @return enabled options
   */
  public static ModuleOptions enabled(String name) {
    return new ModuleOptions(name, Map.of("enabled", Boolean.TRUE));
  }

  /**
   * Creates a disabled section.
   *
   * @param name module short name
   * @return disabled options
   */
  public static ModuleOptions disabled(String name) {
    return new ModuleOptions(name, Map.of("enabled", Boolean.FALSE));
  }

  /**
   * Indicates whether the module should run.
   *
   * @return value of the {@code enabled} option; {@code false} when absent
   */
  public boolean enabled() {
    return bool("enabled", false);
  }

  /**
   * Returns a raw option value.
   *
   * @param key option name
   * @return value when present
   */
  public Optional<Object> value(String key) {
    return Optional.ofNullable(values.get(Objects.requireNonNull(key, "key")));
  }

  /**
   * Returns a string option.
   *
   * @param key option name
   * @param defaultValue fallback when the option is absent or blank
   * @return option text
   */
  public String string(String key, String defaultValue) {
    Object value = values.get(key);
    if (value == null) {
      return defaultValue;
    }
    String text = value.toString().trim();
    return text.isEmpty() ? defaultValue : text;
  }

  /**
   * Returns an integer option.
   *
   * @param key option name
   * @param defaultValue fallback when the option is absent
   * @return parsed integer
   * @throws IllegalArgumentException when the value is not an integer
   */
  public int integer(String key, int defaultValue) {
    Object value = values.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number number) {
      return number.intValue();
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(
          "Invalid integer for " + name + "." + key + ": '" + text + "'", ex);
    }
  }

  /**
   * Returns a boolean option. Accepts {@code true/false}, {@code yes/no}, {@code on/off} and {@code 1/0}.
   *
   * @param key option name
   * @param defaultValue fallback when the option is absent
   * @return parsed boolean
   * @throws IllegalArgumentException when the value is not a recognised boolean
   */
  public boolean bool(String key, boolean defaultValue) {
    Object value = values.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean bool) {
      return bool;
    }
    String text = value.toString().trim().toLowerCase(Locale.ROOT);
    return switch (text) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      case "" -> defaultValue;
      default -> throw new IllegalArgumentException(
          "Invalid boolean for " + name + "." + key + ": '" + value + "'");
    };
  }
}
