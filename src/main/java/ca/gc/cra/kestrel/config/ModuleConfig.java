package ca.gc.cra.kestrel.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration sections of one plugin group, keyed by module short name.
 *
 * <p>Lookups are case-insensitive. Immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ModuleConfig {
  private static final ModuleConfig EMPTY = new ModuleConfig(Map.of());

  private final Map<String, ModuleOptions> sections;

  private ModuleConfig(Map<String, ModuleOptions> sections) {
    this.sections = sections;
  }

  /**
   * Returns a configuration without any section.
   *
   * @return empty configuration
   */
  public static ModuleConfig empty() {
    return EMPTY;
  }

  /**
   * Builds a configuration from resolved sections.
   *
   * @param sections options keyed by module short name; must not be {@code null}
   * @return immutable configuration
   * @throws IllegalArgumentException when two names differ only by case
   */
  public static ModuleConfig of(Map<String, ModuleOptions> sections) {
    Objects.requireNonNull(sections, "sections");
    Map<String, ModuleOptions> normalized = new LinkedHashMap<>();
    for (Map.Entry<String, ModuleOptions> entry : sections.entrySet()) {
      String key = normalize(entry.getKey());
      if (normalized.put(key, Objects.requireNonNull(entry.getValue(), key)) != null) {
        throw new IllegalArgumentException("Duplicate module section: " + entry.getKey());
      }
    }
    return new ModuleConfig(Map.copyOf(normalized));
  }

  /**
   * Builds a configuration from a list of sections, keyed by each section's own name.
   *
   * @param sections module sections
   * @return immutable configuration
   */
  public static ModuleConfig of(ModuleOptions... sections) {
    Map<String, ModuleOptions> map = new LinkedHashMap<>();
    for (ModuleOptions section : sections) {
      map.put(section.name(), section);
    }
    return of(map);
  }

  /**
   * Looks up the section of a module.
   *
   * @param moduleName canonical short name
   * @return section when configured
   */
  public Optional<ModuleOptions> section(String moduleName) {
    return Optional.ofNullable(sections.get(normalize(moduleName)));
  }

  /**
   * Returns the configured section names.
   *
   * @return normalized section names
   */
  public Set<String> names() {
    return sections.keySet();
  }

  /**
   * Returns a copy in which {@code replacement} takes the place of any section with the same name.
   *
   * @param replacement section to add or replace
   * @return updated configuration
   */
  public ModuleConfig with(ModuleOptions replacement) {
    Objects.requireNonNull(replacement, "replacement");
    Map<String, ModuleOptions> copy = new LinkedHashMap<>(sections);
    copy.put(normalize(replacement.name()), replacement);
    return new ModuleConfig(Map.copyOf(copy));
  }

  private static String normalize(String name) {
    return Objects.requireNonNull(name, "name").trim().toLowerCase(Locale.ROOT);
  }
}
