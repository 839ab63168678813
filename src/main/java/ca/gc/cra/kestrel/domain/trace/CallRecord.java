package ca.gc.cra.kestrel.domain.trace;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One API call observed inside a monitored process.
 *
 * @param index position of the call inside its process (zero based)
 * @param api API name, e.g. {@code CreateFileW}
 * @param category behaviour category, e.g. {@code filesystem}
 * @param attributes full call payload as recorded by the sandbox (arguments, status, return value)
 * @since 0.1.0
 */
public record CallRecord(int index, String api, String category, Map<String, Object> attributes) {

  /**
   * Validates required fields and freezes the payload.
   *
   * @param index call position
   * @param api API name
   * @param category behaviour category
   * @param attributes raw payload; {@code null} becomes empty
   */
  public CallRecord {
    if (index < 0) {
      throw new IllegalArgumentException("index must not be negative");
    }
    api = Objects.requireNonNull(api, "api");
    category = Objects.requireNonNull(category, "category");
    attributes = TraceValues.freeze(attributes);
  }

  /**
   * Looks up a named call argument from the {@code arguments} payload section.
   *
   * @param name argument name
   * @return argument value when recorded
   */
  public Optional<Object> argument(String name) {
    Objects.requireNonNull(name, "name");
    Object arguments = attributes.get("arguments");
    if (arguments instanceof Map<?, ?> map) {
      return Optional.ofNullable(map.get(name));
    }
    return Optional.empty();
  }

  /**
   * Returns the recorded arguments section.
   *
   * @return argument map keyed by name; empty when the call carried none
   */
  public Map<String, Object> arguments() {
    Object arguments = attributes.get("arguments");
    if (arguments instanceof Map<?, ?> map) {
      return TraceValues.stringKeyed(map);
    }
    return Map.of();
  }
}
