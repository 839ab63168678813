package ca.gc.cra.kestrel.domain.detection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Externally visible form of a matched signature.
 *
 * @param name signature name
 * @param severity severity ordinal; higher is more severe
 * @param payload descriptive data accumulated by the signature (description, families, marks)
 * @since 0.1.0
 */
public record Detection(String name, int severity, Map<String, Object> payload) {

  /**
   * Validates the name and freezes the payload.
   *
   * @param name signature name
   * @param severity severity ordinal
   * @param payload signature payload; {@code null} becomes empty
   */
  public Detection {
    name = Objects.requireNonNull(name, "name");
    payload = payload == null || payload.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  /**
   * Renders the detection as the map stored under the {@code signatures} results key.
   *
   * <p>{@code name} and {@code severity} come first; payload entries cannot override them.</p>
   *
   * @return mutable, insertion-ordered map
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("name", name);
    map.put("severity", severity);
    for (Map.Entry<String, Object> entry : payload.entrySet()) {
      map.putIfAbsent(entry.getKey(), entry.getValue());
    }
    return map;
  }
}
