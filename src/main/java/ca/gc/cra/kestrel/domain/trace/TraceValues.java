package ca.gc.cra.kestrel.domain.trace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

final class TraceValues {
  private TraceValues() {}

  static Map<String, Object> freeze(Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    // LinkedHashMap keeps payload order and tolerates null values, unlike Map.copyOf
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  static Map<String, Object> stringKeyed(Map<?, ?> source) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : source.entrySet()) {
      if (entry.getKey() != null) {
        copy.put(entry.getKey().toString(), entry.getValue());
      }
    }
    return Collections.unmodifiableMap(copy);
  }
}
