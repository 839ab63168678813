package ca.gc.cra.kestrel.support;

import ca.gc.cra.kestrel.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** MetricsPort that keeps counters and observations in memory for assertions. */
public final class RecordingMetrics implements MetricsPort {
  private final Map<String, Long> counters = new ConcurrentHashMap<>();
  private final Map<String, List<Long>> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.merge(key, 1L, Long::sum);
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
  }

  public long counter(String key) {
    return counters.getOrDefault(key, 0L);
  }

  public List<Long> observations(String key) {
    return observations.getOrDefault(key, List.of());
  }
}
