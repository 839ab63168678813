package ca.gc.cra.kestrel.infrastructure.modules;

import ca.gc.cra.kestrel.application.port.ProcessingException;
import ca.gc.cra.kestrel.application.port.ProcessingModule;
import ca.gc.cra.kestrel.application.port.context.ExecutionContext;
import ca.gc.cra.kestrel.domain.trace.BehaviorTrace;
import ca.gc.cra.kestrel.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the behavioural log written by the sandbox into the {@code behavior} results key.
 *
 * <p>Reads {@code logs/behavior.json} under the analysis directory unless the {@code file} option names
 * another path. A top-level array is taken as the process list.</p>
 *
 * @since 0.1.0
 */
public final class BehaviorProcessing implements ProcessingModule {
  /** Canonical module name. */
  public static final String NAME = "behavior";
  /** Default log location relative to the analysis directory. */
  public static final Path DEFAULT_LOG = Path.of("logs", "behavior.json");

  private static final Logger log = LoggerFactory.getLogger(BehaviorProcessing.class);

  private final JsonSupport json;

  /**
   * Creates the module.
   *
   * @param json JSON parser
   */
  public BehaviorProcessing(JsonSupport json) {
    this.json = json;
  }

  @Override
  public String key() {
    return BehaviorTrace.BEHAVIOR_KEY;
  }

  @Override
  public Object run(ExecutionContext context) throws ProcessingException {
    Path file = context.options().value("file")
        .map(value -> Path.of(value.toString()))
        .orElse(DEFAULT_LOG);
    if (!file.isAbsolute()) {
      file = context.analysisPath().resolve(file);
    }
    if (!Files.isRegularFile(file)) {
      throw new ProcessingException("Behavior log not found at " + file);
    }

    Object parsed;
    try {
      parsed = json.parse(file);
    } catch (IOException ex) {
      throw new ProcessingException("Unable to read behavior log " + file, ex);
    } catch (IllegalArgumentException ex) {
      throw new ProcessingException("Malformed behavior log " + file + ": " + ex.getMessage(), ex);
    }

    Map<String, Object> behavior = new LinkedHashMap<>();
    if (parsed instanceof List<?> processes) {
      behavior.put(BehaviorTrace.PROCESSES_KEY, processes);
    } else if (parsed instanceof Map<?, ?> map) {
      map.forEach((key, value) -> behavior.put(String.valueOf(key), value));
    } else {
      throw new ProcessingException("Behavior log " + file + " must hold an object or an array");
    }
    log.debug("Loaded {} processes from {}", BehaviorTrace.from(Map.of(key(), behavior)).processes().size(), file);
    return behavior;
  }
}
