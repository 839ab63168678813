package ca.gc.cra.kestrel.api;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands a {@code rules=} argument into existing rule files.
 *
 * @since 0.1.0
 */
public final class RulePaths {
  private RulePaths() {}

  /**
   * Splits a comma or semicolon separated list of paths.
   *
   * @param raw raw argument value; {@code null} or blank yields an empty list
   * @return rule files in argument order
   * @throws IllegalArgumentException when a listed file does not exist
   */
  public static List<Path> resolve(String raw) {
    List<Path> paths = new ArrayList<>();
    if (raw == null || raw.isBlank()) {
      return paths;
    }
    for (String token : raw.split("[,;]")) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      Path path = Path.of(trimmed);
      if (!Files.isRegularFile(path)) {
        throw new IllegalArgumentException("Rule file not found: " + path);
      }
      paths.add(path);
    }
    return paths;
  }
}
