package ca.gc.cra.kestrel.api;

import ca.gc.cra.kestrel.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts {@code key=value} CLI tokens into a map, rejecting malformed names and control characters.
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private CliArgsParser() {}

  /**
   * Parses tokens; later duplicates win.
   *
   * @param args tokens such as {@code task=42}
   * @return ordered option map
   * @throws IllegalArgumentException when a token is not {@code key=value} or contains control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = Strings.requireIdentifier("argument name", arg.substring(0, idx));
      String value = Strings.requireNonBlank(key, arg.substring(idx + 1));
      map.put(key, value);
    }
    return map;
  }
}
