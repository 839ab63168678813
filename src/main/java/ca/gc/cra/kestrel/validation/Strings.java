package ca.gc.cra.kestrel.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for plugin names, configuration keys and CLI values.
 * <p><strong>Why:</strong> Module and signature names double as configuration section names and result keys, so
 * they must be stable, printable identifiers.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank and free of control characters.
   *
   * @param name logical parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates an identifier such as a signature name or results key.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate identifier
   * @return trimmed identifier composed of {@code [A-Za-z0-9._-]}
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains other characters
   */
  public static String requireIdentifier(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!IDENTIFIER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
