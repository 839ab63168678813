package ca.gc.cra.kestrel.application.signatures;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dotted numeric version ({@code major.minor[.patch]}) used to gate signatures.
 *
 * <p>A pre-release suffix starting at the first {@code -} is stripped before parsing, so {@code 2.0-dev}
 * compares equal to {@code 2.0} and {@code 2.0.0}.</p>
 *
 * @param major major component
 * @param minor minor component
 * @param patch patch component; {@code 0} when omitted
 * @since 0.1.0
 */
public record EngineVersion(int major, int minor, int patch) implements Comparable<EngineVersion> {
  private static final Pattern FORMAT = Pattern.compile("^(\\d+)\\.(\\d+)(?:\\.(\\d+))?$");

  /** Versions below this predate the event-driven signature interface. */
  static final EngineVersion EVENT_API = new EngineVersion(1, 2, 0);
  /** Versions below this predate the current signature payload layout. */
  static final EngineVersion CURRENT_API = new EngineVersion(2, 0, 0);

  /**
   * Validates components.
   */
  public EngineVersion {
    if (major < 0 || minor < 0 || patch < 0) {
      throw new IllegalArgumentException("version components must not be negative");
    }
  }

  /**
   * Parses a version string.
   *
   * @param text version text such as {@code 2.0.1} or {@code 2.0-dev}
   * @return parsed version
   * @throws IllegalArgumentException when the text is not a dotted numeric version
   */
  public static EngineVersion parse(String text) {
    Objects.requireNonNull(text, "text");
    String trimmed = text.trim();
    int dash = trimmed.indexOf('-');
    if (dash >= 0) {
      trimmed = trimmed.substring(0, dash);
    }
    Matcher matcher = FORMAT.matcher(trimmed);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("invalid version number '" + text + "'");
    }
    try {
      int patch = matcher.group(3) == null ? 0 : Integer.parseInt(matcher.group(3));
      return new EngineVersion(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)), patch);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("invalid version number '" + text + "'", ex);
    }
  }

  @Override
  public int compareTo(EngineVersion other) {
    int result = Integer.compare(major, other.major);
    if (result == 0) {
      result = Integer.compare(minor, other.minor);
    }
    if (result == 0) {
      result = Integer.compare(patch, other.patch);
    }
    return result;
  }

  /**
   * Returns whether this version sorts before {@code other}.
   *
   * @param other version to compare with
   * @return {@code true} when strictly lower
   */
  public boolean isBefore(EngineVersion other) {
    return compareTo(other) < 0;
  }

  /**
   * Returns whether this version sorts after {@code other}.
   *
   * @param other version to compare with
   * @return {@code true} when strictly higher
   */
  public boolean isAfter(EngineVersion other) {
    return compareTo(other) > 0;
  }

  @Override
  public String toString() {
    return patch == 0 ? major + "." + minor : major + "." + minor + "." + patch;
  }
}
