package ca.gc.cra.kestrel.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits raw CLI arguments into {@code key=value} tokens and the {@code --help}/{@code --verbose} flags.
 *
 * @since 0.1.0
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] keyValueArgs;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] keyValueArgs, boolean help, boolean verbose) {
    this.keyValueArgs = keyValueArgs;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments. Blank and {@code null} entries are ignored.
   *
   * @param args raw arguments; may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], false, false);
    }
    List<String> kv = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv.toArray(String[]::new), help, verbose);
  }

  /**
   * Returns the non-flag arguments in their original order.
   *
   * @return defensive copy of the remaining arguments
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  /**
   * Indicates whether help was requested.
   *
   * @return {@code true} when a help flag was present
   */
  public boolean help() {
    return help;
  }

  /**
   * Indicates whether verbose logging was requested.
   *
   * @return {@code true} when a verbose flag was present
   */
  public boolean verbose() {
    return verbose;
  }
}
