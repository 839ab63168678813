package ca.gc.cra.kestrel.application.signatures.rules;

import ca.gc.cra.kestrel.domain.trace.CallRecord;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compiled declarative signature shared by every {@link DeclarativeSignature} instance created from it.
 *
 * @since 0.1.0
 */
final class CompiledSignatureRule {
  private final String name;
  private final int severity;
  private final String description;
  private final List<String> families;
  private final List<String> references;
  private final List<String> ttp;
  private final Set<String> processNames;
  private final Set<String> apiNames;
  private final Set<String> categories;
  private final List<ArgumentMatcher> argumentMatchers;
  private final int threshold;
  private final Set<String> requires;

  CompiledSignatureRule(
      String name,
      int severity,
      String description,
      List<String> families,
      List<String> references,
      List<String> ttp,
      Set<String> processNames,
      Set<String> apiNames,
      Set<String> categories,
      List<ArgumentMatcher> argumentMatchers,
      int threshold,
      Set<String> requires) {
    this.name = Objects.requireNonNull(name, "name");
    this.severity = severity;
    this.description = description == null ? "" : description;
    this.families = List.copyOf(families);
    this.references = List.copyOf(references);
    this.ttp = List.copyOf(ttp);
    this.processNames = Set.copyOf(processNames);
    this.apiNames = Set.copyOf(apiNames);
    this.categories = Set.copyOf(categories);
    this.argumentMatchers = List.copyOf(argumentMatchers);
    this.threshold = threshold;
    this.requires = Set.copyOf(requires);
  }

  String name() {
    return name;
  }

  int severity() {
    return severity;
  }

  String description() {
    return description;
  }

  List<String> families() {
    return families;
  }

  List<String> references() {
    return references;
  }

  List<String> ttp() {
    return ttp;
  }

  Set<String> processNames() {
    return processNames;
  }

  Set<String> apiNames() {
    return apiNames;
  }

  Set<String> categories() {
    return categories;
  }

  int threshold() {
    return threshold;
  }

  Set<String> requires() {
    return requires;
  }

  boolean isMetaSignature() {
    return !requires.isEmpty();
  }

  /** Returns {@code true} when every argument condition holds for the call. */
  boolean matchesArguments(CallRecord call) {
    for (ArgumentMatcher matcher : argumentMatchers) {
      if (!matcher.matches(call)) {
        return false;
      }
    }
    return true;
  }

  static final class ArgumentMatcher {
    private final String argument;
    private final String equals;
    private final String contains;
    private final Pattern regex;
    private final boolean ignoreCase;

    ArgumentMatcher(String argument, String equals, String contains, Pattern regex, boolean ignoreCase) {
      this.argument = Objects.requireNonNull(argument, "argument");
      this.ignoreCase = ignoreCase;
      this.equals = fold(equals);
      this.contains = fold(contains);
      this.regex = regex;
    }

    boolean matches(CallRecord call) {
      Object raw = call.argument(argument).orElse(null);
      if (raw == null) {
        return false;
      }
      String value = raw instanceof String str ? str : String.valueOf(raw);
      String folded = fold(value);
      if (equals != null && !Objects.equals(folded, equals)) {
        return false;
      }
      if (contains != null && !folded.contains(contains)) {
        return false;
      }
      return regex == null || regex.matcher(value).find();
    }

    private String fold(String value) {
      if (value == null || !ignoreCase) {
        return value;
      }
      return value.toLowerCase(Locale.ROOT);
    }
  }
}
