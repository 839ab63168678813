package ca.gc.cra.kestrel.application.signatures.rules;

import ca.gc.cra.kestrel.validation.Strings;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles parsed signature definitions into executable rules.
 *
 * @since 0.1.0
 */
final class RuleSetCompiler {

  List<CompiledSignatureRule> compile(List<SignatureRuleDefinition> definitions) {
    Objects.requireNonNull(definitions, "definitions");
    List<CompiledSignatureRule> compiled = new ArrayList<>(definitions.size());
    for (SignatureRuleDefinition definition : definitions) {
      compiled.add(compileRule(definition));
    }
    return List.copyOf(compiled);
  }

  private CompiledSignatureRule compileRule(SignatureRuleDefinition definition) {
    String name = Strings.requireIdentifier("signature name", definition.name());
    FilterDefinition filters = definition.filters();
    List<CompiledSignatureRule.ArgumentMatcher> arguments = compileArguments(name, definition.arguments());
    Set<String> requires = new LinkedHashSet<>(definition.requires());
    if (requires.contains(name)) {
      throw new IllegalArgumentException("Signature " + name + " must not require itself");
    }
    if (requires.isEmpty() && filters.isEmpty() && arguments.isEmpty()) {
      throw new IllegalArgumentException(
          "Signature " + name + " declares neither filters, arguments nor required signatures");
    }

    return new CompiledSignatureRule(
        name,
        definition.severity(),
        definition.description(),
        definition.families(),
        definition.references(),
        definition.ttp(),
        Set.copyOf(filters.processes()),
        Set.copyOf(filters.apis()),
        Set.copyOf(filters.categories()),
        arguments,
        definition.threshold(),
        requires);
  }

  private List<CompiledSignatureRule.ArgumentMatcher> compileArguments(
      String signature, Map<String, ArgumentConditionDefinition> definitions) {
    if (definitions == null || definitions.isEmpty()) {
      return List.of();
    }
    List<CompiledSignatureRule.ArgumentMatcher> matchers = new ArrayList<>(definitions.size());
    for (Map.Entry<String, ArgumentConditionDefinition> entry : definitions.entrySet()) {
      ArgumentConditionDefinition condition = entry.getValue();
      Pattern regex = null;
      if (condition.regex() != null) {
        try {
          regex = Pattern.compile(condition.regex(), condition.ignoreCase() ? Pattern.CASE_INSENSITIVE : 0);
        } catch (PatternSyntaxException ex) {
          throw new IllegalArgumentException(
              "Invalid regex for argument " + entry.getKey() + " of signature " + signature, ex);
        }
      }
      matchers.add(new CompiledSignatureRule.ArgumentMatcher(
          entry.getKey(), normalize(condition.equals()), normalize(condition.contains()), regex,
          condition.ignoreCase()));
    }
    return List.copyOf(matchers);
  }

  private String normalize(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
