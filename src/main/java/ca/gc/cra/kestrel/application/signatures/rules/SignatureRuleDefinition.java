package ca.gc.cra.kestrel.application.signatures.rules;

import java.util.List;
import java.util.Map;

/**
 * Raw signature rule parsed from YAML prior to compilation.
 *
 * @since 0.1.0
 */
record SignatureRuleDefinition(
    String name,
    int severity,
    String description,
    List<String> families,
    List<String> references,
    List<String> ttp,
    boolean enabled,
    String minimum,
    String maximum,
    FilterDefinition filters,
    Map<String, ArgumentConditionDefinition> arguments,
    int threshold,
    List<String> requires) {}

record FilterDefinition(List<String> processes, List<String> apis, List<String> categories) {
  static final FilterDefinition NONE = new FilterDefinition(List.of(), List.of(), List.of());

  boolean isEmpty() {
    return processes.isEmpty() && apis.isEmpty() && categories.isEmpty();
  }
}

record ArgumentConditionDefinition(String equals, String contains, String regex, boolean ignoreCase) {}
