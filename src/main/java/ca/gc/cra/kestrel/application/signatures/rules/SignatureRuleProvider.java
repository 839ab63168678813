package ca.gc.cra.kestrel.application.signatures.rules;

import ca.gc.cra.kestrel.application.plugin.PluginDescriptor;
import ca.gc.cra.kestrel.application.plugin.PluginRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Facade that loads, compiles and registers declarative signatures from YAML sources.
 *
 * @since 0.1.0
 */
public final class SignatureRuleProvider {
  private static final Logger log = LoggerFactory.getLogger(SignatureRuleProvider.class);

  private final RuleSetLoader loader = new RuleSetLoader();
  private final RuleSetCompiler compiler = new RuleSetCompiler();

  /**
   * Loads and compiles rules from the supplied YAML files.
   *
   * @param sources ordered list of rule files
   * @return one signature descriptor per rule, in file order
   * @throws IOException when any source cannot be read
   * @throws IllegalArgumentException when a file is malformed or names collide
   */
  public List<PluginDescriptor<DeclarativeSignature>> load(List<Path> sources) throws IOException {
    Objects.requireNonNull(sources, "sources");
    List<SignatureRuleDefinition> definitions = loader.load(sources);
    List<CompiledSignatureRule> compiled = compiler.compile(definitions);

    List<PluginDescriptor<DeclarativeSignature>> descriptors = new ArrayList<>(compiled.size());
    for (int i = 0; i < compiled.size(); i++) {
      CompiledSignatureRule rule = compiled.get(i);
      SignatureRuleDefinition definition = definitions.get(i);
      descriptors.add(PluginDescriptor
          .signature(rule.name(), DeclarativeSignature.class, () -> new DeclarativeSignature(rule))
          .withEnabled(definition.enabled())
          .withVersions(definition.minimum(), definition.maximum()));
    }
    return List.copyOf(descriptors);
  }

  /**
   * Loads rules and registers them in the {@code signatures} group.
   *
   * @param registry target registry
   * @param sources ordered list of rule files
   * @return number of registered signatures
   * @throws IOException when any source cannot be read
   */
  public int registerAll(PluginRegistry registry, List<Path> sources) throws IOException {
    Objects.requireNonNull(registry, "registry");
    List<PluginDescriptor<DeclarativeSignature>> descriptors = load(sources);
    descriptors.forEach(registry::register);
    log.info("Registered {} declarative signatures from {} rule file(s)", descriptors.size(), sources.size());
    return descriptors.size();
  }
}
