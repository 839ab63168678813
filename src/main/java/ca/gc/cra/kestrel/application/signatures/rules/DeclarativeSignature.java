package ca.gc.cra.kestrel.application.signatures.rules;

import ca.gc.cra.kestrel.application.signatures.AbstractSignature;
import ca.gc.cra.kestrel.application.signatures.Signature;
import ca.gc.cra.kestrel.domain.trace.CallRecord;
import ca.gc.cra.kestrel.domain.trace.ProcessRecord;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Signature instance backed by a rule from a YAML rule file.
 *
 * <p>A call rule matches once {@code threshold} filtered calls satisfied every argument condition; each such
 * call is marked. A rule with {@code requires} is a meta-signature matching once all named signatures matched.</p>
 *
 * @since 0.1.0
 */
public final class DeclarativeSignature extends AbstractSignature {
  private final CompiledSignatureRule rule;
  private final Set<String> seenPeers = new LinkedHashSet<>();
  private int hits;
  private boolean fired;

  DeclarativeSignature(CompiledSignatureRule rule) {
    super(rule.name(), rule.severity());
    this.rule = Objects.requireNonNull(rule, "rule");
  }

  @Override
  public String description() {
    return rule.description();
  }

  @Override
  public List<String> families() {
    return rule.families();
  }

  @Override
  public List<String> references() {
    return rule.references();
  }

  @Override
  public List<String> ttp() {
    return rule.ttp();
  }

  @Override
  public Set<String> filterProcessNames() {
    return rule.processNames();
  }

  @Override
  public Set<String> filterApiNames() {
    return rule.apiNames();
  }

  @Override
  public Set<String> filterCategories() {
    return rule.categories();
  }

  @Override
  public boolean onCall(CallRecord call, ProcessRecord process) {
    if (rule.isMetaSignature() || !rule.matchesArguments(call)) {
      return false;
    }
    markCall(process, call);
    hits++;
    return hits == rule.threshold();
  }

  @Override
  public boolean onSignature(Signature matched) {
    if (!rule.isMetaSignature() || fired || !rule.requires().contains(matched.name())) {
      return false;
    }
    if (seenPeers.add(matched.name())) {
      mark(Map.of("signature", matched.name()));
    }
    if (seenPeers.containsAll(rule.requires())) {
      fired = true;
      return true;
    }
    return false;
  }
}
