package ca.gc.cra.kestrel.application.signatures;

import ca.gc.cra.kestrel.domain.trace.CallRecord;
import ca.gc.cra.kestrel.domain.trace.ProcessRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/** Configurable signature that records every hook invocation into a shared journal. */
class JournalSignature extends AbstractSignature {
  final List<String> journal;
  final List<String> calls = new ArrayList<>();
  Set<String> processFilter = Set.of();
  Set<String> apiFilter = Set.of();
  Set<String> categoryFilter = Set.of();
  BiPredicate<CallRecord, ProcessRecord> onCall = (call, process) -> false;
  Predicate<Signature> onSignature = matched -> false;
  boolean active = true;
  boolean quickout;
  boolean completeResult;
  boolean initialized;
  int completions;

  JournalSignature(String name, int severity, List<String> journal) {
    super(name, severity);
    this.journal = journal;
  }

  @Override
  public Set<String> filterProcessNames() {
    return processFilter;
  }

  @Override
  public Set<String> filterApiNames() {
    return apiFilter;
  }

  @Override
  public Set<String> filterCategories() {
    return categoryFilter;
  }

  @Override
  public boolean isActive() {
    return active;
  }

  @Override
  public void init(SignatureContext context) {
    initialized = true;
  }

  @Override
  public boolean quickout() {
    return quickout;
  }

  @Override
  public boolean onProcess(ProcessRecord process) {
    journal.add(name() + ":process:" + pid());
    return false;
  }

  @Override
  public boolean onCall(CallRecord call, ProcessRecord process) {
    calls.add(call.api());
    journal.add(name() + ":call:" + call.api());
    return onCall.test(call, process);
  }

  @Override
  public boolean onSignature(Signature matched) {
    journal.add(name() + ":signature:" + matched.name());
    return onSignature.test(matched);
  }

  @Override
  public boolean onComplete() {
    completions++;
    journal.add(name() + ":complete");
    return completeResult;
  }
}
