package ca.gc.cra.kestrel.application.signatures;

import ca.gc.cra.kestrel.application.plugin.PluginDescriptor;
import ca.gc.cra.kestrel.application.plugin.PluginGroup;
import ca.gc.cra.kestrel.application.plugin.PluginRegistry;
import ca.gc.cra.kestrel.application.port.MetricsPort;
import ca.gc.cra.kestrel.application.util.CancellationToken;
import ca.gc.cra.kestrel.config.KestrelConfig;
import ca.gc.cra.kestrel.domain.detection.Detection;
import ca.gc.cra.kestrel.domain.trace.BehaviorTrace;
import ca.gc.cra.kestrel.domain.trace.CallRecord;
import ca.gc.cra.kestrel.domain.trace.ProcessRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Correlation engine turning the behavioural trace into severity-ordered detections.
 * <p><strong>Why:</strong> Evaluates many independent signatures against one trace, letting a match in one
 * signature feed others through {@code onSignature}.</p>
 * <p><strong>Role:</strong> Runs between the processing and reporting stages; reads {@code behavior.processes}
 * from the results map and writes the {@value #RESULTS_KEY} key.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load enabled, version-compatible signatures and drop legacy ones.</li>
 *   <li>Run {@code init}/{@code quickout}, replay processes and calls through set-based filters, then
 *       {@code onComplete}.</li>
 *   <li>Funnel every hook invocation through one wrapper that contains handler failures and propagates
 *       matches to every active signature, bounded by a re-entrancy guard and a depth limit.</li>
 *   <li>Sort matched signatures by severity, ties in first-match order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each {@link #run} call owns its signature instances; concurrent runs on one
 * engine are safe as long as the registry factories create fresh instances.</p>
 * <p><strong>Observability:</strong> Emits {@code signatures.loaded}, {@code signatures.dropped},
 * {@code signatures.quickout}, {@code signatures.matched}, {@code signatures.handler.failed} and
 * {@code signatures.cascade.suppressed}.</p>
 *
 * @since 0.1.0
 */
public final class SignatureEngine {
  private static final Logger log = LoggerFactory.getLogger(SignatureEngine.class);

  /** Results key receiving the detections. */
  public static final String RESULTS_KEY = "signatures";

  private final PluginRegistry registry;
  private final String engineVersion;
  private final int maxCascadeDepth;
  private final MetricsPort metrics;

  /**
   * Creates an engine.
   *
   * @param registry plugin registry providing the {@code signatures} group
   * @param engineVersion running engine version compared with signature bounds
   * @param maxCascadeDepth maximum nesting of match notifications; must be positive
   * @param metrics metrics sink
   */
  public SignatureEngine(PluginRegistry registry, String engineVersion, int maxCascadeDepth, MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.engineVersion = Objects.requireNonNull(engineVersion, "engineVersion");
    if (maxCascadeDepth <= 0) {
      throw new IllegalArgumentException("maxCascadeDepth must be positive");
    }
    this.maxCascadeDepth = maxCascadeDepth;
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Creates an engine from the resolved configuration.
   *
   * @param registry plugin registry
   * @param config engine configuration
   * @param metrics metrics sink
   */
  public SignatureEngine(PluginRegistry registry, KestrelConfig config, MetricsPort metrics) {
    this(registry, config.engineVersion(), config.maxCascadeDepth(), metrics);
  }

  /**
   * Runs every signature against the trace held by {@code results}.
   *
   * @param results results map; receives the {@value #RESULTS_KEY} key
   * @return matched detections, ascending severity
   */
  public List<Detection> run(Map<String, Object> results) {
    return run(results, CancellationToken.NONE);
  }

  /**
   * Runs every signature against the trace held by {@code results}.
   *
   * <p>When {@code cancellation} fires, replay stops before the next call, {@code onComplete} is skipped and
   * detections matched so far are still collected.</p>
   *
   * @param results results map; receives the {@value #RESULTS_KEY} key
   * @param cancellation cooperative cancellation token
   * @return matched detections, ascending severity
   */
  public List<Detection> run(Map<String, Object> results, CancellationToken cancellation) {
    Objects.requireNonNull(results, "results");
    CancellationToken token = Objects.requireNonNullElse(cancellation, CancellationToken.NONE);

    List<ActiveSignature> loaded = load();
    Run run = new Run(initialize(loaded, new SignatureContext(results, engineVersion)));
    BehaviorTrace trace = BehaviorTrace.from(results);
    boolean completed = run.replay(trace, token);
    if (completed) {
      run.complete();
    } else {
      log.warn("Signature evaluation cancelled; collecting {} matches found so far", run.matchedCount());
    }

    List<Detection> detections = run.collect();
    results.put(RESULTS_KEY, detections.stream().map(Detection::toMap).collect(Collectors.toList()));
    return detections;
  }

  /**
   * Checks a descriptor's version bounds and style against the running engine.
   *
   * @param descriptor signature descriptor
   * @return {@code true} when the signature may run
   */
  public boolean isCompatible(PluginDescriptor<?> descriptor) {
    String name = descriptor.name();
    if (descriptor.minimumVersion() != null) {
      try {
        EngineVersion minimum = EngineVersion.parse(descriptor.minimumVersion());
        if (EngineVersion.parse(engineVersion).isBefore(minimum)) {
          log.debug("You are running an older incompatible version of KESTREL, the signature \"{}\" "
              + "requires minimum version {}", name, descriptor.minimumVersion());
          return false;
        }
        if (minimum.isBefore(EngineVersion.EVENT_API)) {
          log.warn("The signature \"{}\" is using the old signature style which is no longer supported; "
              + "rewrite it against the event-driven signature interface", name);
          return false;
        }
        if (minimum.isBefore(EngineVersion.CURRENT_API)) {
          log.warn("The signature \"{}\" targets an engine older than {} and is incompatible with this release",
              name, EngineVersion.CURRENT_API);
          return false;
        }
      } catch (IllegalArgumentException ex) {
        log.debug("Wrong minimum version number in signature {}: {}", name, ex.getMessage());
        return false;
      }
    }

    if (descriptor.legacyStyle()) {
      log.warn("The signature \"{}\" still relies on the deprecated whole-run entry point; "
          + "it needs to be ported to the event hooks", name);
      return false;
    }

    if (descriptor.maximumVersion() != null) {
      try {
        EngineVersion maximum = EngineVersion.parse(descriptor.maximumVersion());
        if (EngineVersion.parse(engineVersion).isAfter(maximum)) {
          log.debug("You are running a newer incompatible version of KESTREL, the signature \"{}\" "
              + "requires maximum version {}", name, descriptor.maximumVersion());
          return false;
        }
      } catch (IllegalArgumentException ex) {
        log.debug("Wrong maximum version number in signature {}: {}", name, ex.getMessage());
        return false;
      }
    }
    return true;
  }

  private List<ActiveSignature> load() {
    List<ActiveSignature> loaded = new ArrayList<>();
    for (PluginDescriptor<? extends Signature> descriptor
        : registry.list(PluginGroup.SIGNATURES, Signature.class)) {
      if (!descriptor.enabled()) {
        log.debug("Signature {} is disabled", descriptor.name());
        continue;
      }
      if (!isCompatible(descriptor)) {
        metrics.increment("signatures.dropped");
        continue;
      }
      Signature signature;
      try {
        signature = descriptor.instantiate();
      } catch (Exception | LinkageError ex) {
        log.error("Failed to load signature {}", descriptor.name(), ex);
        metrics.increment("signatures.dropped");
        continue;
      }
      loaded.add(new ActiveSignature(signature, SignatureFilter.compile(signature)));
    }

    if (!loaded.isEmpty()) {
      log.debug("Loaded {} signature{}", loaded.size(), loaded.size() == 1 ? "" : "s");
      for (int i = 0; i < loaded.size(); i++) {
        log.debug("\t {} {}", i == loaded.size() - 1 ? "`--" : "|--", loaded.get(i).name());
      }
    }
    metrics.observe("signatures.loaded", loaded.size());
    return loaded;
  }

  private List<ActiveSignature> initialize(List<ActiveSignature> loaded, SignatureContext context) {
    List<ActiveSignature> survivors = new ArrayList<>(loaded.size());
    for (ActiveSignature active : List.copyOf(loaded)) {
      try {
        active.signature.init(context);
        if (active.signature.quickout()) {
          log.debug("Signature {} opted out of this analysis", active.name());
          metrics.increment("signatures.quickout");
          continue;
        }
      } catch (RuntimeException | LinkageError ex) {
        log.error("Failed to initialize signature {}", active.name(), ex);
        metrics.increment("signatures.handler.failed");
        continue;
      }
      survivors.add(active);
    }
    return List.copyOf(survivors);
  }

  /** Engine-owned state of one loaded signature during a run. */
  private static final class ActiveSignature {
    private final Signature signature;
    private final SignatureFilter filter;
    private boolean matched;
    private long firstMatch = -1L;

    ActiveSignature(Signature signature, SignatureFilter filter) {
      this.signature = signature;
      this.filter = filter;
    }

    String name() {
      return signature.name();
    }

    void position(long pid, int callIndex) {
      if (signature instanceof AbstractSignature base) {
        base.position(pid, callIndex);
      }
    }
  }

  /** Replay state of one engine run. */
  private final class Run {
    private final List<ActiveSignature> active;
    private final Set<ActiveSignature> propagating = Collections.newSetFromMap(new IdentityHashMap<>());
    private long matchSequence;

    Run(List<ActiveSignature> active) {
      this.active = active;
    }

    boolean replay(BehaviorTrace trace, CancellationToken token) {
      for (ProcessRecord process : trace.processes()) {
        if (token.isCancelled()) {
          return false;
        }
        for (ActiveSignature signature : active) {
          signature.position(process.pid(), AbstractSignature.NO_CALL);
          dispatch(signature, "on_process", () -> signature.signature.onProcess(process), 0);
        }
        for (CallRecord call : process.calls()) {
          if (token.isCancelled()) {
            return false;
          }
          for (ActiveSignature signature : active) {
            if (!signature.filter.accepts(process, call)) {
              continue;
            }
            signature.position(process.pid(), call.index());
            dispatch(signature, "on_call", () -> signature.signature.onCall(call, process), 0);
          }
        }
      }
      return true;
    }

    void complete() {
      for (ActiveSignature signature : active) {
        dispatch(signature, "on_complete", signature.signature::onComplete, 0);
      }
    }

    long matchedCount() {
      return active.stream().filter(s -> s.matched).count();
    }

    List<Detection> collect() {
      List<ActiveSignature> matched = active.stream()
          .filter(s -> s.matched)
          .sorted(Comparator.<ActiveSignature>comparingInt(s -> s.signature.severity())
              .thenComparingLong(s -> s.firstMatch))
          .collect(Collectors.toList());
      List<Detection> detections = new ArrayList<>(matched.size());
      for (ActiveSignature signature : matched) {
        log.debug("Analysis matched signature: {}", signature.name());
        metrics.increment("signatures.matched");
        detections.add(new Detection(signature.name(), signature.signature.severity(), payloadOf(signature)));
      }
      return List.copyOf(detections);
    }

    private Map<String, Object> payloadOf(ActiveSignature signature) {
      try {
        return signature.signature.payload();
      } catch (RuntimeException ex) {
        log.error("Failed to build the payload of signature {}", signature.name(), ex);
        metrics.increment("signatures.handler.failed");
        return Map.of();
      }
    }

    /** Invokes one hook on an active signature; a truthy result counts as a match and cascades. */
    private void dispatch(ActiveSignature target, String handler, BooleanSupplier invocation, int depth) {
      boolean hit;
      try {
        hit = target.signature.isActive() && invocation.getAsBoolean();
      } catch (RuntimeException | LinkageError ex) {
        log.error("Failed to run '{}' of the {} signature", handler, target.name(), ex);
        metrics.increment("signatures.handler.failed");
        return;
      }
      if (!hit) {
        return;
      }
      if (!target.matched) {
        target.matched = true;
        target.firstMatch = matchSequence++;
      }
      propagate(target, depth);
    }

    private void propagate(ActiveSignature source, int depth) {
      if (!propagating.add(source)) {
        log.debug("Suppressed re-entrant match cascade from signature {}", source.name());
        metrics.increment("signatures.cascade.suppressed");
        return;
      }
      try {
        if (depth >= maxCascadeDepth) {
          log.warn("Signature match cascade from {} reached the maximum depth of {}; not notifying further",
              source.name(), maxCascadeDepth);
          metrics.increment("signatures.cascade.suppressed");
          return;
        }
        Signature payload = source.signature;
        for (ActiveSignature peer : active) {
          dispatch(peer, "on_signature", () -> peer.signature.onSignature(payload), depth + 1);
        }
      } finally {
        propagating.remove(source);
      }
    }
  }
}
