package ca.gc.cra.kestrel.application.plugin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Mapping from plugin group to the descriptors known for it.
 * <p><strong>Why:</strong> Replaces runtime subclass scanning with an explicit registration table that every
 * pipeline stage reads.</p>
 * <p><strong>Role:</strong> Constructed once at startup, populated by the discovery step and passed by reference
 * into each stage. Tests create a fresh registry each.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append descriptors per group in registration order; duplicates are the caller's concern.</li>
 *   <li>Return a group's descriptors, or the whole mapping.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Registration and listing may happen from different threads; listings are
 * snapshots.</p>
 *
 * @since 0.1.0
 */
public final class PluginRegistry {
  private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

  private final ConcurrentMap<PluginGroup, List<PluginDescriptor<?>>> groups = new ConcurrentHashMap<>();

  /**
   * Appends a descriptor to a group.
   *
   * @param group target group
   * @param descriptor plugin descriptor; its own group must equal {@code group}
   * @throws IllegalArgumentException when the descriptor belongs to another group
   */
  public void register(PluginGroup group, PluginDescriptor<?> descriptor) {
    Objects.requireNonNull(group, "group");
    Objects.requireNonNull(descriptor, "descriptor");
    if (descriptor.group() != group) {
      throw new IllegalArgumentException(
          "Descriptor " + descriptor.name() + " belongs to group " + descriptor.group().id()
              + ", not " + group.id());
    }
    groups.computeIfAbsent(group, g -> new CopyOnWriteArrayList<>()).add(descriptor);
    log.debug("Registered {} plugin {} ({})", group.id(), descriptor.name(), descriptor.type().getName());
  }

  /**
   * Appends a descriptor to its own group.
   *
   * @param descriptor plugin descriptor
   */
  public void register(PluginDescriptor<?> descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    register(descriptor.group(), descriptor);
  }

  /**
   * Lists a group's descriptors in registration order.
   *
   * @param group plugin group
   * @return immutable snapshot; empty when nothing was registered
   */
  public List<PluginDescriptor<?>> list(PluginGroup group) {
    Objects.requireNonNull(group, "group");
    List<PluginDescriptor<?>> descriptors = groups.get(group);
    return descriptors == null ? List.of() : List.copyOf(descriptors);
  }

  /**
   * Lists a group's descriptors typed by the group contract.
   *
   * @param group plugin group
   * @param contract contract implemented by the group's plugins
   * @param <T> contract type
   * @return immutable snapshot in registration order
   * @throws IllegalArgumentException when {@code contract} is not the group's contract or a supertype of it
   */
  public <T> List<PluginDescriptor<? extends T>> list(PluginGroup group, Class<T> contract) {
    Objects.requireNonNull(contract, "contract");
    if (!contract.isAssignableFrom(group.contract())) {
      throw new IllegalArgumentException(
          contract.getSimpleName() + " is not the contract of group " + group.id());
    }
    List<PluginDescriptor<? extends T>> typed = new ArrayList<>();
    for (PluginDescriptor<?> descriptor : list(group)) {
      typed.add(descriptor.as(contract));
    }
    return List.copyOf(typed);
  }

  /**
   * Returns the full mapping of groups that have at least one registration.
   *
   * @return immutable snapshot keyed by group, in {@link PluginGroup} order
   */
  public Map<PluginGroup, List<PluginDescriptor<?>>> list() {
    Map<PluginGroup, List<PluginDescriptor<?>>> snapshot = new EnumMap<>(PluginGroup.class);
    for (PluginGroup group : PluginGroup.values()) {
      List<PluginDescriptor<?>> descriptors = list(group);
      if (!descriptors.isEmpty()) {
        snapshot.put(group, descriptors);
      }
    }
    return Collections.unmodifiableMap(snapshot);
  }
}
