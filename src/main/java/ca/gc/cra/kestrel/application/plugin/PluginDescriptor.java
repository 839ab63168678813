package ca.gc.cra.kestrel.application.plugin;

import ca.gc.cra.kestrel.validation.Strings;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable description of one plugin implementation and its group.
 * <p><strong>Why:</strong> Lets pipelines sort, gate and instantiate plugins without runtime type scanning.</p>
 * <p><strong>Role:</strong> Entry of the {@link PluginRegistry}; created at discovery time.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Carry the canonical short name used to find the module's configuration section.</li>
 *   <li>Carry the execution {@code order} (processing/reporting) and, for signatures, the static
 *       {@code enabled} flag and engine version bounds.</li>
 *   <li>Create fresh instances through its {@link PluginFactory}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; the factory must be safe to call from any thread.</p>
 *
 * @param group capability group
 * @param name canonical short name
 * @param type implementation type; must implement the group contract
 * @param order execution order; lower runs first
 * @param enabled static enable flag checked before instantiation (signatures)
 * @param minimumVersion minimum compatible engine version, or {@code null}
 * @param maximumVersion maximum compatible engine version, or {@code null}
 * @param legacyStyle {@code true} when the plugin still uses the deprecated whole-run entry point
 * @param factory instance factory
 * @param <T> plugin contract
 * @since 0.1.0
 */
public record PluginDescriptor<T>(
    PluginGroup group,
    String name,
    Class<T> type,
    int order,
    boolean enabled,
    String minimumVersion,
    String maximumVersion,
    boolean legacyStyle,
    PluginFactory<? extends T> factory) {
  /** Order assigned when a plugin does not declare one. */
  public static final int DEFAULT_ORDER = 1;

  /**
   * Validates members and checks that {@code type} implements the group contract.
   */
  public PluginDescriptor {
    Objects.requireNonNull(group, "group");
    name = Strings.requireNonBlank("name", name);
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(factory, "factory");
    if (!group.contract().isAssignableFrom(type)) {
      throw new IllegalArgumentException(
          type.getName() + " does not implement " + group.contract().getSimpleName()
              + " required by group " + group.id());
    }
    minimumVersion = blankToNull(minimumVersion);
    maximumVersion = blankToNull(maximumVersion);
  }

  /**
   * Describes a processing module.
   *
   * @param name canonical short name
   * @param type implementation type
   * @param order execution order
   * @param factory instance factory
   * @param <T> implementation type
   * @return descriptor in the {@code processing} group
   */
  public static <T> PluginDescriptor<T> processing(
      String name, Class<T> type, int order, PluginFactory<? extends T> factory) {
    return new PluginDescriptor<>(PluginGroup.PROCESSING, name, type, order, true, null, null, false, factory);
  }

  /**
   * Describes a reporting module.
   *
   * @param name canonical short name
   * @param type implementation type
   * @param order execution order
   * @param factory instance factory
   * @param <T> implementation type
   * @return descriptor in the {@code reporting} group
   */
  public static <T> PluginDescriptor<T> reporting(
      String name, Class<T> type, int order, PluginFactory<? extends T> factory) {
    return new PluginDescriptor<>(PluginGroup.REPORTING, name, type, order, true, null, null, false, factory);
  }

  /**
   * Describes an auxiliary module.
   *
   * @param name canonical short name
   * @param type implementation type
   * @param factory instance factory
   * @param <T> implementation type
   * @return descriptor in the {@code auxiliary} group
   */
  public static <T> PluginDescriptor<T> auxiliary(String name, Class<T> type, PluginFactory<? extends T> factory) {
    return new PluginDescriptor<>(
        PluginGroup.AUXILIARY, name, type, DEFAULT_ORDER, true, null, null, false, factory);
  }

  /**
   * Describes a machinery backend.
   *
   * @param name canonical short name
   * @param type implementation type
   * @param factory instance factory
   * @param <T> implementation type
   * @return descriptor in the {@code machinery} group
   */
  public static <T> PluginDescriptor<T> machinery(String name, Class<T> type, PluginFactory<? extends T> factory) {
    return new PluginDescriptor<>(
        PluginGroup.MACHINERY, name, type, DEFAULT_ORDER, true, null, null, false, factory);
  }

  /**
   * Describes a signature.
   *
   * @param name signature name
   * @param type implementation type
   * @param factory instance factory
   * @param <T> implementation type
   * @return enabled descriptor in the {@code signatures} group without version bounds
   */
  public static <T> PluginDescriptor<T> signature(String name, Class<T> type, PluginFactory<? extends T> factory) {
    return new PluginDescriptor<>(
        PluginGroup.SIGNATURES, name, type, DEFAULT_ORDER, true, null, null, false, factory);
  }

  /**
   * Returns a copy with another execution order.
   *
   * @param newOrder execution order
   * @return updated descriptor
   */
  public PluginDescriptor<T> withOrder(int newOrder) {
    return new PluginDescriptor<>(
        group, name, type, newOrder, enabled, minimumVersion, maximumVersion, legacyStyle, factory);
  }

  /**
   * Returns a copy with another static enable flag.
   *
   * @param flag enable flag
   * @return updated descriptor
   */
  public PluginDescriptor<T> withEnabled(boolean flag) {
    return new PluginDescriptor<>(
        group, name, type, order, flag, minimumVersion, maximumVersion, legacyStyle, factory);
  }

  /**
   * Returns a copy with engine version bounds.
   *
   * @param minimum minimum version or {@code null}
   * @param maximum maximum version or {@code null}
   * @return updated descriptor
   */
  public PluginDescriptor<T> withVersions(String minimum, String maximum) {
    return new PluginDescriptor<>(group, name, type, order, enabled, minimum, maximum, legacyStyle, factory);
  }

  /**
   * Returns a copy flagged as using the deprecated whole-run entry point.
   *
   * @return updated descriptor
   */
  public PluginDescriptor<T> withLegacyStyle() {
    return new PluginDescriptor<>(
        group, name, type, order, enabled, minimumVersion, maximumVersion, true, factory);
  }

  /**
   * Views this descriptor through a contract its type implements.
   *
   * @param contract interface or superclass of {@link #type()}
   * @param <C> contract type
   * @return equivalent descriptor whose factory output is checked against {@code contract}
   * @throws ClassCastException when {@link #type()} does not implement {@code contract}
   */
  public <C> PluginDescriptor<? extends C> as(Class<C> contract) {
    Objects.requireNonNull(contract, "contract");
    return narrow(type.asSubclass(contract));
  }

  private <S> PluginDescriptor<S> narrow(Class<S> subtype) {
    PluginFactory<? extends T> source = factory;
    return new PluginDescriptor<>(group, name, subtype, order, enabled, minimumVersion, maximumVersion, legacyStyle,
        () -> subtype.cast(source.create()));
  }

  /**
   * Creates a new plugin instance.
   *
   * @return plugin instance
   * @throws Exception when the factory fails or yields {@code null}
   */
  public T instantiate() throws Exception {
    T instance = factory.create();
    if (instance == null) {
      throw new IllegalStateException("Factory for plugin " + name + " returned null");
    }
    return instance;
  }

  private static String blankToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
