package ca.gc.cra.kestrel.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable engine configuration resolved from {@code kestrel.yaml}.
 * <p><strong>Why:</strong> Gives every pipeline stage the same storage root, engine version and module sections.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param storageRoot root directory holding {@code analyses/<task id>} folders
 * @param engineVersion engine version compared against signature bounds
 * @param maxCascadeDepth bound on nested signature match notifications
 * @param processingParallelism worker count for same-order processing modules; {@code 1} runs sequentially
 * @param auxiliary auxiliary module sections
 * @param processing processing module sections
 * @param reporting reporting module sections
 * @since 0.1.0
 */
public record KestrelConfig(
    Path storageRoot,
    String engineVersion,
    int maxCascadeDepth,
    int processingParallelism,
    ModuleConfig auxiliary,
    ModuleConfig processing,
    ModuleConfig reporting) {
  /** Default storage root relative to the working directory. */
  public static final Path DEFAULT_STORAGE_ROOT = Path.of("storage");
  /** Default bound on nested signature notifications. */
  public static final int DEFAULT_MAX_CASCADE_DEPTH = 64;

  /**
   * Validates bounds and applies defaults for missing sections.
   */
  public KestrelConfig {
    storageRoot = Objects.requireNonNullElse(storageRoot, DEFAULT_STORAGE_ROOT);
    engineVersion = engineVersion == null || engineVersion.isBlank()
        ? KestrelVersion.CURRENT
        : engineVersion.trim();
    if (maxCascadeDepth <= 0) {
      throw new IllegalArgumentException("maxCascadeDepth must be positive");
    }
    if (processingParallelism <= 0) {
      throw new IllegalArgumentException("processingParallelism must be positive");
    }
    auxiliary = Objects.requireNonNullElse(auxiliary, ModuleConfig.empty());
    processing = Objects.requireNonNullElse(processing, ModuleConfig.empty());
    reporting = Objects.requireNonNullElse(reporting, ModuleConfig.empty());
  }

  /**
   * Returns the configuration used when no file is supplied.
   *
   * @return defaults with empty module sections
   */
  public static KestrelConfig defaults() {
    return new KestrelConfig(
        DEFAULT_STORAGE_ROOT,
        KestrelVersion.CURRENT,
        DEFAULT_MAX_CASCADE_DEPTH,
        1,
        ModuleConfig.empty(),
        ModuleConfig.empty(),
        ModuleConfig.empty());
  }

  /**
   * Resolves the storage directory of an analysis.
   *
   * @param taskId task identifier
   * @return {@code <storageRoot>/analyses/<taskId>}
   */
  public Path analysisPath(long taskId) {
    return storageRoot.resolve("analyses").resolve(Long.toString(taskId));
  }

  /**
   * Returns a copy with different processing and reporting sections.
   *
   * @param processing processing sections
   * @param reporting reporting sections
   * @return updated configuration
   */
  public KestrelConfig withModules(ModuleConfig processing, ModuleConfig reporting) {
    return new KestrelConfig(
        storageRoot, engineVersion, maxCascadeDepth, processingParallelism, auxiliary, processing, reporting);
  }

  /**
   * Returns a copy targeting another storage root.
   *
   * @param root new storage root
   * @return updated configuration
   */
  public KestrelConfig withStorageRoot(Path root) {
    return new KestrelConfig(
        root, engineVersion, maxCascadeDepth, processingParallelism, auxiliary, processing, reporting);
  }
}
