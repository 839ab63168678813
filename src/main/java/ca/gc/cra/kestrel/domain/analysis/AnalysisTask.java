package ca.gc.cra.kestrel.domain.analysis;

import java.util.Objects;

/**
 * Identifies the analysis task whose artefacts are being processed.
 *
 * <p>The core treats the task as opaque: the identifier only selects the analysis storage directory
 * and tags diagnostics. The target label is informational.</p>
 *
 * @param id numeric task identifier; must not be negative
 * @param target label of the analysed sample (file name or URL); never {@code null}, may be blank
 * @since 0.1.0
 */
public record AnalysisTask(long id, String target) {

  /**
   * Validates the identifier and normalizes the target label.
   *
   * @param id numeric task identifier
   * @param target optional target label; {@code null} becomes blank
   */
  public AnalysisTask {
    if (id < 0) {
      throw new IllegalArgumentException("task id must not be negative");
    }
    target = Objects.requireNonNullElse(target, "").trim();
  }

  /**
   * Creates a task without a target label.
   *
   * @param id numeric task identifier
   * @return task instance
   */
  public static AnalysisTask of(long id) {
    return new AnalysisTask(id, "");
  }
}
