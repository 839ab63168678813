/**
 * Declarative signatures loaded from YAML rule files.
 *
 * <pre>
 * version: 1
 * signatures:
 *   - name: creates_executable
 *     severity: 2
 *     filters:
 *       apis: [CreateFileW]
 *     arguments:
 *       filepath: {contains: ".exe", ignoreCase: true}
 *   - name: dropper
 *     severity: 3
 *     requires: [creates_executable, persistence_autorun]
 * </pre>
 *
 * <p>Version bounds should be quoted ({@code minimum: "2.0"}) so YAML keeps them as text.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.kestrel.application.signatures.rules;
