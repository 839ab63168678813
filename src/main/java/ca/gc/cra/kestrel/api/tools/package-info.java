/**
 * Operator utilities built on the analysis core.
 * <p><strong>Role:</strong> Adapter-side diagnostics such as rule compilation checks.</p>
 */
package ca.gc.cra.kestrel.api.tools;
