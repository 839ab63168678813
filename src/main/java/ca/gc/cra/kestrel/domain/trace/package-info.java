/**
 * Read-only behavioural trace (processes and API calls) replayed by the signature engine.
 *
 * <p>Records are immutable; the engine never mutates the trace during evaluation.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.kestrel.domain.trace;
