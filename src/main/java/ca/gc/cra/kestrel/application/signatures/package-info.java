/**
 * Signature contract and the correlation engine that replays the behavioural trace against it.
 *
 * <p>Hand-written signatures usually extend {@link ca.gc.cra.kestrel.application.signatures.AbstractSignature};
 * declarative ones are compiled from YAML by the {@code rules} subpackage.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.kestrel.application.signatures;
