/**
 * Command-line adapters for the KESTREL analysis core.
 * <p><strong>Role:</strong> Parses {@code key=value} arguments, wires configuration and plugins, and maps
 * failures to {@link ca.gc.cra.kestrel.api.ExitCode} values.</p>
 * <p><strong>Concurrency:</strong> Commands run on the invoking thread; processing parallelism is owned by the
 * application layer.</p>
 */
package ca.gc.cra.kestrel.api;
