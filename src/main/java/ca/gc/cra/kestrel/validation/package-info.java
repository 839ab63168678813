/**
 * Argument validation helpers shared by configuration, CLI and plugin registration.
 *
 * @since 0.1.0
 */
package ca.gc.cra.kestrel.validation;
