/**
 * Context objects handed to module instances.
 *
 * @since 0.1.0
 */
package ca.gc.cra.kestrel.application.port.context;
