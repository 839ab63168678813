/**
 * Logback runtime configuration helpers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.kestrel.logging;
