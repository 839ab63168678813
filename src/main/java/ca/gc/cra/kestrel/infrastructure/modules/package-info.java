/**
 * Processing and reporting modules bundled with KESTREL.
 *
 * @since 0.1.0
 */
package ca.gc.cra.kestrel.infrastructure.modules;
