/**
 * Small helpers shared by the pipelines and the signature engine.
 *
 * @since 0.2.0
 */
package ca.gc.cra.kestrel.application.util;
