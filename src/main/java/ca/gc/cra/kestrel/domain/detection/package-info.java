/**
 * Detections produced by the signature engine.
 *
 * @since 0.1.0
 */
package ca.gc.cra.kestrel.domain.detection;
