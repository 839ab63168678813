/**
 * Analysis task identity shared by every pipeline stage.
 *
 * @since 0.1.0
 */
package ca.gc.cra.kestrel.domain.analysis;
