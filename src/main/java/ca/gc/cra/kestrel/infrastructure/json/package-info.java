/**
 * JSON parsing on top of the Jackson streaming API.
 *
 * @since 0.1.0
 */
package ca.gc.cra.kestrel.infrastructure.json;
