/**
 * JSON rendering of parsed metadata using Jackson's streaming API.
 *
 * @since 0.1.0
 */
package ca.gc.cra.landsat.infrastructure.json;
