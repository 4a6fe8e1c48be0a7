/**
 * <strong>Purpose:</strong> Ports separating archive resolution from container formats and raster decoding.
 * <p><strong>Role:</strong> Application boundary; adapters live in {@code ca.gc.cra.landsat.infrastructure}.
 * <p><strong>Concurrency:</strong> Implementations document their own guarantees; resolution is single-threaded.
 *
 * @since 0.1.0
 */
package ca.gc.cra.landsat.application.port;
