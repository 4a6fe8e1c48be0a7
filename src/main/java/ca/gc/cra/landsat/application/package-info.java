/**
 * Application layer: the MTL parsing pipeline, band dispatch, and archive loading use case.
 * <p><strong>Role:</strong> Orchestrates domain types through the ports in {@code application.port}.</p>
 */
package ca.gc.cra.landsat.application;
