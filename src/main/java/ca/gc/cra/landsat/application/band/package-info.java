/**
 * Sensor identification and band file indexing over parsed MTL metadata.
 *
 * @since 0.1.0
 */
package ca.gc.cra.landsat.application.band;
