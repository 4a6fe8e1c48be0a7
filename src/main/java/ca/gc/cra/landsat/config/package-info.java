/**
 * Configuration for archive loading: options, YAML settings, and band table loading.
 *
 * @since 0.1.0
 */
package ca.gc.cra.landsat.config;
