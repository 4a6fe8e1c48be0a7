/**
 * Typed model of parsed MTL metadata: raw groups, typed values, and immutable records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.landsat.domain.metadata;
