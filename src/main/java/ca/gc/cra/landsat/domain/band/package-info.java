/**
 * <strong>Purpose:</strong> Band identity model: sensor keys, alias tables, and per-archive band file indexes.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share.
 *
 * @since 0.1.0
 */
package ca.gc.cra.landsat.domain.band;
