/**
 * <strong>Purpose:</strong> Exception taxonomy for archive resolution, MTL parsing, and band dispatch.
 * <p><strong>Role:</strong> Domain layer; every type extends {@link ca.gc.cra.landsat.domain.error.LandsatException}
 * so callers may catch broadly or per failure kind.
 * <p><strong>Concurrency:</strong> Exceptions are immutable once thrown.
 *
 * @since 0.1.0
 */
package ca.gc.cra.landsat.domain.error;
