/**
 * <strong>Purpose:</strong> Validation helpers used while building archive options and extracting containers.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct logging; failures surface via {@link java.lang.IllegalArgumentException}
 * or {@link java.io.IOException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.landsat.validation;
