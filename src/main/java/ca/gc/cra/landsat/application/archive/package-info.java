/**
 * <strong>Purpose:</strong> Source classification, archive extraction orchestration, and the {@code LandsatArchive}
 * aggregate.
 * <p><strong>Pipeline role:</strong> Entry point of the resolve, parse, dispatch, and index sequence.
 * <p><strong>Concurrency:</strong> Each load is independent; archives are effectively immutable once built.
 *
 * @since 0.1.0
 */
package ca.gc.cra.landsat.application.archive;
