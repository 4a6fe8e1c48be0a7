/**
 * Container adapters implementing {@link ca.gc.cra.landsat.application.port.ArchiveReader}: zip via the JDK, tar
 * via Apache Commons Compress, selected by content sniffing.
 *
 * @since 0.1.0
 */
package ca.gc.cra.landsat.infrastructure.archive;
