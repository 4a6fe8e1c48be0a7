package ca.gc.cra.landsat.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Port that recognizes archive containers by content and opens them as {@link ArchiveReader}s.
 *
 * @since 0.1.0
 */
public interface ArchiveOpener {
  /**
   * Sniffs the leading bytes of a file.
   *
   * @param file candidate archive; need not exist
   * @return {@code true} when the content is a container this opener can read
   */
  boolean isArchive(Path file);

  /**
   * Opens a recognized archive.
   *
   * @param file archive file accepted by {@link #isArchive(Path)}
   * @return open reader; the caller must close it
   * @throws IOException if the file cannot be opened
   * @throws ca.gc.cra.landsat.domain.error.UnsupportedSourceException if the content is not a supported container
   */
  ArchiveReader open(Path file) throws IOException;
}
