package ca.gc.cra.landsat.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Port over an opened zip or tar container.
 * <p><strong>Why:</strong> The source resolver only needs entry names and a bulk extraction; hiding the container
 * format here means no caller branches on zip versus tar after the archive is opened.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code infrastructure.archive} adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>List entry names as stored in the container.</li>
 *   <li>Extract every entry below a destination directory, overwriting previous output.</li>
 *   <li>Release file handles on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; use from a single try-with-resources block.</p>
 *
 * @since 0.1.0
 * @see ArchiveOpener
 */
public interface ArchiveReader extends AutoCloseable {
  /**
   * Lists entry names, including directory entries, in container order.
   *
   * @return entry names using {@code /} separators
   * @throws IOException if the container cannot be read
   */
  List<String> listEntries() throws IOException;

  /**
   * Extracts all entries below {@code destination}, creating it when missing.
   *
   * @param destination target directory
   * @throws IOException if writing fails or an entry would escape {@code destination}
   */
  void extractAll(Path destination) throws IOException;

  /**
   * Releases the container.
   *
   * @throws IOException if closing the underlying file fails
   */
  @Override
  void close() throws IOException;
}
