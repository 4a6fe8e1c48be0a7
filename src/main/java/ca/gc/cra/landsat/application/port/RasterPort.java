package ca.gc.cra.landsat.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port to the raster I/O library that decodes band files.
 * <p><strong>Why:</strong> Band resolution ends with a file path; decoding GeoTIFFs is left to whichever raster
 * library the caller uses.</p>
 * <p><strong>Role:</strong> Output port; this project ships no implementation.</p>
 *
 * @param <R> opaque raster handle type returned by the library
 * @since 0.1.0
 */
@FunctionalInterface
public interface RasterPort<R> {
  /** Access mode requested when opening a band file. */
  enum AccessMode {
    /** Read-only access. */
    READ
  }

  /**
   * Opens a band file.
   *
   * @param file absolute path of the band file
   * @param mode requested access mode
   * @return library-specific raster handle
   * @throws IOException if the file is unreadable or corrupt
   */
  R open(Path file, AccessMode mode) throws IOException;
}
