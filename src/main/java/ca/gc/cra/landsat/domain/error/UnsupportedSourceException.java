package ca.gc.cra.landsat.domain.error;

/**
 * Thrown when a source is neither a directory, an MTL text file, nor a recognized zip/tar archive.
 *
 * @since 0.1.0
 */
public final class UnsupportedSourceException extends LandsatArchiveException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error naming the rejected source
   */
  public UnsupportedSourceException(String msg) { super(msg); }
}
