package ca.gc.cra.landsat.domain.error;

/**
 * Thrown when no file matches the metadata template or the metadata lacks required identity fields.
 *
 * @since 0.1.0
 */
public final class MetadataFileException extends LandsatMetadataException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public MetadataFileException(String msg) { super(msg); }
}
