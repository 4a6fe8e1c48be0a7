package ca.gc.cra.landsat.domain.error;

/**
 * Thrown when an MTL document is structurally malformed or yields no metadata records.
 *
 * @since 0.1.0
 */
public final class ParsingException extends LandsatMetadataException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public ParsingException(String msg) { super(msg); }
}
