package ca.gc.cra.landsat.domain.error;

/**
 * Base class for failures raised while locating or parsing an MTL metadata file.
 *
 * @since 0.1.0
 */
public class LandsatMetadataException extends LandsatException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public LandsatMetadataException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause
   */
  public LandsatMetadataException(String msg, Throwable cause) { super(msg, cause); }
}
