package ca.gc.cra.landsat.domain.error;

/**
 * Base class for failures raised while classifying a source or resolving band files.
 *
 * @since 0.1.0
 */
public class LandsatArchiveException extends LandsatException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public LandsatArchiveException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause
   */
  public LandsatArchiveException(String msg, Throwable cause) { super(msg, cause); }
}
