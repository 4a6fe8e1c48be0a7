package ca.gc.cra.landsat.domain.error;

/**
 * <strong>What:</strong> Root of the unchecked exception hierarchy raised while resolving, parsing, and indexing
 * Landsat archives.
 * <p><strong>Why:</strong> Lets callers catch every archive failure in one place while the subclasses keep
 * "bad input", "corrupt metadata", and "unsupported sensor" distinguishable.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 * @see LandsatArchiveException
 * @see LandsatMetadataException
 */
public class LandsatException extends RuntimeException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public LandsatException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause
   */
  public LandsatException(String msg, Throwable cause) { super(msg, cause); }
}
