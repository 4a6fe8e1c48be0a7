package ca.gc.cra.landsat.domain.error;

/**
 * Thrown when a band identifier matches neither a band code of the archive nor an alias of its sensor.
 *
 * @since 0.1.0
 */
public final class BandNotFoundException extends LandsatArchiveException {
  private final String band;

  /**
   * Creates an exception for the requested identifier.
   *
   * @param band identifier as supplied by the caller
   */
  public BandNotFoundException(String band) {
    super(band + " not found");
    this.band = band;
  }

  /**
   * Returns the identifier that could not be resolved.
   *
   * @return requested band code or alias
   */
  public String band() {
    return band;
  }
}
