package ca.gc.cra.landsat.domain.error;

/**
 * Thrown when a spacecraft and sensor combination has no entry in the band table.
 *
 * @since 0.1.0
 */
public final class BandMapException extends LandsatArchiveException {
  private final String sensorKey;

  /**
   * Creates an exception for an unresolved sensor key.
   *
   * @param sensorKey composed {@code <SPACECRAFT_ID>_<SENSOR_ID>} key that had no mapping
   */
  public BandMapException(String sensorKey) {
    super("No band mapping found for " + sensorKey);
    this.sensorKey = sensorKey;
  }

  /**
   * Returns the key that failed to resolve.
   *
   * @return sensor key such as {@code LANDSAT_9_OLI_TIRS}
   */
  public String sensorKey() {
    return sensorKey;
  }
}
