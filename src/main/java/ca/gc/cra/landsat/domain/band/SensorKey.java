package ca.gc.cra.landsat.domain.band;

import java.util.Objects;

/**
 * Spacecraft and sensor pair that selects a {@link BandMapping}.
 *
 * @param spacecraftId value of {@code SPACECRAFT_ID}, e.g. {@code LANDSAT_8}
 * @param sensorId value of {@code SENSOR_ID}, e.g. {@code OLI_TIRS}
 * @since 0.1.0
 */
public record SensorKey(String spacecraftId, String sensorId) {
  public SensorKey {
    Objects.requireNonNull(spacecraftId, "spacecraftId");
    Objects.requireNonNull(sensorId, "sensorId");
  }

  /**
   * Composes the band table key.
   *
   * @return {@code <SPACECRAFT_ID>_<SENSOR_ID>}
   */
  public String key() {
    return spacecraftId + '_' + sensorId;
  }

  @Override
  public String toString() {
    return key();
  }
}
