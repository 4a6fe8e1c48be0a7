package ca.gc.cra.landsat.domain.band;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Alias to band-code translation for one spacecraft and sensor combination.
 * <p><strong>Why:</strong> Lets callers request {@code "red"} or {@code "swir1"} without knowing that the code is
 * {@code 4} on Landsat 8 but {@code 3} on Landsat 7.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param sensorKey table key such as {@code LANDSAT_8_OLI_TIRS}
 * @param aliases alias to band code; codes are strings because some are composite ({@code 6_VCID_1})
 * @since 0.1.0
 */
public record BandMapping(String sensorKey, Map<String, String> aliases) {
  public BandMapping {
    Objects.requireNonNull(sensorKey, "sensorKey");
    aliases = Map.copyOf(Objects.requireNonNull(aliases, "aliases"));
  }

  /**
   * Translates an alias to its band code.
   *
   * @param alias alias such as {@code red}; matched exactly
   * @return band code, or empty when the alias is unknown for this sensor
   */
  public Optional<String> codeFor(String alias) {
    return alias == null ? Optional.empty() : Optional.ofNullable(aliases.get(alias));
  }
}
