package ca.gc.cra.landsat.domain.band;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only table of {@link BandMapping}s keyed by {@code <SPACECRAFT_ID>_<SENSOR_ID>}.
 *
 * <p>Loaded once and shared; see {@code ca.gc.cra.landsat.config.BandMapLoader} for the bundled defaults.</p>
 *
 * @since 0.1.0
 */
public final class BandMapTable {
  private final Map<String, BandMapping> mappings;

  private BandMapTable(Map<String, BandMapping> mappings) {
    this.mappings = Collections.unmodifiableMap(mappings);
  }

  /**
   * Builds a table from alias maps keyed by sensor key.
   *
   * @param entries sensor key to alias/code map, in declaration order
   * @return immutable table
   */
  public static BandMapTable of(Map<String, Map<String, String>> entries) {
    Objects.requireNonNull(entries, "entries");
    Map<String, BandMapping> mappings = new LinkedHashMap<>();
    for (Map.Entry<String, Map<String, String>> entry : entries.entrySet()) {
      mappings.put(entry.getKey(), new BandMapping(entry.getKey(), entry.getValue()));
    }
    return new BandMapTable(mappings);
  }

  /**
   * Finds the mapping for a sensor combination.
   *
   * @param key spacecraft and sensor pair
   * @return mapping, or empty when the combination is not supported
   */
  public Optional<BandMapping> lookup(SensorKey key) {
    Objects.requireNonNull(key, "key");
    return Optional.ofNullable(mappings.get(key.key()));
  }

  /**
   * Returns the supported sensor keys in declaration order.
   *
   * @return unmodifiable key set
   */
  public Set<String> sensorKeys() {
    return mappings.keySet();
  }

  /**
   * Returns the number of supported combinations.
   *
   * @return table size
   */
  public int size() {
    return mappings.size();
  }

  @Override
  public String toString() {
    return "BandMapTable" + mappings.keySet();
  }
}
