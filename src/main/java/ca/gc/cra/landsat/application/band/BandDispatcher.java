package ca.gc.cra.landsat.application.band;

import ca.gc.cra.landsat.application.metadata.MetadataStore;
import ca.gc.cra.landsat.domain.band.BandFileIndex;
import ca.gc.cra.landsat.domain.band.BandMapTable;
import ca.gc.cra.landsat.domain.band.BandMapping;
import ca.gc.cra.landsat.domain.band.SensorKey;
import ca.gc.cra.landsat.domain.error.BandMapException;
import ca.gc.cra.landsat.domain.error.MetadataFileException;
import ca.gc.cra.landsat.domain.metadata.MetadataValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Identifies the sensor of a parsed archive and indexes its band files.
 * <p><strong>Why:</strong> Alias tables differ per spacecraft and sensor, so the sensor must be known before a band
 * alias can be turned into a file.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read {@code SPACECRAFT_ID} and {@code SENSOR_ID} from {@code PRODUCT_METADATA}.</li>
 *   <li>Select the {@link BandMapping} for that combination.</li>
 *   <li>Collect {@code FILE_NAME_BAND_<code>} attributes into a {@link BandFileIndex}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class BandDispatcher {
  /** Group carrying sensor identity and band file names. */
  public static final String PRODUCT_METADATA = "PRODUCT_METADATA";
  static final String SPACECRAFT_ID = "SPACECRAFT_ID";
  static final String SENSOR_ID = "SENSOR_ID";

  private static final Logger log = LoggerFactory.getLogger(BandDispatcher.class);
  private static final Pattern BAND_FILE =
      Pattern.compile("FILE_NAME_BAND_(?<code>(?:\\d{1,2}|[A-Za-z]+).*)", Pattern.CASE_INSENSITIVE);

  private BandDispatcher() {}

  /**
   * Reads the sensor identity of a parsed store.
   *
   * @param store parsed metadata
   * @return spacecraft and sensor pair
   * @throws MetadataFileException when either identity attribute is missing
   */
  public static SensorKey sensorKey(MetadataStore store) {
    Objects.requireNonNull(store, "store");
    Optional<MetadataValue> spacecraft = store.get(PRODUCT_METADATA, SPACECRAFT_ID);
    Optional<MetadataValue> sensor = store.get(PRODUCT_METADATA, SENSOR_ID);
    if (spacecraft.isEmpty() || sensor.isEmpty()) {
      throw new MetadataFileException(
          "Metadata " + store.path() + " does not contain a spacecraft or sensor attribute");
    }
    return new SensorKey(spacecraft.get().asText(), sensor.get().asText());
  }

  /**
   * Selects the band mapping for the sensor recorded in the store.
   *
   * @param store parsed metadata
   * @param table band table to consult
   * @return mapping for {@code <SPACECRAFT_ID>_<SENSOR_ID>}
   * @throws MetadataFileException when the identity attributes are missing
   * @throws BandMapException when the table has no entry for the combination
   */
  public static BandMapping dispatch(MetadataStore store, BandMapTable table) {
    Objects.requireNonNull(table, "table");
    SensorKey key = sensorKey(store);
    BandMapping mapping = table.lookup(key).orElseThrow(() -> new BandMapException(key.key()));
    log.debug("Dispatched {} to band mapping with {} aliases", key, mapping.aliases().size());
    return mapping;
  }

  /**
   * Builds the band file index from {@code PRODUCT_METADATA}.
   *
   * @param store parsed metadata
   * @return band code to file name
   * @throws ca.gc.cra.landsat.domain.error.GroupException when {@code PRODUCT_METADATA} is missing
   */
  public static BandFileIndex index(MetadataStore store) {
    Objects.requireNonNull(store, "store");
    Map<String, String> files = new LinkedHashMap<>();
    for (Map.Entry<String, MetadataValue> entry : store.iterGroup(PRODUCT_METADATA)) {
      Matcher matcher = BAND_FILE.matcher(entry.getKey());
      if (matcher.matches()) {
        files.put(matcher.group("code"), entry.getValue().asText());
      }
    }
    log.debug("Indexed {} band files from {}", files.size(), store.path());
    return new BandFileIndex(files);
  }
}
