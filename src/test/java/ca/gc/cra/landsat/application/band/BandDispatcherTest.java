package ca.gc.cra.landsat.application.band;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.landsat.application.metadata.MetadataStore;
import ca.gc.cra.landsat.config.BandMapLoader;
import ca.gc.cra.landsat.domain.band.BandFileIndex;
import ca.gc.cra.landsat.domain.band.BandMapTable;
import ca.gc.cra.landsat.domain.band.BandMapping;
import ca.gc.cra.landsat.domain.error.BandMapException;
import ca.gc.cra.landsat.domain.error.GroupException;
import ca.gc.cra.landsat.domain.error.MetadataFileException;
import ca.gc.cra.landsat.testutil.MtlFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BandDispatcherTest {

  @TempDir Path tempDir;

  private MetadataStore store(String name, String text) throws IOException {
    Path mtl = tempDir.resolve(name);
    Files.writeString(mtl, text);
    MetadataStore store = new MetadataStore(mtl);
    store.parse();
    return store;
  }

  @Test
  void dispatchSelectsLandsat8Mapping() throws IOException {
    MetadataStore store = store(MtlFixtures.LANDSAT8_MTL_NAME, MtlFixtures.landsat8Mtl());

    BandMapping mapping = BandDispatcher.dispatch(store, BandMapLoader.defaults());

    assertEquals("LANDSAT_8_OLI_TIRS", mapping.sensorKey());
    assertEquals("4", mapping.codeFor("red").orElseThrow());
  }

  @Test
  void unknownSensorNamesTheKey() throws IOException {
    MetadataStore store = store("l9_MTL.txt", MtlFixtures.productMtl("LANDSAT_9", "OLI_TIRS", Map.of()));

    BandMapException ex =
        assertThrows(BandMapException.class, () -> BandDispatcher.dispatch(store, BandMapLoader.defaults()));

    assertEquals("LANDSAT_9_OLI_TIRS", ex.sensorKey());
    assertTrue(ex.getMessage().contains("LANDSAT_9_OLI_TIRS"));
  }

  @Test
  void callerTableOverridesDefaults() throws IOException {
    MetadataStore store = store("l9_MTL.txt", MtlFixtures.productMtl("LANDSAT_9", "OLI_TIRS", Map.of()));
    BandMapTable table = BandMapTable.of(Map.of("LANDSAT_9_OLI_TIRS", Map.of("red", "4")));

    assertEquals("LANDSAT_9_OLI_TIRS", BandDispatcher.dispatch(store, table).sensorKey());
  }

  @Test
  void missingSensorIdentityFails() throws IOException {
    MetadataStore store = store("partial_MTL.txt", """
        GROUP = PRODUCT_METADATA
          SPACECRAFT_ID = "LANDSAT_8"
        END_GROUP = PRODUCT_METADATA
        END
        """);

    assertThrows(MetadataFileException.class, () -> BandDispatcher.dispatch(store, BandMapLoader.defaults()));
  }

  @Test
  void missingProductGroupFails() throws IOException {
    MetadataStore store = store("other_MTL.txt", """
        GROUP = IMAGE_ATTRIBUTES
          CLOUD_COVER = 1.0
        END_GROUP = IMAGE_ATTRIBUTES
        END
        """);

    assertThrows(MetadataFileException.class, () -> BandDispatcher.sensorKey(store));
    assertThrows(GroupException.class, () -> BandDispatcher.index(store));
  }

  @Test
  void indexCollectsEveryBandFile() throws IOException {
    MetadataStore store = store(MtlFixtures.LANDSAT8_MTL_NAME, MtlFixtures.landsat8Mtl());

    BandFileIndex index = BandDispatcher.index(store);

    assertEquals(12, index.files().size());
    assertEquals(MtlFixtures.LANDSAT8_PRODUCT + "_B1.TIF", index.fileFor("1").orElseThrow());
    assertEquals(MtlFixtures.LANDSAT8_PRODUCT + "_B11.TIF", index.fileFor("11").orElseThrow());
    assertEquals(MtlFixtures.LANDSAT8_PRODUCT + "_BQA.TIF", index.fileFor("QUALITY").orElseThrow());
  }

  @Test
  void indexKeepsCompositeCodes() throws IOException {
    Map<String, String> bands = new LinkedHashMap<>();
    bands.put("6_VCID_1", "L7_B6_1.TIF");
    bands.put("6_VCID_2", "L7_B6_2.TIF");
    bands.put("8", "L7_B8.TIF");
    MetadataStore store = store("l7_MTL.txt", MtlFixtures.productMtl("LANDSAT_7", "ETM", bands));

    BandFileIndex index = BandDispatcher.index(store);

    assertEquals(bands, index.files());
    assertEquals("6_VCID_1", BandDispatcher.dispatch(store, BandMapLoader.defaults()).codeFor("tirs_low").orElseThrow());
  }
}
