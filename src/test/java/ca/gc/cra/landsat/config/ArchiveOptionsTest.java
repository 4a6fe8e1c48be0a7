package ca.gc.cra.landsat.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.landsat.domain.band.SensorKey;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArchiveOptionsTest {

  @TempDir Path tempDir;

  @Test
  void defaultsUseBundledTableAndCaseInsensitiveTemplate() {
    ArchiveOptions options = ArchiveOptions.defaults();

    assertNull(options.extractTo());
    assertNull(options.alias());
    assertSame(BandMapLoader.defaults(), options.bandMap());
    assertTrue(options.metadataTemplate().matcher("LC08_L1TP_044034_20200101_MTL.txt").matches());
    assertTrue(options.metadataTemplate().matcher("scene_mtl.TXT").matches());
  }

  @Test
  void fromMapAppliesKnownKeys() throws IOException {
    ArchiveOptions options = ArchiveOptions.fromMap(Map.of(
        "extractTo", tempDir.toString(),
        "alias", "  scene-a ",
        "metadataTemplate", ".+_meta\\.txt"));

    assertEquals(tempDir, options.extractTo());
    assertEquals("scene-a", options.alias());
    assertTrue(options.metadataTemplate().matcher("X_META.TXT").matches());
  }

  @Test
  void fromMapIgnoresBlankValues() throws IOException {
    ArchiveOptions options = ArchiveOptions.fromMap(Map.of("alias", " ", "extractTo", ""));

    assertNull(options.alias());
    assertNull(options.extractTo());
  }

  @Test
  void fromMapLoadsBandMapFile() throws IOException {
    Path bands = tempDir.resolve("bands.yaml");
    Files.writeString(bands, """
        mappings:
          LANDSAT_9_OLI_TIRS:
            red: 4
        """);

    ArchiveOptions options = ArchiveOptions.fromMap(Map.of("bandMap", bands.toString()));

    assertTrue(options.bandMap().lookup(new SensorKey("LANDSAT_9", "OLI_TIRS")).isPresent());
  }

  @Test
  void invalidTemplateIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> ArchiveOptions.defaults().withMetadataTemplate("[unclosed"));
  }

  @Test
  void fromYamlFallsBackToDefaultsWhenFileMissing() throws IOException {
    ArchiveOptions options = ArchiveOptions.fromYaml(tempDir.resolve("missing.yaml"), "default");

    assertEquals(ArchiveOptions.DEFAULT_METADATA_TEMPLATE, options.metadataTemplate().pattern());
  }

  @Test
  void fromYamlReadsProfile() throws IOException {
    Path yaml = tempDir.resolve("landsat.yaml");
    Files.writeString(yaml, """
        common:
          alias: base
        archive:
          alias: profiled
        """);

    assertEquals("profiled", ArchiveOptions.fromYaml(yaml, "archive").alias());
    assertEquals("base", ArchiveOptions.fromYaml(yaml, "other").alias());
  }
}
