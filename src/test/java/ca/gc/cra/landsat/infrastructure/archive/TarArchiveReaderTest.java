package ca.gc.cra.landsat.infrastructure.archive;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.landsat.testutil.MtlFixtures;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TarArchiveReaderTest {

  @TempDir Path tempDir;

  @Test
  void listsPlainTarEntries() throws IOException {
    Path tar = MtlFixtures.writeTar(tempDir.resolve("scene.tar"), MtlFixtures.sceneEntries(""), false);

    try (TarArchiveReader reader = new TarArchiveReader(tar, ArchiveFormat.TAR)) {
      assertEquals(List.of("scene_B4.TIF", "scene_B5.TIF", "scene_BQA.TIF", "scene_MTL.txt"), reader.listEntries());
    }
  }

  @Test
  void listAndExtractCanBothRunOnGzipTar() throws IOException {
    Path tar = MtlFixtures.writeTar(tempDir.resolve("scene.tar.gz"), MtlFixtures.sceneEntries("scene/"), true);
    Path out = tempDir.resolve("out");

    try (TarArchiveReader reader = new TarArchiveReader(tar, ArchiveFormat.TAR_GZIP)) {
      assertEquals(5, reader.listEntries().size());
      reader.extractAll(out);
    }

    assertEquals("b4", Files.readString(out.resolve("scene/scene_B4.TIF")));
    assertTrue(Files.readString(out.resolve("scene/scene_MTL.txt")).contains("LANDSAT_8"));
  }

  @Test
  void readsBzip2Tar() throws IOException {
    Path plain = MtlFixtures.writeTar(tempDir.resolve("scene.tar"), MtlFixtures.sceneEntries(""), false);
    Path bz2 = tempDir.resolve("scene.tar.bz2");
    try (OutputStream out = new BZip2CompressorOutputStream(Files.newOutputStream(bz2))) {
      Files.copy(plain, out);
    }

    try (TarArchiveReader reader = new TarArchiveReader(bz2, ArchiveFormat.TAR_BZIP2)) {
      assertTrue(reader.listEntries().contains("scene_MTL.txt"));
    }
  }

  @Test
  void closedReaderRefusesWork() throws IOException {
    Path tar = MtlFixtures.writeTar(tempDir.resolve("scene.tar"), MtlFixtures.sceneEntries(""), false);
    TarArchiveReader reader = new TarArchiveReader(tar, ArchiveFormat.TAR);
    reader.close();

    assertThrows(IllegalStateException.class, reader::listEntries);
    assertThrows(IllegalStateException.class, () -> reader.extractAll(tempDir.resolve("out")));
  }

  @Test
  void zipFormatIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new TarArchiveReader(tempDir.resolve("x.zip"), ArchiveFormat.ZIP));
  }
}
