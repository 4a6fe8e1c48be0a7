package ca.gc.cra.landsat.application.archive;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.landsat.application.port.ArchiveOpener;
import ca.gc.cra.landsat.application.port.ArchiveReader;
import ca.gc.cra.landsat.config.ArchiveOptions;
import ca.gc.cra.landsat.domain.error.MetadataFileException;
import ca.gc.cra.landsat.domain.error.UnsupportedSourceException;
import ca.gc.cra.landsat.infrastructure.archive.SniffingArchiveOpener;
import ca.gc.cra.landsat.testutil.MtlFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceResolverTest {

  private static final Pattern TEMPLATE = ArchiveOptions.defaults().metadataTemplate();

  @TempDir Path tempDir;

  private Path root;
  private SourceResolver resolver;

  @BeforeEach
  void setUp() {
    root = tempDir.toAbsolutePath().normalize();
    resolver = new SourceResolver(new SniffingArchiveOpener());
  }

  @Test
  void directorySourceUsesSniffedFile() throws IOException {
    Path dir = MtlFixtures.writeSceneDirectory(root.resolve("scene"));

    ResolvedSource resolved = resolver.resolve(dir, null, TEMPLATE);

    assertEquals(SourceKind.DIRECTORY, resolved.kind());
    assertEquals(dir, resolved.baseDirectory());
    assertEquals(dir.resolve("scene_MTL.txt"), resolved.metadataFile());
  }

  @Test
  void directoryListingIsSorted() throws IOException {
    Path dir = Files.createDirectories(root.resolve("two"));
    Files.writeString(dir.resolve("b_MTL.txt"), "");
    Files.writeString(dir.resolve("a_MTL.txt"), "");

    assertEquals(dir.resolve("a_MTL.txt"), resolver.resolve(dir, null, TEMPLATE).metadataFile());
  }

  @Test
  void directoryWithoutMetadataFails() throws IOException {
    Path dir = Files.createDirectories(root.resolve("empty"));
    Files.writeString(dir.resolve("B4.TIF"), "x");

    assertThrows(MetadataFileException.class, () -> resolver.resolve(dir, null, TEMPLATE));
  }

  @Test
  void textFileIsUsedDirectly() throws IOException {
    Path mtl = root.resolve("SCENE_MTL.TXT");
    Files.writeString(mtl, "GROUP = A\nK = 1\nEND_GROUP = A\nEND\n");

    ResolvedSource resolved = resolver.resolve(mtl, null, TEMPLATE);

    assertEquals(SourceKind.METADATA_FILE, resolved.kind());
    assertEquals(root, resolved.baseDirectory());
    assertEquals(mtl, resolved.metadataFile());
  }

  @Test
  void zipIsExtractedNextToArchiveByDefault() throws IOException {
    Path zip = MtlFixtures.writeZip(root.resolve("LC08_scene.zip"), MtlFixtures.sceneEntries(""));

    ResolvedSource resolved = resolver.resolve(zip, null, TEMPLATE);

    Path expected = root.resolve("LC08_scene");
    assertEquals(SourceKind.ARCHIVE, resolved.kind());
    assertEquals(expected, resolved.baseDirectory());
    assertEquals(expected.resolve("scene_MTL.txt"), resolved.metadataFile());
    assertTrue(Files.isRegularFile(expected.resolve("scene_B4.TIF")));
  }

  @Test
  void gzipTarHonoursNestedMetadataEntry() throws IOException {
    Path tar = MtlFixtures.writeTar(root.resolve("LC08.tar.gz"), MtlFixtures.sceneEntries("inner/"), true);
    Path out = root.resolve("out");

    ResolvedSource resolved = resolver.resolve(tar, out, TEMPLATE);

    assertEquals(out.resolve("inner"), resolved.baseDirectory());
    assertEquals(out.resolve("inner").resolve("scene_MTL.txt"), resolved.metadataFile());
    assertTrue(Files.isRegularFile(resolved.metadataFile()));
    assertFalse(Files.exists(root.resolve("LC08")));
  }

  @Test
  void archiveIsRecognisedByContentNotExtension() throws IOException {
    Path disguised = MtlFixtures.writeZip(root.resolve("download.bin"), MtlFixtures.sceneEntries(""));

    ResolvedSource resolved = resolver.resolve(disguised, root.resolve("x"), TEMPLATE);

    assertEquals(SourceKind.ARCHIVE, resolved.kind());
  }

  @Test
  void archiveWithoutMetadataFailsBeforeExtraction() throws IOException {
    Path zip = MtlFixtures.writeZip(root.resolve("bands.zip"), Map.of("B4.TIF", "x"));

    assertThrows(MetadataFileException.class, () -> resolver.resolve(zip, null, TEMPLATE));
    assertFalse(Files.exists(root.resolve("bands")));
  }

  @Test
  void unsupportedFileIsRejected() throws IOException {
    Path other = root.resolve("notes.md");
    Files.writeString(other, "just text");

    assertThrows(UnsupportedSourceException.class, () -> resolver.resolve(other, null, TEMPLATE));
  }

  @Test
  void missingPathIsRejected() {
    assertThrows(UnsupportedSourceException.class,
        () -> resolver.resolve(root.resolve("absent.zip"), null, TEMPLATE));
  }

  @Test
  void archiveReaderIsClosedAfterExtraction() throws IOException {
    RecordingOpener opener = new RecordingOpener(List.of("scene/x_MTL.txt"));
    Path source = root.resolve("fake.archive");
    Files.writeString(source, "stub");

    ResolvedSource resolved = new SourceResolver(opener).resolve(source, root.resolve("dest"), TEMPLATE);

    assertEquals(root.resolve("dest").resolve("scene").resolve("x_MTL.txt"), resolved.metadataFile());
    assertEquals(List.of("list", "extract " + root.resolve("dest"), "close"), opener.calls);
  }

  @Test
  void defaultExtractDirectoryStopsAtFirstDot() {
    assertEquals(root.resolve("LC08_scene"), SourceResolver.defaultExtractDirectory(root.resolve("LC08_scene.tar.gz")));
  }

  private static final class RecordingOpener implements ArchiveOpener {
    private final List<String> entries;
    private final List<String> calls = new ArrayList<>();

    RecordingOpener(List<String> entries) {
      this.entries = entries;
    }

    @Override
    public boolean isArchive(Path file) {
      return true;
    }

    @Override
    public ArchiveReader open(Path file) {
      return new ArchiveReader() {
        @Override
        public List<String> listEntries() {
          calls.add("list");
          return entries;
        }

        @Override
        public void extractAll(Path destination) {
          calls.add("extract " + destination);
        }

        @Override
        public void close() {
          calls.add("close");
        }
      };
    }
  }
}
