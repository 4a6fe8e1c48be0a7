package ca.gc.cra.landsat.infrastructure.archive;

import ca.gc.cra.landsat.application.port.ArchiveReader;
import ca.gc.cra.landsat.validation.Paths;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ArchiveReader} over a zip file, backed by {@link ZipFile}.
 *
 * <p>The zip file stays open from construction until {@link #close()}.</p>
 *
 * @since 0.1.0
 */
public final class ZipArchiveReader implements ArchiveReader {
  private static final Logger log = LoggerFactory.getLogger(ZipArchiveReader.class);

  private final Path file;
  private final ZipFile zip;

  /**
   * Opens a zip file.
   *
   * @param file zip archive
   * @throws IOException if the file cannot be opened as a zip
   */
  public ZipArchiveReader(Path file) throws IOException {
    this.file = Objects.requireNonNull(file, "file");
    this.zip = new ZipFile(file.toFile());
  }

  @Override
  public List<String> listEntries() {
    List<String> names = new ArrayList<>();
    Enumeration<? extends ZipEntry> entries = zip.entries();
    while (entries.hasMoreElements()) {
      names.add(entries.nextElement().getName());
    }
    return names;
  }

  @Override
  public void extractAll(Path destination) throws IOException {
    Objects.requireNonNull(destination, "destination");
    Files.createDirectories(destination);
    int count = 0;
    Enumeration<? extends ZipEntry> entries = zip.entries();
    while (entries.hasMoreElements()) {
      ZipEntry entry = entries.nextElement();
      Path target = Paths.resolveEntry(destination, entry.getName());
      if (entry.isDirectory()) {
        Files.createDirectories(target);
        continue;
      }
      Files.createDirectories(target.getParent());
      try (InputStream in = zip.getInputStream(entry)) {
        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
      }
      count++;
    }
    log.debug("Extracted {} files from {} to {}", count, file, destination);
  }

  @Override
  public void close() throws IOException {
    zip.close();
  }
}
