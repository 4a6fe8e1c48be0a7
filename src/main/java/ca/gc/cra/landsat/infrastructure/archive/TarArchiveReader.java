package ca.gc.cra.landsat.infrastructure.archive;

import ca.gc.cra.landsat.application.port.ArchiveReader;
import ca.gc.cra.landsat.validation.Paths;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ArchiveReader} over plain, gzip, or bzip2 tar files using Apache Commons Compress.
 * <p><strong>Why:</strong> Landsat bundles are commonly distributed as {@code .tar.gz}; the JDK has no tar support.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Stream the container once per operation; tar has no central directory to seek in.</li>
 *   <li>Extract regular files and directories; link entries are skipped.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class TarArchiveReader implements ArchiveReader {
  private static final Logger log = LoggerFactory.getLogger(TarArchiveReader.class);

  private final Path file;
  private final ArchiveFormat format;
  private boolean closed;

  /**
   * Creates a reader for a tar file.
   *
   * @param file tar archive
   * @param format one of {@link ArchiveFormat#TAR}, {@link ArchiveFormat#TAR_GZIP}, {@link ArchiveFormat#TAR_BZIP2}
   * @throws IllegalArgumentException if {@code format} is {@link ArchiveFormat#ZIP}
   */
  public TarArchiveReader(Path file, ArchiveFormat format) {
    this.file = Objects.requireNonNull(file, "file");
    this.format = Objects.requireNonNull(format, "format");
    if (format == ArchiveFormat.ZIP) {
      throw new IllegalArgumentException("zip archives are read by ZipArchiveReader");
    }
  }

  @Override
  public List<String> listEntries() throws IOException {
    ensureOpen();
    List<String> names = new ArrayList<>();
    try (TarArchiveInputStream tar = openTar()) {
      TarArchiveEntry entry;
      while ((entry = tar.getNextEntry()) != null) {
        names.add(entry.getName());
      }
    }
    return names;
  }

  @Override
  public void extractAll(Path destination) throws IOException {
    Objects.requireNonNull(destination, "destination");
    ensureOpen();
    Files.createDirectories(destination);
    int count = 0;
    try (TarArchiveInputStream tar = openTar()) {
      TarArchiveEntry entry;
      while ((entry = tar.getNextEntry()) != null) {
        Path target = Paths.resolveEntry(destination, entry.getName());
        if (entry.isDirectory()) {
          Files.createDirectories(target);
        } else if (entry.isFile()) {
          Files.createDirectories(target.getParent());
          Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
          count++;
        } else {
          log.debug("Skipping non-regular tar entry {} in {}", entry.getName(), file);
        }
      }
    }
    log.debug("Extracted {} files from {} to {}", count, file, destination);
  }

  @Override
  public void close() {
    closed = true;
  }

  private TarArchiveInputStream openTar() throws IOException {
    InputStream raw = new BufferedInputStream(Files.newInputStream(file));
    try {
      InputStream in = switch (format) {
        case TAR_GZIP -> new GzipCompressorInputStream(raw, true);
        case TAR_BZIP2 -> new BZip2CompressorInputStream(raw, true);
        default -> raw;
      };
      return new TarArchiveInputStream(in);
    } catch (IOException ex) {
      raw.close();
      throw ex;
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("tar reader for " + file + " is closed");
    }
  }
}
