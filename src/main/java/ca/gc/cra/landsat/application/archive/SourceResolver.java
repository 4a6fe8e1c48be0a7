package ca.gc.cra.landsat.application.archive;

import ca.gc.cra.landsat.application.port.ArchiveOpener;
import ca.gc.cra.landsat.application.port.ArchiveReader;
import ca.gc.cra.landsat.domain.error.UnsupportedSourceException;
import ca.gc.cra.landsat.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Classifies a source path and locates its MTL file.
 * <p><strong>Why:</strong> Landsat products arrive as unpacked directories, bare MTL files, or zip/tar downloads
 * whose extensions are unreliable; everything downstream only needs a metadata path and a base directory.</p>
 * <p><strong>Role:</strong> First stage of archive loading.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Directories: sniff the sorted file names.</li>
 *   <li>{@code .txt} files: use directly.</li>
 *   <li>Archives: sniff entry names, extract everything, and point at the extracted MTL file.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe when the {@link ArchiveOpener} is; holds no mutable state.</p>
 * <p><strong>Observability:</strong> Logs classification at DEBUG and extraction at INFO.</p>
 *
 * @since 0.1.0
 */
public final class SourceResolver {
  private static final Logger log = LoggerFactory.getLogger(SourceResolver.class);
  private static final String METADATA_SUFFIX = ".txt";

  private final ArchiveOpener archives;

  /**
   * Creates a resolver.
   *
   * @param archives content-sniffing opener for zip/tar containers
   */
  public SourceResolver(ArchiveOpener archives) {
    this.archives = Objects.requireNonNull(archives, "archives");
  }

  /**
   * Classifies {@code source} and returns the located metadata file.
   *
   * @param source directory, MTL file, or archive
   * @param extractTo extraction directory for archives; {@code null} selects {@code <parent>/<stem>}
   * @param template metadata file template
   * @return resolved metadata location
   * @throws IOException if listing, reading, or extracting fails
   * @throws UnsupportedSourceException if the source is none of the supported kinds
   * @throws ca.gc.cra.landsat.domain.error.MetadataFileException if no file matches the template
   */
  public ResolvedSource resolve(Path source, Path extractTo, Pattern template) throws IOException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(template, "template");

    if (Files.isDirectory(source)) {
      return resolveDirectory(source, template);
    }
    if (Files.isRegularFile(source) && hasMetadataSuffix(source)) {
      Path file = source.toAbsolutePath().normalize();
      log.debug("Source {} classified as metadata file", source);
      return new ResolvedSource(SourceKind.METADATA_FILE, file.getParent(), file);
    }
    if (Files.isRegularFile(source) && archives.isArchive(source)) {
      return resolveArchive(source, extractTo, template);
    }
    throw new UnsupportedSourceException(source + " is not supported");
  }

  private ResolvedSource resolveDirectory(Path directory, Pattern template) throws IOException {
    List<String> names;
    try (Stream<Path> entries = Files.list(directory)) {
      names = entries
          .map(p -> p.getFileName().toString())
          .sorted()
          .collect(Collectors.toList());
    }
    String metadataName = MetadataSniffer.sniff(names, template);
    Path base = directory.toAbsolutePath().normalize();
    log.debug("Source {} classified as directory; metadata file {}", directory, metadataName);
    return new ResolvedSource(SourceKind.DIRECTORY, base, base.resolve(metadataName));
  }

  private ResolvedSource resolveArchive(Path archive, Path extractTo, Pattern template) throws IOException {
    Path destination = extractTo != null ? extractTo : defaultExtractDirectory(archive);
    String entry;
    try (ArchiveReader reader = archives.open(archive)) {
      entry = MetadataSniffer.sniffEntry(reader.listEntries(), template);
      reader.extractAll(destination);
    }
    Path metadataFile = Paths.resolveEntry(destination, entry);
    log.info("Extracted {} to {}; metadata file {}", archive, destination, entry);
    return new ResolvedSource(SourceKind.ARCHIVE, metadataFile.getParent(), metadataFile);
  }

  static Path defaultExtractDirectory(Path archive) {
    Path absolute = archive.toAbsolutePath().normalize();
    return absolute.resolveSibling(Paths.stem(absolute));
  }

  private static boolean hasMetadataSuffix(Path file) {
    return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(METADATA_SUFFIX);
  }
}
