package ca.gc.cra.landsat;

import ca.gc.cra.landsat.application.archive.LandsatArchive;
import ca.gc.cra.landsat.application.archive.LandsatArchiveLoader;
import ca.gc.cra.landsat.application.archive.SourceResolver;
import ca.gc.cra.landsat.config.ArchiveOptions;
import ca.gc.cra.landsat.infrastructure.archive.SniffingArchiveOpener;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Entry point that wires the default archive adapters into a {@link LandsatArchiveLoader}.
 *
 * <pre>{@code
 * LandsatArchive archive = LandsatArchives.read(Path.of("LC08_L1TP_044034_20200101.tar.gz"));
 * Path red = archive.bandPath("red");
 * }</pre>
 *
 * @since 0.1.0
 */
public final class LandsatArchives {
  private LandsatArchives() {}

  /**
   * Creates a loader backed by the content-sniffing zip/tar opener.
   *
   * @return loader
   */
  public static LandsatArchiveLoader loader() {
    return new LandsatArchiveLoader(new SourceResolver(new SniffingArchiveOpener()));
  }

  /**
   * Reads a directory, MTL file, or archive with default options.
   *
   * @param source product location
   * @return resolved archive
   * @throws IOException if reading or extraction fails
   */
  public static LandsatArchive read(Path source) throws IOException {
    return loader().load(source);
  }

  /**
   * Reads a directory, MTL file, or archive.
   *
   * @param source product location
   * @param options extraction target, alias, metadata template, and band table
   * @return resolved archive
   * @throws IOException if reading or extraction fails
   */
  public static LandsatArchive read(Path source, ArchiveOptions options) throws IOException {
    return loader().load(source, options);
  }
}
