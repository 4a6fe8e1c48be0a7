package ca.gc.cra.landsat.application.archive;

import ca.gc.cra.landsat.application.band.BandDispatcher;
import ca.gc.cra.landsat.application.metadata.MetadataStore;
import ca.gc.cra.landsat.config.ArchiveOptions;
import ca.gc.cra.landsat.domain.band.BandFileIndex;
import ca.gc.cra.landsat.domain.band.BandMapping;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Use case that turns a source path into a {@link LandsatArchive}.
 * <p><strong>Why:</strong> Runs resolution, parsing, sensor dispatch, and band indexing in the only order in which
 * each stage has its inputs.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Advance through {@code UNRESOLVED -> METADATA_LOCATED -> SENSOR_IDENTIFIED -> BAND_INDEX_READY}.</li>
 *   <li>Abort on the first failure; no partially built archive escapes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless besides the resolver; concurrent loads of different sources are
 * independent.</p>
 * <p><strong>Observability:</strong> Stage transitions at DEBUG, the loaded archive at INFO, scenes without band files
 * at WARN.</p>
 *
 * @since 0.1.0
 */
public final class LandsatArchiveLoader {
  private static final Logger log = LoggerFactory.getLogger(LandsatArchiveLoader.class);

  /** Pipeline stages reached while loading. */
  enum Stage {
    UNRESOLVED,
    METADATA_LOCATED,
    SENSOR_IDENTIFIED,
    BAND_INDEX_READY
  }

  private final SourceResolver resolver;

  /**
   * Creates a loader.
   *
   * @param resolver source classifier
   */
  public LandsatArchiveLoader(SourceResolver resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  /**
   * Loads an archive with default options.
   *
   * @param source directory, MTL file, or archive
   * @return resolved archive
   * @throws IOException if reading or extraction fails
   */
  public LandsatArchive load(Path source) throws IOException {
    return load(source, ArchiveOptions.defaults());
  }

  /**
   * Loads an archive.
   *
   * @param source directory, MTL file, or archive
   * @param options extraction target, alias, metadata template, and band table
   * @return resolved archive
   * @throws IOException if reading or extraction fails
   * @throws ca.gc.cra.landsat.domain.error.LandsatException for unsupported sources, missing or malformed metadata,
   *     and unsupported sensors
   */
  public LandsatArchive load(Path source, ArchiveOptions options) throws IOException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(options, "options");
    log.debug("{} {}", Stage.UNRESOLVED, source);

    ResolvedSource resolved = resolver.resolve(source, options.extractTo(), options.metadataTemplate());
    log.debug("{} {} ({})", Stage.METADATA_LOCATED, resolved.metadataFile(), resolved.kind());

    MetadataStore metadata = new MetadataStore(resolved.metadataFile());
    metadata.parse();
    BandMapping mapping = BandDispatcher.dispatch(metadata, options.bandMap());
    log.debug("{} {}", Stage.SENSOR_IDENTIFIED, mapping.sensorKey());

    BandFileIndex bands = BandDispatcher.index(metadata);
    if (bands.isEmpty()) {
      log.warn("Metadata {} lists no FILE_NAME_BAND attributes; every band lookup will fail", metadata.path());
    }
    log.debug("{} {} bands", Stage.BAND_INDEX_READY, bands.files().size());

    LandsatArchive archive =
        new LandsatArchive(resolved.baseDirectory(), metadata, options.alias(), mapping, bands);
    log.info("Loaded {} archive {} with {} bands", mapping.sensorKey(), resolved.baseDirectory(),
        bands.files().size());
    return archive;
  }
}
