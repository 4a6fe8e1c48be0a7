package ca.gc.cra.landsat.application.archive;

import ca.gc.cra.landsat.application.metadata.MetadataStore;
import ca.gc.cra.landsat.application.port.RasterPort;
import ca.gc.cra.landsat.domain.band.BandFileIndex;
import ca.gc.cra.landsat.domain.band.BandMapping;
import ca.gc.cra.landsat.domain.error.BandNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> A fully resolved Landsat product: base directory, parsed metadata, sensor band mapping, and
 * band file index.
 * <p><strong>Why:</strong> Lets callers turn a band code or alias into a file without knowing how the product was
 * delivered.</p>
 * <p><strong>Role:</strong> Application aggregate; instances only come out of {@link LandsatArchiveLoader}, so an
 * archive is never partially valid.</p>
 * <p><strong>Thread-safety:</strong> Effectively immutable after construction; the metadata store is not re-parsed.</p>
 *
 * @since 0.1.0
 */
public final class LandsatArchive {
  private final Path directory;
  private final MetadataStore metadata;
  private final String alias;
  private final BandMapping mapping;
  private final BandFileIndex bands;

  LandsatArchive(Path directory, MetadataStore metadata, String alias, BandMapping mapping, BandFileIndex bands) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    this.alias = alias;
    this.mapping = Objects.requireNonNull(mapping, "mapping");
    this.bands = Objects.requireNonNull(bands, "bands");
  }

  /**
   * Resolves a band identifier to its file name.
   *
   * <p>The identifier is first looked up as a band code; when absent it is translated through the sensor's alias
   * table and looked up again.</p>
   *
   * @param band band code ({@code "4"}, {@code "QUALITY"}) or alias ({@code "red"})
   * @return file name relative to {@link #directory()}
   * @throws BandNotFoundException when neither lookup succeeds
   */
  public String bandFile(String band) {
    Objects.requireNonNull(band, "band");
    Optional<String> direct = bands.fileFor(band);
    if (direct.isPresent()) {
      return direct.get();
    }
    return mapping.codeFor(band)
        .flatMap(bands::fileFor)
        .orElseThrow(() -> new BandNotFoundException(band));
  }

  /**
   * Resolves a band identifier given as a number, e.g. {@code 4}.
   *
   * @param band numeric band code
   * @return file name relative to {@link #directory()}
   * @throws BandNotFoundException when the archive has no such band
   */
  public String bandFile(int band) {
    return bandFile(Integer.toString(band));
  }

  /**
   * Resolves a band identifier to an absolute file path.
   *
   * @param band band code or alias
   * @return absolute path below {@link #directory()}
   * @throws BandNotFoundException when the band cannot be resolved
   */
  public Path bandPath(String band) {
    return directory.resolve(bandFile(band)).toAbsolutePath().normalize();
  }

  /**
   * Opens a band through the caller's raster library.
   *
   * @param band band code or alias
   * @param rasters raster I/O collaborator
   * @param <R> raster handle type
   * @return handle returned by {@code rasters}
   * @throws IOException if the raster library cannot open the file
   * @throws BandNotFoundException when the band cannot be resolved
   */
  public <R> R openBand(String band, RasterPort<R> rasters) throws IOException {
    Objects.requireNonNull(rasters, "rasters");
    return rasters.open(bandPath(band), RasterPort.AccessMode.READ);
  }

  /**
   * Returns the directory band file names are relative to.
   *
   * @return absolute base directory
   */
  public Path directory() {
    return directory;
  }

  /**
   * Returns the parsed metadata.
   *
   * @return metadata store
   */
  public MetadataStore metadata() {
    return metadata;
  }

  /**
   * Returns the caller-supplied label.
   *
   * @return alias, or empty when none was given
   */
  public Optional<String> alias() {
    return Optional.ofNullable(alias);
  }

  /**
   * Returns the alias table selected for this archive's sensor.
   *
   * @return band mapping
   */
  public BandMapping mapping() {
    return mapping;
  }

  /**
   * Returns the band code to file name index.
   *
   * @return band file index
   */
  public BandFileIndex bands() {
    return bands;
  }

  @Override
  public String toString() {
    return "LandsatArchive(" + directory + ", " + metadata.path().getFileName() + ", " + alias + ", "
        + mapping.sensorKey() + ")";
  }
}
