package ca.gc.cra.landsat.domain.band;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Band code to file name index built from the {@code FILE_NAME_BAND_*} attributes of {@code PRODUCT_METADATA}.
 *
 * @param files band code (e.g. {@code 4}, {@code 6_VCID_1}, {@code QUALITY}) to file name relative to the archive
 *     directory
 * @since 0.1.0
 */
public record BandFileIndex(Map<String, String> files) {
  public BandFileIndex {
    files = Map.copyOf(Objects.requireNonNull(files, "files"));
  }

  /**
   * Looks up the file for a band code.
   *
   * @param code band code exactly as it appears after {@code FILE_NAME_BAND_}
   * @return file name, or empty when the archive has no such band
   */
  public Optional<String> fileFor(String code) {
    return code == null ? Optional.empty() : Optional.ofNullable(files.get(code));
  }

  /**
   * Reports whether the index is empty.
   *
   * @return {@code true} when no band file was listed
   */
  public boolean isEmpty() {
    return files.isEmpty();
  }
}
