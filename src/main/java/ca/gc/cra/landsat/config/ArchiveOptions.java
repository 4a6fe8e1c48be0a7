package ca.gc.cra.landsat.config;

import ca.gc.cra.landsat.domain.band.BandMapTable;
import ca.gc.cra.landsat.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Options controlling how a Landsat source is resolved and indexed.
 * <p><strong>Why:</strong> Groups the optional extraction target, alias label, metadata file template, and band table
 * so callers override only what they need.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; {@link Pattern} and {@link BandMapTable} are thread-safe.</p>
 *
 * @param extractTo extraction directory for archives; {@code null} selects a sibling directory named after the archive
 * @param alias optional label carried by the loaded archive; may be {@code null}
 * @param metadataTemplate pattern matched against file base names to find the MTL file
 * @param bandMap band table consulted during dispatch
 * @since 0.1.0
 */
public record ArchiveOptions(Path extractTo, String alias, Pattern metadataTemplate, BandMapTable bandMap) {
  /** Default metadata file template: any base name ending in {@code MTL.txt}, case-insensitive. */
  public static final String DEFAULT_METADATA_TEMPLATE = ".*MTL\\.txt";

  static final String EXTRACT_TO = "extractTo";
  static final String ALIAS = "alias";
  static final String METADATA_TEMPLATE = "metadataTemplate";
  static final String BAND_MAP = "bandMap";
  /** Setting keys understood by {@link #fromMap(Map)}. */
  public static final Set<String> KEYS = Set.of(EXTRACT_TO, ALIAS, METADATA_TEMPLATE, BAND_MAP);

  private static final Pattern DEFAULT_PATTERN = Strings.compileTemplate(METADATA_TEMPLATE, DEFAULT_METADATA_TEMPLATE);

  public ArchiveOptions {
    Objects.requireNonNull(metadataTemplate, "metadataTemplate");
    Objects.requireNonNull(bandMap, "bandMap");
  }

  /**
   * Returns options using the default template and the bundled band table.
   *
   * @return default options
   */
  public static ArchiveOptions defaults() {
    return new ArchiveOptions(null, null, DEFAULT_PATTERN, BandMapLoader.defaults());
  }

  /**
   * Builds options from flat key/value settings, e.g. the output of {@link YamlConfigLoader}.
   *
   * <p>Recognized keys: {@code extractTo}, {@code alias}, {@code metadataTemplate}, {@code bandMap} (path to a band
   * map YAML file). Missing or blank keys keep their defaults.</p>
   *
   * @param settings flat settings map
   * @return options with overrides applied
   * @throws IOException if a {@code bandMap} file cannot be read
   * @throws IllegalArgumentException if a value is invalid
   */
  public static ArchiveOptions fromMap(Map<String, String> settings) throws IOException {
    Objects.requireNonNull(settings, "settings");
    ArchiveOptions options = defaults();
    String extractTo = Strings.optional(EXTRACT_TO, settings.get(EXTRACT_TO));
    if (extractTo != null) {
      options = options.withExtractTo(Path.of(extractTo));
    }
    String alias = Strings.optional(ALIAS, settings.get(ALIAS));
    if (alias != null) {
      options = options.withAlias(alias);
    }
    String template = Strings.optional(METADATA_TEMPLATE, settings.get(METADATA_TEMPLATE));
    if (template != null) {
      options = options.withMetadataTemplate(template);
    }
    String bandMap = Strings.optional(BAND_MAP, settings.get(BAND_MAP));
    if (bandMap != null) {
      options = options.withBandMap(BandMapLoader.load(Path.of(bandMap)));
    }
    return options;
  }

  /**
   * Loads options from a YAML file section, falling back to defaults when the file is absent.
   *
   * @param path YAML configuration file
   * @param profile section merged over {@code common}
   * @return resolved options
   * @throws IOException if the file or a referenced band map cannot be read
   */
  public static ArchiveOptions fromYaml(Path path, String profile) throws IOException {
    Optional<Map<String, String>> settings = YamlConfigLoader.load(path, profile);
    return settings.isPresent() ? fromMap(settings.get()) : defaults();
  }

  /**
   * Returns a copy with a different extraction directory.
   *
   * @param dir extraction directory; {@code null} restores the sibling-directory default
   * @return updated options
   */
  public ArchiveOptions withExtractTo(Path dir) {
    return new ArchiveOptions(dir, alias, metadataTemplate, bandMap);
  }

  /**
   * Returns a copy with a different alias label.
   *
   * @param label alias; {@code null} clears it
   * @return updated options
   */
  public ArchiveOptions withAlias(String label) {
    return new ArchiveOptions(extractTo, label, metadataTemplate, bandMap);
  }

  /**
   * Returns a copy with a different metadata template, compiled case-insensitively.
   *
   * @param regex template matched against whole base names
   * @return updated options
   * @throws IllegalArgumentException if the expression is blank or invalid
   */
  public ArchiveOptions withMetadataTemplate(String regex) {
    return new ArchiveOptions(extractTo, alias, Strings.compileTemplate(METADATA_TEMPLATE, regex), bandMap);
  }

  /**
   * Returns a copy with a different band table.
   *
   * @param table band table
   * @return updated options
   */
  public ArchiveOptions withBandMap(BandMapTable table) {
    return new ArchiveOptions(extractTo, alias, metadataTemplate, table);
  }
}
