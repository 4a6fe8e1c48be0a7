package ca.gc.cra.landsat.config;

import ca.gc.cra.landsat.domain.band.BandMapTable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Loads {@link BandMapTable}s from YAML.
 * <p><strong>Why:</strong> Keeps the spacecraft/sensor alias tables as data so new sensors need no code change.</p>
 * <p><strong>Role:</strong> Configuration helper; {@link #defaults()} serves the bundled {@code band-map.yaml}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the lazily initialized default table, which is immutable.</p>
 *
 * <p>Document layout:</p>
 * <pre>{@code
 * version: 1
 * mappings:
 *   LANDSAT_8_OLI_TIRS:
 *     red: "4"
 * }</pre>
 *
 * @since 0.1.0
 */
public final class BandMapLoader {
  /** Classpath location of the bundled table. */
  public static final String DEFAULT_RESOURCE = "/band-map.yaml";

  private BandMapLoader() {}

  /**
   * Returns the bundled band table, loading it on first use.
   *
   * @return process-wide read-only table
   * @throws IllegalStateException if the bundled resource is missing or malformed
   */
  public static BandMapTable defaults() {
    return DefaultsHolder.TABLE;
  }

  /**
   * Loads a band table from a YAML file.
   *
   * @param path YAML document
   * @return parsed table
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the document structure is invalid
   */
  public static BandMapTable load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new IOException("Band map file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return load(reader, path.toString());
    }
  }

  /**
   * Loads a band table from a reader.
   *
   * @param reader YAML document; not closed
   * @param source description used in error messages
   * @return parsed table
   * @throws IllegalArgumentException if the document structure is invalid
   */
  public static BandMapTable load(Reader reader, String source) {
    Objects.requireNonNull(reader, "reader");
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse band map YAML at " + source, ex);
    }
    if (document == null) {
      throw new IllegalArgumentException("Band map " + source + " is empty");
    }
    Map<String, Object> root = asMap(document, "root");
    Object version = root.get("version");
    if (version != null && !"1".equals(version.toString())) {
      throw new IllegalArgumentException("Unsupported band map version " + version + " in " + source);
    }
    Map<String, Object> mappings = asMap(root.get("mappings"), "mappings");

    Map<String, Map<String, String>> entries = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : mappings.entrySet()) {
      Map<String, String> aliases = new LinkedHashMap<>();
      for (Map.Entry<String, Object> alias : asMap(entry.getValue(), entry.getKey()).entrySet()) {
        Object code = alias.getValue();
        if (code == null || code.toString().isBlank()) {
          throw new IllegalArgumentException(
              "Alias " + alias.getKey() + " of " + entry.getKey() + " has no band code");
        }
        aliases.put(alias.getKey(), code.toString().trim());
      }
      entries.put(entry.getKey(), aliases);
    }
    return BandMapTable.of(entries);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (node == null) {
      throw new IllegalArgumentException(context + " section is missing");
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static final class DefaultsHolder {
    private static final BandMapTable TABLE = loadDefaults();

    private static BandMapTable loadDefaults() {
      try (InputStream in = BandMapLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
        if (in == null) {
          throw new IllegalStateException("Bundled band map " + DEFAULT_RESOURCE + " not found on classpath");
        }
        return load(new InputStreamReader(in, StandardCharsets.UTF_8), DEFAULT_RESOURCE);
      } catch (IOException ex) {
        throw new UncheckedIOException("Failed to read bundled band map " + DEFAULT_RESOURCE, ex);
      }
    }
  }
}
