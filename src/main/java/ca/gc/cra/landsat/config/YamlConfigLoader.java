package ca.gc.cra.landsat.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads archive option settings from a YAML file with a {@code common} section and named profile sections.
 *
 * <p>Both sections are flat mappings of the keys in {@link ArchiveOptions#KEYS}. The profile overrides
 * {@code common}; an explicit {@code null} in the profile clears a common value. Unknown keys are skipped with a
 * warning, nested mappings and lists are rejected.</p>
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);
  static final String COMMON = "common";

  private YamlConfigLoader() {}

  /**
   * Loads the {@code common} section merged with the {@code profile} section.
   *
   * @param path YAML configuration file
   * @param profile section name, matched ignoring case, e.g. {@code nightly}
   * @return settings keyed by {@link ArchiveOptions#KEYS}; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document or a section is not a flat mapping
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(profile, "profile");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("YAML config " + path + " must be a mapping of sections");
    }

    Map<String, String> settings = new LinkedHashMap<>();
    readSection(root, COMMON, path, settings);
    String wanted = profile.trim().toLowerCase(Locale.ROOT);
    if (!wanted.isEmpty() && !wanted.equals(COMMON)) {
      readSection(root, wanted, path, settings);
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static void readSection(Map<?, ?> root, String name, Path path, Map<String, String> settings) {
    Object section = null;
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      if (entry.getKey() instanceof String key && key.trim().toLowerCase(Locale.ROOT).equals(name)) {
        section = entry.getValue();
      }
    }
    if (section == null) {
      return;
    }
    if (!(section instanceof Map<?, ?> values)) {
      throw new IllegalArgumentException("Section " + name + " in " + path + " must be a mapping");
    }
    for (Map.Entry<?, ?> entry : values.entrySet()) {
      String key = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new IllegalArgumentException(
            "Setting " + name + "." + key + " in " + path + " must be a scalar value");
      }
      if (!ArchiveOptions.KEYS.contains(key)) {
        log.warn("Ignoring unknown setting {}.{} in {}", name, key, path);
        continue;
      }
      settings.put(key, value == null ? "" : value.toString());
    }
  }
}
