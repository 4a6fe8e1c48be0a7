package ca.gc.cra.landsat.application.metadata;

import ca.gc.cra.landsat.domain.error.GroupException;
import ca.gc.cra.landsat.domain.metadata.MetadataRecord;
import ca.gc.cra.landsat.domain.metadata.MetadataValue;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Parsed MTL metadata indexed by group name.
 * <p><strong>Why:</strong> Gives band dispatch and callers case-insensitive group/key lookups over a single file.</p>
 * <p><strong>Role:</strong> Application-level owner of the scanner, lexer, and parser pipeline for one path.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run scan, lex, and parse on {@link #parse()}, replacing any previous contents.</li>
 *   <li>Answer lookups without throwing for missing groups or keys.</li>
 *   <li>Fail iteration over a missing group with {@link GroupException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confine {@link #parse()} to the owning caller.</p>
 * <p><strong>Performance:</strong> Eager parse proportional to line count; lookups are O(1).</p>
 * <p><strong>Observability:</strong> Logs parse outcomes at DEBUG and duplicate groups at WARN.</p>
 *
 * @since 0.1.0
 */
public final class MetadataStore {
  private static final Logger log = LoggerFactory.getLogger(MetadataStore.class);

  private final Path path;
  private Map<String, MetadataRecord> records = Map.of();
  private boolean parsed;

  /**
   * Creates an unparsed store for an MTL file.
   *
   * @param path metadata file location; read on {@link #parse()}
   */
  public MetadataStore(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  /**
   * Reads and parses the configured file, replacing all records.
   *
   * @throws IOException when the file cannot be opened or read
   * @throws ca.gc.cra.landsat.domain.error.ParsingException when the document is malformed or empty
   */
  public void parse() throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      replace(read(reader));
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    }
    log.debug("Parsed {} metadata groups from {}", records.size(), path);
  }

  /**
   * Runs scanner, lexer, and parser over an arbitrary reader.
   *
   * @param reader MTL document; not closed by this method
   * @return records in close order
   * @throws ca.gc.cra.landsat.domain.error.ParsingException when the document is malformed or empty
   */
  public static List<MetadataRecord> read(Reader reader) {
    Objects.requireNonNull(reader, "reader");
    BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
    Iterator<String> lines = buffered.lines().iterator();
    return MtlParser.parse(new MtlLexer(new MtlScanner(lines)));
  }

  private void replace(List<MetadataRecord> parsedRecords) {
    Map<String, MetadataRecord> fresh = new LinkedHashMap<>();
    for (MetadataRecord record : parsedRecords) {
      String name = normalize(record.group());
      if (fresh.containsKey(name)) {
        log.warn("Duplicate metadata group {} in {}; keeping the later occurrence", record.group(), path);
        fresh.remove(name);
      }
      fresh.put(name, record);
    }
    records = Collections.unmodifiableMap(fresh);
    parsed = true;
  }

  /**
   * Looks up a whole group ignoring case.
   *
   * @param group group name such as {@code product_metadata}
   * @return record, or empty when absent
   */
  public Optional<MetadataRecord> get(String group) {
    if (group == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(records.get(normalize(group)));
  }

  /**
   * Looks up a single attribute; group and key are matched ignoring case.
   *
   * @param group group name
   * @param key attribute name
   * @return typed value, or empty when the group or key is absent
   */
  public Optional<MetadataValue> get(String group, String key) {
    return get(group).flatMap(record -> record.get(key));
  }

  /**
   * Looks up a whole group, falling back to a default.
   *
   * @param group group name
   * @param defaultValue returned when the group is absent; may be {@code null}
   * @return record or {@code defaultValue}
   */
  public MetadataRecord getOrDefault(String group, MetadataRecord defaultValue) {
    return get(group).orElse(defaultValue);
  }

  /**
   * Looks up a single attribute, falling back to a default.
   *
   * @param group group name
   * @param key attribute name
   * @param defaultValue returned when the group or key is absent; may be {@code null}
   * @return typed value or {@code defaultValue}
   */
  public MetadataValue getOrDefault(String group, String key, MetadataValue defaultValue) {
    return get(group, key).orElse(defaultValue);
  }

  /**
   * Returns a restartable view over the attributes of a group, excluding its {@code GROUP} key.
   *
   * @param group group name, matched ignoring case
   * @return iterable yielding attributes in file order on every iteration
   * @throws GroupException when the group does not exist
   */
  public Iterable<Map.Entry<String, MetadataValue>> iterGroup(String group) {
    MetadataRecord record = get(group).orElseThrow(() -> new GroupException(group));
    Map<String, MetadataValue> attributes = record.attributes();
    return () -> attributes.entrySet().iterator();
  }

  /**
   * Returns the stored group names in file order.
   *
   * @return upper-cased group names
   */
  public Set<String> groupNames() {
    return records.keySet();
  }

  /**
   * Returns an ordered snapshot of every record keyed by group name.
   *
   * @return unmodifiable map of group name to record
   */
  public Map<String, MetadataRecord> asMap() {
    return records;
  }

  /**
   * Reports whether {@link #parse()} has completed at least once.
   *
   * @return {@code true} after a successful parse
   */
  public boolean isParsed() {
    return parsed;
  }

  /**
   * Returns the metadata file this store reads.
   *
   * @return configured path
   */
  public Path path() {
    return path;
  }

  private static String normalize(String group) {
    return group.toUpperCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return "MetadataStore(" + path + ", groups=" + records.keySet() + ")";
  }
}
