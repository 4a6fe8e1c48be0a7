package ca.gc.cra.landsat.domain.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable, ordered set of typed attributes parsed from one MTL group.
 * <p><strong>Why:</strong> Replaces per-group attribute objects with an explicit key/value mapping that supports
 * case-insensitive lookups while keeping keys as written.</p>
 * <p><strong>Role:</strong> Domain aggregate stored by group name in the metadata store.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Preserve attribute order and key spelling from the source file.</li>
 *   <li>Guarantee a {@code GROUP} key and at least one further attribute.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class MetadataRecord {
  /** Key that every record carries and whose value names the record. */
  public static final String GROUP_KEY = "GROUP";

  private final String group;
  private final Map<String, MetadataValue> fields;
  private final Map<String, String> keyIndex;

  private MetadataRecord(String group, Map<String, MetadataValue> fields) {
    this.group = group;
    this.fields = Collections.unmodifiableMap(fields);
    Map<String, String> index = new LinkedHashMap<>();
    for (String key : fields.keySet()) {
      index.putIfAbsent(normalize(key), key);
    }
    this.keyIndex = index;
  }

  /**
   * Builds a record from ordered attributes.
   *
   * @param fields attributes in file order; must contain {@code GROUP} and more than one key
   * @return immutable record named after the {@code GROUP} value
   * @throws IllegalArgumentException when the {@code GROUP} key is missing or no other key is present
   */
  public static MetadataRecord of(Map<String, MetadataValue> fields) {
    Objects.requireNonNull(fields, "fields");
    MetadataValue group = fields.get(GROUP_KEY);
    if (group == null) {
      throw new IllegalArgumentException("record must contain a " + GROUP_KEY + " key");
    }
    if (fields.size() <= 1) {
      throw new IllegalArgumentException("record " + group.asText() + " has no attributes");
    }
    return new MetadataRecord(group.asText(), new LinkedHashMap<>(fields));
  }

  /**
   * Returns the group name, i.e. the value of the {@code GROUP} key.
   *
   * @return group name as written
   */
  public String group() {
    return group;
  }

  /**
   * Looks up an attribute ignoring case.
   *
   * @param key attribute name; {@code null} yields empty
   * @return typed value, or empty when absent
   */
  public Optional<MetadataValue> get(String key) {
    if (key == null) {
      return Optional.empty();
    }
    String actual = keyIndex.get(normalize(key));
    return actual == null ? Optional.empty() : Optional.of(fields.get(actual));
  }

  /**
   * Returns every attribute including {@code GROUP}, in file order.
   *
   * @return unmodifiable view
   */
  public Map<String, MetadataValue> fields() {
    return fields;
  }

  /**
   * Returns the attributes without the {@code GROUP} key, in file order.
   *
   * @return new unmodifiable map
   */
  public Map<String, MetadataValue> attributes() {
    Map<String, MetadataValue> attributes = new LinkedHashMap<>(fields);
    attributes.remove(GROUP_KEY);
    return Collections.unmodifiableMap(attributes);
  }

  /**
   * Returns the number of attributes including {@code GROUP}.
   *
   * @return attribute count, always greater than one
   */
  public int size() {
    return fields.size();
  }

  private static String normalize(String key) {
    return key.toUpperCase(Locale.ROOT);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof MetadataRecord record)) {
      return false;
    }
    return fields.equals(record.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("MetadataRecord[");
    boolean first = true;
    for (Map.Entry<String, MetadataValue> entry : fields.entrySet()) {
      if (!first) {
        sb.append(", ");
      }
      sb.append(entry.getKey()).append('=').append(entry.getValue().asText());
      first = false;
    }
    return sb.append(']').toString();
  }
}
