package ca.gc.cra.landsat.application.metadata;

import ca.gc.cra.landsat.domain.error.ParsingException;
import ca.gc.cra.landsat.domain.metadata.MetadataRecord;
import ca.gc.cra.landsat.domain.metadata.MetadataValue;
import ca.gc.cra.landsat.domain.metadata.RawGroup;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts {@link RawGroup}s into typed {@link MetadataRecord}s.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Split each line on the last {@code " = "} and cast the value with {@link ValueCaster}.</li>
 *   <li>Skip lines that are not {@code key = value}; they never fail the parse.</li>
 *   <li>Drop groups holding only their {@code GROUP} key.</li>
 *   <li>Reject documents that yield no record at all.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class MtlParser {
  private static final Logger log = LoggerFactory.getLogger(MtlParser.class);
  private static final Pattern KEY_VALUE = Pattern.compile("(?<key>.+)\\s=\\s(?<value>.+)");

  private MtlParser() {}

  /**
   * Parses every group produced by the lexer.
   *
   * @param groups lexer output; consumed fully
   * @return records in close order
   * @throws ParsingException when the lexer fails or no record could be built
   */
  public static List<MetadataRecord> parse(Iterator<RawGroup> groups) {
    Objects.requireNonNull(groups, "groups");
    List<MetadataRecord> records = new ArrayList<>();
    while (groups.hasNext()) {
      RawGroup group = groups.next();
      Map<String, MetadataValue> fields = parseGroup(group);
      if (fields.size() > 1 && fields.containsKey(MetadataRecord.GROUP_KEY)) {
        records.add(MetadataRecord.of(fields));
      } else {
        log.debug("Dropping group {} without attributes", group.tag());
      }
    }
    if (records.isEmpty()) {
      throw new ParsingException("No metadata found: document contains no group with attributes");
    }
    return List.copyOf(records);
  }

  private static Map<String, MetadataValue> parseGroup(RawGroup group) {
    Map<String, MetadataValue> fields = new LinkedHashMap<>();
    for (String line : group.lines()) {
      Matcher matcher = KEY_VALUE.matcher(line);
      if (!matcher.matches()) {
        continue;
      }
      String key = matcher.group("key").strip();
      fields.put(key, ValueCaster.castToBest(matcher.group("value")));
    }
    return fields;
  }
}
