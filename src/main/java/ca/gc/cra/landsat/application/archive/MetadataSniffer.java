package ca.gc.cra.landsat.application.archive;

import ca.gc.cra.landsat.domain.error.MetadataFileException;
import ca.gc.cra.landsat.validation.Paths;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Finds the MTL file among directory listings or archive entry names.
 *
 * <p>Only the base name of each candidate is matched, as a whole, against the template. The first match in the
 * supplied order wins.</p>
 *
 * @since 0.1.0
 */
public final class MetadataSniffer {
  private MetadataSniffer() {}

  /**
   * Returns the base name of the first candidate matching the template.
   *
   * @param names file or entry names; directory components are ignored
   * @param template pattern matched against the whole base name
   * @return matching base name, e.g. {@code LC08_L1TP_044034_MTL.txt}
   * @throws MetadataFileException when no candidate matches
   */
  public static String sniff(Iterable<String> names, Pattern template) {
    return Paths.baseName(sniffEntry(names, template));
  }

  /**
   * Returns the first candidate whose base name matches the template, keeping its directory components.
   *
   * @param names file or entry names
   * @param template pattern matched against the whole base name
   * @return matching name exactly as supplied
   * @throws MetadataFileException when no candidate matches
   */
  public static String sniffEntry(Iterable<String> names, Pattern template) {
    Objects.requireNonNull(names, "names");
    Objects.requireNonNull(template, "template");
    for (String name : names) {
      if (name == null) {
        continue;
      }
      if (template.matcher(Paths.baseName(name)).matches()) {
        return name;
      }
    }
    throw new MetadataFileException("Missing Landsat metadata file matching " + template.pattern() + " in " + names);
  }
}
