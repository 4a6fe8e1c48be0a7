package ca.gc.cra.landsat.validation;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Filesystem path helpers for archive extraction and source classification.
 * <p><strong>Why:</strong> Archive entries are untrusted names; extraction must never write outside the chosen
 * destination directory.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods.</p>
 * <p><strong>Observability:</strong> Emits no logs; callers surface the exceptions.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Resolves an archive entry name below a destination directory.
   *
   * @param destination extraction root; must not be {@code null}
   * @param entryName entry name as stored in the archive
   * @return normalized absolute target path inside {@code destination}
   * @throws IOException if the entry contains null bytes or escapes {@code destination}
   */
  public static Path resolveEntry(Path destination, String entryName) throws IOException {
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(entryName, "entryName");
    if (entryName.indexOf('\0') >= 0) {
      throw new IOException("archive entry name must not contain null bytes");
    }
    Path base = destination.toAbsolutePath().normalize();
    Path target = base.resolve(entryName).normalize();
    ensureWithinBase(target, base, entryName);
    return target;
  }

  /**
   * Returns the text of a file name before its first dot.
   *
   * @param file file whose name is used, e.g. {@code LC08_L1TP.tar.gz}
   * @return stem such as {@code LC08_L1TP}
   */
  public static String stem(Path file) {
    Objects.requireNonNull(file, "file");
    Path fileName = file.getFileName();
    String name = fileName == null ? file.toString() : fileName.toString();
    int dot = name.indexOf('.');
    return dot < 0 ? name : name.substring(0, dot);
  }

  /**
   * Returns the portion of an archive entry or path string after its last separator.
   *
   * @param name entry name using {@code /} or {@code \} separators
   * @return base name; empty for directory entries ending in a separator
   */
  public static String baseName(String name) {
    Objects.requireNonNull(name, "name");
    int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    return slash < 0 ? name : name.substring(slash + 1);
  }

  private static void ensureWithinBase(Path candidate, Path base, String entryName) throws IOException {
    if (!candidate.startsWith(base)) {
      throw new IOException("archive entry " + entryName + " escapes extraction directory " + base);
    }
  }
}
