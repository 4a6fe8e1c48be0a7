package ca.gc.cra.landsat.application.metadata;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Lazily trims each line of an MTL document.
 *
 * <p>Order is preserved and blank lines are passed through; the lexer decides what to do with them.</p>
 *
 * @since 0.1.0
 */
public final class MtlScanner implements Iterator<String> {
  private final Iterator<String> content;

  /**
   * Creates a scanner over raw lines.
   *
   * @param content raw lines, e.g. {@code BufferedReader.lines().iterator()}
   */
  public MtlScanner(Iterator<String> content) {
    this.content = Objects.requireNonNull(content, "content");
  }

  @Override
  public boolean hasNext() {
    return content.hasNext();
  }

  @Override
  public String next() {
    if (!content.hasNext()) {
      throw new NoSuchElementException();
    }
    String line = content.next();
    return line == null ? "" : line.strip();
  }
}
