package ca.gc.cra.landsat.application.metadata;

import ca.gc.cra.landsat.domain.error.ParsingException;
import ca.gc.cra.landsat.domain.metadata.RawGroup;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Stack-based grouping pass that turns trimmed MTL lines into {@link RawGroup}s.
 * <p><strong>Why:</strong> MTL files nest {@code GROUP = <tag>} / {@code END_GROUP = <tag>} spans; the parser works on
 * one closed span at a time.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Push a group on {@code GROUP}, pop and emit it on the matching {@code END_GROUP}.</li>
 *   <li>Fail on a tag mismatch, on {@code END_GROUP} without an open group, and on attributes outside any group.</li>
 *   <li>Stop at the bare {@code END} line, discarding groups that were never closed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateful; confine an instance to one thread.</p>
 * <p><strong>Performance:</strong> Lazy; holds only the lines of currently open groups.</p>
 *
 * @since 0.1.0
 * @see MtlScanner
 * @see MtlParser
 */
public final class MtlLexer implements Iterator<RawGroup> {
  private static final Pattern START_GROUP = Pattern.compile("GROUP\\s=\\s(?<tag>.+)");
  private static final Pattern END_GROUP = Pattern.compile("END_GROUP\\s=\\s(?<tag>.+)");
  private static final String EOF = "END";

  private final Iterator<String> lines;
  private final Deque<OpenGroup> stack = new ArrayDeque<>();
  private RawGroup pending;
  private boolean finished;
  private long lineNumber;

  /**
   * Creates a lexer over trimmed lines.
   *
   * @param lines trimmed lines, typically an {@link MtlScanner}
   */
  public MtlLexer(Iterator<String> lines) {
    this.lines = Objects.requireNonNull(lines, "lines");
  }

  @Override
  public boolean hasNext() {
    if (pending == null && !finished) {
      pending = advance();
    }
    return pending != null;
  }

  @Override
  public RawGroup next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    RawGroup group = pending;
    pending = null;
    return group;
  }

  private RawGroup advance() {
    while (lines.hasNext()) {
      String line = lines.next();
      lineNumber++;

      Matcher start = START_GROUP.matcher(line);
      if (start.matches()) {
        OpenGroup group = new OpenGroup(start.group("tag").strip());
        group.lines.add(line);
        stack.push(group);
        continue;
      }

      Matcher end = END_GROUP.matcher(line);
      if (end.matches()) {
        String endTag = end.group("tag").strip();
        if (stack.isEmpty()) {
          throw new ParsingException("END_GROUP = " + endTag + " without open group at line " + lineNumber);
        }
        OpenGroup open = stack.pop();
        if (!open.tag.equals(endTag)) {
          throw new ParsingException(
              "Diverging start and end tag: " + open.tag + " != " + endTag + " at line " + lineNumber);
        }
        return new RawGroup(open.tag, open.lines);
      }

      if (EOF.equals(line)) {
        finished = true;
        stack.clear();
        return null;
      }

      if (stack.isEmpty()) {
        if (line.isEmpty()) {
          continue;
        }
        throw new ParsingException("Unexpected line outside of any group at line " + lineNumber + ": " + line);
      }
      stack.peek().lines.add(line);
    }
    finished = true;
    stack.clear();
    return null;
  }

  private static final class OpenGroup {
    private final String tag;
    private final List<String> lines = new ArrayList<>();

    private OpenGroup(String tag) {
      this.tag = tag;
    }
  }
}
