package ca.gc.cra.landsat.domain.metadata;

import java.util.List;
import java.util.Objects;

/**
 * Lines belonging to one {@code GROUP}/{@code END_GROUP} span, including the opening {@code GROUP = <tag>} line.
 *
 * <p>Produced by the lexer and consumed by the parser; not retained afterwards.</p>
 *
 * @param tag group tag as written after {@code GROUP =}
 * @param lines trimmed lines in file order; defensively copied
 * @since 0.1.0
 */
public record RawGroup(String tag, List<String> lines) {
  public RawGroup {
    Objects.requireNonNull(tag, "tag");
    lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
  }
}
