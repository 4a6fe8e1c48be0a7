package ca.gc.cra.landsat.application.metadata;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.landsat.domain.error.ParsingException;
import ca.gc.cra.landsat.domain.metadata.RawGroup;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.Test;

class MtlLexerTest {

  @Test
  void emitsOneGroupPerMatchedPair() {
    List<RawGroup> groups = lex(
        "GROUP = A",
        "X = 1",
        "END_GROUP = A",
        "GROUP = B",
        "Y = 2",
        "END_GROUP = B",
        "END");

    assertEquals(2, groups.size());
    assertEquals(new RawGroup("A", List.of("GROUP = A", "X = 1")), groups.get(0));
    assertEquals(new RawGroup("B", List.of("GROUP = B", "Y = 2")), groups.get(1));
  }

  @Test
  void nestedGroupsCloseInnerFirst() {
    List<RawGroup> groups = lex(
        "GROUP = OUTER",
        "O = 1",
        "GROUP = INNER",
        "I = 2",
        "END_GROUP = INNER",
        "O2 = 3",
        "END_GROUP = OUTER",
        "END");

    assertEquals(List.of("INNER", "OUTER"), groups.stream().map(RawGroup::tag).toList());
    assertEquals(List.of("GROUP = INNER", "I = 2"), groups.get(0).lines());
    assertEquals(List.of("GROUP = OUTER", "O = 1", "O2 = 3"), groups.get(1).lines());
  }

  @Test
  void divergingTagsFail() {
    ParsingException ex = assertThrows(ParsingException.class,
        () -> lex("GROUP = A", "X = 1", "END_GROUP = B"));

    assertTrue(ex.getMessage().contains("A != B"));
  }

  @Test
  void endTerminatesAndDropsUnclosedGroups() {
    List<RawGroup> groups = lex(
        "GROUP = A",
        "X = 1",
        "END_GROUP = A",
        "GROUP = OPEN",
        "Y = 2",
        "END",
        "GROUP = AFTER",
        "Z = 3",
        "END_GROUP = AFTER");

    assertEquals(List.of("A"), groups.stream().map(RawGroup::tag).toList());
  }

  @Test
  void unclosedGroupAtEndOfInputIsNotEmitted() {
    List<RawGroup> groups = lex("GROUP = A", "X = 1");

    assertTrue(groups.isEmpty());
  }

  @Test
  void attributeOutsideGroupFails() {
    assertThrows(ParsingException.class, () -> lex("X = 1", "GROUP = A", "END_GROUP = A"));
  }

  @Test
  void endGroupWithoutOpenGroupFails() {
    assertThrows(ParsingException.class, () -> lex("END_GROUP = A"));
  }

  @Test
  void blankLinesOutsideGroupsAreIgnored() {
    List<RawGroup> groups = lex("", "GROUP = A", "X = 1", "END_GROUP = A", "", "END");

    assertEquals(1, groups.size());
  }

  @Test
  void groupsAreProducedLazily() {
    Iterator<String> lines = List.of(
        "GROUP = A", "X = 1", "END_GROUP = A",
        "GROUP = B", "END_GROUP = C").iterator();
    MtlLexer lexer = new MtlLexer(new MtlScanner(lines));

    assertTrue(lexer.hasNext());
    assertEquals("A", lexer.next().tag());
    assertThrows(ParsingException.class, lexer::hasNext);
  }

  @Test
  void hasNextIsIdempotent() {
    MtlLexer lexer = new MtlLexer(List.of("GROUP = A", "END_GROUP = A", "END").iterator());

    assertTrue(lexer.hasNext());
    assertTrue(lexer.hasNext());
    lexer.next();
    assertFalse(lexer.hasNext());
  }

  private static List<RawGroup> lex(String... lines) {
    List<RawGroup> groups = new ArrayList<>();
    new MtlLexer(new MtlScanner(List.of(lines).iterator())).forEachRemaining(groups::add);
    return groups;
  }
}
