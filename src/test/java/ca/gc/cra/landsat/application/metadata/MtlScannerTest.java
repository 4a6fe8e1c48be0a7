package ca.gc.cra.landsat.application.metadata;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class MtlScannerTest {

  @Test
  void trimsLinesAndKeepsBlanksInOrder() {
    MtlScanner scanner = new MtlScanner(List.of("  GROUP = A \t", "", "   ", "\tKEY = 1").iterator());

    List<String> lines = new ArrayList<>();
    scanner.forEachRemaining(lines::add);

    assertEquals(List.of("GROUP = A", "", "", "KEY = 1"), lines);
  }

  @Test
  void exhaustedScannerThrows() {
    MtlScanner scanner = new MtlScanner(List.<String>of().iterator());

    assertFalse(scanner.hasNext());
    assertThrows(NoSuchElementException.class, scanner::next);
  }
}
