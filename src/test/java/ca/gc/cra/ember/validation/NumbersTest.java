package ca.gc.cra.ember.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parseIntFallsBackOnBlank() {
    assertEquals(9000, Numbers.parseInt("port", null, 9000, 1, 65_535));
    assertEquals(9000, Numbers.parseInt("port", "  ", 9000, 1, 65_535));
    assertEquals(9100, Numbers.parseInt("port", " 9100 ", 9000, 1, 65_535));
  }

  @Test
  void parseIntReportsKeyName() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInt("fusion.workers", "many", 2, 1, 64));
    assertTrue(ex.getMessage().startsWith("fusion.workers"), ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("fusion.workers", "65", 2, 1, 64));
  }

  @Test
  void doubleRangeRejectsNonFinite() {
    assertEquals(0.5, Numbers.requireRange("vision", 0.5, 0d, 1d), 0d);
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("vision", Double.NaN, 0d, 1d));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("vision", Double.POSITIVE_INFINITY, 0d, 1d));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseDouble("scale", "1e9", 0.01, 1e-6, 1_000));
  }
}
