package ca.gc.cra.ember.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void identifiersAllowInteriorSpaces() {
    assertEquals("default room", Strings.requireIdentifier("location", " default room "));
    assertEquals("cam-1.north_2", Strings.requireIdentifier("stream", "cam-1.north_2"));
  }

  @Test
  void identifiersRejectPunctuationAndControls() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("location", "Room:A"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("location", "Room\tA"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("location", "x".repeat(129)));
    assertThrows(NullPointerException.class, () -> Strings.requireIdentifier("location", null));
  }

  @Test
  void printableAsciiRejectsNonAscii() {
    assertEquals("Kitchen unit", Strings.requirePrintableAscii("name", "Kitchen unit", 32));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("name", "Cuisine é", 32));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
  }
}
