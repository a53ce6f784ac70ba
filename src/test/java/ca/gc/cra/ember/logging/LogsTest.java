package ca.gc.cra.ember.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("#locid:RoomA!", Logs.truncate("#locid:RoomA!", 96));
    assertEquals("<null>", Logs.excerpt(null, 8));
  }

  @Test
  void longPacketsAreTruncatedWithLength() {
    String excerpt = Logs.excerpt("#frame:".concat("0".repeat(200)).getBytes(StandardCharsets.US_ASCII), 16);

    assertTrue(excerpt.startsWith("#frame:000000000"), excerpt);
    assertTrue(excerpt.endsWith("(truncated, 16 of 207)"), excerpt);
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void levelsCanBeChangedPerLogger() {
    Logger logger = (Logger) LoggerFactory.getLogger("ember.test.levels");

    LoggingConfigurator.setLevel("ember.test.levels", "ERROR");
    assertEquals(Level.ERROR, logger.getLevel());

    LoggingConfigurator.setLevel("ember.test.levels", "chatty");
    assertEquals(Level.INFO, logger.getLevel());
  }
}
