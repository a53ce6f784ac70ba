package ca.gc.cra.ember.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"ingest.port=9000", " mode = OnDemand "});
    assertEquals("9000", map.get("ingest.port"));
    assertEquals("OnDemand", map.get("mode"));
  }

  @Test
  void laterDuplicatesWinAndValuesMayContainEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"a=1", "a=2", "url=http://x/?q=1"});
    assertEquals("2", map.get("a"));
    assertEquals("http://x/?q=1", map.get("url"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
