package dev.chatpulse.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"host=chat.example.net", "title=Friday = fun"});
    assertEquals("chat.example.net", map.get("host"));
    assertEquals("Friday = fun", map.get("title"));
  }

  @Test
  void laterDuplicatesWin() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"port=8001", "port=9001"});
    assertEquals("9001", map.get("port"));
  }

  @Test
  void blankValuesPassThrough() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"title="});
    assertEquals("", map.get("title"));
  }

  @Test
  void rejectsArgumentsWithoutSeparator() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
  }

  @Test
  void rejectsUnsafeKeysAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"token=a\u0007b"}));
  }

  @Test
  void nullYieldsEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
