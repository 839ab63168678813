package ca.gc.cra.kestrel.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"task=42", "rules=a.yaml,b.yaml"});
    assertEquals("42", map.get("task"));
    assertEquals("a.yaml,b.yaml", map.get("rules"));
  }

  @Test
  void laterDuplicatesWin() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"task=1", "task=2"});
    assertEquals("2", map.get("task"));
  }

  @Test
  void rejectsTokensWithoutValue() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"task"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"task="}));
  }

  @Test
  void rejectsControlCharactersAndOddNames() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"rules=a\u0000b"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"ta sk=1"}));
  }

  @Test
  void inputSeparatesFlagsFromOptions() {
    CliInput input = CliInput.parse(new String[] {"analyze", "--verbose", "task=3", "-h"});
    assertTrue(input.help());
    assertTrue(input.verbose());
    assertArrayEquals(new String[] {"analyze", "task=3"}, input.keyValueArgs());
  }
}
