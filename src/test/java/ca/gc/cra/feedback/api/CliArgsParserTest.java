package ca.gc.cra.feedback.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"kafkaTopic=feedback", "workers=4"});
    assertEquals(List.of("kafkaTopic", "workers"), List.copyOf(map.keySet()));
    assertEquals("feedback", map.get("kafkaTopic"));
    assertEquals("4", map.get("workers"));
  }

  @Test
  void splitsOnFirstEqualsAndLaterDuplicatesWin() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "otelResourceAttributes=service.name=feedback", "workers=2", "workers=8"});
    assertEquals("service.name=feedback", map.get("otelResourceAttributes"));
    assertEquals("8", map.get("workers"));
  }

  @Test
  void allowsEmptyValuesAndSkipsBlankArgs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"enrichedTopic=", " ", null});
    assertEquals(Map.of("enrichedTopic", ""), map);
  }

  @Test
  void rejectsMalformedArgs() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key=a\u0007b"}));
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
