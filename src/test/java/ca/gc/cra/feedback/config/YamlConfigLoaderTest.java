package ca.gc.cra.feedback.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void modeSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("feedback.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          kafkaBootstrap: common:9092
        consume:
          kafkaBootstrap: broker-1:9092
          workers: 4
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "consume").orElseThrow();

    assertEquals("none", map.get("metricsExporter"));
    assertEquals("broker-1:9092", map.get("kafkaBootstrap"));
    assertEquals("4", map.get("workers"));
  }

  @Test
  void listsJoinWithCommasAndNestedMapsFlatten() throws IOException {
    Path yaml = tempDir.resolve("lists.yaml");
    Files.writeString(yaml, """
        consume:
          kafkaBootstrap:
            - broker-1:9092
            - broker-2:9092
          model:
            endpoint: https://model.internal/v1
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "CONSUME").orElseThrow();

    assertEquals("broker-1:9092,broker-2:9092", map.get("kafkaBootstrap"));
    assertEquals("https://model.internal/v1", map.get("model.endpoint"));
  }

  @Test
  void missingFileReturnsEmpty() throws IOException {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "consume").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");
    assertTrue(YamlConfigLoader.load(yaml, "consume").orElseThrow().isEmpty());
  }

  @Test
  void scalarModeSectionIsRejected() throws IOException {
    Path yaml = tempDir.resolve("bad.yaml");
    Files.writeString(yaml, "consume: 42\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "consume"));
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "consume: [unclosed\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "consume"));
  }
}
