package ca.gc.cra.feedback.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {
  private static final Map<String, String> REQUIRED = Map.of(
      "kafkaBootstrap", "localhost:9092",
      "jdbcUrl", "jdbc:postgresql://localhost/feedback",
      "modelEndpoint", "http://localhost:8080/generate");

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> yaml = new LinkedHashMap<>(REQUIRED);
    yaml.put("workers", "4");
    yaml.put("batchSize", "20");
    Map<String, String> cli = Map.of("workers", "8");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "consume", Optional.of(yaml), cli, DefaultsForMode.asFlatMap("consume"), warnings::add);

    assertEquals("8", merged.get("workers"));
    assertEquals("20", merged.get("batchSize"));
    assertEquals("customer-feedback", merged.get("kafkaTopic"));
    assertEquals(List.of("CLI overrides YAML for key: workers"), warnings);
  }

  @Test
  void missingRequiredKeyIsReported() {
    Map<String, String> cli = new LinkedHashMap<>(REQUIRED);
    cli.remove("modelEndpoint");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "consume", Optional.empty(), cli, DefaultsForMode.asFlatMap("consume"), msg -> {}));
    assertTrue(ex.getMessage().contains("modelEndpoint"));
  }

  @Test
  void invertedBackoffBoundsAreRejected() {
    Map<String, String> cli = new LinkedHashMap<>(REQUIRED);
    cli.put("backoffMinMs", "10000");
    cli.put("backoffMaxMs", "500");

    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "consume", Optional.empty(), cli, DefaultsForMode.asFlatMap("consume"), msg -> {}));
  }

  @Test
  void kafkaEnrichedStoreNeedsTopic() {
    Map<String, String> cli = new LinkedHashMap<>(REQUIRED);
    cli.put("enrichedStore", "kafka");
    cli.put("enrichedTopic", "");

    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "consume", Optional.empty(), cli, DefaultsForMode.asFlatMap("consume"), msg -> {}));
  }
}
