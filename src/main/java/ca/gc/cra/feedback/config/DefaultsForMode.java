package ca.gc.cra.feedback.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>Required keys ({@code kafkaBootstrap}, {@code jdbcUrl}, {@code modelEndpoint}) default to blank
 * so that {@link ConfigMerger} can report them as missing.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode; only {@code consume} is supported
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for unknown modes
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "consume" -> buildConsumeDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildConsumeDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("kafkaBootstrap", "");
    map.put("kafkaTopic", PipelineConfig.DEFAULT_TOPIC);
    map.put("kafkaGroup", PipelineConfig.DEFAULT_GROUP);
    map.put("pollTimeoutMs", Integer.toString(PipelineConfig.DEFAULT_POLL_TIMEOUT_MS));
    map.put("batchSize", Integer.toString(PipelineConfig.DEFAULT_BATCH_SIZE));
    map.put("workers", Integer.toString(PipelineConfig.DEFAULT_WORKERS));
    map.put("idleDelayMs", Integer.toString(PipelineConfig.DEFAULT_IDLE_DELAY_MS));
    map.put("backoffMinMs", Integer.toString(PipelineConfig.DEFAULT_BACKOFF_MIN_MS));
    map.put("backoffMaxMs", Integer.toString(PipelineConfig.DEFAULT_BACKOFF_MAX_MS));
    map.put("backoffJitter", Double.toString(PipelineConfig.DEFAULT_BACKOFF_JITTER));
    map.put("jdbcUrl", "");
    map.put("jdbcUser", "");
    map.put("jdbcPassword", "");
    map.put("rawTable", PipelineConfig.DEFAULT_RAW_TABLE);
    map.put("enrichedStore", EnrichedStoreMode.JDBC.name());
    map.put("enrichedTable", PipelineConfig.DEFAULT_ENRICHED_TABLE);
    map.put("enrichedTopic", PipelineConfig.DEFAULT_ENRICHED_TOPIC);
    map.put("modelEndpoint", "");
    map.put("modelApiToken", "");
    map.put("modelTimeoutMs", Integer.toString(PipelineConfig.DEFAULT_MODEL_TIMEOUT_MS));
    return map;
  }
}
