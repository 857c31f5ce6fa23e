package ca.gc.cra.feedback.config;

import ca.gc.cra.feedback.logging.Logs;
import ca.gc.cra.feedback.validation.Net;
import ca.gc.cra.feedback.validation.Numbers;
import ca.gc.cra.feedback.validation.Strings;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable settings for the consume pipeline.
 * <p><strong>Role:</strong> Configuration aggregate handed to {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse flattened key/value maps produced by {@link ConfigMerger}.</li>
 *   <li>Apply defaults and range-check numeric knobs.</li>
 *   <li>Validate broker lists, topic names and endpoint URLs.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent reads.</p>
 *
 * @param kafkaBootstrap validated {@code HOST:PORT[,HOST:PORT]} list
 * @param kafkaTopic inbound feedback topic
 * @param kafkaGroup consumer group id
 * @param pollTimeout broker poll timeout
 * @param batchSize maximum handles per pull
 * @param workers worker pool size
 * @param idleDelay pause after an empty pull
 * @param backoffMin first pull-failure delay
 * @param backoffMax pull-failure delay cap
 * @param backoffJitter downward jitter fraction in {@code [0,1]}
 * @param jdbcUrl JDBC URL of the raw store database
 * @param jdbcUser database user; may be empty
 * @param jdbcPassword database password; may be empty
 * @param rawTable raw feedback table
 * @param enrichedStore analytical store destination
 * @param enrichedTable analytical table when {@link EnrichedStoreMode#JDBC}
 * @param enrichedTopic analytical topic when {@link EnrichedStoreMode#KAFKA}
 * @param modelEndpoint text generation endpoint URL
 * @param modelApiToken optional bearer token; may be empty
 * @param modelTimeout upper bound on one model call
 * @since 0.1.0
 */
public record PipelineConfig(
    String kafkaBootstrap,
    String kafkaTopic,
    String kafkaGroup,
    Duration pollTimeout,
    int batchSize,
    int workers,
    Duration idleDelay,
    Duration backoffMin,
    Duration backoffMax,
    double backoffJitter,
    String jdbcUrl,
    String jdbcUser,
    String jdbcPassword,
    String rawTable,
    EnrichedStoreMode enrichedStore,
    String enrichedTable,
    String enrichedTopic,
    String modelEndpoint,
    String modelApiToken,
    Duration modelTimeout) {

  static final String DEFAULT_TOPIC = "customer-feedback";
  static final String DEFAULT_GROUP = "customer-feedback-sub";
  static final int DEFAULT_POLL_TIMEOUT_MS = 1_000;
  static final int DEFAULT_BATCH_SIZE = 10;
  static final int DEFAULT_WORKERS = 10;
  static final int DEFAULT_IDLE_DELAY_MS = 1_000;
  static final int DEFAULT_BACKOFF_MIN_MS = 5_000;
  static final int DEFAULT_BACKOFF_MAX_MS = 60_000;
  static final double DEFAULT_BACKOFF_JITTER = 0.1d;
  static final String DEFAULT_RAW_TABLE = "raw_feedback";
  static final String DEFAULT_ENRICHED_TABLE = "feedback_analysis";
  static final String DEFAULT_ENRICHED_TOPIC = "feedback-analysis";
  static final int DEFAULT_MODEL_TIMEOUT_MS = 30_000;

  private static final int MAX_BATCH_SIZE = 500;
  private static final int MAX_WORKERS = 256;
  private static final int MAX_POLL_TIMEOUT_MS = 60_000;
  private static final int MAX_DELAY_MS = 3_600_000;
  private static final int MAX_MODEL_TIMEOUT_MS = 600_000;

  public PipelineConfig {
    Objects.requireNonNull(kafkaBootstrap, "kafkaBootstrap");
    Objects.requireNonNull(kafkaTopic, "kafkaTopic");
    Objects.requireNonNull(kafkaGroup, "kafkaGroup");
    Objects.requireNonNull(pollTimeout, "pollTimeout");
    Objects.requireNonNull(idleDelay, "idleDelay");
    Objects.requireNonNull(backoffMin, "backoffMin");
    Objects.requireNonNull(backoffMax, "backoffMax");
    Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    Objects.requireNonNull(rawTable, "rawTable");
    Objects.requireNonNull(enrichedStore, "enrichedStore");
    Objects.requireNonNull(modelEndpoint, "modelEndpoint");
    Objects.requireNonNull(modelTimeout, "modelTimeout");
    jdbcUser = jdbcUser == null ? "" : jdbcUser;
    jdbcPassword = jdbcPassword == null ? "" : jdbcPassword;
    modelApiToken = modelApiToken == null ? "" : modelApiToken;
    enrichedTable = enrichedTable == null ? DEFAULT_ENRICHED_TABLE : enrichedTable;
    enrichedTopic = enrichedTopic == null ? DEFAULT_ENRICHED_TOPIC : enrichedTopic;
    if (backoffMax.compareTo(backoffMin) < 0) {
      throw new IllegalArgumentException("backoffMaxMs must be >= backoffMinMs");
    }
  }

  /**
   * Builds a configuration from flattened key/value pairs.
   *
   * @param args merged configuration map
   * @return validated configuration
   * @throws IllegalArgumentException when a required key is missing or a value is invalid
   */
  public static PipelineConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : new HashMap<>(args);

    String bootstrap = Net.validateHostPortList(required(kv, "kafkaBootstrap"));
    String topic = Strings.sanitizeTopic("kafkaTopic", valueOr(kv, "kafkaTopic", DEFAULT_TOPIC));
    String group = Strings.sanitizeTopic("kafkaGroup", valueOr(kv, "kafkaGroup", DEFAULT_GROUP));
    int pollTimeoutMs = parseBoundedInt(kv, "pollTimeoutMs", DEFAULT_POLL_TIMEOUT_MS, 1, MAX_POLL_TIMEOUT_MS);
    int batchSize = parseBoundedInt(kv, "batchSize", DEFAULT_BATCH_SIZE, 1, MAX_BATCH_SIZE);
    int workers = parseBoundedInt(kv, "workers", DEFAULT_WORKERS, 1, MAX_WORKERS);
    int idleDelayMs = parseBoundedInt(kv, "idleDelayMs", DEFAULT_IDLE_DELAY_MS, 0, MAX_DELAY_MS);
    int backoffMinMs = parseBoundedInt(kv, "backoffMinMs", DEFAULT_BACKOFF_MIN_MS, 0, MAX_DELAY_MS);
    int backoffMaxMs = parseBoundedInt(kv, "backoffMaxMs", DEFAULT_BACKOFF_MAX_MS, 0, MAX_DELAY_MS);
    double jitter = parseBoundedDouble(kv, "backoffJitter", DEFAULT_BACKOFF_JITTER, 0d, 1d);

    String jdbcUrl = required(kv, "jdbcUrl");
    if (!jdbcUrl.startsWith("jdbc:")) {
      throw new IllegalArgumentException("jdbcUrl must start with jdbc: (was " + jdbcUrl + ")");
    }
    String rawTable = Strings.requireTableName("rawTable", valueOr(kv, "rawTable", DEFAULT_RAW_TABLE));
    EnrichedStoreMode mode = EnrichedStoreMode.fromString(kv.get("enrichedStore"));
    String enrichedTable =
        Strings.requireTableName("enrichedTable", valueOr(kv, "enrichedTable", DEFAULT_ENRICHED_TABLE));
    String enrichedTopic = Strings.sanitizeTopic(
        "enrichedTopic", valueOr(kv, "enrichedTopic", DEFAULT_ENRICHED_TOPIC));

    String endpoint = Net.validateHttpUrl("modelEndpoint", required(kv, "modelEndpoint"));
    int modelTimeoutMs = parseBoundedInt(kv, "modelTimeoutMs", DEFAULT_MODEL_TIMEOUT_MS, 1, MAX_MODEL_TIMEOUT_MS);

    return new PipelineConfig(
        bootstrap,
        topic,
        group,
        Duration.ofMillis(pollTimeoutMs),
        batchSize,
        workers,
        Duration.ofMillis(idleDelayMs),
        Duration.ofMillis(backoffMinMs),
        Duration.ofMillis(backoffMaxMs),
        jitter,
        jdbcUrl,
        Strings.trimToEmpty(kv.get("jdbcUser")),
        kv.getOrDefault("jdbcPassword", ""),
        rawTable,
        mode,
        enrichedTable,
        enrichedTopic,
        endpoint,
        Strings.trimToEmpty(kv.get("modelApiToken")),
        Duration.ofMillis(modelTimeoutMs));
  }

  @Override
  public String toString() {
    return "PipelineConfig[kafkaBootstrap=" + kafkaBootstrap
        + ", kafkaTopic=" + kafkaTopic
        + ", kafkaGroup=" + kafkaGroup
        + ", batchSize=" + batchSize
        + ", workers=" + workers
        + ", jdbcUrl=" + jdbcUrl
        + ", enrichedStore=" + enrichedStore
        + ", modelEndpoint=" + modelEndpoint
        + ", jdbcPassword=" + Logs.redact(jdbcPassword)
        + ", modelApiToken=" + Logs.redact(modelApiToken)
        + "]";
  }

  private static String required(Map<String, String> kv, String key) {
    String value = kv.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value.trim();
  }

  private static String valueOr(Map<String, String> kv, String key, String fallback) {
    String value = kv.get(key);
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  private static int parseBoundedInt(Map<String, String> kv, String key, int defaultValue, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      Numbers.requireRange(key, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  private static double parseBoundedDouble(
      Map<String, String> kv, String key, double defaultValue, double min, double max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Numbers.requireRange(key, Double.parseDouble(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number between " + min + " and " + max, ex);
    }
  }
}
