package ca.gc.cra.feedback.config;

import ca.gc.cra.feedback.adapter.kafka.KafkaEnrichedStore;
import ca.gc.cra.feedback.adapter.kafka.KafkaMessageSource;
import ca.gc.cra.feedback.application.enrichment.ModelBackedEnricher;
import ca.gc.cra.feedback.application.json.FeedbackEventDecoder;
import ca.gc.cra.feedback.application.pipeline.BackoffPolicy;
import ca.gc.cra.feedback.application.pipeline.FeedbackMessageHandler;
import ca.gc.cra.feedback.application.pipeline.FeedbackPipelineCoordinator;
import ca.gc.cra.feedback.application.pipeline.PipelineSettings;
import ca.gc.cra.feedback.application.pipeline.ShutdownSignal;
import ca.gc.cra.feedback.application.pipeline.Sleeper;
import ca.gc.cra.feedback.application.port.ClockPort;
import ca.gc.cra.feedback.application.port.EnrichedStore;
import ca.gc.cra.feedback.application.port.Enricher;
import ca.gc.cra.feedback.application.port.MessageSource;
import ca.gc.cra.feedback.application.port.MetricsPort;
import ca.gc.cra.feedback.application.port.RawStore;
import ca.gc.cra.feedback.application.port.TextGenerationPort;
import ca.gc.cra.feedback.infrastructure.model.OkHttpTextGenerationClient;
import ca.gc.cra.feedback.infrastructure.persistence.jdbc.DataSources;
import ca.gc.cra.feedback.infrastructure.persistence.jdbc.JdbcEnrichedStore;
import ca.gc.cra.feedback.infrastructure.persistence.jdbc.JdbcRawStore;
import ca.gc.cra.feedback.infrastructure.time.SystemClockAdapter;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the consume pipeline to its concrete adapters.
 * <p><strong>Role:</strong> Composition root; the only place that knows every adapter class.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Construct the queue, store and model clients once from {@link PipelineConfig}.</li>
 *   <li>Assemble the handler and coordinator around a caller-supplied {@link ShutdownSignal}.</li>
 *   <li>Close every client in reverse order of construction.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Build and close on one thread; the constructed ports are shared by workers.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final int CONNECTIVITY_TIMEOUT_SECONDS = 5;

  private final PipelineConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final MessageSource source;
  private final RawStore rawStore;
  private final EnrichedStore enrichedStore;
  private final TextGenerationPort model;
  private final DataSource dataSource;

  CompositionRoot(
      PipelineConfig config,
      MetricsPort metrics,
      ClockPort clock,
      MessageSource source,
      RawStore rawStore,
      EnrichedStore enrichedStore,
      TextGenerationPort model,
      DataSource dataSource) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.source = Objects.requireNonNull(source, "source");
    this.rawStore = Objects.requireNonNull(rawStore, "rawStore");
    this.enrichedStore = Objects.requireNonNull(enrichedStore, "enrichedStore");
    this.model = Objects.requireNonNull(model, "model");
    this.dataSource = dataSource;
  }

  /**
   * Builds every production adapter. Partially built clients are closed when a later one fails.
   *
   * @param config validated configuration
   * @param metrics metrics adapter shared by all components
   * @return ready composition root
   * @throws IllegalStateException when a client cannot be constructed
   */
  public static CompositionRoot create(PipelineConfig config, MetricsPort metrics) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(metrics, "metrics");
    List<AutoCloseable> built = new ArrayList<>();
    try {
      HikariDataSource dataSource = track(built, DataSources.postgres(
          config.jdbcUrl(), config.jdbcUser(), config.jdbcPassword(), config.workers()));
      TextGenerationPort model = track(built, new OkHttpTextGenerationClient(
          config.modelEndpoint(), config.modelApiToken(), config.modelTimeout()));
      RawStore rawStore = track(built, new JdbcRawStore(dataSource, config.rawTable()));
      EnrichedStore enrichedStore = track(built, switch (config.enrichedStore()) {
        case JDBC -> new JdbcEnrichedStore(dataSource, config.enrichedTable());
        case KAFKA -> new KafkaEnrichedStore(config.kafkaBootstrap(), config.enrichedTopic());
      });
      MessageSource source = track(built, new KafkaMessageSource(
          config.kafkaBootstrap(), config.kafkaTopic(), config.kafkaGroup(), config.pollTimeout(), metrics));
      return new CompositionRoot(
          config, metrics, new SystemClockAdapter(), source, rawStore, enrichedStore, model, dataSource);
    } catch (RuntimeException ex) {
      for (int i = built.size() - 1; i >= 0; i--) {
        closeQuietly(built.get(i), ex);
      }
      throw new IllegalStateException("Failed to construct pipeline clients: " + ex.getMessage(), ex);
    }
  }

  /**
   * Opens one database connection to fail fast on unreachable or misconfigured stores.
   *
   * @throws SQLException when no valid connection can be obtained
   */
  public void verifyConnectivity() throws SQLException {
    if (dataSource == null) {
      return;
    }
    try (Connection connection = dataSource.getConnection()) {
      if (!connection.isValid(CONNECTIVITY_TIMEOUT_SECONDS)) {
        throw new SQLException("Database connection is not valid: " + config.jdbcUrl());
      }
    }
    log.info("Database connectivity verified for {}", config.jdbcUrl());
  }

  /**
   * Builds the coordinator bound to {@code signal}.
   *
   * @param signal shutdown signal tripped by the CLI shutdown hook
   * @return coordinator ready to {@link FeedbackPipelineCoordinator#run()}
   */
  public FeedbackPipelineCoordinator coordinator(ShutdownSignal signal) {
    Objects.requireNonNull(signal, "signal");
    Enricher enricher = new ModelBackedEnricher(model, metrics);
    FeedbackMessageHandler handler = new FeedbackMessageHandler(
        source, new FeedbackEventDecoder(), rawStore, enricher, enrichedStore, clock, metrics);
    PipelineSettings settings = new PipelineSettings(config.batchSize(), config.workers(), config.idleDelay());
    BackoffPolicy backoff = new BackoffPolicy(config.backoffMin(), config.backoffMax(), config.backoffJitter());
    return new FeedbackPipelineCoordinator(
        source, handler, settings, backoff, Sleeper.wakingOn(signal), signal, metrics);
  }

  public PipelineConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Closes the queue first so outstanding settlements are committed, then the stores, the database
   * pool and the model client.
   */
  @Override
  public void close() {
    closeLogged("message source", source);
    closeLogged("enriched store", enrichedStore);
    closeLogged("raw store", rawStore);
    if (dataSource instanceof AutoCloseable pool) {
      closeLogged("database pool", pool);
    }
    closeLogged("model client", model);
  }

  private static <T extends AutoCloseable> T track(List<AutoCloseable> built, T resource) {
    built.add(resource);
    return resource;
  }

  private static void closeLogged(String name, AutoCloseable resource) {
    try {
      resource.close();
      log.info("Closed {}", name);
    } catch (Exception ex) {
      log.error("Failed to close {}", name, ex);
    }
  }

  private static void closeQuietly(AutoCloseable resource, Exception primary) {
    try {
      resource.close();
    } catch (Exception closeFailure) {
      primary.addSuppressed(closeFailure);
    }
  }
}
