package ca.gc.cra.feedback.api;

import ca.gc.cra.feedback.application.pipeline.RunSummary;
import ca.gc.cra.feedback.application.pipeline.ShutdownSignal;
import ca.gc.cra.feedback.config.CompositionRoot;
import ca.gc.cra.feedback.config.ConfigMerger;
import ca.gc.cra.feedback.config.DefaultsForMode;
import ca.gc.cra.feedback.config.PipelineConfig;
import ca.gc.cra.feedback.config.YamlConfigLoader;
import ca.gc.cra.feedback.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.feedback.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the feedback consume pipeline until the process is asked to stop.
 *
 * @since 0.1.0
 */
public final class ConsumeCli {
  private static final Logger log = LoggerFactory.getLogger(ConsumeCli.class);
  private static final String MODE = "consume";
  private static final long SHUTDOWN_WAIT_SECONDS = 60;
  private static final String SUMMARY_USAGE =
      "usage: consume kafkaBootstrap=HOST:PORT jdbcUrl=jdbc:postgresql://... modelEndpoint=URL "
          + "[config=PATH] [kafkaTopic=T] [kafkaGroup=G] [batchSize=1-500] [workers=1-256] "
          + "[enrichedStore=JDBC|KAFKA] [--dry-run] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      Feedback consume pipeline

      Usage:
        consume [config=PATH] key=value... [--dry-run]

      Required (CLI or YAML):
        kafkaBootstrap=HOST:PORT[,HOST:PORT]  Kafka brokers holding feedback events
        jdbcUrl=jdbc:postgresql://...         Raw store (and JDBC enriched store) database
        modelEndpoint=URL                     Generative model endpoint (http or https)

      Optional (validated):
        config=PATH                 YAML file with common and consume sections
        kafkaTopic=NAME             Feedback topic (default customer-feedback)
        kafkaGroup=NAME             Consumer group (default customer-feedback-sub)
        pollTimeoutMs=1-60000       Kafka poll timeout (default 1000)
        batchSize=1-500             Max messages pulled at once (default 10)
        workers=1-256               Concurrent message handlers (default 10)
        idleDelayMs=0-3600000       Pause after an empty pull (default 1000)
        backoffMinMs / backoffMaxMs Pull failure backoff bounds (default 5000 / 60000)
        backoffJitter=0.0-1.0       Random fraction added to each backoff (default 0.1)
        jdbcUser / jdbcPassword     Database credentials
        rawTable=NAME               Raw feedback table (default raw_feedback)
        enrichedStore=JDBC|KAFKA    Enriched sink (default JDBC)
        enrichedTable=NAME          Enriched table when JDBC (default feedback_analysis)
        enrichedTopic=NAME          Enriched topic when KAFKA (default feedback-analysis)
        modelApiToken=TOKEN         Bearer token for the model endpoint
        modelTimeoutMs=1-600000     Model call timeout (default 30000)
        metricsExporter=otlp|none   Metrics exporter (default otlp)
        otelEndpoint=URL            OTLP metrics endpoint
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --dry-run                   Validate configuration and print the plan
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private ConsumeCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the consume command and returns its exit code.
   *
   * @param args arguments after the command name
   * @return exit code signalling success or failure
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for consume CLI");
    }
    boolean dryRun = input.hasFlag("--dry-run");

    Map<String, String> cli;
    try {
      cli = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(cli);
    Optional<Map<String, String>> yaml;
    try {
      yaml = configPath == null ? Optional.empty() : YamlConfigLoader.load(Path.of(configPath), MODE);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}: {}", configPath, ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration file {}: {}", configPath, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    if (configPath != null && yaml.isEmpty()) {
      log.warn("Configuration file {} not found; using CLI arguments and defaults", configPath);
    }

    PipelineConfig config;
    try {
      Map<String, String> effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          MODE, yaml, cli, DefaultsForMode.asFlatMap(MODE), log::warn));
      TelemetryConfigurator.configureMetrics(effective);
      config = PipelineConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid consume configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    if (dryRun) {
      printDryRunPlan(config, configPath);
      return ExitCode.SUCCESS;
    }
    return runPipeline(config);
  }

  private static ExitCode runPipeline(PipelineConfig config) {
    log.info("Starting consume pipeline with {}", config);
    OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
    CompositionRoot root;
    try {
      root = CompositionRoot.create(config, metrics);
      root.verifyConnectivity();
    } catch (IllegalStateException ex) {
      log.error("Unable to construct pipeline clients", ex);
      metrics.close();
      return ExitCode.RUNTIME_FAILURE;
    } catch (SQLException ex) {
      log.error("Raw store is unreachable at {}", config.jdbcUrl(), ex);
      metrics.close();
      return ExitCode.RUNTIME_FAILURE;
    }

    ShutdownSignal signal = new ShutdownSignal();
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      if (signal.request()) {
        log.info("Shutdown requested; draining in-flight messages");
      }
      try {
        if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
          log.warn("Pipeline did not stop within {} seconds", SHUTDOWN_WAIT_SECONDS);
        }
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      }
    }, "feedback-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);

    try {
      RunSummary summary = root.coordinator(signal).run();
      log.info("Consume pipeline finished: {}", summary);
      return Thread.currentThread().isInterrupted() ? ExitCode.INTERRUPTED : ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in consume pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      root.close();
      metrics.close();
      finished.countDown();
      removeHook(hook);
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException shuttingDown) {
      log.debug("JVM shutdown in progress; hook stays registered");
    }
  }

  private static void printDryRunPlan(PipelineConfig config, String configPath) {
    Map<String, String> plan = new LinkedHashMap<>();
    plan.put("Config file", configPath == null ? "<none>" : configPath);
    plan.put("Kafka bootstrap", config.kafkaBootstrap());
    plan.put("Kafka topic", config.kafkaTopic());
    plan.put("Consumer group", config.kafkaGroup());
    plan.put("Batch size", Integer.toString(config.batchSize()));
    plan.put("Workers", Integer.toString(config.workers()));
    plan.put("Idle delay (ms)", Long.toString(config.idleDelay().toMillis()));
    plan.put("Backoff (ms)", config.backoffMin().toMillis() + ".." + config.backoffMax().toMillis()
        + " jitter " + config.backoffJitter());
    plan.put("Raw store", config.jdbcUrl() + " table " + config.rawTable());
    plan.put("Enriched store", config.enrichedStore() + " -> " + enrichedTarget(config));
    plan.put("Model endpoint", config.modelEndpoint());
    plan.put("Model timeout", config.modelTimeout().toMillis() + " ms");
    CliPrinter.printPlan("Consume dry-run: no messages will be pulled.", plan,
        " Re-run without --dry-run to start consuming.");
  }

  private static String enrichedTarget(PipelineConfig config) {
    return switch (config.enrichedStore()) {
      case JDBC -> config.enrichedTable();
      case KAFKA -> config.enrichedTopic();
    };
  }
}
