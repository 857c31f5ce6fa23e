package ca.gc.cra.feedback.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the meter used by {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>Each setting is looked up as a system property ({@code otel.metrics.exporter},
 * {@code otel.exporter.otlp.endpoint}, {@code otel.resource.attributes}), which is what the
 * {@code consume} command sets, and then as the equivalent {@code OTEL_*} environment variable.
 * Any failure while building the SDK degrades to a noop meter.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String SCOPE = "ca.gc.cra.feedback";
  private static final String SERVICE = "feedback-pipeline";
  private static final String FALLBACK_VERSION = "0.0.0-dev";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize() {
    Settings settings = Settings.fromEnvironment();
    if (!settings.exportEnabled()) {
      log.info("Pipeline metrics export disabled (metricsExporter=none)");
      return BootstrapResult.noop();
    }
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      BootstrapResult result = build(reader, settings.extraAttributes());
      log.info("Exporting pipeline metrics over OTLP to {}", settings.endpoint());
      return result;
    } catch (RuntimeException ex) {
      log.error("Unable to start OTLP metrics export to {}; metrics are discarded", settings.endpoint(), ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extraAttributes) {
    String version = serviceVersion();
    Resource service = Resource.create(Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), SERVICE)
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), version)
        .put(AttributeKey.stringKey("service.instance.id"), hostName())
        .build());
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(Resource.getDefault().merge(service).merge(Resource.create(extraAttributes)))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(SCOPE).setInstrumentationVersion(version).build();
    return new BootstrapResult(meter, provider);
  }

  /**
   * Parses {@code key=value[,key=value]} resource attributes. Malformed entries are skipped with a warning.
   */
  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String entry : raw.split(",")) {
      String pair = entry.trim();
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String key = eq > 0 ? pair.substring(0, eq).trim() : "";
      String value = eq > 0 ? pair.substring(eq + 1).trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Skipping malformed resource attribute '{}'", pair);
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? FALLBACK_VERSION : version;
  }

  private static String hostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Host name unavailable for service.instance.id", ex);
      return "unknown";
    }
  }

  private static String lookup(String property, String env) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value == null ? "" : value.trim();
  }

  private record Settings(boolean exportEnabled, String endpoint, Attributes extraAttributes) {
    static Settings fromEnvironment() {
      String exporter = lookup("otel.metrics.exporter", "OTEL_METRICS_EXPORTER").toLowerCase(Locale.ROOT);
      if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
        log.warn("Unknown metrics exporter '{}'; using otlp", exporter);
      }
      String endpoint = lookup("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT");
      return new Settings(
          !exporter.equals("none"),
          endpoint.isEmpty() ? DEFAULT_ENDPOINT : endpoint,
          parseResourceAttributes(lookup("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES")));
    }
  }

  /** Meter plus the SDK provider that owns it; the provider is absent in noop mode. */
  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode pending, String action) {
      pending.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      if (!pending.isSuccess()) {
        log.warn("Meter provider {} did not complete within {} s", action, SHUTDOWN_TIMEOUT_SECONDS);
      }
    }
  }
}
