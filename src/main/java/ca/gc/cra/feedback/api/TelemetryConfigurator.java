package ca.gc.cra.feedback.api;

import ca.gc.cra.feedback.validation.Net;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves metrics settings out of the effective configuration into the system properties read by
 * the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Consumes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}.
   * Blank values leave the corresponding property untouched.
   *
   * @param args mutable configuration map
   * @throws IllegalArgumentException when a value is malformed
   */
  static void configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return;
    }
    String exporter = trim(args.remove("metricsExporter"));
    if (!exporter.isEmpty()) {
      String normalized = exporter.toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
      System.setProperty("otel.metrics.exporter", normalized);
    }

    String endpoint = trim(args.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      Net.validateHttpUrl("otelEndpoint", endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }

    String resourceAttributes = trim(args.remove("otelResourceAttributes"));
    if (!resourceAttributes.isEmpty()) {
      requirePrintableAscii(resourceAttributes);
      log.debug("Configuring OTEL_RESOURCE_ATTRIBUTES override");
      System.setProperty("otel.resource.attributes", resourceAttributes);
    }
  }

  private static void requirePrintableAscii(String value) {
    if (value.length() > MAX_RESOURCE_ATTRIBUTES_LENGTH) {
      throw new IllegalArgumentException(
          "otelResourceAttributes must be <= " + MAX_RESOURCE_ATTRIBUTES_LENGTH + " characters");
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c < 0x20 || c > 0x7e) {
        throw new IllegalArgumentException("otelResourceAttributes must be printable ASCII");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
