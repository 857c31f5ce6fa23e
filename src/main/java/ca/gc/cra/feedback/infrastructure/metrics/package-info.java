/**
 * Metrics adapters implementing {@link ca.gc.cra.feedback.application.port.MetricsPort}.
 * <p>The OpenTelemetry adapter exports counters and histograms over OTLP; the no-op adapter drops
 * everything.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.feedback.infrastructure.metrics;
