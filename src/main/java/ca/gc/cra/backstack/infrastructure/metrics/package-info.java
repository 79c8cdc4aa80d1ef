/**
 * OpenTelemetry implementation of {@link ca.gc.cra.backstack.application.port.MetricsPort}.
 * <p><strong>Configuration:</strong> {@code OTEL_METRICS_EXPORTER=none} disables export; otherwise metrics are
 * pushed over OTLP gRPC every 30 seconds.</p>
 */
package ca.gc.cra.backstack.infrastructure.metrics;
