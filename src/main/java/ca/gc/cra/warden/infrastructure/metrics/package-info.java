/**
 * <strong>Purpose:</strong> Metrics adapters implementing {@link ca.gc.cra.warden.application.port.MetricsPort}.
 * <p><strong>Observability:</strong> Forwards {@code auth.*} counters and histograms to OpenTelemetry, or discards
 * them when metrics are disabled.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure.metrics;
