package ca.gc.cra.warden.infrastructure.metrics;

import ca.gc.cra.warden.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations.
 * <p>Thread-safe and stateless; selected when {@code metrics.exporter=none}.</p>
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
