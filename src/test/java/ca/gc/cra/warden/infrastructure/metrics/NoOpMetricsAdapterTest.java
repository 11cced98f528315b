package ca.gc.cra.warden.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

import org.junit.jupiter.api.Test;

class NoOpMetricsAdapterTest {

  @Test
  void acceptsAnyKey() {
    NoOpMetricsAdapter adapter = new NoOpMetricsAdapter();
    assertDoesNotThrow(() -> {
      adapter.increment("auth.login.started");
      adapter.observe("auth.login.latencyMillis", 12);
    });
  }
}
