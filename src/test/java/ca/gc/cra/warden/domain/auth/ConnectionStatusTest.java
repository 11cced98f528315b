package ca.gc.cra.warden.domain.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ConnectionStatusTest {

  @Test
  void connectedOnlyReachableFromConnecting() {
    assertTrue(ConnectionStatus.CONNECTING.canTransitionTo(ConnectionStatus.CONNECTED));
    assertTrue(ConnectionStatus.CONNECTED.canTransitionTo(ConnectionStatus.CONNECTED));
    assertFalse(ConnectionStatus.DISCONNECTED.canTransitionTo(ConnectionStatus.CONNECTED));
    assertFalse(ConnectionStatus.FAILED.canTransitionTo(ConnectionStatus.CONNECTED));
  }

  @Test
  void everyStateMayFailOrDisconnect() {
    for (ConnectionStatus from : ConnectionStatus.values()) {
      assertTrue(from.canTransitionTo(ConnectionStatus.DISCONNECTED), from.name());
      assertTrue(from.canTransitionTo(ConnectionStatus.FAILED), from.name());
      assertTrue(from.canTransitionTo(ConnectionStatus.CONNECTING), from.name());
      assertFalse(from.canTransitionTo(null), from.name());
    }
  }

  @Test
  void metricNameIsLowerCase() {
    assertEquals("connecting", ConnectionStatus.CONNECTING.metricName());
  }
}
