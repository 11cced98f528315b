package ca.gc.cra.warden.infrastructure.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.SettingsPort;
import ca.gc.cra.warden.application.session.AuthenticationClient;
import ca.gc.cra.warden.domain.auth.ConnectionStatus;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class AnonymousAuthenticationStrategyTest {

  @Test
  void reportsAnonymousIdentity() {
    AnonymousAuthenticationStrategy strategy = new AnonymousAuthenticationStrategy();
    assertEquals("anonymous", strategy.authenticationMethod());
    assertEquals("anonymous-client", strategy.clientType());
    assertNull(strategy.username());
    assertNull(strategy.accessToken());
  }

  @Test
  void loginConnectsAndLogoutDisconnects() {
    AuthenticationClient client = new AuthenticationClient(
        new AnonymousAuthenticationStrategy(),
        SettingsPort.EMPTY,
        LoggerFactory.getLogger(AnonymousAuthenticationStrategyTest.class),
        MetricsPort.NO_OP,
        ClockPort.SYSTEM,
        Runnable::run);
    List<ConnectionStatus> seen = new ArrayList<>();
    client.statusFeed().subscribe(seen::add);

    client.beginLogin().join();
    assertTrue(client.isConnected());
    client.logout().join();

    assertEquals(List.of(
        ConnectionStatus.DISCONNECTED,
        ConnectionStatus.CONNECTING,
        ConnectionStatus.CONNECTED,
        ConnectionStatus.DISCONNECTED), seen);
  }

  @Test
  void saveThenLoadYieldsEmptyCredentials() {
    AuthenticationClient client = new AuthenticationClient(
        new AnonymousAuthenticationStrategy(),
        SettingsPort.EMPTY,
        LoggerFactory.getLogger(AnonymousAuthenticationStrategyTest.class),
        MetricsPort.NO_OP,
        ClockPort.SYSTEM,
        Runnable::run);

    assertTrue(client.load(client.save().join()).join().isEmpty());
  }
}
