package ca.gc.cra.warden.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.session.AuthenticationClient;
import ca.gc.cra.warden.domain.auth.ConnectionStatus;
import ca.gc.cra.warden.domain.auth.UserCredentials;
import ca.gc.cra.warden.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.warden.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.warden.infrastructure.transport.InMemoryIdentityTransport;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AuthenticationClientFactoryTest {

  @Test
  void anonymousClientConnectsWithoutSettings() {
    try (AuthenticationClient client = AuthenticationClientFactory.anonymous()) {
      assertEquals("anonymous", client.authenticationMethod());
      assertEquals("anonymous-client", client.clientType());

      client.beginLogin().join();

      assertEquals(ConnectionStatus.CONNECTED, client.currentStatus());
    }
  }

  @Test
  void defaultMethodIsAnonymous() {
    try (AuthenticationClient client = new AuthenticationClientFactory(ClientSettings.empty()).create()) {
      assertEquals("anonymous", client.authenticationMethod());
    }
  }

  @Test
  void passwordMethodUsesSuppliedTransport() {
    InMemoryIdentityTransport transport = new InMemoryIdentityTransport().registerUser("alice", "pw");
    AuthenticationClientFactory factory =
        new AuthenticationClientFactory(ClientSettings.of(Map.of("auth.method", "Password")), MetricsPort.NO_OP);

    try (AuthenticationClient client = factory.create(transport, Runnable::run)) {
      client.setCredentials(UserCredentials.password("alice", "pw"));
      client.beginLogin().join();

      assertEquals("password-client", client.clientType());
      assertTrue(client.isConnected());
    }
  }

  @Test
  void tokenMethodUsesSuppliedTransport() {
    InMemoryIdentityTransport transport = new InMemoryIdentityTransport().issueToken("tok", "dave");
    AuthenticationClientFactory factory =
        new AuthenticationClientFactory(ClientSettings.of(Map.of("auth.method", "token")));

    try (AuthenticationClient client = factory.create(transport)) {
      client.setCredentials(UserCredentials.token("tok"));
      client.beginLogin().join();

      assertEquals("token-client", client.clientType());
      assertEquals("dave", client.username());
    }
  }

  @Test
  void httpTransportNeedsBaseUri() {
    AuthenticationClientFactory factory =
        new AuthenticationClientFactory(ClientSettings.of(Map.of("auth.method", "password")));

    assertThrows(IllegalArgumentException.class, factory::create);
  }

  @Test
  void httpTransportBuiltFromIdentitySettings() {
    AuthenticationClientFactory factory = new AuthenticationClientFactory(ClientSettings.of(Map.of(
        "auth.method", "token",
        "identity.baseUri", "https://id.example.test")));

    try (AuthenticationClient client = factory.create()) {
      assertEquals("token", client.authenticationMethod());
    }
  }

  @Test
  void unknownMethodIsRejected() {
    AuthenticationClientFactory factory =
        new AuthenticationClientFactory(ClientSettings.of(Map.of("auth.method", "kerberos")));

    assertThrows(IllegalArgumentException.class, () -> factory.create(new InMemoryIdentityTransport()));
  }

  @Test
  void metricsExporterSelection() {
    assertInstanceOf(NoOpMetricsAdapter.class, AuthenticationClientFactory.metricsFor(ClientSettings.empty()));
    assertInstanceOf(OpenTelemetryMetricsAdapter.class,
        AuthenticationClientFactory.metricsFor(ClientSettings.of(Map.of("metrics.exporter", "otel"))));
    assertThrows(IllegalArgumentException.class,
        () -> AuthenticationClientFactory.metricsFor(ClientSettings.of(Map.of("metrics.exporter", "statsd"))));
  }

  @Test
  void authMethodParsing() {
    assertEquals(AuthMethod.ANONYMOUS, AuthMethod.fromString(null));
    assertEquals(AuthMethod.TOKEN, AuthMethod.fromString(" TOKEN "));
    assertThrows(IllegalArgumentException.class, () -> AuthMethod.fromString("saml"));
  }
}
