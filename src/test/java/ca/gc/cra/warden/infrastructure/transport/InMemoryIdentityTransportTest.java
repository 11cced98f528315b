package ca.gc.cra.warden.infrastructure.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.port.IdentityTransportException;
import ca.gc.cra.warden.domain.auth.TokenGrant;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

class InMemoryIdentityTransportTest {

  @Test
  void issuedTokenResolvesUntilRevoked() {
    InMemoryIdentityTransport transport = new InMemoryIdentityTransport().registerUser("alice", "pw");

    TokenGrant grant = transport.requestToken("alice", "pw").join();
    assertEquals("alice", transport.fetchProfile(grant.accessToken()).join().username());

    transport.revokeToken(grant.accessToken()).join();

    assertFalse(transport.isActive(grant.accessToken()));
    assertTrue(transport.revokedTokens().contains(grant.accessToken()));
    assertThrows(CompletionException.class, () -> transport.fetchProfile(grant.accessToken()).join());
  }

  @Test
  void injectedFailureAppliesOnce() {
    InMemoryIdentityTransport transport = new InMemoryIdentityTransport().issueToken("tok", "bob");
    IdentityTransportException failure = new IdentityTransportException("outage");
    transport.failNextCall(failure);

    CompletionException thrown =
        assertThrows(CompletionException.class, () -> transport.fetchProfile("tok").join());

    assertSame(failure, thrown.getCause());
    assertEquals("bob", transport.fetchProfile("tok").join().username());
  }

  @Test
  void unknownUserIsRejected() {
    InMemoryIdentityTransport transport = new InMemoryIdentityTransport();
    assertThrows(CompletionException.class, () -> transport.requestToken("ghost", "pw").join());
  }
}
