package ca.gc.cra.warden.infrastructure.transport;

import ca.gc.cra.warden.application.port.IdentityTransport;
import ca.gc.cra.warden.application.port.IdentityTransportException;
import ca.gc.cra.warden.domain.auth.IdentityProfile;
import ca.gc.cra.warden.domain.auth.TokenGrant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory identity provider used for tests and offline wiring.
 *
 * <p>Passwords are checked against registered users; issued tokens stay valid until revoked. A single failure can
 * be queued with {@link #failNextCall(IdentityTransportException)} to exercise error paths.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryIdentityTransport implements IdentityTransport {
  private final Map<String, String> passwords = new ConcurrentHashMap<>();
  private final Map<String, String> issuedTokens = new ConcurrentHashMap<>();
  private final Set<String> revokedTokens = ConcurrentHashMap.newKeySet();
  private final AtomicReference<IdentityTransportException> pendingFailure = new AtomicReference<>();

  /**
   * Registers (or replaces) a user account.
   *
   * @param username account name
   * @param password account secret
   * @return this transport for chaining
   */
  public InMemoryIdentityTransport registerUser(String username, String password) {
    passwords.put(Objects.requireNonNull(username, "username"), Objects.requireNonNull(password, "password"));
    return this;
  }

  /**
   * Registers a pre-issued token for a user, as if obtained out of band.
   *
   * @param accessToken token value
   * @param username owning account
   * @return this transport for chaining
   */
  public InMemoryIdentityTransport issueToken(String accessToken, String username) {
    issuedTokens.put(Objects.requireNonNull(accessToken, "accessToken"), Objects.requireNonNull(username, "username"));
    revokedTokens.remove(accessToken);
    return this;
  }

  /**
   * Makes the next transport call fail with the supplied exception.
   *
   * @param failure exception delivered through the next returned future
   */
  public void failNextCall(IdentityTransportException failure) {
    pendingFailure.set(Objects.requireNonNull(failure, "failure"));
  }

  @Override
  public CompletableFuture<TokenGrant> requestToken(String username, String password) {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
    IdentityTransportException injected = pendingFailure.getAndSet(null);
    if (injected != null) {
      return CompletableFuture.failedFuture(injected);
    }
    if (!password.equals(passwords.get(username))) {
      return CompletableFuture.failedFuture(new IdentityTransportException("Invalid username or password", 401));
    }
    String token = UUID.randomUUID().toString();
    issuedTokens.put(token, username);
    return CompletableFuture.completedFuture(TokenGrant.bearer(token));
  }

  @Override
  public CompletableFuture<IdentityProfile> fetchProfile(String accessToken) {
    Objects.requireNonNull(accessToken, "accessToken");
    IdentityTransportException injected = pendingFailure.getAndSet(null);
    if (injected != null) {
      return CompletableFuture.failedFuture(injected);
    }
    String username = revokedTokens.contains(accessToken) ? null : issuedTokens.get(accessToken);
    if (username == null) {
      return CompletableFuture.failedFuture(new IdentityTransportException("Unknown or revoked token", 401));
    }
    return CompletableFuture.completedFuture(new IdentityProfile(username));
  }

  @Override
  public CompletableFuture<Void> revokeToken(String accessToken) {
    Objects.requireNonNull(accessToken, "accessToken");
    IdentityTransportException injected = pendingFailure.getAndSet(null);
    if (injected != null) {
      return CompletableFuture.failedFuture(injected);
    }
    revokedTokens.add(accessToken);
    return CompletableFuture.completedFuture(null);
  }

  /**
   * Reports whether a token is currently accepted by {@link #fetchProfile(String)}.
   *
   * @param accessToken token value
   * @return {@code true} when issued and not revoked
   */
  public boolean isActive(String accessToken) {
    return issuedTokens.containsKey(accessToken) && !revokedTokens.contains(accessToken);
  }

  /**
   * Returns a snapshot of revoked tokens.
   *
   * @return immutable set of revoked tokens
   */
  public Set<String> revokedTokens() {
    return Set.copyOf(revokedTokens);
  }
}
