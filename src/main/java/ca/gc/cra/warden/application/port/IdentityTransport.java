package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.auth.IdentityProfile;
import ca.gc.cra.warden.domain.auth.TokenGrant;
import java.util.concurrent.CompletableFuture;

/**
 * <strong>What:</strong> Outbound port performing the network exchanges behind login and logout.
 * <p><strong>Why:</strong> Keeps strategies independent of HTTP plumbing, request building, and JSON handling.</p>
 * <p><strong>Role:</strong> Implemented by {@code HttpIdentityTransport} and {@code InMemoryIdentityTransport}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent calls from several clients.</p>
 * <p><strong>Performance:</strong> Methods must return without blocking the calling thread; results arrive
 * through the returned futures.</p>
 *
 * <p>Every failure completes the returned future exceptionally with an {@link IdentityTransportException}.</p>
 *
 * @since 0.1.0
 */
public interface IdentityTransport {
  /**
   * Exchanges a username and password for an access token.
   *
   * @param username account name; never {@code null}
   * @param password secret; never {@code null}
   * @return future completing with the issued grant
   */
  CompletableFuture<TokenGrant> requestToken(String username, String password);

  /**
   * Resolves the identity a bearer token belongs to, validating the token in the process.
   *
   * @param accessToken bearer token; never {@code null}
   * @return future completing with the profile, or failing with {@link IdentityTransportException} when the
   *     token is malformed or rejected
   */
  CompletableFuture<IdentityProfile> fetchProfile(String accessToken);

  /**
   * Invalidates a previously issued token.
   *
   * @param accessToken bearer token; never {@code null}
   * @return future completing once the provider acknowledged the revocation
   */
  CompletableFuture<Void> revokeToken(String accessToken);
}
