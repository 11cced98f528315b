package ca.gc.cra.warden.infrastructure.auth;

import ca.gc.cra.warden.application.port.AuthenticationContext;
import ca.gc.cra.warden.application.port.AuthenticationStrategy;
import ca.gc.cra.warden.application.port.IdentityTransport;
import ca.gc.cra.warden.domain.auth.ConnectionStatus;
import ca.gc.cra.warden.domain.auth.IdentityProfile;
import ca.gc.cra.warden.domain.auth.UserCredentials;
import ca.gc.cra.warden.logging.Logs;
import java.io.InputStream;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Variant signing in with a pre-issued bearer token.
 *
 * <p>Login verifies the token through {@link IdentityTransport#fetchProfile(String)}. A rejected token ends in
 * {@link ConnectionStatus#DISCONNECTED}: the token simply does not sign anyone in. Logout forgets the resolved
 * identity but does not revoke the token, which the host issued and still owns.</p>
 *
 * @since 0.1.0
 */
public final class TokenAuthenticationStrategy implements AuthenticationStrategy {
  /** Authentication method reported by token clients. */
  public static final String METHOD = "token";

  private final IdentityTransport transport;
  private final SessionStateCodec codec;
  private final AtomicReference<String> username = new AtomicReference<>();
  private final AtomicReference<String> accessToken = new AtomicReference<>();

  public TokenAuthenticationStrategy(IdentityTransport transport, SessionStateCodec codec) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public String authenticationMethod() {
    return METHOD;
  }

  @Override
  public String clientType() {
    return "token-client";
  }

  @Override
  public String username() {
    return username.get();
  }

  @Override
  public String accessToken() {
    return accessToken.get();
  }

  @Override
  public void onSetCredentials(AuthenticationContext context, UserCredentials credentials) {
    accessToken.set(credentials.accessToken());
    username.set(credentials.username());
  }

  @Override
  public CompletableFuture<Void> onBeginLogin(AuthenticationContext context) {
    String token = accessToken.get();
    if (token == null) {
      context.transitionTo(ConnectionStatus.DISCONNECTED);
      return CompletableFuture.failedFuture(new IllegalStateException("Token login requires an access token"));
    }
    CompletableFuture<IdentityProfile> profileLookup;
    try {
      profileLookup = transport.fetchProfile(token);
    } catch (RuntimeException ex) {
      reject(context, token);
      return CompletableFuture.failedFuture(ex);
    }
    return profileLookup
        .handle((profile, failure) -> {
          if (failure != null) {
            reject(context, token);
            throw failure instanceof CompletionException completion ? completion : new CompletionException(failure);
          }
          username.set(profile.username());
          context.transitionTo(ConnectionStatus.CONNECTED);
          return null;
        });
  }

  private static void reject(AuthenticationContext context, String token) {
    context.logger().info("Token {} was not accepted by the identity provider", Logs.tokenHint(token));
    context.transitionTo(ConnectionStatus.DISCONNECTED);
  }

  @Override
  public CompletableFuture<Void> onLogout(AuthenticationContext context) {
    username.set(null);
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public CompletableFuture<InputStream> onSave(AuthenticationContext context) {
    return CompletableFuture.completedFuture(codec.encode(METHOD, username.get(), accessToken.get()));
  }

  @Override
  public CompletableFuture<UserCredentials> onLoad(AuthenticationContext context, InputStream stream) {
    return CompletableFuture.completedFuture(codec.decode(METHOD, stream));
  }
}
