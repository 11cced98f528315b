package ca.gc.cra.warden.infrastructure.auth;

import ca.gc.cra.warden.application.port.AuthenticationContext;
import ca.gc.cra.warden.application.port.AuthenticationStrategy;
import ca.gc.cra.warden.application.port.IdentityTransport;
import ca.gc.cra.warden.domain.auth.ConnectionStatus;
import ca.gc.cra.warden.domain.auth.TokenGrant;
import ca.gc.cra.warden.domain.auth.UserCredentials;
import ca.gc.cra.warden.logging.Logs;
import java.io.InputStream;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Variant exchanging a username and password for an access token.
 *
 * <p><strong>Login:</strong> with a password the credentials are exchanged through
 * {@link IdentityTransport#requestToken(String, String)}; without a password but with a restored access token
 * the token is verified through {@link IdentityTransport#fetchProfile(String)}. A failed exchange ends in
 * {@link ConnectionStatus#FAILED}. Missing credentials end in {@link ConnectionStatus#DISCONNECTED} and fail the
 * login with {@link IllegalStateException}.</p>
 * <p><strong>Logout:</strong> revokes the held token, if any.</p>
 * <p><strong>Persistence:</strong> saves the username and access token; never the password.</p>
 *
 * @since 0.1.0
 */
public final class PasswordAuthenticationStrategy implements AuthenticationStrategy {
  /** Authentication method reported by password clients. */
  public static final String METHOD = "password";

  private final IdentityTransport transport;
  private final SessionStateCodec codec;
  private final AtomicReference<String> username = new AtomicReference<>();
  private final AtomicReference<String> accessToken = new AtomicReference<>();

  /**
   * Creates a password variant.
   *
   * @param transport identity provider transport; never {@code null}
   * @param codec persisted state codec; never {@code null}
   */
  public PasswordAuthenticationStrategy(IdentityTransport transport, SessionStateCodec codec) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public String authenticationMethod() {
    return METHOD;
  }

  @Override
  public String clientType() {
    return "password-client";
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
    username.set(credentials.username());
    accessToken.set(credentials.accessToken());
  }

  @Override
  public CompletableFuture<Void> onBeginLogin(AuthenticationContext context) {
    UserCredentials credentials = context.credentials().orElse(UserCredentials.empty());
    if (credentials.username() != null && credentials.hasPassword()) {
      return transport.requestToken(credentials.username(), credentials.password())
          .handle((grant, failure) -> {
            if (failure != null) {
              return fail(context, failure);
            }
            accept(context, grant);
            return null;
          });
    }
    if (credentials.hasAccessToken()) {
      return transport.fetchProfile(credentials.accessToken())
          .handle((profile, failure) -> {
            if (failure != null) {
              accessToken.set(null);
              return fail(context, failure);
            }
            username.set(profile.username());
            context.logger().debug("Resumed session for {} from a saved access token", profile.username());
            context.transitionTo(ConnectionStatus.CONNECTED);
            return null;
          });
    }
    context.transitionTo(ConnectionStatus.DISCONNECTED);
    return CompletableFuture.failedFuture(
        new IllegalStateException("Password login requires a username and password or a saved access token"));
  }

  @Override
  public CompletableFuture<Void> onLogout(AuthenticationContext context) {
    String token = accessToken.getAndSet(null);
    if (token == null) {
      return CompletableFuture.completedFuture(null);
    }
    return transport.revokeToken(token);
  }

  @Override
  public CompletableFuture<InputStream> onSave(AuthenticationContext context) {
    return CompletableFuture.completedFuture(codec.encode(METHOD, username.get(), accessToken.get()));
  }

  @Override
  public CompletableFuture<UserCredentials> onLoad(AuthenticationContext context, InputStream stream) {
    return CompletableFuture.completedFuture(codec.decode(METHOD, stream));
  }

  private void accept(AuthenticationContext context, TokenGrant grant) {
    accessToken.set(grant.accessToken());
    context.logger().debug("Issued {} token {} for {}", grant.tokenType(), Logs.tokenHint(grant.accessToken()),
        username.get());
    context.transitionTo(ConnectionStatus.CONNECTED);
  }

  private static Void fail(AuthenticationContext context, Throwable failure) {
    context.transitionTo(ConnectionStatus.FAILED);
    throw failure instanceof CompletionException completion ? completion : new CompletionException(failure);
  }
}
