package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.auth.UserCredentials;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

/**
 * <strong>What:</strong> Capability set a concrete authentication variant (anonymous, password, token) supplies
 * to the session orchestrator.
 * <p><strong>Why:</strong> Keeps status bookkeeping, logging, and argument checks in one orchestrator while each
 * variant decides how to talk to the identity provider and how to persist its state.</p>
 * <p><strong>Role:</strong> Held by {@link ca.gc.cra.warden.application.session.AuthenticationClient}.</p>
 * <p><strong>Thread-safety:</strong> One strategy instance serves one client. Hooks may be called from the
 * caller's thread; futures may complete on transport threads.</p>
 *
 * <p>{@link #onBeginLogin(AuthenticationContext)} must move the client out of
 * {@link ca.gc.cra.warden.domain.auth.ConnectionStatus#CONNECTING} on every path, success or failure.</p>
 *
 * @since 0.1.0
 */
public interface AuthenticationStrategy extends AutoCloseable {
  /**
   * Returns the stable identifier of this strategy (e.g., {@code anonymous}, {@code password}).
   *
   * @return authentication method name
   */
  String authenticationMethod();

  /**
   * Returns the stable identifier of this implementation.
   *
   * @return client type name
   */
  String clientType();

  /**
   * Returns the signed-in or configured username.
   *
   * @return username or {@code null}
   */
  String username();

  /**
   * Returns the access token currently held.
   *
   * @return token or {@code null}
   */
  String accessToken();

  /**
   * Performs the variant-specific login. The client is already {@code CONNECTING} when this runs.
   *
   * @param context owning client view
   * @return future completing when the login outcome is known
   */
  CompletableFuture<Void> onBeginLogin(AuthenticationContext context);

  /**
   * Performs the variant-specific logout. The client moves to {@code DISCONNECTED} afterwards regardless of the
   * outcome.
   *
   * @param context owning client view
   * @return future completing when the logout exchange finished
   */
  default CompletableFuture<Void> onLogout(AuthenticationContext context) {
    return CompletableFuture.completedFuture(null);
  }

  /**
   * Serializes the state needed to rebuild credentials later. Defaults to an empty stream.
   *
   * @param context owning client view
   * @return future completing with the serialized state
   */
  default CompletableFuture<InputStream> onSave(AuthenticationContext context) {
    return CompletableFuture.completedFuture(new ByteArrayInputStream(new byte[0]));
  }

  /**
   * Rebuilds credentials from a stream produced by {@link #onSave(AuthenticationContext)}. Defaults to empty
   * credentials without reading the stream.
   *
   * @param context owning client view
   * @param stream serialized state; never {@code null}
   * @return future completing with restored credentials
   */
  default CompletableFuture<UserCredentials> onLoad(AuthenticationContext context, InputStream stream) {
    return CompletableFuture.completedFuture(UserCredentials.empty());
  }

  /**
   * Reacts to new credentials being stored on the client (e.g., clears cached tokens).
   *
   * @param context owning client view
   * @param credentials newly stored credentials; never {@code null}
   */
  default void onSetCredentials(AuthenticationContext context, UserCredentials credentials) {}

  /**
   * Releases strategy resources when the owning client closes.
   */
  @Override
  default void close() {}
}
