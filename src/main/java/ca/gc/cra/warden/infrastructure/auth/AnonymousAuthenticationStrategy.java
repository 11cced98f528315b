package ca.gc.cra.warden.infrastructure.auth;

import ca.gc.cra.warden.application.port.AuthenticationContext;
import ca.gc.cra.warden.application.port.AuthenticationStrategy;
import ca.gc.cra.warden.domain.auth.ConnectionStatus;
import java.util.concurrent.CompletableFuture;

/**
 * Variant requiring no credentials; login succeeds immediately.
 *
 * <p>Used as the default client when no identity is configured.</p>
 *
 * @since 0.1.0
 */
public final class AnonymousAuthenticationStrategy implements AuthenticationStrategy {
  /** Authentication method reported by anonymous clients. */
  public static final String METHOD = "anonymous";

  @Override
  public String authenticationMethod() {
    return METHOD;
  }

  @Override
  public String clientType() {
    return "anonymous-client";
  }

  @Override
  public String username() {
    return null;
  }

  @Override
  public String accessToken() {
    return null;
  }

  @Override
  public CompletableFuture<Void> onBeginLogin(AuthenticationContext context) {
    context.transitionTo(ConnectionStatus.CONNECTED);
    return CompletableFuture.completedFuture(null);
  }
}
