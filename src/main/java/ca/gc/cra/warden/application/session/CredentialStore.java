package ca.gc.cra.warden.application.session;

import ca.gc.cra.warden.domain.auth.UserCredentials;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the credentials of one client. Values are replaced wholesale, never mutated in place.
 *
 * @since 0.1.0
 */
public final class CredentialStore {
  private final AtomicReference<UserCredentials> current = new AtomicReference<>();

  /**
   * Stores new credentials, replacing any previous value.
   *
   * @param credentials credentials to store; never {@code null}
   * @return the previously stored credentials, if any
   */
  public Optional<UserCredentials> replace(UserCredentials credentials) {
    Objects.requireNonNull(credentials, "credentials");
    return Optional.ofNullable(current.getAndSet(credentials));
  }

  public Optional<UserCredentials> current() {
    return Optional.ofNullable(current.get());
  }
}
