package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.auth.ConnectionStatus;
import ca.gc.cra.warden.domain.auth.UserCredentials;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * View of the owning client handed to {@link AuthenticationStrategy} hooks.
 *
 * <p>{@link #transitionTo(ConnectionStatus)} is the strategy's only way to change status; it routes through the
 * client's single transition primitive.</p>
 *
 * @since 0.1.0
 */
public interface AuthenticationContext {
  /**
   * Moves the owning client to {@code status}, logging and publishing the change.
   *
   * @param status new status; never {@code null}
   * @throws IllegalStateException if the current status may not move to {@code status}
   */
  void transitionTo(ConnectionStatus status);

  /**
   * Returns the owning client's current status.
   *
   * @return current status
   */
  ConnectionStatus currentStatus();

  /**
   * Returns the credentials stored on the owning client.
   *
   * @return stored credentials, empty before {@code setCredentials}
   */
  Optional<UserCredentials> credentials();

  /**
   * Returns the settings borrowed by the owning client.
   *
   * @return settings source
   */
  SettingsPort settings();

  /**
   * Returns the logger borrowed by the owning client.
   *
   * @return logger
   */
  Logger logger();
}
