package ca.gc.cra.warden.domain.auth;

import java.util.Locale;

/**
 * Connection state of an authentication client relative to the remote identity provider.
 *
 * <p><strong>Why:</strong> Observers react to login progress without polling the client.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and safe to share.
 *
 * @since 0.1.0
 */
public enum ConnectionStatus {
  /** No session is established; the initial state of every client. */
  DISCONNECTED,

  /** A login attempt is in flight. */
  CONNECTING,

  /** The identity provider accepted the client's credentials. */
  CONNECTED,

  /** The last login attempt failed. */
  FAILED;

  /**
   * Reports whether a client currently in this state may move to {@code next}.
   *
   * <p>{@link #CONNECTED} is reachable only through {@link #CONNECTING}; every other target is reachable from
   * any state.</p>
   *
   * @param next candidate status; never {@code null}
   * @return {@code true} when the transition is permitted
   */
  public boolean canTransitionTo(ConnectionStatus next) {
    if (next == CONNECTED) {
      return this == CONNECTING || this == CONNECTED;
    }
    return next != null;
  }

  /**
   * Returns the lower-case name used for metric keys (e.g., {@code auth.status.connected}).
   *
   * @return metric-friendly status name
   */
  public String metricName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
