package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.auth.ConnectionStatus;

/**
 * Receives connection status values from a {@link StatusFeed}.
 *
 * <p>Calls for one subscription never overlap and arrive in publish order. The first call happens on the
 * subscribing thread; later calls happen on the feed's dispatch executor.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface StatusObserver {
  /**
   * Handles a status value.
   *
   * @param status current or newly published status; never {@code null}
   */
  void onStatus(ConnectionStatus status);

  /**
   * Signals that the feed was closed and no further values will arrive.
   */
  default void onCompleted() {}
}
