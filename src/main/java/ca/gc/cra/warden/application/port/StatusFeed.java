package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.auth.ConnectionStatus;

/**
 * <strong>What:</strong> Subscribable view of a client's connection status with replay-latest semantics.
 * <p><strong>Thread-safety:</strong> Implementations must support concurrent subscribe, unsubscribe, and reads.</p>
 *
 * @since 0.1.0
 */
public interface StatusFeed {
  /**
   * Returns the latest published status without blocking.
   *
   * @return current status; never {@code null}
   */
  ConnectionStatus current();

  /**
   * Registers an observer. The observer receives the current status synchronously, then every later value in
   * publish order until the subscription is closed.
   *
   * @param observer status observer; never {@code null}
   * @return subscription handle
   * @throws NullPointerException if {@code observer} is {@code null}
   */
  StatusSubscription subscribe(StatusObserver observer);
}
