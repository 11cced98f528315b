package ca.gc.cra.warden.application.port;

/**
 * Handle returned by {@link StatusFeed#subscribe(StatusObserver)}; closing it stops further deliveries.
 *
 * @since 0.1.0
 */
public interface StatusSubscription extends AutoCloseable {
  /**
   * Reports whether values are still delivered to the observer.
   *
   * @return {@code false} once closed or once the feed completed
   */
  boolean isActive();

  /**
   * Unsubscribes the observer. Repeated calls are no-ops.
   */
  @Override
  void close();
}
