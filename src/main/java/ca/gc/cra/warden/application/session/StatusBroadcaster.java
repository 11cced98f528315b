package ca.gc.cra.warden.application.session;

import ca.gc.cra.warden.application.port.StatusFeed;
import ca.gc.cra.warden.application.port.StatusObserver;
import ca.gc.cra.warden.application.port.StatusSubscription;
import ca.gc.cra.warden.domain.auth.ConnectionStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Replay-latest status feed distributing {@link ConnectionStatus} changes to observers.
 * <p><strong>Why:</strong> Observers must see the current value on subscription and then every transition in
 * order, without a slow observer holding up the client that publishes.</p>
 * <p><strong>Role:</strong> Owned by {@link AuthenticationClient}; exposed read-only as a {@link StatusFeed}.</p>
 * <p><strong>Thread-safety:</strong> Publish, subscribe, unsubscribe, and close may run concurrently. The
 * subscriber list is guarded by a lock; each subscription owns an unbounded queue drained serially on the
 * dispatch executor.</p>
 * <p><strong>Observability:</strong> Observer failures are logged at WARN and do not stop delivery.</p>
 *
 * @since 0.1.0
 */
public final class StatusBroadcaster implements StatusFeed, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(StatusBroadcaster.class);

  private final Object lock = new Object();
  private final List<Subscription> subscribers = new ArrayList<>();
  private final Executor executor;
  private volatile ConnectionStatus current;
  private boolean closed;

  /**
   * Creates a broadcaster seeded with {@code initial}.
   *
   * @param initial first value replayed to subscribers; never {@code null}
   * @param executor executor running asynchronous deliveries; never {@code null}
   */
  public StatusBroadcaster(ConnectionStatus initial, Executor executor) {
    this.current = Objects.requireNonNull(initial, "initial");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public ConnectionStatus current() {
    return current;
  }

  @Override
  public StatusSubscription subscribe(StatusObserver observer) {
    Objects.requireNonNull(observer, "observer");
    Subscription subscription = new Subscription(observer);
    ConnectionStatus snapshot;
    boolean completed;
    synchronized (lock) {
      snapshot = current;
      completed = closed;
      if (!completed) {
        subscribers.add(subscription);
      }
    }
    subscription.deliverStatus(snapshot);
    if (completed) {
      subscription.deliverCompletion();
      subscription.cancelled = true;
      return subscription;
    }
    subscription.activate();
    return subscription;
  }

  /**
   * Sets the current value and enqueues it for every active subscriber.
   *
   * @param status new value; never {@code null}
   */
  public void publish(ConnectionStatus status) {
    Objects.requireNonNull(status, "status");
    List<Subscription> targets;
    synchronized (lock) {
      if (closed) {
        log.debug("Ignoring status {} published after the feed was closed", status);
        return;
      }
      current = status;
      targets = List.copyOf(subscribers);
      for (Subscription subscription : targets) {
        subscription.enqueue(Signal.of(status));
      }
    }
    for (Subscription subscription : targets) {
      subscription.schedule();
    }
  }

  /**
   * Returns the number of active subscriptions.
   *
   * @return subscriber count
   */
  public int subscriberCount() {
    synchronized (lock) {
      return subscribers.size();
    }
  }

  /**
   * Completes the feed for every subscriber. Repeated calls are no-ops.
   */
  @Override
  public void close() {
    List<Subscription> targets;
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      targets = List.copyOf(subscribers);
      subscribers.clear();
      for (Subscription subscription : targets) {
        subscription.enqueue(Signal.COMPLETE);
      }
    }
    for (Subscription subscription : targets) {
      subscription.schedule();
    }
  }

  private void remove(Subscription subscription) {
    synchronized (lock) {
      subscribers.remove(subscription);
    }
  }

  private record Signal(ConnectionStatus status) {
    static final Signal COMPLETE = new Signal(null);

    static Signal of(ConnectionStatus status) {
      return new Signal(status);
    }

    boolean isCompletion() {
      return status == null;
    }
  }

  private final class Subscription implements StatusSubscription {
    private final StatusObserver observer;
    private final Queue<Signal> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pending = new AtomicInteger();
    private volatile boolean active;
    private volatile boolean cancelled;

    private Subscription(StatusObserver observer) {
      this.observer = observer;
    }

    void enqueue(Signal signal) {
      queue.offer(signal);
    }

    void activate() {
      active = true;
      if (!queue.isEmpty()) {
        schedule();
      }
    }

    void schedule() {
      if (!active || cancelled) {
        return;
      }
      if (pending.getAndIncrement() != 0) {
        return;
      }
      try {
        executor.execute(this::drain);
      } catch (RejectedExecutionException ex) {
        pending.set(0);
        log.warn("Status dispatch executor rejected delivery; {} queued value(s) dropped", queue.size(), ex);
        queue.clear();
      }
    }

    private void drain() {
      int missed = 1;
      while (true) {
        Signal signal;
        while ((signal = queue.poll()) != null) {
          if (cancelled) {
            queue.clear();
            break;
          }
          if (signal.isCompletion()) {
            cancelled = true;
            deliverCompletion();
          } else {
            deliverStatus(signal.status());
          }
        }
        missed = pending.addAndGet(-missed);
        if (missed == 0) {
          return;
        }
      }
    }

    void deliverStatus(ConnectionStatus status) {
      try {
        observer.onStatus(status);
      } catch (RuntimeException ex) {
        log.warn("Status observer failed while handling {}", status, ex);
      }
    }

    void deliverCompletion() {
      try {
        observer.onCompleted();
      } catch (RuntimeException ex) {
        log.warn("Status observer failed while handling completion", ex);
      }
    }

    @Override
    public boolean isActive() {
      return !cancelled;
    }

    @Override
    public void close() {
      if (cancelled) {
        return;
      }
      cancelled = true;
      remove(this);
    }
  }
}
