package ca.gc.cra.warden.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.port.StatusObserver;
import ca.gc.cra.warden.application.port.StatusSubscription;
import ca.gc.cra.warden.domain.auth.ConnectionStatus;
import ca.gc.cra.warden.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class StatusBroadcasterTest {

  @Test
  void subscriberReceivesCurrentValueImmediately() {
    StatusBroadcaster broadcaster = new StatusBroadcaster(ConnectionStatus.DISCONNECTED, Runnable::run);
    List<ConnectionStatus> seen = new ArrayList<>();

    broadcaster.subscribe(seen::add);

    assertEquals(List.of(ConnectionStatus.DISCONNECTED), seen);
  }

  @Test
  void lateSubscriberSeesOnlyLatestThenLaterValues() {
    StatusBroadcaster broadcaster = new StatusBroadcaster(ConnectionStatus.DISCONNECTED, Runnable::run);
    broadcaster.publish(ConnectionStatus.CONNECTING);
    broadcaster.publish(ConnectionStatus.CONNECTED);
    List<ConnectionStatus> seen = new ArrayList<>();

    broadcaster.subscribe(seen::add);
    broadcaster.publish(ConnectionStatus.DISCONNECTED);

    assertEquals(List.of(ConnectionStatus.CONNECTED, ConnectionStatus.DISCONNECTED), seen);
    assertEquals(ConnectionStatus.DISCONNECTED, broadcaster.current());
  }

  @Test
  void closedSubscriptionStopsReceiving() {
    StatusBroadcaster broadcaster = new StatusBroadcaster(ConnectionStatus.DISCONNECTED, Runnable::run);
    List<ConnectionStatus> seen = new ArrayList<>();
    StatusSubscription subscription = broadcaster.subscribe(seen::add);

    subscription.close();
    broadcaster.publish(ConnectionStatus.CONNECTING);

    assertFalse(subscription.isActive());
    assertEquals(0, broadcaster.subscriberCount());
    assertEquals(List.of(ConnectionStatus.DISCONNECTED), seen);
  }

  @Test
  void throwingObserverDoesNotStopOthers() {
    StatusBroadcaster broadcaster = new StatusBroadcaster(ConnectionStatus.DISCONNECTED, Runnable::run);
    AtomicInteger failures = new AtomicInteger();
    broadcaster.subscribe(status -> {
      failures.incrementAndGet();
      throw new IllegalStateException("observer bug");
    });
    List<ConnectionStatus> seen = new ArrayList<>();
    broadcaster.subscribe(seen::add);

    broadcaster.publish(ConnectionStatus.CONNECTING);
    broadcaster.publish(ConnectionStatus.FAILED);

    assertEquals(3, failures.get());
    assertEquals(
        List.of(ConnectionStatus.DISCONNECTED, ConnectionStatus.CONNECTING, ConnectionStatus.FAILED), seen);
  }

  @Test
  void closeSignalsCompletionAndIgnoresLaterPublishes() {
    StatusBroadcaster broadcaster = new StatusBroadcaster(ConnectionStatus.DISCONNECTED, Runnable::run);
    RecordingObserver observer = new RecordingObserver();
    broadcaster.subscribe(observer);

    broadcaster.close();
    broadcaster.close();
    broadcaster.publish(ConnectionStatus.CONNECTING);

    assertEquals(1, observer.completions.get());
    assertEquals(List.of(ConnectionStatus.DISCONNECTED), observer.statuses);
    assertEquals(ConnectionStatus.DISCONNECTED, broadcaster.current());
  }

  @Test
  void subscribeAfterCloseDeliversCurrentThenCompletion() {
    StatusBroadcaster broadcaster = new StatusBroadcaster(ConnectionStatus.FAILED, Runnable::run);
    broadcaster.close();
    RecordingObserver observer = new RecordingObserver();

    StatusSubscription subscription = broadcaster.subscribe(observer);

    assertEquals(List.of(ConnectionStatus.FAILED), observer.statuses);
    assertEquals(1, observer.completions.get());
    assertFalse(subscription.isActive());
  }

  @Test
  void asynchronousDeliveryPreservesPublishOrder() throws InterruptedException {
    ExecutorService executor = ExecutorFactories.newStatusDispatcher("broadcaster-test");
    try {
      StatusBroadcaster broadcaster = new StatusBroadcaster(ConnectionStatus.DISCONNECTED, executor);
      int publishes = 200;
      CountDownLatch done = new CountDownLatch(publishes + 1);
      List<ConnectionStatus> seen = new CopyOnWriteArrayList<>();
      broadcaster.subscribe(status -> {
        seen.add(status);
        done.countDown();
      });

      List<ConnectionStatus> expected = new ArrayList<>();
      expected.add(ConnectionStatus.DISCONNECTED);
      for (int i = 0; i < publishes; i++) {
        ConnectionStatus next = i % 2 == 0 ? ConnectionStatus.CONNECTING : ConnectionStatus.FAILED;
        expected.add(next);
        broadcaster.publish(next);
      }

      assertTrue(done.await(5, TimeUnit.SECONDS), "all values delivered");
      assertEquals(expected, seen);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void concurrentSubscribersSeeNoRepeatsAndEndOnLatest() throws Exception {
    int rounds = 20;
    int subscribers = 16;
    int publishes = 1000;
    ExecutorService dispatcher = ExecutorFactories.newStatusDispatcher("broadcaster-race");
    ExecutorService subscribing = Executors.newFixedThreadPool(4);
    try {
      for (int round = 0; round < rounds; round++) {
        StatusBroadcaster broadcaster = new StatusBroadcaster(ConnectionStatus.DISCONNECTED, dispatcher);
        CountDownLatch settled = new CountDownLatch(subscribers);
        CountDownLatch start = new CountDownLatch(1);
        List<List<ConnectionStatus>> histories = new ArrayList<>();
        List<Future<?>> subscriptions = new ArrayList<>();
        for (int i = 0; i < subscribers; i++) {
          List<ConnectionStatus> history = Collections.synchronizedList(new ArrayList<>());
          histories.add(history);
          subscriptions.add(subscribing.submit(() -> {
            start.await();
            return broadcaster.subscribe(status -> {
              history.add(status);
              if (status == ConnectionStatus.CONNECTED) {
                settled.countDown();
              }
            });
          }));
        }

        start.countDown();
        for (int i = 0; i < publishes; i++) {
          broadcaster.publish(i % 2 == 0 ? ConnectionStatus.CONNECTING : ConnectionStatus.FAILED);
        }
        broadcaster.publish(ConnectionStatus.CONNECTED);
        for (Future<?> subscription : subscriptions) {
          subscription.get(5, TimeUnit.SECONDS);
        }

        assertTrue(settled.await(5, TimeUnit.SECONDS), "every subscriber reached the latest value");
        for (List<ConnectionStatus> history : histories) {
          synchronized (history) {
            assertEquals(ConnectionStatus.CONNECTED, history.get(history.size() - 1), "round " + round);
            for (int i = 1; i < history.size(); i++) {
              assertNotEquals(history.get(i - 1), history.get(i), "repeated value in round " + round);
            }
          }
        }
      }
    } finally {
      subscribing.shutdownNow();
      dispatcher.shutdownNow();
    }
  }

  private static final class RecordingObserver implements StatusObserver {
    private final List<ConnectionStatus> statuses = new ArrayList<>();
    private final AtomicInteger completions = new AtomicInteger();

    @Override
    public void onStatus(ConnectionStatus status) {
      statuses.add(status);
    }

    @Override
    public void onCompleted() {
      completions.incrementAndGet();
    }
  }
}
