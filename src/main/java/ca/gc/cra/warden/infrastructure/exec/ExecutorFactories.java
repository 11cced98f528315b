package ca.gc.cra.warden.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for creating executor services aligned with WARDEN concurrency requirements.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a single daemon thread executor delivering status notifications for one client.
   *
   * @param prefix thread-name prefix used to tag the worker thread
   * @return configured executor service; owned and shut down by the caller
   */
  public static ExecutorService newStatusDispatcher(String prefix) {
    return newStatusDispatcher(prefix, null);
  }

  /**
   * Builds a single daemon thread executor delivering status notifications for one client.
   *
   * @param prefix thread-name prefix used to tag the worker thread
   * @param handler uncaught exception handler installed on the worker; logs at ERROR when {@code null}
   * @return configured executor service; owned and shut down by the caller
   */
  public static ExecutorService newStatusDispatcher(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "warden-status" : prefix.trim();
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler,
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
