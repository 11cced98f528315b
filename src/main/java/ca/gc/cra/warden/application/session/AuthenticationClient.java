package ca.gc.cra.warden.application.session;

import ca.gc.cra.warden.application.port.AuthenticationContext;
import ca.gc.cra.warden.application.port.AuthenticationStrategy;
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.SettingsPort;
import ca.gc.cra.warden.application.port.StatusFeed;
import ca.gc.cra.warden.domain.auth.ConnectionStatus;
import ca.gc.cra.warden.domain.auth.UserCredentials;
import ca.gc.cra.warden.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.warden.logging.Logs;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Authentication session client tracking the login lifecycle against an identity provider.
 * <p><strong>Why:</strong> Gives every authentication variant one uniform contract (login, logout, save, load) and
 * one status state machine, while the variant decides how to reach the provider.</p>
 * <p><strong>Role:</strong> Application-layer orchestrator holding an {@link AuthenticationStrategy}, a
 * {@link CredentialStore}, and a {@link StatusBroadcaster}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate arguments before any state mutation.</li>
 *   <li>Move to {@link ConnectionStatus#CONNECTING} before delegating login; move to
 *   {@link ConnectionStatus#DISCONNECTED} after every logout.</li>
 *   <li>Route every status change through one transition primitive that logs, counts, and publishes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for one logical session; concurrent {@code beginLogin()} and
 * {@code logout()} calls on the same instance are not linearized. Status reads and subscriptions are safe from
 * any thread.</p>
 * <p><strong>Observability:</strong> INFO at the start of every lifecycle operation, DEBUG for each transition,
 * counters under {@code auth.*}, and {@code auth.login.latencyMillis} observations.</p>
 *
 * @since 0.1.0
 */
public final class AuthenticationClient implements AutoCloseable {
  private final AuthenticationStrategy strategy;
  private final SettingsPort settings;
  private final Logger logger;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final CredentialStore credentialStore = new CredentialStore();
  private final StatusBroadcaster broadcaster;
  private final ExecutorService ownedDispatcher;
  private final AuthenticationContext context = new ClientContext();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates a client with no metrics, the system clock, and a dedicated status dispatch thread.
   *
   * @param strategy authentication variant; never {@code null}
   * @param settings configuration consumed by the variant; never {@code null}
   * @param logger logger borrowed for lifecycle messages; never {@code null}
   * @throws NullPointerException if any argument is {@code null}
   */
  public AuthenticationClient(AuthenticationStrategy strategy, SettingsPort settings, Logger logger) {
    this(strategy, settings, logger, MetricsPort.NO_OP, ClockPort.SYSTEM, null);
  }

  /**
   * Creates a fully wired client.
   *
   * @param strategy authentication variant; never {@code null}
   * @param settings configuration consumed by the variant; never {@code null}
   * @param logger logger borrowed for lifecycle messages; never {@code null}
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param clock time source for latency metrics; falls back to {@link ClockPort#SYSTEM} when {@code null}
   * @param dispatchExecutor executor delivering status notifications; when {@code null} the client creates and
   *     owns a single daemon thread
   * @throws NullPointerException if {@code strategy}, {@code settings}, or {@code logger} is {@code null}
   */
  public AuthenticationClient(
      AuthenticationStrategy strategy,
      SettingsPort settings,
      Logger logger,
      MetricsPort metrics,
      ClockPort clock,
      Executor dispatchExecutor) {
    this.logger = Objects.requireNonNull(logger, "logger");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.strategy = Objects.requireNonNull(strategy, "strategy");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    if (dispatchExecutor == null) {
      this.ownedDispatcher = ExecutorFactories.newStatusDispatcher("warden-status-" + strategy.clientType());
      this.broadcaster = new StatusBroadcaster(ConnectionStatus.DISCONNECTED, ownedDispatcher);
    } else {
      this.ownedDispatcher = null;
      this.broadcaster = new StatusBroadcaster(ConnectionStatus.DISCONNECTED, dispatchExecutor);
    }
  }

  /**
   * Stores new credentials and notifies the variant. Does not change status.
   *
   * @param credentials credentials to store; never {@code null}
   * @throws NullPointerException if {@code credentials} is {@code null}
   * @throws IllegalStateException if the client is closed
   */
  public void setCredentials(UserCredentials credentials) {
    Objects.requireNonNull(credentials, "credentials");
    ensureOpen();
    Optional<UserCredentials> previous = credentialStore.replace(credentials);
    if (previous.isPresent()) {
      logger.debug("Credentials replaced for client type {} (user {} -> {})", clientType(),
          Logs.userLabel(previous.get().username()), Logs.userLabel(credentials.username()));
    } else {
      logger.debug("Credentials set for client type {} (user {})", clientType(), Logs.userLabel(credentials.username()));
    }
    strategy.onSetCredentials(context, credentials);
  }

  /**
   * Returns the stored credentials.
   *
   * @return credentials, empty until {@link #setCredentials(UserCredentials)} succeeds
   */
  public Optional<UserCredentials> credentials() {
    return credentialStore.current();
  }

  /**
   * Starts a login. Status becomes {@link ConnectionStatus#CONNECTING} before this method returns; the variant
   * decides the final status.
   *
   * <p>If the variant's future fails while status is still {@code CONNECTING}, the client moves to
   * {@link ConnectionStatus#FAILED}.</p>
   *
   * @return future completing with the variant's login outcome
   * @throws IllegalStateException if the client is closed
   */
  public CompletableFuture<Void> beginLogin() {
    ensureOpen();
    logger.info("Beginning login process for client type {} for user {}...", clientType(), Logs.userLabel(username()));
    metrics.increment("auth.login.started");
    long startedAt = clock.nowMillis();
    transition(ConnectionStatus.CONNECTING);
    return invoke("login", () -> strategy.onBeginLogin(context))
        .whenComplete((ignored, failure) -> {
          metrics.observe("auth.login.latencyMillis", Math.max(0L, clock.nowMillis() - startedAt));
          if (failure == null) {
            metrics.increment("auth.login.succeeded");
            return;
          }
          metrics.increment("auth.login.failed");
          if (broadcaster.current() == ConnectionStatus.CONNECTING) {
            logger.warn("Login for client type {} failed without leaving CONNECTING; marking FAILED",
                clientType(), unwrap(failure));
            transition(ConnectionStatus.FAILED);
          }
        });
  }

  /**
   * Logs out. Status becomes {@link ConnectionStatus#DISCONNECTED} before the returned future completes, whether
   * or not the variant's logout succeeded.
   *
   * @return future completing with the variant's logout outcome
   * @throws IllegalStateException if the client is closed
   */
  public CompletableFuture<Void> logout() {
    ensureOpen();
    logger.info("Logging out client type {}...", clientType());
    return invoke("logout", () -> strategy.onLogout(context))
        .whenComplete((ignored, failure) -> {
          if (failure == null) {
            metrics.increment("auth.logout.completed");
          } else {
            metrics.increment("auth.logout.failed");
            logger.warn("Logout for client type {} reported a failure", clientType(), unwrap(failure));
          }
          transition(ConnectionStatus.DISCONNECTED);
        });
  }

  /**
   * Serializes the session state needed to restore credentials later.
   *
   * @return future completing with the serialized state; empty when the variant has nothing to save
   * @throws IllegalStateException if the client is closed
   */
  public CompletableFuture<InputStream> save() {
    ensureOpen();
    logger.info("Saving security state for client type {}...", clientType());
    return invoke("save", () -> strategy.onSave(context));
  }

  /**
   * Restores credentials from a stream produced by {@link #save()}. The result is returned, not stored; pass it
   * to {@link #setCredentials(UserCredentials)} to apply it.
   *
   * @param stream serialized state; never {@code null}
   * @return future completing with the restored credentials
   * @throws NullPointerException if {@code stream} is {@code null}
   * @throws IllegalStateException if the client is closed
   */
  public CompletableFuture<UserCredentials> load(InputStream stream) {
    Objects.requireNonNull(stream, "stream");
    ensureOpen();
    logger.info("Restoring security state for client type {}...", clientType());
    return invoke("load", () -> strategy.onLoad(context, stream));
  }

  public boolean isConnected() {
    return broadcaster.current() == ConnectionStatus.CONNECTED;
  }

  public ConnectionStatus currentStatus() {
    return broadcaster.current();
  }

  /**
   * Returns the subscribable status feed.
   *
   * @return status feed with replay-latest semantics
   */
  public StatusFeed statusFeed() {
    return broadcaster;
  }

  public String authenticationMethod() {
    return strategy.authenticationMethod();
  }

  public String username() {
    return strategy.username();
  }

  public String accessToken() {
    return strategy.accessToken();
  }

  public String clientType() {
    return strategy.clientType();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Completes the status feed, closes the variant, and stops the owned dispatch thread. Repeated calls are
   * no-ops.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    logger.debug("Closing authentication client type {}", clientType());
    broadcaster.close();
    try {
      strategy.close();
    } catch (Exception ex) {
      logger.warn("Authentication strategy {} failed to close cleanly", clientType(), ex);
    } finally {
      if (ownedDispatcher != null) {
        ownedDispatcher.shutdown();
      }
    }
  }

  private void transition(ConnectionStatus status) {
    Objects.requireNonNull(status, "status");
    ConnectionStatus from = broadcaster.current();
    if (!from.canTransitionTo(status)) {
      throw new IllegalStateException("Cannot move from " + from + " to " + status);
    }
    logger.debug("Authentication client status changing to: {}", status);
    metrics.increment("auth.status." + status.metricName());
    broadcaster.publish(status);
  }

  private <T> CompletableFuture<T> invoke(String operation, Supplier<CompletableFuture<T>> hook) {
    try {
      CompletableFuture<T> future = hook.get();
      if (future == null) {
        return CompletableFuture.failedFuture(
            new IllegalStateException(clientType() + " returned no result for " + operation));
      }
      return future;
    } catch (RuntimeException ex) {
      return CompletableFuture.failedFuture(ex);
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("Authentication client is closed");
    }
  }

  private static Throwable unwrap(Throwable failure) {
    Throwable current = failure;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private final class ClientContext implements AuthenticationContext {
    @Override
    public void transitionTo(ConnectionStatus status) {
      transition(status);
    }

    @Override
    public ConnectionStatus currentStatus() {
      return broadcaster.current();
    }

    @Override
    public Optional<UserCredentials> credentials() {
      return credentialStore.current();
    }

    @Override
    public SettingsPort settings() {
      return settings;
    }

    @Override
    public Logger logger() {
      return logger;
    }
  }
}
