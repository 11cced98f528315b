package ca.gc.cra.warden.config;

import ca.gc.cra.warden.application.port.AuthenticationStrategy;
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.IdentityTransport;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.SettingsPort;
import ca.gc.cra.warden.application.session.AuthenticationClient;
import ca.gc.cra.warden.infrastructure.auth.AnonymousAuthenticationStrategy;
import ca.gc.cra.warden.infrastructure.auth.PasswordAuthenticationStrategy;
import ca.gc.cra.warden.infrastructure.auth.SessionStateCodec;
import ca.gc.cra.warden.infrastructure.auth.TokenAuthenticationStrategy;
import ca.gc.cra.warden.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.warden.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.warden.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.warden.infrastructure.transport.HttpIdentityTransport;
import ca.gc.cra.warden.infrastructure.transport.IdentityEndpoints;
import ca.gc.cra.warden.logging.LoggingConfigurator;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root building {@link AuthenticationClient}s from settings.
 * <p><strong>Why:</strong> Keeps the mapping from {@code auth.method}, {@code metrics.exporter}, and identity
 * endpoints to concrete adapters in one place.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the strategy named by {@code auth.method} (default {@code anonymous}).</li>
 *   <li>Build an {@link HttpIdentityTransport} from {@code identity.*} settings when none is supplied.</li>
 *   <li>Select the metrics adapter named by {@code metrics.exporter} ({@code none} or {@code otel}).</li>
 *   <li>Raise logging to DEBUG when {@code logging.verbose} is set.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable references; each call builds a new client.</p>
 *
 * @since 0.1.0
 */
public final class AuthenticationClientFactory {
  static final String AUTH_METHOD_KEY = "auth.method";
  static final String METRICS_EXPORTER_KEY = "metrics.exporter";
  static final String VERBOSE_KEY = "logging.verbose";

  private static final Logger log = LoggerFactory.getLogger(AuthenticationClientFactory.class);
  private static final Logger CLIENT_LOGGER = LoggerFactory.getLogger(AuthenticationClient.class);

  private final SettingsPort settings;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a factory selecting its metrics adapter from {@code metrics.exporter}.
   *
   * @param settings client settings; never {@code null}
   * @throws IllegalArgumentException if {@code metrics.exporter} names an unknown exporter
   */
  public AuthenticationClientFactory(SettingsPort settings) {
    this(settings, metricsFor(Objects.requireNonNull(settings, "settings")));
  }

  /**
   * Creates a factory with an explicit metrics adapter.
   *
   * @param settings client settings; never {@code null}
   * @param metrics metrics adapter shared by built clients; never {@code null}
   */
  public AuthenticationClientFactory(SettingsPort settings, MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = new SystemClockAdapter();
  }

  /**
   * Builds the default anonymous client. It needs no settings and no transport.
   *
   * @return new anonymous client
   */
  public static AuthenticationClient anonymous() {
    return new AuthenticationClient(new AnonymousAuthenticationStrategy(), SettingsPort.EMPTY, CLIENT_LOGGER);
  }

  /**
   * Builds the client named by {@code auth.method}, using an HTTP transport configured from {@code identity.*}.
   *
   * @return new client
   * @throws IllegalArgumentException if the method is unknown or identity endpoints are missing or invalid
   */
  public AuthenticationClient create() {
    AuthMethod method = method();
    IdentityTransport transport = method == AuthMethod.ANONYMOUS
        ? null
        : new HttpIdentityTransport(IdentityEndpoints.fromSettings(settings));
    return build(method, transport, null);
  }

  /**
   * Builds the client named by {@code auth.method} over a caller-supplied transport.
   *
   * @param transport identity transport; never {@code null}
   * @return new client
   */
  public AuthenticationClient create(IdentityTransport transport) {
    return create(transport, null);
  }

  /**
   * Builds the client named by {@code auth.method} over a caller-supplied transport and dispatch executor.
   *
   * @param transport identity transport; never {@code null}
   * @param dispatchExecutor status delivery executor; {@code null} lets the client own a daemon thread
   * @return new client
   */
  public AuthenticationClient create(IdentityTransport transport, Executor dispatchExecutor) {
    Objects.requireNonNull(transport, "transport");
    return build(method(), transport, dispatchExecutor);
  }

  private AuthenticationClient build(AuthMethod method, IdentityTransport transport, Executor dispatchExecutor) {
    if (settings.getBoolean(VERBOSE_KEY, false) && LoggingConfigurator.enableVerboseLogging()) {
      log.debug("Verbose logging enabled by {}", VERBOSE_KEY);
    }
    AuthenticationStrategy strategy = strategyFor(method, transport);
    log.info("Creating {} authentication client", strategy.clientType());
    return new AuthenticationClient(strategy, settings, CLIENT_LOGGER, metrics, clock, dispatchExecutor);
  }

  private AuthenticationStrategy strategyFor(AuthMethod method, IdentityTransport transport) {
    return switch (method) {
      case ANONYMOUS -> new AnonymousAuthenticationStrategy();
      case PASSWORD -> new PasswordAuthenticationStrategy(transport, new SessionStateCodec(clock));
      case TOKEN -> new TokenAuthenticationStrategy(transport, new SessionStateCodec(clock));
    };
  }

  private AuthMethod method() {
    return AuthMethod.fromString(settings.get(AUTH_METHOD_KEY).orElse(null));
  }

  static MetricsPort metricsFor(SettingsPort settings) {
    String exporter = settings.getOrDefault(METRICS_EXPORTER_KEY, "none").trim().toLowerCase(Locale.ROOT);
    return switch (exporter) {
      case "none", "" -> new NoOpMetricsAdapter();
      case "otel", "otlp" -> new OpenTelemetryMetricsAdapter(GlobalOpenTelemetry.get());
      default -> throw new IllegalArgumentException("Unknown " + METRICS_EXPORTER_KEY + ": " + exporter);
    };
  }
}
