package ca.gc.cra.warden.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts WARDEN logging verbosity at runtime.
 * <p><strong>Why:</strong> Status transitions are logged at DEBUG; hosts troubleshooting a login can surface them
 * without editing their logback configuration or raising verbosity for unrelated libraries.</p>
 * <p><strong>Thread-safety:</strong> Intended for bootstrap; Logback synchronizes level changes.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  /** Logger hierarchy owned by this library. */
  public static final String WARDEN_LOGGER = "ca.gc.cra.warden";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the {@value #WARDEN_LOGGER} hierarchy to DEBUG.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    return setLevel(WARDEN_LOGGER, "DEBUG");
  }

  /**
   * Sets the level of a named logger; {@code null} level resets it to inherit from its parent.
   *
   * @param loggerName logger name; never {@code null}
   * @param level Logback level name such as {@code DEBUG}; may be {@code null}
   * @return {@code true} when the backend accepted the change
   */
  public static boolean setLevel(String loggerName, String level) {
    Objects.requireNonNull(loggerName, "loggerName");
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Logging level change for {} requested but backend {} does not support dynamic updates",
          loggerName, factory.getClass().getName());
      return false;
    }
    Logger target = context.getLogger(loggerName);
    Level parsed = level == null ? null : Level.toLevel(level, null);
    if (level != null && parsed == null) {
      throw new IllegalArgumentException("Unknown logging level: " + level);
    }
    target.setLevel(parsed);
    log.debug("Logger {} level set to {}", loggerName, parsed);
    return true;
  }
}
