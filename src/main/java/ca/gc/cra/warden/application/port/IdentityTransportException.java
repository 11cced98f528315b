package ca.gc.cra.warden.application.port;

import java.util.OptionalInt;

/**
 * Checked exception reported when the network exchange with the identity provider fails.
 *
 * <p>Delivered through the failed {@link java.util.concurrent.CompletableFuture} of a transport call; the
 * session orchestrator surfaces it unchanged to the caller of {@code beginLogin()} or {@code logout()}.</p>
 *
 * @since 0.1.0
 */
public final class IdentityTransportException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int statusCode;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public IdentityTransportException(String msg) {
    super(msg);
    this.statusCode = -1;
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause from the HTTP stack or JSON parsing
   */
  public IdentityTransportException(String msg, Throwable cause) {
    super(msg, cause);
    this.statusCode = -1;
  }

  /**
   * Creates an exception for an identity provider error response.
   *
   * @param msg human-readable error
   * @param statusCode HTTP status returned by the provider
   */
  public IdentityTransportException(String msg, int statusCode) {
    super(msg);
    this.statusCode = statusCode;
  }

  /**
   * Returns the HTTP status reported by the provider, when one was received.
   *
   * @return status code or empty for connection-level failures
   */
  public OptionalInt statusCode() {
    return statusCode < 0 ? OptionalInt.empty() : OptionalInt.of(statusCode);
  }
}
