package ca.gc.cra.warden.domain.auth;

import ca.gc.cra.warden.logging.Logs;
import ca.gc.cra.warden.validation.Strings;
import java.util.Objects;

/**
 * Immutable login material supplied to an authentication client.
 *
 * <p><strong>Why:</strong> Strategies need a single value carrying whichever secret they authenticate with
 * (a password, a pre-issued access token, or nothing at all).</p>
 * <p><strong>Thread-safety:</strong> Records are immutable and safely shareable; clients replace the whole value
 * rather than mutating it.</p>
 * <p><strong>Security:</strong> {@link #toString()} redacts the password and access token.</p>
 *
 * @param username login name; may be {@code null}
 * @param password secret for password exchange; may be {@code null}
 * @param accessToken pre-issued or restored bearer token; may be {@code null}
 *
 * @since 0.1.0
 */
public record UserCredentials(String username, String password, String accessToken) {
  private static final UserCredentials EMPTY = new UserCredentials(null, null, null);

  /**
   * Canonicalizes blank components to {@code null}.
   */
  public UserCredentials {
    username = normalize(username);
    password = blankToNull(password);
    accessToken = normalize(accessToken);
  }

  /**
   * Returns credentials carrying no material. Never performs I/O and never fails.
   *
   * @return empty credentials
   */
  public static UserCredentials empty() {
    return EMPTY;
  }

  /**
   * Builds credentials for a username/password exchange.
   *
   * @param username login name; must be non-blank
   * @param password secret; must not be {@code null}
   * @return immutable credentials
   * @throws NullPointerException if either argument is {@code null}
   * @throws IllegalArgumentException if {@code username} is blank or contains control characters
   */
  public static UserCredentials password(String username, String password) {
    String user = Strings.requireNonBlank("username", username);
    return new UserCredentials(user, Objects.requireNonNull(password, "password"), null);
  }

  /**
   * Builds credentials carrying only a bearer token.
   *
   * @param accessToken token issued by the identity provider; must be non-blank
   * @return immutable credentials
   */
  public static UserCredentials token(String accessToken) {
    return new UserCredentials(null, null, Strings.requireNonBlank("accessToken", accessToken));
  }

  public boolean hasPassword() {
    return password != null;
  }

  public boolean hasAccessToken() {
    return accessToken != null;
  }

  /**
   * Reports whether no credential material is present.
   *
   * @return {@code true} when username, password, and token are all absent
   */
  public boolean isEmpty() {
    return username == null && password == null && accessToken == null;
  }

  @Override
  public String toString() {
    return "UserCredentials[username=" + username
        + ", password=" + (password == null ? null : Logs.redact(password))
        + ", accessToken=" + (accessToken == null ? null : Logs.redact(accessToken)) + ']';
  }

  private static String normalize(String candidate) {
    if (candidate == null) {
      return null;
    }
    String trimmed = candidate.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static String blankToNull(String candidate) {
    return candidate == null || candidate.isEmpty() ? null : candidate;
  }
}
