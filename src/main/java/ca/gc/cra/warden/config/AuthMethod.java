package ca.gc.cra.warden.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Authentication variants selectable through the {@code auth.method} setting.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum AuthMethod {
  /** No identity; login always succeeds. */
  ANONYMOUS,
  /** Username and password exchanged for a token. */
  PASSWORD,
  /** Pre-issued bearer token. */
  TOKEN;

  /**
   * Parses a setting value, defaulting to {@link #ANONYMOUS} when blank.
   *
   * @param value textual representation such as {@code "password"}
   * @return parsed method
   * @throws IllegalArgumentException if the value does not name a known method
   */
  public static AuthMethod fromString(String value) {
    if (value == null || value.isBlank()) {
      return ANONYMOUS;
    }
    try {
      return AuthMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown auth.method: " + value, ex);
    }
  }
}
