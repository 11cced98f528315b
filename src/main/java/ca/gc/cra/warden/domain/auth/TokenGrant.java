package ca.gc.cra.warden.domain.auth;

import ca.gc.cra.warden.logging.Logs;
import java.util.Locale;
import java.util.Objects;

/**
 * Access token issued by the identity provider after a successful credential exchange.
 *
 * @param accessToken bearer token; never {@code null}
 * @param tokenType token scheme reported by the provider; defaults to {@code bearer}
 *
 * @since 0.1.0
 */
public record TokenGrant(String accessToken, String tokenType) {

  /**
   * Validates the token and normalizes the type.
   */
  public TokenGrant {
    accessToken = Objects.requireNonNull(accessToken, "accessToken");
    if (accessToken.isBlank()) {
      throw new IllegalArgumentException("accessToken must not be blank");
    }
    tokenType = tokenType == null || tokenType.isBlank() ? "bearer" : tokenType.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Builds a bearer grant.
   *
   * @param accessToken bearer token; must be non-blank
   * @return immutable grant
   */
  public static TokenGrant bearer(String accessToken) {
    return new TokenGrant(accessToken, "bearer");
  }

  @Override
  public String toString() {
    return "TokenGrant[accessToken=" + Logs.redact(accessToken) + ", tokenType=" + tokenType + ']';
  }
}
