package ca.gc.cra.warden.domain.auth;

import java.util.Objects;

/**
 * Identity resolved by the provider for a bearer token.
 *
 * @param username account name the token belongs to; never {@code null}
 *
 * @since 0.1.0
 */
public record IdentityProfile(String username) {

  public IdentityProfile {
    username = Objects.requireNonNull(username, "username").trim();
    if (username.isEmpty()) {
      throw new IllegalArgumentException("username must not be blank");
    }
  }
}
