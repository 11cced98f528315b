package ca.gc.cra.warden.infrastructure.transport;

import ca.gc.cra.warden.application.port.SettingsPort;
import ca.gc.cra.warden.validation.Numbers;
import ca.gc.cra.warden.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Identity provider endpoints and request timeout used by {@link HttpIdentityTransport}.
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param baseUri provider base URI (http or https)
 * @param tokenPath path of the password exchange endpoint
 * @param profilePath path of the token profile endpoint
 * @param revokePath path of the token revocation endpoint
 * @param timeout per-request timeout
 * @since 0.1.0
 */
public record IdentityEndpoints(
    URI baseUri,
    String tokenPath,
    String profilePath,
    String revokePath,
    Duration timeout) {

  /** Settings key holding the provider base URI. */
  public static final String BASE_URI_KEY = "identity.baseUri";
  static final String TOKEN_PATH_KEY = "identity.tokenPath";
  static final String PROFILE_PATH_KEY = "identity.profilePath";
  static final String REVOKE_PATH_KEY = "identity.revokePath";
  static final String TIMEOUT_KEY = "identity.timeoutMillis";
  static final long DEFAULT_TIMEOUT_MILLIS = 10_000L;
  static final long MAX_TIMEOUT_MILLIS = 300_000L;

  /**
   * Validates the scheme and normalizes paths to start with {@code /}.
   */
  public IdentityEndpoints {
    Objects.requireNonNull(baseUri, "baseUri");
    String scheme = baseUri.getScheme() == null ? "" : baseUri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException("identity.baseUri must use http or https (was " + baseUri + ")");
    }
    tokenPath = normalizePath("tokenPath", tokenPath);
    profilePath = normalizePath("profilePath", profilePath);
    revokePath = normalizePath("revokePath", revokePath);
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  /**
   * Builds endpoints from settings. {@code identity.baseUri} is required; paths default to {@code /token},
   * {@code /profile}, {@code /revoke}, and the timeout to 10 seconds.
   *
   * @param settings settings source; never {@code null}
   * @return validated endpoints
   * @throws IllegalArgumentException if the base URI is missing or malformed, or the timeout is out of range
   */
  public static IdentityEndpoints fromSettings(SettingsPort settings) {
    Objects.requireNonNull(settings, "settings");
    String rawBase = settings.get(BASE_URI_KEY)
        .orElseThrow(() -> new IllegalArgumentException(BASE_URI_KEY + " is required"));
    URI base;
    try {
      base = new URI(Strings.requireNonBlank(BASE_URI_KEY, rawBase));
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(BASE_URI_KEY + " is not a valid URI: " + rawBase, ex);
    }
    long timeoutMillis = settings.get(TIMEOUT_KEY)
        .map(raw -> Numbers.parseInRange(TIMEOUT_KEY, raw, 1, MAX_TIMEOUT_MILLIS))
        .orElse(DEFAULT_TIMEOUT_MILLIS);
    return new IdentityEndpoints(
        base,
        settings.getOrDefault(TOKEN_PATH_KEY, "/token"),
        settings.getOrDefault(PROFILE_PATH_KEY, "/profile"),
        settings.getOrDefault(REVOKE_PATH_KEY, "/revoke"),
        Duration.ofMillis(timeoutMillis));
  }

  URI tokenUri() {
    return resolve(tokenPath);
  }

  URI profileUri() {
    return resolve(profilePath);
  }

  URI revokeUri() {
    return resolve(revokePath);
  }

  private URI resolve(String path) {
    String base = baseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + path);
  }

  private static String normalizePath(String name, String path) {
    String trimmed = Strings.requireNonBlank(name, path);
    return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
  }
}
