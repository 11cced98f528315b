package ca.gc.cra.warden.application.port;

import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Read-only configuration source consumed by authentication strategies and transports.
 * <p><strong>Why:</strong> Strategies need identity provider endpoints and options without depending on how the
 * host loads configuration (YAML, maps, environment).</p>
 * <p><strong>Role:</strong> Borrowed by {@link ca.gc.cra.warden.application.session.AuthenticationClient}; never
 * read by the orchestrator itself.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be immutable or otherwise safe to share across clients.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SettingsPort {
  /**
   * Looks up a setting by its dotted key (e.g., {@code identity.baseUri}).
   *
   * @param key setting key; must not be {@code null}
   * @return trimmed value when present
   */
  Optional<String> get(String key);

  /**
   * Returns the setting or a fallback when absent.
   *
   * @param key setting key
   * @param defaultValue fallback value
   * @return configured value or {@code defaultValue}
   */
  default String getOrDefault(String key, String defaultValue) {
    return get(key).orElse(defaultValue);
  }

  /**
   * Interprets the setting as a boolean ({@code true}, {@code yes}, {@code on}, {@code 1}).
   *
   * @param key setting key
   * @param defaultValue fallback when absent
   * @return parsed flag
   */
  default boolean getBoolean(String key, boolean defaultValue) {
    return get(key)
        .map(value -> value.trim().toLowerCase(Locale.ROOT))
        .map(value -> value.equals("true") || value.equals("yes") || value.equals("on") || value.equals("1"))
        .orElse(defaultValue);
  }

  /**
   * Settings source with no entries.
   */
  SettingsPort EMPTY = key -> Optional.empty();
}
