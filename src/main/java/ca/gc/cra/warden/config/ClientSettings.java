package ca.gc.cra.warden.config;

import ca.gc.cra.warden.application.port.SettingsPort;
import ca.gc.cra.warden.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable {@link SettingsPort} backed by a flat key/value map.
 * <p><strong>Why:</strong> Gives hosts one settings type whether values come from YAML, code, or overrides.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across clients.</p>
 *
 * @since 0.1.0
 */
public final class ClientSettings implements SettingsPort {
  private static final ClientSettings EMPTY_SETTINGS = new ClientSettings(Map.of());

  private final Map<String, String> values;

  private ClientSettings(Map<String, String> values) {
    this.values = Map.copyOf(values);
  }

  /**
   * Creates settings from a map. Blank values are treated as absent.
   *
   * @param values flat settings; never {@code null}
   * @return immutable settings
   */
  public static ClientSettings of(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    Map<String, String> cleaned = new LinkedHashMap<>();
    values.forEach((key, value) -> {
      String trimmed = Strings.trimToNull(value);
      if (key != null && trimmed != null) {
        cleaned.put(key.trim(), trimmed);
      }
    });
    return new ClientSettings(cleaned);
  }

  public static ClientSettings empty() {
    return EMPTY_SETTINGS;
  }

  /**
   * Loads settings for a profile from a YAML file; a missing file yields empty settings.
   *
   * @param path YAML file
   * @param profile profile section to merge over {@code common}
   * @return loaded settings
   * @throws IOException when the file exists but cannot be read
   */
  public static ClientSettings fromYaml(Path path, String profile) throws IOException {
    return YamlSettingsLoader.load(path, profile).map(ClientSettings::of).orElse(EMPTY_SETTINGS);
  }

  /**
   * Returns new settings where {@code overrides} win over the current values.
   *
   * @param overrides replacement values; a blank value removes the key
   * @return merged settings
   */
  public ClientSettings withOverrides(Map<String, String> overrides) {
    Objects.requireNonNull(overrides, "overrides");
    Map<String, String> merged = new LinkedHashMap<>(values);
    overrides.forEach((key, value) -> {
      if (key == null) {
        return;
      }
      String trimmed = Strings.trimToNull(value);
      if (trimmed == null) {
        merged.remove(key.trim());
      } else {
        merged.put(key.trim(), trimmed);
      }
    });
    return new ClientSettings(merged);
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(values.get(Objects.requireNonNull(key, "key")));
  }

  /**
   * Returns the settings as an immutable map.
   *
   * @return flat settings snapshot
   */
  public Map<String, String> asMap() {
    return values;
  }

  @Override
  public String toString() {
    return "ClientSettings" + values.keySet();
  }
}
