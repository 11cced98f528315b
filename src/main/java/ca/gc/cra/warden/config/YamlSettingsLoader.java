package ca.gc.cra.warden.config;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads client settings from YAML. The {@code common} section applies to every profile; the named profile section
 * overrides it. Nested mappings are flattened into dotted keys ({@code identity: {baseUri: x}} becomes
 * {@code identity.baseUri=x}).
 */
public final class YamlSettingsLoader {

  private YamlSettingsLoader() {}

  /**
   * Loads settings for {@code profile} from a YAML file.
   *
   * @param path YAML document location
   * @param profile profile section to merge over {@code common} (e.g., {@code dev}, {@code prod})
   * @return flat settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or not a mapping of scalars
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(profile, "profile");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, profile, path.toString()));
    }
  }

  /**
   * Parses settings for {@code profile} from YAML text.
   *
   * @param yaml YAML document
   * @param profile profile section to merge over {@code common}
   * @return flat settings
   * @throws IllegalArgumentException when the YAML is malformed or not a mapping of scalars
   */
  public static Map<String, String> parse(String yaml, String profile) {
    Objects.requireNonNull(yaml, "yaml");
    Objects.requireNonNull(profile, "profile");
    return parse(new StringReader(yaml), profile, "<inline>");
  }

  private static Map<String, String> parse(Reader reader, String profile, String source) {
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML settings at " + source, ex);
    }
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> root = mapping(document, "root");
    Map<String, String> settings = new LinkedHashMap<>();
    Object common = section(root, "common");
    if (common != null) {
      flatten(mapping(common, "common"), "", settings);
    }
    String normalizedProfile = profile.trim().toLowerCase(Locale.ROOT);
    Object selected = section(root, normalizedProfile);
    if (selected instanceof Map<?, ?> profileMap) {
      flatten(mapping(profileMap, normalizedProfile), "", settings);
    }
    return Map.copyOf(settings);
  }

  private static Map<String, Object> mapping(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object section(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey().trim();
      if (key.isEmpty()) {
        throw new IllegalArgumentException("YAML settings contain a blank key");
      }
      String dotted = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flatten(mapping(nested, dotted), dotted, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for setting " + dotted);
      } else if (value == null) {
        target.remove(dotted);
      } else {
        target.put(dotted, value.toString());
      }
    }
  }
}
