package ca.gc.cra.helm.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a HELM YAML file into flat dotted keys.
 *
 * <pre>
 * common:            # applies to every profile
 *   dedup:
 *     factor: 1.5    # becomes dedup.factor
 * console:           # profile section, overrides common
 *   party: [Ann, Bo] # becomes party=Ann,Bo
 * </pre>
 *
 * <p>Section names match case-insensitively.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and returns the {@code common} section overlaid with the {@code profile} section.
   *
   * @param path YAML file
   * @param profile profile section name, e.g. {@code console}
   * @return flattened keys, or empty when the file does not exist
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if the document is not valid YAML or is not shaped as described above
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    String wanted = Objects.requireNonNull(profile, "profile").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String text = Files.readString(path, StandardCharsets.UTF_8);
    Object document;
    try {
      document = new Yaml().load(text);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    Map<String, Object> root = mapping(document, "document root");
    Map<String, String> result = new LinkedHashMap<>();
    for (String name : List.of(COMMON, wanted)) {
      for (Map.Entry<String, Object> section : root.entrySet()) {
        if (section.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
          flattenInto(result, "", mapping(section.getValue(), name));
        }
      }
    }
    return Optional.of(Map.copyOf(result));
  }

  private static void flattenInto(Map<String, String> out, String prefix, Map<String, Object> node) {
    node.forEach((key, value) -> {
      if (key.isBlank()) {
        throw new IllegalArgumentException("blank key under '" + prefix + "'");
      }
      String path = prefix.isEmpty() ? key : prefix + "." + key;
      if (value instanceof Map<?, ?>) {
        flattenInto(out, path, mapping(value, path));
      } else if (value instanceof List<?> items) {
        out.put(path, items.stream().map(item -> scalar(item, path)).collect(Collectors.joining(",")));
      } else {
        out.put(path, value == null ? "" : value.toString());
      }
    });
  }

  private static String scalar(Object item, String path) {
    if (item == null || item instanceof Map<?, ?> || item instanceof List<?>) {
      throw new IllegalArgumentException("list under '" + path + "' must hold scalars only");
    }
    return item.toString();
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException("'" + where + "' must be a mapping");
    }
    Map<String, Object> typed = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name)) {
        throw new IllegalArgumentException("'" + where + "' has a non-string key: " + key);
      }
      typed.put(name, value);
    });
    return typed;
  }
}
