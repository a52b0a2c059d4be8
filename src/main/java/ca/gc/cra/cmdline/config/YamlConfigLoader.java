package ca.gc.cra.cmdline.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a YAML document and flattens one top-level section into dotted key/value pairs.
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and flattens the requested top-level {@code section}.
   *
   * <p>Section names match case-insensitively. Nested mappings become dotted keys ({@code help.keys}); YAML
   * lists are joined with commas.</p>
   *
   * @param path location of the YAML document
   * @param section top-level section to read, such as {@code dispatch}
   * @return empty when the file does not exist; otherwise the flattened section (empty when absent)
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(section, "section");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String normalized = section.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> flattened = new LinkedHashMap<>();
      Object sectionNode = findSection(root, normalized);
      if (sectionNode != null) {
        flatten(asMap(sectionNode, normalized), "", flattened);
      }
      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
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

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?> items) {
        StringBuilder joined = new StringBuilder();
        for (Object item : items) {
          if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
            throw new IllegalArgumentException("YAML list for key " + composite + " must hold scalars");
          }
          if (joined.length() > 0) {
            joined.append(',');
          }
          joined.append(item);
        }
        target.put(composite, joined.toString());
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
