package ca.gc.cra.feedback.config;

import java.io.IOException;
import java.io.Reader;
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
import java.util.stream.StreamSupport;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the pipeline YAML file into the flat {@code key=value} shape the CLI uses.
 *
 * <p>Layout:</p>
 * <pre>
 * common:            # applies to every command
 *   metricsExporter: none
 * consume:           # overrides common for the consume command
 *   kafkaBootstrap: [broker-1:9092, broker-2:9092]
 *   model:
 *     endpoint: https://...
 * </pre>
 * <p>Section names match case-insensitively. Nested mappings become dotted keys
 * ({@code model.endpoint}); scalar lists are joined with commas; {@code null} becomes an empty string.
 * Only plain YAML types are constructed.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and overlays the {@code mode} section on the {@code common} section.
   *
   * @param path YAML file
   * @param mode command name, e.g. {@code consume}
   * @return flattened settings, or empty when the file does not exist
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the document is not valid YAML or a section is not a mapping
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path + ": " + ex.getMessage(), ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<?, ?> root = requireMapping(document, "root");
    Map<String, String> settings = new LinkedHashMap<>();
    for (String name : List.of(COMMON_SECTION, section)) {
      Object body = section(root, name);
      if (body != null) {
        flattenInto(settings, "", requireMapping(body, name));
      }
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static Object section(Map<?, ?> root, String name) {
    return root.entrySet().stream()
        .filter(e -> e.getKey() instanceof String key && key.trim().toLowerCase(Locale.ROOT).equals(name))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(null);
  }

  private static Map<?, ?> requireMapping(Object node, String context) {
    if (node instanceof Map<?, ?> map) {
      return map;
    }
    throw new IllegalArgumentException(context + " section must be a mapping");
  }

  private static void flattenInto(Map<String, String> target, String prefix, Map<?, ?> node) {
    for (Map.Entry<?, ?> entry : node.entrySet()) {
      if (!(entry.getKey() instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException("YAML keys must be non-blank strings (under '" + prefix + "')");
      }
      String key = prefix.isEmpty() ? name.trim() : prefix + '.' + name.trim();
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flattenInto(target, key, nested);
      } else if (value instanceof Iterable<?> list) {
        target.put(key, joinScalars(key, list));
      } else {
        target.put(key, value == null ? "" : value.toString());
      }
    }
  }

  private static String joinScalars(String key, Iterable<?> list) {
    return StreamSupport.stream(list.spliterator(), false)
        .map(item -> {
          if (item == null || item instanceof Map<?, ?> || item instanceof Iterable<?>) {
            throw new IllegalArgumentException("YAML list for key " + key + " must contain scalars only");
          }
          return item.toString().trim();
        })
        .collect(Collectors.joining(","));
  }
}
