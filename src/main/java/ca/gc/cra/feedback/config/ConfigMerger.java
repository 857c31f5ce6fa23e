package ca.gc.cra.feedback.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {
  private static final String[] REQUIRED_FOR_CONSUME = {"kafkaBootstrap", "jdbcUrl", "modelEndpoint"};

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active pipeline mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (!"consume".equalsIgnoreCase(mode.trim())) {
      return;
    }
    for (String key : REQUIRED_FOR_CONSUME) {
      if (trim(effective.get(key)).isEmpty()) {
        throw new IllegalArgumentException(key + " is required for " + mode);
      }
    }
    long min = parseLong(effective, "backoffMinMs");
    long max = parseLong(effective, "backoffMaxMs");
    if (min >= 0 && max >= 0 && max < min) {
      throw new IllegalArgumentException("backoffMaxMs must be >= backoffMinMs");
    }
    if ("KAFKA".equalsIgnoreCase(trim(effective.get("enrichedStore")))
        && trim(effective.get("enrichedTopic")).isEmpty()) {
      throw new IllegalArgumentException("enrichedTopic is required when enrichedStore=KAFKA");
    }
  }

  private static long parseLong(Map<String, String> effective, String key) {
    String raw = trim(effective.get(key));
    if (raw.isEmpty()) {
      return -1L;
    }
    try {
      return Long.parseLong(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
