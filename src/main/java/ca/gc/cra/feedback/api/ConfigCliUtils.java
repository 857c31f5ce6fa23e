package ca.gc.cra.feedback.api;

import java.util.Map;

/**
 * Helpers for mixing CLI arguments with YAML configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config=} (or {@code --config=}) path from the CLI map.
   *
   * @param args mutable CLI map
   * @return trimmed path or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String found = null;
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (found == null && value != null && !value.isBlank()) {
        found = value.trim();
      }
    }
    return found;
  }
}
