package ca.gc.cra.feedback.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * String validation helpers for configuration values such as topic and group names.
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");
  private static final int MAX_TOPIC_LENGTH = 249;
  private static final Pattern TABLE_PATTERN =
      Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?$");

  private Strings() {
    // Utility
  }

  /**
   * Trims {@code value} and rejects blank input or control characters.
   *
   * @param name label used in error messages
   * @param value raw value
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if blank or containing control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic or consumer group name.
   *
   * @param name label used in error messages
   * @param topic raw value
   * @return trimmed value
   * @throws IllegalArgumentException if the name uses characters Kafka rejects or is too long
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (sanitized.length() > MAX_TOPIC_LENGTH) {
      throw new IllegalArgumentException(message(name, "length must be <= " + MAX_TOPIC_LENGTH));
    }
    if (!TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Validates an unquoted SQL table name, optionally schema-qualified ({@code schema.table}).
   *
   * @param name label used in error messages
   * @param table raw value
   * @return trimmed value, safe to splice into a statement
   * @throws IllegalArgumentException if the name is not a plain identifier
   */
  public static String requireTableName(String name, String table) {
    String sanitized = requireNonBlank(name, table);
    if (!TABLE_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name, "must be a plain SQL identifier (was " + sanitized + ")"));
    }
    return sanitized;
  }

  /**
   * Returns the trimmed value, or an empty string for {@code null}.
   *
   * @param value raw value
   * @return trimmed value, never {@code null}
   */
  public static String trimToEmpty(String value) {
    return value == null ? "" : value.trim();
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
