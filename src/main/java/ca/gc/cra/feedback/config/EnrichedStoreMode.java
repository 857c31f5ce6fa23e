package ca.gc.cra.feedback.config;

import java.util.Locale;

/**
 * Destination of analytical records.
 */
public enum EnrichedStoreMode {
  /** Rows appended to a JDBC table. */
  JDBC,
  /** JSON documents published to a Kafka topic. */
  KAFKA;

  /**
   * Parses a case-insensitive mode name.
   *
   * @param value raw value; blank selects {@link #JDBC}
   * @return parsed mode
   * @throws IllegalArgumentException for unknown names
   */
  public static EnrichedStoreMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return JDBC;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("enrichedStore must be JDBC or KAFKA (was " + value + ")", ex);
    }
  }
}
