package ca.gc.cra.feedback.domain.feedback;

import java.util.Optional;

/**
 * Closed set of topics a feedback comment can be tagged with.
 *
 * @since 0.1.0
 */
public enum Topic {
  BILLING,
  UI_UX,
  PERFORMANCE,
  FEATURE_REQUEST;

  /**
   * Resolves a topic from its exact constant name.
   *
   * @param name candidate name; matching is case-sensitive
   * @return matching topic, or empty when {@code name} is {@code null} or not an allowed topic
   */
  public static Optional<Topic> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    for (Topic topic : values()) {
      if (topic.name().equals(name)) {
        return Optional.of(topic);
      }
    }
    return Optional.empty();
  }
}
