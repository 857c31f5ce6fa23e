package ca.gc.cra.feedback.domain.feedback;

import java.util.Optional;

/**
 * Overall sentiment assigned to a feedback comment by the enrichment step.
 *
 * @since 0.1.0
 */
public enum Sentiment {
  POSITIVE,
  NEGATIVE,
  NEUTRAL;

  /**
   * Resolves a sentiment from its exact constant name.
   *
   * @param name candidate name; matching is case-sensitive
   * @return matching sentiment, or empty when {@code name} is {@code null} or unknown
   */
  public static Optional<Sentiment> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    for (Sentiment sentiment : values()) {
      if (sentiment.name().equals(name)) {
        return Optional.of(sentiment);
      }
    }
    return Optional.empty();
  }
}
