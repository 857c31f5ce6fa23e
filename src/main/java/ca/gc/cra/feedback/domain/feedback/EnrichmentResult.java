package ca.gc.cra.feedback.domain.feedback;

import java.util.List;
import java.util.Objects;

/**
 * Validated outcome of analysing one feedback comment.
 *
 * <p>Invariants: {@code sentiment} is never {@code null}; {@code topics} is immutable, holds no
 * {@code null} entries and at most {@link #MAX_TOPICS} elements, in the order supplied.</p>
 *
 * @param sentiment overall sentiment
 * @param topics ordered topics, at most three
 * @since 0.1.0
 */
public record EnrichmentResult(Sentiment sentiment, List<Topic> topics) {
  /** Maximum number of topics retained per comment. */
  public static final int MAX_TOPICS = 3;

  private static final EnrichmentResult FALLBACK = new EnrichmentResult(Sentiment.NEUTRAL, List.of());

  public EnrichmentResult {
    Objects.requireNonNull(sentiment, "sentiment");
    topics = List.copyOf(Objects.requireNonNull(topics, "topics"));
    if (topics.size() > MAX_TOPICS) {
      throw new IllegalArgumentException(
          "topics must hold at most " + MAX_TOPICS + " entries (was " + topics.size() + ")");
    }
  }

  /**
   * Returns the substitute result used whenever a comment cannot be analysed.
   *
   * @return {@code {NEUTRAL, []}}
   */
  public static EnrichmentResult fallback() {
    return FALLBACK;
  }

  /**
   * Indicates whether this result equals the fallback value.
   *
   * @return {@code true} for {@code {NEUTRAL, []}}
   */
  public boolean isFallback() {
    return FALLBACK.equals(this);
  }
}
