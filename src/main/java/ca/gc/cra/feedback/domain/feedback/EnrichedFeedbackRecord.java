package ca.gc.cra.feedback.domain.feedback;

import java.time.Instant;
import java.util.Objects;

/**
 * Analytical row appended to the enriched store.
 *
 * @param feedbackId logical key of the analysed event; not unique in the enriched store
 * @param result validated enrichment result (genuine or fallback)
 * @param analyzedAt time the analysis completed
 * @since 0.1.0
 */
public record EnrichedFeedbackRecord(String feedbackId, EnrichmentResult result, Instant analyzedAt) {
  public EnrichedFeedbackRecord {
    Objects.requireNonNull(feedbackId, "feedbackId");
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(analyzedAt, "analyzedAt");
  }
}
