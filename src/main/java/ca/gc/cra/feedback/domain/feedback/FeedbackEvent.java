package ca.gc.cra.feedback.domain.feedback;

import java.util.Objects;

/**
 * Customer feedback event as emitted by the producer.
 *
 * <p>Immutable. The same logical event may be delivered several times; {@code feedbackId} is the
 * logical key used for idempotent raw persistence.</p>
 *
 * @param feedbackId non-blank logical key
 * @param userId submitting user; empty when the producer omitted it
 * @param timestamp producer-side ISO-8601 timestamp, carried verbatim
 * @param comment non-blank free-text comment of arbitrary length
 * @since 0.1.0
 */
public record FeedbackEvent(String feedbackId, String userId, String timestamp, String comment) {
  public FeedbackEvent {
    Objects.requireNonNull(feedbackId, "feedbackId");
    Objects.requireNonNull(comment, "comment");
    if (feedbackId.isBlank()) {
      throw new IllegalArgumentException("feedbackId must not be blank");
    }
    if (comment.isBlank()) {
      throw new IllegalArgumentException("comment must not be blank");
    }
    userId = userId == null ? "" : userId;
    timestamp = timestamp == null ? "" : timestamp;
  }
}
