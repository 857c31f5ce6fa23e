package ca.gc.cra.feedback.domain.feedback;

import java.time.Instant;
import java.util.Objects;

/**
 * Row written to the raw store: the event exactly as submitted plus the time the pipeline received it.
 *
 * @param event submitted feedback event
 * @param receivedAt pipeline-assigned receipt time
 * @since 0.1.0
 */
public record RawFeedbackRecord(FeedbackEvent event, Instant receivedAt) {
  public RawFeedbackRecord {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(receivedAt, "receivedAt");
  }

  public String feedbackId() {
    return event.feedbackId();
  }
}
