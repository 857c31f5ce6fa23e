package ca.gc.cra.feedback.domain.feedback;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class FeedbackEventTest {

  @Test
  void absentOptionalFieldsBecomeEmpty() {
    FeedbackEvent event = new FeedbackEvent("fb-1", null, null, "Great app");
    assertEquals("", event.userId());
    assertEquals("", event.timestamp());
  }

  @Test
  void rejectsBlankIdentifierAndComment() {
    assertThrows(IllegalArgumentException.class, () -> new FeedbackEvent(" ", "u", "t", "c"));
    assertThrows(IllegalArgumentException.class, () -> new FeedbackEvent("fb-1", "u", "t", "  "));
    assertThrows(NullPointerException.class, () -> new FeedbackEvent(null, "u", "t", "c"));
  }

  @Test
  void rawRecordExposesFeedbackId() {
    FeedbackEvent event = new FeedbackEvent("fb-9", "u-1", "2024-05-01T10:00:00Z", "Slow");
    RawFeedbackRecord record = new RawFeedbackRecord(event, Instant.EPOCH);
    assertEquals("fb-9", record.feedbackId());
  }
}
