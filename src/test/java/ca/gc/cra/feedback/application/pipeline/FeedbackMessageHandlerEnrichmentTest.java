package ca.gc.cra.feedback.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.feedback.application.enrichment.ModelBackedEnricher;
import ca.gc.cra.feedback.application.json.FeedbackEventDecoder;
import ca.gc.cra.feedback.application.port.TextGenerationPort;
import ca.gc.cra.feedback.domain.feedback.EnrichedFeedbackRecord;
import ca.gc.cra.feedback.domain.feedback.Sentiment;
import ca.gc.cra.feedback.domain.feedback.Topic;
import ca.gc.cra.feedback.domain.queue.MessageHandle;
import ca.gc.cra.feedback.testutil.InMemoryEnrichedStore;
import ca.gc.cra.feedback.testutil.InMemoryRawStore;
import ca.gc.cra.feedback.testutil.RecordingMetricsPort;
import ca.gc.cra.feedback.testutil.ScriptedMessageSource;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Runs deliveries through the handler with the model-backed enricher over a scripted model reply. */
class FeedbackMessageHandlerEnrichmentTest {
  private static final String PAYLOAD = "{\"feedback_id\":\"fdbk-123\",\"comment\":\"slow dashboard\"}";

  private ScriptedMessageSource source;
  private InMemoryRawStore rawStore;
  private InMemoryEnrichedStore enrichedStore;
  private RecordingMetricsPort metrics;
  private List<String> prompts;

  @BeforeEach
  void setUp() {
    source = new ScriptedMessageSource();
    rawStore = new InMemoryRawStore();
    enrichedStore = new InMemoryEnrichedStore();
    metrics = new RecordingMetricsPort();
    prompts = new ArrayList<>();
  }

  @Test
  void validReplyIsStoredAndAcknowledgedOnce() {
    MessageHandle handle = deliver();

    ProcessingOutcome outcome = handle(handle, "{\"sentiment\":\"NEGATIVE\",\"topics\":[\"PERFORMANCE\",\"UI_UX\"]}");

    assertTrue(outcome.isAcked());
    assertTrue(rawStore.rows().containsKey("fdbk-123"));
    assertEquals("slow dashboard", rawStore.rows().get("fdbk-123").event().comment());
    assertStored(Sentiment.NEGATIVE, List.of(Topic.PERFORMANCE, Topic.UI_UX));
    assertEquals(Set.of(handle.ackToken()), source.acked());
    assertTrue(source.released().isEmpty());
    assertEquals(1, prompts.size());
    assertTrue(prompts.get(0).contains("slow dashboard"));
  }

  @Test
  void nonJsonReplyStoresFallbackAndStillAcknowledges() {
    MessageHandle handle = deliver();

    ProcessingOutcome outcome = handle(handle, "I think the user is unhappy about speed.");

    assertTrue(outcome.isAcked());
    assertStored(Sentiment.NEUTRAL, List.of());
    assertEquals(Set.of(handle.ackToken()), source.acked());
    assertEquals(1, metrics.count("enricher.fallback"));
  }

  @Test
  void rawStoreFailureSkipsTheModelAndReleases() {
    MessageHandle handle = deliver();
    rawStore.failWrites(true);

    ProcessingOutcome outcome = handle(handle, "{\"sentiment\":\"NEGATIVE\",\"topics\":[]}");

    assertEquals(ProcessingState.PARSED, outcome.releasedFrom());
    assertTrue(prompts.isEmpty());
    assertEquals(0, enrichedStore.attempts());
    assertEquals(Set.of(handle.ackToken()), source.released());
  }

  @Test
  void unknownSentimentIsCoercedToNeutralAndTopicsKept() {
    MessageHandle handle = deliver();

    ProcessingOutcome outcome = handle(handle, "{\"sentiment\":\"ANGRY\",\"topics\":[\"BILLING\"]}");

    assertTrue(outcome.isAcked());
    assertStored(Sentiment.NEUTRAL, List.of(Topic.BILLING));
    assertEquals(Set.of(handle.ackToken()), source.acked());
  }

  @Test
  void moreThanThreeTopicsAreTruncatedInOrder() {
    MessageHandle handle = deliver();

    ProcessingOutcome outcome = handle(handle,
        "{\"sentiment\":\"POSITIVE\",\"topics\":[\"BILLING\",\"UI_UX\",\"PERFORMANCE\",\"FEATURE_REQUEST\"]}");

    assertTrue(outcome.isAcked());
    assertStored(Sentiment.POSITIVE, List.of(Topic.BILLING, Topic.UI_UX, Topic.PERFORMANCE));
    assertEquals(Set.of(handle.ackToken()), source.acked());
  }

  @Test
  void enrichedStoreRejectionReleasesAfterRawWrite() {
    MessageHandle handle = deliver();
    enrichedStore.failWrites(true);

    ProcessingOutcome outcome = handle(handle, "{\"sentiment\":\"POSITIVE\",\"topics\":[]}");

    assertFalse(outcome.isAcked());
    assertEquals(ProcessingState.ENRICHED, outcome.releasedFrom());
    assertTrue(rawStore.rows().containsKey("fdbk-123"));
    assertTrue(source.acked().isEmpty());
    assertEquals(Set.of(handle.ackToken()), source.released());
  }

  private MessageHandle deliver() {
    return source.addRaw(PAYLOAD.getBytes(StandardCharsets.UTF_8));
  }

  private ProcessingOutcome handle(MessageHandle handle, String reply) {
    TextGenerationPort model = prompt -> {
      prompts.add(prompt);
      return reply;
    };
    FeedbackMessageHandler handler = new FeedbackMessageHandler(
        source, new FeedbackEventDecoder(), rawStore, new ModelBackedEnricher(model, metrics),
        enrichedStore, () -> 0L, metrics);
    return handler.handle(handle);
  }

  private void assertStored(Sentiment sentiment, List<Topic> topics) {
    assertEquals(1, enrichedStore.rows().size());
    EnrichedFeedbackRecord row = enrichedStore.rows().get(0);
    assertEquals("fdbk-123", row.feedbackId());
    assertEquals(sentiment, row.result().sentiment());
    assertEquals(topics, row.result().topics());
  }
}
