package ca.gc.cra.feedback.domain.feedback;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class EnrichmentResultTest {

  @Test
  void fallbackIsNeutralWithoutTopics() {
    EnrichmentResult fallback = EnrichmentResult.fallback();
    assertEquals(Sentiment.NEUTRAL, fallback.sentiment());
    assertTrue(fallback.topics().isEmpty());
    assertTrue(fallback.isFallback());
  }

  @Test
  void neutralWithoutTopicsFromModelEqualsFallback() {
    assertTrue(new EnrichmentResult(Sentiment.NEUTRAL, List.of()).isFallback());
    assertFalse(new EnrichmentResult(Sentiment.NEUTRAL, List.of(Topic.BILLING)).isFallback());
  }

  @Test
  void rejectsMoreThanThreeTopics() {
    List<Topic> four = List.of(Topic.BILLING, Topic.UI_UX, Topic.PERFORMANCE, Topic.FEATURE_REQUEST);
    assertThrows(IllegalArgumentException.class, () -> new EnrichmentResult(Sentiment.POSITIVE, four));
  }

  @Test
  void keepsDuplicateTopicsInOrder() {
    EnrichmentResult result =
        new EnrichmentResult(Sentiment.NEGATIVE, List.of(Topic.BILLING, Topic.BILLING, Topic.UI_UX));
    assertEquals(List.of(Topic.BILLING, Topic.BILLING, Topic.UI_UX), result.topics());
  }

  @Test
  void topicsAreCopiedDefensively() {
    List<Topic> topics = new ArrayList<>(List.of(Topic.PERFORMANCE));
    EnrichmentResult result = new EnrichmentResult(Sentiment.POSITIVE, topics);
    topics.add(Topic.BILLING);
    assertEquals(List.of(Topic.PERFORMANCE), result.topics());
  }

  @Test
  void namesMatchCaseSensitively() {
    assertEquals(Sentiment.POSITIVE, Sentiment.fromName("POSITIVE").orElseThrow());
    assertTrue(Sentiment.fromName("positive").isEmpty());
    assertEquals(Topic.UI_UX, Topic.fromName("UI_UX").orElseThrow());
    assertTrue(Topic.fromName("SHIPPING").isEmpty());
    assertTrue(Topic.fromName(null).isEmpty());
  }
}
