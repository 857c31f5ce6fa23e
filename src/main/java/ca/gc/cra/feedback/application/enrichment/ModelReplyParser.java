package ca.gc.cra.feedback.application.enrichment;

import ca.gc.cra.feedback.application.json.JsonSupport;
import ca.gc.cra.feedback.domain.feedback.EnrichmentResult;
import ca.gc.cra.feedback.domain.feedback.Sentiment;
import ca.gc.cra.feedback.domain.feedback.Topic;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validates free-text model replies against the closed sentiment and topic vocabularies.
 *
 * <p>The trimmed reply must be a JSON object. An unknown, missing or non-string {@code sentiment}
 * becomes {@link Sentiment#NEUTRAL}. A missing or non-array {@code topics} becomes empty; otherwise
 * only exact, allowed topic names survive, in reply order, capped at
 * {@link EnrichmentResult#MAX_TOPICS}. Duplicates are kept as returned.</p>
 */
public final class ModelReplyParser {
  private final JsonSupport json;

  public ModelReplyParser() {
    this(new JsonSupport());
  }

  public ModelReplyParser(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Interprets a reply.
   *
   * @param reply raw model text; may be {@code null}
   * @return {@link ReplyParseResult.Parsed} or {@link ReplyParseResult.ParseFailure}
   */
  public ReplyParseResult parse(String reply) {
    if (reply == null || reply.isBlank()) {
      return ReplyParseResult.failure("blank reply");
    }
    Map<String, Object> fields;
    try {
      fields = json.parseObject(reply.trim());
    } catch (IllegalArgumentException ex) {
      return ReplyParseResult.failure(ex.getMessage());
    }
    Sentiment sentiment = sentimentOf(fields.get("sentiment"));
    List<Topic> topics = topicsOf(fields.get("topics"));
    return ReplyParseResult.parsed(new EnrichmentResult(sentiment, topics));
  }

  private static Sentiment sentimentOf(Object value) {
    if (value instanceof String name) {
      return Sentiment.fromName(name).orElse(Sentiment.NEUTRAL);
    }
    return Sentiment.NEUTRAL;
  }

  private static List<Topic> topicsOf(Object value) {
    if (!(value instanceof List<?> items)) {
      return List.of();
    }
    List<Topic> topics = new ArrayList<>(EnrichmentResult.MAX_TOPICS);
    for (Object item : items) {
      if (topics.size() == EnrichmentResult.MAX_TOPICS) {
        break;
      }
      if (item instanceof String name) {
        Optional<Topic> topic = Topic.fromName(name);
        topic.ifPresent(topics::add);
      }
    }
    return topics;
  }
}
