package ca.gc.cra.feedback.application.json;

import ca.gc.cra.feedback.domain.feedback.FeedbackEvent;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes UTF-8 JSON queue payloads into {@link FeedbackEvent} values.
 *
 * <p>Expected shape: {@code {"feedback_id": str, "user_id": str, "timestamp": str, "comment": str}}.
 * Unknown fields are ignored. {@code feedback_id} and {@code comment} must be non-blank strings.</p>
 */
public final class FeedbackEventDecoder {
  static final String FEEDBACK_ID = "feedback_id";
  static final String USER_ID = "user_id";
  static final String TIMESTAMP = "timestamp";
  static final String COMMENT = "comment";

  private final JsonSupport json;

  public FeedbackEventDecoder() {
    this(new JsonSupport());
  }

  public FeedbackEventDecoder(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Decodes a raw payload.
   *
   * @param payload message bytes
   * @return decoded event
   * @throws MalformedPayloadException when the bytes are not UTF-8 JSON of the expected shape
   */
  public FeedbackEvent decode(byte[] payload) throws MalformedPayloadException {
    if (payload == null || payload.length == 0) {
      throw new MalformedPayloadException("Payload is empty");
    }
    String text;
    try {
      text = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(payload))
          .toString();
    } catch (CharacterCodingException ex) {
      throw new MalformedPayloadException("Payload is not valid UTF-8", ex);
    }

    Map<String, Object> fields;
    try {
      fields = json.parseObject(text);
    } catch (IllegalArgumentException ex) {
      throw new MalformedPayloadException("Payload is not a JSON object: " + ex.getMessage(), ex);
    }

    String feedbackId = requiredString(fields, FEEDBACK_ID);
    String comment = requiredString(fields, COMMENT);
    String userId = textOf(fields.get(USER_ID));
    String timestamp = textOf(fields.get(TIMESTAMP));
    return new FeedbackEvent(feedbackId, userId, timestamp, comment);
  }

  private static String requiredString(Map<String, Object> fields, String name)
      throws MalformedPayloadException {
    Object value = fields.get(name);
    if (!(value instanceof String s)) {
      throw new MalformedPayloadException("Missing or non-string field '" + name + "'");
    }
    if (s.isBlank()) {
      throw new MalformedPayloadException("Field '" + name + "' is blank");
    }
    return s;
  }

  private String textOf(Object value) {
    if (value == null) {
      return "";
    }
    return value instanceof String s ? s : json.write(value);
  }
}
