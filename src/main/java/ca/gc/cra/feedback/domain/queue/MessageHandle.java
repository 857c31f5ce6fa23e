package ca.gc.cra.feedback.domain.queue;

import java.util.Arrays;
import java.util.Objects;

/**
 * One delivery attempt of a queued message.
 *
 * @param payload raw message bytes; defensively copied
 * @param ackToken capability used to acknowledge or release this delivery
 * @since 0.1.0
 */
public record MessageHandle(byte[] payload, AckToken ackToken) {
  public MessageHandle {
    payload = Objects.requireNonNull(payload, "payload").clone();
    Objects.requireNonNull(ackToken, "ackToken");
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof MessageHandle that)) {
      return false;
    }
    return Arrays.equals(payload, that.payload) && ackToken.equals(that.ackToken);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(payload) + ackToken.hashCode();
  }

  @Override
  public String toString() {
    return "MessageHandle[payloadBytes=" + payload.length + ", ackToken=" + ackToken + "]";
  }
}
