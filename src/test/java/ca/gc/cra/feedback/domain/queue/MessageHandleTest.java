package ca.gc.cra.feedback.domain.queue;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MessageHandleTest {
  private static final AckToken TOKEN = new AckToken() {};

  @Test
  void payloadIsCopiedOnTheWayInAndOut() {
    byte[] bytes = {1, 2, 3};
    MessageHandle handle = new MessageHandle(bytes, TOKEN);
    bytes[0] = 9;
    handle.payload()[1] = 9;
    assertArrayEquals(new byte[] {1, 2, 3}, handle.payload());
  }

  @Test
  void equalityUsesPayloadContent() {
    assertEquals(new MessageHandle(new byte[] {4}, TOKEN), new MessageHandle(new byte[] {4}, TOKEN));
    assertTrue(new MessageHandle(new byte[] {4}, TOKEN).toString().contains("payloadBytes=1"));
  }
}
