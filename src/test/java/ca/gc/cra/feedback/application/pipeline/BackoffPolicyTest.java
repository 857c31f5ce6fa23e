package ca.gc.cra.feedback.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Random;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

  @Test
  void doublesUntilCapped() {
    BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(5), Duration.ofSeconds(60), 0d);

    assertEquals(Duration.ofSeconds(5), policy.delayFor(1));
    assertEquals(Duration.ofSeconds(10), policy.delayFor(2));
    assertEquals(Duration.ofSeconds(40), policy.delayFor(4));
    assertEquals(Duration.ofSeconds(60), policy.delayFor(5));
    assertEquals(Duration.ofSeconds(60), policy.delayFor(500));
  }

  @Test
  void jitterOnlyShortensDelay() {
    BackoffPolicy policy =
        new BackoffPolicy(Duration.ofMillis(1000), Duration.ofMillis(1000), 0.5d, new Random(42));
    for (int i = 0; i < 50; i++) {
      long millis = policy.delayFor(3).toMillis();
      assertTrue(millis >= 500 && millis <= 1000, "delay " + millis);
    }
  }

  @Test
  void rejectsInvertedBoundsAndBadJitter() {
    assertThrows(IllegalArgumentException.class,
        () -> new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 0d));
    assertThrows(IllegalArgumentException.class,
        () -> new BackoffPolicy(Duration.ZERO, Duration.ofSeconds(1), 1.5d));
  }
}
