package ca.gc.cra.feedback.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ShutdownSignalTest {

  @Test
  void requestIsIdempotent() {
    ShutdownSignal signal = new ShutdownSignal();
    assertTrue(signal.request());
    assertFalse(signal.request());
    assertTrue(signal.isRequested());
  }

  @Test
  void awaitTimesOutWhenNotRequested() throws InterruptedException {
    assertFalse(new ShutdownSignal().await(Duration.ofMillis(20)));
  }

  @Test
  void wakingSleeperReturnsEarlyOnRequest() throws Exception {
    ShutdownSignal signal = new ShutdownSignal();
    Sleeper sleeper = Sleeper.wakingOn(signal);
    long start = System.nanoTime();
    CompletableFuture<Void> sleeping = CompletableFuture.runAsync(() -> {
      try {
        sleeper.sleep(Duration.ofSeconds(30));
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      }
    });
    Thread.sleep(50);
    signal.request();
    sleeping.get(5, TimeUnit.SECONDS);
    assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(5));
  }
}
