package ca.gc.cra.feedback.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Pause abstraction used by the coordinator between pulls.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Sleeper {
  /**
   * Pauses the calling thread.
   *
   * @param duration requested pause; implementations may return early
   * @throws InterruptedException if interrupted while paused
   */
  void sleep(Duration duration) throws InterruptedException;

  /**
   * Returns a sleeper that wakes as soon as {@code signal} is tripped.
   *
   * @param signal shutdown signal to observe
   * @return production sleeper
   */
  static Sleeper wakingOn(ShutdownSignal signal) {
    Objects.requireNonNull(signal, "signal");
    return signal::await;
  }
}
