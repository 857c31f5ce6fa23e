package ca.gc.cra.feedback.application.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Capped exponential backoff with downward jitter for repeated pull failures.
 *
 * <p>For the {@code n}-th consecutive failure the base delay is {@code min(maxDelay, minDelay * 2^(n-1))},
 * then scaled by a random factor in {@code [1 - jitter, 1]}.</p>
 *
 * @since 0.1.0
 */
public final class BackoffPolicy {
  private final Duration minDelay;
  private final Duration maxDelay;
  private final double jitter;
  private final Random random;

  public BackoffPolicy(Duration minDelay, Duration maxDelay, double jitter) {
    this(minDelay, maxDelay, jitter, new Random());
  }

  public BackoffPolicy(Duration minDelay, Duration maxDelay, double jitter, Random random) {
    this.minDelay = Objects.requireNonNull(minDelay, "minDelay");
    this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    this.random = Objects.requireNonNull(random, "random");
    if (minDelay.isNegative()) {
      throw new IllegalArgumentException("minDelay must not be negative");
    }
    if (maxDelay.compareTo(minDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= minDelay");
    }
    if (Double.isNaN(jitter) || jitter < 0d || jitter > 1d) {
      throw new IllegalArgumentException("jitter must be within [0,1]");
    }
    this.jitter = jitter;
  }

  /**
   * Computes the pause before the next attempt.
   *
   * @param consecutiveFailures failures in the current streak; values below 1 are treated as 1
   * @return non-negative delay
   */
  public Duration delayFor(int consecutiveFailures) {
    int exponent = Math.max(0, consecutiveFailures - 1);
    long minMillis = minDelay.toMillis();
    long maxMillis = maxDelay.toMillis();
    long base;
    if (exponent >= 62 || (minMillis > 0 && minMillis > (maxMillis >> exponent))) {
      base = maxMillis;
    } else {
      base = Math.min(maxMillis, minMillis << exponent);
    }
    double factor = 1d - jitter * random.nextDouble();
    return Duration.ofMillis(Math.max(0L, Math.round(base * factor)));
  }

  public Duration minDelay() {
    return minDelay;
  }

  public Duration maxDelay() {
    return maxDelay;
  }

  public double jitter() {
    return jitter;
  }
}
