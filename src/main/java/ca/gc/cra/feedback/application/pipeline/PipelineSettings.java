package ca.gc.cra.feedback.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Coordinator tuning.
 *
 * @param batchSize maximum handles requested per pull
 * @param workers worker pool size and in-flight bound
 * @param idleDelay pause after an empty pull
 * @since 0.1.0
 */
public record PipelineSettings(int batchSize, int workers, Duration idleDelay) {
  public static final int DEFAULT_BATCH_SIZE = 10;
  public static final int DEFAULT_WORKERS = 10;
  public static final Duration DEFAULT_IDLE_DELAY = Duration.ofSeconds(1);

  public PipelineSettings {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    Objects.requireNonNull(idleDelay, "idleDelay");
    if (idleDelay.isNegative()) {
      throw new IllegalArgumentException("idleDelay must not be negative");
    }
  }

  public static PipelineSettings defaults() {
    return new PipelineSettings(DEFAULT_BATCH_SIZE, DEFAULT_WORKERS, DEFAULT_IDLE_DELAY);
  }
}
