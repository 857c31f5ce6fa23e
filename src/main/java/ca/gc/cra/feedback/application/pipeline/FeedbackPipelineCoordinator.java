package ca.gc.cra.feedback.application.pipeline;

import ca.gc.cra.feedback.application.port.MessageSource;
import ca.gc.cra.feedback.application.port.MetricsPort;
import ca.gc.cra.feedback.domain.queue.MessageHandle;
import ca.gc.cra.feedback.infrastructure.exec.ExecutorFactories;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Pull loop that feeds deliveries to a bounded worker pool.
 * <p><strong>Role:</strong> Application use case driving the consume pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pull at most {@code batchSize} handles and never more than the free worker slots.</li>
 *   <li>Back off after pull failures and pause after empty pulls.</li>
 *   <li>Stop pulling once the {@link ShutdownSignal} trips, release undispatched handles, and wait
 *   for in-flight handles to finish.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #run()} may be active on one thread at a time.</p>
 * <p><strong>Observability:</strong> Emits {@code pipeline.pull.batch} and {@code pipeline.pull.failure};
 * logs each received batch at INFO.</p>
 *
 * @since 0.1.0
 */
public final class FeedbackPipelineCoordinator {
  private static final Logger log = LoggerFactory.getLogger(FeedbackPipelineCoordinator.class);
  private static final String WORKER_PREFIX = "feedback-worker";
  private static final Duration TERMINATION_LOG_INTERVAL = Duration.ofSeconds(5);

  private final MessageSource source;
  private final FeedbackMessageHandler handler;
  private final PipelineSettings settings;
  private final BackoffPolicy backoff;
  private final Sleeper sleeper;
  private final ShutdownSignal signal;
  private final MetricsPort metrics;
  private final AtomicReference<Thread> runThread = new AtomicReference<>();

  public FeedbackPipelineCoordinator(
      MessageSource source,
      FeedbackMessageHandler handler,
      PipelineSettings settings,
      BackoffPolicy backoff,
      Sleeper sleeper,
      ShutdownSignal signal,
      MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    this.signal = Objects.requireNonNull(signal, "signal");
    this.sleeper = sleeper == null ? Sleeper.wakingOn(signal) : sleeper;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Runs until shutdown is requested or the calling thread is interrupted. Returns only after every
   * dispatched handle has reached a terminal state.
   *
   * @return loop counters
   */
  public RunSummary run() {
    if (!runThread.compareAndSet(null, Thread.currentThread())) {
      throw new IllegalStateException("Coordinator already running");
    }
    MDC.put("pipeline", "consume");
    UncaughtExceptionHandler uncaught =
        (thread, ex) -> log.error("Worker {} terminated unexpectedly", thread.getName(), ex);
    ExecutorService pool = ExecutorFactories.newWorkerPool(settings.workers(), WORKER_PREFIX, uncaught);
    Semaphore slots = new Semaphore(settings.workers());
    long batches = 0;
    long dispatched = 0;
    long releasedUndispatched = 0;
    long pullFailures = 0;
    int failureStreak = 0;
    log.info("Feedback pipeline started with batchSize={} workers={}", settings.batchSize(), settings.workers());
    try {
      while (!signal.isRequested() && !Thread.currentThread().isInterrupted()) {
        slots.acquire();
        int free = 1 + slots.drainPermits();
        if (signal.isRequested()) {
          slots.release(free);
          break;
        }
        int request = Math.min(settings.batchSize(), free);

        List<MessageHandle> batch;
        try {
          batch = source.pull(request);
        } catch (InterruptedException ie) {
          slots.release(free);
          Thread.currentThread().interrupt();
          break;
        } catch (Exception ex) {
          slots.release(free);
          failureStreak++;
          pullFailures++;
          metrics.increment("pipeline.pull.failure");
          Duration delay = backoff.delayFor(failureStreak);
          log.warn("Pull failed ({} consecutive); retrying in {} ms", failureStreak, delay.toMillis(), ex);
          sleeper.sleep(delay);
          continue;
        }
        failureStreak = 0;
        if (batch == null || batch.isEmpty()) {
          slots.release(free);
          sleeper.sleep(settings.idleDelay());
          continue;
        }

        int accepted = Math.min(batch.size(), request);
        if (accepted < free) {
          slots.release(free - accepted);
        }
        batches++;
        metrics.observe("pipeline.pull.batch", batch.size());
        log.info("Received {} messages", batch.size());

        for (int i = 0; i < batch.size(); i++) {
          MessageHandle handle = batch.get(i);
          if (i >= accepted) {
            log.warn("Source returned {} handles for a pull of {}; releasing surplus", batch.size(), request);
            releaseQuietly(handle);
            releasedUndispatched++;
            continue;
          }
          if (signal.isRequested()) {
            releaseQuietly(handle);
            slots.release();
            releasedUndispatched++;
            continue;
          }
          try {
            pool.execute(() -> {
              try {
                handler.handle(handle);
              } finally {
                slots.release();
              }
            });
            dispatched++;
          } catch (RejectedExecutionException rejected) {
            log.error("Worker pool rejected a delivery; releasing it", rejected);
            releaseQuietly(handle);
            slots.release();
            releasedUndispatched++;
          }
        }
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.info("Feedback pipeline interrupted; stopping");
    } finally {
      awaitWorkers(pool);
      runThread.set(null);
      MDC.remove("pipeline");
    }

    if (releasedUndispatched > 0) {
      log.info("Released {} undispatched messages during shutdown", releasedUndispatched);
    }
    log.info("Feedback pipeline stopped after {} batches and {} messages", batches, dispatched);
    return new RunSummary(batches, dispatched, releasedUndispatched, pullFailures);
  }

  private void releaseQuietly(MessageHandle handle) {
    try {
      source.release(handle.ackToken());
    } catch (RuntimeException ex) {
      metrics.increment("pipeline.release.failure");
      log.warn("Failed to release undispatched message", ex);
    }
  }

  private void awaitWorkers(ExecutorService pool) {
    pool.shutdown();
    boolean interrupted = false;
    while (true) {
      try {
        if (pool.awaitTermination(TERMINATION_LOG_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
          break;
        }
        log.info("Waiting for in-flight messages to finish");
      } catch (InterruptedException ie) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }
}
