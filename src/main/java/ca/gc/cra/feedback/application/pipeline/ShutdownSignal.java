package ca.gc.cra.feedback.application.pipeline;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token shared between the CLI shutdown hook and the coordinator loop.
 *
 * @since 0.1.0
 */
public final class ShutdownSignal {
  private final AtomicBoolean requested = new AtomicBoolean();
  private final CountDownLatch latch = new CountDownLatch(1);

  /**
   * Requests shutdown. Idempotent.
   *
   * @return {@code true} when this call flipped the signal
   */
  public boolean request() {
    if (requested.compareAndSet(false, true)) {
      latch.countDown();
      return true;
    }
    return false;
  }

  public boolean isRequested() {
    return requested.get();
  }

  /**
   * Waits up to {@code timeout} for shutdown to be requested.
   *
   * @param timeout maximum wait
   * @return {@code true} if shutdown was requested before the timeout elapsed
   * @throws InterruptedException if the calling thread is interrupted
   */
  public boolean await(Duration timeout) throws InterruptedException {
    if (timeout.isNegative() || timeout.isZero()) {
      return isRequested();
    }
    return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}
