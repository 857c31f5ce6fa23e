package ca.gc.cra.feedback.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor services for the message worker pool.
 */
public final class ExecutorFactories {
  private static final String DEFAULT_PREFIX = "feedback-worker";

  private ExecutorFactories() {}

  /**
   * Builds a fixed pool of non-daemon workers named {@code <prefix>-<n>}.
   *
   * <p>Queued tasks are unbounded; the coordinator caps in-flight deliveries with its own semaphore,
   * so a task handed over while a worker is still returning to the pool waits instead of being
   * rejected. Submissions after {@code shutdown()} are rejected.</p>
   *
   * @param size worker thread count; must be positive
   * @param prefix thread-name prefix; blank selects {@code feedback-worker}
   * @param handler installed on every worker thread; may be {@code null}
   * @return running executor
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("worker pool size must be positive (was " + size + ")");
    }
    String name = prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix.trim();
    return Executors.newFixedThreadPool(size, new WorkerThreadFactory(name, handler));
  }

  private static final class WorkerThreadFactory implements ThreadFactory {
    private final String prefix;
    private final UncaughtExceptionHandler handler;
    private final AtomicInteger next = new AtomicInteger();

    WorkerThreadFactory(String prefix, UncaughtExceptionHandler handler) {
      this.prefix = prefix;
      this.handler = handler;
    }

    @Override
    public Thread newThread(Runnable task) {
      Thread worker = new Thread(task, prefix + "-" + next.getAndIncrement());
      worker.setDaemon(false);
      if (handler != null) {
        worker.setUncaughtExceptionHandler(handler);
      }
      return worker;
    }
  }
}
