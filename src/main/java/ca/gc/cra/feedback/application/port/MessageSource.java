package ca.gc.cra.feedback.application.port;

import ca.gc.cra.feedback.domain.queue.AckToken;
import ca.gc.cra.feedback.domain.queue.MessageHandle;
import java.util.List;

/**
 * <strong>What:</strong> Domain port over a pull-based, at-least-once delivery queue.
 * <p><strong>Role:</strong> Input port on the consume side of the feedback pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return batches of deliveries, possibly fewer than requested and possibly none.</li>
 *   <li>Suppress redelivery once a delivery is acknowledged.</li>
 *   <li>Trigger near-immediate redelivery when a delivery is released.</li>
 * </ul>
 * <p><strong>Delivery:</strong> At-least-once with no ordering guarantee within or across batches;
 * every pulled handle may duplicate an event already seen.</p>
 * <p><strong>Thread-safety:</strong> {@link #pull(int)} is called from the single coordinator thread;
 * {@link #acknowledge(AckToken)} and {@link #release(AckToken)} are called concurrently from workers.</p>
 * <p><strong>Observability:</strong> Adapters should emit {@code queue.*} metrics for commit or
 * settlement failures.</p>
 *
 * @since 0.1.0
 */
public interface MessageSource extends AutoCloseable {
  /**
   * Pulls up to {@code maxCount} deliveries.
   *
   * @param maxCount maximum number of handles to return; must be positive
   * @return handles in no particular order; never {@code null}, possibly empty
   * @throws Exception when the transport fails; the caller backs off and retries
   */
  List<MessageHandle> pull(int maxCount) throws Exception;

  /**
   * Marks a delivery as permanently processed.
   *
   * <p>Settling a token twice, or after its lease expired, is a no-op and must not throw.</p>
   *
   * @param token token of the delivery to acknowledge
   */
  void acknowledge(AckToken token);

  /**
   * Releases a delivery for immediate redelivery (redelivery deadline of zero).
   *
   * <p>Settling a token twice, or after its lease expired, is a no-op and must not throw.</p>
   *
   * @param token token of the delivery to release
   */
  void release(AckToken token);

  /**
   * Flushes outstanding settlements and releases transport resources.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  default void close() throws Exception {}
}
