package ca.gc.cra.feedback.application.port;

import ca.gc.cra.feedback.domain.feedback.RawFeedbackRecord;

/**
 * <strong>What:</strong> Domain port persisting the unmodified feedback event.
 * <p><strong>Role:</strong> Output port; the first durable write of every message.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write atomically: either the whole row is stored or nothing changes.</li>
 *   <li>Stay idempotent per {@code feedback_id}: re-applying the same event is not an error.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent calls, including two
 * concurrent deliveries of the same {@code feedback_id}.</p>
 *
 * @since 0.1.0
 */
public interface RawStore extends AutoCloseable {
  /**
   * Inserts the record or updates the existing row sharing its {@code feedback_id}.
   *
   * @param record raw row to persist
   * @throws StorageException on timeout, constraint violation, or connectivity loss; always retryable
   */
  void upsert(RawFeedbackRecord record) throws StorageException;

  @Override
  default void close() throws Exception {}
}
