package ca.gc.cra.feedback.application.port;

import ca.gc.cra.feedback.domain.feedback.EnrichedFeedbackRecord;

/**
 * <strong>What:</strong> Domain port appending analytical rows.
 * <p><strong>Role:</strong> Output port; written only after the raw store succeeded.</p>
 * <p><strong>Semantics:</strong> Append-only, one row per call, no deduplication key. Repeated
 * success for the same {@code feedback_id} produces duplicate rows.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent calls.</p>
 *
 * @since 0.1.0
 */
public interface EnrichedStore extends AutoCloseable {
  /**
   * Appends one analytical row.
   *
   * @param record row to append
   * @throws StorageException when the write fails or the store rejects the row
   */
  void append(EnrichedFeedbackRecord record) throws StorageException;

  @Override
  default void close() throws Exception {}
}
