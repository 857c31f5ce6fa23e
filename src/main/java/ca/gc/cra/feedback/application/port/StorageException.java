package ca.gc.cra.feedback.application.port;

/**
 * Signals that a durable write failed.
 *
 * <p>Transient and permanent causes are not distinguished; the pipeline treats every storage
 * failure as retryable and releases the message.</p>
 *
 * @since 0.1.0
 */
public class StorageException extends Exception {
  private static final long serialVersionUID = 1L;

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
