package ca.gc.cra.feedback.application.json;

/**
 * Raised when a queue payload cannot be decoded into a feedback event.
 */
public final class MalformedPayloadException extends Exception {
  private static final long serialVersionUID = 1L;

  public MalformedPayloadException(String message) {
    super(message);
  }

  public MalformedPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
