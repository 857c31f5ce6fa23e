package ca.gc.cra.feedback.application.port;

/**
 * Signals that a text-generation call failed or returned no usable text.
 *
 * @since 0.1.0
 */
public class TextGenerationException extends Exception {
  private static final long serialVersionUID = 1L;

  public TextGenerationException(String message) {
    super(message);
  }

  public TextGenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
