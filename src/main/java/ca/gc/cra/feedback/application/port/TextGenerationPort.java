package ca.gc.cra.feedback.application.port;

/**
 * Port to an external text-generation model.
 *
 * <p>Replies are untrusted free text; callers validate whatever they parse out of them.
 * Implementations must be safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public interface TextGenerationPort extends AutoCloseable {
  /**
   * Sends one prompt and returns the model's reply text.
   *
   * @param prompt fully formatted prompt
   * @return reply text; may be blank
   * @throws TextGenerationException when the call fails, times out, or the reply carries no text
   */
  String generate(String prompt) throws TextGenerationException;

  @Override
  default void close() throws Exception {}
}
