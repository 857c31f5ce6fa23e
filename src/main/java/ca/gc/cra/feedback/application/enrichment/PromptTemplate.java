package ca.gc.cra.feedback.application.enrichment;

import ca.gc.cra.feedback.domain.feedback.Sentiment;
import ca.gc.cra.feedback.domain.feedback.Topic;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fixed instruction sent to the model for every comment. The comment is embedded verbatim.
 */
public final class PromptTemplate {
  private static final String TEMPLATE = String.join("\n",
      "Analyze the following customer feedback and return a JSON response with sentiment and topics.",
      "",
      "Sentiment options: %s",
      "Topic options: %s",
      "",
      "Input: %s",
      "",
      "Output JSON format:",
      "{",
      "    \"sentiment\": \"<%s>\",",
      "    \"topics\": [\"<topic1>\", \"<topic2>\", \"<topic3>\"]",
      "}",
      "",
      "Return only the JSON response, no additional text.");

  private PromptTemplate() {
    // Utility
  }

  /**
   * Builds the prompt for one comment.
   *
   * @param comment feedback text; never {@code null}
   * @return prompt text
   */
  public static String format(String comment) {
    Objects.requireNonNull(comment, "comment");
    String sentiments = join(Sentiment.values(), ", ");
    String topics = join(Topic.values(), ", ");
    return String.format(TEMPLATE, sentiments, topics, comment, join(Sentiment.values(), "|"));
  }

  private static String join(Enum<?>[] values, String delimiter) {
    return Arrays.stream(values).map(Enum::name).collect(Collectors.joining(delimiter));
  }
}
