package ca.gc.cra.feedback.application.enrichment;

import ca.gc.cra.feedback.domain.feedback.EnrichmentResult;
import java.util.Objects;

/**
 * Outcome of interpreting one model reply: either a validated result or the reason it was rejected.
 *
 * @since 0.1.0
 */
public sealed interface ReplyParseResult
    permits ReplyParseResult.Parsed, ReplyParseResult.ParseFailure {

  /**
   * Collapses the outcome into a usable result, substituting the fallback on failure.
   *
   * @return parsed result, or {@link EnrichmentResult#fallback()}
   */
  EnrichmentResult orFallback();

  static ReplyParseResult parsed(EnrichmentResult result) {
    return new Parsed(result);
  }

  static ReplyParseResult failure(String reason) {
    return new ParseFailure(reason);
  }

  /** Reply was a JSON object; fields have been validated and normalized. */
  record Parsed(EnrichmentResult result) implements ReplyParseResult {
    public Parsed {
      Objects.requireNonNull(result, "result");
    }

    @Override
    public EnrichmentResult orFallback() {
      return result;
    }
  }

  /** Reply could not be used at all. */
  record ParseFailure(String reason) implements ReplyParseResult {
    public ParseFailure {
      reason = reason == null ? "unknown" : reason;
    }

    @Override
    public EnrichmentResult orFallback() {
      return EnrichmentResult.fallback();
    }
  }
}
