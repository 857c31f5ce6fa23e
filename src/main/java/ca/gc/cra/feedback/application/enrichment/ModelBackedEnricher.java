package ca.gc.cra.feedback.application.enrichment;

import ca.gc.cra.feedback.application.port.Enricher;
import ca.gc.cra.feedback.application.port.MetricsPort;
import ca.gc.cra.feedback.application.port.TextGenerationException;
import ca.gc.cra.feedback.application.port.TextGenerationPort;
import ca.gc.cra.feedback.domain.feedback.EnrichmentResult;
import ca.gc.cra.feedback.logging.Logs;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link Enricher} that asks a text generation model for sentiment and topics.
 * <p><strong>Role:</strong> Application service between the pipeline and {@link TextGenerationPort}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Format the prompt and call the model exactly once per comment.</li>
 *   <li>Validate the reply through {@link ModelReplyParser}.</li>
 *   <li>Substitute {@link EnrichmentResult#fallback()} for any model or parse failure.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use when the model port is.</p>
 * <p><strong>Observability:</strong> Emits {@code enricher.success} and {@code enricher.fallback}.</p>
 *
 * @since 0.1.0
 */
public final class ModelBackedEnricher implements Enricher {
  private static final Logger log = LoggerFactory.getLogger(ModelBackedEnricher.class);
  private static final int LOG_COMMENT_BYTES = 120;

  private final TextGenerationPort model;
  private final ModelReplyParser parser;
  private final MetricsPort metrics;

  public ModelBackedEnricher(TextGenerationPort model, MetricsPort metrics) {
    this(model, new ModelReplyParser(), metrics);
  }

  public ModelBackedEnricher(TextGenerationPort model, ModelReplyParser parser, MetricsPort metrics) {
    this.model = Objects.requireNonNull(model, "model");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public EnrichmentResult analyze(String comment) {
    ReplyParseResult outcome;
    try {
      String reply = model.generate(PromptTemplate.format(comment == null ? "" : comment));
      outcome = parser.parse(reply);
    } catch (TextGenerationException ex) {
      outcome = ReplyParseResult.failure("model call failed: " + ex.getMessage());
    } catch (RuntimeException ex) {
      outcome = ReplyParseResult.failure("model call failed unexpectedly: " + ex);
    }

    if (outcome instanceof ReplyParseResult.ParseFailure failure) {
      metrics.increment("enricher.fallback");
      log.warn("Analysis fell back to NEUTRAL for comment '{}': {}",
          Logs.truncate(comment, LOG_COMMENT_BYTES), failure.reason());
      return failure.orFallback();
    }
    EnrichmentResult result = outcome.orFallback();
    metrics.increment("enricher.success");
    log.info("Analysis completed: sentiment={}, topics={}", result.sentiment(), result.topics());
    return result;
  }
}
