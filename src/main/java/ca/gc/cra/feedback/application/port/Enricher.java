package ca.gc.cra.feedback.application.port;

import ca.gc.cra.feedback.domain.feedback.EnrichmentResult;

/**
 * <strong>What:</strong> Domain port turning a comment into a validated {@link EnrichmentResult}.
 * <p><strong>Contract:</strong> Never fails the caller. Every error is absorbed and replaced by
 * {@link EnrichmentResult#fallback()}; enrichment quality is best-effort and has no effect on
 * pipeline success.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Enricher {
  /**
   * Analyses a comment.
   *
   * @param comment comment text of any length
   * @return validated result; never {@code null}
   */
  EnrichmentResult analyze(String comment);
}
