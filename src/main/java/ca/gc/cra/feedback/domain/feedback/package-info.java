/**
 * Feedback domain model: submitted events, validated enrichment results, and the rows written to
 * the raw and enriched stores.
 * <p>All types are immutable records or enums and safe to share across worker threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.feedback.domain.feedback;
