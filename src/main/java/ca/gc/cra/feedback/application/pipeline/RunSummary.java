package ca.gc.cra.feedback.application.pipeline;

/**
 * Counters reported when the coordinator loop returns.
 *
 * @param batches non-empty batches pulled
 * @param dispatched handles handed to workers
 * @param releasedUndispatched handles released because shutdown was observed before dispatch
 * @param pullFailures failed pull attempts
 */
public record RunSummary(long batches, long dispatched, long releasedUndispatched, long pullFailures) {}
