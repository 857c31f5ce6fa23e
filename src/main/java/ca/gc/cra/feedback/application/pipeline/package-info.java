/**
 * Consume-side use cases: the per-delivery state machine and the batching coordinator that feeds it.
 */
package ca.gc.cra.feedback.application.pipeline;
