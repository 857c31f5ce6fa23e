/**
 * Executor factories for the pipeline worker pool.
 */
package ca.gc.cra.feedback.infrastructure.exec;
