/**
 * Queue-facing value types: delivery handles and their opaque acknowledgement tokens.
 *
 * @since 0.1.0
 */
package ca.gc.cra.feedback.domain.queue;
