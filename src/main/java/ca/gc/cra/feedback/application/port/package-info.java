/**
 * <strong>Purpose:</strong> Capability interfaces for every collaborator of the feedback pipeline.
 * <p><strong>Pipeline role:</strong> The coordinator depends only on these ports; adapters in
 * {@code ca.gc.cra.feedback.adapter} and {@code ca.gc.cra.feedback.infrastructure} implement them and
 * tests substitute each one independently.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Errors:</strong> Durable writes fail with {@link ca.gc.cra.feedback.application.port.StorageException};
 * model calls with {@link ca.gc.cra.feedback.application.port.TextGenerationException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.feedback.application.port;
