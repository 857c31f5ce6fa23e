/**
 * Infrastructure adapters that bind pipeline ports to external systems (JDBC stores, the model
 * endpoint, metrics, clocks, executors).
 * <p><strong>Concurrency:</strong> Each adapter documents its guarantees; workers call store and model
 * adapters concurrently.</p>
 * <p><strong>Metrics:</strong> Emits namespaces such as {@code store.*} and {@code model.*}.</p>
 */
package ca.gc.cra.feedback.infrastructure;
