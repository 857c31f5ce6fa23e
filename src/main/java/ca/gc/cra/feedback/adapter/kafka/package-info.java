/**
 * Kafka adapters: the inbound feedback source and the optional analytics topic sink.
 */
package ca.gc.cra.feedback.adapter.kafka;
