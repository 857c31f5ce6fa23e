/**
 * Configuration loading, precedence merging and wiring of the consume pipeline.
 */
package ca.gc.cra.feedback.config;
