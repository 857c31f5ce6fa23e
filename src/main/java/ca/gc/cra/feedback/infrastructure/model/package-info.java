/**
 * HTTP client for the hosted text generation model.
 */
package ca.gc.cra.feedback.infrastructure.model;
