/**
 * Logging setup and log-line hygiene helpers.
 */
package ca.gc.cra.feedback.logging;
