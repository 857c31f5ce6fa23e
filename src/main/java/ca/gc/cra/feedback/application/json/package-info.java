/**
 * JSON decoding and encoding helpers for queue payloads and model replies.
 */
package ca.gc.cra.feedback.application.json;
