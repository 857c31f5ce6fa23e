/**
 * Comment enrichment: prompt construction, model reply validation and the fallback policy.
 */
package ca.gc.cra.feedback.application.enrichment;
