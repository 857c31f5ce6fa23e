package ca.gc.cra.feedback.application.pipeline;

import ca.gc.cra.feedback.application.json.FeedbackEventDecoder;
import ca.gc.cra.feedback.application.json.MalformedPayloadException;
import ca.gc.cra.feedback.application.port.ClockPort;
import ca.gc.cra.feedback.application.port.EnrichedStore;
import ca.gc.cra.feedback.application.port.Enricher;
import ca.gc.cra.feedback.application.port.MessageSource;
import ca.gc.cra.feedback.application.port.MetricsPort;
import ca.gc.cra.feedback.application.port.RawStore;
import ca.gc.cra.feedback.application.port.StorageException;
import ca.gc.cra.feedback.domain.feedback.EnrichedFeedbackRecord;
import ca.gc.cra.feedback.domain.feedback.EnrichmentResult;
import ca.gc.cra.feedback.domain.feedback.FeedbackEvent;
import ca.gc.cra.feedback.domain.feedback.RawFeedbackRecord;
import ca.gc.cra.feedback.domain.queue.MessageHandle;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one delivery through the feedback state machine.
 * <p><strong>Role:</strong> Worker-side use case invoked by {@link FeedbackPipelineCoordinator}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode the payload; reject it with a release and no store calls when malformed.</li>
 *   <li>Upsert the raw record and only then enrich and append the analytical record.</li>
 *   <li>Acknowledge on success; release on any failure, including a failed acknowledge.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; invoked concurrently by every worker.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code feedbackId}; emits {@code pipeline.message.*},
 * {@code pipeline.ack.failure} and {@code pipeline.release.failure}.</p>
 *
 * @since 0.1.0
 */
public final class FeedbackMessageHandler {
  private static final Logger log = LoggerFactory.getLogger(FeedbackMessageHandler.class);
  static final String MDC_FEEDBACK_ID = "feedbackId";

  private final MessageSource source;
  private final FeedbackEventDecoder decoder;
  private final RawStore rawStore;
  private final Enricher enricher;
  private final EnrichedStore enrichedStore;
  private final ClockPort clock;
  private final MetricsPort metrics;

  public FeedbackMessageHandler(
      MessageSource source,
      FeedbackEventDecoder decoder,
      RawStore rawStore,
      Enricher enricher,
      EnrichedStore enrichedStore,
      ClockPort clock,
      MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.rawStore = Objects.requireNonNull(rawStore, "rawStore");
    this.enricher = Objects.requireNonNull(enricher, "enricher");
    this.enrichedStore = Objects.requireNonNull(enrichedStore, "enrichedStore");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Processes one delivery to a terminal state. Never throws for collaborator failures.
   *
   * @param handle delivery to process
   * @return terminal outcome
   */
  public ProcessingOutcome handle(MessageHandle handle) {
    Objects.requireNonNull(handle, "handle");
    long startNanos = System.nanoTime();
    try {
      return process(handle);
    } finally {
      metrics.observe("pipeline.message.latencyNanos", System.nanoTime() - startNanos);
      MDC.remove(MDC_FEEDBACK_ID);
    }
  }

  private ProcessingOutcome process(MessageHandle handle) {
    FeedbackEvent event;
    try {
      event = decoder.decode(handle.payload());
    } catch (MalformedPayloadException | RuntimeException ex) {
      log.warn("Releasing malformed payload ({} bytes): {}", handle.payload().length, ex.getMessage());
      metrics.increment("pipeline.message.released.parse");
      return release(handle, null, ProcessingState.RECEIVED);
    }

    String feedbackId = event.feedbackId();
    MDC.put(MDC_FEEDBACK_ID, feedbackId);

    try {
      rawStore.upsert(new RawFeedbackRecord(event, clock.now()));
    } catch (StorageException | RuntimeException ex) {
      log.error("Raw store write failed for {}; releasing", feedbackId, ex);
      metrics.increment("pipeline.message.released.raw");
      return release(handle, feedbackId, ProcessingState.PARSED);
    }

    EnrichmentResult result;
    try {
      result = enricher.analyze(event.comment());
    } catch (RuntimeException ex) {
      log.warn("Enricher failed unexpectedly for {}; using fallback", feedbackId, ex);
      result = EnrichmentResult.fallback();
    }
    if (result == null) {
      result = EnrichmentResult.fallback();
    }

    try {
      enrichedStore.append(new EnrichedFeedbackRecord(feedbackId, result, clock.now()));
    } catch (StorageException | RuntimeException ex) {
      log.error("Enriched store write failed for {}; releasing", feedbackId, ex);
      metrics.increment("pipeline.message.released.enriched");
      return release(handle, feedbackId, ProcessingState.ENRICHED);
    }

    try {
      source.acknowledge(handle.ackToken());
    } catch (RuntimeException ex) {
      log.warn("Acknowledge failed for {}; releasing", feedbackId, ex);
      metrics.increment("pipeline.ack.failure");
      return release(handle, feedbackId, ProcessingState.ENRICHED_STORED);
    }
    metrics.increment("pipeline.message.acked");
    log.info("Processed feedback {} (sentiment={}, topics={})", feedbackId, result.sentiment(), result.topics());
    return ProcessingOutcome.acked(feedbackId);
  }

  private ProcessingOutcome release(MessageHandle handle, String feedbackId, ProcessingState from) {
    try {
      source.release(handle.ackToken());
    } catch (RuntimeException ex) {
      log.warn("Release failed for {}; delivery will be retried after its lease expires",
          feedbackId == null ? "<unparsed>" : feedbackId, ex);
      metrics.increment("pipeline.release.failure");
    }
    return ProcessingOutcome.released(feedbackId, from);
  }
}
