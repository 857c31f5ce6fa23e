package ca.gc.cra.feedback.application.pipeline;

/**
 * Per-delivery processing states.
 *
 * <p>Happy path: {@code RECEIVED -> PARSED -> RAW_STORED -> ENRICHED -> ENRICHED_STORED -> ACKED}.
 * {@link #RELEASED} is terminal and is entered from {@link #RECEIVED} (payload rejected),
 * {@link #PARSED} (raw write failed), {@link #ENRICHED} (enriched write failed) or
 * {@link #ENRICHED_STORED} (acknowledge failed).</p>
 *
 * @since 0.1.0
 */
public enum ProcessingState {
  RECEIVED,
  PARSED,
  RAW_STORED,
  ENRICHED,
  ENRICHED_STORED,
  ACKED,
  RELEASED;

  public boolean isTerminal() {
    return this == ACKED || this == RELEASED;
  }
}
