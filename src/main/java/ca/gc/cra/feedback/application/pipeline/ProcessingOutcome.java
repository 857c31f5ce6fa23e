package ca.gc.cra.feedback.application.pipeline;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of running one delivery through the state machine.
 *
 * @param finalState {@link ProcessingState#ACKED} or {@link ProcessingState#RELEASED}
 * @param feedbackId logical key when the payload was decoded, otherwise {@code null}
 * @param releasedFrom last state reached before release; {@code null} when acknowledged
 * @since 0.1.0
 */
public record ProcessingOutcome(ProcessingState finalState, String feedbackId, ProcessingState releasedFrom) {
  public ProcessingOutcome {
    Objects.requireNonNull(finalState, "finalState");
    if (!finalState.isTerminal()) {
      throw new IllegalArgumentException("finalState must be terminal: " + finalState);
    }
    if (finalState == ProcessingState.RELEASED && releasedFrom == null) {
      throw new IllegalArgumentException("releasedFrom is required for a released delivery");
    }
  }

  static ProcessingOutcome acked(String feedbackId) {
    return new ProcessingOutcome(ProcessingState.ACKED, feedbackId, null);
  }

  static ProcessingOutcome released(String feedbackId, ProcessingState from) {
    return new ProcessingOutcome(ProcessingState.RELEASED, feedbackId, from);
  }

  public boolean isAcked() {
    return finalState == ProcessingState.ACKED;
  }

  public Optional<String> feedbackIdIfKnown() {
    return Optional.ofNullable(feedbackId);
  }
}
