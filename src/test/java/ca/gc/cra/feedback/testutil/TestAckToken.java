package ca.gc.cra.feedback.testutil;

import ca.gc.cra.feedback.domain.queue.AckToken;

/** Ack token identified by a sequence number. */
public record TestAckToken(int id) implements AckToken {}
