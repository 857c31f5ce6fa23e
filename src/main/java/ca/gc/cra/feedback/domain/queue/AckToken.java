package ca.gc.cra.feedback.domain.queue;

/**
 * Opaque capability identifying one delivery attempt of a queued message.
 *
 * <p>Only the {@code MessageSource} that issued a token can interpret it. Holding the token is the
 * only way to acknowledge or release the delivery.</p>
 *
 * @since 0.1.0
 */
public interface AckToken {}
