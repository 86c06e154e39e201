package org.app.challenge.event;

import java.time.Duration;
import java.util.Optional;

/**
 * Handle on a broadcaster subscription. Receives every event published after it was opened
 * until closed by the caller or dropped by the broadcaster for falling behind.
 */
public interface Subscription extends AutoCloseable {

    /**
     * Waits up to {@code timeout} for the next buffered event.
     */
    Optional<ChallengeEvent> poll(Duration timeout) throws InterruptedException;

    /**
     * Registers a callback run once when the subscription closes, whoever closed it.
     * Runs immediately if already closed.
     */
    void onClose(Runnable callback);

    boolean isClosed();

    /** Idempotent. */
    @Override
    void close();
}
