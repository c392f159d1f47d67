package com.billow;

import java.time.Duration;

/**
 * Waits between polling cycles. Abstracted so that tests can step the consumer
 * loop without real time passing.
 */
@FunctionalInterface
public interface Sleeper {
    /**
     * Wait for at most the given duration. Implementations may return early,
     * e.g. once a shutdown has been requested.
     *
     * @param duration
     *            The time to wait.
     * @throws InterruptedException
     *             If interrupted while waiting.
     */
    void sleep(Duration duration) throws InterruptedException;
}
