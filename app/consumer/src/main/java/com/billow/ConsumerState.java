package com.billow;

/**
 * The states of the consumer loop. A cycle goes through
 * {@code IDLE -> POLLING -> PROCESSING -> ADVANCING -> IDLE}, skipping the
 * last two if there is nothing to process. {@code STOPPED} is terminal.
 */
public enum ConsumerState {
    /** Between cycles. Shutdown requests are honored here. */
    IDLE,
    /** About to peek the next batch from the slot. */
    POLLING,
    /** A batch has been peeked and is about to be applied. */
    PROCESSING,
    /** The batch has been applied and the slot is about to be advanced. */
    ADVANCING,
    /** The loop has terminated. */
    STOPPED;
}
