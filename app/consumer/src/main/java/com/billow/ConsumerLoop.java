package com.billow;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main loop of the consumer, expressed as a state machine. Each call to
 * {@link #step()} performs exactly one transition:
 *
 * <pre>
 * IDLE -> POLLING -> PROCESSING -> ADVANCING -> IDLE
 *           |  (empty batch or error)            ^
 *           +------------------------------------+
 * </pre>
 *
 * The slot is advanced after every processed batch, also if some of its
 * changes failed. A change that keeps failing must not stall the slot forever.
 * The effect of a failed change is lost until the next change for the same key
 * triggers a recomputation, which then reads the complete source state again.
 * <p>
 * Shutdown requests are only honored in {@code IDLE}, so a batch that is being
 * processed is always completed before the loop stops.
 */
public class ConsumerLoop {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConsumerLoop.class);

    private final SlotReader slotReader;
    private final ChangeProcessor processor;
    private final String slotName;
    private final Duration pollInterval;
    private final Sleeper sleeper;
    private final ConsumerStats stats = new ConsumerStats();
    /** Counted down once shutdown has been requested. */
    private final CountDownLatch shutdownRequested = new CountDownLatch(1);
    /** Counted down once the loop reached {@code STOPPED}. */
    private final CountDownLatch terminated = new CountDownLatch(1);

    private ConsumerState state = ConsumerState.IDLE;
    /** The batch currently being processed, if any. */
    private List<SlotChange> batch = List.of();

    /**
     * Create a new consumer loop that sleeps in real time, waking up early on
     * shutdown.
     *
     * @param slotReader
     *            The reader for the replication slot.
     * @param processor
     *            The processor applying the changes.
     * @param slotName
     *            The name of the replication slot.
     * @param pollInterval
     *            The time to wait between polling cycles.
     */
    public ConsumerLoop(SlotReader slotReader, ChangeProcessor processor, String slotName, Duration pollInterval) {
        this.slotReader = slotReader;
        this.processor = processor;
        this.slotName = slotName;
        this.pollInterval = pollInterval;
        this.sleeper = duration -> shutdownRequested.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Create a new consumer loop using the given sleeper to wait between cycles.
     *
     * @param slotReader
     *            The reader for the replication slot.
     * @param processor
     *            The processor applying the changes.
     * @param slotName
     *            The name of the replication slot.
     * @param pollInterval
     *            The time to wait between polling cycles.
     * @param sleeper
     *            The sleeper to use.
     */
    public ConsumerLoop(SlotReader slotReader, ChangeProcessor processor, String slotName, Duration pollInterval,
            Sleeper sleeper) {
        this.slotReader = slotReader;
        this.processor = processor;
        this.slotName = slotName;
        this.pollInterval = pollInterval;
        this.sleeper = sleeper;
    }

    public ConsumerState getState() {
        return state;
    }

    public ConsumerStats getStats() {
        return stats;
    }

    /**
     * Run the loop until it is stopped by {@link #requestShutdown()} or by
     * interrupting the calling thread.
     */
    public void run() {
        LOGGER.info("Starting CDC consumer for slot {}, polling every {} ms", slotName, pollInterval.toMillis());
        while (step() != ConsumerState.STOPPED) {
            // Keep stepping.
        }
    }

    /**
     * Perform a single transition of the state machine.
     *
     * @return The state after the transition.
     */
    public ConsumerState step() {
        try {
            switch (state) {
                case IDLE:
                    if (isShutdownRequested()) {
                        state = ConsumerState.STOPPED;
                        LOGGER.info("CDC consumer stopped after {}", stats);
                        terminated.countDown();
                    } else {
                        state = ConsumerState.POLLING;
                    }
                    break;
                case POLLING:
                    poll();
                    break;
                case PROCESSING:
                    processBatch();
                    break;
                case ADVANCING:
                    advance();
                    break;
                case STOPPED:
                    break;
            }
        } catch (InterruptedException e) {
            // Stop without advancing. An unfinished batch is delivered again on restart.
            Thread.currentThread().interrupt();
            LOGGER.warn("CDC consumer interrupted in state {}", state);
            requestShutdown();
            batch = List.of();
            state = ConsumerState.IDLE;
        }
        return state;
    }

    private void poll() throws InterruptedException {
        stats.recordCycle();
        List<SlotChange> changes;
        try {
            changes = slotReader.peek(slotName);
        } catch (SQLException e) {
            stats.recordTransportError();
            LOGGER.error("Failed to read changes from slot {}", slotName, e);
            idle();
            return;
        }
        if (changes.isEmpty()) {
            idle();
        } else {
            batch = changes;
            stats.recordBatch(changes.size());
            state = ConsumerState.PROCESSING;
        }
    }

    private void processBatch() throws InterruptedException {
        int applied = 0;
        int skipped = 0;
        int failed = 0;
        for (SlotChange change : batch) {
            for (RecordResult result : processor.process(change)) {
                stats.recordResult(result);
                if (result instanceof RecordResult.Applied) {
                    applied++;
                } else if (result instanceof RecordResult.Skipped) {
                    skipped++;
                } else {
                    failed++;
                    logFailure(change, (RecordResult.Failed) result);
                }
            }
        }
        LOGGER.info("Processed {} changes: {} applied, {} skipped, {} failed", batch.size(), applied, skipped,
                failed);
        state = ConsumerState.ADVANCING;
    }

    private void advance() throws InterruptedException {
        String upTo = batch.get(batch.size() - 1).getPosition();
        try {
            slotReader.advance(slotName, upTo);
        } catch (SQLException e) {
            // The batch will be delivered again, which is safe since recomputation is idempotent.
            stats.recordTransportError();
            LOGGER.error("Failed to advance slot {} to {}", slotName, upTo, e);
        }
        batch = List.of();
        idle();
    }

    private void idle() throws InterruptedException {
        state = ConsumerState.IDLE;
        if (!isShutdownRequested()) {
            sleeper.sleep(pollInterval);
        }
    }

    private static void logFailure(SlotChange change, RecordResult.Failed failure) {
        Throwable error = failure.getError();
        if (error instanceof DecodeException) {
            LOGGER.warn("Skipping undecodable change at {}: {}", change.getPosition(),
                    ((DecodeException) error).getPayload(), error);
        } else {
            LOGGER.warn("Failed to process change at {}", change.getPosition(), error);
        }
    }

    /**
     * Whether {@link #requestShutdown()} has been called.
     *
     * @return {@code true} if the loop should stop at the next opportunity.
     */
    public boolean isShutdownRequested() {
        return shutdownRequested.getCount() == 0;
    }

    /**
     * Request the loop to stop. This can be called from any thread. The loop
     * finishes the current batch and stops when it is next idle. A pending sleep
     * of the default sleeper is woken up.
     */
    public void requestShutdown() {
        shutdownRequested.countDown();
    }

    /**
     * Wait for the loop to reach {@code STOPPED}.
     *
     * @param timeout
     *            The maximum time to wait.
     * @return {@code true} if the loop stopped, {@code false} on timeout.
     * @throws InterruptedException
     *             If interrupted while waiting.
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
