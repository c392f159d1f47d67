package com.billow;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the changes of one slot entry to the aggregates. Every event is
 * routed and, if relevant, its aggregate row is recomputed, in delivery order.
 * Problems with one event are reported in its result and do not stop the
 * processing of the following ones.
 */
public class ChangeProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeProcessor.class);

    private final ChangeDecoder decoder;
    private final ChangeRouter router;
    private final AggregateStore store;

    /**
     * Create a new processor.
     *
     * @param decoder
     *            Decoder for the slot payloads.
     * @param router
     *            Router selecting the aggregate rows to recompute.
     * @param store
     *            Store performing the recomputation.
     */
    public ChangeProcessor(ChangeDecoder decoder, ChangeRouter router, AggregateStore store) {
        this.decoder = decoder;
        this.router = router;
        this.store = store;
    }

    /**
     * Process all events contained in the given slot entry.
     *
     * @param change
     *            The slot entry to process.
     * @return One result per event, or a single failed result if the payload
     *         could not be decoded.
     * @throws InterruptedException
     *             If interrupted while waiting for the database.
     */
    public List<RecordResult> process(SlotChange change) throws InterruptedException {
        List<ChangeEvent> events;
        try {
            events = decoder.decode(change.getPayload());
        } catch (DecodeException e) {
            return List.of(RecordResult.failed(change.getPosition(), e));
        }
        List<RecordResult> results = new ArrayList<>(events.size());
        for (ChangeEvent event : events) {
            results.add(process(change.getPosition(), event));
        }
        return results;
    }

    private RecordResult process(String position, ChangeEvent event) throws InterruptedException {
        try {
            Optional<AggregationKey> key = router.route(event);
            if (key.isEmpty()) {
                return RecordResult.skipped(event);
            }
            AggregateRow row = store.recompute(key.get());
            LOGGER.debug("Updated aggregates for user {} on {} ({})", key.get().getUserId(),
                    key.get().getAggDate(), event);
            return RecordResult.applied(key.get(), row);
        } catch (SQLException | RuntimeException e) {
            return RecordResult.failed(position, e);
        }
    }
}
