package com.billow;

/**
 * Running counters of the consumer loop. Only ever updated from the loop thread.
 */
public class ConsumerStats {
    private long cycles;
    private long batches;
    private long changes;
    private long applied;
    private long skipped;
    private long failed;
    private long transportErrors;

    void recordCycle() {
        cycles++;
    }

    void recordBatch(int size) {
        batches++;
        changes += size;
    }

    void recordResult(RecordResult result) {
        if (result instanceof RecordResult.Applied) {
            applied++;
        } else if (result instanceof RecordResult.Skipped) {
            skipped++;
        } else {
            failed++;
        }
    }

    void recordTransportError() {
        transportErrors++;
    }

    public long getCycles() {
        return cycles;
    }

    public long getBatches() {
        return batches;
    }

    public long getChanges() {
        return changes;
    }

    public long getApplied() {
        return applied;
    }

    public long getSkipped() {
        return skipped;
    }

    public long getFailed() {
        return failed;
    }

    public long getTransportErrors() {
        return transportErrors;
    }

    @Override
    public String toString() {
        return cycles + " cycles, " + batches + " batches, " + changes + " changes, " + applied + " applied, "
                + skipped + " skipped, " + failed + " failed, " + transportErrors + " transport errors";
    }
}
