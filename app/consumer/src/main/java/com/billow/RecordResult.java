package com.billow;

/**
 * The outcome of processing a single change. A change either led to an
 * aggregate row being recomputed, was skipped as irrelevant, or failed. Failures
 * are reported as values so that one bad change never aborts the rest of a
 * batch.
 */
public sealed abstract class RecordResult permits RecordResult.Applied, RecordResult.Skipped, RecordResult.Failed {
    private RecordResult() {
    }

    /**
     * Return whether this result represents an error.
     *
     * @return {@code true} if this is an error, {@code false} otherwise.
     */
    public abstract boolean isError();

    /**
     * Build the result for a change that caused a recomputation.
     *
     * @param key
     *            The key that was recomputed.
     * @param row
     *            The row as written.
     * @return The result.
     */
    public static RecordResult applied(AggregationKey key, AggregateRow row) {
        return new Applied(key, row);
    }

    /**
     * Build the result for a change that is not relevant for any aggregate.
     *
     * @param event
     *            The skipped event.
     * @return The result.
     */
    public static RecordResult skipped(ChangeEvent event) {
        return new Skipped(event);
    }

    /**
     * Build the result for a change that could not be processed.
     *
     * @param position
     *            The slot position of the change.
     * @param error
     *            What went wrong.
     * @return The result.
     */
    public static RecordResult failed(String position, Throwable error) {
        return new Failed(position, error);
    }

    /**
     * A change whose aggregate row has been recomputed.
     */
    public static final class Applied extends RecordResult {
        private final AggregationKey key;
        private final AggregateRow row;

        private Applied(AggregationKey key, AggregateRow row) {
            this.key = key;
            this.row = row;
        }

        @Override
        public boolean isError() {
            return false;
        }

        public AggregationKey getKey() {
            return key;
        }

        public AggregateRow getRow() {
            return row;
        }
    }

    /**
     * A change that does not affect any aggregate.
     */
    public static final class Skipped extends RecordResult {
        private final ChangeEvent event;

        private Skipped(ChangeEvent event) {
            this.event = event;
        }

        @Override
        public boolean isError() {
            return false;
        }

        public ChangeEvent getEvent() {
            return event;
        }
    }

    /**
     * A change that could not be decoded, routed or recomputed.
     */
    public static final class Failed extends RecordResult {
        private final String position;
        private final Throwable error;

        private Failed(String position, Throwable error) {
            this.position = position;
            this.error = error;
        }

        @Override
        public boolean isError() {
            return true;
        }

        public String getPosition() {
            return position;
        }

        public Throwable getError() {
            return error;
        }
    }
}
