package com.billow;

import java.sql.SQLException;

/**
 * Signals that recomputing the aggregate row for a key failed. Since the write
 * is a single upsert, the existing row for the key is left untouched.
 */
public class RecomputeException extends SQLException {
    /** The key whose recomputation failed. */
    private final AggregationKey key;

    /**
     * Create a new recompute exception.
     *
     * @param key
     *            The key that could not be recomputed.
     * @param cause
     *            The database error.
     */
    public RecomputeException(AggregationKey key, SQLException cause) {
        super("Failed to recompute aggregates for " + key, cause.getSQLState(), cause.getErrorCode(), cause);
        this.key = key;
    }

    /**
     * Get the key whose recomputation failed.
     *
     * @return The aggregation key.
     */
    public AggregationKey getKey() {
        return key;
    }
}
