package com.billow;

import java.sql.SQLException;

/**
 * Recomputes and stores the daily aggregate rows. The recomputation always
 * reads the current contents of the source tables, so calling it any number of
 * times, in any order, converges to the same row.
 */
public interface AggregateStore {
    /**
     * Recompute the aggregate row for the given key from the source tables and
     * upsert it, overwriting all measures of an existing row.
     *
     * @param key
     *            The user and date to recompute.
     * @return The row as it has been written.
     * @throws SQLException
     *             In case the recomputation or the write fails. The stored
     *             row is unchanged in that case.
     * @throws InterruptedException
     *             If interrupted while waiting for a connection.
     */
    AggregateRow recompute(AggregationKey key) throws SQLException, InterruptedException;
}
