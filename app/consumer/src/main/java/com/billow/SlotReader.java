package com.billow;

import java.sql.SQLException;
import java.util.List;

/**
 * Reads pending changes from a named logical replication slot. Reading does
 * not consume the changes, they are only discarded by an explicit
 * {@link #advance(String, String)}. Implementations do not retry, every error
 * is propagated to the caller.
 */
public interface SlotReader {
    /**
     * Return the currently pending changes of the slot without consuming them.
     * Calling this repeatedly without advancing returns the same changes.
     *
     * @param slotName
     *            The name of the replication slot.
     * @return The pending changes in delivery order, possibly empty.
     * @throws SQLException
     *             In case the database can not be queried.
     * @throws InterruptedException
     *             If interrupted while waiting for a connection.
     */
    List<SlotChange> peek(String slotName) throws SQLException, InterruptedException;

    /**
     * Discard all changes of the slot up to and including the given position.
     * This must only be called once the effects of these changes have been
     * applied, as they can not be read again afterwards.
     *
     * @param slotName
     *            The name of the replication slot.
     * @param upToPosition
     *            The position of the last change to discard, as returned by
     *            {@link #peek(String)}.
     * @throws SQLException
     *             In case the database can not be queried.
     * @throws InterruptedException
     *             If interrupted while waiting for a connection.
     */
    void advance(String slotName, String upToPosition) throws SQLException, InterruptedException;
}
