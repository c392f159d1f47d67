package com.billow;

/**
 * One entry of a batch peeked from a replication slot. The position is the LSN
 * of the change as reported by the database. It is never interpreted here,
 * only handed back to bound how far the slot is advanced.
 */
public class SlotChange {
    private final String position;
    private final String payload;

    /**
     * Create a new slot change.
     *
     * @param position
     *            The replication position of the change.
     * @param payload
     *            The serialized payload produced by the decoding plugin.
     */
    public SlotChange(String position, String payload) {
        this.position = position;
        this.payload = payload;
    }

    public String getPosition() {
        return position;
    }

    public String getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "SlotChange @ " + position;
    }
}
