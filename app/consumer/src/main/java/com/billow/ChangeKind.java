package com.billow;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The kind of a row change as tagged by the wal2json logical decoding plugin.
 * Only {@code INSERT}, {@code UPDATE} and {@code DELETE} can perturb an
 * aggregate. The remaining kinds exist so that decoding stays total over
 * everything the plugin may emit.
 */
public enum ChangeKind {
    /** A row has been inserted. */
    INSERT("insert"),
    /** A row has been updated. */
    UPDATE("update"),
    /** A row has been deleted. */
    DELETE("delete"),
    /** A table has been truncated. */
    TRUNCATE("truncate"),
    /** A logical decoding message emitted with {@code pg_logical_emit_message}. */
    MESSAGE("message"),
    /** All other tags get this kind. */
    OTHER("other");

    private final String tag;

    private ChangeKind(String tag) {
        this.tag = tag;
    }

    /**
     * Whether a change of this kind modifies the contents of a row.
     *
     * @return {@code true} for inserts, updates and deletes.
     */
    public boolean isRowChange() {
        return this == INSERT || this == UPDATE || this == DELETE;
    }

    @JsonValue
    @Override
    public String toString() {
        return tag;
    }

    /**
     * Find the change kind matching the given wal2json tag. Unknown tags map to
     * {@link #OTHER}, routing decides what to do with them.
     *
     * @param tag
     *            The value of the {@code kind} field.
     * @return The matching kind.
     */
    public static ChangeKind fromString(String tag) {
        for (ChangeKind kind : ChangeKind.values()) {
            if (kind.tag.equals(tag)) {
                return kind;
            }
        }
        return OTHER;
    }
}
