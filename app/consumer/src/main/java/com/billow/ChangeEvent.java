package com.billow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A single decoded row change. Column values are kept as raw JSON nodes, since
 * only a handful of them are ever interpreted by the router.
 */
public class ChangeEvent {
    private final ChangeKind kind;
    private final String schema;
    private final String table;
    private final Map<String, JsonNode> columns;

    /**
     * Create a new change event.
     *
     * @param kind
     *            The kind of change.
     * @param schema
     *            The schema of the changed table, may be {@code null}.
     * @param table
     *            The name of the changed table, may be {@code null}.
     * @param columns
     *            The column values of the row, in column order.
     */
    public ChangeEvent(ChangeKind kind, String schema, String table, Map<String, JsonNode> columns) {
        this.kind = kind;
        this.schema = schema;
        this.table = table;
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public ChangeKind getKind() {
        return kind;
    }

    public String getSchema() {
        return schema;
    }

    public String getTable() {
        return table;
    }

    public Map<String, JsonNode> getColumns() {
        return columns;
    }

    /**
     * Get the text of a column value. A column that is missing and a column
     * holding a JSON {@code null} are treated the same.
     *
     * @param name
     *            The name of the column.
     * @return The value as text, or {@code null} if absent.
     */
    public String getText(String name) {
        JsonNode value = columns.get(name);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return value.asText();
    }

    @Override
    public String toString() {
        return kind + " on " + (schema == null ? "" : schema + ".") + table;
    }
}
