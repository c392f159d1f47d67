package com.billow;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Slot reader using the SQL interface of PostgreSQL logical decoding, i.e.
 * {@code pg_logical_slot_peek_changes} and {@code pg_logical_slot_get_changes}.
 */
public class PostgresSlotReader implements SlotReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresSlotReader.class);

    private final DbConnectionPool connectionPool;
    /** Maximum number of changes per peek, {@code null} for no limit. */
    private final Integer maxChanges;
    /** Options passed to the output plugin. */
    private final Map<String, String> pluginOptions;
    private final String peekSql;
    private final String advanceSql;

    /**
     * Create a new slot reader.
     *
     * @param connectionPool
     *            The pool to borrow the connection from.
     * @param maxChanges
     *            Maximum number of changes returned by one peek, or
     *            {@code null} to return all pending changes.
     * @param pluginOptions
     *            Options for the output plugin, e.g.
     *            {@code include-timestamp=true}.
     */
    public PostgresSlotReader(DbConnectionPool connectionPool, Integer maxChanges, Map<String, String> pluginOptions) {
        this.connectionPool = connectionPool;
        this.maxChanges = maxChanges;
        this.pluginOptions = new LinkedHashMap<>(pluginOptions);
        // Plugin options are passed as variadic name/value pairs.
        StringBuilder optionParams = new StringBuilder();
        for (int i = 0; i < this.pluginOptions.size(); i++) {
            optionParams.append(", ?, ?");
        }
        peekSql = "SELECT lsn::text, data FROM pg_logical_slot_peek_changes(?, NULL, ?" + optionParams + ")";
        advanceSql = "SELECT count(*) FROM pg_logical_slot_get_changes(?, CAST(? AS pg_lsn), NULL"
                + optionParams + ")";
    }

    @Override
    public List<SlotChange> peek(String slotName) throws SQLException, InterruptedException {
        return connectionPool.execute(connection -> {
            List<SlotChange> changes = new ArrayList<>();
            try (PreparedStatement ps = connection.prepareStatement(peekSql)) {
                ps.setString(1, slotName);
                if (maxChanges == null) {
                    ps.setNull(2, Types.INTEGER);
                } else {
                    ps.setInt(2, maxChanges);
                }
                setPluginOptions(ps, 3);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        changes.add(new SlotChange(rs.getString(1), rs.getString(2)));
                    }
                }
            }
            LOGGER.debug("Peeked {} changes from slot {}", changes.size(), slotName);
            return changes;
        });
    }

    @Override
    public void advance(String slotName, String upToPosition) throws SQLException, InterruptedException {
        long discarded = connectionPool.execute(connection -> {
            try (PreparedStatement ps = connection.prepareStatement(advanceSql)) {
                ps.setString(1, slotName);
                ps.setString(2, upToPosition);
                setPluginOptions(ps, 3);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            }
        });
        LOGGER.debug("Advanced slot {} to {}, discarding {} changes", slotName, upToPosition, discarded);
    }

    private void setPluginOptions(PreparedStatement ps, int firstIndex) throws SQLException {
        int index = firstIndex;
        for (Map.Entry<String, String> option : pluginOptions.entrySet()) {
            ps.setString(index++, option.getKey());
            ps.setString(index++, option.getValue());
        }
    }
}
