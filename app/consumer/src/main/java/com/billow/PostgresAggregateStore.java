package com.billow;

import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;

/**
 * Aggregate store writing into the {@code user_dashboard_aggregates} table.
 * The measures are computed and upserted with a single statement.
 */
public class PostgresAggregateStore implements AggregateStore {
    /** The task status counted as completed. */
    public static final String DONE_STATUS = "done";

    private static final String RECOMPUTE_SQL = "WITH params AS ( "
            + "    SELECT CAST(? AS %s) AS user_id, CAST(? AS date) AS agg_date "
            + "), task_counts AS ( "
            + "    SELECT COUNT(*) FILTER (WHERE t.status = ?) AS tasks_completed, "
            + "           COUNT(*) AS tasks_created "
            + "    FROM tasks t, params p "
            + "    WHERE t.user_id = p.user_id "
            + "      AND DATE(t.created_at) = p.agg_date "
            + "), reflection_stats AS ( "
            + "    SELECT COUNT(*) AS reflections_count, "
            + "           AVG(r.mood_score) AS avg_mood "
            + "    FROM reflections r, params p "
            + "    WHERE r.user_id = p.user_id "
            + "      AND r.reflection_date = p.agg_date "
            + ") "
            + "INSERT INTO user_dashboard_aggregates "
            + "    (user_id, agg_date, tasks_completed, tasks_created, reflections_count, avg_mood, last_updated) "
            + "SELECT p.user_id, p.agg_date, tc.tasks_completed, tc.tasks_created, "
            + "       rs.reflections_count, rs.avg_mood, now() "
            + "FROM params p, task_counts tc, reflection_stats rs "
            + "ON CONFLICT (user_id, agg_date) DO UPDATE SET "
            + "    tasks_completed = EXCLUDED.tasks_completed, "
            + "    tasks_created = EXCLUDED.tasks_created, "
            + "    reflections_count = EXCLUDED.reflections_count, "
            + "    avg_mood = EXCLUDED.avg_mood, "
            + "    last_updated = EXCLUDED.last_updated "
            + "RETURNING user_id::text, agg_date, tasks_completed, tasks_created, "
            + "          reflections_count, avg_mood, last_updated ";

    private final DbConnectionPool connectionPool;
    private final String recomputeSql;

    /**
     * Create a new aggregate store.
     *
     * @param connectionPool
     *            The pool to borrow the connection from.
     * @param userIdType
     *            The SQL type of the {@code user_id} columns, e.g.
     *            {@code uuid}.
     */
    public PostgresAggregateStore(DbConnectionPool connectionPool, String userIdType) {
        this.connectionPool = connectionPool;
        this.recomputeSql = recomputeSql(userIdType);
    }

    /**
     * Build the recomputation statement for the given user id type.
     *
     * @param userIdType
     *            The SQL type of the {@code user_id} columns.
     * @return The SQL statement.
     */
    static String recomputeSql(String userIdType) {
        return String.format(RECOMPUTE_SQL, userIdType);
    }

    @Override
    public AggregateRow recompute(AggregationKey key) throws SQLException, InterruptedException {
        try {
            return connectionPool.execute(connection -> {
                try (PreparedStatement ps = connection.prepareStatement(recomputeSql)) {
                    ps.setString(1, key.getUserId());
                    ps.setDate(2, Date.valueOf(key.getAggDate()));
                    ps.setString(3, DONE_STATUS);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            throw new SQLException("Upsert returned no row");
                        }
                        Timestamp lastUpdated = rs.getTimestamp(7);
                        return new AggregateRow(
                                rs.getString(1),
                                rs.getDate(2).toLocalDate(),
                                rs.getLong(3),
                                rs.getLong(4),
                                rs.getLong(5),
                                rs.getBigDecimal(6),
                                lastUpdated == null ? null : lastUpdated.toInstant());
                    }
                }
            });
        } catch (SQLException e) {
            throw new RecomputeException(key, e);
        }
    }
}
