package com.billow;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An aggregate store that recomputes from in-memory source rows, following the
 * same rules as the SQL statement of {@link PostgresAggregateStore}.
 */
public class InMemoryAggregateStore implements AggregateStore {
    private static class Task {
        final String userId;
        final LocalDate createdOn;
        final String status;

        Task(String userId, LocalDate createdOn, String status) {
            this.userId = userId;
            this.createdOn = createdOn;
            this.status = status;
        }
    }

    private static class Reflection {
        final String userId;
        final LocalDate reflectionDate;
        final Integer moodScore;

        Reflection(String userId, LocalDate reflectionDate, Integer moodScore) {
            this.userId = userId;
            this.reflectionDate = reflectionDate;
            this.moodScore = moodScore;
        }
    }

    private final List<Task> tasks = new ArrayList<>();
    private final List<Reflection> reflections = new ArrayList<>();
    private final Map<AggregationKey, AggregateRow> rows = new HashMap<>();
    private final List<AggregationKey> recomputed = new ArrayList<>();
    private final Set<AggregationKey> failingKeys = new HashSet<>();
    private long clockTicks = 0;

    public void addTask(String userId, String createdOn, String status) {
        tasks.add(new Task(userId, LocalDate.parse(createdOn), status));
    }

    public void addReflection(String userId, String reflectionDate, Integer moodScore) {
        reflections.add(new Reflection(userId, LocalDate.parse(reflectionDate), moodScore));
    }

    public void failFor(AggregationKey key) {
        failingKeys.add(key);
    }

    public void stopFailingFor(AggregationKey key) {
        failingKeys.remove(key);
    }

    @Override
    public AggregateRow recompute(AggregationKey key) throws SQLException {
        recomputed.add(key);
        if (failingKeys.contains(key)) {
            throw new RecomputeException(key, new SQLException("duplicate key value violates unique constraint",
                    "23505"));
        }
        long completed = 0;
        long created = 0;
        for (Task task : tasks) {
            if (task.userId.equals(key.getUserId()) && task.createdOn.equals(key.getAggDate())) {
                created++;
                if (PostgresAggregateStore.DONE_STATUS.equals(task.status)) {
                    completed++;
                }
            }
        }
        long reflectionCount = 0;
        long moodSum = 0;
        long moodCount = 0;
        for (Reflection reflection : reflections) {
            if (reflection.userId.equals(key.getUserId()) && reflection.reflectionDate.equals(key.getAggDate())) {
                reflectionCount++;
                if (reflection.moodScore != null) {
                    moodSum += reflection.moodScore;
                    moodCount++;
                }
            }
        }
        BigDecimal avgMood = moodCount == 0 ? null
                : BigDecimal.valueOf(moodSum).divide(BigDecimal.valueOf(moodCount), 16, RoundingMode.HALF_EVEN);
        AggregateRow row = new AggregateRow(key.getUserId(), key.getAggDate(), completed, created, reflectionCount,
                avgMood, Instant.EPOCH.plusSeconds(++clockTicks));
        rows.put(key, row);
        return row;
    }

    public AggregateRow getRow(AggregationKey key) {
        return rows.get(key);
    }

    public Map<AggregationKey, AggregateRow> getRows() {
        return rows;
    }

    public List<AggregationKey> getRecomputed() {
        return recomputed;
    }
}
