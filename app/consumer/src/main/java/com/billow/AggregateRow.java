package com.billow;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * The contents of one row of the {@code user_dashboard_aggregates} table. The
 * measures are always derived from the source tables, never from the change
 * that triggered the recomputation.
 */
public class AggregateRow {
    private final String userId;
    private final LocalDate aggDate;
    private final long tasksCompleted;
    private final long tasksCreated;
    private final long reflectionsCount;
    private final BigDecimal avgMood;
    private final Instant lastUpdated;

    /**
     * Create a new aggregate row.
     *
     * @param userId
     *            The user this row belongs to.
     * @param aggDate
     *            The date this row aggregates.
     * @param tasksCompleted
     *            Number of tasks created that day that are done.
     * @param tasksCreated
     *            Number of tasks created that day.
     * @param reflectionsCount
     *            Number of reflections for that day.
     * @param avgMood
     *            Average mood score of those reflections, {@code null} if
     *            there are none.
     * @param lastUpdated
     *            When the row was last written.
     */
    public AggregateRow(String userId, LocalDate aggDate, long tasksCompleted, long tasksCreated,
            long reflectionsCount, BigDecimal avgMood, Instant lastUpdated) {
        this.userId = userId;
        this.aggDate = aggDate;
        this.tasksCompleted = tasksCompleted;
        this.tasksCreated = tasksCreated;
        this.reflectionsCount = reflectionsCount;
        this.avgMood = avgMood;
        this.lastUpdated = lastUpdated;
    }

    public AggregationKey getKey() {
        return new AggregationKey(userId, aggDate);
    }

    public String getUserId() {
        return userId;
    }

    public LocalDate getAggDate() {
        return aggDate;
    }

    public long getTasksCompleted() {
        return tasksCompleted;
    }

    public long getTasksCreated() {
        return tasksCreated;
    }

    public long getReflectionsCount() {
        return reflectionsCount;
    }

    public BigDecimal getAvgMood() {
        return avgMood;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    /**
     * Compare the measures of two rows, ignoring {@code lastUpdated}. Two
     * recomputations over unchanged source data must agree by this measure.
     *
     * @param other
     *            The row to compare to.
     * @return {@code true} if key and measures are the same.
     */
    public boolean sameMeasures(AggregateRow other) {
        return other != null
                && Objects.equals(userId, other.userId)
                && Objects.equals(aggDate, other.aggDate)
                && tasksCompleted == other.tasksCompleted
                && tasksCreated == other.tasksCreated
                && reflectionsCount == other.reflectionsCount
                && (avgMood == null ? other.avgMood == null
                        : other.avgMood != null && avgMood.compareTo(other.avgMood) == 0);
    }

    @Override
    public String toString() {
        return "AggregateRow" + getKey() + " completed=" + tasksCompleted + " created=" + tasksCreated
                + " reflections=" + reflectionsCount + " mood=" + avgMood;
    }
}
