package com.billow;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Identifies one row of the aggregate table, a user on a given calendar day.
 */
public class AggregationKey {
    private final String userId;
    private final LocalDate aggDate;

    /**
     * Create a new key.
     *
     * @param userId
     *            The user identifier, as text.
     * @param aggDate
     *            The aggregation date.
     */
    public AggregationKey(String userId, LocalDate aggDate) {
        this.userId = Objects.requireNonNull(userId);
        this.aggDate = Objects.requireNonNull(aggDate);
    }

    public String getUserId() {
        return userId;
    }

    public LocalDate getAggDate() {
        return aggDate;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof AggregationKey)) {
            return false;
        }
        AggregationKey other = (AggregationKey) obj;
        return userId.equals(other.userId) && aggDate.equals(other.aggDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, aggDate);
    }

    @Override
    public String toString() {
        return "(" + userId + ", " + aggDate + ")";
    }
}
