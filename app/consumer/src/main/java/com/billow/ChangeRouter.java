package com.billow;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Decides which aggregate row, if any, a change event perturbs. Only row
 * changes to the {@code tasks} and {@code reflections} tables that carry a
 * user identifier are routed.
 */
public class ChangeRouter {
    public static final String TASKS_TABLE = "tasks";
    public static final String REFLECTIONS_TABLE = "reflections";
    public static final String USER_ID_COLUMN = "user_id";
    public static final String COMPLETED_AT_COLUMN = "completed_at";
    public static final String REFLECTION_DATE_COLUMN = "reflection_date";

    /** Source of "today" for changes without a date of their own. */
    private final Clock clock;

    public ChangeRouter() {
        this(Clock.systemDefaultZone());
    }

    /**
     * Create a router that uses the given clock to determine the current date.
     *
     * @param clock
     *            The clock to read today's date from.
     */
    public ChangeRouter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Compute the aggregation key for the given event.
     * <p>
     * Tasks are aggregated on the day they were completed, reflections on their
     * reflection date. If the event has no such date, today's date is used.
     *
     * @param event
     *            The event to route.
     * @return The key of the aggregate to recompute, or empty if the event is
     *         not relevant.
     * @throws IllegalArgumentException
     *             If the event carries a date that can not be parsed.
     */
    public Optional<AggregationKey> route(ChangeEvent event) {
        if (!event.getKind().isRowChange()) {
            return Optional.empty();
        }
        String table = event.getTable();
        if (!TASKS_TABLE.equals(table) && !REFLECTIONS_TABLE.equals(table)) {
            return Optional.empty();
        }
        String userId = event.getText(USER_ID_COLUMN);
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        LocalDate aggDate = LocalDate.now(clock);
        if (TASKS_TABLE.equals(table)) {
            String completedAt = event.getText(COMPLETED_AT_COLUMN);
            if (completedAt != null) {
                aggDate = calendarDate(completedAt);
            }
        } else {
            String reflectionDate = event.getText(REFLECTION_DATE_COLUMN);
            if (reflectionDate != null) {
                aggDate = calendarDate(reflectionDate);
            }
        }
        return Optional.of(new AggregationKey(userId, aggDate));
    }

    /**
     * Extract the calendar date from a date or timestamp as formatted by the
     * database, e.g. {@code 2024-03-01}, {@code 2024-03-01T10:00:00} or
     * {@code 2024-03-01 10:00:00+00}. The date is taken as written, no time
     * zone conversion happens.
     *
     * @param value
     *            The date or timestamp text.
     * @return The calendar date.
     */
    static LocalDate calendarDate(String value) {
        String text = value.trim();
        int end = text.length();
        int sep = text.indexOf('T');
        if (sep < 0) {
            sep = text.indexOf(' ');
        }
        if (sep >= 0) {
            end = sep;
        }
        try {
            return LocalDate.parse(text.substring(0, end));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("\"" + value + "\" is not a valid date", e);
        }
    }
}
