package io.pollrunr.cron;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parsed 5-field cron expression: {@code minute hour day-of-month month day-of-week}.
 *
 * <p>Field matching is delegated to Spring's {@link CronExpression} with the seconds field pinned to 0.
 * When both day-of-month and day-of-week are restricted, a day matches if <em>either</em> field
 * matches, following classic cron rather than Spring's intersection.</p>
 */
public final class CronSchedule {

    private static final int FIELD_COUNT = 5;

    private final String expression;
    private final List<CronExpression> matchers;
    private final ZoneId zone;

    private CronSchedule(String expression, List<CronExpression> matchers, ZoneId zone) {
        this.expression = expression;
        this.matchers = matchers;
        this.zone = zone;
    }

    /**
     * Parses an expression evaluated in the system default zone.
     */
    public static CronSchedule parse(String expression) {
        return parse(expression, ZoneId.systemDefault());
    }

    /**
     * Parses an expression evaluated in the given zone.
     *
     * @throws InvalidCronExpressionException if the expression is malformed or can never fire
     */
    public static CronSchedule parse(String expression, ZoneId zone) {
        Objects.requireNonNull(zone, "zone");
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(expression), "expression is empty");
        }
        String normalized = expression.trim().replaceAll("\\s+", " ");
        String[] fields = normalized.split(" ");
        if (fields.length != FIELD_COUNT) {
            throw new InvalidCronExpressionException(normalized,
                    "expected 5 fields (minute hour day-of-month month day-of-week) but found " + fields.length);
        }

        String minute = fields[0];
        String hour = fields[1];
        String dayOfMonth = fields[2];
        String month = fields[3];
        String dayOfWeek = fields[4];

        List<CronExpression> matchers = new ArrayList<>();
        try {
            if (isRestricted(dayOfMonth) && isRestricted(dayOfWeek)) {
                matchers.add(CronExpression.parse(withSeconds(minute, hour, dayOfMonth, month, "*")));
                matchers.add(CronExpression.parse(withSeconds(minute, hour, "*", month, dayOfWeek)));
            } else {
                matchers.add(CronExpression.parse(withSeconds(minute, hour, dayOfMonth, month, dayOfWeek)));
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException(normalized, e.getMessage(), e);
        }

        CronSchedule schedule = new CronSchedule(normalized, List.copyOf(matchers), zone);
        if (schedule.findNext(Instant.EPOCH) == null) {
            throw new InvalidCronExpressionException(normalized, "expression never fires");
        }
        return schedule;
    }

    /**
     * Returns the first fire time strictly after {@code after}.
     */
    public Instant nextAfter(Instant after) {
        Instant next = findNext(after);
        if (next == null) {
            throw new IllegalStateException("No fire time after " + after + " for '" + expression + "'");
        }
        return next;
    }

    public String expression() {
        return expression;
    }

    public ZoneId zone() {
        return zone;
    }

    private Instant findNext(Instant after) {
        ZonedDateTime reference = after.atZone(zone);
        ZonedDateTime earliest = null;
        for (CronExpression matcher : matchers) {
            // CronExpression.next is exclusive of the reference instant
            ZonedDateTime candidate = matcher.next(reference);
            if (candidate != null && (earliest == null || candidate.isBefore(earliest))) {
                earliest = candidate;
            }
        }
        return earliest != null ? earliest.toInstant() : null;
    }

    private static boolean isRestricted(String field) {
        return !"*".equals(field) && !"?".equals(field);
    }

    private static String withSeconds(String minute, String hour, String dayOfMonth, String month, String dayOfWeek) {
        return String.join(" ", "0", minute, hour, dayOfMonth, month, dayOfWeek);
    }

    @Override
    public String toString() {
        return expression;
    }
}
