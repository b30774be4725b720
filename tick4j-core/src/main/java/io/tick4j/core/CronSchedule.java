package io.tick4j.core;

import io.tick4j.utils.ScheduleEvaluator;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;
import java.util.TimeZone;

/**
 * Calendar based schedule backed by a Quartz {@link CronExpression}.
 *
 * <p>The expression is parsed once, here, so a malformed rule fails at registration and
 * never on a tick. Accepted forms:
 * <ul>
 *   <li>5 fields: {@code min hour dom month dow} (seconds default to 0)</li>
 *   <li>6 fields: {@code sec min hour dom month dow}</li>
 *   <li>7 fields: {@code sec min hour dom month dow year}</li>
 * </ul>
 */
public final class CronSchedule implements Schedule {

    private final String expression;
    private final ZoneId zone;
    private final CronExpression cron;

    private CronSchedule(String expression, ZoneId zone, CronExpression cron) {
        this.expression = expression;
        this.zone = zone;
        this.cron = cron;
    }

    public static CronSchedule parse(String expression) {
        return parse(expression, ZoneId.of("UTC"));
    }

    public static CronSchedule parse(String expression, ZoneId zone) {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        if (expression.isBlank()) {
            throw new IllegalArgumentException("cron expression must not be blank");
        }

        String quartz = ScheduleEvaluator.normalizeCron(expression);
        CronExpression parsed;
        try {
            parsed = new CronExpression(quartz);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression, ex);
        }
        parsed.setTimeZone(TimeZone.getTimeZone(zone));
        return new CronSchedule(expression.trim(), zone, parsed);
    }

    /**
     * Earliest occurrence strictly after {@code after}, or empty when the rule has no more.
     */
    public Optional<Instant> nextAfter(Instant after) {
        Objects.requireNonNull(after, "after must not be null");
        Date next = cron.getNextValidTimeAfter(Date.from(after));
        while (next != null && !next.toInstant().isAfter(after)) {
            next = cron.getNextValidTimeAfter(next);
        }
        return next == null ? Optional.empty() : Optional.of(next.toInstant());
    }

    public String expression() {
        return expression;
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public JobType jobType() {
        return JobType.CRON;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronSchedule that)) return false;
        return expression.equals(that.expression) && zone.equals(that.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, zone);
    }

    @Override
    public String toString() {
        return "CronSchedule{" + expression + " @ " + zone + "}";
    }
}
