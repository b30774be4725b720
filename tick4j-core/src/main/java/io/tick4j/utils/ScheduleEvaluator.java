package io.tick4j.utils;

import io.tick4j.core.CronSchedule;
import io.tick4j.core.RepeatingSchedule;
import io.tick4j.core.Schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes next occurrences for job schedules and parses schedule text.
 * <p>
 * Supported text formats:
 * <ul>
 *   <li>Cron expressions with 5, 6 or 7 fields (see {@link CronSchedule})</li>
 *   <li>Intervals: plain seconds ("90"), compact ("30s", "5m", "2h", "1d", "1w")
 *       or human-readable ("5 minutes", "1 day 3 hours")</li>
 * </ul>
 * <p>
 * Every method is a pure function of its arguments.
 */
public final class ScheduleEvaluator {
    private ScheduleEvaluator() {
    }

    /**
     * Next occurrence of {@code schedule} strictly after {@code after}.
     *
     * @return the next instant, or empty when the schedule is exhausted
     */
    public static Optional<Instant> nextOccurrence(Schedule schedule, Instant after) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(after, "after must not be null");

        if (schedule instanceof CronSchedule cron) {
            return cron.nextAfter(after);
        }
        if (schedule instanceof RepeatingSchedule repeating) {
            if (!repeating.hasRemaining()) {
                return Optional.empty();
            }
            return Optional.of(after.plus(repeating.interval()));
        }
        throw new IllegalArgumentException("Unsupported schedule: " + schedule.getClass().getName());
    }

    /**
     * Duration from {@code from} to the next occurrence, empty when exhausted.
     */
    public static Optional<Duration> durationUntilNext(Schedule schedule, Instant from) {
        return nextOccurrence(schedule, from).map(next -> Duration.between(from, next));
    }

    /**
     * Normalize cron expressions into Quartz syntax:
     * - 5 fields: prepend seconds "0".
     * - 6 fields: seconds first.
     * - 7 fields: seconds first, trailing year.
     * Quartz requires one of day-of-month / day-of-week to be "?".
     */
    public static String normalizeCron(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("expression must not be null");
        }
        String s = expression.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4], null);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5], null);
        }
        if (parts.length == 7) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5], parts[6]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth,
                                       String month, String dayOfWeek, String year) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if (!"?".equals(dom) && !"?".equals(dow)) {
            if ("*".equals(dow)) {
                dow = "?";
            } else if ("*".equals(dom)) {
                dom = "?";
            }
        }

        String quartz = String.join(" ", sec, min, hour, dom, month, dow);
        return year == null ? quartz : quartz + " " + year;
    }

    /**
     * Parse an interval: plain seconds, compact or human-readable text.
     */
    public static Duration parseInterval(String interval) {
        if (interval == null) {
            throw new IllegalArgumentException("interval must not be null");
        }
        String s = interval.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("interval must not be empty");
        }

        Duration d = parseHumanDuration(s);
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        return d;
    }

    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            long seconds;
            try {
                seconds = Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Interval seconds out of range: " + input);
            }
            if (seconds <= 0) {
                throw new IllegalArgumentException("Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        if (s.matches("^\\d+\\s*(ms|[smhdw])$")) {
            String digits = s.replaceAll("[^0-9]", "");
            String u = s.replaceAll("[0-9\\s]", "");
            long n = Long.parseLong(digits);
            return switch (u) {
                case "ms" -> Duration.ofMillis(n);
                case "s" -> Duration.ofSeconds(n);
                case "m" -> Duration.ofMinutes(n);
                case "h" -> Duration.ofHours(n);
                case "d" -> Duration.ofDays(n);
                case "w" -> Duration.ofDays(7L * n);
                default -> throw new IllegalArgumentException("Unsupported compact unit: " + u);
            };
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        boolean seenWeek = false, seenDay = false, seenHour = false, seenMinute = false, seenSecond = false;
        long totalSeconds = 0;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "week" -> {
                    if (seenWeek) throw new IllegalArgumentException("Duplicate unit: week");
                    seenWeek = true;
                    totalSeconds += ChronoUnit.DAYS.getDuration().toSeconds() * 7L * n;
                }
                case "day" -> {
                    if (seenDay) throw new IllegalArgumentException("Duplicate unit: day");
                    seenDay = true;
                    totalSeconds += ChronoUnit.DAYS.getDuration().toSeconds() * n;
                }
                case "hour" -> {
                    if (seenHour) throw new IllegalArgumentException("Duplicate unit: hour");
                    seenHour = true;
                    totalSeconds += ChronoUnit.HOURS.getDuration().toSeconds() * n;
                }
                case "minute" -> {
                    if (seenMinute) throw new IllegalArgumentException("Duplicate unit: minute");
                    seenMinute = true;
                    totalSeconds += ChronoUnit.MINUTES.getDuration().toSeconds() * n;
                }
                case "second" -> {
                    if (seenSecond) throw new IllegalArgumentException("Duplicate unit: second");
                    seenSecond = true;
                    totalSeconds += n;
                }
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
        }

        return Duration.ofSeconds(totalSeconds);
    }
}
