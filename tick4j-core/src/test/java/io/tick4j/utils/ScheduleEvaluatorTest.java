package io.tick4j.utils;

import io.tick4j.core.CronSchedule;
import io.tick4j.core.RepeatingSchedule;
import io.tick4j.core.Schedule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleEvaluatorTest {

    @Test
    void parseHumanDurationShouldWork() {
        assertEquals(Duration.ofMinutes(5), ScheduleEvaluator.parseInterval("5 minutes"));
        assertEquals(Duration.ofHours(27), ScheduleEvaluator.parseInterval("1 day 3 hours"));
        assertEquals(Duration.ofSeconds(30), ScheduleEvaluator.parseInterval("30s"));
        assertEquals(Duration.ofMillis(250), ScheduleEvaluator.parseInterval("250ms"));
        assertEquals(Duration.ofSeconds(90), ScheduleEvaluator.parseInterval("90"));
    }

    @Test
    void parseIntervalShouldRejectZeroAndGarbage() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleEvaluator.parseInterval("0 minutes"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleEvaluator.parseInterval("5 fortnights"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleEvaluator.parseInterval("1 minute 2 minutes"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleEvaluator.parseInterval(" "));
    }

    @Test
    void cronShouldSupportFiveFieldSyntax() {
        Schedule schedule = CronSchedule.parse("*/5 * * * *");

        Optional<Instant> next = ScheduleEvaluator.nextOccurrence(schedule, Instant.parse("2026-01-01T00:01:00Z"));

        assertEquals(Optional.of(Instant.parse("2026-01-01T00:05:00Z")), next);
    }

    @Test
    void cronShouldSupportSecondsAndDayOfMonth() {
        Schedule schedule = CronSchedule.parse("30 0 9 15 * *");

        Optional<Instant> next = ScheduleEvaluator.nextOccurrence(schedule, Instant.parse("2026-01-15T09:00:30Z"));

        assertEquals(Optional.of(Instant.parse("2026-02-15T09:00:30Z")), next);
    }

    @Test
    void cronShouldHonourTimezone() {
        Schedule schedule = CronSchedule.parse("0 0 9 * * *", ZoneId.of("Asia/Taipei"));

        Optional<Instant> next = ScheduleEvaluator.nextOccurrence(schedule, Instant.parse("2026-01-01T00:00:00Z"));

        assertEquals(Optional.of(Instant.parse("2026-01-01T01:00:00Z")), next);
    }

    @Test
    void cronWithoutFurtherOccurrencesShouldBeExhausted() {
        Schedule schedule = CronSchedule.parse("0 0 0 1 1 ? 2020");

        assertEquals(Optional.empty(), ScheduleEvaluator.nextOccurrence(schedule, Instant.parse("2026-01-01T00:00:00Z")));
    }

    @Test
    void malformedCronShouldFailAtConstruction() {
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("not a cron"));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("61 * * * * *"));
    }

    @Test
    void nextOccurrenceShouldAlwaysBeStrictlyLater() {
        List<Schedule> schedules = List.of(
                CronSchedule.parse("* * * * * *"),
                CronSchedule.parse("*/5 * * * *"),
                CronSchedule.parse("0 0 12 ? * MON-FRI"),
                RepeatingSchedule.every(Duration.ofMillis(1)),
                RepeatingSchedule.times(Duration.ofSeconds(3), 2)
        );
        Instant base = Instant.parse("2026-03-29T00:59:59.999Z");

        for (Schedule schedule : schedules) {
            Instant after = base;
            for (int i = 0; i < 200; i++) {
                after = after.plusMillis(137 * i);
                Optional<Instant> next = ScheduleEvaluator.nextOccurrence(schedule, after);
                if (next.isPresent()) {
                    assertTrue(next.get().isAfter(after), schedule + " produced " + next.get() + " for " + after);
                }
            }
        }
    }

    @Test
    void repeatingShouldStopWhenBudgetIsSpent() {
        RepeatingSchedule schedule = RepeatingSchedule.times(Duration.ofSeconds(1), 1);
        Instant now = Instant.parse("2026-01-01T00:00:00Z");

        assertEquals(Optional.of(now.plusSeconds(1)), ScheduleEvaluator.nextOccurrence(schedule, now));

        RepeatingSchedule spent = schedule.afterRun();
        assertFalse(spent.hasRemaining());
        assertEquals(Optional.empty(), ScheduleEvaluator.nextOccurrence(spent, now));
    }

    @Test
    void indefiniteRepeatingShouldNeverBeExhausted() {
        RepeatingSchedule schedule = RepeatingSchedule.every(Duration.ofMinutes(1));
        for (int i = 0; i < 10; i++) {
            schedule = schedule.afterRun();
        }

        assertTrue(ScheduleEvaluator.nextOccurrence(schedule, Instant.EPOCH).isPresent());
    }

    @Test
    void durationUntilNextShouldMeasureFromGivenInstant() {
        Duration duration = ScheduleEvaluator.durationUntilNext(
                CronSchedule.parse("*/5 * * * *"), Instant.parse("2026-01-01T00:01:00Z")).orElseThrow();

        assertEquals(Duration.ofMinutes(4), duration);
    }
}
