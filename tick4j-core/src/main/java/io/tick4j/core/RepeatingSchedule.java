package io.tick4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed-interval schedule.
 *
 * @param interval           time between runs, strictly positive
 * @param repeatIndefinitely when false, {@code remaining} bounds the number of runs left
 * @param remaining          runs left (ignored when repeating indefinitely)
 * @param jobType            {@link JobType#REPEATED} or {@link JobType#ONE_SHOT}
 */
public record RepeatingSchedule(
        Duration interval,
        boolean repeatIndefinitely,
        long remaining,
        JobType jobType
) implements Schedule {

    public RepeatingSchedule {
        Objects.requireNonNull(interval, "interval must not be null");
        Objects.requireNonNull(jobType, "jobType must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be a positive duration: " + interval);
        }
        if (remaining < 0) {
            throw new IllegalArgumentException("remaining must not be negative: " + remaining);
        }
        if (jobType == JobType.CRON) {
            throw new IllegalArgumentException("a repeating schedule cannot have job type CRON");
        }
    }

    public static RepeatingSchedule every(Duration interval) {
        return new RepeatingSchedule(interval, true, 0, JobType.REPEATED);
    }

    public static RepeatingSchedule times(Duration interval, long times) {
        if (times <= 0) {
            throw new IllegalArgumentException("times must be a positive number: " + times);
        }
        return new RepeatingSchedule(interval, false, times, JobType.REPEATED);
    }

    public static RepeatingSchedule once(Duration delay) {
        return new RepeatingSchedule(delay, false, 1, JobType.ONE_SHOT);
    }

    public boolean hasRemaining() {
        return repeatIndefinitely || remaining > 0;
    }

    /**
     * The schedule that applies after one more run has been consumed.
     */
    public RepeatingSchedule afterRun() {
        if (repeatIndefinitely || remaining == 0) {
            return this;
        }
        return new RepeatingSchedule(interval, false, remaining - 1, jobType);
    }
}
