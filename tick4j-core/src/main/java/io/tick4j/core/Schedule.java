package io.tick4j.core;

/**
 * When a job fires. Either a {@link CronSchedule} or a {@link RepeatingSchedule}.
 */
public interface Schedule {

    JobType jobType();
}
