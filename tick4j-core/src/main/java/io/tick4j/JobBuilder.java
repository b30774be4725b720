package io.tick4j;

import io.tick4j.core.JobSpec;
import io.tick4j.core.JobState;

import java.time.Instant;
import java.util.UUID;

/**
 * Fluent builder for configuring a job before registering it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job spec</li>
 *   <li>add(): build() + register with the scheduler</li>
 * </ul>
 */
public interface JobBuilder {

    /**
     * Use a caller supplied id instead of a random one.
     */
    JobBuilder id(UUID id);

    /**
     * IANA time zone id used to evaluate cron rules (e.g. "Asia/Taipei"). Defaults to UTC.
     */
    JobBuilder timezone(String timezone);

    /**
     * Limit an interval job to {@code times} runs. Interval jobs repeat forever by default.
     */
    JobBuilder repeatTimes(long times);

    /**
     * Fire the first run on the next tick instead of one interval (or cron occurrence) from now.
     */
    JobBuilder startImmediately();

    /**
     * Fire the first run at an absolute time.
     */
    JobBuilder firstRunAt(Instant time);

    /**
     * Opaque payload stored with the job metadata. Never interpreted by the scheduler.
     */
    JobBuilder extra(byte[] extra);

    JobBuilder onStarted(UUID listenerId);

    JobBuilder onDone(UUID listenerId);

    JobBuilder on(JobState state, UUID listenerId);

    /**
     * Build an immutable job spec (not registered).
     */
    JobSpec build();

    /**
     * Build + register.
     *
     * @return the job id
     */
    UUID add();
}
