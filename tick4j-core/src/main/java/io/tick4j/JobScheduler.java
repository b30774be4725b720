package io.tick4j;

import io.tick4j.core.JobSpec;
import io.tick4j.core.JobState;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Main scheduler API.
 *
 * <p>Supports two scheduling styles:
 * <ul>
 *   <li>Calendar scheduling through cron expressions</li>
 *   <li>Fixed-interval scheduling, repeating forever or a bounded number of times</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 *
 * UUID id = scheduler.cron("0 0/5 * * * ?", (jobId, s) -> syncMailboxes())
 *       .timezone("Europe/Berlin")
 *       .add();
 *
 * scheduler.repeated(Duration.ofSeconds(30), (jobId, s) -> heartbeat())
 *       .repeatTimes(10)
 *       .add();
 *
 * scheduler.shutdown();
 * scheduler.stop();
 * }</pre>
 */
public interface JobScheduler {

    /**
     * Start the tick loop. Idempotent.
     */
    void start();

    /**
     * Stop the tick loop and the worker pools. Idempotent. Registered jobs stay registered.
     */
    void stop();

    boolean isRunning();

    JobBuilder cron(String expression, JobExecution execution);

    JobBuilder repeated(Duration interval, JobExecution execution);

    /**
     * Interval given as text, e.g. "30s", "5 minutes", "1 day 3 hours" or plain seconds.
     */
    JobBuilder repeated(String interval, JobExecution execution);

    JobBuilder oneShot(Duration delay, JobExecution execution);

    /**
     * Register a job.
     *
     * @throws io.tick4j.core.JobSchedulerException with kind CANT_ADD for a duplicate id
     */
    UUID add(JobSpec spec);

    /**
     * Remove a job. An in-flight execution is not cancelled.
     *
     * @throws io.tick4j.core.JobSchedulerException with kind CANT_REMOVE for an unknown id
     */
    void remove(UUID id);

    /**
     * Mark a job stopped. It is removed on the next tick.
     *
     * @throws io.tick4j.core.JobSchedulerException with kind GET_JOB_DATA for an unknown id
     */
    void stopJob(UUID id);

    Optional<Instant> nextTickForJob(UUID id);

    Set<UUID> jobIds();

    UUID addListener(JobListener listener);

    void removeListener(UUID listenerId);

    /**
     * Register {@code listener} and subscribe it to {@code state} events of one job.
     *
     * @return the listener id
     */
    UUID onJobEvent(UUID jobId, JobState state, JobListener listener);

    /**
     * Replace the shutdown handler. Only one handler is kept.
     */
    void setShutdownHandler(ShutdownHandler handler);

    void removeShutdownHandler();

    /**
     * Time until the nearest job is due, or the configured default wait when nothing is scheduled.
     */
    Duration timeTillNextJob();

    /**
     * Remove every job and fire the shutdown handler once.
     *
     * @return completes when the shutdown handler has completed
     */
    CompletableFuture<Void> shutdown();
}
