package io.tick4j.core;

import io.tick4j.JobExecution;
import io.tick4j.utils.ScheduleEvaluator;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live, thread-safe state of one registered job.
 *
 * <p>The running flag is a test-and-set guard: only the caller that wins {@link #tryAcquire()}
 * may execute the job until it calls {@link #release()}. Run state is guarded by the handle's
 * monitor.
 */
public final class JobHandle {

    private final UUID id;
    private final JobExecution execution;
    private final byte[] extra;
    private final Map<JobState, Set<UUID>> listeners = new EnumMap<>(JobState.class);

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean stopped;
    private volatile boolean removed;

    private Schedule schedule;
    private long runCount;
    private boolean ran;
    private Instant lastTick;
    private Instant nextTick;
    private Instant lastUpdated;

    public JobHandle(UUID id, JobSpec spec, Instant registeredAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(registeredAt, "registeredAt must not be null");

        this.execution = spec.execution();
        this.extra = spec.extra();
        this.schedule = spec.schedule();
        this.lastUpdated = registeredAt;
        this.nextTick = spec.firstRunAt() != null
                ? spec.firstRunAt()
                : ScheduleEvaluator.nextOccurrence(schedule, registeredAt).orElse(null);

        for (JobState state : JobState.values()) {
            Set<UUID> ids = ConcurrentHashMap.newKeySet();
            ids.addAll(spec.listenersFor(state));
            listeners.put(state, ids);
        }
    }

    public UUID id() {
        return id;
    }

    public JobExecution execution() {
        return execution;
    }

    public byte[] extra() {
        return extra == null ? null : extra.clone();
    }

    public boolean tryAcquire() {
        return running.compareAndSet(false, true);
    }

    public void release() {
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isStopped() {
        return stopped;
    }

    public synchronized void stop(Instant at) {
        this.stopped = true;
        this.lastUpdated = at;
    }

    public boolean isRemoved() {
        return removed;
    }

    void markRemoved() {
        this.removed = true;
    }

    public synchronized Schedule schedule() {
        return schedule;
    }

    public synchronized long runCount() {
        return runCount;
    }

    public synchronized boolean ran() {
        return ran;
    }

    public synchronized Optional<Instant> nextTick() {
        return Optional.ofNullable(nextTick);
    }

    public synchronized Optional<Instant> lastTick() {
        return Optional.ofNullable(lastTick);
    }

    public synchronized boolean isDue(Instant now) {
        return nextTick != null && !nextTick.isAfter(now);
    }

    public synchronized boolean isExhausted() {
        return nextTick == null;
    }

    /**
     * Records a run fired at {@code firedAt} and recomputes the next tick from it.
     *
     * @return the next tick
     * @throws JobSchedulerException with kind {@link ErrorKind#NO_NEXT_TICK} when the schedule is
     *                               exhausted; the run itself is still recorded
     */
    public synchronized Instant recordRun(Instant firedAt) {
        Objects.requireNonNull(firedAt, "firedAt must not be null");
        ran = true;
        runCount++;
        if (schedule instanceof RepeatingSchedule repeating) {
            schedule = repeating.afterRun();
        }
        lastTick = firedAt;
        lastUpdated = firedAt;
        nextTick = ScheduleEvaluator.nextOccurrence(schedule, firedAt).orElse(null);
        if (nextTick == null) {
            throw new JobSchedulerException(ErrorKind.NO_NEXT_TICK, "No next tick for job " + id);
        }
        return nextTick;
    }

    public Set<UUID> listenersFor(JobState state) {
        return Set.copyOf(listeners.get(state));
    }

    public void addListener(JobState state, UUID listenerId) {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(listenerId, "listenerId must not be null");
        listeners.get(state).add(listenerId);
    }

    public void removeListener(UUID listenerId) {
        for (Set<UUID> ids : listeners.values()) {
            ids.remove(listenerId);
        }
    }

    /**
     * Snapshot of the persistable fields.
     */
    public synchronized JobStoredData toStoredData() {
        String cronText = null;
        Boolean repeating = null;
        Long repeatedEvery = null;
        if (schedule instanceof CronSchedule cron) {
            cronText = cron.expression();
        } else if (schedule instanceof RepeatingSchedule r) {
            repeating = r.repeatIndefinitely();
            repeatedEvery = storedIntervalSeconds(r.interval());
        }
        return new JobStoredData(
                id,
                lastUpdated,
                lastTick,
                nextTick,
                schedule.jobType(),
                runCount,
                ran,
                stopped,
                cronText,
                repeating,
                repeatedEvery,
                extra
        );
    }

    // whole seconds, rounded up
    static long storedIntervalSeconds(Duration interval) {
        long seconds = interval.getSeconds();
        return interval.getNano() > 0 ? seconds + 1 : seconds;
    }

    @Override
    public String toString() {
        return "JobHandle{id=" + id + ", schedule=" + schedule() + ", running=" + running.get()
                + ", stopped=" + stopped + "}";
    }
}
