package io.tick4j.internal;

import io.tick4j.JobBuilder;
import io.tick4j.JobExecution;
import io.tick4j.core.CronSchedule;
import io.tick4j.core.JobSpec;
import io.tick4j.core.JobState;
import io.tick4j.core.RepeatingSchedule;
import io.tick4j.core.Schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation used by {@link TickScheduler}.
 */
public class SimpleJobBuilder implements JobBuilder {

    private enum Kind {CRON, REPEATED, ONE_SHOT}

    private final Kind kind;
    private final String cronExpression;
    private final Duration interval;
    private final JobExecution execution;
    private final Function<JobSpec, UUID> registrar;

    private UUID id;
    private ZoneId zone = ZoneId.of("UTC");
    private long repeatTimes;
    private boolean startImmediately;
    private Instant firstRunAt;
    private byte[] extra;
    private final Map<JobState, Set<UUID>> listeners = new EnumMap<>(JobState.class);

    private SimpleJobBuilder(Kind kind, String cronExpression, Duration interval, JobExecution execution,
                             Function<JobSpec, UUID> registrar) {
        this.kind = kind;
        this.cronExpression = cronExpression;
        this.interval = interval;
        this.execution = Objects.requireNonNull(execution, "execution must not be null");
        this.registrar = Objects.requireNonNull(registrar, "registrar must not be null");
    }

    public static SimpleJobBuilder cron(String expression, JobExecution execution, Function<JobSpec, UUID> registrar) {
        // fail fast on a malformed rule; the zone is applied in build()
        CronSchedule.parse(expression);
        return new SimpleJobBuilder(Kind.CRON, expression, null, execution, registrar);
    }

    public static SimpleJobBuilder repeated(Duration interval, JobExecution execution, Function<JobSpec, UUID> registrar) {
        RepeatingSchedule.every(interval);
        return new SimpleJobBuilder(Kind.REPEATED, null, interval, execution, registrar);
    }

    public static SimpleJobBuilder oneShot(Duration delay, JobExecution execution, Function<JobSpec, UUID> registrar) {
        RepeatingSchedule.once(delay);
        return new SimpleJobBuilder(Kind.ONE_SHOT, null, delay, execution, registrar);
    }

    @Override
    public JobBuilder id(UUID id) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        return this;
    }

    @Override
    public JobBuilder timezone(String timezone) {
        Objects.requireNonNull(timezone, "timezone must not be null");
        this.zone = ZoneId.of(timezone);
        return this;
    }

    @Override
    public JobBuilder repeatTimes(long times) {
        if (kind != Kind.REPEATED) {
            throw new IllegalStateException("repeatTimes applies to repeated jobs only");
        }
        if (times <= 0) {
            throw new IllegalArgumentException("times must be a positive number: " + times);
        }
        this.repeatTimes = times;
        return this;
    }

    @Override
    public JobBuilder startImmediately() {
        this.startImmediately = true;
        return this;
    }

    @Override
    public JobBuilder firstRunAt(Instant time) {
        this.firstRunAt = Objects.requireNonNull(time, "time must not be null");
        return this;
    }

    @Override
    public JobBuilder extra(byte[] extra) {
        this.extra = extra == null ? null : extra.clone();
        return this;
    }

    @Override
    public JobBuilder onStarted(UUID listenerId) {
        return on(JobState.STARTED, listenerId);
    }

    @Override
    public JobBuilder onDone(UUID listenerId) {
        return on(JobState.DONE, listenerId);
    }

    @Override
    public JobBuilder on(JobState state, UUID listenerId) {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(listenerId, "listenerId must not be null");
        listeners.computeIfAbsent(state, s -> new LinkedHashSet<>()).add(listenerId);
        return this;
    }

    @Override
    public JobSpec build() {
        Schedule schedule = switch (kind) {
            case CRON -> CronSchedule.parse(cronExpression, zone);
            case REPEATED -> repeatTimes > 0
                    ? RepeatingSchedule.times(interval, repeatTimes)
                    : RepeatingSchedule.every(interval);
            case ONE_SHOT -> RepeatingSchedule.once(interval);
        };

        Instant first = firstRunAt;
        if (first == null && startImmediately) {
            first = Instant.now();
        }

        return new JobSpec(id, schedule, first, execution, extra, listeners);
    }

    @Override
    public UUID add() {
        return registrar.apply(build());
    }
}
