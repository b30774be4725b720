package io.tick4j.core;

import io.tick4j.JobExecution;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable job definition produced by JobBuilder.build().
 * This is a pure data object with no scheduling logic.
 */
public record JobSpec(

        // identity, null means "generate"
        UUID id,

        // scheduling
        Schedule schedule,
        Instant firstRunAt,

        // execution
        JobExecution execution,

        // host bookkeeping
        byte[] extra,
        Map<JobState, Set<UUID>> listeners
) {

    public JobSpec {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(execution, "execution must not be null");
        extra = extra == null ? null : extra.clone();

        Map<JobState, Set<UUID>> copy = new EnumMap<>(JobState.class);
        if (listeners != null) {
            listeners.forEach((state, ids) -> {
                if (ids != null && !ids.isEmpty()) {
                    copy.put(state, Set.copyOf(ids));
                }
            });
        }
        listeners = Collections.unmodifiableMap(copy);
    }

    @Override
    public byte[] extra() {
        return extra == null ? null : extra.clone();
    }

    public Set<UUID> listenersFor(JobState state) {
        return listeners.getOrDefault(state, Set.of());
    }
}
