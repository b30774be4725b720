package io.tick4j.core;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * Persistence-facing projection of a job. The only job representation handed to a
 * {@link io.tick4j.store.MetadataStore}.
 *
 * <p>Instants are truncated to whole seconds so every store round-trips them exactly.
 * {@code schedule} is set for cron jobs only; {@code repeating} and {@code repeatedEverySeconds}
 * for interval jobs only.
 */
public record JobStoredData(
        UUID id,
        Instant lastUpdated,
        Instant lastTick,
        Instant nextTick,
        JobType jobType,
        long count,
        boolean ran,
        boolean stopped,
        String schedule,
        Boolean repeating,
        Long repeatedEverySeconds,
        byte[] extra
) {

    public JobStoredData {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(jobType, "jobType must not be null");
        lastUpdated = truncate(lastUpdated);
        lastTick = truncate(lastTick);
        nextTick = truncate(nextTick);
        extra = extra == null ? null : extra.clone();
    }

    @Override
    public byte[] extra() {
        return extra == null ? null : extra.clone();
    }

    public JobStoredData withTicks(Instant nextTick, Instant lastTick) {
        return new JobStoredData(id, lastUpdated, lastTick, nextTick, jobType, count, ran, stopped,
                schedule, repeating, repeatedEverySeconds, extra);
    }

    public JobAndNextTick toJobAndNextTick() {
        return new JobAndNextTick(id, jobType, nextTick, lastTick);
    }

    private static Instant truncate(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.SECONDS);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobStoredData that)) return false;
        return count == that.count
                && ran == that.ran
                && stopped == that.stopped
                && id.equals(that.id)
                && Objects.equals(lastUpdated, that.lastUpdated)
                && Objects.equals(lastTick, that.lastTick)
                && Objects.equals(nextTick, that.nextTick)
                && jobType == that.jobType
                && Objects.equals(schedule, that.schedule)
                && Objects.equals(repeating, that.repeating)
                && Objects.equals(repeatedEverySeconds, that.repeatedEverySeconds)
                && Arrays.equals(extra, that.extra);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, lastUpdated, lastTick, nextTick, jobType, count, ran, stopped,
                schedule, repeating, repeatedEverySeconds);
        return 31 * result + Arrays.hashCode(extra);
    }

    @Override
    public String toString() {
        return "JobStoredData{id=" + id
                + ", jobType=" + jobType
                + ", nextTick=" + nextTick
                + ", lastTick=" + lastTick
                + ", count=" + count
                + ", ran=" + ran
                + ", stopped=" + stopped
                + ", schedule=" + schedule
                + ", repeating=" + repeating
                + ", repeatedEverySeconds=" + repeatedEverySeconds
                + ", extra=" + (extra == null ? "null" : extra.length + " bytes")
                + "}";
    }
}
