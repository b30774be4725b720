package io.tick4j.store;

import io.tick4j.core.JobAndNextTick;
import io.tick4j.core.JobStoredData;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Durable mirror of job metadata.
 *
 * <p>Every operation is asynchronous. A failed operation completes its future exceptionally
 * with a {@link io.tick4j.core.JobSchedulerException} whose kind names the operation. Callers
 * may issue operations concurrently; an implementation serializes writes itself if its backend
 * requires it.
 */
public interface MetadataStore extends AutoCloseable {

    /**
     * Idempotent lazy initialization. A no-op once {@link #inited()} is true.
     */
    CompletableFuture<Void> init();

    CompletableFuture<Boolean> inited();

    CompletableFuture<Optional<JobStoredData>> get(UUID id);

    /**
     * Upsert keyed by {@link JobStoredData#id()}.
     */
    CompletableFuture<Void> addOrUpdate(JobStoredData data);

    CompletableFuture<Void> delete(UUID id);

    /**
     * Jobs with a next tick after the epoch and before now, i.e. due or overdue.
     */
    CompletableFuture<List<JobAndNextTick>> listNextTicks();

    CompletableFuture<Void> setNextAndLastTick(UUID id, Instant nextTick, Instant lastTick);

    /**
     * Gap between now and the nearest future next tick, empty when nothing is scheduled.
     */
    CompletableFuture<Optional<Duration>> timeTillNextJob();

    @Override
    default void close() {
    }
}
