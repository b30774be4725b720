package io.tick4j.store;

import io.tick4j.core.ErrorKind;
import io.tick4j.core.JobAndNextTick;
import io.tick4j.core.JobSchedulerException;
import io.tick4j.core.JobStoredData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Base class for stores with a blocking backend.
 *
 * <p>Each operation runs on the store executor and is rejected with its error kind until
 * {@link #init()} has succeeded. Subclasses implement the blocking {@code do*} methods and
 * may throw anything; failures are logged here and mapped to the operation's kind.
 */
public abstract class AbstractMetadataStore implements MetadataStore {
    private static final Logger log = LoggerFactory.getLogger(AbstractMetadataStore.class);

    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final Object initLock = new Object();
    private volatile boolean inited;

    protected AbstractMetadataStore(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.ownedExecutor = null;
    }

    protected AbstractMetadataStore() {
        this.ownedExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("tick4j.store");
            t.setDaemon(true);
            return t;
        });
        this.executor = ownedExecutor;
    }

    protected abstract void doInit() throws Exception;

    protected abstract Optional<JobStoredData> doGet(UUID id) throws Exception;

    protected abstract void doAddOrUpdate(JobStoredData data) throws Exception;

    protected abstract void doDelete(UUID id) throws Exception;

    protected abstract List<JobAndNextTick> doListNextTicks(Instant now) throws Exception;

    /**
     * @return false when no job with {@code id} exists
     */
    protected abstract boolean doSetNextAndLastTick(UUID id, Instant nextTick, Instant lastTick) throws Exception;

    /**
     * Earliest next tick strictly after {@code now}.
     */
    protected abstract Optional<Instant> doFindNextTickAfter(Instant now) throws Exception;

    @Override
    public CompletableFuture<Void> init() {
        return CompletableFuture.runAsync(() -> {
            synchronized (initLock) {
                if (inited) {
                    return;
                }
                try {
                    doInit();
                } catch (Exception e) {
                    log.error("tick4j store init failed store={} msg={}", getClass().getSimpleName(), e.getMessage(), e);
                    throw new JobSchedulerException(ErrorKind.CANT_INIT,
                            "Could not initialise " + getClass().getSimpleName(), e);
                }
                inited = true;
                log.info("tick4j store initialised store={}", getClass().getSimpleName());
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Boolean> inited() {
        return CompletableFuture.completedFuture(inited);
    }

    @Override
    public CompletableFuture<Optional<JobStoredData>> get(UUID id) {
        Objects.requireNonNull(id, "id must not be null");
        return call(ErrorKind.GET_JOB_DATA, () -> doGet(id));
    }

    @Override
    public CompletableFuture<Void> addOrUpdate(JobStoredData data) {
        Objects.requireNonNull(data, "data must not be null");
        return call(ErrorKind.UPDATE_JOB_DATA, () -> {
            doAddOrUpdate(data);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> delete(UUID id) {
        Objects.requireNonNull(id, "id must not be null");
        return call(ErrorKind.CANT_REMOVE, () -> {
            doDelete(id);
            return null;
        });
    }

    @Override
    public CompletableFuture<List<JobAndNextTick>> listNextTicks() {
        return call(ErrorKind.CANT_LIST_NEXT_TICKS, () -> doListNextTicks(Instant.now()));
    }

    @Override
    public CompletableFuture<Void> setNextAndLastTick(UUID id, Instant nextTick, Instant lastTick) {
        Objects.requireNonNull(id, "id must not be null");
        return call(ErrorKind.UPDATE_JOB_DATA, () -> {
            if (!doSetNextAndLastTick(id, nextTick, lastTick)) {
                throw new JobSchedulerException(ErrorKind.UPDATE_JOB_DATA, "No job data stored for id: " + id);
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Optional<Duration>> timeTillNextJob() {
        return call(ErrorKind.COULD_NOT_GET_TIME_UNTIL_NEXT_TICK, () -> {
            Instant now = Instant.now();
            return doFindNextTickAfter(now)
                    .map(next -> Duration.between(now, next))
                    .filter(d -> !d.isZero() && !d.isNegative());
        });
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    private <T> CompletableFuture<T> call(ErrorKind kind, Callable<T> action) {
        return CompletableFuture.supplyAsync(() -> {
            if (!inited) {
                throw new JobSchedulerException(kind, getClass().getSimpleName() + " is not initialised");
            }
            try {
                return action.call();
            } catch (JobSchedulerException e) {
                log.error("tick4j store operation failed store={} kind={} msg={}",
                        getClass().getSimpleName(), kind, e.getMessage());
                throw e;
            } catch (Exception e) {
                log.error("tick4j store operation failed store={} kind={} msg={}",
                        getClass().getSimpleName(), kind, e.getMessage(), e);
                throw new JobSchedulerException(kind, "Store operation failed: " + kind, e);
            }
        }, executor);
    }
}
