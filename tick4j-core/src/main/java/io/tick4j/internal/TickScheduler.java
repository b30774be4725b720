package io.tick4j.internal;

import io.tick4j.JobBuilder;
import io.tick4j.JobExecution;
import io.tick4j.JobListener;
import io.tick4j.JobScheduler;
import io.tick4j.ShutdownHandler;
import io.tick4j.config.SchedulerProperties;
import io.tick4j.core.ErrorKind;
import io.tick4j.core.JobHandle;
import io.tick4j.core.JobRegistry;
import io.tick4j.core.JobSchedulerException;
import io.tick4j.core.JobSpec;
import io.tick4j.core.JobState;
import io.tick4j.core.JobStoredData;
import io.tick4j.core.NotificationDispatcher;
import io.tick4j.store.MetadataStore;
import io.tick4j.utils.ScheduleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * TickScheduler is an in-process cron and interval job scheduler &amp; runner.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Cron jobs (Quartz cron expressions, any time zone)</li>
 *   <li>Interval jobs, repeating forever or a bounded number of times, and one-shot jobs</li>
 *   <li>Best-effort mirroring of run state into a {@link MetadataStore}</li>
 * </ul>
 *
 * <p>A dedicated ticker thread scans the {@link JobRegistry} every
 * {@code tickInterval}. Due jobs run on the worker pool; store writes and listener
 * notifications are asynchronous too, so the ticker only ever sleeps between scans.
 * A job whose previous run is still executing is skipped until that run finishes.
 */
public class TickScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(TickScheduler.class);

    private final SchedulerProperties props;
    private final JobRegistry registry;
    private final MetadataStore store;
    private final NotificationDispatcher notifier;
    private final ShutdownController shutdownController;
    private final Executor notifierExecutor;
    private final boolean ownsNotifierPool;
    private final Map<UUID, CompletableFuture<Void>> storeTails = new ConcurrentHashMap<>();

    private final AtomicBoolean started = new AtomicBoolean(false);

    private ExecutorService notifierPool; // guarded by this, only when owned
    private volatile ExecutorService workerPool;
    private Thread tickerThread;
    private int systemErrorCount = 0;

    public TickScheduler(SchedulerProperties props, MetadataStore store) {
        this(props, new JobRegistry(), store);
    }

    public TickScheduler(SchedulerProperties props, JobRegistry registry, MetadataStore store) {
        this(props, registry, store, null);
    }

    /**
     * @param notifierExecutor runs listener notifications and the shutdown handler; owned by the
     *                         caller. When null the scheduler owns a pool that {@link #stop()} shuts down.
     */
    public TickScheduler(SchedulerProperties props, JobRegistry registry, MetadataStore store, Executor notifierExecutor) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.ownsNotifierPool = notifierExecutor == null;
        this.notifierExecutor = ownsNotifierPool ? command -> ownedNotifierPool().execute(command) : notifierExecutor;
        this.notifier = new NotificationDispatcher(this.notifierExecutor);
        this.shutdownController = new ShutdownController(registry, this::remove, this.notifierExecutor);
    }

    /**
     * Initialise the store and start the ticker. Idempotent.
     *
     * @throws JobSchedulerException CANT_INIT when the metadata store cannot be initialised
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getTickInterval(), "tick4j.tickInterval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("tick4j.tickInterval must be a positive duration");
        }
        if (props.getMaxConcurrency() <= 0) {
            started.set(false);
            throw new IllegalArgumentException("tick4j.maxConcurrency must be a positive number");
        }

        try {
            store.init().join();
        } catch (CompletionException e) {
            started.set(false);
            throw new JobSchedulerException(ErrorKind.CANT_INIT, "Metadata store could not be initialised", e.getCause());
        }

        log.info("tick4j starting with tickInterval={}, maxConcurrency={}, store={}",
                props.getTickInterval(),
                props.getMaxConcurrency(),
                store.getClass().getSimpleName());

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("tick4j.worker");
                t.setDaemon(true);
                return t;
            });
        }

        if (tickerThread == null) {
            tickerThread = new Thread(this::tickLoop);
            tickerThread.setName("tick4j.ticker");
            tickerThread.setDaemon(true);
            tickerThread.start();
        }
        log.info("tick4j started successfully.");
    }

    /**
     * Stop ticking and wait for running jobs up to {@code shutdownTimeout}. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("tick4j stopping...");

        if (tickerThread != null) {
            tickerThread.interrupt();
            tickerThread = null;
        }

        ExecutorService pool = workerPool;
        if (pool != null) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }
        shutdownNotifierPool();
        log.info("tick4j stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public JobBuilder cron(String expression, JobExecution execution) {
        return SimpleJobBuilder.cron(expression, execution, this::add);
    }

    @Override
    public JobBuilder repeated(Duration interval, JobExecution execution) {
        return SimpleJobBuilder.repeated(interval, execution, this::add);
    }

    @Override
    public JobBuilder repeated(String interval, JobExecution execution) {
        return SimpleJobBuilder.repeated(ScheduleEvaluator.parseInterval(interval), execution, this::add);
    }

    @Override
    public JobBuilder oneShot(Duration delay, JobExecution execution) {
        return SimpleJobBuilder.oneShot(delay, execution, this::add);
    }

    @Override
    public UUID add(JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        UUID id = spec.id() != null ? spec.id() : UUID.randomUUID();
        JobHandle job = new JobHandle(id, spec, nowInstant());

        registry.add(job);
        log.debug("tick4j job added id={} schedule={} nextTick={}", id, job.schedule(), job.nextTick().orElse(null));

        persist(job);
        notifier.notify(id, JobState.SCHEDULED, job.listenersFor(JobState.SCHEDULED));
        return id;
    }

    @Override
    public void remove(UUID id) {
        JobHandle job = registry.remove(id);
        afterRemoval(job);
    }

    @Override
    public void stopJob(UUID id) {
        JobHandle job = registry.get(id)
                .orElseThrow(() -> new JobSchedulerException(ErrorKind.GET_JOB_DATA, "No job registered with id: " + id));
        job.stop(nowInstant());
        log.debug("tick4j job stopped id={}", id);

        persist(job);
        notifier.notify(id, JobState.STOPPED, job.listenersFor(JobState.STOPPED));
    }

    @Override
    public Optional<Instant> nextTickForJob(UUID id) {
        return registry.get(id).flatMap(JobHandle::nextTick);
    }

    @Override
    public Set<UUID> jobIds() {
        return registry.listIds();
    }

    @Override
    public UUID addListener(JobListener listener) {
        return notifier.addListener(listener);
    }

    @Override
    public void removeListener(UUID listenerId) {
        notifier.removeListener(listenerId);
        for (JobHandle job : registry.snapshot()) {
            job.removeListener(listenerId);
        }
    }

    @Override
    public UUID onJobEvent(UUID jobId, JobState state, JobListener listener) {
        JobHandle job = registry.get(jobId)
                .orElseThrow(() -> new JobSchedulerException(ErrorKind.GET_JOB_DATA, "No job registered with id: " + jobId));
        UUID listenerId = notifier.addListener(listener);
        job.addListener(state, listenerId);
        return listenerId;
    }

    @Override
    public void setShutdownHandler(ShutdownHandler handler) {
        shutdownController.setHandler(handler);
    }

    @Override
    public void removeShutdownHandler() {
        shutdownController.clearHandler();
    }

    @Override
    public Duration timeTillNextJob() {
        List<JobHandle> jobs = registry.snapshot();
        if (jobs.isEmpty()) {
            return props.getDefaultWait();
        }

        Instant now = nowInstant();
        return jobs.stream()
                .filter(job -> !job.isStopped())
                .map(job -> untilNext(job, now))
                .flatMap(Optional::stream)
                .min(Comparator.naturalOrder())
                .orElse(props.getDefaultWait());
    }

    @Override
    public CompletableFuture<Void> shutdown() {
        log.info("tick4j shutdown requested jobs={}", registry.size());
        return shutdownController.shutdown();
    }

    public JobRegistry registry() {
        return registry;
    }

    public MetadataStore store() {
        return store;
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    private synchronized ExecutorService ownedNotifierPool() {
        if (notifierPool == null || notifierPool.isShutdown()) {
            notifierPool = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r);
                t.setName("tick4j.notifier");
                t.setDaemon(true);
                return t;
            });
        }
        return notifierPool;
    }

    // Queued notifications still run; the pool is recreated if anything notifies after stop.
    private synchronized void shutdownNotifierPool() {
        if (ownsNotifierPool && notifierPool != null) {
            notifierPool.shutdown();
        }
    }

    synchronized boolean isNotifierPoolShutdown() {
        return notifierPool == null || notifierPool.isShutdown();
    }

    private Optional<Duration> untilNext(JobHandle job, Instant now) {
        Optional<Instant> next = job.nextTick();
        if (next.isEmpty()) {
            return Optional.empty();
        }
        if (next.get().isAfter(now)) {
            return Optional.of(Duration.between(now, next.get()));
        }
        return ScheduleEvaluator.durationUntilNext(job.schedule(), now);
    }

    private void tickLoop() {
        while (started.get()) {
            try {
                tick();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("tick4j tick failed msg={}", e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            try {
                Thread.sleep(props.getTickInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated tick-loop failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(props.getTickInterval().toMillis() * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    /**
     * One scan over the registry. Normally driven by the ticker thread.
     */
    void tick() {
        ExecutorService pool = workerPool;
        if (pool == null) {
            return;
        }

        for (UUID id : registry.listIds()) {
            Optional<JobHandle> job = registry.get(id);
            if (job.isEmpty()) {
                continue;
            }
            try {
                tickJob(job.get(), pool);
            } catch (Exception e) {
                log.error("tick4j tick failed for job id={} msg={}", id, e.getMessage(), e);
            }
        }
    }

    private void tickJob(JobHandle job, ExecutorService pool) {
        if (!job.tryAcquire()) {
            log.debug("tick4j job still running, skipping id={}", job.id());
            return;
        }

        boolean handedOff = false;
        boolean retired = false;
        try {
            if (job.isRemoved()) {
                return;
            }
            if (job.isStopped() || job.isExhausted()) {
                retired = true;
                retire(job, job.isStopped() ? "stopped" : "exhausted");
                return;
            }

            Instant firedAt = nowInstant();
            if (!job.isDue(firedAt)) {
                return;
            }

            boolean exhausted = false;
            try {
                job.recordRun(firedAt);
            } catch (JobSchedulerException e) {
                if (e.kind() != ErrorKind.NO_NEXT_TICK) {
                    throw e;
                }
                exhausted = true;
            }
            persist(job);

            final boolean retireAfterRun = exhausted;
            pool.execute(() -> runJob(job, retireAfterRun));
            handedOff = true;
        } catch (RejectedExecutionException e) {
            log.warn("tick4j worker pool rejected job id={}", job.id());
        } finally {
            if (!handedOff) {
                job.release();
                if (!retired && job.isRemoved()) {
                    // removed while this tick held the flag; afterRemoval left the delete to us
                    deleteFromStore(job.id());
                }
            }
        }
    }

    private void runJob(JobHandle job, boolean retireAfterRun) {
        UUID id = job.id();
        try {
            notifier.notify(id, JobState.STARTED, job.listenersFor(JobState.STARTED));

            Instant startedAt = Instant.now();
            log.debug("tick4j job started id={} at={}", id, startedAt);
            try {
                job.execution().execute(id, this);
                log.debug("tick4j job succeeded id={} runCount={}", id, job.runCount());
            } catch (Exception e) {
                log.error("tick4j job failed id={} msg={}", id, e.getMessage(), e);
            }

            notifier.notify(id, JobState.DONE, job.listenersFor(JobState.DONE));
        } finally {
            job.release();
            if (retireAfterRun) {
                retire(job, "exhausted");
            } else if (job.isRemoved()) {
                deleteFromStore(id);
            }
        }
    }

    /**
     * Drop a stopped or exhausted job. The caller must hold the job's running flag or have
     * just released it.
     */
    private void retire(JobHandle job, String reason) {
        log.debug("tick4j retiring job id={} reason={}", job.id(), reason);
        if (job.isRemoved()) {
            deleteFromStore(job.id());
            return;
        }
        try {
            registry.remove(job.id());
        } catch (JobSchedulerException e) {
            if (e.kind() != ErrorKind.CANT_REMOVE) {
                throw e;
            }
            log.debug("tick4j job already removed id={}", job.id());
        }
        notifier.notify(job.id(), JobState.REMOVED, job.listenersFor(JobState.REMOVED));
        deleteFromStore(job.id());
    }

    private void afterRemoval(JobHandle job) {
        log.debug("tick4j job removed id={}", job.id());
        notifier.notify(job.id(), JobState.REMOVED, job.listenersFor(JobState.REMOVED));
        if (job.isRunning()) {
            // whoever holds the running flag deletes the metadata when it releases it
            return;
        }
        deleteFromStore(job.id());
    }

    /**
     * Store writes for one job are chained, so they reach the store in the order they were issued
     * and a delete always lands after every earlier write.
     */
    private void persist(JobHandle job) {
        UUID id = job.id();
        trackTail(id, storeTails.compute(id, (k, tail) -> {
            JobStoredData data = job.toStoredData();
            return chain(tail, () -> store.addOrUpdate(data), id, ErrorKind.UPDATE_JOB_DATA);
        }));
    }

    private void deleteFromStore(UUID id) {
        trackTail(id, storeTails.compute(id, (k, tail) -> chain(tail, () -> store.delete(id), id, ErrorKind.CANT_REMOVE)));
    }

    private CompletableFuture<Void> chain(CompletableFuture<Void> tail, Supplier<CompletableFuture<Void>> op,
                                          UUID id, ErrorKind kind) {
        CompletableFuture<Void> previous = tail != null ? tail : CompletableFuture.completedFuture(null);
        return previous
                .thenCompose(v -> invoke(op))
                .handle((v, e) -> {
                    if (e != null) {
                        log.warn("tick4j store operation failed id={} kind={}", id, JobSchedulerException.kindOf(e, kind));
                    }
                    return null;
                });
    }

    private static CompletableFuture<Void> invoke(Supplier<CompletableFuture<Void>> op) {
        try {
            CompletableFuture<Void> f = op.get();
            return f != null ? f : CompletableFuture.completedFuture(null);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // drop the tail once nothing is chained behind it
    private void trackTail(UUID id, CompletableFuture<Void> link) {
        link.whenComplete((v, e) -> storeTails.remove(id, link));
    }
}
