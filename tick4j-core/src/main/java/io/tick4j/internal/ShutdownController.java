package io.tick4j.internal;

import io.tick4j.ShutdownHandler;
import io.tick4j.core.ErrorKind;
import io.tick4j.core.JobRegistry;
import io.tick4j.core.JobSchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Drains the job registry and fires the single-slot shutdown handler.
 *
 * <p>The handler slot is guarded by a lock. {@link #shutdown()} takes the handler out of the
 * slot before invoking it, so a handler fires at most once per registration.
 */
public class ShutdownController {
    private static final Logger log = LoggerFactory.getLogger(ShutdownController.class);

    private final JobRegistry registry;
    private final Consumer<UUID> remover;
    private final Executor executor;

    private final Lock slotLock = new ReentrantLock();
    private ShutdownHandler handler;

    /**
     * @param remover removes one job with the same contract as a host removal
     */
    public ShutdownController(JobRegistry registry, Consumer<UUID> remover, Executor executor) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.remover = Objects.requireNonNull(remover, "remover must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public void setHandler(ShutdownHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        slotLock.lock();
        try {
            this.handler = handler;
        } finally {
            slotLock.unlock();
        }
    }

    public void clearHandler() {
        slotLock.lock();
        try {
            this.handler = null;
        } finally {
            slotLock.unlock();
        }
    }

    public boolean hasHandler() {
        slotLock.lock();
        try {
            return handler != null;
        } finally {
            slotLock.unlock();
        }
    }

    /**
     * Removes every registered job, then invokes the shutdown handler (if any) on the executor.
     *
     * @return completes when the handler's own completion stage completes
     */
    public CompletableFuture<Void> shutdown() {
        int removed = 0;
        for (UUID id : registry.listIds()) {
            try {
                remover.accept(id);
                removed++;
            } catch (JobSchedulerException e) {
                if (e.kind() != ErrorKind.CANT_REMOVE) {
                    throw e;
                }
                log.debug("tick4j job vanished during shutdown id={}", id);
            }
        }
        log.info("tick4j shutdown removed {} job(s)", removed);

        ShutdownHandler toFire;
        slotLock.lock();
        try {
            toFire = handler;
            handler = null;
        } finally {
            slotLock.unlock();
        }

        if (toFire == null) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            executor.execute(() -> fire(toFire, done));
        } catch (RejectedExecutionException e) {
            log.error("tick4j shutdown handler could not be scheduled msg={}", e.getMessage(), e);
            done.completeExceptionally(new JobSchedulerException(ErrorKind.SHUTDOWN_NOTIFIER,
                    "Shutdown handler could not be scheduled", e));
        }
        return done;
    }

    private void fire(ShutdownHandler toFire, CompletableFuture<Void> done) {
        CompletionStage<Void> stage;
        try {
            stage = toFire.onShutdown();
        } catch (Exception e) {
            log.error("tick4j shutdown handler failed msg={}", e.getMessage(), e);
            done.completeExceptionally(new JobSchedulerException(ErrorKind.SHUTDOWN_NOTIFIER,
                    "Shutdown handler failed", e));
            return;
        }
        if (stage == null) {
            done.complete(null);
            return;
        }
        stage.whenComplete((v, e) -> {
            if (e == null) {
                log.debug("tick4j shutdown handler completed");
                done.complete(null);
            } else {
                log.error("tick4j shutdown handler completed exceptionally msg={}", e.getMessage(), e);
                done.completeExceptionally(new JobSchedulerException(ErrorKind.SHUTDOWN_NOTIFIER,
                        "Shutdown handler failed", e));
            }
        });
    }
}
