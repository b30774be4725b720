package io.tick4j.config;

import io.tick4j.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bridges scheduler start/stop lifecycle with the Spring container lifecycle.
 *
 * <p>On stop every job is removed and the shutdown handler is awaited before the tick loop stops.
 */
public class Tick4jLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(Tick4jLifecycle.class);

    private final JobScheduler scheduler;
    private final Duration shutdownTimeout;
    private volatile boolean running = false;

    public Tick4jLifecycle(JobScheduler scheduler, Duration shutdownTimeout) {
        this.scheduler = scheduler;
        this.shutdownTimeout = shutdownTimeout;
    }

    @Override
    public void start() {
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        try {
            scheduler.shutdown().get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("tick4j shutdown handler failed msg={}", e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            log.warn("tick4j shutdown handler did not complete within {}", shutdownTimeout);
        } finally {
            scheduler.stop();
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
