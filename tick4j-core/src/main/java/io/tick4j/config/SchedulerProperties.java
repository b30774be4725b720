package io.tick4j.config;

import java.time.Duration;

/**
 * Runtime configuration for scheduler behavior.
 */
public class SchedulerProperties {
    private Duration tickInterval = Duration.ofMillis(500);
    private Duration defaultWait = Duration.ofMillis(500); // reported by timeTillNextJob when idle
    private int maxConcurrency = 20;
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public Duration getDefaultWait() {
        return defaultWait;
    }

    public void setDefaultWait(Duration defaultWait) {
        this.defaultWait = defaultWait;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }
}
