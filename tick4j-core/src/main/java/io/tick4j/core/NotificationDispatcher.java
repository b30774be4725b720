package io.tick4j.core;

import io.tick4j.JobListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Delivers job lifecycle events to registered listeners.
 *
 * <p>Each listener runs on the dispatcher's executor, so a slow listener never holds up the
 * caller. Unknown listener ids are skipped.
 */
public class NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Map<UUID, JobListener> listeners = new ConcurrentHashMap<>();
    private final Executor executor;

    public NotificationDispatcher(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public UUID addListener(JobListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        UUID id = UUID.randomUUID();
        listeners.put(id, listener);
        return id;
    }

    public boolean removeListener(UUID listenerId) {
        return listeners.remove(listenerId) != null;
    }

    public boolean hasListener(UUID listenerId) {
        return listeners.containsKey(listenerId);
    }

    /**
     * Fire-and-forget delivery of {@code state} for {@code jobId} to every listed listener.
     *
     * @return number of listeners the event was handed to
     */
    public int notify(UUID jobId, JobState state, Collection<UUID> listenerIds) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(state, "state must not be null");
        if (listenerIds == null || listenerIds.isEmpty()) {
            return 0;
        }

        int dispatched = 0;
        for (UUID listenerId : listenerIds) {
            JobListener listener = listeners.get(listenerId);
            if (listener == null) {
                log.debug("tick4j listener not registered listenerId={} jobId={} state={}", listenerId, jobId, state);
                continue;
            }
            try {
                executor.execute(() -> invoke(listener, jobId, listenerId, state));
                dispatched++;
            } catch (RejectedExecutionException e) {
                log.warn("tick4j notification rejected listenerId={} jobId={} state={}", listenerId, jobId, state);
            }
        }
        return dispatched;
    }

    private void invoke(JobListener listener, UUID jobId, UUID listenerId, JobState state) {
        try {
            listener.onEvent(jobId, listenerId, state);
        } catch (Exception e) {
            log.error("tick4j listener failed listenerId={} jobId={} state={} msg={}",
                    listenerId, jobId, state, e.getMessage(), e);
        }
    }
}
