package io.tick4j;

import io.tick4j.core.JobState;

import java.util.UUID;

/**
 * Callback for job lifecycle events, addressed by the id returned from
 * {@link JobScheduler#addListener(JobListener)}.
 */
@FunctionalInterface
public interface JobListener {

    void onEvent(UUID jobId, UUID listenerId, JobState state);
}
