package io.tick4j;

import java.util.UUID;

/**
 * Host-supplied job body, invoked every time the job is due.
 */
@FunctionalInterface
public interface JobExecution {

    void execute(UUID jobId, JobScheduler scheduler) throws Exception;
}
