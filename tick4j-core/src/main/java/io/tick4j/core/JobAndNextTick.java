package io.tick4j.core;

import java.time.Instant;
import java.util.UUID;

/**
 * Minimal projection used by due-job scans.
 */
public record JobAndNextTick(
        UUID id,
        JobType jobType,
        Instant nextTick,
        Instant lastTick
) {
}
