package io.tick4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Invoked once after {@link JobScheduler#shutdown()} has removed every job.
 */
@FunctionalInterface
public interface ShutdownHandler {

    CompletionStage<Void> onShutdown();

    static ShutdownHandler of(Runnable action) {
        return () -> {
            action.run();
            return CompletableFuture.completedFuture(null);
        };
    }
}
