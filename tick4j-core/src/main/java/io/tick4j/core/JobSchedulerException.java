package io.tick4j.core;

import java.util.Objects;

public class JobSchedulerException extends RuntimeException {

    private final ErrorKind kind;

    public JobSchedulerException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public JobSchedulerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Unwraps {@link java.util.concurrent.CompletionException} layers and returns the kind
     * when the root failure is a {@link JobSchedulerException}.
     */
    public static ErrorKind kindOf(Throwable t, ErrorKind fallback) {
        Throwable cur = t;
        while (cur != null) {
            if (cur instanceof JobSchedulerException jse) {
                return jse.kind();
            }
            cur = cur.getCause();
        }
        return fallback;
    }

    @Override
    public String toString() {
        return "JobSchedulerException{kind=" + kind + ", message=" + getMessage() + "}";
    }
}
