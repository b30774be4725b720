package io.tick4j.core;

/**
 * Persisted job-type discriminant. The code is what metadata stores write.
 */
public enum JobType {
    CRON(0),
    REPEATED(1),
    ONE_SHOT(2);

    private final int code;

    JobType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static JobType fromCode(int code) {
        for (JobType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown job type code: " + code);
    }
}
