package com.cardioclaw.common.errors;

/**
 * Error taxonomy shared by every CardioClaw operation.
 * <p>
 * Fatal kinds abort the whole operation; per-item kinds are tallied into a
 * batch report and never abort the batch.
 */
public enum ErrorKind {
    CONFIG_NOT_FOUND(true),
    CONFIG_PARSE(true),
    EXTERNAL_QUERY(true),
    CREATE_FAILED(false),
    REMOVE_FAILED(false),
    INVALID_SCHEDULE(false),
    MISSING_PAYLOAD(false),
    VALIDATION(false),
    CACHE_WRITE(false),
    CACHE_READ(true),
    USAGE(true);

    private final boolean fatal;

    ErrorKind(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
