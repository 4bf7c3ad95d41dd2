package com.cardioclaw.common.errors;

public class RemoveFailedException extends CardioclawException {

    private final String jobId;

    public RemoveFailedException(String jobId, String message) {
        super(ErrorKind.REMOVE_FAILED, message);
        this.jobId = jobId;
    }

    public RemoveFailedException(String jobId, String message, Throwable cause) {
        super(ErrorKind.REMOVE_FAILED, message, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
