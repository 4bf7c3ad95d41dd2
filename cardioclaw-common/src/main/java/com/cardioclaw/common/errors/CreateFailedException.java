package com.cardioclaw.common.errors;

/**
 * The scheduler rejected a job creation. The message holds the process diagnostics.
 */
public class CreateFailedException extends CardioclawException {

    public CreateFailedException(String message) {
        super(ErrorKind.CREATE_FAILED, message);
    }

    public CreateFailedException(String message, Throwable cause) {
        super(ErrorKind.CREATE_FAILED, message, cause);
    }
}
