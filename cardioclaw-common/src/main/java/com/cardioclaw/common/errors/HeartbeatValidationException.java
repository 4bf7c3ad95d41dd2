package com.cardioclaw.common.errors;

/**
 * A declared heartbeat is missing a required field or carries conflicting ones.
 */
public class HeartbeatValidationException extends CardioclawException {

    public HeartbeatValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
