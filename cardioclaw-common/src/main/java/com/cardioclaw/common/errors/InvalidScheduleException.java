package com.cardioclaw.common.errors;

public class InvalidScheduleException extends CardioclawException {

    public InvalidScheduleException(String message) {
        super(ErrorKind.INVALID_SCHEDULE, message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(ErrorKind.INVALID_SCHEDULE, message, cause);
    }
}
