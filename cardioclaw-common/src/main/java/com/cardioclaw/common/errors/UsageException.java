package com.cardioclaw.common.errors;

/**
 * Invalid combination or value of command options. Raised before any side effect.
 */
public class UsageException extends CardioclawException {

    public UsageException(String message) {
        super(ErrorKind.USAGE, message);
    }
}
