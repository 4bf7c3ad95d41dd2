package com.cardioclaw.common.errors;

/**
 * Base of all CardioClaw failures. Carries an {@link ErrorKind} so callers can
 * decide between aborting and tallying without matching on subclasses.
 */
public class CardioclawException extends RuntimeException {

    private final ErrorKind kind;

    public CardioclawException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CardioclawException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
