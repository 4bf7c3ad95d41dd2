package com.cardioclaw.common.errors;

/**
 * The external scheduler could not be queried, or answered with output that is
 * not a job listing.
 */
public class ExternalQueryException extends CardioclawException {

    public ExternalQueryException(String message) {
        super(ErrorKind.EXTERNAL_QUERY, message);
    }

    public ExternalQueryException(String message, Throwable cause) {
        super(ErrorKind.EXTERNAL_QUERY, message, cause);
    }
}
