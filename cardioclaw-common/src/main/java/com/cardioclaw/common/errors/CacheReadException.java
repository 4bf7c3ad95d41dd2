package com.cardioclaw.common.errors;

/**
 * A query against the local cache database failed.
 */
public class CacheReadException extends CardioclawException {

    public CacheReadException(String message, Throwable cause) {
        super(ErrorKind.CACHE_READ, message, cause);
    }
}
