package com.cardioclaw.common.errors;

/**
 * A write against the local cache database failed. Wraps the driver exception.
 */
public class CacheWriteException extends CardioclawException {

    public CacheWriteException(String message, Throwable cause) {
        super(ErrorKind.CACHE_WRITE, message, cause);
    }
}
