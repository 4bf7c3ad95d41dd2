package com.cardioclaw.app.dashboard;

/**
 * A request parameter is missing or malformed; rendered as 400.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }
}
