package com.cardioclaw.common.errors;

public class MissingPayloadException extends CardioclawException {

    public MissingPayloadException(String message) {
        super(ErrorKind.MISSING_PAYLOAD, message);
    }
}
