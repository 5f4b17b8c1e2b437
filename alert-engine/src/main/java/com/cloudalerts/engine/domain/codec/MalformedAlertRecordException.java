package com.cloudalerts.engine.domain.codec;

public class MalformedAlertRecordException extends RuntimeException {

    public MalformedAlertRecordException(String message) {
        super(message);
    }
}
