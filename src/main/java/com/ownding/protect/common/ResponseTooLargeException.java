package com.ownding.protect.common;

/**
 * A 2xx response arrived but its body was larger than the configured in-memory limit.
 */
public class ResponseTooLargeException extends ProtectException {

    public ResponseTooLargeException(String message, Throwable cause) {
        super(message, cause);
    }
}
