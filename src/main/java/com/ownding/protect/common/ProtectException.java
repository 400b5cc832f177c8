package com.ownding.protect.common;

/**
 * Root of every failure raised while talking to the Protect controller.
 */
public class ProtectException extends RuntimeException {

    public ProtectException(String message) {
        super(message);
    }

    public ProtectException(String message, Throwable cause) {
        super(message, cause);
    }
}
