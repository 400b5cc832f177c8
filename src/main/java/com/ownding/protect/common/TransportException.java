package com.ownding.protect.common;

/**
 * The request never produced an HTTP response: DNS, refused connection, timeout or a broken envelope.
 */
public class TransportException extends ProtectException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
