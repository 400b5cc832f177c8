package com.ownding.protect.common;

import org.springframework.http.HttpStatus;

/**
 * Rejects a gateway call before anything is sent to the controller.
 */
public class ApiException extends RuntimeException {
    private final HttpStatus status;

    public ApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
