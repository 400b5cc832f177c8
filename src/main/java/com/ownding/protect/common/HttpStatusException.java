package com.ownding.protect.common;

/**
 * The controller answered with a status outside 200..299. The response body is not kept.
 */
public class HttpStatusException extends ProtectException {

    private final int statusCode;
    private final String reasonPhrase;

    public HttpStatusException(int statusCode, String reasonPhrase) {
        super("HTTP " + statusCode + " " + reasonPhrase);
        this.statusCode = statusCode;
        this.reasonPhrase = reasonPhrase;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getReasonPhrase() {
        return reasonPhrase;
    }
}
