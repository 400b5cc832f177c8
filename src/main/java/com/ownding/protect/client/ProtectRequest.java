package com.ownding.protect.client;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;

import java.net.URI;

/**
 * One call against the Protect integration API.
 *
 * @param path    path below the integration base url, used when {@code uri} is null
 * @param uri     absolute target, wins over {@code path}
 * @param headers replaces the default headers entirely when not null
 * @param method  defaults to GET
 * @param body    raw request body, may be null
 * @param accept  expected response type, defaults to JSON
 */
public record ProtectRequest(
        String path,
        URI uri,
        HttpHeaders headers,
        HttpMethod method,
        byte[] body,
        MediaType accept
) {
    public ProtectRequest {
        if (path == null && uri == null) {
            throw new IllegalArgumentException("either path or uri is required");
        }
        if (method == null) {
            method = HttpMethod.GET;
        }
        if (accept == null) {
            accept = MediaType.APPLICATION_JSON;
        }
    }

    public static ProtectRequest get(String path) {
        return new ProtectRequest(path, null, null, null, null, null);
    }

    public static ProtectRequest get(URI uri) {
        return new ProtectRequest(null, uri, null, null, null, null);
    }

    public ProtectRequest withMethod(HttpMethod newMethod) {
        return new ProtectRequest(path, uri, headers, newMethod, body, accept);
    }

    public ProtectRequest withBody(byte[] newBody) {
        return new ProtectRequest(path, uri, headers, method, newBody, accept);
    }

    public ProtectRequest withHeaders(HttpHeaders newHeaders) {
        return new ProtectRequest(path, uri, newHeaders, method, body, accept);
    }

    public ProtectRequest accepting(MediaType newAccept) {
        return new ProtectRequest(path, uri, headers, method, body, newAccept);
    }
}
