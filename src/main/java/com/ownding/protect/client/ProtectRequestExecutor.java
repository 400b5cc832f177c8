package com.ownding.protect.client;

import com.ownding.protect.common.HttpStatusException;
import com.ownding.protect.common.ProtectException;
import com.ownding.protect.common.ResponseTooLargeException;
import com.ownding.protect.common.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Sends single authenticated requests to the Protect integration API and hands back the raw body.
 * No retries; timeouts and redirects are whatever the underlying connector does.
 */
public class ProtectRequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProtectRequestExecutor.class);

    public static final String API_KEY_HEADER = "X-API-KEY";
    private static final int BODY_SNIPPET_LENGTH = 200;
    private static final byte[] EMPTY_BODY = new byte[0];

    private final WebClient webClient;
    private final String baseUrl;
    private final String apiKey;

    public ProtectRequestExecutor(WebClient webClient, String host, String apiKey) {
        this.webClient = webClient;
        this.baseUrl = "http://" + host + "/proxy/protect/integration/v1";
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    URI resolve(String path) {
        String relative = path.startsWith("/") ? path : "/" + path;
        return UriComponentsBuilder.fromUriString(baseUrl)
                .path(relative)
                .build()
                .toUri();
    }

    HttpHeaders defaultHeaders(MediaType accept) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(API_KEY_HEADER, apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(accept));
        return headers;
    }

    /**
     * Emits the response body of a 2xx answer, or fails with {@link HttpStatusException} for any
     * other status and {@link TransportException} when no response arrived.
     */
    public Mono<byte[]> execute(ProtectRequest request) {
        return Mono.defer(() -> {
            String requestId = "Req " + UUID.randomUUID().toString().substring(0, 6);
            URI target = request.uri() != null ? request.uri() : resolve(request.path());
            HttpHeaders headers = request.headers() != null ? request.headers() : defaultHeaders(request.accept());
            log.debug("[{}] Preparing: {} {}", requestId, request.method(), target);
            if (log.isTraceEnabled()) {
                log.trace("[{}] Request headers: {}", requestId, masked(headers));
            }

            WebClient.RequestBodySpec spec = webClient.method(request.method())
                    .uri(target)
                    .headers(h -> h.addAll(headers));
            WebClient.RequestHeadersSpec<?> ready = request.body() != null ? spec.bodyValue(request.body()) : spec;

            log.info("[{}] Sending request to {}", requestId, target);
            return ready.exchangeToMono(response -> readBody(requestId, request, response))
                    .onErrorMap(ex -> !(ex instanceof ProtectException),
                            ex -> new TransportException(
                                    "Request " + request.method() + " " + target + " failed: " + ex.getMessage(), ex));
        });
    }

    private Mono<byte[]> readBody(String requestId, ProtectRequest request, ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        log.debug("[{}] Received response: {}", requestId, status.value());
        if (!status.is2xxSuccessful()) {
            return response.releaseBody()
                    .then(Mono.<byte[]>error(new HttpStatusException(status.value(), reasonPhrase(status.value()))));
        }
        return response.bodyToMono(byte[].class)
                .onErrorMap(ProtectRequestExecutor::exceedsBufferLimit,
                        ex -> new ResponseTooLargeException(request.accept() + " response exceeded buffer limit: "
                                + ex.getMessage(), ex))
                .defaultIfEmpty(EMPTY_BODY)
                .doOnNext(body -> {
                    if (log.isDebugEnabled() && MediaType.APPLICATION_JSON.isCompatibleWith(request.accept())) {
                        String snippet = new String(body, 0, Math.min(body.length, BODY_SNIPPET_LENGTH),
                                StandardCharsets.UTF_8);
                        log.debug("[{}] Response body (first {} chars): {}", requestId, BODY_SNIPPET_LENGTH, snippet);
                    }
                });
    }

    private static boolean exceedsBufferLimit(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof DataBufferLimitException) {
                return true;
            }
        }
        return false;
    }

    static String reasonPhrase(int statusCode) {
        HttpStatus status = HttpStatus.resolve(statusCode);
        return status != null ? status.getReasonPhrase() : "Unknown Status";
    }

    private static String masked(HttpHeaders headers) {
        return headers.entrySet().stream()
                .map(entry -> entry.getKey() + "="
                        + (API_KEY_HEADER.equalsIgnoreCase(entry.getKey()) ? "****" : entry.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
