package org.vectorfill.clients.http;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Interface for HTTP client adapters. This abstraction allows the REST clients to be exercised
 * without a network.
 */
public interface HttpClientAdapter {
    /**
     * Performs an HTTP request.
     *
     * @param method The HTTP method (GET, POST, PUT, etc.)
     * @param path The request path, relative to the base URI
     * @param body The request body, or null if no body
     * @param headers The request headers
     * @return A Mono that emits the HTTP response, whatever its status
     */
    Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers);
}
