package org.vectorfill.clients.http;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import reactor.core.publisher.Mono;

/**
 * Base class of the REST clients. Adds the common headers and the connection's credentials to
 * each request and hands it to an {@link HttpClientAdapter}.
 */
public abstract class AbstractRestClient {
    @Getter
    protected final ConnectionContext connectionContext;
    protected final HttpClientAdapter httpClientAdapter;

    private static final String USER_AGENT_HEADER_NAME = "User-Agent";
    private static final String CONTENT_TYPE_HEADER_NAME = "Content-Type";
    private static final String HOST_HEADER_NAME = "Host";

    private static final String USER_AGENT = "EmbeddingBackfill-1.0";
    private static final String JSON_CONTENT_TYPE = "application/json";
    public static final String NDJSON_CONTENT_TYPE = "application/x-ndjson";

    protected AbstractRestClient(ConnectionContext connectionContext, HttpClientAdapter httpClientAdapter) {
        this.connectionContext = connectionContext;
        this.httpClientAdapter = httpClientAdapter;
    }

    public static String getHostHeaderValue(ConnectionContext connectionContext) {
        String host = connectionContext.getUri().getHost();
        int port = connectionContext.getUri().getPort();
        ConnectionContext.Protocol protocol = connectionContext.getProtocol();

        if (ConnectionContext.Protocol.HTTP.equals(protocol)) {
            if (port == -1 || port == 80) {
                return host;
            }
        } else if (ConnectionContext.Protocol.HTTPS.equals(protocol)) {
            if (port == -1 || port == 443) {
                return host;
            }
        } else {
            throw new IllegalArgumentException("Unexpected protocol" + protocol);
        }
        return host + ":" + port;
    }

    public Mono<HttpResponse> asyncRequest(String method, String path, String body,
                                           Map<String, List<String>> additionalHeaders) {
        return httpClientAdapter.request(method, relativeTo(path), body, prepareHeaders(body, additionalHeaders));
    }

    // the base URI may carry a path prefix such as /v1
    private String relativeTo(String path) {
        var basePath = connectionContext.getUri().getPath();
        var relative = path.startsWith("/") ? path.substring(1) : path;
        if (basePath == null || basePath.isEmpty() || basePath.equals("/")) {
            return relative;
        }
        return (basePath.startsWith("/") ? basePath.substring(1) : basePath) + "/" + relative;
    }

    protected Map<String, List<String>> prepareHeaders(String body, Map<String, List<String>> additionalHeaders) {
        Map<String, List<String>> headers = new HashMap<>();
        headers.put(USER_AGENT_HEADER_NAME, List.of(USER_AGENT));
        headers.put(HOST_HEADER_NAME, List.of(getHostHeaderValue(connectionContext)));
        if (body != null) {
            headers.put(CONTENT_TYPE_HEADER_NAME, List.of(JSON_CONTENT_TYPE));
        }
        connectionContext.getAuth().addHeaders(headers);
        if (additionalHeaders != null) {
            headers.putAll(additionalHeaders);
        }
        return headers;
    }

    public Mono<HttpResponse> getAsync(String path) {
        return asyncRequest("GET", path, null, null);
    }

    public Mono<HttpResponse> postAsync(String path, String body) {
        return asyncRequest("POST", path, body, null);
    }

    public Mono<HttpResponse> postAsync(String path, String body, Map<String, List<String>> additionalHeaders) {
        return asyncRequest("POST", path, body, additionalHeaders);
    }

    public Mono<HttpResponse> putAsync(String path, String body) {
        return asyncRequest("PUT", path, body, null);
    }
}
