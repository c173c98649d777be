package org.vectorfill.clients.http;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Credentials added to every request of a {@link ConnectionContext}.
 */
public interface AuthConfig {

    String AUTHORIZATION_HEADER_NAME = "Authorization";

    void addHeaders(Map<String, List<String>> headers);

    class NoAuth implements AuthConfig {
        public static final NoAuth INSTANCE = new NoAuth();
        private NoAuth() {}

        @Override
        public void addHeaders(Map<String, List<String>> headers) {
            // nothing to add
        }
    }

    class BasicAuth implements AuthConfig {
        public final String username;
        public final String password;

        public BasicAuth(String username, String password) {
            if (username == null || password == null) {
                throw new IllegalArgumentException("Both username and password must be provided");
            }
            this.username = username;
            this.password = password;
        }

        @Override
        public void addHeaders(Map<String, List<String>> headers) {
            var token = Base64.getEncoder().encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
            headers.put(AUTHORIZATION_HEADER_NAME, List.of("Basic " + token));
        }
    }

    class BearerAuth implements AuthConfig {
        private final String token;

        public BearerAuth(String token) {
            if (token == null || token.isBlank()) {
                throw new IllegalArgumentException("A bearer token must be provided");
            }
            this.token = token;
        }

        @Override
        public void addHeaders(Map<String, List<String>> headers) {
            headers.put(AUTHORIZATION_HEADER_NAME, List.of("Bearer " + token));
        }

        @Override
        public String toString() {
            return "BearerAuth[****]";
        }
    }

    /** Elasticsearch style API keys, sent as {@code Authorization: ApiKey <key>}. */
    class ApiKeyAuth implements AuthConfig {
        private final String encodedKey;

        public ApiKeyAuth(String encodedKey) {
            if (encodedKey == null || encodedKey.isBlank()) {
                throw new IllegalArgumentException("An API key must be provided");
            }
            this.encodedKey = encodedKey;
        }

        @Override
        public void addHeaders(Map<String, List<String>> headers) {
            headers.put(AUTHORIZATION_HEADER_NAME, List.of("ApiKey " + encodedKey));
        }

        @Override
        public String toString() {
            return "ApiKeyAuth[****]";
        }
    }
}
