package org.vectorfill.clients.http;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Where and how to connect to a remote HTTP service.
 */
@Getter
@ToString
public class ConnectionContext {

    public enum Protocol {
        HTTP,
        HTTPS
    }

    private final URI uri;
    private final Protocol protocol;
    private final boolean insecure;
    private final Path caCertificate;
    private final AuthConfig auth;

    /**
     * @param host          base URL, e.g. {@code https://localhost:9200}
     * @param insecure      trust any certificate and skip hostname verification
     * @param caCertificate PEM file with the certificate authority to trust; may be null
     * @param auth          credentials; null for none
     */
    @Builder
    public ConnectionContext(String host, boolean insecure, Path caCertificate, AuthConfig auth) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("A host URL is required");
        }
        try {
            this.uri = new URI(stripTrailingSlash(host));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid host URL: " + host, e);
        }
        if ("http".equalsIgnoreCase(uri.getScheme())) {
            this.protocol = Protocol.HTTP;
        } else if ("https".equalsIgnoreCase(uri.getScheme())) {
            this.protocol = Protocol.HTTPS;
        } else {
            throw new IllegalArgumentException("Host URL must start with http:// or https://, got " + host);
        }
        if (protocol == Protocol.HTTP && (insecure || caCertificate != null)) {
            throw new IllegalArgumentException("TLS options were given for a plain HTTP URL " + host);
        }
        this.insecure = insecure;
        this.caCertificate = caCertificate;
        this.auth = auth != null ? auth : AuthConfig.NoAuth.INSTANCE;
    }

    private static String stripTrailingSlash(String host) {
        return host.endsWith("/") ? host.substring(0, host.length() - 1) : host;
    }
}
