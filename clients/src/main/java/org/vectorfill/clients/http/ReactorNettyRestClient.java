package org.vectorfill.clients.http;

import java.time.Duration;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.tcp.SslProvider;

/**
 * Implementation of RestClient using Reactor Netty.
 */
public class ReactorNettyRestClient extends AbstractRestClient {

    public ReactorNettyRestClient(ConnectionContext connectionContext) {
        this(connectionContext, 0, null);
    }

    /**
     * @param maxConnections  if &gt; 0, the size of a dedicated connection pool; otherwise Reactor's default pool
     * @param responseTimeout how long to wait for a response; null for no limit
     */
    public ReactorNettyRestClient(ConnectionContext connectionContext, int maxConnections, Duration responseTimeout) {
        super(connectionContext, createAdapter(connectionContext, maxConnections, responseTimeout));
    }

    public ReactorNettyRestClient(ConnectionContext connectionContext, HttpClientAdapter adapter) {
        super(connectionContext, adapter);
    }

    private static ReactorNettyAdapter createAdapter(ConnectionContext connectionContext, int maxConnections,
                                                     Duration responseTimeout) {
        HttpClient httpClient;
        if (maxConnections <= 0) {
            httpClient = HttpClient.create();
        } else {
            httpClient = HttpClient.create(ConnectionProvider.create("RestClient", maxConnections));
        }

        if (connectionContext.getProtocol() == ConnectionContext.Protocol.HTTPS) {
            SslProvider sslProvider;
            if (connectionContext.isInsecure()) {
                sslProvider = getInsecureSslProvider();
            } else if (connectionContext.getCaCertificate() != null) {
                sslProvider = getCaSslProvider(connectionContext);
            } else {
                sslProvider = SslProvider.defaultClientProvider();
            }
            httpClient = httpClient.secure(sslProvider);
        }
        if (responseTimeout != null) {
            httpClient = httpClient.responseTimeout(responseTimeout);
        }

        httpClient = httpClient
            .baseUrl(connectionContext.getUri().getScheme() + "://" + connectionContext.getUri().getAuthority())
            .disableRetry(false) // one retry on connection reset with no delay
            .keepAlive(true);

        return new ReactorNettyAdapter(httpClient);
    }

    private static SslProvider getCaSslProvider(ConnectionContext connectionContext) {
        try {
            SslContext sslContext = SslContextBuilder.forClient()
                .trustManager(connectionContext.getCaCertificate().toFile())
                .build();
            return SslProvider.builder().sslContext(sslContext).build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to construct SslProvider from "
                + connectionContext.getCaCertificate(), e);
        }
    }

    private static SslProvider getInsecureSslProvider() {
        try {
            SslContext sslContext = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();

            return SslProvider.builder()
                .sslContext(sslContext)
                .handlerConfigurator(sslHandler -> {
                    SSLEngine engine = sslHandler.engine();
                    SSLParameters sslParameters = engine.getSSLParameters();
                    sslParameters.setEndpointIdentificationAlgorithm(null);
                    engine.setSSLParameters(sslParameters);
                })
                .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to construct SslProvider", e);
        }
    }
}
