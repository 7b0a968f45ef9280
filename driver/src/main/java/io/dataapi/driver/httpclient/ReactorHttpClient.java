/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.httpclient;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.ssl.SslContext;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.ProxyProvider;

/**
 * Internal use only, not meant for public usage can change in the future.
 * <p>
 * An HTTP client for a single host built on the reactor-netty
 * {@link HttpClient}, with its own {@link ConnectionProvider}.
 * <p>
 * The event loops are the reactor-netty defaults, shared by every client
 * of the process and sized by {@code -Dreactor.netty.ioWorkerCount}. The
 * connection pool belongs to this client and is disposed by
 * {@link #shutdown}.
 */
public class ReactorHttpClient {
    static final int DEFAULT_MAX_CONTENT_LENGTH = 32 * 1024 * 1024; // 32MB
    static final int DEFAULT_MAX_CHUNK_SIZE = 65536;
    static final int DEFAULT_HANDSHAKE_TIMEOUT_MS = 3000;
    static final int DEFAULT_MAX_INITIAL_LINE_LENGTH = 4096;
    static final int DEFAULT_MAX_HEADER_SIZE = 8192;

    private final Logger logger;
    private final String host;
    private final int port;
    private final SslContext sslContext;
    private final ConnectionPoolConfig connectionPoolConfig;
    private final ConnectionProvider connectionProvider;
    private final int maxContentLength;
    private final HttpClient httpClient;
    private final String proxyHost;
    private final int proxyPort;

    private ReactorHttpClient(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.connectionPoolConfig = builder.config;
        this.sslContext = builder.sslContext;
        this.logger = builder.logger;
        this.maxContentLength = builder.maxContentLength;
        this.proxyHost = builder.proxyHost;
        this.proxyPort = builder.proxyPort;

        connectionProvider =
            (connectionPoolConfig.getMaxConnections() == 1) ?
            ConnectionProvider.newConnection() :
            ConnectionProvider
            .builder(host + ":" + port + "-pool")
            .maxConnections(connectionPoolConfig.getMaxConnections())
            .pendingAcquireTimeout(Duration.ofMillis(
                connectionPoolConfig.getPendingAcquireTimeout()))
            .pendingAcquireMaxCount(
                connectionPoolConfig.getMaxPendingAcquires())
            .maxIdleTime(Duration.ofMillis(
                connectionPoolConfig.getMaxIdleTime()))
            .maxLifeTime(Duration.ofMillis(
                connectionPoolConfig.getMaxLifetime()))
            .build();

        HttpClient client = HttpClient
            .create(connectionProvider)
            .host(host)
            .port(port)
            .httpResponseDecoder(spec -> spec
                                 .maxChunkSize(builder.maxChunkSize)
                                 .maxHeaderSize(builder.maxHeaderSize)
                                 .maxInitialLineLength(
                                     builder.maxInitialLineLength))
            .option(ChannelOption.SO_KEEPALIVE, true)
            .option(ChannelOption.TCP_NODELAY, true)
            .wiretap(builder.wiretap);

        if (builder.proxyHost != null) {
            client = client.proxy(spec -> {
                ProxyProvider.Builder proxy = spec
                    .type(ProxyProvider.Proxy.HTTP)
                    .host(builder.proxyHost)
                    .port(builder.proxyPort);
                if (builder.proxyUserName != null) {
                    proxy.username(builder.proxyUserName)
                         .password(user -> builder.proxyPassword);
                }
            });
        }

        if (sslContext != null) {
            client = client.secure(sslContextSpec -> sslContextSpec
                                   .sslContext(sslContext)
                                   .handshakeTimeoutMillis(
                                       builder.sslHandshakeTimeoutMs));
        }
        httpClient = client;
        logger.fine("Created HTTP client for " + host + ":" + port +
                    ", " + connectionPoolConfig);
    }

    /**
     * Send the Http request to the remote server
     * @param uri  The target path to send the request to
     * @param headers  The HTTP header to use with the request
     * @param httpMethod The HTTP request method
     * @param body The request body, may be null
     * @return Mono of the response from the server
     */
    public Mono<HttpResponse> sendRequest(String uri,
                                          HttpHeaders headers,
                                          HttpMethod httpMethod,
                                          ByteBuf body) {
        /*
         * The current response, kept so that a body nobody consumed can be
         * drained on cancel or error.
         */
        final AtomicReference<HttpResponse> responseReference =
            new AtomicReference<HttpResponse>();

        return httpClient.request(httpMethod)
            .uri(uri)
            .send((httpClientRequest, nettyOutbound) -> {
                httpClientRequest.headers(headers);
                if (body != null) {
                    return nettyOutbound.send(Mono.just(body));
                }
                return nettyOutbound;
            })
            .responseConnection((httpClientResponse, connection) -> {
                HttpResponse response =
                    new HttpResponse(httpClientResponse, connection);
                responseReference.set(response);
                return Mono.just(response);
            })
            .next()
            .doOnCancel(() -> {
                HttpResponse response = responseReference.get();
                if (response != null) {
                    response.releaseUnSubscribedResponse(
                        HttpResponse.SubscriptionState.CANCELLED);
                }
            })
            .doOnError(throwable -> {
                HttpResponse response = responseReference.get();
                if (response != null) {
                    response.releaseUnSubscribedResponse(
                        HttpResponse.SubscriptionState.ERROR);
                }
            });
    }

    /**
     * send HTTP POST request
     *
     * @param uri The target path to send the request to
     * @param headers The HTTP header to use with the request
     * @param body The request body
     * @return Mono of the response from the server
     */
    public Mono<HttpResponse> postRequest(String uri,
                                          HttpHeaders headers,
                                          ByteBuf body) {
        return sendRequest(uri, headers, HttpMethod.POST, body);
    }

    /**
     * send HTTP POST request
     *
     * @param uri The target path to send the request to
     * @param headers A Mono which returns The HTTP header to use with the
     *                request when subscribed to
     * @param body The request body
     * @return Mono of the response from the server
     */
    public Mono<HttpResponse> postRequest(String uri,
                                          Mono<HttpHeaders> headers,
                                          ByteBuf body) {
        return headers.flatMap(h -> sendRequest(uri, h, HttpMethod.POST,
                                                body));
    }

    public int getMaxContentLength() {
        return maxContentLength;
    }

    /**
     * Disposes the connection pool. Requests in flight may fail.
     */
    public void shutdown() {
        logger.fine("Shutting down HTTP client for " + host + ":" + port);
        connectionProvider.dispose();
    }

    public boolean isShutdown() {
        return connectionProvider.isDisposed();
    }

    /**
     * @hidden
     * For testing only
     */
    public HttpClient getHttpClient() {
        return httpClient;
    }

    /**
     * @hidden
     * For testing only
     */
    public Logger getLogger() {
        return logger;
    }

    /**
     * @hidden
     * For testing only
     */
    public String getHost() {
        return host;
    }

    /**
     * @hidden
     * For testing only
     */
    public int getPort() {
        return port;
    }

    /**
     * @hidden
     * For testing only
     */
    public SslContext getSslContext() {
        return sslContext;
    }

    /**
     * @hidden
     * For testing only
     */
    public ConnectionPoolConfig getConnectionPoolConfig() {
        return connectionPoolConfig;
    }

    /**
     * @hidden
     * For testing only
     */
    public String getProxyHost() {
        return proxyHost;
    }

    /**
     * @hidden
     * For testing only
     */
    public int getProxyPort() {
        return proxyPort;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private String host = "localhost";
        private int port = 80;
        private int maxContentLength = DEFAULT_MAX_CONTENT_LENGTH;
        private int maxInitialLineLength = DEFAULT_MAX_INITIAL_LINE_LENGTH;
        private int maxHeaderSize = DEFAULT_MAX_HEADER_SIZE;
        private int maxChunkSize = DEFAULT_MAX_CHUNK_SIZE;
        private int sslHandshakeTimeoutMs = DEFAULT_HANDSHAKE_TIMEOUT_MS;
        private ConnectionPoolConfig config =
            ConnectionPoolConfig.builder().build();
        private SslContext sslContext;
        private String proxyHost;
        private int proxyPort;
        private String proxyUserName;
        private String proxyPassword;
        private boolean wiretap;
        private Logger logger =
            Logger.getLogger(ReactorHttpClient.class.getName());

        /**
         * Sets the host name for the HTTP server.
         * Default to localhost.
         *
         * @param host the host name for the HTTP server
         * @return this
         * @throws IllegalArgumentException If host is null or empty
         */
        public Builder host(String host) {
            if (host == null || host.isEmpty()) {
                throw new IllegalArgumentException("host is either null or " +
                    "empty");
            }
            this.host = host;
            return this;
        }

        /**
         * Set the port for the HTTP server.
         * Default to 80
         *
         * @param port port for the HTTP server.
         * @return this
         * @throws IllegalArgumentException If port is not positive
         */
        public Builder port(int port) {
            if (port <= 0) {
                throw new IllegalArgumentException("port must be positive");
            }
            this.port = port;
            return this;
        }

        /**
         * Set the maximum size in bytes of requests/responses. If zero
         * default value is used.
         * Default to {@value DEFAULT_MAX_CONTENT_LENGTH}.
         *
         * @param maxContentLength maximum size in bytes of requests/responses.
         * @return this
         * @throws IllegalArgumentException If maxContentLength is negative
         */
        public Builder maxContentLength(int maxContentLength) {
            if (maxContentLength < 0) {
                throw new IllegalArgumentException("maxContentLength is " +
                    "negative");
            }
            if (maxContentLength != 0) {
                this.maxContentLength = maxContentLength;
            }
            return this;
        }

        /**
         * Set the maximum length of the HTTP response's initial line. If
         * zero default value is used.
         * Default to {@value DEFAULT_MAX_INITIAL_LINE_LENGTH}
         *
         * @param maxInitialLineLength the maximum initial line length
         * @return this
         * @throws IllegalArgumentException If maxInitialLineLength is negative
         */
        public Builder maxInitialLineLength(int maxInitialLineLength) {
            if (maxInitialLineLength < 0) {
                throw new IllegalArgumentException("maxInitialLineLength is " +
                    "negative");
            }
            if (maxInitialLineLength != 0) {
                this.maxInitialLineLength = maxInitialLineLength;
            }
            return this;
        }

        /**
         * Set the maximum header size that can be decoded for the HTTP
         * response. If zero default value is used.
         * Default to {@value DEFAULT_MAX_HEADER_SIZE}
         *
         * @param maxHeaderSize the maximum header size
         * @return this
         * @throws IllegalArgumentException If maxHeaderSize is negative
         */
        public Builder maxHeaderSize(int maxHeaderSize) {
            if (maxHeaderSize < 0) {
                throw new IllegalArgumentException("maxHeaderSize is negative");
            }
            if (maxHeaderSize != 0) {
                this.maxHeaderSize = maxHeaderSize;
            }
            return this;
        }

        /**
         * Set the maximum chunk size that can be decoded for the HTTP
         * response. If zero default value is used.
         * Default to {@value DEFAULT_MAX_CHUNK_SIZE}
         *
         * @param maxChunkSize the maximum chunk size
         * @return this
         * @throws IllegalArgumentException If maxChunkSize is negative
         */
        public Builder maxChunkSize(int maxChunkSize) {
            if (maxChunkSize < 0) {
                throw new IllegalArgumentException("maxChunkSize is " +
                    "negative");
            }
            if (maxChunkSize != 0) {
                this.maxChunkSize = maxChunkSize;
            }
            return this;
        }

        /**
         * Set the SSL handshake timeout. If zero default value is used.
         * Default to {@value DEFAULT_HANDSHAKE_TIMEOUT_MS}
         *
         * @param sslHandshakeTimeoutMs the SSL handshake timeout in
         * milliseconds
         * @return this
         * @throws IllegalArgumentException If sslHandshakeTimeoutMs is
         * negative
         */
        public Builder sslHandshakeTimeoutMs(int sslHandshakeTimeoutMs) {
            if (sslHandshakeTimeoutMs < 0) {
                throw new IllegalArgumentException("sslHandshakeTimeoutMs " +
                    "is negative");
            }
            if (sslHandshakeTimeoutMs != 0) {
                this.sslHandshakeTimeoutMs = sslHandshakeTimeoutMs;
            }
            return this;
        }

        /**
         * sets the connection pool config
         *
         * @param config connection pool config, null for the default
         * @return this
         */
        public Builder connectionPoolConfig(ConnectionPoolConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Set the ssl context, required for https
         *
         * @param sslContext the ssl context
         * @return this
         */
        public Builder sslContext(SslContext sslContext) {
            this.sslContext = sslContext;
            return this;
        }

        public Builder proxyHost(String proxyHost) {
            this.proxyHost = proxyHost;
            return this;
        }

        public Builder proxyPort(int proxyPort) {
            this.proxyPort = proxyPort;
            return this;
        }

        public Builder proxyUsername(String proxyUserName) {
            this.proxyUserName = proxyUserName;
            return this;
        }

        public Builder proxyPassword(String proxyPassword) {
            this.proxyPassword = proxyPassword;
            return this;
        }

        /**
         * Logs the traffic through Netty's logging, at FINE, when true.
         *
         * @param wiretap true to log traffic
         * @return this
         */
        public Builder wiretap(boolean wiretap) {
            this.wiretap = wiretap;
            return this;
        }

        public Builder logger(Logger logger) {
            if (logger != null) {
                this.logger = logger;
            }
            return this;
        }

        public ReactorHttpClient build() {
            if ((proxyHost != null && proxyPort == 0) ||
                    (proxyHost == null && proxyPort != 0)) {
                throw new IllegalArgumentException(
                        "To configure an HTTP proxy, both host and port " +
                        "are required");
            }
            if ((proxyUserName != null && proxyPassword == null) ||
                    (proxyUserName == null && proxyPassword != null)) {
                throw new IllegalArgumentException(
                        "To configure HTTP proxy authentication, both user " +
                        "name and password are required");
            }
            if (config == null) {
                config = ConnectionPoolConfig.builder().build();
            }
            return new ReactorHttpClient(this);
        }
    }
}
