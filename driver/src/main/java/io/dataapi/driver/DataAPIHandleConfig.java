/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import static io.dataapi.driver.util.CheckNull.requireNonNull;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.logging.Logger;

import io.dataapi.driver.httpclient.ConnectionPoolConfig;
import io.dataapi.driver.util.HttpConstants;
import io.netty.handler.ssl.SslContext;

/**
 * DataAPIHandleConfig groups parameters used to configure a
 * {@link DataAPIHandle}. It also provides a way to default common
 * parameters for use by {@link Collection} methods. When creating a
 * DataAPIHandle, the DataAPIHandleConfig instance is copied so
 * modification operations on the instance have no effect on existing
 * handles.
 * <p>
 * Most of the configuration parameters are optional and have default
 * values if not specified. The only required parameter is the service
 * endpoint. Setters validate their argument and throw
 * IllegalArgumentException for invalid values.
 */
public class DataAPIHandleConfig implements Cloneable {

    /**
     * The default value for request timeouts in milliseconds.
     */
    public static final int DEFAULT_TIMEOUT = 10000;

    /**
     * The default number of times a throttled or unavailable response is
     * retried.
     */
    public static final int DEFAULT_MAX_RETRIES = 3;

    /**
     * The default keyspace.
     */
    public static final String DEFAULT_NAMESPACE = "default_keyspace";

    /**
     * The default number of documents per insertMany command.
     */
    public static final int DEFAULT_INSERT_MANY_CHUNK_SIZE = 50;

    /**
     * The default number of insertMany commands in flight for unordered
     * inserts.
     */
    public static final int DEFAULT_INSERT_MANY_CONCURRENCY = 20;

    /**
     * The default number of operations in flight for unordered bulk
     * writes.
     */
    public static final int DEFAULT_BULK_WRITE_CONCURRENCY = 10;

    /**
     * The default upper bound for countDocuments.
     */
    public static final int DEFAULT_COUNT_UPPER_BOUND = 1000;

    /*
     * The url used to contact the service, path stripped
     */
    private final URL serviceURL;

    private String apiPath = HttpConstants.DEFAULT_API_PATH;

    private String namespace = DEFAULT_NAMESPACE;

    private int timeout;

    private int maxRetries = DEFAULT_MAX_RETRIES;

    private AuthorizationProvider authProvider;

    private Logger logger;

    private ConnectionPoolConfig connectionPoolConfig;

    private SslContext sslCtx;

    private int sslHandshakeTimeoutMs;

    private int insertManyChunkSize = DEFAULT_INSERT_MANY_CHUNK_SIZE;

    private int insertManyConcurrency = DEFAULT_INSERT_MANY_CONCURRENCY;

    private int bulkWriteConcurrency = DEFAULT_BULK_WRITE_CONCURRENCY;

    private int countUpperBound = DEFAULT_COUNT_UPPER_BOUND;

    /**
     * Additional extension to user agent http header.
     */
    private String extensionUserAgent;

    /*
     * HTTP Proxy configuration, optional
     */
    private String proxyHost;
    private int proxyPort;
    private String proxyUsername;
    private String proxyPassword;

    /* log network traffic through Netty */
    private boolean wiretap;

    /**
     * Specifies the endpoint of the Data API service.
     * <p>
     * A fully specified endpoint is of the format:
     * <pre>    http[s]://host:port</pre>
     * Portions may be omitted. If the port is omitted, it defaults to 443
     * for https and 8080 for http. If the protocol is omitted, the endpoint
     * uses https if the port is 443, and http in all other cases.
     * For example, these are valid endpoint arguments:
     * <ul>
     * <li>https://0123abcd-us-east1.apps.example.com</li>
     * <li>localhost:8181</li>
     * <li>http://localhost:8181</li>
     * </ul>
     *
     * @param endpoint the service endpoint
     *
     * @throws IllegalArgumentException if the endpoint is null or malformed.
     */
    public DataAPIHandleConfig(String endpoint) {
        super();
        this.serviceURL = createURL(endpoint, "/");
    }

    /**
     * Specifies the endpoint and the token to use.
     *
     * @param endpoint the service endpoint
     * @param token the application token
     *
     * @throws IllegalArgumentException if the endpoint is malformed or the
     * token is empty
     */
    public DataAPIHandleConfig(String endpoint, String token) {
        this(endpoint);
        setAuthorizationProvider(new StaticTokenProvider(token));
    }

    /**
     * Sets the URL to use to connect to the service, as alternative to
     * setting the endpoint. Any path of the URL is ignored; see
     * {@link #setApiPath}.
     *
     * @param serviceURL a URL to locate the service
     *
     * @throws IllegalArgumentException if the URL is null or malformed.
     */
    public DataAPIHandleConfig(URL serviceURL) {
        super();

        requireNonNull(serviceURL,
                       "DataAPIHandleConfig: serviceURL must be non-null");

        try {
            this.serviceURL = new URL(serviceURL.getProtocol(),
                                      serviceURL.getHost(),
                                      serviceURL.getPort(), "/");
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * @hidden
     *
     * @param endpoint the endpoint to use
     * @param path the path to use
     * @return the constructed URL
     */
    public static URL createURL(String endpoint, String path) {
        requireNonNull(endpoint,
                       "Endpoint must be non-null");

        /* The defaults for protocol and port */
        String protocol = "https";
        int port = 443;
        String host = null;

        /* Strip a trailing slash, "https://host/" is common */
        while (endpoint.endsWith("/")) {
            endpoint = endpoint.substring(0, endpoint.length() - 1);
        }

        /* Possible formats are:
         * - host
         * - protocol://host
         * - host:port
         * - protocol://host:port
         */

        String[] parts = endpoint.split(":");
        switch (parts.length) {
            case 1:
                /* endpoint is just <host> */
                host = parts[0];
                break;
            case 2:
                /* Could be <protocol>://<host>, or could be <host>:<port> */
                if (parts[0].toLowerCase().startsWith("http")) {
                    protocol = parts[0].toLowerCase();
                    host = parts[1]; /* may have slashes to strip out */
                    if (protocol.equals("http")) {
                        /* Override the default of 443 */
                        port = 8080;
                    }
                } else {
                    host = parts[0];
                    port = validatePort(parts[1], endpoint);
                    if (port != 443) {
                        /* Override the default of https */
                        protocol = "http";
                    }
                }
                break;
             case 3:
                 /* the full <protocol>://<host>:<port> */
                 protocol = parts[0].toLowerCase();
                 host = parts[1];
                 port = validatePort(parts[2], endpoint);
                 break;
             default:
                 throw new IllegalArgumentException("Invalid endpoint: " +
                                                    endpoint);
        }

        /* Strip out any slashes if the format was protocol://host */
        if (host.startsWith("//")) {
            host = host.substring(2);
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("Invalid endpoint: " +
                                               endpoint);
        }
        if (!protocol.equals("http") && !protocol.equals("https")) {
            throw new IllegalArgumentException("Unknown protocol: " +
                                               protocol);
        }

        try {
            return new URL(protocol, host, port, path);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /*
     * Check that a port is a valid, non negative integer.
     */
    private static int validatePort(String portString, String endpoint) {
        int port;
        try {
            port = Integer.parseInt(portString);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port value for " +
                                               "endpoint:" + endpoint);
        }
        if (port < 0) {
            throw new IllegalArgumentException
                ("invalid port value of " + port + " for endpoint:" +
                 endpoint);
        }
        return port;
    }

    /**
     * Returns the URL of the service, without path.
     *
     * @return the URL.
     */
    public URL getServiceURL() {
        return serviceURL;
    }

    /**
     * Returns the path prefix of the JSON API, default "/api/json/v1".
     *
     * @return the path
     */
    public String getApiPath() {
        return apiPath;
    }

    /**
     * Sets the path prefix of the JSON API. Commands are sent to
     * {@code <apiPath>/<keyspace>/<collection>}.
     *
     * @param apiPath the path, must start with "/"
     *
     * @return this
     */
    public DataAPIHandleConfig setApiPath(String apiPath) {
        requireNonNull(apiPath, "apiPath must be non-null");
        if (!apiPath.startsWith("/")) {
            throw new IllegalArgumentException(
                "apiPath must start with '/': " + apiPath);
        }
        while (apiPath.length() > 1 && apiPath.endsWith("/")) {
            apiPath = apiPath.substring(0, apiPath.length() - 1);
        }
        this.apiPath = apiPath;
        return this;
    }

    /**
     * Returns the default keyspace used by
     * {@link DataAPIHandle#getCollection(String)}.
     *
     * @return the keyspace
     */
    public String getDefaultNamespace() {
        return namespace;
    }

    /**
     * Sets the default keyspace.
     *
     * @param namespace the keyspace
     *
     * @return this
     */
    public DataAPIHandleConfig setDefaultNamespace(String namespace) {
        if (namespace == null || namespace.isEmpty()) {
            throw new IllegalArgumentException(
                "Namespace must be non-empty");
        }
        this.namespace = namespace;
        return this;
    }

    /**
     * Returns the configured request timeout value, in milliseconds, 0 if
     * it has not been set.
     *
     * @return the timeout, in milliseconds, or 0 if it has not been set
     */
    public int getRequestTimeout() {
        return timeout;
    }

    /**
     * Returns the default value for request timeout in milliseconds. If
     * there is no configured timeout or it is configured as 0, a "default"
     * default value of 10000 milliseconds is used.
     *
     * @return the default timeout, in milliseconds
     */
    public int getDefaultRequestTimeout() {
        return timeout == 0 ? DEFAULT_TIMEOUT : timeout;
    }

    /**
     * Sets the default request timeout. Retries of throttled or
     * unavailable responses happen within this interval.
     *
     * @param timeout the timeout value, in milliseconds
     *
     * @return this
     */
    public DataAPIHandleConfig setRequestTimeout(int timeout) {
        if (timeout <= 0) {
            throw new IllegalArgumentException(
                "Request timeout must be positive");
        }
        this.timeout = timeout;
        return this;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Sets the number of times a retryable failure (HTTP 429, 502, 503,
     * 504) is retried before it is reported. 0 disables retries.
     *
     * @param maxRetries the number of retries
     *
     * @return this
     */
    public DataAPIHandleConfig setMaxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must be non-negative");
        }
        this.maxRetries = maxRetries;
        return this;
    }

    /**
     * Returns the {@link AuthorizationProvider} configured for the handle,
     * or null if not set.
     *
     * @return the AuthorizationProvider
     */
    public AuthorizationProvider getAuthorizationProvider() {
        return authProvider;
    }

    public DataAPIHandleConfig setAuthorizationProvider(
        AuthorizationProvider provider) {
        this.authProvider = provider;
        return this;
    }

    /**
     * Sets the logger used for the driver. If not set, the driver logs
     * through a logger named after the handle implementation class.
     *
     * @param logger the logger
     *
     * @return this
     */
    public DataAPIHandleConfig setLogger(Logger logger) {
        this.logger = logger;
        return this;
    }

    /**
     * Returns the logger, or null if not set.
     *
     * @return the logger
     */
    public Logger getLogger() {
        return logger;
    }

    /**
     * Returns the connection pool configuration, or null if the default
     * is used.
     *
     * @return the configuration
     */
    public ConnectionPoolConfig getConnectionPoolConfig() {
        return connectionPoolConfig;
    }

    public DataAPIHandleConfig setConnectionPoolConfig(
        ConnectionPoolConfig connectionPoolConfig) {
        this.connectionPoolConfig = connectionPoolConfig;
        return this;
    }

    /**
     * Sets the SslContext used for https endpoints. If not set one is
     * built with the JDK defaults when the handle is created.
     *
     * @param sslCtx the context
     *
     * @return this
     */
    public DataAPIHandleConfig setSslContext(SslContext sslCtx) {
        this.sslCtx = sslCtx;
        return this;
    }

    public SslContext getSslContext() {
        return sslCtx;
    }

    /**
     * Returns the SSL handshake timeout in milliseconds, 0 for the default.
     *
     * @return the timeout
     */
    public int getSSLHandshakeTimeout() {
        return sslHandshakeTimeoutMs;
    }

    public DataAPIHandleConfig setSSLHandshakeTimeout(int timeoutMs) {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException(
                "SSL handshake timeout must be non-negative");
        }
        this.sslHandshakeTimeoutMs = timeoutMs;
        return this;
    }

    public int getInsertManyChunkSize() {
        return insertManyChunkSize;
    }

    /**
     * Sets the number of documents sent per insertMany command.
     *
     * @param chunkSize the number of documents, 1 to 100
     *
     * @return this
     */
    public DataAPIHandleConfig setInsertManyChunkSize(int chunkSize) {
        if (chunkSize <= 0 || chunkSize > 100) {
            throw new IllegalArgumentException(
                "insertMany chunk size must be between 1 and 100");
        }
        this.insertManyChunkSize = chunkSize;
        return this;
    }

    public int getInsertManyConcurrency() {
        return insertManyConcurrency;
    }

    public DataAPIHandleConfig setInsertManyConcurrency(int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "insertMany concurrency must be positive");
        }
        this.insertManyConcurrency = concurrency;
        return this;
    }

    public int getBulkWriteConcurrency() {
        return bulkWriteConcurrency;
    }

    public DataAPIHandleConfig setBulkWriteConcurrency(int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "bulkWrite concurrency must be positive");
        }
        this.bulkWriteConcurrency = concurrency;
        return this;
    }

    public int getCountUpperBound() {
        return countUpperBound;
    }

    /**
     * Sets the default upper bound used by
     * {@link Collection#countDocuments(io.dataapi.driver.values.MapValue)}.
     *
     * @param upperBound the bound
     *
     * @return this
     */
    public DataAPIHandleConfig setCountUpperBound(int upperBound) {
        if (upperBound <= 0) {
            throw new IllegalArgumentException(
                "count upper bound must be positive");
        }
        this.countUpperBound = upperBound;
        return this;
    }

    /**
     * Returns the set extension to the user agent http header or null if
     * unset.
     *
     * @return the extension
     */
    public String getExtensionUserAgent() {
        return extensionUserAgent;
    }

    /**
     * Sets an extension to the user agent http header. Extension must be
     * up to 64 chars long.
     *
     * @param extensionUserAgent the extension
     *
     * @return this
     */
    public DataAPIHandleConfig setExtensionUserAgent(
        String extensionUserAgent) {
        if (extensionUserAgent != null && extensionUserAgent.length() > 64) {
            throw new IllegalArgumentException("User agent extension too " +
                "long, must be up to 64 chars long: " +
                extensionUserAgent.length());
        }
        this.extensionUserAgent = extensionUserAgent;
        return this;
    }

    /**
     * Sets an HTTP proxy host to be used for the session. If a proxy host
     * is specified a proxy port must also be specified, using
     * {@link #setProxyPort}.
     *
     * @param proxyHost the proxy host
     *
     * @return this
     */
    public DataAPIHandleConfig setProxyHost(String proxyHost) {
        this.proxyHost = proxyHost;
        return this;
    }

    /**
     * Sets an HTTP proxy user name if the configured proxy host requires
     * authentication. If a proxy user name is configured a proxy password
     * must also be configured, using {@link #setProxyPassword}.
     *
     * @param proxyUsername the user name
     *
     * @return this
     */
    public DataAPIHandleConfig setProxyUsername(String proxyUsername) {
        this.proxyUsername = proxyUsername;
        return this;
    }

    /**
     * Sets an HTTP proxy password if the configured proxy host requires
     * authentication.
     *
     * @param proxyPassword the password
     *
     * @return this
     */
    public DataAPIHandleConfig setProxyPassword(String proxyPassword) {
        this.proxyPassword = proxyPassword;
        return this;
    }

    /**
     * Sets an HTTP proxy port to be used for the session. If a proxy port
     * is specified a proxy host must also be specified, using
     * {@link #setProxyHost}.
     *
     * @param proxyPort the proxy port
     *
     * @return this
     */
    public DataAPIHandleConfig setProxyPort(int proxyPort) {
        if (proxyPort < 0) {
            throw new IllegalArgumentException("proxyPort must be >= 0");
        }
        this.proxyPort = proxyPort;
        return this;
    }

    /**
     * Returns a proxy host, or null if not configured
     *
     * @return the host, or null
     */
    public String getProxyHost() {
        return proxyHost;
    }

    /**
     * Returns a proxy user name, or null if not configured
     *
     * @return the user name, or null
     */
    public String getProxyUsername() {
        return proxyUsername;
    }

    /**
     * Returns a proxy password, or null if not configured
     *
     * @return the password, or null
     */
    public String getProxyPassword() {
        return proxyPassword;
    }

    /**
     * Returns a proxy port, or 0 if not configured
     *
     * @return the proxy port
     */
    public int getProxyPort() {
        return proxyPort;
    }

    /**
     * Enables logging of the HTTP traffic through Netty's logger, at FINE.
     * Off by default.
     *
     * @param wiretap true to log traffic
     *
     * @return this
     */
    public DataAPIHandleConfig setWiretap(boolean wiretap) {
        this.wiretap = wiretap;
        return this;
    }

    public boolean getWiretap() {
        return wiretap;
    }

    @Override
    public DataAPIHandleConfig clone() {
        try {
            return (DataAPIHandleConfig) super.clone();
        } catch (CloneNotSupportedException neverHappens) {
            throw new IllegalStateException(neverHappens);
        }
    }
}
