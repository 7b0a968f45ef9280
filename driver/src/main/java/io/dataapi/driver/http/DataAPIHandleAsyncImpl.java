/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.http;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import javax.net.ssl.SSLException;

import io.dataapi.driver.AsyncCollection;
import io.dataapi.driver.AuthorizationProvider;
import io.dataapi.driver.DataAPIHandleAsync;
import io.dataapi.driver.DataAPIHandleConfig;
import io.dataapi.driver.ops.Request;
import io.dataapi.driver.ops.Result;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.internal.logging.InternalLoggerFactory;
import io.netty.util.internal.logging.JdkLoggerFactory;
import reactor.core.publisher.Mono;

public class DataAPIHandleAsyncImpl implements DataAPIHandleAsync {

    private final DataAPIHandleConfig config;
    private final AsyncClient client;
    private final AtomicBoolean isClosed = new AtomicBoolean(false);

    public DataAPIHandleAsyncImpl(DataAPIHandleConfig config) {
        configNettyLogging();
        final Logger logger = getLogger(config);
        this.config = config;
        client = new AsyncClient(config, configSslContext(config), logger);
    }

    /**
     * Returns the logger used for the driver. If no logger is specified
     * create one based on this class name.
     */
    private Logger getLogger(DataAPIHandleConfig config) {
        if (config.getLogger() != null) {
            return config.getLogger();
        }

        /*
         * The default logger logs at INFO. If this is too verbose users
         * must create a logger and pass it in.
         */
        return Logger.getLogger(getClass().getName());
    }

    /**
     * Configures the logging of Netty library.
     */
    private void configNettyLogging() {
        /*
         * Configure default Netty logging using Jdk Logger.
         */
        InternalLoggerFactory.setDefaultFactory(JdkLoggerFactory.INSTANCE);
    }

    /*
     * Returns the context of the config, or a default client context for
     * https endpoints, or null.
     */
    private SslContext configSslContext(DataAPIHandleConfig config) {
        if (config.getSslContext() != null) {
            return config.getSslContext();
        }
        if (config.getServiceURL().getProtocol().equalsIgnoreCase("HTTPS")) {
            try {
                SslContext ctx = SslContextBuilder.forClient().build();
                config.setSslContext(ctx);
                return ctx;
            } catch (SSLException se) {
                throw new IllegalStateException(
                    "Unable to start handle with SSL", se);
            }
        }
        return null;
    }

    @Override
    public AsyncCollection getCollection(String name) {
        return getCollection(config.getDefaultNamespace(), name);
    }

    @Override
    public AsyncCollection getCollection(String namespace, String name) {
        checkClient();
        return new AsyncCollection(this, namespace, name);
    }

    @Override
    public Mono<Result> execute(Request request) {
        checkClient();
        return client.execute(request);
    }

    @Override
    public DataAPIHandleConfig getConfig() {
        return config.clone();
    }

    @Override
    public void close() {
        if (isClosed.compareAndSet(false, true)) {
            client.shutdown();
            AuthorizationProvider ap = config.getAuthorizationProvider();
            if (ap != null) {
                ap.close();
            }
        }
    }

    void checkClient() {
        if (isClosed.get()) {
            throw new IllegalStateException("DataAPIHandle has been closed");
        }
    }

    /**
     * @hidden
     * For testing use
     */
    public AsyncClient getClient() {
        return client;
    }
}
