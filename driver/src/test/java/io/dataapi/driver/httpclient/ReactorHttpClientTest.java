/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.httpclient;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.net.SocketAddress;
import java.util.logging.Logger;

import javax.net.ssl.SSLException;

import org.junit.Test;

import io.netty.handler.ssl.SslContextBuilder;
import reactor.netty.http.client.HttpClientConfig;
import reactor.netty.transport.ProxyProvider;

/**
 * Test for {@link ReactorHttpClient}
 */
public class ReactorHttpClientTest {

    @Test
    public void testDefaultConfig() {
        ReactorHttpClient httpClient = ReactorHttpClient.builder().build();
        try {
            HttpClientConfig cfg = httpClient.getHttpClient().configuration();

            SocketAddress address = cfg.remoteAddress().get();
            String hostPort = address.toString();
            assertTrue(hostPort.contains("localhost"));
            assertTrue(hostPort.contains("80"));

            assertNull(cfg.sslProvider());
            assertNull(httpClient.getSslContext());

            assertEquals(ReactorHttpClient.DEFAULT_MAX_INITIAL_LINE_LENGTH,
                         cfg.decoder().maxInitialLineLength());
            assertEquals(ReactorHttpClient.DEFAULT_MAX_HEADER_SIZE,
                         cfg.decoder().maxHeaderSize());
            assertEquals(ReactorHttpClient.DEFAULT_MAX_CHUNK_SIZE,
                         cfg.decoder().maxChunkSize());
            assertEquals(ReactorHttpClient.DEFAULT_MAX_CONTENT_LENGTH,
                         httpClient.getMaxContentLength());

            assertEquals(ReactorHttpClient.class.getName(),
                         httpClient.getLogger().getName());

            assertEquals(ConnectionPoolConfig.DEFAULT_MAX_CONNECTIONS,
                         cfg.connectionProvider().maxConnections());

            assertFalse(cfg.hasProxy());
            assertNull(cfg.loggingHandler());
            assertNotNull(cfg.loopResources());
        } finally {
            httpClient.shutdown();
        }
        assertTrue(httpClient.isShutdown());
    }

    @Test
    public void testCustomConfig() throws SSLException {
        ConnectionPoolConfig poolConfig = ConnectionPoolConfig.builder()
            .maxConnections(20)
            .maxPendingAcquires(200)
            .pendingAcquireTimeout(10000)
            .maxIdleTime(5000)
            .maxLifetime(30000)
            .build();

        Logger logger = Logger.getLogger(getClass().getName());

        ReactorHttpClient httpClient = ReactorHttpClient.builder()
            .host("db-1234.apps.example.com")
            .port(443)
            .sslContext(SslContextBuilder.forClient().build())
            .sslHandshakeTimeoutMs(10000)
            .maxContentLength(2048)
            .maxChunkSize(4096)
            .maxHeaderSize(2048)
            .maxInitialLineLength(1024)
            .connectionPoolConfig(poolConfig)
            .wiretap(true)
            .logger(logger)
            .build();
        try {
            HttpClientConfig cfg = httpClient.getHttpClient().configuration();

            String hostPort = cfg.remoteAddress().get().toString();
            assertTrue(hostPort.contains("db-1234.apps.example.com"));
            assertTrue(hostPort.contains("443"));
            assertEquals("db-1234.apps.example.com", httpClient.getHost());
            assertEquals(443, httpClient.getPort());

            assertNotNull(cfg.sslProvider());

            assertEquals(1024, cfg.decoder().maxInitialLineLength());
            assertEquals(2048, cfg.decoder().maxHeaderSize());
            assertEquals(4096, cfg.decoder().maxChunkSize());
            assertEquals(2048, httpClient.getMaxContentLength());

            assertSame(logger, httpClient.getLogger());
            assertSame(poolConfig, httpClient.getConnectionPoolConfig());
            assertEquals(20, cfg.connectionProvider().maxConnections());

            assertNotNull(cfg.loggingHandler());
            assertFalse(cfg.hasProxy());
        } finally {
            httpClient.shutdown();
        }
    }

    @Test
    public void testZeroUsesDefaults() {
        ReactorHttpClient httpClient = ReactorHttpClient.builder()
            .maxContentLength(0)
            .maxChunkSize(0)
            .maxHeaderSize(0)
            .maxInitialLineLength(0)
            .sslHandshakeTimeoutMs(0)
            .connectionPoolConfig(null)
            .logger(null)
            .build();
        try {
            HttpClientConfig cfg = httpClient.getHttpClient().configuration();
            assertEquals(ReactorHttpClient.DEFAULT_MAX_CHUNK_SIZE,
                         cfg.decoder().maxChunkSize());
            assertEquals(ReactorHttpClient.DEFAULT_MAX_CONTENT_LENGTH,
                         httpClient.getMaxContentLength());
            assertNotNull(httpClient.getConnectionPoolConfig());
            assertNotNull(httpClient.getLogger());
        } finally {
            httpClient.shutdown();
        }
    }

    @Test
    public void testProxy() {
        ReactorHttpClient httpClient = ReactorHttpClient.builder()
            .proxyHost("proxy.example.com")
            .proxyPort(3128)
            .proxyUsername("scott")
            .proxyPassword("tiger")
            .build();
        try {
            ProxyProvider proxyProvider =
                httpClient.getHttpClient().configuration().proxyProvider();
            assertNotNull(proxyProvider);
            assertEquals("proxy.example.com",
                         proxyProvider.getAddress().get().getHostName());
            assertEquals(3128, proxyProvider.getAddress().get().getPort());
            assertEquals("proxy.example.com", httpClient.getProxyHost());
            assertEquals(3128, httpClient.getProxyPort());
        } finally {
            httpClient.shutdown();
        }
    }

    @Test
    public void testError() {
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                ReactorHttpClient.builder().host(null);
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                ReactorHttpClient.builder().host("");
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                ReactorHttpClient.builder().port(0);
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                ReactorHttpClient.builder().port(-1);
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                ReactorHttpClient.builder().maxContentLength(-1);
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                ReactorHttpClient.builder().maxInitialLineLength(-1);
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                ReactorHttpClient.builder().maxHeaderSize(-1);
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                ReactorHttpClient.builder().maxChunkSize(-1);
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                ReactorHttpClient.builder().sslHandshakeTimeoutMs(-1);
            }
        });

        /* proxy host and port go together */
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                ReactorHttpClient.builder().proxyHost("host").build();
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                ReactorHttpClient.builder().proxyPort(8080).build();
            }
        });

        /* so do proxy user and password */
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                ReactorHttpClient.builder()
                    .proxyHost("host").proxyPort(8080)
                    .proxyUsername("username")
                    .build();
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                ReactorHttpClient.builder()
                    .proxyHost("host").proxyPort(8080)
                    .proxyPassword("password")
                    .build();
            }
        });
    }

    private static void expectIllegalArg(Runnable r) {
        try {
            r.run();
            fail("Expecting IllegalArgumentException but didn't get");
        } catch (IllegalArgumentException iae) {
            /* expected */
        }
    }
}
