/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.net.URL;
import java.util.logging.Logger;

import org.junit.Test;

import io.dataapi.driver.httpclient.ConnectionPoolConfig;
import io.dataapi.driver.util.HttpConstants;

/**
 * Basic handle configuration sanity checks
 */
public class DataAPIHandleConfigTest {

    @Test
    public void testEndpoints() {

        /* a bare host defaults to https and port 443 */
        validate("db-1234.apps.example.com",
                 "https", "db-1234.apps.example.com", 443);
        validate("https://db-1234.apps.example.com",
                 "https", "db-1234.apps.example.com", 443);
        validate("https://db-1234.apps.example.com/",
                 "https", "db-1234.apps.example.com", 443);
        validate("db-1234.apps.example.com:443",
                 "https", "db-1234.apps.example.com", 443);

        /* any other port means http */
        validate("db-1234.apps.example.com:8181",
                 "http", "db-1234.apps.example.com", 8181);
        validate("localhost:8181", "http", "localhost", 8181);
        validate("http://localhost:123", "http", "localhost", 123);
        validate("http://localhost", "http", "localhost", 8080);

        validate("HtTp://localhost", "http", "localhost", 8080);
        validate("HtTpS://Foo.com:90", "https", "Foo.com", 90);

        /*
         * Invalid ports, too many parts and unknown protocols are caught.
         * Whether protocol and port make sense together is not checked.
         */
        expectIllegalArg("http://db.example.com:-10");
        expectIllegalArg("http://db.example.com:80:10");
        expectIllegalArg("http://db.example.com:port");
        expectIllegalArg("httpxx://db.example.com");
    }

    @Test
    public void testServiceURL() throws Exception {
        DataAPIHandleConfig config = new DataAPIHandleConfig(
            new URL("https://db.example.com:9443/some/path"));
        URL url = config.getServiceURL();
        assertEquals("https", url.getProtocol());
        assertEquals("db.example.com", url.getHost());
        assertEquals(9443, url.getPort());
        assertEquals("/", url.getPath());
    }

    @Test
    public void testDefaults() {
        DataAPIHandleConfig config =
            new DataAPIHandleConfig("http://localhost:8181");
        assertEquals(HttpConstants.DEFAULT_API_PATH, config.getApiPath());
        assertEquals(DataAPIHandleConfig.DEFAULT_NAMESPACE,
                     config.getDefaultNamespace());
        assertEquals(0, config.getRequestTimeout());
        assertEquals(DataAPIHandleConfig.DEFAULT_TIMEOUT,
                     config.getDefaultRequestTimeout());
        assertEquals(DataAPIHandleConfig.DEFAULT_MAX_RETRIES,
                     config.getMaxRetries());
        assertEquals(DataAPIHandleConfig.DEFAULT_INSERT_MANY_CHUNK_SIZE,
                     config.getInsertManyChunkSize());
        assertEquals(DataAPIHandleConfig.DEFAULT_INSERT_MANY_CONCURRENCY,
                     config.getInsertManyConcurrency());
        assertEquals(DataAPIHandleConfig.DEFAULT_BULK_WRITE_CONCURRENCY,
                     config.getBulkWriteConcurrency());
        assertEquals(DataAPIHandleConfig.DEFAULT_COUNT_UPPER_BOUND,
                     config.getCountUpperBound());
        assertNull(config.getAuthorizationProvider());
        assertNull(config.getConnectionPoolConfig());
        assertNull(config.getSslContext());
        assertNull(config.getProxyHost());
        assertEquals(0, config.getProxyPort());
        assertFalse(config.getWiretap());
    }

    @Test
    public void testSetters() {
        DataAPIHandleConfig config =
            new DataAPIHandleConfig("http://localhost:8181", "secret")
            .setApiPath("/api/json/v2/")
            .setDefaultNamespace("library")
            .setRequestTimeout(2500)
            .setMaxRetries(0)
            .setInsertManyChunkSize(100)
            .setInsertManyConcurrency(1)
            .setBulkWriteConcurrency(2)
            .setCountUpperBound(500)
            .setExtensionUserAgent("my-app/2.0")
            .setWiretap(true);

        assertTrue(config.getAuthorizationProvider()
                   instanceof StaticTokenProvider);
        assertEquals("/api/json/v2", config.getApiPath());
        assertEquals("library", config.getDefaultNamespace());
        assertEquals(2500, config.getDefaultRequestTimeout());
        assertEquals(0, config.getMaxRetries());
        assertEquals(100, config.getInsertManyChunkSize());
        assertEquals(1, config.getInsertManyConcurrency());
        assertEquals(2, config.getBulkWriteConcurrency());
        assertEquals(500, config.getCountUpperBound());
        assertEquals("my-app/2.0", config.getExtensionUserAgent());
        assertTrue(config.getWiretap());

        /* the token never shows up in text */
        assertFalse(config.getAuthorizationProvider().toString()
                    .contains("secret"));
    }

    @Test
    public void testProxyPoolAndLogger() {
        ConnectionPoolConfig pool =
            ConnectionPoolConfig.builder().maxConnections(4).build();
        Logger logger = Logger.getLogger("dataapi.test");
        DataAPIHandleConfig config =
            new DataAPIHandleConfig("http://localhost:8181", "secret")
            .setConnectionPoolConfig(pool)
            .setLogger(logger)
            .setProxyHost("proxy.example.com")
            .setProxyPort(3128)
            .setProxyUsername("scott")
            .setProxyPassword("tiger");

        assertSame(pool, config.getConnectionPoolConfig());
        assertEquals(4, config.getConnectionPoolConfig().getMaxConnections());
        assertSame(logger, config.getLogger());
        assertEquals("proxy.example.com", config.getProxyHost());
        assertEquals(3128, config.getProxyPort());
        assertEquals("scott", config.getProxyUsername());
        assertEquals("tiger", config.getProxyPassword());
    }

    @Test
    public void testClone() {
        DataAPIHandleConfig config =
            new DataAPIHandleConfig("http://localhost:8181", "secret")
            .setMaxRetries(1);
        DataAPIHandleConfig copy = config.clone();
        assertNotSame(config, copy);
        assertSame(config.getAuthorizationProvider(),
                   copy.getAuthorizationProvider());
        copy.setMaxRetries(5).setDefaultNamespace("other");
        assertEquals(1, config.getMaxRetries());
        assertEquals(DataAPIHandleConfig.DEFAULT_NAMESPACE,
                     config.getDefaultNamespace());
    }

    @Test
    public void testInvalidSettings() {
        final DataAPIHandleConfig config =
            new DataAPIHandleConfig("http://localhost:8181");
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                config.setApiPath("api/json/v1");
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                config.setDefaultNamespace("");
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                config.setRequestTimeout(0);
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                config.setMaxRetries(-1);
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                config.setInsertManyChunkSize(101);
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                config.setInsertManyConcurrency(0);
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                config.setBulkWriteConcurrency(0);
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                config.setCountUpperBound(0);
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                config.setSSLHandshakeTimeout(-1);
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                config.setProxyPort(-1);
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < 65; i++) {
                    sb.append('x');
                }
                config.setExtensionUserAgent(sb.toString());
            }
        });
        expectIllegalArg(new Runnable() {
            @Override
            public void run() {
                new DataAPIHandleConfig("http://localhost:8181", "");
            }
        });
    }

    private static void expectIllegalArg(Runnable r) {
        try {
            r.run();
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // expected
        }
    }

    private static void expectIllegalArg(String endpoint) {
        try {
            new DataAPIHandleConfig(endpoint);
            fail("Endpoint " + endpoint + " should have failed");
        } catch (IllegalArgumentException expected) {
            // expected
        }
    }

    private static void validate(String endpoint, String protocol,
                                 String host, int port) {
        URL configURL = new DataAPIHandleConfig(endpoint).getServiceURL();
        assertEquals(protocol, configURL.getProtocol());
        assertEquals(host, configURL.getHost());
        assertEquals(port, configURL.getPort());
    }
}
