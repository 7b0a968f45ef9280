/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.httpclient;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

/**
 * Tests for {@link ConnectionPoolConfig}
 */
public class ConnectionPoolConfigTest {

    @Test
    public void testDefaults() {
        ConnectionPoolConfig cfg = ConnectionPoolConfig.builder().build();
        assertEquals(100, cfg.getMaxConnections());
        assertEquals(60000, cfg.getMaxIdleTime());
        assertEquals(300000, cfg.getMaxLifetime());
        assertEquals(-1, cfg.getMaxPendingAcquires());
        assertEquals(45000, cfg.getPendingAcquireTimeout());
    }

    @Test
    public void testCustom() {
        ConnectionPoolConfig cfg = ConnectionPoolConfig.builder()
            .maxConnections(10)
            .maxIdleTime(30000)
            .maxLifetime(60000)
            .maxPendingAcquires(50)
            .pendingAcquireTimeout(20000)
            .build();
        assertEquals(10, cfg.getMaxConnections());
        assertEquals(30000, cfg.getMaxIdleTime());
        assertEquals(60000, cfg.getMaxLifetime());
        assertEquals(50, cfg.getMaxPendingAcquires());
        assertEquals(20000, cfg.getPendingAcquireTimeout());
        assertTrue(cfg.toString().contains("maxConnections=10"));

        /* the pool is built from the config */
        ReactorHttpClient client = ReactorHttpClient.builder()
            .connectionPoolConfig(cfg)
            .build();
        try {
            assertEquals(10, client.getHttpClient().configuration()
                         .connectionProvider().maxConnections());
        } finally {
            client.shutdown();
        }
    }

    @Test
    public void testError() {
        ConnectionPoolConfig.Builder builder = ConnectionPoolConfig.builder();
        try {
            builder.maxConnections(0);
            fail("Expecting IllegalArgumentException but didn't get");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            builder.maxConnections(-1);
            fail("Expecting IllegalArgumentException but didn't get");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            builder.maxPendingAcquires(0);
            fail("Expecting IllegalArgumentException but didn't get");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            builder.maxPendingAcquires(-2);
            fail("Expecting IllegalArgumentException but didn't get");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            builder.maxIdleTime(0);
            fail("Expecting IllegalArgumentException but didn't get");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            builder.maxLifetime(-1);
            fail("Expecting IllegalArgumentException but didn't get");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            builder.pendingAcquireTimeout(0);
            fail("Expecting IllegalArgumentException but didn't get");
        } catch (IllegalArgumentException iae) {
            // expected
        }

        /* failures leave the builder usable */
        assertEquals(100, builder.build().getMaxConnections());
    }
}
