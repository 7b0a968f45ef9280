/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.httpclient;

/**
 * Configuration of the pool of HTTP connections a handle keeps to the
 * Data API endpoint. Instances are immutable and built with
 * {@link #builder()}:
 * <pre>
 *   ConnectionPoolConfig pool = ConnectionPoolConfig.builder()
 *       .maxConnections(20)
 *       .maxIdleTime(30000)
 *       .build();
 * </pre>
 */
public class ConnectionPoolConfig {

    /** default maximum number of connections */
    public static final int DEFAULT_MAX_CONNECTIONS = 100;

    /** -1 leaves the queue of pending acquires unbounded */
    public static final int DEFAULT_MAX_PENDING_ACQUIRES = -1;

    /** default wait for a connection, in milliseconds */
    public static final long DEFAULT_PENDING_ACQUIRE_TIMEOUT = 45000;

    /** default idle time before a connection is closed, in milliseconds */
    public static final long DEFAULT_MAX_IDLE_TIME = 60000;

    /** default lifetime of a connection, in milliseconds */
    public static final long DEFAULT_MAX_LIFETIME = 300000;

    private final int maxConnections;
    private final int maxPendingAcquires;
    private final long pendingAcquireTimeout;
    private final long maxIdleTime;
    private final long maxLifetime;

    private ConnectionPoolConfig(Builder builder) {
        this.maxConnections = builder.maxConnections;
        this.maxPendingAcquires = builder.maxPendingAcquires;
        this.pendingAcquireTimeout = builder.pendingAcquireTimeout;
        this.maxIdleTime = builder.maxIdleTime;
        this.maxLifetime = builder.maxLifetime;
    }

    /**
     * Get the maximum number of connections that can be created by the
     * connection pool.
     *
     * @return maximum number of connections created by the connection pool.
     */
    public int getMaxConnections() {
        return maxConnections;
    }

    /**
     * Get the maximum number of requests for connection acquire to keep in a
     * pending queue, -1 if unbounded.
     *
     * @return maximum number of pending request for connection acquisition
     */
    public int getMaxPendingAcquires() {
        return maxPendingAcquires;
    }

    /**
     * Get the timeout in milliseconds to wait for connection acquisition.
     *
     * @return timeout in milliseconds to wait for connection acquisition.
     */
    public long getPendingAcquireTimeout() {
        return pendingAcquireTimeout;
    }

    /**
     * Get the maximum idle time in milliseconds for the idle connection to be
     * closed.
     *
     * @return maximum idle time in milliseconds
     */
    public long getMaxIdleTime() {
        return maxIdleTime;
    }

    /**
     * Get the maximum time in milliseconds a connection is kept open.
     *
     * @return maximum lifetime in milliseconds
     */
    public long getMaxLifetime() {
        return maxLifetime;
    }

    /**
     * Builder
     * @return Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ConnectionPoolConfig[maxConnections=" + maxConnections +
            ", maxPendingAcquires=" + maxPendingAcquires +
            ", pendingAcquireTimeout=" + pendingAcquireTimeout +
            ", maxIdleTime=" + maxIdleTime +
            ", maxLifetime=" + maxLifetime + "]";
    }

    public static class Builder {
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private int maxPendingAcquires = DEFAULT_MAX_PENDING_ACQUIRES;
        private long pendingAcquireTimeout = DEFAULT_PENDING_ACQUIRE_TIMEOUT;
        private long maxIdleTime = DEFAULT_MAX_IDLE_TIME;
        private long maxLifetime = DEFAULT_MAX_LIFETIME;

        /**
         * Set the maximum number of connections to create before requests
         * start pending. Default to {@value #DEFAULT_MAX_CONNECTIONS}. A
         * value of 1 disables pooling: each request opens a new connection.
         *
         * @param maxConnections the maximum number of connections in the pool
         * @return this
         * @throws IllegalArgumentException if maxConnections is not positive
         */
        public Builder maxConnections(int maxConnections) {
            if (maxConnections <= 0) {
                throw new IllegalArgumentException("maxConnections must be " +
                        "positive, provided value is " + maxConnections);
            }
            this.maxConnections = maxConnections;
            return this;
        }

        /**
         * Set the maximum number of registered requests for connection acquire
         * to keep in a pending queue.
         * Default to -1 which means the pending queue will not have upper limit.
         *
         * @param maxPendingAcquires the maximum number of registered requests
         *                           for acquire to keep in a pending queue.
         * @return this
         * @throws IllegalArgumentException If maxPendingAcquires is zero
         * or less than -1
         */
        public Builder maxPendingAcquires(int maxPendingAcquires) {
            if (maxPendingAcquires != -1 && maxPendingAcquires <= 0) {
                throw new IllegalArgumentException("maxPendingAcquires must " +
                    "be positive or -1, provided value is " +
                    maxPendingAcquires);
            }
            this.maxPendingAcquires = maxPendingAcquires;
            return this;
        }

        /**
         * Set the maximum time in milliseconds to wait for a connection.
         * Default to {@value #DEFAULT_PENDING_ACQUIRE_TIMEOUT}.
         *
         * @param pendingAcquireTimeout maximum time in milliseconds to wait
         *                              for the acquisition of a connection
         * @return this
         * @throws IllegalArgumentException If pendingAcquireTimeout is not
         * positive
         */
        public Builder pendingAcquireTimeout(long pendingAcquireTimeout) {
            if (pendingAcquireTimeout <= 0) {
                throw new IllegalArgumentException("pendingAcquireTimeout " +
                    "must be positive, provided value is " +
                    pendingAcquireTimeout);
            }
            this.pendingAcquireTimeout = pendingAcquireTimeout;
            return this;
        }

        /**
         * Set the time in milliseconds after which an idle connection is
         * closed. Default to {@value #DEFAULT_MAX_IDLE_TIME}.
         *
         * @param maxIdleTime the idle time. The check is performed only
         *                    when the connection is selected for use.
         * @return this
         * @throws IllegalArgumentException If maxIdleTime is not positive
         */
        public Builder maxIdleTime(long maxIdleTime) {
            if (maxIdleTime <= 0) {
                throw new IllegalArgumentException("maxIdleTime must be " +
                    "positive, provided value is " + maxIdleTime);
            }
            this.maxIdleTime = maxIdleTime;
            return this;
        }

        /**
         * Set the time in milliseconds after which a connection is closed.
         * Default to {@value #DEFAULT_MAX_LIFETIME}.
         *
         * @param maxLifetime the lifetime. The check is performed only when
         *                    the connection is selected for use.
         * @return this
         * @throws IllegalArgumentException If maxLifetime is not positive
         */
        public Builder maxLifetime(long maxLifetime) {
            if (maxLifetime <= 0) {
                throw new IllegalArgumentException("maxLifetime must be " +
                    "positive, provided value is " + maxLifetime);
            }
            this.maxLifetime = maxLifetime;
            return this;
        }

        /**
         * Build the {@link ConnectionPoolConfig} instance
         *
         * @return new {@link ConnectionPoolConfig}
         */
        public ConnectionPoolConfig build() {
            return new ConnectionPoolConfig(this);
        }
    }
}
