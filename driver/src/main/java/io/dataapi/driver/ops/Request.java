/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

import io.dataapi.driver.DataAPIHandleConfig;
import io.dataapi.driver.ops.serde.Serializer;
import io.dataapi.driver.ops.serde.SerializerFactory;

/**
 * A request is an abstract class used as a base for all requests types.
 * Each request maps to one Data API command sent to a single collection.
 * Public state and methods are implemented by extending classes.
 */
public abstract class Request {

    protected int timeoutMs;

    /**
     * The keyspace of the target collection.
     */
    protected String namespace;

    /**
     * The name of the collection used for the operation. This is required.
     */
    protected String collectionName;

    /**
     * Construct a request
     * @hidden
     */
    protected Request() {}

    /**
     * Returns timeout
     * @return the timeout in milliseconds
     * @hidden
     */
    public int getTimeoutInternal() {
        return timeoutMs;
    }

    /**
     * @param timeoutMs the request timeout, in milliseconds
     * @hidden
     */
    public void setTimeoutInternal(int timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.timeoutMs = timeoutMs;
    }

    /**
     * Internal use only.
     *
     * Sets default values in a request based on the specified config
     * object. This will typically be overridden by subclasses.
     *
     * @param config the configuration object to use to get default values
     *
     * @return this
     * @hidden
     */
    public Request setDefaults(DataAPIHandleConfig config) {
        if (timeoutMs == 0) {
            timeoutMs = config.getDefaultRequestTimeout();
        }
        if (namespace == null) {
            namespace = config.getDefaultNamespace();
        }
        return this;
    }

    /**
     * Return if this request should be retried.
     *
     * @return true if the request should be retried
     * @hidden
     */
    public boolean shouldRetry() {
        return true;
    }

    /**
     * @param namespace the keyspace
     * @hidden
     */
    public void setNamespaceInternal(String namespace) {
        this.namespace = namespace;
    }

    /**
     * Returns the keyspace of the target collection.
     *
     * @return the keyspace, or null if not set
     */
    public String getNamespace() {
        return namespace;
    }

    /**
     * @param collectionName the collection name
     * @hidden
     */
    public void setCollectionNameInternal(String collectionName) {
        this.collectionName = collectionName;
    }

    /**
     * Returns the name of the target collection.
     *
     * @return the collection name, or null if not set
     */
    public String getCollectionName() {
        return collectionName;
    }

    /**
     * Copies the target, timeout included, from another request.
     *
     * @param other the request to copy from
     * @hidden
     */
    protected void copyBase(Request other) {
        this.timeoutMs = other.timeoutMs;
        this.namespace = other.namespace;
        this.collectionName = other.collectionName;
    }

    /**
     * Returns the name of the command sent for this request.
     *
     * @return the command name
     * @hidden
     */
    public abstract String getCommandName();

    /**
     * @hidden
     */
    public abstract void validate();

    /**
     * @param factory the factory
     * @return the serializer
     * @hidden
     */
    public abstract Serializer createSerializer(SerializerFactory factory);

    /**
     * @hidden
     */
    protected void validateCollectionName() {
        if (collectionName == null || collectionName.isEmpty()) {
            throw new IllegalArgumentException(
                getClass().getSimpleName() +
                " requires a collection name");
        }
    }
}
