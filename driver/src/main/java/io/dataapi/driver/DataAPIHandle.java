/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

/**
 * DataAPIHandle is a handle to a Data API endpoint whose operations block
 * until done. To create one, request an instance using
 * {@link DataAPIHandleFactory#createDataAPIHandle} and a
 * {@link DataAPIHandleConfig}.
 * <p>
 * A handle has memory and network resources associated with it.
 * Consequently, the {@link #close} method must be invoked to free up the
 * resources when the application is done using the handle.
 * <p>
 * The handle is built on {@link DataAPIHandleAsync}; see
 * {@link #getAsyncHandle}.
 */
public interface DataAPIHandle extends AutoCloseable {

    /**
     * Returns a collection in the default namespace of the configuration.
     * No request is made; the collection is not checked for existence.
     *
     * @param name the collection name
     *
     * @return the collection
     */
    Collection getCollection(String name);

    /**
     * Returns a collection in the given namespace (keyspace).
     *
     * @param namespace the namespace
     * @param name the collection name
     *
     * @return the collection
     */
    Collection getCollection(String namespace, String name);

    /**
     * Returns the asynchronous handle this handle blocks on. It shares the
     * connections of this handle and is closed with it.
     *
     * @return the asynchronous handle
     */
    DataAPIHandleAsync getAsyncHandle();

    /**
     * Close the DataAPIHandle instance and release resources. Once closed
     * the handle is no longer usable.
     */
    @Override
    void close();
}
