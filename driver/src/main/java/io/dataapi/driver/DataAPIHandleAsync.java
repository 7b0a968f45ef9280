/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import io.dataapi.driver.ops.Request;
import io.dataapi.driver.ops.Result;
import reactor.core.publisher.Mono;

/**
 * DataAPIHandleAsync is an asynchronous handle to a Data API endpoint. To
 * create one, request an instance using
 * {@link DataAPIHandleFactory#createDataAPIHandleAsync} and a
 * {@link DataAPIHandleConfig}, which allows an application to specify
 * default values and other configuration information to be used by the
 * handle.
 * <p>
 * A handle has memory and network resources associated with it.
 * Consequently, the {@link #close} method must be invoked to free up the
 * resources when the application is done using the handle.
 * <p>
 * To minimize network activity as well as resource allocation and
 * deallocation overheads, it's best to avoid repeated creation and closing
 * of handles. A handle permits concurrent operations, so a single handle is
 * sufficient for a multi-threaded application.
 * <p>
 * The operations of the returned {@link AsyncCollection} instances return
 * {@link Mono} or {@link reactor.core.publisher.Flux} publishers. Nothing
 * is sent until they are subscribed to.
 */
public interface DataAPIHandleAsync extends AutoCloseable {

    /**
     * Returns a collection in the default namespace of the configuration.
     * No request is made; the collection is not checked for existence.
     *
     * @param name the collection name
     *
     * @return the collection
     */
    AsyncCollection getCollection(String name);

    /**
     * Returns a collection in the given namespace (keyspace).
     *
     * @param namespace the namespace
     * @param name the collection name
     *
     * @return the collection
     */
    AsyncCollection getCollection(String namespace, String name);

    /**
     * @hidden
     * Executes a request. Used by the collections of this handle.
     *
     * @param request the request
     *
     * @return the result
     */
    Mono<Result> execute(Request request);

    /**
     * Returns a copy of the configuration of this handle.
     *
     * @return the configuration
     */
    DataAPIHandleConfig getConfig();

    /**
     * Close the DataAPIHandleAsync instance and release resources. Once
     * closed the handle is no longer usable. Attempts to use a closed
     * handle will throw {@link IllegalStateException}.
     */
    @Override
    void close();
}
