/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import static io.dataapi.driver.util.CheckNull.requireNonNull;

import io.dataapi.driver.http.DataAPIHandleAsyncImpl;
import io.dataapi.driver.http.DataAPIHandleImpl;

/**
 * Factory class used to produce handles to a Data API endpoint.
 *
 * @see DataAPIHandle
 * @see DataAPIHandleAsync
 * @see DataAPIHandleConfig
 */
public class DataAPIHandleFactory {

    /**
     * Creates a handle whose operations block. The application must invoke
     * {@link DataAPIHandle#close}, when it is done accessing the system to
     * free up resources associated with the handle.
     *
     * @param config the configuration, copied by the handle
     *
     * @return a valid {@link DataAPIHandle} instance, ready for use
     *
     * @throws IllegalArgumentException if an illegal configuration parameter
     * is specified.
     */
    public static DataAPIHandle createDataAPIHandle(
        DataAPIHandleConfig config) {
        requireNonNull(
            config,
            "DataAPIHandleFactory.createDataAPIHandle: config cannot be null");
        return new DataAPIHandleImpl(config.clone());
    }

    /**
     * Creates a handle whose operations return reactive publishers. The
     * application must invoke {@link DataAPIHandleAsync#close}, when it is
     * done accessing the system to free up resources associated with the
     * handle.
     *
     * @param config the configuration, copied by the handle
     *
     * @return a valid {@link DataAPIHandleAsync} instance, ready for use
     *
     * @throws IllegalArgumentException if an illegal configuration parameter
     * is specified.
     */
    public static DataAPIHandleAsync createDataAPIHandleAsync(
        DataAPIHandleConfig config) {
        requireNonNull(
            config,
            "DataAPIHandleFactory.createDataAPIHandleAsync: config cannot " +
            "be null");
        return new DataAPIHandleAsyncImpl(config.clone());
    }
}
