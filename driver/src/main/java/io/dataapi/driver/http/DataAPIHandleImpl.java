/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.http;

import io.dataapi.driver.Collection;
import io.dataapi.driver.DataAPIHandle;
import io.dataapi.driver.DataAPIHandleAsync;
import io.dataapi.driver.DataAPIHandleConfig;

/**
 * The methods in this class require non-null arguments. Because they all
 * ultimately call the AsyncClient class the check for null is done there
 * in a single place.
 */
public class DataAPIHandleImpl implements DataAPIHandle {

    private final DataAPIHandleAsyncImpl client;

    public DataAPIHandleImpl(DataAPIHandleConfig config) {
        client = new DataAPIHandleAsyncImpl(config);
    }

    @Override
    public Collection getCollection(String name) {
        return client.getCollection(name).toSync();
    }

    @Override
    public Collection getCollection(String namespace, String name) {
        return client.getCollection(namespace, name).toSync();
    }

    @Override
    public DataAPIHandleAsync getAsyncHandle() {
        return client;
    }

    @Override
    public void close() {
        client.close();
    }

    /**
     * @hidden
     * For testing use
     */
    public AsyncClient getClient() {
        return client.getClient();
    }
}
