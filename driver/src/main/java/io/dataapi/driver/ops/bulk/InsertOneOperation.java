/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops.bulk;

import static io.dataapi.driver.util.CheckNull.requireNonNull;

import io.dataapi.driver.AsyncCollection;
import io.dataapi.driver.values.MapValue;
import reactor.core.publisher.Mono;

/**
 * Inserts one document.
 */
public class InsertOneOperation extends BulkOperation {

    private final MapValue document;

    public InsertOneOperation(MapValue document) {
        requireNonNull(document, "InsertOneOperation: document must be " +
                       "non-null");
        this.document = document;
    }

    public MapValue getDocument() {
        return document;
    }

    @Override
    public Mono<BulkWriteResult> execute(AsyncCollection collection,
                                         int index) {
        return collection.insertOne(document)
            .map(res -> BulkWriteResult.fromInserted(1));
    }
}
