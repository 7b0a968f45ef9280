/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops.bulk;

import static io.dataapi.driver.util.CheckNull.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.dataapi.driver.AsyncCollection;
import io.dataapi.driver.values.MapValue;
import reactor.core.publisher.Mono;

/**
 * Inserts a list of documents, chunked as
 * {@link AsyncCollection#insertMany(List, boolean)} does.
 */
public class InsertManyOperation extends BulkOperation {

    private final List<MapValue> documents;
    private final boolean ordered;

    public InsertManyOperation(List<MapValue> documents) {
        this(documents, true);
    }

    public InsertManyOperation(List<MapValue> documents, boolean ordered) {
        requireNonNull(documents, "InsertManyOperation: documents must be " +
                       "non-null");
        this.documents = Collections.unmodifiableList(
            new ArrayList<MapValue>(documents));
        this.ordered = ordered;
    }

    public List<MapValue> getDocuments() {
        return documents;
    }

    public boolean isOrdered() {
        return ordered;
    }

    @Override
    public Mono<BulkWriteResult> execute(AsyncCollection collection,
                                         int index) {
        return collection.insertMany(documents, ordered)
            .map(BulkWriteResult::fromInsertMany);
    }
}
