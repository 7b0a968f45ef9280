/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops.bulk;

import static io.dataapi.driver.util.CheckNull.requireNonNull;

import io.dataapi.driver.AsyncCollection;
import io.dataapi.driver.ops.SortSpec;
import io.dataapi.driver.values.MapValue;
import reactor.core.publisher.Mono;

/**
 * Updates the first document matching a filter.
 */
public class UpdateOneOperation extends BulkOperation {

    private final MapValue filter;
    private final MapValue update;
    private final SortSpec sort;
    private final boolean upsert;

    public UpdateOneOperation(MapValue filter, MapValue update) {
        this(filter, update, null, false);
    }

    public UpdateOneOperation(MapValue filter, MapValue update,
                              boolean upsert) {
        this(filter, update, null, upsert);
    }

    /**
     * @param filter the filter, null matches all documents
     * @param update the update, such as {@code {"$set": {...}}}
     * @param sort picks the document to update, may be null
     * @param upsert true to insert a document if none matches
     */
    public UpdateOneOperation(MapValue filter, MapValue update,
                              SortSpec sort, boolean upsert) {
        requireNonNull(update, "UpdateOneOperation: update must be non-null");
        this.filter = filter;
        this.update = update;
        this.sort = sort;
        this.upsert = upsert;
    }

    @Override
    public Mono<BulkWriteResult> execute(AsyncCollection collection,
                                         int index) {
        return collection.updateOne(filter, update, sort, upsert)
            .map(res -> BulkWriteResult.fromUpdate(res, index));
    }
}
