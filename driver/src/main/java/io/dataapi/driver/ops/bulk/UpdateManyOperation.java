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
 * Updates every document matching a filter.
 */
public class UpdateManyOperation extends BulkOperation {

    private final MapValue filter;
    private final MapValue update;
    private final boolean upsert;

    public UpdateManyOperation(MapValue filter, MapValue update) {
        this(filter, update, false);
    }

    public UpdateManyOperation(MapValue filter, MapValue update,
                               boolean upsert) {
        requireNonNull(update, "UpdateManyOperation: update must be " +
                       "non-null");
        this.filter = filter;
        this.update = update;
        this.upsert = upsert;
    }

    @Override
    public Mono<BulkWriteResult> execute(AsyncCollection collection,
                                         int index) {
        return collection.updateMany(filter, update, upsert)
            .map(res -> BulkWriteResult.fromUpdate(res, index));
    }
}
