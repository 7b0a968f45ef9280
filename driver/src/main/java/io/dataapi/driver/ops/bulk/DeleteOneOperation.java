/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops.bulk;

import io.dataapi.driver.AsyncCollection;
import io.dataapi.driver.ops.SortSpec;
import io.dataapi.driver.values.MapValue;
import reactor.core.publisher.Mono;

/**
 * Deletes the first document matching a filter.
 */
public class DeleteOneOperation extends BulkOperation {

    private final MapValue filter;
    private final SortSpec sort;

    public DeleteOneOperation(MapValue filter) {
        this(filter, null);
    }

    public DeleteOneOperation(MapValue filter, SortSpec sort) {
        this.filter = filter;
        this.sort = sort;
    }

    @Override
    public Mono<BulkWriteResult> execute(AsyncCollection collection,
                                         int index) {
        return collection.deleteOne(filter, sort)
            .map(BulkWriteResult::fromDelete);
    }
}
