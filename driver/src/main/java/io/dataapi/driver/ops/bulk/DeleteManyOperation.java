/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops.bulk;

import io.dataapi.driver.AsyncCollection;
import io.dataapi.driver.values.MapValue;
import reactor.core.publisher.Mono;

/**
 * Deletes every document matching a non-empty filter.
 */
public class DeleteManyOperation extends BulkOperation {

    private final MapValue filter;

    public DeleteManyOperation(MapValue filter) {
        this.filter = filter;
    }

    @Override
    public Mono<BulkWriteResult> execute(AsyncCollection collection,
                                         int index) {
        return collection.deleteMany(filter)
            .map(BulkWriteResult::fromDelete);
    }
}
