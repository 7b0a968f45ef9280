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
 * Replaces the first document matching a filter.
 */
public class ReplaceOneOperation extends BulkOperation {

    private final MapValue filter;
    private final MapValue replacement;
    private final SortSpec sort;
    private final boolean upsert;

    public ReplaceOneOperation(MapValue filter, MapValue replacement) {
        this(filter, replacement, null, false);
    }

    public ReplaceOneOperation(MapValue filter, MapValue replacement,
                               boolean upsert) {
        this(filter, replacement, null, upsert);
    }

    public ReplaceOneOperation(MapValue filter, MapValue replacement,
                               SortSpec sort, boolean upsert) {
        requireNonNull(replacement, "ReplaceOneOperation: replacement must " +
                       "be non-null");
        this.filter = filter;
        this.replacement = replacement;
        this.sort = sort;
        this.upsert = upsert;
    }

    @Override
    public Mono<BulkWriteResult> execute(AsyncCollection collection,
                                         int index) {
        return collection.replaceOne(filter, replacement, sort, upsert)
            .map(res -> BulkWriteResult.fromUpdate(res, index));
    }
}
