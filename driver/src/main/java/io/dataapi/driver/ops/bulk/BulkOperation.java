/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops.bulk;

import io.dataapi.driver.AsyncCollection;
import reactor.core.publisher.Mono;

/**
 * One write of a bulk write. Operations are immutable and can be reused
 * across batches and collections.
 *
 * @see io.dataapi.driver.Collection#bulkWrite
 */
public abstract class BulkOperation {

    BulkOperation() {
    }

    /**
     * @hidden
     * Runs this operation.
     *
     * @param collection the target collection
     * @param index the position of this operation in its batch
     *
     * @return the result of this operation alone
     */
    public abstract Mono<BulkWriteResult> execute(AsyncCollection collection,
                                                  int index);
}
