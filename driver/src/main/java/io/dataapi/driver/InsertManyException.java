/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import java.util.List;

import io.dataapi.driver.ops.InsertManyResult;

/**
 * Thrown when one or more chunks of an insertMany fail. The partial result
 * holds the ids of the documents that were inserted before, or besides, the
 * failures.
 */
public class InsertManyException extends DataAPIResponseException {

    private static final long serialVersionUID = 1L;

    private final transient InsertManyResult partialResult;

    /**
     * @hidden
     * @param errors the errors of the failed chunks
     * @param partialResult what was inserted
     * @param cause the first failure
     */
    public InsertManyException(List<ErrorDescriptor> errors,
                               InsertManyResult partialResult,
                               Throwable cause) {
        super(makeMessage("insertMany", errors), errors, cause);
        this.partialResult = partialResult;
    }

    public InsertManyResult getPartialResult() {
        return partialResult;
    }
}
