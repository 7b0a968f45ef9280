/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.dataapi.driver.ops.bulk.BulkWriteResult;

/**
 * Thrown when one or more operations of a bulk write fail. In ordered mode
 * there is exactly one cause, the operation that stopped the batch. In
 * unordered mode every failure is a cause. The first cause is also the
 * {@link #getCause cause} of this exception.
 */
public class BulkWriteException extends DataAPIException {

    private static final long serialVersionUID = 1L;

    private final transient BulkWriteResult partialResult;

    private final List<Throwable> causes;

    /**
     * @hidden
     * @param partialResult results of the operations that succeeded
     * @param causes the failures, not empty
     */
    public BulkWriteException(BulkWriteResult partialResult,
                              List<Throwable> causes) {
        super("Bulk write failed with " + causes.size() + " error(s): " +
              causes.get(0).getMessage(), causes.get(0));
        this.partialResult = partialResult;
        this.causes = Collections.unmodifiableList(
            new ArrayList<Throwable>(causes));
    }

    public BulkWriteResult getPartialResult() {
        return partialResult;
    }

    public List<Throwable> getCauses() {
        return causes;
    }
}
