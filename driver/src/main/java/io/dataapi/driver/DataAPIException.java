/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

/**
 * A base class for most exceptions thrown by the driver. All exceptions
 * that originate from the Data API service or the transport extend this
 * class. It is unchecked.
 * <p>
 * Argument validation failures are reported with
 * {@link IllegalArgumentException} before any request is sent, and
 * iteration of a closed {@link io.dataapi.driver.ops.Cursor} is reported
 * with {@link CursorClosedException}.
 */
public class DataAPIException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    public DataAPIException(String msg) {
        super(msg);
    }

    /**
     * @hidden
     * @param msg the message
     * @param cause the cause
     */
    public DataAPIException(String msg, Throwable cause) {
        super(msg, cause);
    }

    /**
     * Returns whether this exception can be retried with a reasonable
     * expectation that it may succeed. Instances of
     * {@link RetryableException} will return true for this method.
     *
     * @return true if this exception can be retried
     */
    public boolean okToRetry() {
        return false;
    }
}
