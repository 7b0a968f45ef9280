/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

/**
 * A base exception for all exceptions that may be retried with a reasonable
 * expectation that they may succeed on retry. The driver retries these
 * internally, up to {@link DataAPIHandleConfig#getMaxRetries}, before
 * surfacing them.
 */
public class RetryableException extends DataAPIException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    protected RetryableException(String msg) {
        super(msg);
    }

    /**
     * @hidden
     * @param msg the message
     * @param cause the cause
     */
    protected RetryableException(String msg, Throwable cause) {
        super(msg, cause);
    }

    @Override
    public boolean okToRetry() {
        return true;
    }
}
