/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

/**
 * Thrown when the service answers HTTP 429, Too Many Requests. Operations
 * resulting in this exception can be retried after a delay.
 */
public class ThrottlingException extends RetryableException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    public ThrottlingException(String msg) {
        super(msg);
    }
}
