/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

/**
 * Thrown when the service or a gateway in front of it answers HTTP 502, 503
 * or 504. The condition is usually transient.
 */
public class ServiceUnavailableException extends RetryableException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    /**
     * @hidden
     * @param statusCode the HTTP status
     * @param msg the message
     */
    public ServiceUnavailableException(int statusCode, String msg) {
        super(msg);
        this.statusCode = statusCode;
    }

    /**
     * Returns the HTTP status code of the response.
     *
     * @return the status code
     */
    public int getStatusCode() {
        return statusCode;
    }
}
