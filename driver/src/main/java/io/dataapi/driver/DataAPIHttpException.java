/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

/**
 * Thrown when the service answers with an HTTP status other than 200 that
 * is not retryable, for example 401 for a rejected token or 404 for an
 * unknown keyspace.
 */
public class DataAPIHttpException extends DataAPIException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    private final String responseBody;

    /**
     * @hidden
     * @param statusCode the HTTP status
     * @param msg the message
     * @param responseBody the response body text, may be null
     */
    public DataAPIHttpException(int statusCode,
                                String msg,
                                String responseBody) {
        super(msg);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns the body of the failed response, if there was one.
     *
     * @return the body, or null
     */
    public String getResponseBody() {
        return responseBody;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " (HTTP " + statusCode + ")";
    }
}
