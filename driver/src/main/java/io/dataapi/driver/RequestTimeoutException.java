/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

/**
 * Thrown when a request cannot be processed because the configured timeout
 * interval is exceeded. Retries of throttled or unavailable responses
 * happen within the same interval.
 */
public class RequestTimeoutException extends DataAPIException {

    private static final long serialVersionUID = 1L;

    private volatile int timeoutMs;

    /**
     * @hidden
     * Internal use only.
     *
     * @param timeoutMs the timeout that was in effect, in milliseconds
     * @param msg the message string for the timeout
     * @param cause the cause of the exception
     */
    public RequestTimeoutException(int timeoutMs,
                                   String msg,
                                   Throwable cause) {
        super(msg, cause);
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (timeoutMs != 0) {
            sb.append(" Timeout: ");
            sb.append(timeoutMs);
            sb.append("ms");
        }
        return sb.toString();
    }

    /**
     * Returns the timeout that was in effect for the operation.
     *
     * @return the timeout in milliseconds, or 0 if not known
     */
    public int getTimeoutMs() {
        return timeoutMs;
    }
}
