/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

/**
 * Thrown by countDocuments when the number of matching documents exceeds
 * the requested upper bound, or the service's own count limit.
 */
public class TooManyDocumentsToCountException extends DataAPIException {

    private static final long serialVersionUID = 1L;

    private final int upperBound;

    private final boolean serverLimitReached;

    /**
     * @hidden
     * @param upperBound the bound that was exceeded
     * @param serverLimitReached true if the service stopped counting
     */
    public TooManyDocumentsToCountException(int upperBound,
                                            boolean serverLimitReached) {
        super(serverLimitReached ?
              "Document count exceeds the server count limit" :
              "Document count exceeds required upper bound " + upperBound);
        this.upperBound = upperBound;
        this.serverLimitReached = serverLimitReached;
    }

    public int getUpperBound() {
        return upperBound;
    }

    /**
     * Returns true if the service reported more matches than it counts.
     *
     * @return true if the server limit was reached
     */
    public boolean isServerLimitReached() {
        return serverLimitReached;
    }
}
