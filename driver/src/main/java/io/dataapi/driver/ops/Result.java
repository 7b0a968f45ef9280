/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

import io.dataapi.driver.values.MapValue;

/**
 * Result is a base class for result classes for all supported operations.
 * All state and methods are maintained by extending classes.
 */
public class Result {

    /*
     * The "status" object of the response, if any. Counters the typed
     * result does not model remain available here.
     */
    private MapValue status;

    protected Result() {}

    /**
     * Returns the "status" object of the response, or null if the response
     * had none.
     *
     * @return the status
     */
    public MapValue getStatus() {
        return status;
    }

    /**
     * @param status the status
     * @hidden
     */
    public void setStatus(MapValue status) {
        this.status = status;
    }
}
