/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

/**
 * Selects which version of a document a findOneAndUpdate or
 * findOneAndReplace returns.
 */
public enum ReturnDocument {
    /** the document as it was before the modification */
    BEFORE("before"),
    /** the document as it is after the modification */
    AFTER("after");

    private final String value;

    ReturnDocument(String value) {
        this.value = value;
    }

    /**
     * @return the wire value
     * @hidden
     */
    public String getValue() {
        return value;
    }
}
