/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

import io.dataapi.driver.values.FieldValue;

/**
 * The result of an insertOne command.
 */
public class InsertOneResult extends Result {

    private FieldValue insertedId;

    /**
     * Returns the "_id" of the inserted document, as supplied by the caller
     * or generated by the service.
     *
     * @return the id
     */
    public FieldValue getInsertedId() {
        return insertedId;
    }

    /**
     * @param insertedId the id
     * @return this
     * @hidden
     */
    public InsertOneResult setInsertedId(FieldValue insertedId) {
        this.insertedId = insertedId;
        return this;
    }

    @Override
    public String toString() {
        return "InsertOneResult[insertedId=" + insertedId + "]";
    }
}
