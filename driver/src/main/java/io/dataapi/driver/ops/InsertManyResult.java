/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.dataapi.driver.values.FieldValue;

/**
 * The result of an insertMany. The ids are those of the documents
 * actually inserted, in the order the service reported them.
 */
public class InsertManyResult extends Result {

    private final List<FieldValue> insertedIds = new ArrayList<FieldValue>();

    public List<FieldValue> getInsertedIds() {
        return Collections.unmodifiableList(insertedIds);
    }

    /**
     * @param ids the ids to append
     * @return this
     * @hidden
     */
    public InsertManyResult addInsertedIds(List<FieldValue> ids) {
        insertedIds.addAll(ids);
        return this;
    }

    @Override
    public String toString() {
        return "InsertManyResult[insertedIds=" + insertedIds + "]";
    }
}
