/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

import io.dataapi.driver.ops.serde.Serializer;
import io.dataapi.driver.ops.serde.SerializerFactory;
import io.dataapi.driver.values.MapValue;

/**
 * Represents the input to a deleteOne or deleteMany command. A deleteMany
 * deletes a bounded number of documents per call and reports
 * {@link DeleteResult#getMoreData} when matches remain.
 */
public class DeleteRequest extends Request {

    private final boolean multi;
    private MapValue filter;
    private SortSpec sort;

    /**
     * Creates a request.
     *
     * @param multi true for deleteMany, false for deleteOne
     */
    public DeleteRequest(boolean multi) {
        this.multi = multi;
    }

    public boolean isMulti() {
        return multi;
    }

    public MapValue getFilter() {
        return filter;
    }

    public DeleteRequest setFilter(MapValue filter) {
        this.filter = filter;
        return this;
    }

    public SortSpec getSort() {
        return sort;
    }

    public DeleteRequest setSort(SortSpec sort) {
        this.sort = sort;
        return this;
    }

    /**
     * @param collectionName the collection
     * @return this
     * @hidden
     */
    public DeleteRequest setCollectionName(String collectionName) {
        super.setCollectionNameInternal(collectionName);
        return this;
    }

    @Override
    public String getCommandName() {
        return multi ? "deleteMany" : "deleteOne";
    }

    @Override
    public void validate() {
        validateCollectionName();
        if (multi && sort != null && !sort.isEmpty()) {
            throw new IllegalArgumentException(
                "deleteMany does not accept a sort");
        }
    }

    @Override
    public Serializer createSerializer(SerializerFactory factory) {
        return factory.createDeleteSerializer();
    }
}
