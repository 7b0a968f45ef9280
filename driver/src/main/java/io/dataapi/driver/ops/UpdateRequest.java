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
 * Represents the input to an updateOne or updateMany command. The update
 * is a map of update operators such as {@code {"$set": {...}}} and is sent
 * verbatim.
 * <p>
 * An updateMany may return a continuation token when more documents match
 * than the service updates in one call; the token is passed back with
 * {@link #setPageState} to continue.
 */
public class UpdateRequest extends Request {

    private final boolean multi;
    private MapValue filter;
    private MapValue update;
    private SortSpec sort;
    private boolean upsert;
    private String pageState;

    /**
     * Creates a request.
     *
     * @param multi true for updateMany, false for updateOne
     */
    public UpdateRequest(boolean multi) {
        this.multi = multi;
    }

    public boolean isMulti() {
        return multi;
    }

    public MapValue getFilter() {
        return filter;
    }

    public UpdateRequest setFilter(MapValue filter) {
        this.filter = filter;
        return this;
    }

    public MapValue getUpdate() {
        return update;
    }

    public UpdateRequest setUpdate(MapValue update) {
        this.update = update;
        return this;
    }

    public SortSpec getSort() {
        return sort;
    }

    /**
     * Sets the sort selecting which document an updateOne modifies.
     *
     * @param sort the sort
     *
     * @return this
     */
    public UpdateRequest setSort(SortSpec sort) {
        this.sort = sort;
        return this;
    }

    public boolean getUpsert() {
        return upsert;
    }

    public UpdateRequest setUpsert(boolean upsert) {
        this.upsert = upsert;
        return this;
    }

    public String getPageState() {
        return pageState;
    }

    /**
     * @param pageState the token
     * @return this
     * @hidden
     */
    public UpdateRequest setPageState(String pageState) {
        this.pageState = pageState;
        return this;
    }

    /**
     * @param collectionName the collection
     * @return this
     * @hidden
     */
    public UpdateRequest setCollectionName(String collectionName) {
        super.setCollectionNameInternal(collectionName);
        return this;
    }

    @Override
    public String getCommandName() {
        return multi ? "updateMany" : "updateOne";
    }

    @Override
    public void validate() {
        validateCollectionName();
        if (update == null || update.isEmpty()) {
            throw new IllegalArgumentException(
                "UpdateRequest requires a non-empty update");
        }
        if (multi && sort != null && !sort.isEmpty()) {
            throw new IllegalArgumentException(
                "updateMany does not accept a sort");
        }
    }

    @Override
    public Serializer createSerializer(SerializerFactory factory) {
        return factory.createUpdateSerializer();
    }
}
