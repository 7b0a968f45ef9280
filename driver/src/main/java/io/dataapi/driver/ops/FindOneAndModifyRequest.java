/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

import io.dataapi.driver.values.MapValue;

/**
 * A base class for the findOneAnd* commands, which modify the first
 * matching document and return a version of it.
 *
 * @param <T> the concrete request type, returned by the setters
 */
public abstract class FindOneAndModifyRequest<T extends FindOneAndModifyRequest<T>>
    extends Request {

    private MapValue filter;
    private Projection projection;
    private SortSpec sort;

    protected FindOneAndModifyRequest() {
    }

    protected abstract T self();

    public MapValue getFilter() {
        return filter;
    }

    public T setFilter(MapValue filter) {
        this.filter = filter;
        return self();
    }

    public Projection getProjection() {
        return projection;
    }

    /**
     * Sets the projection applied to the returned document.
     *
     * @param projection the projection
     *
     * @return this
     */
    public T setProjection(Projection projection) {
        this.projection = projection;
        return self();
    }

    public SortSpec getSort() {
        return sort;
    }

    public T setSort(SortSpec sort) {
        this.sort = sort;
        return self();
    }

    /**
     * @param collectionName the collection
     * @return this
     * @hidden
     */
    public T setCollectionName(String collectionName) {
        super.setCollectionNameInternal(collectionName);
        return self();
    }

    @Override
    public void validate() {
        validateCollectionName();
    }
}
