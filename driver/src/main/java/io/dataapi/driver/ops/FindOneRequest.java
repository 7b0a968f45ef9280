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
 * Represents the input to a findOne command, which returns the first
 * matching document.
 */
public class FindOneRequest extends Request {

    private MapValue filter;
    private Projection projection;
    private SortSpec sort;

    public MapValue getFilter() {
        return filter;
    }

    public FindOneRequest setFilter(MapValue filter) {
        this.filter = filter;
        return this;
    }

    public Projection getProjection() {
        return projection;
    }

    public FindOneRequest setProjection(Projection projection) {
        this.projection = projection;
        return this;
    }

    public SortSpec getSort() {
        return sort;
    }

    public FindOneRequest setSort(SortSpec sort) {
        this.sort = sort;
        return this;
    }

    /**
     * @param collectionName the collection
     * @return this
     * @hidden
     */
    public FindOneRequest setCollectionName(String collectionName) {
        super.setCollectionNameInternal(collectionName);
        return this;
    }

    @Override
    public String getCommandName() {
        return "findOne";
    }

    @Override
    public void validate() {
        validateCollectionName();
    }

    @Override
    public Serializer createSerializer(SerializerFactory factory) {
        return factory.createFindOneSerializer();
    }
}
