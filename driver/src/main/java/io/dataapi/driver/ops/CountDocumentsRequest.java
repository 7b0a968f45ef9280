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
 * Represents the input to a countDocuments command.
 */
public class CountDocumentsRequest extends Request {

    private MapValue filter;

    public MapValue getFilter() {
        return filter;
    }

    public CountDocumentsRequest setFilter(MapValue filter) {
        this.filter = filter;
        return this;
    }

    /**
     * @param collectionName the collection
     * @return this
     * @hidden
     */
    public CountDocumentsRequest setCollectionName(String collectionName) {
        super.setCollectionNameInternal(collectionName);
        return this;
    }

    @Override
    public String getCommandName() {
        return "countDocuments";
    }

    @Override
    public void validate() {
        validateCollectionName();
    }

    @Override
    public Serializer createSerializer(SerializerFactory factory) {
        return factory.createCountDocumentsSerializer();
    }
}
