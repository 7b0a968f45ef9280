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
 * Represents the input to an insertOne command. If the document has no
 * "_id" field the service generates one.
 */
public class InsertOneRequest extends Request {

    private MapValue document;

    public MapValue getDocument() {
        return document;
    }

    public InsertOneRequest setDocument(MapValue document) {
        this.document = document;
        return this;
    }

    /**
     * @param collectionName the collection
     * @return this
     * @hidden
     */
    public InsertOneRequest setCollectionName(String collectionName) {
        super.setCollectionNameInternal(collectionName);
        return this;
    }

    @Override
    public String getCommandName() {
        return "insertOne";
    }

    @Override
    public void validate() {
        validateCollectionName();
        if (document == null) {
            throw new IllegalArgumentException(
                "InsertOneRequest requires a document");
        }
    }

    @Override
    public Serializer createSerializer(SerializerFactory factory) {
        return factory.createInsertOneSerializer();
    }
}
