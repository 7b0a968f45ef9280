/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

import java.util.ArrayList;
import java.util.List;

import io.dataapi.driver.ops.serde.Serializer;
import io.dataapi.driver.ops.serde.SerializerFactory;
import io.dataapi.driver.values.MapValue;

/**
 * Represents the input to a single insertMany command. Large inserts are
 * split into several of these by
 * {@link io.dataapi.driver.Collection#insertMany}.
 * <p>
 * When ordered, the service stops at the first failing document. When
 * unordered, it attempts every document.
 */
public class InsertManyRequest extends Request {

    private List<MapValue> documents = new ArrayList<MapValue>();
    private boolean ordered;

    public List<MapValue> getDocuments() {
        return documents;
    }

    public InsertManyRequest setDocuments(List<MapValue> documents) {
        this.documents = documents;
        return this;
    }

    public boolean isOrdered() {
        return ordered;
    }

    public InsertManyRequest setOrdered(boolean ordered) {
        this.ordered = ordered;
        return this;
    }

    /**
     * @param collectionName the collection
     * @return this
     * @hidden
     */
    public InsertManyRequest setCollectionName(String collectionName) {
        super.setCollectionNameInternal(collectionName);
        return this;
    }

    @Override
    public String getCommandName() {
        return "insertMany";
    }

    @Override
    public void validate() {
        validateCollectionName();
        if (documents == null || documents.isEmpty()) {
            throw new IllegalArgumentException(
                "InsertManyRequest requires at least one document");
        }
        for (MapValue doc : documents) {
            if (doc == null) {
                throw new IllegalArgumentException(
                    "InsertManyRequest: documents must be non-null");
            }
        }
    }

    @Override
    public Serializer createSerializer(SerializerFactory factory) {
        return factory.createInsertManySerializer();
    }
}
