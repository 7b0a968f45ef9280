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
 * Represents the input to a findOneAndUpdate command.
 */
public class FindOneAndUpdateRequest
    extends FindOneAndModifyRequest<FindOneAndUpdateRequest> {

    private MapValue update;
    private boolean upsert;
    private ReturnDocument returnDocument = ReturnDocument.BEFORE;

    @Override
    protected FindOneAndUpdateRequest self() {
        return this;
    }

    public MapValue getUpdate() {
        return update;
    }

    public FindOneAndUpdateRequest setUpdate(MapValue update) {
        this.update = update;
        return this;
    }

    public boolean getUpsert() {
        return upsert;
    }

    public FindOneAndUpdateRequest setUpsert(boolean upsert) {
        this.upsert = upsert;
        return this;
    }

    public ReturnDocument getReturnDocument() {
        return returnDocument;
    }

    public FindOneAndUpdateRequest setReturnDocument(
        ReturnDocument returnDocument) {
        this.returnDocument = returnDocument;
        return this;
    }

    @Override
    public String getCommandName() {
        return "findOneAndUpdate";
    }

    @Override
    public void validate() {
        super.validate();
        if (update == null || update.isEmpty()) {
            throw new IllegalArgumentException(
                "findOneAndUpdate requires a non-empty update");
        }
        if (returnDocument == null) {
            throw new IllegalArgumentException(
                "findOneAndUpdate requires a returnDocument");
        }
    }

    @Override
    public Serializer createSerializer(SerializerFactory factory) {
        return factory.createFindOneAndUpdateSerializer();
    }
}
