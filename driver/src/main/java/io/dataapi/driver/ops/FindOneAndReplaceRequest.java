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
 * Represents the input to a findOneAndReplace command. The replacement
 * becomes the whole document; the "_id" of the matched document is kept.
 */
public class FindOneAndReplaceRequest
    extends FindOneAndModifyRequest<FindOneAndReplaceRequest> {

    private MapValue replacement;
    private boolean upsert;
    private ReturnDocument returnDocument = ReturnDocument.BEFORE;

    @Override
    protected FindOneAndReplaceRequest self() {
        return this;
    }

    public MapValue getReplacement() {
        return replacement;
    }

    public FindOneAndReplaceRequest setReplacement(MapValue replacement) {
        this.replacement = replacement;
        return this;
    }

    public boolean getUpsert() {
        return upsert;
    }

    public FindOneAndReplaceRequest setUpsert(boolean upsert) {
        this.upsert = upsert;
        return this;
    }

    public ReturnDocument getReturnDocument() {
        return returnDocument;
    }

    public FindOneAndReplaceRequest setReturnDocument(
        ReturnDocument returnDocument) {
        this.returnDocument = returnDocument;
        return this;
    }

    @Override
    public String getCommandName() {
        return "findOneAndReplace";
    }

    @Override
    public void validate() {
        super.validate();
        if (replacement == null) {
            throw new IllegalArgumentException(
                "findOneAndReplace requires a replacement");
        }
        if (returnDocument == null) {
            throw new IllegalArgumentException(
                "findOneAndReplace requires a returnDocument");
        }
    }

    @Override
    public Serializer createSerializer(SerializerFactory factory) {
        return factory.createFindOneAndReplaceSerializer();
    }
}
