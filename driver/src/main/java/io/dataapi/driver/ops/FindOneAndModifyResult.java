/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

import io.dataapi.driver.values.FieldValue;
import io.dataapi.driver.values.MapValue;

/**
 * The result of a findOneAnd* command: the returned document plus the
 * status counters reported by the service.
 */
public class FindOneAndModifyResult extends Result {

    private MapValue document;
    private int matchedCount;
    private int modifiedCount;
    private int deletedCount;
    private FieldValue upsertedId;

    /**
     * Returns the document, or null if none matched. For an upsert
     * returning the document before modification this is null too.
     *
     * @return the document
     */
    public MapValue getDocument() {
        return document;
    }

    /**
     * @param document the document
     * @return this
     * @hidden
     */
    public FindOneAndModifyResult setDocument(MapValue document) {
        this.document = document;
        return this;
    }

    public int getMatchedCount() {
        return matchedCount;
    }

    /**
     * @param matchedCount the count
     * @return this
     * @hidden
     */
    public FindOneAndModifyResult setMatchedCount(int matchedCount) {
        this.matchedCount = matchedCount;
        return this;
    }

    public int getModifiedCount() {
        return modifiedCount;
    }

    /**
     * @param modifiedCount the count
     * @return this
     * @hidden
     */
    public FindOneAndModifyResult setModifiedCount(int modifiedCount) {
        this.modifiedCount = modifiedCount;
        return this;
    }

    public int getDeletedCount() {
        return deletedCount;
    }

    /**
     * @param deletedCount the count
     * @return this
     * @hidden
     */
    public FindOneAndModifyResult setDeletedCount(int deletedCount) {
        this.deletedCount = deletedCount;
        return this;
    }

    public FieldValue getUpsertedId() {
        return upsertedId;
    }

    /**
     * @param upsertedId the id
     * @return this
     * @hidden
     */
    public FindOneAndModifyResult setUpsertedId(FieldValue upsertedId) {
        this.upsertedId = upsertedId;
        return this;
    }

    /**
     * Returns the counters as an {@link UpdateResult}.
     *
     * @return a new result
     */
    public UpdateResult toUpdateResult() {
        UpdateResult res = new UpdateResult()
            .setMatchedCount(matchedCount)
            .setModifiedCount(modifiedCount)
            .setUpsertedId(upsertedId);
        res.setStatus(getStatus());
        return res;
    }
}
