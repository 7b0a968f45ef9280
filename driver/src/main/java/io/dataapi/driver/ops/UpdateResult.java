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
 * The result of an update or replace. For a paginated updateMany the
 * collection sums the counters of every call.
 */
public class UpdateResult extends Result {

    private int matchedCount;
    private int modifiedCount;
    private FieldValue upsertedId;
    private boolean moreData;
    private String nextPageState;

    public int getMatchedCount() {
        return matchedCount;
    }

    /**
     * @param matchedCount the count
     * @return this
     * @hidden
     */
    public UpdateResult setMatchedCount(int matchedCount) {
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
    public UpdateResult setModifiedCount(int modifiedCount) {
        this.modifiedCount = modifiedCount;
        return this;
    }

    /**
     * Returns the id of the document inserted by an upsert, or null if no
     * upsert happened.
     *
     * @return the id
     */
    public FieldValue getUpsertedId() {
        return upsertedId;
    }

    /**
     * @param upsertedId the id
     * @return this
     * @hidden
     */
    public UpdateResult setUpsertedId(FieldValue upsertedId) {
        this.upsertedId = upsertedId;
        return this;
    }

    /**
     * @return true if the service stopped before updating every match
     * @hidden
     */
    public boolean getMoreData() {
        return moreData;
    }

    /**
     * @param moreData the flag
     * @return this
     * @hidden
     */
    public UpdateResult setMoreData(boolean moreData) {
        this.moreData = moreData;
        return this;
    }

    /**
     * @return the continuation token
     * @hidden
     */
    public String getNextPageState() {
        return nextPageState;
    }

    /**
     * @param nextPageState the token
     * @return this
     * @hidden
     */
    public UpdateResult setNextPageState(String nextPageState) {
        this.nextPageState = nextPageState;
        return this;
    }

    /**
     * Adds the counters of another partial result to this one.
     *
     * @param other the other result
     * @return this
     * @hidden
     */
    public UpdateResult add(UpdateResult other) {
        matchedCount += other.matchedCount;
        modifiedCount += other.modifiedCount;
        if (other.upsertedId != null) {
            upsertedId = other.upsertedId;
        }
        moreData = other.moreData;
        nextPageState = other.nextPageState;
        return this;
    }

    /**
     * Returns a summary of the update in the form used by document
     * database drivers:
     * <pre>
     *   {"n": matched + upserted, "updatedExisting": matched &gt; 0,
     *    "ok": 1.0, "nModified": modified, "upserted": id}
     * </pre>
     * "upserted" is present only when an upsert happened.
     *
     * @return a new map
     */
    public MapValue getUpdateInfo() {
        MapValue info = new MapValue();
        info.put("n", matchedCount + (upsertedId != null ? 1 : 0));
        info.put("updatedExisting", matchedCount > 0);
        info.put("ok", 1.0);
        info.put("nModified", modifiedCount);
        if (upsertedId != null) {
            info.put("upserted", upsertedId);
        }
        return info;
    }

    @Override
    public String toString() {
        return "UpdateResult[matched=" + matchedCount + ", modified=" +
            modifiedCount + ", upsertedId=" + upsertedId + "]";
    }
}
