/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops.bulk;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.dataapi.driver.ops.DeleteResult;
import io.dataapi.driver.ops.InsertManyResult;
import io.dataapi.driver.ops.UpdateResult;
import io.dataapi.driver.values.FieldValue;

/**
 * The outcome of a bulk write, or of one of its operations. Counters are
 * summed over the operations; {@link #getUpsertedIds} is keyed by the
 * position of the operation in the batch.
 * <p>
 * A document created by an upsert counts as both inserted and upserted.
 */
public class BulkWriteResult {

    private int deletedCount;
    private int insertedCount;
    private int matchedCount;
    private int modifiedCount;
    private int upsertedCount;
    private final Map<Integer, FieldValue> upsertedIds =
        new TreeMap<Integer, FieldValue>();

    public BulkWriteResult() {
    }

    static BulkWriteResult fromInserted(int count) {
        BulkWriteResult result = new BulkWriteResult();
        result.insertedCount = count;
        return result;
    }

    static BulkWriteResult fromInsertMany(InsertManyResult res) {
        return fromInserted(res.getInsertedIds().size());
    }

    static BulkWriteResult fromUpdate(UpdateResult res, int index) {
        BulkWriteResult result = new BulkWriteResult();
        result.matchedCount = res.getMatchedCount();
        result.modifiedCount = res.getModifiedCount();
        if (res.getUpsertedId() != null) {
            result.insertedCount = 1;
            result.upsertedCount = 1;
            result.upsertedIds.put(index, res.getUpsertedId());
        }
        return result;
    }

    static BulkWriteResult fromDelete(DeleteResult res) {
        BulkWriteResult result = new BulkWriteResult();
        /* -1, unknown, contributes nothing */
        result.deletedCount = Math.max(0, res.getDeletedCount());
        return result;
    }

    /**
     * Adds the counters and upserted ids of another result to this one.
     *
     * @param other the result to add
     *
     * @return this
     */
    public BulkWriteResult add(BulkWriteResult other) {
        deletedCount += other.deletedCount;
        insertedCount += other.insertedCount;
        matchedCount += other.matchedCount;
        modifiedCount += other.modifiedCount;
        upsertedCount += other.upsertedCount;
        upsertedIds.putAll(other.upsertedIds);
        return this;
    }

    /**
     * Sums a list of results into a new one.
     *
     * @param results the results
     *
     * @return the sum
     */
    public static BulkWriteResult merge(List<BulkWriteResult> results) {
        BulkWriteResult merged = new BulkWriteResult();
        for (BulkWriteResult result : results) {
            merged.add(result);
        }
        return merged;
    }

    public int getDeletedCount() {
        return deletedCount;
    }

    public int getInsertedCount() {
        return insertedCount;
    }

    public int getMatchedCount() {
        return matchedCount;
    }

    public int getModifiedCount() {
        return modifiedCount;
    }

    public int getUpsertedCount() {
        return upsertedCount;
    }

    /**
     * Returns the ids of upserted documents by operation index.
     *
     * @return the ids, ordered by index
     */
    public Map<Integer, FieldValue> getUpsertedIds() {
        return Collections.unmodifiableMap(upsertedIds);
    }

    @Override
    public String toString() {
        return "BulkWriteResult[deleted=" + deletedCount +
            ", inserted=" + insertedCount + ", matched=" + matchedCount +
            ", modified=" + modifiedCount + ", upserted=" + upsertedCount +
            ", upsertedIds=" + upsertedIds + "]";
    }
}
