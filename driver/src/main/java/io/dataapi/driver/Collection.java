/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import java.util.List;

import io.dataapi.driver.ops.Cursor;
import io.dataapi.driver.ops.DeleteResult;
import io.dataapi.driver.ops.FindOneAndDeleteRequest;
import io.dataapi.driver.ops.FindOneAndReplaceRequest;
import io.dataapi.driver.ops.FindOneAndUpdateRequest;
import io.dataapi.driver.ops.FindOneRequest;
import io.dataapi.driver.ops.FindRequest;
import io.dataapi.driver.ops.FindResult;
import io.dataapi.driver.ops.InsertManyResult;
import io.dataapi.driver.ops.InsertOneResult;
import io.dataapi.driver.ops.Projection;
import io.dataapi.driver.ops.SortSpec;
import io.dataapi.driver.ops.UpdateResult;
import io.dataapi.driver.ops.bulk.BulkOperation;
import io.dataapi.driver.ops.bulk.BulkWriteResult;
import io.dataapi.driver.values.DocumentPath;
import io.dataapi.driver.values.FieldValue;
import io.dataapi.driver.values.MapValue;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

/**
 * A collection of a Data API namespace whose operations block until done.
 * It is a view of an {@link AsyncCollection}; see that class for the
 * semantics of each operation.
 * <p>
 * Errors are thrown as the exceptions the service or transport raised,
 * {@link DataAPIException} subclasses, or {@link IllegalArgumentException}
 * for invalid arguments.
 */
public class Collection {

    private final AsyncCollection async;

    Collection(AsyncCollection async) {
        this.async = async;
    }

    public String getName() {
        return async.getName();
    }

    public String getNamespace() {
        return async.getNamespace();
    }

    /**
     * Returns the HTTP path the commands of this collection are posted to.
     *
     * @return the path
     */
    public String getAddress() {
        return async.getAddress();
    }

    public AsyncCollection toAsync() {
        return async;
    }

    /**
     * Counts the documents matching a filter, exactly.
     *
     * @param filter the filter
     * @param upperBound the largest count the caller accepts
     *
     * @return the count
     *
     * @throws TooManyDocumentsToCountException if the count exceeds
     * upperBound or the service stopped counting
     */
    public int countDocuments(MapValue filter, int upperBound) {
        return block(async.countDocuments(filter, upperBound));
    }

    public InsertOneResult insertOne(MapValue document) {
        return block(async.insertOne(document));
    }

    public InsertManyResult insertMany(List<MapValue> documents) {
        return block(async.insertMany(documents));
    }

    public InsertManyResult insertMany(List<MapValue> documents,
                                       boolean ordered) {
        return block(async.insertMany(documents, ordered));
    }

    /**
     * Inserts documents in chunks.
     *
     * @param documents the documents
     * @param ordered true for an ordered insert
     * @param chunkSize the number of documents per command
     * @param concurrency the number of chunks in flight, unordered only
     *
     * @return the ids of the inserted documents
     *
     * @throws InsertManyException if any document was not inserted
     */
    public InsertManyResult insertMany(List<MapValue> documents,
                                       boolean ordered,
                                       int chunkSize,
                                       int concurrency) {
        return block(async.insertMany(documents, ordered, chunkSize,
                                      concurrency));
    }

    public Cursor find(MapValue filter) {
        return find(new FindRequest().setFilter(filter));
    }

    /**
     * Returns a cursor over the documents a query finds. No request is
     * made until the cursor is iterated.
     *
     * @param spec the query, copied by the cursor
     *
     * @return the cursor
     */
    public Cursor find(FindRequest spec) {
        return new Cursor(spec, this::fetchPage, this);
    }

    private FindResult fetchPage(FindRequest spec, String pageState) {
        return block(async.findPage(spec.copy().setPageState(pageState)));
    }

    public MapValue findOne(MapValue filter) {
        return block(async.findOne(filter));
    }

    /**
     * Finds a document.
     *
     * @param filter the filter
     * @param projection the projection, may be null
     * @param sort picks the document if several match, may be null
     *
     * @return the document, or null if none matches
     */
    public MapValue findOne(MapValue filter,
                            Projection projection,
                            SortSpec sort) {
        return block(async.findOne(filter, projection, sort));
    }

    public MapValue findOne(FindOneRequest request) {
        return block(async.findOne(request));
    }

    /**
     * Returns the distinct values found at a path in the documents
     * matching a filter, in the order they are first seen.
     *
     * @param path the path
     * @param filter the filter
     *
     * @return the values
     *
     * @throws IllegalArgumentException if the path is malformed
     */
    public List<FieldValue> distinct(String path, MapValue filter) {
        DocumentPath docPath = DocumentPath.parse(path);
        try (Cursor cursor =
                 find(AsyncCollection.distinctSpec(docPath, filter))) {
            return cursor.distinct(path);
        }
    }

    public UpdateResult updateOne(MapValue filter, MapValue update) {
        return block(async.updateOne(filter, update));
    }

    public UpdateResult updateOne(MapValue filter,
                                  MapValue update,
                                  SortSpec sort,
                                  boolean upsert) {
        return block(async.updateOne(filter, update, sort, upsert));
    }

    public UpdateResult updateMany(MapValue filter, MapValue update) {
        return block(async.updateMany(filter, update));
    }

    public UpdateResult updateMany(MapValue filter,
                                   MapValue update,
                                   boolean upsert) {
        return block(async.updateMany(filter, update, upsert));
    }

    public UpdateResult replaceOne(MapValue filter, MapValue replacement) {
        return block(async.replaceOne(filter, replacement));
    }

    public UpdateResult replaceOne(MapValue filter,
                                   MapValue replacement,
                                   SortSpec sort,
                                   boolean upsert) {
        return block(async.replaceOne(filter, replacement, sort, upsert));
    }

    public DeleteResult deleteOne(MapValue filter) {
        return block(async.deleteOne(filter));
    }

    public DeleteResult deleteOne(MapValue filter, SortSpec sort) {
        return block(async.deleteOne(filter, sort));
    }

    /**
     * Deletes every document matching a filter.
     *
     * @param filter the filter, must not be empty
     *
     * @return the result
     *
     * @throws IllegalArgumentException if the filter is null or empty
     */
    public DeleteResult deleteMany(MapValue filter) {
        return block(async.deleteMany(filter));
    }

    public DeleteResult deleteAll() {
        return block(async.deleteAll());
    }

    public MapValue findOneAndReplace(MapValue filter, MapValue replacement) {
        return block(async.findOneAndReplace(filter, replacement));
    }

    public MapValue findOneAndReplace(FindOneAndReplaceRequest request) {
        return block(async.findOneAndReplace(request));
    }

    public MapValue findOneAndUpdate(MapValue filter, MapValue update) {
        return block(async.findOneAndUpdate(filter, update));
    }

    public MapValue findOneAndUpdate(FindOneAndUpdateRequest request) {
        return block(async.findOneAndUpdate(request));
    }

    public MapValue findOneAndDelete(MapValue filter) {
        return block(async.findOneAndDelete(filter));
    }

    public MapValue findOneAndDelete(FindOneAndDeleteRequest request) {
        return block(async.findOneAndDelete(request));
    }

    public BulkWriteResult bulkWrite(List<BulkOperation> operations) {
        return block(async.bulkWrite(operations));
    }

    /**
     * Runs a list of write operations.
     *
     * @param operations the operations
     * @param ordered true to stop at the first failure
     * @param concurrency the number of operations in flight, unordered
     * only
     *
     * @return the summed result
     *
     * @throws BulkWriteException if any operation failed
     */
    public BulkWriteResult bulkWrite(List<BulkOperation> operations,
                                     boolean ordered,
                                     int concurrency) {
        return block(async.bulkWrite(operations, ordered, concurrency));
    }

    /*
     * Blocks on the Mono, rethrowing the original exception rather than
     * the wrapper block() may add.
     */
    static <T> T block(Mono<T> mono) {
        try {
            return mono.block();
        } catch (RuntimeException re) {
            Throwable t = Exceptions.unwrap(re);
            if (t instanceof RuntimeException) {
                throw (RuntimeException) t;
            }
            throw new DataAPIException(t.getMessage(), t);
        }
    }

    @Override
    public String toString() {
        return "Collection[" + getNamespace() + "." + getName() + "]";
    }
}
