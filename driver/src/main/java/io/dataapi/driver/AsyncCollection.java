/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import static io.dataapi.driver.util.CheckNull.requireNonEmpty;
import static io.dataapi.driver.util.CheckNull.requireNonNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import io.dataapi.driver.ops.CountDocumentsRequest;
import io.dataapi.driver.ops.CountDocumentsResult;
import io.dataapi.driver.ops.DeleteRequest;
import io.dataapi.driver.ops.DeleteResult;
import io.dataapi.driver.ops.FindOneAndDeleteRequest;
import io.dataapi.driver.ops.FindOneAndModifyResult;
import io.dataapi.driver.ops.FindOneAndReplaceRequest;
import io.dataapi.driver.ops.FindOneAndUpdateRequest;
import io.dataapi.driver.ops.FindOneRequest;
import io.dataapi.driver.ops.FindOneResult;
import io.dataapi.driver.ops.FindRequest;
import io.dataapi.driver.ops.FindResult;
import io.dataapi.driver.ops.InsertManyRequest;
import io.dataapi.driver.ops.InsertManyResult;
import io.dataapi.driver.ops.InsertOneRequest;
import io.dataapi.driver.ops.InsertOneResult;
import io.dataapi.driver.ops.Projection;
import io.dataapi.driver.ops.Request;
import io.dataapi.driver.ops.Result;
import io.dataapi.driver.ops.SortSpec;
import io.dataapi.driver.ops.UpdateRequest;
import io.dataapi.driver.ops.UpdateResult;
import io.dataapi.driver.ops.bulk.BulkOperation;
import io.dataapi.driver.ops.bulk.BulkWriteResult;
import io.dataapi.driver.ops.serde.JsonSerializerFactory;
import io.dataapi.driver.util.HttpConstants;
import io.dataapi.driver.values.DocumentPath;
import io.dataapi.driver.values.FieldValue;
import io.dataapi.driver.values.JsonUtils;
import io.dataapi.driver.values.MapValue;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SynchronousSink;
import reactor.core.scheduler.Schedulers;

/**
 * A collection of a Data API namespace, with operations that return
 * reactive publishers. Nothing is sent until a returned publisher is
 * subscribed to, and each subscription sends the command again.
 * <p>
 * Instances are obtained from {@link DataAPIHandleAsync#getCollection} and
 * are thread safe. {@link #toSync} returns the blocking view of the same
 * collection.
 * <p>
 * Filters are {@link MapValue} instances passed verbatim to the service;
 * null means all documents. A {@link Mono} of a document completes empty
 * when there is no document.
 */
public class AsyncCollection {

    private final DataAPIHandleAsync handle;
    private final DataAPIHandleConfig config;
    private final String namespace;
    private final String name;

    /**
     * @hidden
     * @param handle the handle
     * @param namespace the namespace
     * @param name the collection name
     */
    public AsyncCollection(DataAPIHandleAsync handle,
                           String namespace,
                           String name) {
        requireNonNull(handle, "AsyncCollection: handle must be non-null");
        requireNonEmpty(namespace, "AsyncCollection: namespace must be " +
                        "non-empty");
        requireNonEmpty(name, "AsyncCollection: name must be non-empty");
        this.handle = handle;
        this.config = handle.getConfig();
        this.namespace = namespace;
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * Returns the HTTP path the commands of this collection are posted to,
     * such as /api/json/v1/default_keyspace/movies.
     *
     * @return the path
     */
    public String getAddress() {
        return HttpConstants.makePath(config.getApiPath(), namespace, name);
    }

    /**
     * Returns a blocking view of this collection.
     *
     * @return the collection
     */
    public Collection toSync() {
        return new Collection(this);
    }

    /**
     * Counts the documents matching a filter, exactly.
     *
     * @param filter the filter
     * @param upperBound the largest count the caller accepts
     *
     * @return the count, or a {@link TooManyDocumentsToCountException} if
     * the count exceeds upperBound or the service stopped counting
     */
    public Mono<Integer> countDocuments(MapValue filter, int upperBound) {
        if (upperBound < 0) {
            throw new IllegalArgumentException(
                "countDocuments: upperBound must be >= 0");
        }
        CountDocumentsRequest req = new CountDocumentsRequest()
            .setFilter(filter);
        return execute(req)
            .cast(CountDocumentsResult.class)
            .handle((CountDocumentsResult res,
                     SynchronousSink<Integer> sink) -> {
                if (res.getMoreData()) {
                    sink.error(new TooManyDocumentsToCountException(
                        upperBound, true));
                } else if (res.getCount() > upperBound) {
                    sink.error(new TooManyDocumentsToCountException(
                        upperBound, false));
                } else {
                    sink.next(res.getCount());
                }
            });
    }

    /**
     * Inserts a document. If it has no "_id" the service generates one.
     *
     * @param document the document
     *
     * @return the result, holding the id
     */
    public Mono<InsertOneResult> insertOne(MapValue document) {
        return execute(new InsertOneRequest().setDocument(document))
            .cast(InsertOneResult.class);
    }

    /**
     * Inserts documents in order, stopping at the first failure. Uses the
     * chunk size of the configuration.
     *
     * @param documents the documents
     *
     * @return the result
     */
    public Mono<InsertManyResult> insertMany(List<MapValue> documents) {
        return insertMany(documents, true);
    }

    public Mono<InsertManyResult> insertMany(List<MapValue> documents,
                                             boolean ordered) {
        return insertMany(documents, ordered,
                          config.getInsertManyChunkSize(),
                          config.getInsertManyConcurrency());
    }

    /**
     * Inserts documents in chunks of at most chunkSize, one insertMany
     * command per chunk.
     * <p>
     * Ordered inserts send the chunks one at a time and stop at the first
     * chunk with an error; within a chunk the service stops at the first
     * failing document. Unordered inserts send up to concurrency chunks at
     * once and attempt every document.
     * <p>
     * On any failure the Mono signals {@link InsertManyException} holding
     * the ids that were inserted and the errors reported.
     *
     * @param documents the documents
     * @param ordered true for an ordered insert
     * @param chunkSize the number of documents per command
     * @param concurrency the number of chunks in flight, unordered only
     *
     * @return the ids of the inserted documents, in chunk order
     */
    public Mono<InsertManyResult> insertMany(List<MapValue> documents,
                                             boolean ordered,
                                             int chunkSize,
                                             int concurrency) {
        requireNonNull(documents, "insertMany: documents must be non-null");
        if (chunkSize < 1) {
            throw new IllegalArgumentException(
                "insertMany: chunkSize must be positive");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException(
                "insertMany: concurrency must be positive");
        }
        if (documents.isEmpty()) {
            return Mono.just(new InsertManyResult());
        }

        List<List<MapValue>> chunks = new ArrayList<List<MapValue>>();
        for (int i = 0; i < documents.size(); i += chunkSize) {
            chunks.add(new ArrayList<MapValue>(documents.subList(
                i, Math.min(documents.size(), i + chunkSize))));
        }

        Flux<Outcome<InsertManyResult>> outcomes;
        if (ordered) {
            outcomes = Flux.fromIterable(chunks)
                .concatMap(chunk -> outcome(insertChunk(chunk, true)))
                .takeUntil(outcome -> outcome.error != null);
        } else {
            outcomes = Flux.fromIterable(chunks)
                .flatMapSequential(chunk ->
                    outcome(insertChunk(chunk, false))
                    .subscribeOn(Schedulers.boundedElastic()),
                    concurrency);
        }
        return outcomes.collectList().flatMap(AsyncCollection::insertResult);
    }

    private Mono<InsertManyResult> insertChunk(List<MapValue> chunk,
                                               boolean ordered) {
        return execute(new InsertManyRequest()
                       .setDocuments(chunk)
                       .setOrdered(ordered))
            .cast(InsertManyResult.class);
    }

    private static Mono<InsertManyResult> insertResult(
        List<Outcome<InsertManyResult>> outcomes) {

        InsertManyResult result = new InsertManyResult();
        List<ErrorDescriptor> errors = new ArrayList<ErrorDescriptor>();
        Throwable firstError = null;
        for (Outcome<InsertManyResult> outcome : outcomes) {
            if (outcome.error == null) {
                result.addInsertedIds(outcome.value.getInsertedIds());
                continue;
            }
            if (firstError == null) {
                firstError = outcome.error;
            }
            if (outcome.error instanceof DataAPIResponseException) {
                DataAPIResponseException dre =
                    (DataAPIResponseException) outcome.error;
                errors.addAll(dre.getErrors());
                if (dre.getResponse() != null) {
                    /* the documents of the chunk that did get in */
                    result.addInsertedIds(
                        JsonSerializerFactory.readInsertedIds(
                            dre.getResponse()));
                }
            }
        }
        if (firstError == null) {
            return Mono.just(result);
        }
        return Mono.error(new InsertManyException(errors, result,
                                                  firstError));
    }

    /**
     * Finds the documents matching a filter.
     *
     * @param filter the filter
     *
     * @return the documents
     */
    public Flux<MapValue> find(MapValue filter) {
        return find(new FindRequest().setFilter(filter));
    }

    /**
     * Finds documents. Pages are requested as the documents are consumed,
     * following the page state of each response. A sorted find is one
     * request. If the request has a limit no more than limit documents are
     * emitted.
     *
     * @param spec the query, copied
     *
     * @return the documents
     */
    public Flux<MapValue> find(FindRequest spec) {
        requireNonNull(spec, "find: spec must be non-null");
        final FindRequest first = spec.copy().setPageState(null);
        Flux<MapValue> documents = findPage(first)
            .expand(page -> (first.isSorted() ||
                             page.getNextPageState() == null) ?
                    Mono.<FindResult>empty() :
                    findPage(first.copy()
                             .setPageState(page.getNextPageState())))
            .concatMapIterable(FindResult::getDocuments, 1);
        Integer limit = first.getLimit();
        return limit == null ? documents : documents.take(limit.longValue());
    }

    /*
     * Fetches one page of a find. Used for the cursors of the blocking
     * collection as well.
     */
    Mono<FindResult> findPage(FindRequest request) {
        return execute(request).cast(FindResult.class);
    }

    public Mono<MapValue> findOne(MapValue filter) {
        return findOne(filter, null, null);
    }

    /**
     * Finds a document.
     *
     * @param filter the filter
     * @param projection the projection, may be null
     * @param sort picks the document if several match, may be null
     *
     * @return the document, empty if none matches
     */
    public Mono<MapValue> findOne(MapValue filter,
                                  Projection projection,
                                  SortSpec sort) {
        return findOne(new FindOneRequest()
                       .setFilter(filter)
                       .setProjection(projection)
                       .setSort(sort));
    }

    public Mono<MapValue> findOne(FindOneRequest request) {
        return execute(request)
            .cast(FindOneResult.class)
            .flatMap(res -> Mono.justOrEmpty(res.getDocument()));
    }

    /**
     * Returns the distinct values found at a path in the documents
     * matching a filter, in the order they are first seen. See
     * {@link DocumentPath} for the path syntax.
     *
     * @param path the path
     * @param filter the filter
     *
     * @return the values
     *
     * @throws IllegalArgumentException if the path is malformed
     */
    public Mono<List<FieldValue>> distinct(String path, MapValue filter) {
        final DocumentPath docPath = DocumentPath.parse(path);
        return find(distinctSpec(docPath, filter))
            .collect(() -> new LinkedHashMap<String, FieldValue>(),
                     (values, doc) -> {
                         for (FieldValue value : docPath.extract(doc)) {
                             values.putIfAbsent(
                                 JsonUtils.toCanonicalJson(value), value);
                         }
                     })
            .map(values -> new ArrayList<FieldValue>(values.values()));
    }

    /* the query of a distinct, projected on the part of the path before
     * any index */
    static FindRequest distinctSpec(DocumentPath path, MapValue filter) {
        FindRequest spec = new FindRequest().setFilter(filter);
        String prefix = path.getProjectionPrefix();
        if (prefix != null) {
            spec.setProjection(Projection.include(prefix));
        }
        return spec;
    }

    public Mono<UpdateResult> updateOne(MapValue filter, MapValue update) {
        return updateOne(filter, update, null, false);
    }

    /**
     * Updates one document.
     *
     * @param filter the filter
     * @param update the update, such as {@code {"$set": {...}}}
     * @param sort picks the document if several match, may be null
     * @param upsert true to insert a document if none matches
     *
     * @return the result
     */
    public Mono<UpdateResult> updateOne(MapValue filter,
                                        MapValue update,
                                        SortSpec sort,
                                        boolean upsert) {
        return execute(new UpdateRequest(false)
                       .setFilter(filter)
                       .setUpdate(update)
                       .setSort(sort)
                       .setUpsert(upsert))
            .cast(UpdateResult.class);
    }

    public Mono<UpdateResult> updateMany(MapValue filter, MapValue update) {
        return updateMany(filter, update, false);
    }

    /**
     * Updates every document matching a filter. The service updates a
     * batch per command; commands are repeated until it reports no more
     * data, and the counts summed.
     *
     * @param filter the filter
     * @param update the update
     * @param upsert true to insert a document if none matches
     *
     * @return the summed result
     */
    public Mono<UpdateResult> updateMany(MapValue filter,
                                         MapValue update,
                                         boolean upsert) {
        return updateBatch(filter, update, upsert, null)
            .expand(res -> res.getNextPageState() == null ?
                    Mono.<UpdateResult>empty() :
                    updateBatch(filter, update, upsert,
                                res.getNextPageState()))
            .reduceWith(UpdateResult::new, UpdateResult::add)
            .map(res -> res.setNextPageState(null).setMoreData(false));
    }

    private Mono<UpdateResult> updateBatch(MapValue filter,
                                           MapValue update,
                                           boolean upsert,
                                           String pageState) {
        return execute(new UpdateRequest(true)
                       .setFilter(filter)
                       .setUpdate(update)
                       .setUpsert(upsert)
                       .setPageState(pageState))
            .cast(UpdateResult.class);
    }

    public Mono<UpdateResult> replaceOne(MapValue filter,
                                         MapValue replacement) {
        return replaceOne(filter, replacement, null, false);
    }

    /**
     * Replaces one document, keeping its id.
     *
     * @param filter the filter
     * @param replacement the new document
     * @param sort picks the document if several match, may be null
     * @param upsert true to insert the replacement if none matches
     *
     * @return the result
     */
    public Mono<UpdateResult> replaceOne(MapValue filter,
                                         MapValue replacement,
                                         SortSpec sort,
                                         boolean upsert) {
        return execute(new FindOneAndReplaceRequest()
                       .setFilter(filter)
                       .setReplacement(replacement)
                       .setSort(sort)
                       .setUpsert(upsert)
                       .setProjection(Projection.include("_id")))
            .cast(FindOneAndModifyResult.class)
            .map(FindOneAndModifyResult::toUpdateResult);
    }

    public Mono<DeleteResult> deleteOne(MapValue filter) {
        return deleteOne(filter, null);
    }

    /**
     * Deletes one document.
     *
     * @param filter the filter
     * @param sort picks the document if several match, may be null
     *
     * @return the result
     */
    public Mono<DeleteResult> deleteOne(MapValue filter, SortSpec sort) {
        return execute(new DeleteRequest(false)
                       .setFilter(filter)
                       .setSort(sort))
            .cast(DeleteResult.class);
    }

    /**
     * Deletes every document matching a filter, repeating the command
     * while the service reports more data.
     *
     * @param filter the filter, must not be empty; use {@link #deleteAll}
     * to empty the collection
     *
     * @return the summed result
     *
     * @throws IllegalArgumentException if the filter is null or empty
     */
    public Mono<DeleteResult> deleteMany(MapValue filter) {
        if (filter == null || filter.isEmpty()) {
            throw new IllegalArgumentException(
                "deleteMany requires a non-empty filter, use deleteAll to " +
                "delete every document");
        }
        return deleteBatches(filter);
    }

    /**
     * Deletes every document of the collection. The service does not count
     * them, the deleted count is -1.
     *
     * @return the result
     */
    public Mono<DeleteResult> deleteAll() {
        return deleteBatches(null);
    }

    private Mono<DeleteResult> deleteBatches(MapValue filter) {
        return deleteBatch(filter)
            .expand(res -> res.getMoreData() ?
                    deleteBatch(filter) : Mono.<DeleteResult>empty())
            .reduce((total, res) -> new DeleteResult()
                    .setDeletedCount(
                        (total.getDeletedCount() < 0 ||
                         res.getDeletedCount() < 0) ? -1 :
                        total.getDeletedCount() + res.getDeletedCount()))
            .map(res -> res.setMoreData(false));
    }

    private Mono<DeleteResult> deleteBatch(MapValue filter) {
        return execute(new DeleteRequest(true).setFilter(filter))
            .cast(DeleteResult.class);
    }

    public Mono<MapValue> findOneAndReplace(MapValue filter,
                                            MapValue replacement) {
        return findOneAndReplace(new FindOneAndReplaceRequest()
                                 .setFilter(filter)
                                 .setReplacement(replacement));
    }

    /**
     * Replaces a document and returns it, before or after the replacement
     * as the request says.
     *
     * @param request the request
     *
     * @return the document, empty if none matched and, for
     * {@link io.dataapi.driver.ops.ReturnDocument#BEFORE}, if one was
     * upserted
     */
    public Mono<MapValue> findOneAndReplace(FindOneAndReplaceRequest request) {
        return findOneAndModify(request);
    }

    public Mono<MapValue> findOneAndUpdate(MapValue filter, MapValue update) {
        return findOneAndUpdate(new FindOneAndUpdateRequest()
                                .setFilter(filter)
                                .setUpdate(update));
    }

    /**
     * Updates a document and returns it, before or after the update as
     * the request says.
     *
     * @param request the request
     *
     * @return the document, empty if there is none
     */
    public Mono<MapValue> findOneAndUpdate(FindOneAndUpdateRequest request) {
        return findOneAndModify(request);
    }

    public Mono<MapValue> findOneAndDelete(MapValue filter) {
        return findOneAndDelete(new FindOneAndDeleteRequest()
                                .setFilter(filter));
    }

    /**
     * Deletes a document and returns it.
     *
     * @param request the request
     *
     * @return the deleted document, empty if none matched
     */
    public Mono<MapValue> findOneAndDelete(FindOneAndDeleteRequest request) {
        return findOneAndModify(request);
    }

    private Mono<MapValue> findOneAndModify(Request request) {
        return execute(request)
            .cast(FindOneAndModifyResult.class)
            .flatMap(res -> Mono.justOrEmpty(res.getDocument()));
    }

    public Mono<BulkWriteResult> bulkWrite(List<BulkOperation> operations) {
        return bulkWrite(operations, true, config.getBulkWriteConcurrency());
    }

    /**
     * Runs a list of write operations.
     * <p>
     * Ordered writes run one operation at a time and stop at the first
     * failure. Unordered writes run up to concurrency operations at once
     * and attempt all of them. Failures are signalled as a
     * {@link BulkWriteException} holding the summed result of the
     * operations that succeeded.
     *
     * @param operations the operations
     * @param ordered true for an ordered write
     * @param concurrency the number of operations in flight, unordered
     * only
     *
     * @return the summed result
     */
    public Mono<BulkWriteResult> bulkWrite(List<BulkOperation> operations,
                                           boolean ordered,
                                           int concurrency) {
        requireNonNull(operations, "bulkWrite: operations must be non-null");
        if (concurrency < 1) {
            throw new IllegalArgumentException(
                "bulkWrite: concurrency must be positive");
        }
        final List<BulkOperation> ops =
            new ArrayList<BulkOperation>(operations);
        Flux<Outcome<BulkWriteResult>> outcomes;
        if (ordered) {
            outcomes = Flux.range(0, ops.size())
                .concatMap(i -> outcome(ops.get(i).execute(this, i)))
                .takeUntil(outcome -> outcome.error != null);
        } else {
            outcomes = Flux.range(0, ops.size())
                .flatMapSequential(i ->
                    outcome(ops.get(i).execute(this, i))
                    .subscribeOn(Schedulers.boundedElastic()),
                    concurrency);
        }
        return outcomes.collectList().flatMap(AsyncCollection::bulkResult);
    }

    private static Mono<BulkWriteResult> bulkResult(
        List<Outcome<BulkWriteResult>> outcomes) {

        BulkWriteResult result = new BulkWriteResult();
        List<Throwable> causes = new ArrayList<Throwable>();
        for (Outcome<BulkWriteResult> outcome : outcomes) {
            if (outcome.error == null) {
                result.add(outcome.value);
            } else {
                causes.add(outcome.error);
            }
        }
        if (causes.isEmpty()) {
            return Mono.just(result);
        }
        return Mono.error(new BulkWriteException(result, causes));
    }

    /*
     * Sets the target of the request and runs it. The request keeps any
     * namespace it already has.
     */
    private Mono<Result> execute(Request request) {
        if (request.getNamespace() == null) {
            request.setNamespaceInternal(namespace);
        }
        request.setCollectionNameInternal(name);
        return handle.execute(request);
    }

    private static <T> Mono<Outcome<T>> outcome(Mono<T> mono) {
        return mono.map(Outcome::success)
            .onErrorResume(t -> Mono.just(Outcome.<T>failure(t)));
    }

    /*
     * A value or an error, for batches that go on past a failure.
     */
    private static final class Outcome<T> {
        private final T value;
        private final Throwable error;

        private Outcome(T value, Throwable error) {
            this.value = value;
            this.error = error;
        }

        static <T> Outcome<T> success(T value) {
            return new Outcome<T>(value, null);
        }

        static <T> Outcome<T> failure(Throwable error) {
            return new Outcome<T>(null, error);
        }
    }

    @Override
    public String toString() {
        return "AsyncCollection[" + namespace + "." + name + "]";
    }
}
