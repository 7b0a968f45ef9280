/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops.serde;

import java.util.ArrayList;
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
import io.dataapi.driver.values.ArrayValue;
import io.dataapi.driver.values.FieldValue;
import io.dataapi.driver.values.MapValue;

/**
 * @hidden
 *
 * Serializers for the JSON Data API commands. Every command is a single
 * entry object:
 * <pre>
 *   {"&lt;command&gt;": {"filter": ..., ..., "options": {...}}}
 * </pre>
 * and every response an object with optional "data", "status" and
 * "errors" members. Errors are handled by the transport before a
 * serializer sees the response.
 */
public class JsonSerializerFactory implements SerializerFactory {

    /* response members */
    public static final String DATA = "data";
    public static final String STATUS = "status";
    public static final String ERRORS = "errors";

    /* command members */
    static final String FILTER = "filter";
    static final String PROJECTION = "projection";
    static final String SORT = "sort";
    static final String OPTIONS = "options";
    static final String DOCUMENT = "document";
    static final String DOCUMENTS = "documents";
    static final String UPDATE = "update";
    static final String REPLACEMENT = "replacement";

    /* options */
    static final String SKIP = "skip";
    static final String LIMIT = "limit";
    static final String PAGE_STATE = "pageState";
    static final String ORDERED = "ordered";
    static final String UPSERT = "upsert";
    static final String RETURN_DOCUMENT = "returnDocument";

    /* data and status members */
    static final String NEXT_PAGE_STATE = "nextPageState";
    static final String INSERTED_IDS = "insertedIds";
    static final String MATCHED_COUNT = "matchedCount";
    static final String MODIFIED_COUNT = "modifiedCount";
    static final String UPSERTED_ID = "upsertedId";
    static final String DELETED_COUNT = "deletedCount";
    static final String MORE_DATA = "moreData";
    static final String COUNT = "count";

    static final Serializer findSerializer =
        new FindRequestSerializer();
    static final Serializer findOneSerializer =
        new FindOneRequestSerializer();
    static final Serializer insertOneSerializer =
        new InsertOneRequestSerializer();
    static final Serializer insertManySerializer =
        new InsertManyRequestSerializer();
    static final Serializer updateSerializer =
        new UpdateRequestSerializer();
    static final Serializer deleteSerializer =
        new DeleteRequestSerializer();
    static final Serializer countDocumentsSerializer =
        new CountDocumentsRequestSerializer();
    static final Serializer findOneAndUpdateSerializer =
        new FindOneAndUpdateRequestSerializer();
    static final Serializer findOneAndReplaceSerializer =
        new FindOneAndReplaceRequestSerializer();
    static final Serializer findOneAndDeleteSerializer =
        new FindOneAndDeleteRequestSerializer();

    @Override
    public Serializer createFindSerializer() {
        return findSerializer;
    }

    @Override
    public Serializer createFindOneSerializer() {
        return findOneSerializer;
    }

    @Override
    public Serializer createInsertOneSerializer() {
        return insertOneSerializer;
    }

    @Override
    public Serializer createInsertManySerializer() {
        return insertManySerializer;
    }

    @Override
    public Serializer createUpdateSerializer() {
        return updateSerializer;
    }

    @Override
    public Serializer createDeleteSerializer() {
        return deleteSerializer;
    }

    @Override
    public Serializer createCountDocumentsSerializer() {
        return countDocumentsSerializer;
    }

    @Override
    public Serializer createFindOneAndUpdateSerializer() {
        return findOneAndUpdateSerializer;
    }

    @Override
    public Serializer createFindOneAndReplaceSerializer() {
        return findOneAndReplaceSerializer;
    }

    @Override
    public Serializer createFindOneAndDeleteSerializer() {
        return findOneAndDeleteSerializer;
    }

    /*
     * Shared helpers
     */

    /**
     * Returns the ids listed in status.insertedIds of a response, empty if
     * absent. Used for partial results of failed inserts as well.
     *
     * @param response the response
     *
     * @return the ids
     */
    public static List<FieldValue> readInsertedIds(MapValue response) {
        List<FieldValue> ids = new ArrayList<FieldValue>();
        MapValue status = getMap(response, STATUS);
        FieldValue val = (status == null ? null : status.get(INSERTED_IDS));
        if (val != null && val.isArray()) {
            for (FieldValue id : val.asArray()) {
                ids.add(id);
            }
        }
        return ids;
    }

    static MapValue command(Request request, MapValue payload) {
        MapValue cmd = new MapValue(1);
        cmd.put(request.getCommandName(), payload);
        return cmd;
    }

    /* an absent filter is sent as {} */
    static void writeFilter(MapValue payload, MapValue filter) {
        payload.put(FILTER, filter == null ? new MapValue() : filter);
    }

    static void writeProjection(MapValue payload, Projection projection) {
        if (projection != null) {
            payload.put(PROJECTION, projection.toMapValue());
        }
    }

    static void writeSort(MapValue payload, SortSpec sort) {
        if (sort != null && !sort.isEmpty()) {
            payload.put(SORT, sort.toMapValue());
        }
    }

    static void writeOptions(MapValue payload, MapValue options) {
        if (!options.isEmpty()) {
            payload.put(OPTIONS, options);
        }
    }

    static MapValue getMap(MapValue map, String name) {
        if (map == null) {
            return null;
        }
        FieldValue val = map.get(name);
        return (val != null && val.isMap() ? val.asMap() : null);
    }

    static int readInt(MapValue map, String name, int defaultValue) {
        if (map == null) {
            return defaultValue;
        }
        FieldValue val = map.get(name);
        if (val == null || !val.isNumeric()) {
            return defaultValue;
        }
        return (val.isInteger() ? val.getInt() : (int) val.castAsDouble());
    }

    static boolean readBoolean(MapValue map, String name) {
        if (map == null) {
            return false;
        }
        FieldValue val = map.get(name);
        return val != null && val.isBoolean() && val.getBoolean();
    }

    static String readString(MapValue map, String name) {
        if (map == null) {
            return null;
        }
        FieldValue val = map.get(name);
        return (val != null && val.isString() ? val.getString() : null);
    }

    /* a JSON null id counts as absent */
    static FieldValue readId(MapValue map, String name) {
        if (map == null) {
            return null;
        }
        FieldValue val = map.get(name);
        return (val == null || val.isJsonNull() ? null : val);
    }

    static MapValue readDocument(MapValue response) {
        return getMap(getMap(response, DATA), DOCUMENT);
    }

    static <T extends Result> T withStatus(T result, MapValue response) {
        result.setStatus(getMap(response, STATUS));
        return result;
    }

    /**
     * Find request:
     *    filter, projection, sort
     *    options: skip, limit, pageState
     *
     * Find result (data):
     *    documents
     *    nextPageState, may be null
     */
    public static class FindRequestSerializer implements Serializer {

        @Override
        public MapValue serialize(Request request) {
            FindRequest rq = (FindRequest) request;
            MapValue payload = new MapValue();
            writeFilter(payload, rq.getFilter());
            writeProjection(payload, rq.getProjection());
            writeSort(payload, rq.getSort());

            MapValue options = new MapValue();
            if (rq.getSkip() != null) {
                options.put(SKIP, rq.getSkip().intValue());
            }
            if (rq.getLimit() != null) {
                options.put(LIMIT, rq.getLimit().intValue());
            }
            /* a sorted find is not paginated */
            if (rq.getPageState() != null && !rq.isSorted()) {
                options.put(PAGE_STATE, rq.getPageState());
            }
            writeOptions(payload, options);
            return command(rq, payload);
        }

        @Override
        public Result deserialize(Request request, MapValue response) {
            FindResult result = new FindResult();
            MapValue data = getMap(response, DATA);
            List<MapValue> docs = new ArrayList<MapValue>();
            FieldValue val = (data == null ? null : data.get(DOCUMENTS));
            if (val != null && val.isArray()) {
                for (FieldValue doc : val.asArray()) {
                    docs.add(doc.asMap());
                }
            }
            result.setDocuments(docs);
            result.setNextPageState(readString(data, NEXT_PAGE_STATE));
            return withStatus(result, response);
        }
    }

    /**
     * FindOne request:
     *    filter, projection, sort
     *
     * FindOne result (data):
     *    document, may be null
     */
    public static class FindOneRequestSerializer implements Serializer {

        @Override
        public MapValue serialize(Request request) {
            FindOneRequest rq = (FindOneRequest) request;
            MapValue payload = new MapValue();
            writeFilter(payload, rq.getFilter());
            writeProjection(payload, rq.getProjection());
            writeSort(payload, rq.getSort());
            return command(rq, payload);
        }

        @Override
        public Result deserialize(Request request, MapValue response) {
            return withStatus(
                new FindOneResult().setDocument(readDocument(response)),
                response);
        }
    }

    /**
     * InsertOne request:
     *    document
     *
     * InsertOne result (status):
     *    insertedIds, a single element array
     */
    public static class InsertOneRequestSerializer implements Serializer {

        @Override
        public MapValue serialize(Request request) {
            InsertOneRequest rq = (InsertOneRequest) request;
            MapValue payload = new MapValue(1);
            payload.put(DOCUMENT, rq.getDocument());
            return command(rq, payload);
        }

        @Override
        public Result deserialize(Request request, MapValue response) {
            List<FieldValue> ids = readInsertedIds(response);
            InsertOneResult result = new InsertOneResult();
            if (!ids.isEmpty()) {
                result.setInsertedId(ids.get(0));
            }
            return withStatus(result, response);
        }
    }

    /**
     * InsertMany request:
     *    documents
     *    options: ordered
     *
     * InsertMany result (status):
     *    insertedIds
     */
    public static class InsertManyRequestSerializer implements Serializer {

        @Override
        public MapValue serialize(Request request) {
            InsertManyRequest rq = (InsertManyRequest) request;
            MapValue payload = new MapValue(2);
            ArrayValue docs = new ArrayValue(rq.getDocuments().size());
            for (MapValue doc : rq.getDocuments()) {
                docs.add(doc);
            }
            payload.put(DOCUMENTS, docs);
            MapValue options = new MapValue(1);
            options.put(ORDERED, rq.isOrdered());
            writeOptions(payload, options);
            return command(rq, payload);
        }

        @Override
        public Result deserialize(Request request, MapValue response) {
            return withStatus(
                new InsertManyResult().addInsertedIds(
                    readInsertedIds(response)),
                response);
        }
    }

    /**
     * UpdateOne/UpdateMany request:
     *    filter, update, sort (updateOne only)
     *    options: upsert, pageState (updateMany only)
     *
     * Update result (status):
     *    matchedCount, modifiedCount, upsertedId?
     *    moreData?, nextPageState?
     */
    public static class UpdateRequestSerializer implements Serializer {

        @Override
        public MapValue serialize(Request request) {
            UpdateRequest rq = (UpdateRequest) request;
            MapValue payload = new MapValue();
            writeFilter(payload, rq.getFilter());
            payload.put(UPDATE, rq.getUpdate());
            if (!rq.isMulti()) {
                writeSort(payload, rq.getSort());
            }
            MapValue options = new MapValue();
            if (rq.getUpsert()) {
                options.put(UPSERT, true);
            }
            if (rq.isMulti() && rq.getPageState() != null) {
                options.put(PAGE_STATE, rq.getPageState());
            }
            writeOptions(payload, options);
            return command(rq, payload);
        }

        @Override
        public Result deserialize(Request request, MapValue response) {
            MapValue status = getMap(response, STATUS);
            UpdateResult result = new UpdateResult()
                .setMatchedCount(readInt(status, MATCHED_COUNT, 0))
                .setModifiedCount(readInt(status, MODIFIED_COUNT, 0))
                .setUpsertedId(readId(status, UPSERTED_ID))
                .setMoreData(readBoolean(status, MORE_DATA))
                .setNextPageState(readString(status, NEXT_PAGE_STATE));
            return withStatus(result, response);
        }
    }

    /**
     * DeleteOne/DeleteMany request:
     *    filter, sort (deleteOne only)
     *
     * Delete result (status):
     *    deletedCount, moreData?
     */
    public static class DeleteRequestSerializer implements Serializer {

        @Override
        public MapValue serialize(Request request) {
            DeleteRequest rq = (DeleteRequest) request;
            MapValue payload = new MapValue();
            writeFilter(payload, rq.getFilter());
            if (!rq.isMulti()) {
                writeSort(payload, rq.getSort());
            }
            return command(rq, payload);
        }

        @Override
        public Result deserialize(Request request, MapValue response) {
            MapValue status = getMap(response, STATUS);
            DeleteResult result = new DeleteResult()
                .setDeletedCount(readInt(status, DELETED_COUNT, 0))
                .setMoreData(readBoolean(status, MORE_DATA));
            return withStatus(result, response);
        }
    }

    /**
     * CountDocuments request:
     *    filter
     *
     * CountDocuments result (status):
     *    count, moreData?
     */
    public static class CountDocumentsRequestSerializer
        implements Serializer {

        @Override
        public MapValue serialize(Request request) {
            CountDocumentsRequest rq = (CountDocumentsRequest) request;
            MapValue payload = new MapValue(1);
            writeFilter(payload, rq.getFilter());
            return command(rq, payload);
        }

        @Override
        public Result deserialize(Request request, MapValue response) {
            MapValue status = getMap(response, STATUS);
            CountDocumentsResult result = new CountDocumentsResult()
                .setCount(readInt(status, COUNT, 0))
                .setMoreData(readBoolean(status, MORE_DATA));
            return withStatus(result, response);
        }
    }

    /*
     * Shared by the findOneAnd* commands. The status members present
     * depend on the command.
     */
    static Result deserializeFindOneAndModify(MapValue response) {
        MapValue status = getMap(response, STATUS);
        FindOneAndModifyResult result = new FindOneAndModifyResult()
            .setDocument(readDocument(response))
            .setMatchedCount(readInt(status, MATCHED_COUNT, 0))
            .setModifiedCount(readInt(status, MODIFIED_COUNT, 0))
            .setDeletedCount(readInt(status, DELETED_COUNT, 0))
            .setUpsertedId(readId(status, UPSERTED_ID));
        return withStatus(result, response);
    }

    /**
     * FindOneAndUpdate request:
     *    filter, update, projection, sort
     *    options: upsert, returnDocument
     *
     * FindOneAndUpdate result:
     *    data: document
     *    status: matchedCount, modifiedCount, upsertedId?
     */
    public static class FindOneAndUpdateRequestSerializer
        implements Serializer {

        @Override
        public MapValue serialize(Request request) {
            FindOneAndUpdateRequest rq = (FindOneAndUpdateRequest) request;
            MapValue payload = new MapValue();
            writeFilter(payload, rq.getFilter());
            payload.put(UPDATE, rq.getUpdate());
            writeProjection(payload, rq.getProjection());
            writeSort(payload, rq.getSort());
            MapValue options = new MapValue(2);
            options.put(RETURN_DOCUMENT, rq.getReturnDocument().getValue());
            options.put(UPSERT, rq.getUpsert());
            writeOptions(payload, options);
            return command(rq, payload);
        }

        @Override
        public Result deserialize(Request request, MapValue response) {
            return deserializeFindOneAndModify(response);
        }
    }

    /**
     * FindOneAndReplace request:
     *    filter, replacement, projection, sort
     *    options: upsert, returnDocument
     *
     * FindOneAndReplace result:
     *    data: document
     *    status: matchedCount, modifiedCount, upsertedId?
     */
    public static class FindOneAndReplaceRequestSerializer
        implements Serializer {

        @Override
        public MapValue serialize(Request request) {
            FindOneAndReplaceRequest rq = (FindOneAndReplaceRequest) request;
            MapValue payload = new MapValue();
            writeFilter(payload, rq.getFilter());
            payload.put(REPLACEMENT, rq.getReplacement());
            writeProjection(payload, rq.getProjection());
            writeSort(payload, rq.getSort());
            MapValue options = new MapValue(2);
            options.put(RETURN_DOCUMENT, rq.getReturnDocument().getValue());
            options.put(UPSERT, rq.getUpsert());
            writeOptions(payload, options);
            return command(rq, payload);
        }

        @Override
        public Result deserialize(Request request, MapValue response) {
            return deserializeFindOneAndModify(response);
        }
    }

    /**
     * FindOneAndDelete request:
     *    filter, projection, sort
     *
     * FindOneAndDelete result:
     *    data: document
     *    status: deletedCount
     */
    public static class FindOneAndDeleteRequestSerializer
        implements Serializer {

        @Override
        public MapValue serialize(Request request) {
            FindOneAndDeleteRequest rq = (FindOneAndDeleteRequest) request;
            MapValue payload = new MapValue();
            writeFilter(payload, rq.getFilter());
            writeProjection(payload, rq.getProjection());
            writeSort(payload, rq.getSort());
            return command(rq, payload);
        }

        @Override
        public Result deserialize(Request request, MapValue response) {
            return deserializeFindOneAndModify(response);
        }
    }
}
