/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops.serde;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import io.dataapi.driver.ops.CountDocumentsRequest;
import io.dataapi.driver.ops.CountDocumentsResult;
import io.dataapi.driver.ops.DeleteRequest;
import io.dataapi.driver.ops.FindOneAndModifyResult;
import io.dataapi.driver.ops.FindOneAndUpdateRequest;
import io.dataapi.driver.ops.FindRequest;
import io.dataapi.driver.ops.FindResult;
import io.dataapi.driver.ops.InsertManyRequest;
import io.dataapi.driver.ops.InsertManyResult;
import io.dataapi.driver.ops.Projection;
import io.dataapi.driver.ops.Request;
import io.dataapi.driver.ops.ReturnDocument;
import io.dataapi.driver.ops.SortSpec;
import io.dataapi.driver.ops.UpdateRequest;
import io.dataapi.driver.ops.UpdateResult;
import io.dataapi.driver.values.FieldValue;
import io.dataapi.driver.values.JsonUtils;
import io.dataapi.driver.values.MapValue;

/**
 * Wire shapes of the commands and parsing of their responses.
 */
public class JsonSerializerFactoryTest {

    private final SerializerFactory factory = new JsonSerializerFactory();

    @Test
    public void testFindCommand() {
        FindRequest rq = new FindRequest()
            .setFilter(doc("{\"a\": 1}"))
            .setProjection(Projection.include("x", "y"))
            .setSort(SortSpec.descending("n"))
            .setSkip(2)
            .setLimit(5)
            .setPageState("ignored");
        checkCommand("{\"find\": {\"filter\": {\"a\": 1}," +
                     " \"projection\": {\"x\": 1, \"y\": 1}," +
                     " \"sort\": {\"n\": -1}," +
                     " \"options\": {\"skip\": 2, \"limit\": 5}}}", rq);

        /* no filter, no options */
        checkCommand("{\"find\": {\"filter\": {}}}", new FindRequest());

        checkCommand("{\"find\": {\"filter\": {}," +
                     " \"options\": {\"pageState\": \"p2\"}}}",
                     new FindRequest().setPageState("p2"));
    }

    @Test
    public void testWriteCommands() {
        InsertManyRequest insert = new InsertManyRequest()
            .setDocuments(Arrays.asList(doc("{\"_id\": 1}"),
                                        doc("{\"_id\": 2}")))
            .setOrdered(false);
        checkCommand("{\"insertMany\": {\"documents\": " +
                     "[{\"_id\": 1}, {\"_id\": 2}]," +
                     " \"options\": {\"ordered\": false}}}", insert);

        UpdateRequest updateOne = new UpdateRequest(false)
            .setFilter(doc("{\"a\": 1}"))
            .setUpdate(doc("{\"$set\": {\"b\": 2}}"))
            .setSort(SortSpec.ascending("c"))
            .setUpsert(true);
        checkCommand("{\"updateOne\": {\"filter\": {\"a\": 1}," +
                     " \"update\": {\"$set\": {\"b\": 2}}," +
                     " \"sort\": {\"c\": 1}," +
                     " \"options\": {\"upsert\": true}}}", updateOne);

        UpdateRequest updateMany = new UpdateRequest(true)
            .setFilter(doc("{\"a\": 1}"))
            .setUpdate(doc("{\"$inc\": {\"b\": 1}}"))
            .setPageState("next");
        checkCommand("{\"updateMany\": {\"filter\": {\"a\": 1}," +
                     " \"update\": {\"$inc\": {\"b\": 1}}," +
                     " \"options\": {\"pageState\": \"next\"}}}",
                     updateMany);

        checkCommand("{\"deleteMany\": {\"filter\": {\"a\": {\"$gt\": 3}}}}",
                     new DeleteRequest(true)
                     .setFilter(doc("{\"a\": {\"$gt\": 3}}")));
        checkCommand("{\"deleteOne\": {\"filter\": {}, \"sort\": {\"a\": 1}}}",
                     new DeleteRequest(false)
                     .setSort(SortSpec.ascending("a")));
        checkCommand("{\"countDocuments\": {\"filter\": {}}}",
                     new CountDocumentsRequest());

        FindOneAndUpdateRequest fou = new FindOneAndUpdateRequest()
            .setFilter(doc("{\"a\": 1}"))
            .setUpdate(doc("{\"$set\": {\"b\": 1}}"))
            .setProjection(Projection.exclude("big"))
            .setReturnDocument(ReturnDocument.AFTER)
            .setUpsert(true);
        checkCommand("{\"findOneAndUpdate\": {\"filter\": {\"a\": 1}," +
                     " \"update\": {\"$set\": {\"b\": 1}}," +
                     " \"projection\": {\"big\": 0}," +
                     " \"options\": {\"returnDocument\": \"after\"," +
                     " \"upsert\": true}}}", fou);
    }

    @Test
    public void testFindResult() {
        FindRequest rq = new FindRequest();
        FindResult result = (FindResult) rq.createSerializer(factory)
            .deserialize(rq, doc("{\"data\": {\"documents\": " +
                                 "[{\"_id\": 1}, {\"_id\": 2}]," +
                                 " \"nextPageState\": \"p2\"}}"));
        assertEquals(2, result.getDocuments().size());
        assertEquals("p2", result.getNextPageState());

        result = (FindResult) rq.createSerializer(factory)
            .deserialize(rq, doc("{\"data\": {\"documents\": []," +
                                 " \"nextPageState\": null}}"));
        assertTrue(result.getDocuments().isEmpty());
        assertNull(result.getNextPageState());
    }

    @Test
    public void testStatusResults() {
        UpdateRequest update = new UpdateRequest(true);
        UpdateResult ur = (UpdateResult) update.createSerializer(factory)
            .deserialize(update, doc("{\"status\": {\"matchedCount\": 20," +
                                     " \"modifiedCount\": 18," +
                                     " \"moreData\": true," +
                                     " \"nextPageState\": \"n\"}}"));
        assertEquals(20, ur.getMatchedCount());
        assertEquals(18, ur.getModifiedCount());
        assertTrue(ur.getMoreData());
        assertEquals("n", ur.getNextPageState());
        assertNull(ur.getUpsertedId());

        CountDocumentsRequest count = new CountDocumentsRequest();
        CountDocumentsResult cr = (CountDocumentsResult)
            count.createSerializer(factory)
            .deserialize(count, doc("{\"status\": {\"count\": 1000," +
                                    " \"moreData\": true}}"));
        assertEquals(1000, cr.getCount());
        assertTrue(cr.getMoreData());

        InsertManyRequest insert = new InsertManyRequest();
        InsertManyResult ir = (InsertManyResult)
            insert.createSerializer(factory)
            .deserialize(insert, doc("{\"status\": {\"insertedIds\": " +
                                     "[\"a\", 2]}}"));
        assertEquals(2, ir.getInsertedIds().size());
        assertEquals("a", ir.getInsertedIds().get(0).getString());

        FindOneAndUpdateRequest fou = new FindOneAndUpdateRequest();
        FindOneAndModifyResult mr = (FindOneAndModifyResult)
            fou.createSerializer(factory)
            .deserialize(fou, doc("{\"data\": {\"document\": null}," +
                                  " \"status\": {\"matchedCount\": 0," +
                                  " \"modifiedCount\": 0," +
                                  " \"upsertedId\": \"new\"}}"));
        assertNull(mr.getDocument());
        assertEquals("new", mr.getUpsertedId().getString());
        assertFalse(mr.getUpsertedId().isJsonNull());
    }

    @Test
    public void testInsertedIds() {
        assertTrue(JsonSerializerFactory.readInsertedIds(doc("{}")).isEmpty());
        assertEquals(Arrays.asList(FieldValue.createFromJson("1")),
                     JsonSerializerFactory.readInsertedIds(
                         doc("{\"status\": {\"insertedIds\": [1]}," +
                             " \"errors\": [{\"message\": \"dup\"}]}")));
    }

    private void checkCommand(String expected, Request request) {
        MapValue command = request.createSerializer(factory)
            .serialize(request);
        assertTrue("expected " + expected + ", got " + command.toJson(),
                   JsonUtils.jsonEquals(expected, command.toJson()));
    }

    private static MapValue doc(String json) {
        return FieldValue.createFromJson(json).asMap();
    }
}
