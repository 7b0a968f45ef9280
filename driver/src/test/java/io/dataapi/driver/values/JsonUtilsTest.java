/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.math.BigDecimal;

import org.junit.Test;

import io.dataapi.driver.JsonParseException;

/**
 * JSON parsing of documents and the canonical form used to compare them.
 */
public class JsonUtilsTest {

    @Test
    public void testNumberTypes() {
        MapValue doc = FieldValue.createFromJson(
            "{\"i\": 5, \"l\": 5000000000, \"d\": 1.5," +
            " \"n\": 123456789012345678901234567890}").asMap();
        assertEquals(FieldValue.Type.INTEGER, doc.getType("i"));
        assertEquals(FieldValue.Type.LONG, doc.getType("l"));
        assertEquals(FieldValue.Type.DOUBLE, doc.getType("d"));
        assertEquals(FieldValue.Type.NUMBER, doc.getType("n"));
        assertEquals(new BigDecimal("123456789012345678901234567890"),
                     doc.getNumber("n"));
    }

    @Test
    public void testTimestamp() {
        FieldValue value =
            FieldValue.createFromJson("{\"when\": {\"$date\": 86400000}}")
            .asMap().get("when");
        assertTrue(value.isTimestamp());
        assertEquals(86400000L, value.getLong());
        assertEquals("1970-01-02T00:00:00Z", value.getString());
        assertEquals("{\"$date\":86400000}", value.toJson());
        assertEquals(value, new TimestampValue("1970-01-02T00:00:00Z"));

        /* other shapes stay maps */
        assertTrue(FieldValue.createFromJson(
                       "{\"$date\": \"soon\"}").isMap());
        assertTrue(FieldValue.createFromJson(
                       "{\"$date\": 1, \"x\": 2}").isMap());
    }

    @Test
    public void testCanonicalJson() {
        assertEquals("1", canonical("1"));
        assertEquals("1", canonical("1.0"));
        assertEquals("1.5", canonical("1.50"));
        assertEquals("0", canonical("-0.0"));
        assertEquals("100000000000000000000", canonical("1e20"));
        assertEquals("\"a\"", canonical("\"a\""));
        assertEquals("{\"a\":[2,{\"c\":null,\"d\":true}],\"b\":1}",
                     canonical("{\"b\": 1, " +
                               "\"a\": [2.0, {\"d\": true, \"c\": null}]}"));
        assertEquals("{}", canonical("{}"));
        assertEquals("[1,[]]", canonical("[1, []]"));
    }

    @Test
    public void testCanonicalEquality() {
        assertEquals(canonical("{\"x\": 1, \"y\": [1, 2]}"),
                     canonical("{\"y\": [1.0, 2], \"x\": 1.00}"));
        /* array order matters */
        assertNotEquals(canonical("[1, 2]"), canonical("[2, 1]"));
        assertNotEquals(canonical("1"), canonical("\"1\""));
        assertNotEquals(canonical("true"), canonical("1"));
    }

    @Test
    public void testJsonEquals() {
        assertTrue(JsonUtils.jsonEquals("{\"a\": 1, \"b\": \"x\"}",
                                        "{\"b\": \"x\", \"a\": 1}"));
        assertFalse(JsonUtils.jsonEquals("{\"a\": 1}", "{\"a\": 2}"));
    }

    @Test
    public void testBadJson() {
        for (String bad : new String[] {"", "{\"a\": 1", "{\"a\" 1}",
                                        "[1, 2"}) {
            try {
                FieldValue.createFromJson(bad);
                fail("Parse should fail: " + bad);
            } catch (JsonParseException jpe) {
                /* success */
            }
        }
    }

    @Test
    public void testToJson() {
        MapValue doc = new MapValue()
            .put("s", "quote\"d")
            .put("i", 3)
            .put("b", false);
        doc.put("arr", new ArrayValue().add(1).add("two"));
        doc.put("nil", JsonNullValue.getInstance());
        String json = doc.toJson();
        assertEquals("{\"s\":\"quote\\\"d\",\"i\":3,\"b\":false," +
                     "\"arr\":[1,\"two\"],\"nil\":null}", json);
        assertEquals(doc, FieldValue.createFromJson(json));
    }

    private static String canonical(String json) {
        return JsonUtils.toCanonicalJson(FieldValue.createFromJson(json));
    }
}
