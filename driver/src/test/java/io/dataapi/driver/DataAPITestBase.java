/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.rules.TestRule;
import org.junit.rules.TestWatcher;
import org.junit.runner.Description;

import io.dataapi.driver.ops.Cursor;
import io.dataapi.driver.values.FieldValue;
import io.dataapi.driver.values.JsonUtils;
import io.dataapi.driver.values.MapValue;

/**
 * A common base for tests that run against a {@link FakeDataAPIServer}.
 * The server is started once per test class; each test gets a fresh
 * handle and empty collections.
 */
public class DataAPITestBase {

    protected static final String TOKEN = "test-token";
    protected static final String COLLECTION = "drivertest";
    protected static String TRACE = "test.trace";

    protected static FakeDataAPIServer server;
    protected static boolean trace;

    protected DataAPIHandle handle;
    protected Collection collection;

    @Rule
    public final TestRule watchman = new TestWatcher() {

        @Override
        protected void starting(Description description) {
            if (trace) {
                System.out.println(java.time.Instant.now() +
                                   " Starting test: " +
                                   description.getMethodName());
            }
        }
    };

    @BeforeClass
    public static void staticSetUp() throws Exception {
        trace = Boolean.getBoolean(TRACE);
        server = new FakeDataAPIServer(TOKEN);
        server.start();
    }

    @AfterClass
    public static void staticTearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Before
    public void setUp() {
        server.reset();
        handle = DataAPIHandleFactory.createDataAPIHandle(createConfig());
        collection = handle.getCollection(COLLECTION);
    }

    @After
    public void tearDown() {
        if (handle != null) {
            handle.close();
        }
    }

    /* a config for the fake server */
    protected static DataAPIHandleConfig createConfig() {
        return new DataAPIHandleConfig(server.getEndpoint(), TOKEN)
            .setRequestTimeout(5000);
    }

    protected static MapValue doc(String json) {
        return FieldValue.createFromJson(json).asMap();
    }

    protected static List<MapValue> storedDocuments() {
        return server.getDocuments(DataAPIHandleConfig.DEFAULT_NAMESPACE,
                                   COLLECTION);
    }

    protected static List<MapValue> docs(String... json) {
        List<MapValue> list = new ArrayList<MapValue>(json.length);
        for (String s : json) {
            list.add(doc(s));
        }
        return list;
    }

    protected static List<MapValue> toList(Cursor cursor) {
        List<MapValue> list = new ArrayList<MapValue>();
        while (cursor.hasNext()) {
            list.add(cursor.next());
        }
        return list;
    }

    /* canonical JSON of each value, for order independent comparison */
    protected static Set<String> jsonSet(List<? extends FieldValue> values) {
        Set<String> set = new HashSet<String>();
        for (FieldValue value : values) {
            set.add(JsonUtils.toCanonicalJson(value));
        }
        return set;
    }

    protected static Set<String> jsonSet(String... json) {
        Set<String> set = new HashSet<String>();
        for (String s : json) {
            set.add(JsonUtils.toCanonicalJson(FieldValue.createFromJson(s)));
        }
        return set;
    }

    protected static Set<String> storedIds() {
        Set<String> ids = new HashSet<String>();
        for (MapValue doc : storedDocuments()) {
            ids.add(doc.getString("_id"));
        }
        return ids;
    }
}
