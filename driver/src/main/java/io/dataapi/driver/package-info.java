/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
/**
 * Contains the public API of the Data API SDK: handles, their
 * configuration, collections, and exception classes. Value classes used for
 * documents are in the
 * <a href="{@docRoot}/io/dataapi/driver/values/package-summary.html#package.description">
 * values package.
 * </a>
 * Request and result objects used for individual operations, and the
 * {@link io.dataapi.driver.ops.Cursor}, are in the
 * <a href="{@docRoot}/io/dataapi/driver/ops/package-summary.html#package.description">
 * ops package.
 * </a>
 * <p>
 * A typical application creates one handle and uses its collections:
 * <pre>
 *   DataAPIHandleConfig config =
 *       new DataAPIHandleConfig("https://db.example.com", token);
 *   try (DataAPIHandle handle =
 *            DataAPIHandleFactory.createDataAPIHandle(config)) {
 *       Collection coll = handle.getCollection("people");
 *       coll.insertOne(new MapValue().put("name", "Ada"));
 *       for (MapValue doc : coll.find(null)) {
 *           ...
 *       }
 *   }
 * </pre>
 */
package io.dataapi.driver;
