/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

/**
 * The classes in this package represent the JSON documents exchanged with
 * the Data API. All data classes in this package are instances of
 * {@link io.dataapi.driver.values.FieldValue}. A document is a
 * {@link io.dataapi.driver.values.MapValue}, which is an insertion-ordered
 * map of {@link io.dataapi.driver.values.FieldValue} instances keyed by
 * field name.
 * <table>
 *   <caption>The mappings between JSON and value classes</caption>
 *   <tr><th>JSON</th><th>Class</th></tr>
 *   <tr><td>object</td><td>{@link io.dataapi.driver.values.MapValue}</td></tr>
 *   <tr><td>array</td><td>{@link io.dataapi.driver.values.ArrayValue}</td></tr>
 *   <tr><td>string</td><td>{@link io.dataapi.driver.values.StringValue}</td></tr>
 *   <tr><td>number</td><td>{@link io.dataapi.driver.values.IntegerValue},
 *       {@link io.dataapi.driver.values.LongValue},
 *       {@link io.dataapi.driver.values.DoubleValue},
 *       {@link io.dataapi.driver.values.NumberValue}</td></tr>
 *   <tr><td>true, false</td>
 *       <td>{@link io.dataapi.driver.values.BooleanValue}</td></tr>
 *   <tr><td>null</td>
 *       <td>{@link io.dataapi.driver.values.JsonNullValue}</td></tr>
 *   <tr><td>{"$date": millis}</td>
 *       <td>{@link io.dataapi.driver.values.TimestampValue}</td></tr>
 * </table>
 * <p>
 * {@link io.dataapi.driver.values.DocumentPath} extracts values from a
 * document by dotted path, and
 * {@link io.dataapi.driver.values.JsonUtils#toCanonicalJson} produces a text
 * that is equal for structurally equal values.
 */
package io.dataapi.driver.values;
