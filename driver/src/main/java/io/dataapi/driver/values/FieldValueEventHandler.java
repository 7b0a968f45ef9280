/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

import java.math.BigDecimal;
import java.util.Map;

/**
 * {@link FieldValueEventHandler} is an event-driven interface that allows
 * multiple implementations of serializers and deserializers for a
 * {@link FieldValue}. The events correspond to the data model exposed by
 * {@link FieldValue}.
 * <p>
 * Example usage
 * <pre>
 *   MapValue map = new MapValue().put("name", "joe");
 *   JsonSerializer js = new JsonSerializer();
 *   FieldValueEventHandler.generate(map, js);
 *   String json = js.toString();
 * </pre>
 * Map values have <em>startMap</em> and <em>endMap</em> events that surround
 * them. Map entries are surrounded by <em>startMapField</em> and
 * <em>endMapField</em>:
 * <pre>
 *   startMap(1)
 *   startMapField(key)
 *   stringValue("a string")
 *   endMapField(key)
 *   endMap(1)
 * </pre>
 * Array values have <em>startArray</em> and <em>endArray</em> events, and
 * each element is surrounded by <em>startArrayField</em> and
 * <em>endArrayField</em>.
 * @hidden
 */
public interface FieldValueEventHandler {

    /**
     * Start a MapValue.
     *
     * @param size the number of entries in the map or -1 if not known.
     */
    default void startMap(int size) {}

    /**
     * Start an ArrayValue.
     *
     * @param size the number of entries in the array or -1 if not known.
     */
    default void startArray(int size) {}

    default void endMap(int size) {}

    default void endArray(int size) {}

    /**
     * Start a field in a map.
     *
     * @param key the key of the field.
     * @return true if the field should be skipped
     */
    default boolean startMapField(String key) {
        return false;
    }

    default void endMapField(String key) {}

    default void startArrayField(int index) {}

    default void endArrayField(int index) {}

    default void booleanValue(boolean value) {}

    default void stringValue(String value) {}

    default void integerValue(int value) {}

    default void longValue(long value) {}

    default void doubleValue(double value) {}

    default void numberValue(BigDecimal value) {}

    default void timestampValue(TimestampValue timestamp) {}

    default void jsonNullValue() {}

    /**
     * Returns true if the generator should stop creating events.
     *
     * @return true to stop
     */
    default boolean stop() {
        return false;
    }

    /**
     * Generates events from a {@link FieldValue} instance sending them to
     * the {@link FieldValueEventHandler} provided.
     *
     * @param value the FieldValue used to generate events
     * @param handler the handler to use
     */
    public static void generate(FieldValue value,
                                FieldValueEventHandler handler) {

        FieldValue.Type type = value.getType();
        switch (type) {
            case ARRAY:
                generateForArray(value.asArray(), handler);
                break;
            case BOOLEAN:
                handler.booleanValue(value.getBoolean());
                break;
            case DOUBLE:
                handler.doubleValue(value.getDouble());
                break;
            case INTEGER:
                handler.integerValue(value.getInt());
                break;
            case LONG:
                handler.longValue(value.getLong());
                break;
            case MAP:
                generateForMap(value.asMap(), handler);
                break;
            case STRING:
                handler.stringValue(value.asString().getValue());
                break;
            case TIMESTAMP:
                handler.timestampValue(value.asTimestamp());
                break;
            case NUMBER:
                handler.numberValue(value.asNumber().getValue());
                break;
            case JSON_NULL:
                handler.jsonNullValue();
                break;
            default:
                throw new IllegalStateException(
                    "FieldValueEventHandler, unknown type " + type);
        }
    }

    /**
     * Generates events for {@link MapValue} sending them to the specified
     * {@link FieldValueEventHandler}.
     *
     * @param map the MapValue to use
     * @param handler the handler to use
     */
    public static void generateForMap(MapValue map,
                                      FieldValueEventHandler handler) {
        handler.startMap(map.size());
        for (Map.Entry<String, FieldValue> entry : map.entrySet()) {
            boolean skip = handler.startMapField(entry.getKey());
            if (handler.stop()) {
                return;
            }
            if (!skip) {
                generate(entry.getValue(), handler);
                if (handler.stop()) {
                    return;
                }
            }
            /* make start/end calls symmetrical */
            handler.endMapField(entry.getKey());
            if (handler.stop()) {
                return;
            }
        }
        handler.endMap(map.size());
    }

    /**
     * Generates events for {@link ArrayValue} sending them to the specified
     * {@link FieldValueEventHandler}.
     *
     * @param array the ArrayValue to use
     * @param handler the handler to use
     */
    public static void generateForArray(ArrayValue array,
                                        FieldValueEventHandler handler) {
        handler.startArray(array.size());
        int index = 0;
        for (FieldValue value : array) {
            handler.startArrayField(index);
            generate(value, handler);
            if (handler.stop()) {
                return;
            }
            handler.endArrayField(index++);
            if (handler.stop()) {
                return;
            }
        }
        handler.endArray(array.size());
    }
}
