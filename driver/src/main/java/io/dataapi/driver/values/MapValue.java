/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

import static io.dataapi.driver.util.CheckNull.requireNonNull;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * MapValue represents a JSON object, which is how documents are held. Field
 * order is the insertion order, so a document read from the service keeps
 * the order the service sent, and a filter or sort built by the application
 * is sent in the order it was built.
 * <p>
 * The put methods return this instance, so documents can be built fluently:
 * <pre>
 *    MapValue doc = new MapValue().put("_id", 1).put("name", "x");
 * </pre>
 * Equality is structural and ignores field order.
 */
public class MapValue extends FieldValue
    implements Iterable<Map.Entry<String, FieldValue>> {

    private final Map<String, FieldValue> values;

    /**
     * Creates an empty MapValue.
     */
    public MapValue() {
        super();
        values = new LinkedHashMap<String, FieldValue>();
    }

    /**
     * Creates an empty MapValue with a size hint.
     *
     * @param size the initial capacity
     */
    public MapValue(int size) {
        super();
        values = new LinkedHashMap<String, FieldValue>(size);
    }

    @Override
    public Type getType() {
        return Type.MAP;
    }

    /**
     * Returns a live Map of the MapValue state.
     *
     * @return the map
     */
    public Map<String, FieldValue> getMap() {
        return values;
    }

    public Set<Map.Entry<String, FieldValue>> entrySet() {
        return values.entrySet();
    }

    @Override
    public Iterator<Map.Entry<String, FieldValue>> iterator() {
        return entrySet().iterator();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Collection<FieldValue> values() {
        return values.values();
    }

    /**
     * Adds all of the entries of another map to this one.
     *
     * @param other the map to copy from
     *
     * @return this
     */
    public MapValue addAll(MapValue other) {
        requireNonNull(other, "MapValue.addAll: other must be non-null");
        values.putAll(other.values);
        return this;
    }

    public FieldValue.Type getType(String name) {
        requireNonNull(name, "MapValue.getType: name must be non-null");
        FieldValue val = values.get(name);
        return (val == null ? null : val.getType());
    }

    /**
     * Returns the field value with the specified name.
     *
     * @param name the name of the field
     *
     * @return the value, or null if the field is not present
     */
    public FieldValue get(String name) {
        requireNonNull(name, "MapValue.get: name must be non-null");
        return values.get(name);
    }

    public boolean contains(String name) {
        requireNonNull(name, "MapValue.contains: name must be non-null");
        return values.containsKey(name);
    }

    /**
     * Sets the named field, replacing any previous value.
     *
     * @param name the name of the field
     * @param value the value
     *
     * @return this
     */
    public MapValue put(String name, FieldValue value) {
        requireNonNull(name, "MapValue.put: name must be non-null");
        requireNonNull(value, "MapValue.put: value must be non-null");
        validateName(name, value);
        values.put(name, value);
        return this;
    }

    public MapValue put(String name, int value) {
        return put(name, new IntegerValue(value));
    }

    public MapValue put(String name, long value) {
        return put(name, new LongValue(value));
    }

    public MapValue put(String name, double value) {
        return put(name, new DoubleValue(value));
    }

    public MapValue put(String name, BigDecimal value) {
        return put(name, new NumberValue(value));
    }

    public MapValue put(String name, String value) {
        return put(name, new StringValue(value));
    }

    public MapValue put(String name, boolean value) {
        return put(name, BooleanValue.getInstance(value));
    }

    public MapValue put(String name, Timestamp value) {
        return put(name, new TimestampValue(value));
    }

    /**
     * Sets the named field to the value parsed from a JSON string.
     *
     * @param name the name of the field
     * @param jsonString the JSON text
     *
     * @return this
     */
    public MapValue putFromJson(String name, String jsonString) {
        return put(name, JsonUtils.createValueFromJson(jsonString));
    }

    public FieldValue remove(String name) {
        return values.remove(name);
    }

    public int getInt(String name) {
        return getExisting(name).getInt();
    }

    public long getLong(String name) {
        return getExisting(name).getLong();
    }

    public double getDouble(String name) {
        return getExisting(name).getDouble();
    }

    public BigDecimal getNumber(String name) {
        return getExisting(name).getNumber();
    }

    public String getString(String name) {
        return getExisting(name).getString();
    }

    public boolean getBoolean(String name) {
        return getExisting(name).getBoolean();
    }

    public Timestamp getTimestamp(String name) {
        return getExisting(name).getTimestamp();
    }

    private FieldValue getExisting(String name) {
        FieldValue val = values.get(name);
        if (val == null) {
            throw new IllegalArgumentException("Field does not exist: " + name);
        }
        return val;
    }

    /**
     * Returns a deep copy of this map.
     *
     * @return the copy
     */
    public MapValue copy() {
        return JsonUtils.createValueFromJson(toJson()).asMap();
    }

    @Override
    public int compareTo(FieldValue other) {

        MapValue otherImpl = other.asMap();

        for (Map.Entry<String, FieldValue> entry : values.entrySet()) {
            String key = entry.getKey();
            FieldValue otherVal = otherImpl.get(key);
            if (otherVal == null) {
                return 1;
            }

            try {
                int valCompare = entry.getValue().compareTo(otherVal);
                if (valCompare != 0) {
                    return valCompare;
                }
            } catch (ClassCastException cce) {
                throw new ClassCastException(cce.getMessage() +
                    ", the key of values: " + key);
            }
        }

        /*
         * Every key of this map is in the other and the values are equal;
         * the other can only be larger.
         */
        return (size() < otherImpl.size()) ? -1 : 0;
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof MapValue) {
            return values.equals(((MapValue)other).values);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }
}
