/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

import java.math.BigDecimal;
import java.sql.Timestamp;

import io.dataapi.driver.JsonParseException;

/**
 * FieldValue is the base class of all data items in a document. Each
 * instance has a type and a value and maps to a JSON value exchanged with
 * the Data API.
 * <p>
 * FieldValue instances are typed, based on the {@link Type} enumeration. The
 * type mappings between JSON and Java are:
 * <ul>
 * <li>Object {@literal ->} {@link MapValue}</li>
 * <li>Array {@literal ->} {@link ArrayValue}</li>
 * <li>String {@literal ->} {@link StringValue}</li>
 * <li>Number {@literal ->} {@link IntegerValue}, {@link LongValue},
 * {@link DoubleValue} or {@link NumberValue}, whichever holds the value
 * without loss</li>
 * <li>true/false {@literal ->} {@link BooleanValue}</li>
 * <li>null {@literal ->} {@link JsonNullValue}</li>
 * <li><code>{"$date": millis}</code> {@literal ->} {@link TimestampValue}</li>
 * </ul>
 * <p>
 * Accessor methods such as {@link #getInt} throw ClassCastException if the
 * value cannot be represented as the requested type.
 */
public abstract class FieldValue implements Comparable<FieldValue> {

    /**
     * The type of a field.
     */
    public enum Type {
        /** An array of FieldValue instances */
        ARRAY,
        /** A boolean value */
        BOOLEAN,
        /** A double value */
        DOUBLE,
        /** An integer value */
        INTEGER,
        /** A long value */
        LONG,
        /** A map of FieldValue instances */
        MAP,
        /** A string value */
        STRING,
        /** A timestamp */
        TIMESTAMP,
        /** A number value */
        NUMBER,
        /** A JSON null value */
        JSON_NULL;
    }

    public FieldValue() {
    }

    /**
     * Returns the type of the object
     *
     * @return the type
     */
    public abstract Type getType();

    /**
     * Returns an integer value for the field if the value can be represented
     * as a valid integer without loss of information.
     *
     * @return an integer value
     *
     * @throws ClassCastException if this is not an integer value
     */
    public int getInt() {
        return asInteger().getValue();
    }

    /**
     * Returns a long value for the field if the value can be represented
     * as a valid long without loss of information.
     *
     * @return a long value
     *
     * @throws ClassCastException if this is not a long value
     */
    public long getLong() {
        return asLong().getValue();
    }

    /**
     * Returns a double value for the field if the value can be represented
     * as a valid double without loss of information.
     *
     * @return a double value
     *
     * @throws ClassCastException if this is not a double value
     */
    public double getDouble() {
        return asDouble().getValue();
    }

    /**
     * Returns a BigDecimal value for the field.
     *
     * @return a BigDecimal value
     *
     * @throws ClassCastException if this is not a numeric value
     */
    public BigDecimal getNumber() {
        return asNumber().getValue();
    }

    /**
     * Casts a numeric value to double, possibly with loss of information.
     *
     * @return a double value
     *
     * @throws ClassCastException if this is not a numeric value
     */
    public double castAsDouble() {
        throw new ClassCastException(
            "Value can not be cast to a double: " + getClass());
    }

    /**
     * Returns a boolean value for the field.
     *
     * @return a boolean value
     *
     * @throws ClassCastException if this is not a BooleanValue
     */
    public boolean getBoolean() {
        return asBoolean().getValue();
    }

    /**
     * Returns a String value for the field. Atomic values other than
     * strings return their JSON text.
     *
     * @return a String value
     *
     * @throws ClassCastException if this is a map or array
     */
    public String getString() {
        return asString().getValue();
    }

    /**
     * Returns a Timestamp value for the field.
     *
     * @return a Timestamp value
     *
     * @throws ClassCastException if this is not a TimestampValue
     */
    public Timestamp getTimestamp() {
        return asTimestamp().getValue();
    }

    public IntegerValue asInteger() {
        return (IntegerValue) this;
    }

    public StringValue asString() {
        return (StringValue) this;
    }

    public LongValue asLong() {
        return (LongValue) this;
    }

    public NumberValue asNumber() {
        return (NumberValue) this;
    }

    public TimestampValue asTimestamp() {
        return (TimestampValue) this;
    }

    public BooleanValue asBoolean() {
        return (BooleanValue) this;
    }

    public ArrayValue asArray() {
        return (ArrayValue) this;
    }

    public MapValue asMap() {
        return (MapValue) this;
    }

    public DoubleValue asDouble() {
        return (DoubleValue) this;
    }

    public JsonNullValue asJsonNull() {
        return (JsonNullValue) this;
    }

    public boolean isInteger() {
        return getType() == Type.INTEGER;
    }

    public boolean isLong() {
        return getType() == Type.LONG;
    }

    public boolean isDouble() {
        return getType() == Type.DOUBLE;
    }

    public boolean isNumber() {
        return getType() == Type.NUMBER;
    }

    public boolean isBoolean() {
        return getType() == Type.BOOLEAN;
    }

    public boolean isArray() {
        return getType() == Type.ARRAY;
    }

    public boolean isMap() {
        return getType() == Type.MAP;
    }

    public boolean isString() {
        return getType() == Type.STRING;
    }

    public boolean isTimestamp() {
        return getType() == Type.TIMESTAMP;
    }

    public boolean isJsonNull() {
        return getType() == Type.JSON_NULL;
    }

    /**
     * Returns true if the type of this value is numeric.
     *
     * @return true if numeric
     */
    public boolean isNumeric() {
        switch (getType()) {
        case INTEGER:
        case LONG:
        case DOUBLE:
        case NUMBER:
            return true;
        default:
            return false;
        }
    }

    /**
     * Returns true if this is neither a map nor an array.
     *
     * @return true if atomic
     */
    public boolean isAtomic() {
        return !isMap() && !isArray();
    }

    /**
     * Returns a JSON representation of the value.
     *
     * @return the JSON text
     */
    public String toJson() {
        JsonSerializer js = new JsonSerializer();
        FieldValueEventHandler.generate(this, js);
        return js.toString();
    }

    @Override
    public String toString() {
        return toJson();
    }

    /**
     * Constructs a new FieldValue instance based on the JSON string provided.
     *
     * @param jsonInput a JSON formatted String
     *
     * @return a new FieldValue instance representing the JSON string
     *
     * @throws JsonParseException if the string is not valid JSON
     */
    public static FieldValue createFromJson(String jsonInput) {
        return JsonUtils.createValueFromJson(jsonInput);
    }

    /*
     * Internal utility methods
     */
    static void validateName(String name, FieldValue value) {
        if (name == null) {
            throw new IllegalArgumentException("Field name is null");
        }
        if (value == null) {
            throw new IllegalArgumentException("FieldValue is null");
        }
    }
}
