/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

import java.math.BigDecimal;

import com.fasterxml.jackson.core.io.CharTypes;

/**
 * An instance of FieldValueEventHandler that accepts events and constructs
 * a compact JSON string representation. Timestamps are written in the
 * extended form <code>{"$date": millis}</code>.
 *
 * @hidden
 */
public class JsonSerializer implements FieldValueEventHandler {

    protected final StringBuilder sb;

    protected static final String START_OBJECT = "{";
    protected static final String END_OBJECT = "}";
    protected static final String START_ARRAY = "[";
    protected static final String END_ARRAY = "]";
    protected static final String FIELD_SEP = ",";
    protected static final String QUOTE = "\"";
    protected static final String KEY_SEP = ":";

    public JsonSerializer() {
        sb = new StringBuilder();
    }

    @Override
    public void startMap(int size) {
        sb.append(START_OBJECT);
    }

    @Override
    public void startArray(int size) {
        sb.append(START_ARRAY);
    }

    @Override
    public void endMap(int size) {
        trimSeparator();
        sb.append(END_OBJECT);
    }

    @Override
    public void endArray(int size) {
        trimSeparator();
        sb.append(END_ARRAY);
    }

    private void trimSeparator() {
        int len = sb.length() - 1;
        if (len > 0 && sb.charAt(len) == ',') {
            sb.setLength(len);
        }
    }

    @Override
    public boolean startMapField(String key) {
        sb.append(QUOTE);
        CharTypes.appendQuoted(sb, key);
        sb.append(QUOTE).append(KEY_SEP);
        return false;
    }

    @Override
    public void endMapField(String key) {
        sb.append(FIELD_SEP);
    }

    @Override
    public void endArrayField(int index) {
        sb.append(FIELD_SEP);
    }

    @Override
    public void booleanValue(boolean value) {
        sb.append(Boolean.toString(value));
    }

    @Override
    public void stringValue(String value) {
        sb.append(QUOTE);
        CharTypes.appendQuoted(sb, value);
        sb.append(QUOTE);
    }

    @Override
    public void integerValue(int value) {
        sb.append(Integer.toString(value));
    }

    @Override
    public void longValue(long value) {
        sb.append(Long.toString(value));
    }

    /*
     * NaN and the infinities have no JSON literal and are sent as strings.
     */
    @Override
    public void doubleValue(double value) {
        if (Double.isFinite(value)) {
            sb.append(Double.toString(value));
        } else {
            stringValue(Double.toString(value));
        }
    }

    @Override
    public void numberValue(BigDecimal value) {
        sb.append(value.toString());
    }

    @Override
    public void timestampValue(TimestampValue timestamp) {
        sb.append(timestamp.toJson());
    }

    @Override
    public void jsonNullValue() {
        sb.append("null");
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
