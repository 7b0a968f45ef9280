/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

import static io.dataapi.driver.util.CheckNull.requireNonNull;

import com.fasterxml.jackson.core.io.CharTypes;

/**
 * A {@link FieldValue} instance representing a string value.
 */
public class StringValue extends FieldValue {

    private final String value;

    /**
     * Creates a new instance.
     *
     * @param value the value to use
     */
    public StringValue(String value) {
        super();
        requireNonNull(value, "StringValue: value must be non-null");
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.STRING;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String getString() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof StringValue) {
            return value.equals(((StringValue)other).value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public int compareTo(FieldValue other) {
        if (other instanceof StringValue) {
            return value.compareTo(other.asString().getValue());
        }
        throw new ClassCastException("Object is not a StringValue");
    }

    @Override
    public String toJson() {
        StringBuilder sb = new StringBuilder();
        sb.append("\"");
        CharTypes.appendQuoted(sb, value);
        sb.append("\"");
        return sb.toString();
    }
}
