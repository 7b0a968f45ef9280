/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

import java.math.BigDecimal;
import java.sql.Timestamp;

/**
 * A {@link FieldValue} instance representing a long value.
 */
public class LongValue extends FieldValue {

    private final long value;

    /**
     * Creates a new instance.
     *
     * @param value the value to use
     */
    public LongValue(long value) {
        super();
        this.value = value;
    }

    /**
     * Creates a new instance from a String value
     *
     * @param value the value to use
     *
     * @throws NumberFormatException if the value is not a valid long
     */
    public LongValue(String value) {
        super();
        this.value = Long.parseLong(value);
    }

    @Override
    public Type getType() {
        return Type.LONG;
    }

    public long getValue() {
        return value;
    }

    @Override
    public double castAsDouble() {
        return value;
    }

    @Override
    public int compareTo(FieldValue other) {
        if (other instanceof LongValue) {
            return Long.compare(value, ((LongValue) other).value);
        }
        return NumberValue.compareNumeric(this, other);
    }

    @Override
    public double getDouble() {
        return value;
    }

    @Override
    public BigDecimal getNumber() {
        return new BigDecimal(value);
    }

    /**
     * @throws ArithmeticException if the value overflows an int
     */
    @Override
    public int getInt() {
        return Math.toIntExact(value);
    }

    @Override
    public String getString() {
        return toJson();
    }

    /**
     * Interprets the value as milliseconds since the epoch.
     */
    @Override
    public Timestamp getTimestamp() {
        return new Timestamp(value);
    }

    @Override
    public String toJson() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof LongValue) {
            return value == ((LongValue)other).value;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return ((Long) value).hashCode();
    }
}
