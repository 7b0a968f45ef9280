/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

import java.math.BigDecimal;

/**
 * A {@link FieldValue} instance representing an integer value.
 */
public class IntegerValue extends FieldValue {

    private final int value;

    /**
     * Creates a new instance.
     *
     * @param value the value to use
     */
    public IntegerValue(int value) {
        super();
        this.value = value;
    }

    /**
     * Creates a new instance from a String value
     *
     * @param value the value to use
     *
     * @throws NumberFormatException if the value is not a valid integer
     */
    public IntegerValue(String value) {
        super();
        this.value = Integer.parseInt(value);
    }

    @Override
    public Type getType() {
        return Type.INTEGER;
    }

    /**
     * Returns the integer value of this object
     *
     * @return the integer value
     */
    public int getValue() {
        return value;
    }

    @Override
    public int compareTo(FieldValue other) {
        if (other instanceof IntegerValue) {
            return Integer.compare(value, ((IntegerValue) other).value);
        }
        return NumberValue.compareNumeric(this, other);
    }

    @Override
    public long getLong() {
        return value;
    }

    @Override
    public double castAsDouble() {
        return value;
    }

    @Override
    public double getDouble() {
        return value;
    }

    @Override
    public BigDecimal getNumber() {
        return new BigDecimal(value);
    }

    @Override
    public String getString() {
        return toJson();
    }

    @Override
    public String toJson() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof IntegerValue) {
            return value == ((IntegerValue)other).value;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return ((Integer) value).hashCode();
    }
}
