/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

import java.math.BigDecimal;

/**
 * A {@link FieldValue} instance representing a double value.
 */
public class DoubleValue extends FieldValue {

    private final double value;

    public DoubleValue(double value) {
        super();
        this.value = value;
    }

    public DoubleValue(String value) {
        super();
        this.value = Double.parseDouble(value);
    }

    @Override
    public Type getType() {
        return Type.DOUBLE;
    }

    public double getValue() {
        return value;
    }

    @Override
    public double castAsDouble() {
        return value;
    }

    @Override
    public int compareTo(FieldValue other) {
        if (other instanceof DoubleValue) {
            return Double.compare(value, ((DoubleValue) other).value);
        }
        return NumberValue.compareNumeric(this, other);
    }

    /**
     * @throws NumberFormatException if the value is NaN or infinite
     */
    @Override
    public BigDecimal getNumber() {
        return BigDecimal.valueOf(value);
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
        if (other instanceof DoubleValue) {
            /* Use Double.equals to handle values like NaN */
            return ((Double)value).equals(((DoubleValue)other).value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return ((Double) value).hashCode();
    }
}
