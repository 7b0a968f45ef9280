/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

import static io.dataapi.driver.util.CheckNull.requireNonNull;

import java.math.BigDecimal;

/**
 * A {@link FieldValue} instance representing a numeric value that does not
 * fit in a long or a double without loss, held as a BigDecimal.
 */
public class NumberValue extends FieldValue {

    /* The BigDecimal that represents the Number value */
    private final BigDecimal value;

    public NumberValue(BigDecimal value) {
        super();
        requireNonNull(value, "NumberValue: value must be non-null");
        this.value = value;
    }

    public NumberValue(String value) {
        super();
        this.value = new BigDecimal(value);
    }

    @Override
    public Type getType() {
        return Type.NUMBER;
    }

    public BigDecimal getValue() {
        return value;
    }

    @Override
    public double castAsDouble() {
         return value.doubleValue();
    }

    @Override
    public int compareTo(FieldValue other) {
        requireNonNull(other, "NumberValue.compareTo: other must be non-null");
        return compareNumeric(this, other);
    }

    /*
     * Compares two numeric values of possibly different types as
     * BigDecimal. Non-finite doubles compare as doubles.
     */
    static int compareNumeric(FieldValue v1, FieldValue v2) {
        if (!v2.isNumeric()) {
            throw new ClassCastException("Object is not a numeric type: " +
                                         v2.getType());
        }
        if (isNonFinite(v1) || isNonFinite(v2)) {
            return Double.compare(v1.castAsDouble(), v2.castAsDouble());
        }
        return v1.getNumber().compareTo(v2.getNumber());
    }

    private static boolean isNonFinite(FieldValue v) {
        return v.isDouble() && !Double.isFinite(v.getDouble());
    }

    @Override
    public String getString() {
        return toJson();
    }

    @Override
    public String toJson() {
        return value.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof NumberValue) {
            return value.equals(((NumberValue) other).value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
