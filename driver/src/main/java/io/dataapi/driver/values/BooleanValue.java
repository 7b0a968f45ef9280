/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

/**
 * A {@link FieldValue} instance representing a boolean value. There are
 * only two instances.
 */
public abstract class BooleanValue extends FieldValue {

    private static final BooleanValue TRUE = new TrueBooleanValue();
    private static final BooleanValue FALSE = new FalseBooleanValue();

    public static BooleanValue trueInstance() {
        return TRUE;
    }

    public static BooleanValue falseInstance() {
        return FALSE;
    }

    public static BooleanValue getInstance(boolean value) {
        return (value ? TRUE : FALSE);
    }

    abstract public boolean getValue();

    private BooleanValue() {
        super();
    }

    @Override
    public String getString() {
        return toJson();
    }

    @Override
    public Type getType() {
        return Type.BOOLEAN;
    }

    private static class TrueBooleanValue extends BooleanValue {
        @Override
        public boolean getValue() {
            return true;
        }

        @Override
        public String toJson() {
            return "true";
        }
    }

    private static class FalseBooleanValue extends BooleanValue {
        @Override
        public boolean getValue() {
            return false;
        }

        @Override
        public String toJson() {
            return "false";
        }
    }

    @Override
    public int compareTo(FieldValue other) {
        return Boolean.compare(getValue(), other.getBoolean());
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof BooleanValue) {
            return getValue() == ((BooleanValue)other).getValue();
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(getValue());
    }
}
