/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

import static io.dataapi.driver.util.CheckNull.requireNonNull;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * ArrayValue represents a JSON array. Elements may be of any type,
 * including nested maps and arrays.
 */
public class ArrayValue extends FieldValue implements Iterable<FieldValue> {

    private final ArrayList<FieldValue> array;

    public ArrayValue() {
        super();
        array = new ArrayList<FieldValue>();
    }

    public ArrayValue(int size) {
        super();
        array = new ArrayList<FieldValue>(size);
    }

    @Override
    public Type getType() {
        return Type.ARRAY;
    }

    /**
     * Returns the live list of elements.
     *
     * @return the list
     */
    public List<FieldValue> getArrayInternal() {
        return array;
    }

    public int size() {
        return array.size();
    }

    public FieldValue get(int index) {
        return array.get(index);
    }

    public ArrayValue add(FieldValue value) {
        requireNonNull(value, "ArrayValue.add: value must be non-null");
        array.add(value);
        return this;
    }

    public FieldValue set(int index, FieldValue value) {
        requireNonNull(value, "ArrayValue.set: value must be non-null");
        return array.set(index, value);
    }

    public FieldValue remove(int index) {
        return array.remove(index);
    }

    public ArrayValue addAll(Iterator<? extends FieldValue> iter) {
        requireNonNull(iter, "ArrayValue.addAll: iter must be non-null");
        while (iter.hasNext()) {
            add(iter.next());
        }
        return this;
    }

    public ArrayValue add(int value) {
        return add(new IntegerValue(value));
    }

    public ArrayValue add(long value) {
        return add(new LongValue(value));
    }

    public ArrayValue add(double value) {
        return add(new DoubleValue(value));
    }

    public ArrayValue add(BigDecimal value) {
        requireNonNull(value, "ArrayValue.add: value must be non-null");
        return add(new NumberValue(value));
    }

    public ArrayValue add(boolean value) {
        return add(BooleanValue.getInstance(value));
    }

    public ArrayValue add(String value) {
        requireNonNull(value, "ArrayValue.add: value must be non-null");
        return add(new StringValue(value));
    }

    @Override
    public int compareTo(FieldValue other) {
        requireNonNull(other, "ArrayValue.compareTo: other must be non-null");
        ArrayValue otherImpl = other.asArray();
        int minSize = Math.min(size(), otherImpl.size());
        for (int i = 0; i < minSize; i++) {
            int ret = get(i).compareTo(otherImpl.get(i));
            if (ret != 0) {
                return ret;
            }
        }
        return Integer.compare(size(), otherImpl.size());
    }

    @Override
    public Iterator<FieldValue> iterator() {
        return array.iterator();
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof ArrayValue) {
            return array.equals(((ArrayValue)other).array);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return array.hashCode();
    }
}
