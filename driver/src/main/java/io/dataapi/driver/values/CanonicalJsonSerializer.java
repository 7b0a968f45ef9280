/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

import java.math.BigDecimal;
import java.util.Arrays;

/**
 * A JSON serializer producing a canonical text: map keys in sorted order
 * and every finite number written as its normalized decimal, so
 * <code>1</code>, <code>1L</code> and <code>1.0</code> produce the same
 * text. Two values that are structurally equal produce equal text.
 *
 * @hidden
 */
class CanonicalJsonSerializer extends JsonSerializer {

    @Override
    public void integerValue(int value) {
        numberValue(BigDecimal.valueOf(value));
    }

    @Override
    public void longValue(long value) {
        numberValue(BigDecimal.valueOf(value));
    }

    @Override
    public void doubleValue(double value) {
        if (Double.isFinite(value)) {
            numberValue(BigDecimal.valueOf(value));
        } else {
            super.doubleValue(value);
        }
    }

    @Override
    public void numberValue(BigDecimal value) {
        BigDecimal normalized = value.stripTrailingZeros();
        if (normalized.signum() == 0) {
            normalized = BigDecimal.ZERO;
        }
        sb.append(normalized.toPlainString());
    }

    /**
     * Writes the value with map keys sorted, recursively.
     *
     * @param value the value
     */
    void write(FieldValue value) {
        if (value.isMap()) {
            MapValue map = value.asMap();
            String[] keys = map.getMap().keySet().toArray(new String[0]);
            Arrays.sort(keys);
            startMap(keys.length);
            for (String key : keys) {
                startMapField(key);
                write(map.get(key));
                endMapField(key);
            }
            endMap(keys.length);
        } else if (value.isArray()) {
            ArrayValue array = value.asArray();
            startArray(array.size());
            for (int i = 0; i < array.size(); i++) {
                startArrayField(i);
                write(array.get(i));
                endArrayField(i);
            }
            endArray(array.size());
        } else {
            FieldValueEventHandler.generate(value, this);
        }
    }
}
