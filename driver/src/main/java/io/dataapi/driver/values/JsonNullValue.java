/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

/**
 * A {@link FieldValue} instance representing a JSON null value. There is a
 * single instance.
 */
public class JsonNullValue extends FieldValue {

    private static final JsonNullValue INSTANCE = new JsonNullValue();

    private JsonNullValue() {
        super();
    }

    @Override
    public Type getType() {
        return Type.JSON_NULL;
    }

    public static JsonNullValue getInstance() {
        return INSTANCE;
    }

    /*
     * null sorts before every other value
     */
    @Override
    public int compareTo(FieldValue other) {
        if (other instanceof JsonNullValue) {
            return 0;
        }
        return -1;
    }

    @Override
    public String getString() {
        return toJson();
    }

    @Override
    public String toJson() {
        return "null";
    }

    @Override
    public boolean equals(Object other) {
        return other == INSTANCE;
    }

    @Override
    public int hashCode() {
        return 0;
    }
}
