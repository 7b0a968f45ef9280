/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import java.util.Map;

import io.dataapi.driver.values.FieldValue;
import io.dataapi.driver.values.MapValue;

/**
 * One entry of the "errors" array of a Data API response.
 */
public class ErrorDescriptor {

    private final String errorCode;

    private final String message;

    private final MapValue attributes;

    /**
     * @hidden
     * @param errorCode the error code, may be null
     * @param message the message, may be null
     * @param attributes any other fields of the error
     */
    public ErrorDescriptor(String errorCode,
                           String message,
                           MapValue attributes) {
        this.errorCode = errorCode;
        this.message = message;
        this.attributes = (attributes == null ? new MapValue() : attributes);
    }

    /**
     * @hidden
     * Creates a descriptor from one element of the errors array.
     *
     * @param error the JSON error object
     * @return the descriptor
     */
    public static ErrorDescriptor fromMap(MapValue error) {
        MapValue attributes = new MapValue();
        String code = null;
        String message = null;
        for (Map.Entry<String, FieldValue> e : error) {
            if ("errorCode".equals(e.getKey())) {
                code = e.getValue().getString();
            } else if ("message".equals(e.getKey())) {
                message = e.getValue().getString();
            } else {
                attributes.put(e.getKey(), e.getValue());
            }
        }
        return new ErrorDescriptor(code, message, attributes);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getMessage() {
        return message;
    }

    public MapValue getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        if (errorCode == null) {
            return String.valueOf(message);
        }
        return message + " (" + errorCode + ")";
    }
}
