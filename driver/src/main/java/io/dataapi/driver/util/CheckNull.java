/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.util;

import java.util.Collection;
import java.util.Objects;

/**
 * @hidden
 * Argument checks shared by requests and the collection API
 */
public class CheckNull {

    public static void requireNonNull(Object value, String message) {
        Objects.requireNonNull(value, message);
    }

    /*
     * throws IAE instead of NPE
     */
    public static void requireNonEmpty(String value, String message) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(message);
        }
    }

    public static void requireNonEmpty(Collection<?> value, String message) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(message);
        }
    }
}
