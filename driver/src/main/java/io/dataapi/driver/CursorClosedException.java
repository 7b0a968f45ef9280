/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import java.util.NoSuchElementException;

/**
 * Thrown when a closed {@link io.dataapi.driver.ops.Cursor} is iterated or
 * rewound. It is a NoSuchElementException so that loops written against
 * {@link java.util.Iterator} end the same way they would at exhaustion.
 */
public class CursorClosedException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    public CursorClosedException(String msg) {
        super(msg);
    }
}
