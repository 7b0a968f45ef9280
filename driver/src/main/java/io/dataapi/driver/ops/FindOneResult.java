/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

import io.dataapi.driver.values.MapValue;

/**
 * The result of a findOne command.
 */
public class FindOneResult extends Result {

    private MapValue document;

    /**
     * Returns the document found, or null if nothing matched.
     *
     * @return the document
     */
    public MapValue getDocument() {
        return document;
    }

    /**
     * @param document the document
     * @return this
     * @hidden
     */
    public FindOneResult setDocument(MapValue document) {
        this.document = document;
        return this;
    }
}
