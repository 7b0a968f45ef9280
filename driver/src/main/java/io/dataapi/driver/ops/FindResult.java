/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

import java.util.Collections;
import java.util.List;

import io.dataapi.driver.values.MapValue;

/**
 * One page of a find command: the documents plus the continuation token
 * of the next page, null if there is none.
 */
public class FindResult extends Result {

    private List<MapValue> documents = Collections.emptyList();
    private String nextPageState;

    public FindResult() {
    }

    public List<MapValue> getDocuments() {
        return documents;
    }

    /**
     * @param documents the documents
     * @return this
     * @hidden
     */
    public FindResult setDocuments(List<MapValue> documents) {
        this.documents =
            (documents == null ? Collections.<MapValue>emptyList() :
             documents);
        return this;
    }

    public String getNextPageState() {
        return nextPageState;
    }

    /**
     * @param nextPageState the token
     * @return this
     * @hidden
     */
    public FindResult setNextPageState(String nextPageState) {
        this.nextPageState = nextPageState;
        return this;
    }

    @Override
    public String toString() {
        return "FindResult[documents=" + documents.size() +
            ", nextPageState=" + nextPageState + "]";
    }
}
