/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

/**
 * The result of a countDocuments command. When the service stops counting
 * at its own limit, {@link #getMoreData} is true and the count is a lower
 * bound.
 */
public class CountDocumentsResult extends Result {

    private int count;
    private boolean moreData;

    public int getCount() {
        return count;
    }

    /**
     * @param count the count
     * @return this
     * @hidden
     */
    public CountDocumentsResult setCount(int count) {
        this.count = count;
        return this;
    }

    public boolean getMoreData() {
        return moreData;
    }

    /**
     * @param moreData the flag
     * @return this
     * @hidden
     */
    public CountDocumentsResult setMoreData(boolean moreData) {
        this.moreData = moreData;
        return this;
    }
}
