/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

/**
 * The result of a delete. A deletedCount of -1 means the service did not
 * report a count, which is the case when a collection is emptied.
 */
public class DeleteResult extends Result {

    private int deletedCount;
    private boolean moreData;

    public int getDeletedCount() {
        return deletedCount;
    }

    /**
     * @param deletedCount the count
     * @return this
     * @hidden
     */
    public DeleteResult setDeletedCount(int deletedCount) {
        this.deletedCount = deletedCount;
        return this;
    }

    /**
     * @return true if matching documents remain
     * @hidden
     */
    public boolean getMoreData() {
        return moreData;
    }

    /**
     * @param moreData the flag
     * @return this
     * @hidden
     */
    public DeleteResult setMoreData(boolean moreData) {
        this.moreData = moreData;
        return this;
    }

    @Override
    public String toString() {
        return "DeleteResult[deletedCount=" + deletedCount + "]";
    }
}
