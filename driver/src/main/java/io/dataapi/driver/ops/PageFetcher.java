/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

/**
 * Fetches one page of a find. A {@link Cursor} calls this each time its
 * buffer runs dry.
 * <p>
 * Implementations issue exactly one request per call and either return
 * the whole page or throw; errors reach the cursor's caller unchanged.
 */
public interface PageFetcher {

    /**
     * Fetches a page.
     *
     * @param spec the query specification of the cursor, not to be
     * modified
     * @param pageState the continuation token of the page, null for the
     * first page
     *
     * @return the page
     */
    FindResult fetch(FindRequest spec, String pageState);
}
