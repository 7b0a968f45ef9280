/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

import io.dataapi.driver.ops.serde.Serializer;
import io.dataapi.driver.ops.serde.SerializerFactory;
import io.dataapi.driver.values.MapValue;

/**
 * Represents the input to a find command: the query specification of a
 * {@link Cursor}, plus the continuation token of the page to fetch.
 * <p>
 * The filter is sent to the service verbatim; the driver never evaluates
 * it. A null filter matches every document.
 * <p>
 * When a sort is present the service returns the result in a single,
 * non-paginated response. skip and limit are applied by the service in
 * that case. The service also rejects a skip without a sort, which
 * surfaces as a {@link io.dataapi.driver.DataAPIResponseException} on the
 * first fetch; {@link #validate} does not check it.
 *
 * @see io.dataapi.driver.Collection#find(FindRequest)
 */
public class FindRequest extends Request {

    private MapValue filter;
    private Projection projection;
    private SortSpec sort;
    private Integer skip;
    private Integer limit;
    private String pageState;

    public FindRequest() {
    }

    /**
     * Returns an independent copy of this request.
     *
     * @return the copy
     */
    public FindRequest copy() {
        FindRequest copy = new FindRequest();
        copy.copyBase(this);
        copy.filter = (filter == null ? null : filter.copy());
        copy.projection = projection;
        copy.sort = (sort == null ? null : sort.copy());
        copy.skip = skip;
        copy.limit = limit;
        copy.pageState = pageState;
        return copy;
    }

    public MapValue getFilter() {
        return filter;
    }

    /**
     * Sets the filter. Null or empty matches all documents.
     *
     * @param filter the filter
     *
     * @return this
     */
    public FindRequest setFilter(MapValue filter) {
        this.filter = filter;
        return this;
    }

    public Projection getProjection() {
        return projection;
    }

    public FindRequest setProjection(Projection projection) {
        this.projection = projection;
        return this;
    }

    public SortSpec getSort() {
        return sort;
    }

    public FindRequest setSort(SortSpec sort) {
        this.sort = sort;
        return this;
    }

    /**
     * Returns true if the request has a non-empty sort, in which case it is
     * served by a single request.
     *
     * @return true if sorted
     */
    public boolean isSorted() {
        return sort != null && !sort.isEmpty();
    }

    public Integer getSkip() {
        return skip;
    }

    /**
     * Sets the number of documents to skip. The service accepts it only
     * together with a sort and reports an error otherwise.
     *
     * @param skip the number of documents, or null for none
     *
     * @return this
     */
    public FindRequest setSkip(Integer skip) {
        if (skip != null && skip < 0) {
            throw new IllegalArgumentException("skip must be non-negative");
        }
        this.skip = skip;
        return this;
    }

    public Integer getLimit() {
        return limit;
    }

    /**
     * Sets the maximum number of documents returned over the life of a
     * cursor traversal. 0 or null means no limit.
     *
     * @param limit the limit
     *
     * @return this
     */
    public FindRequest setLimit(Integer limit) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative");
        }
        this.limit = (limit != null && limit == 0 ? null : limit);
        return this;
    }

    /**
     * Returns the continuation token of the page to fetch, null for the
     * first page.
     *
     * @return the token
     */
    public String getPageState() {
        return pageState;
    }

    /**
     * @param pageState the token
     * @return this
     * @hidden
     */
    public FindRequest setPageState(String pageState) {
        this.pageState = pageState;
        return this;
    }

    /**
     * Sets the request timeout value, in milliseconds. This overrides any
     * default value set in the handle configuration. The value must be
     * positive.
     *
     * @param timeoutMs the timeout value, in milliseconds
     *
     * @return this
     */
    public FindRequest setTimeout(int timeoutMs) {
        super.setTimeoutInternal(timeoutMs);
        return this;
    }

    /**
     * @param collectionName the collection
     * @return this
     * @hidden
     */
    public FindRequest setCollectionName(String collectionName) {
        super.setCollectionNameInternal(collectionName);
        return this;
    }

    @Override
    public String getCommandName() {
        return "find";
    }

    /**
     * @hidden
     */
    @Override
    public void validate() {
        validateCollectionName();
    }

    /**
     * @hidden
     */
    @Override
    public Serializer createSerializer(SerializerFactory factory) {
        return factory.createFindSerializer();
    }

    @Override
    public String toString() {
        return "FindRequest[filter=" + filter + ", projection=" +
            projection + ", sort=" + sort + ", skip=" + skip +
            ", limit=" + limit + "]";
    }
}
