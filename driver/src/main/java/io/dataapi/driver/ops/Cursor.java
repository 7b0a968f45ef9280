/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

import static io.dataapi.driver.util.CheckNull.requireNonNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

import io.dataapi.driver.Collection;
import io.dataapi.driver.CursorClosedException;
import io.dataapi.driver.util.LogUtil;
import io.dataapi.driver.values.DocumentPath;
import io.dataapi.driver.values.FieldValue;
import io.dataapi.driver.values.JsonUtils;
import io.dataapi.driver.values.MapValue;

/**
 * A lazy iterator over the documents matching a find. Pages are fetched
 * from the service on demand, one request per page, following the
 * continuation token the service returns.
 * <p>
 * A cursor is an explicit state machine:
 * <pre>
 *   IDLE --next--&gt; STARTED --last document or limit--&gt; EXHAUSTED
 *     any state but CLOSED --rewind--&gt; IDLE
 *     any state --close--&gt; CLOSED
 * </pre>
 * A cursor with a sort is served by a single request; any continuation
 * token returned for it is ignored. When a limit is set, a traversal never
 * returns more than limit documents.
 * <p>
 * Positions used by {@link #get} and {@link #slice} are absolute since
 * construction or the last {@link #rewind}. If the cursor has already
 * moved past the requested position it rewinds itself first.
 * <p>
 * A cursor is meant for a single consumer thread. {@link #close} may be
 * called from any thread; a page that arrives after close is dropped.
 * Errors raised while fetching a page are neither retried nor wrapped, and
 * leave the cursor as it was, so a later call fetches the same page again.
 * <p>
 * Example:
 * <pre>
 *   try (Cursor cursor = collection.find(new FindRequest()
 *            .setFilter(filter)
 *            .setSort(SortSpec.ascending("seq")))) {
 *       for (MapValue doc : cursor) {
 *           ...
 *       }
 *   }
 * </pre>
 */
public class Cursor
    implements Iterator<MapValue>, Iterable<MapValue>, AutoCloseable {

    /**
     * The iteration state of a cursor.
     */
    public enum State {
        /** nothing returned since construction or the last rewind */
        IDLE,
        /** at least one document returned */
        STARTED,
        /** every document has been returned */
        EXHAUSTED,
        /** closed, the cursor can no longer be used */
        CLOSED
    }

    private static final Logger logger =
        Logger.getLogger(Cursor.class.getName());

    private static final AtomicLong nextCursorId = new AtomicLong(1);

    private final FindRequest spec;

    private final PageFetcher fetcher;

    private final Collection collection;

    private final long cursorId;

    private volatile State state = State.IDLE;

    /*
     * The state and the iteration state below are written only while
     * holding this. Fetches run without the lock so close() is never
     * blocked by the network.
     */
    private final ArrayDeque<MapValue> buffer = new ArrayDeque<MapValue>();

    private String pageState;

    /* true once the last page has been fetched */
    private boolean lastPage;

    /* true once any page has been fetched since the last rewind */
    private boolean fetched;

    /* documents returned to the caller since the last rewind */
    private int retrieved;

    /* documents consumed since the last rewind, skipped ones included */
    private int position;

    /* bumped by rewind and close, a fetch started earlier is dropped */
    private long epoch;

    /**
     * Creates a cursor. The query specification is copied, changes the
     * caller makes to it later have no effect.
     *
     * @param spec the query specification
     * @param fetcher the page source
     * @param collection the owning collection, may be null
     */
    public Cursor(FindRequest spec, PageFetcher fetcher, Collection collection) {
        requireNonNull(spec, "Cursor: spec must be non-null");
        requireNonNull(fetcher, "Cursor: fetcher must be non-null");
        this.spec = spec.copy();
        this.spec.setPageState(null);
        this.fetcher = fetcher;
        this.collection = collection;
        this.cursorId = nextCursorId.getAndIncrement();
    }

    /**
     * Returns this cursor, so it can be used in a for-each loop. The cursor
     * is not restarted; use {@link #rewind} for that.
     */
    @Override
    public Iterator<MapValue> iterator() {
        return this;
    }

    /**
     * Returns true if another document is available, fetching a page if
     * needed. Returns false once the cursor is exhausted or closed.
     *
     * @return true if {@link #next} will return a document
     */
    @Override
    public boolean hasNext() {
        while (true) {
            synchronized (this) {
                if (state == State.CLOSED) {
                    return false;
                }
                if (limitReached()) {
                    markExhausted();
                    return false;
                }
                if (!buffer.isEmpty()) {
                    return true;
                }
                if (lastPage) {
                    markExhausted();
                    return false;
                }
            }
            fetchPage();
        }
    }

    /**
     * Returns the next document, fetching a page if needed.
     *
     * @return the document
     *
     * @throws CursorClosedException if the cursor is closed
     * @throws NoSuchElementException if there are no more documents
     */
    @Override
    public MapValue next() {
        return nextDocument(true);
    }

    private MapValue nextDocument(boolean count) {
        while (true) {
            synchronized (this) {
                checkOpen();
                if (limitReached()) {
                    markExhausted();
                    throw new NoSuchElementException(
                        "Cursor " + cursorId + " has no more documents");
                }
                MapValue doc = buffer.pollFirst();
                if (doc != null) {
                    position++;
                    if (count) {
                        retrieved++;
                    }
                    state = State.STARTED;
                    if ((buffer.isEmpty() && lastPage) || limitReached()) {
                        markExhausted();
                    }
                    return doc;
                }
                if (lastPage) {
                    markExhausted();
                    throw new NoSuchElementException(
                        "Cursor " + cursorId + " has no more documents");
                }
            }
            fetchPage();
        }
    }

    private void fetchPage() {
        final String token;
        final long fetchEpoch;
        synchronized (this) {
            if (state == State.CLOSED) {
                return;
            }
            token = pageState;
            fetchEpoch = epoch;
        }

        FindResult page = fetcher.fetch(spec, token);
        if (page == null) {
            throw new IllegalStateException(
                "PageFetcher returned no page for cursor " + cursorId);
        }

        synchronized (this) {
            if (state == State.CLOSED || fetchEpoch != epoch) {
                if (LogUtil.isFineEnabled(logger)) {
                    LogUtil.logFine(logger, "Cursor " + cursorId +
                                    ": dropping page fetched before " +
                                    (state == State.CLOSED ?
                                     "close" : "rewind"));
                }
                return;
            }
            buffer.addAll(page.getDocuments());
            fetched = true;
            String next = page.getNextPageState();
            if (spec.isSorted() || next == null) {
                lastPage = true;
                pageState = null;
            } else {
                pageState = next;
            }
        }
    }

    /**
     * Resets the cursor to its initial state: nothing retrieved, nothing
     * buffered, no continuation token. The query specification is kept.
     *
     * @return this
     *
     * @throws CursorClosedException if the cursor is closed
     */
    public synchronized Cursor rewind() {
        checkOpen();
        reset();
        state = State.IDLE;
        return this;
    }

    private void reset() {
        epoch++;
        buffer.clear();
        pageState = null;
        lastPage = false;
        fetched = false;
        retrieved = 0;
        position = 0;
    }

    /**
     * Returns a new, independent cursor with the same query specification
     * and owning collection. The new cursor starts from the beginning
     * whatever the state of this one, and a closed cursor can be copied
     * too.
     *
     * @return the new cursor
     */
    public Cursor copy() {
        return new Cursor(spec, fetcher, collection);
    }

    /**
     * Same as {@link #copy}.
     *
     * @return the new cursor
     */
    @Override
    public Cursor clone() {
        return copy();
    }

    /**
     * Closes the cursor and drops any buffered documents. Calling close
     * more than once has no effect.
     */
    @Override
    public synchronized void close() {
        state = State.CLOSED;
        epoch++;
        buffer.clear();
        pageState = null;
        lastPage = true;
    }

    /**
     * Returns true if the cursor is neither closed nor known to be
     * exhausted. A true value does not guarantee another document exists,
     * only that the cursor cannot tell without fetching.
     *
     * @return true if more documents may be available
     */
    public synchronized boolean isAlive() {
        State s = state;
        if (s != State.IDLE && s != State.STARTED) {
            return false;
        }
        if (limitReached()) {
            return false;
        }
        return !fetched || !buffer.isEmpty() || !lastPage;
    }

    /**
     * Returns the document at the given position since the last rewind.
     * Documents before it are consumed but not counted as retrieved. If the
     * cursor is already past the position it is rewound first.
     *
     * @param index the position, starting at 0
     *
     * @return the document
     *
     * @throws IllegalArgumentException if index is negative
     * @throws IndexOutOfBoundsException if the cursor ends before index
     * @throws CursorClosedException if the cursor is closed
     */
    public MapValue get(int index) {
        if (index < 0) {
            throw new IllegalArgumentException(
                "Cursor index must be non-negative: " + index);
        }
        seek(index);
        if (!hasNext()) {
            throw new IndexOutOfBoundsException(
                "Cursor index out of range: " + index);
        }
        return nextDocument(true);
    }

    /**
     * Returns the documents at positions start (inclusive) to end
     * (exclusive) since the last rewind, with the rules of {@link #get}.
     * The list is shorter than end - start if the cursor ends first.
     *
     * @param start the first position
     * @param end the position after the last
     *
     * @return the documents
     *
     * @throws IllegalArgumentException if start is negative or greater
     * than end
     * @throws CursorClosedException if the cursor is closed
     */
    public List<MapValue> slice(int start, int end) {
        if (start < 0 || start > end) {
            throw new IllegalArgumentException(
                "Invalid cursor slice [" + start + ", " + end + ")");
        }
        /* end is only an upper bound, the cursor may end first */
        List<MapValue> docs = new ArrayList<MapValue>();
        seek(start);
        while (currentPosition() < end && hasNext()) {
            docs.add(nextDocument(true));
        }
        return docs;
    }

    /*
     * Moves to the position, rewinding first if already past it. Stops
     * early if the cursor ends.
     */
    private void seek(int target) {
        synchronized (this) {
            checkOpen();
            if (position > target) {
                reset();
                state = State.IDLE;
            }
        }
        while (currentPosition() < target && hasNext()) {
            nextDocument(false);
        }
        synchronized (this) {
            checkOpen();
        }
    }

    private synchronized int currentPosition() {
        return position;
    }

    /**
     * Returns the distinct values found at a path in the remaining
     * documents of the cursor, in the order first seen. The cursor is
     * consumed to the end from its current position, without rewinding.
     * <p>
     * See {@link DocumentPath} for the path syntax. Values that are arrays
     * contribute each element. Maps and arrays are compared structurally.
     *
     * @param path the dotted path
     *
     * @return the values
     *
     * @throws IllegalArgumentException if the path is malformed, before any
     * document is fetched
     * @throws CursorClosedException if the cursor is closed
     */
    public List<FieldValue> distinct(String path) {
        DocumentPath docPath = DocumentPath.parse(path);
        synchronized (this) {
            checkOpen();
        }
        Map<String, FieldValue> values = new LinkedHashMap<String, FieldValue>();
        while (hasNext()) {
            MapValue doc = next();
            for (FieldValue value : docPath.extract(doc)) {
                String key = JsonUtils.toCanonicalJson(value);
                if (!values.containsKey(key)) {
                    values.put(key, value);
                }
            }
        }
        return new ArrayList<FieldValue>(values.values());
    }

    /**
     * Returns the number of documents returned since construction or the
     * last rewind.
     *
     * @return the count
     */
    public synchronized int getRetrieved() {
        return retrieved;
    }

    /**
     * Returns an id unique among the cursors of this process.
     *
     * @return the id
     */
    public long getCursorId() {
        return cursorId;
    }

    /**
     * Returns the owning collection, or null.
     *
     * @return the collection
     */
    public Collection getCollection() {
        return collection;
    }

    /**
     * Returns the HTTP path of the owning collection, or null if there is
     * none.
     *
     * @return the path
     */
    public String getAddress() {
        return collection == null ? null : collection.getAddress();
    }

    public State getState() {
        return state;
    }

    /**
     * Returns a copy of the query specification of this cursor.
     *
     * @return the specification
     */
    public FindRequest getSpec() {
        return spec.copy();
    }

    private boolean limitReached() {
        Integer limit = spec.getLimit();
        return limit != null && position >= limit;
    }

    /* callers hold the lock */
    private void markExhausted() {
        if (state != State.CLOSED) {
            state = State.EXHAUSTED;
        }
        buffer.clear();
    }

    private void checkOpen() {
        if (state == State.CLOSED) {
            throw new CursorClosedException(
                "Cursor " + cursorId + " is closed");
        }
    }

    @Override
    public String toString() {
        return "Cursor[id=" + cursorId + ", state=" + state +
            ", retrieved=" + getRetrieved() + ", spec=" + spec + "]";
    }
}
