/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.dataapi.driver.values.MapValue;

/**
 * An ordered list of sort keys. The order in which keys are added is the
 * order in which they apply.
 * <pre>
 *   SortSpec sort = new SortSpec()
 *       .add("priority", SortSpec.Direction.DESCENDING)
 *       .add("name", SortSpec.Direction.ASCENDING);
 * </pre>
 */
public class SortSpec {

    /**
     * Sort direction.
     */
    public enum Direction {
        ASCENDING(1),
        DESCENDING(-1);

        private final int value;

        Direction(int value) {
            this.value = value;
        }

        /**
         * Returns the wire value, 1 or -1.
         *
         * @return the value
         */
        public int getValue() {
            return value;
        }
    }

    /**
     * A single sort key.
     */
    public static final class Key {
        private final String path;
        private final Direction direction;

        Key(String path, Direction direction) {
            this.path = path;
            this.direction = direction;
        }

        public String getPath() {
            return path;
        }

        public Direction getDirection() {
            return direction;
        }
    }

    private final List<Key> keys = new ArrayList<Key>();

    /**
     * Creates an empty sort.
     */
    public SortSpec() {
    }

    /**
     * Creates a single key ascending sort.
     *
     * @param path the field
     *
     * @return the sort
     */
    public static SortSpec ascending(String path) {
        return new SortSpec().add(path, Direction.ASCENDING);
    }

    /**
     * Creates a single key descending sort.
     *
     * @param path the field
     *
     * @return the sort
     */
    public static SortSpec descending(String path) {
        return new SortSpec().add(path, Direction.DESCENDING);
    }

    /**
     * Appends a sort key.
     *
     * @param path the field, dot notation allowed
     * @param direction the direction
     *
     * @return this
     *
     * @throws IllegalArgumentException if the path is empty or already
     * present, or the direction is null
     */
    public SortSpec add(String path, Direction direction) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException(
                "Sort path must be non-empty");
        }
        if (direction == null) {
            throw new IllegalArgumentException(
                "Sort direction must be non-null");
        }
        for (Key key : keys) {
            if (key.path.equals(path)) {
                throw new IllegalArgumentException(
                    "Duplicate sort path: " + path);
            }
        }
        keys.add(new Key(path, direction));
        return this;
    }

    public List<Key> getKeys() {
        return Collections.unmodifiableList(keys);
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    /**
     * Returns the wire form of the sort, keys in insertion order.
     *
     * @return a new map
     */
    public MapValue toMapValue() {
        MapValue map = new MapValue(keys.size());
        for (Key key : keys) {
            map.put(key.path, key.direction.getValue());
        }
        return map;
    }

    /**
     * Returns an independent copy.
     *
     * @return the copy
     */
    public SortSpec copy() {
        SortSpec copy = new SortSpec();
        copy.keys.addAll(keys);
        return copy;
    }

    @Override
    public String toString() {
        return toMapValue().toJson();
    }
}
