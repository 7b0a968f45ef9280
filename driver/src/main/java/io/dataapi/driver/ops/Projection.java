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
 * Selects the fields returned for each document, either by naming the
 * fields to include or the fields to exclude. The two forms cannot be
 * mixed. Paths use dot notation.
 * <pre>
 *   Projection.include("name", "address.city")  // {"name":1,"address.city":1}
 *   Projection.exclude("payload")                // {"payload":0}
 * </pre>
 * Instances are immutable.
 */
public final class Projection {

    /**
     * The kind of projection.
     */
    public enum Kind {
        /** only the named fields, plus _id, are returned */
        INCLUDE,
        /** every field but the named ones is returned */
        EXCLUDE
    }

    private final Kind kind;
    private final List<String> paths;

    private Projection(Kind kind, String... paths) {
        if (paths == null || paths.length == 0) {
            throw new IllegalArgumentException(
                "Projection requires at least one path");
        }
        List<String> list = new ArrayList<String>(paths.length);
        for (String path : paths) {
            if (path == null || path.isEmpty()) {
                throw new IllegalArgumentException(
                    "Projection paths must be non-empty");
            }
            list.add(path);
        }
        this.kind = kind;
        this.paths = Collections.unmodifiableList(list);
    }

    /**
     * Creates a projection returning only the named fields.
     *
     * @param paths the fields
     *
     * @return the projection
     */
    public static Projection include(String... paths) {
        return new Projection(Kind.INCLUDE, paths);
    }

    /**
     * Creates a projection returning all but the named fields.
     *
     * @param paths the fields
     *
     * @return the projection
     */
    public static Projection exclude(String... paths) {
        return new Projection(Kind.EXCLUDE, paths);
    }

    public Kind getKind() {
        return kind;
    }

    public List<String> getPaths() {
        return paths;
    }

    /**
     * Returns the wire form of the projection.
     *
     * @return a new map
     */
    public MapValue toMapValue() {
        MapValue map = new MapValue(paths.size());
        int flag = (kind == Kind.INCLUDE ? 1 : 0);
        for (String path : paths) {
            map.put(path, flag);
        }
        return map;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof Projection)) {
            return false;
        }
        Projection p = (Projection) other;
        return kind == p.kind && paths.equals(p.paths);
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + paths.hashCode();
    }

    @Override
    public String toString() {
        return toMapValue().toJson();
    }
}
