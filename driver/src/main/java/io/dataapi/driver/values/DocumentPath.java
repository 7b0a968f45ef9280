/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

import static io.dataapi.driver.util.CheckNull.requireNonNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A dotted path into a document, such as "address.city" or "items.0.sku",
 * used to extract the values that {@code distinct} operates on.
 * <p>
 * A segment is a list index if it is a non-negative decimal integer without
 * leading zeros ("0", "12", but not "01" or "-1"). Extraction walks the
 * document as follows:
 * <ul>
 * <li>on a map, a segment selects the field of that name, including numeric
 * segments, which are plain field names on a map</li>
 * <li>on an array, an index segment selects that element; any other segment
 * is applied to every element with the same remaining path</li>
 * <li>at the end of the path, an array contributes each of its elements and
 * any other value contributes itself</li>
 * <li>a missing field or out of range index contributes nothing</li>
 * </ul>
 * Paths with empty segments are rejected when parsed.
 */
public class DocumentPath {

    private final String path;

    private final String[] segments;

    private DocumentPath(String path, String[] segments) {
        this.path = path;
        this.segments = segments;
    }

    /**
     * Parses a dotted path.
     *
     * @param path the path
     *
     * @return the parsed path
     *
     * @throws IllegalArgumentException if the path is empty or has an empty
     * segment, as in "a..b", ".a" or "a."
     */
    public static DocumentPath parse(String path) {
        requireNonNull(path, "DocumentPath: path must be non-null");
        /* -1 keeps trailing empty strings */
        String[] segments = path.split("\\.", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new IllegalArgumentException(
                    "Invalid document path, empty segment: '" + path + "'");
            }
        }
        return new DocumentPath(path, segments);
    }

    /**
     * Returns true if the segment is a list index.
     *
     * @param segment the segment
     *
     * @return true if it is a non-negative integer without leading zeros
     */
    public static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        if (segment.length() > 1 && segment.charAt(0) == '0') {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    public String getPath() {
        return path;
    }

    public List<String> getSegments() {
        return Collections.unmodifiableList(Arrays.asList(segments));
    }

    /**
     * Returns the leading segments of the path up to, not including, the
     * first index segment, joined with dots. This is the part of the path a
     * projection can safely select. Returns null if the first segment is an
     * index.
     *
     * @return the prefix, or null
     */
    public String getProjectionPrefix() {
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            if (isIndex(segment)) {
                break;
            }
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(segment);
        }
        return sb.length() == 0 ? null : sb.toString();
    }

    /**
     * Extracts the values this path selects from a document.
     *
     * @param document the document
     *
     * @return the values, in document order; empty if nothing matches
     */
    public List<FieldValue> extract(MapValue document) {
        requireNonNull(document, "DocumentPath: document must be non-null");
        List<FieldValue> results = new ArrayList<FieldValue>();
        extract(document, 0, results);
        return results;
    }

    private void extract(FieldValue value, int pos, List<FieldValue> results) {
        if (pos == segments.length) {
            if (value.isArray()) {
                results.addAll(value.asArray().getArrayInternal());
            } else {
                results.add(value);
            }
            return;
        }
        String segment = segments[pos];
        if (value.isMap()) {
            FieldValue child = value.asMap().get(segment);
            if (child != null) {
                extract(child, pos + 1, results);
            }
        } else if (value.isArray()) {
            ArrayValue array = value.asArray();
            if (isIndex(segment)) {
                int index = Integer.parseInt(segment);
                if (index < array.size()) {
                    extract(array.get(index), pos + 1, results);
                }
            } else {
                for (FieldValue element : array) {
                    extract(element, pos, results);
                }
            }
        }
        /* atomic values have no children */
    }

    @Override
    public String toString() {
        return path;
    }
}
