/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import com.fasterxml.jackson.core.JsonLocation;

/**
 * An exception indicating a problem parsing JSON, either application input
 * or a malformed response. If available, information about the location
 * of the problem is included.
 */
public class JsonParseException extends DataAPIException {

    private static final long serialVersionUID = 1L;

    private final transient JsonLocation location;

    /**
     * @hidden
     * @param msg the message
     */
    public JsonParseException(String msg) {
        this(msg, null);
    }

    /**
     * @hidden
     * @param msg the message
     * @param location the location of the problem, may be null
     */
    public JsonParseException(String msg, JsonLocation location) {
        super(msg);
        this.location = location;
    }

    /**
     * Returns the column number of the problem, or -1 if not known.
     *
     * @return the column
     */
    public int getColumn() {
        if (location != null && location != JsonLocation.NA) {
            return location.getColumnNr();
        }
        return -1;
    }

    /**
     * Returns the line number of the problem, or -1 if not known.
     *
     * @return the line
     */
    public int getLine() {
        if (location != null && location != JsonLocation.NA) {
            return location.getLineNr();
        }
        return -1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getMessage()).append(" at line ");
        sb.append(lineToString()).append(", column ");
        sb.append(columnToString());
        return sb.toString();
    }

    private String lineToString() {
        return (getLine() >= 0 ? Integer.toString(getLine()) : "n/a");
    }

    private String columnToString() {
        return (getColumn() >= 0 ? Integer.toString(getColumn()) : "n/a");
    }
}
