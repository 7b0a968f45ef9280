/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

import static io.dataapi.driver.util.CheckNull.requireNonNull;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * A {@link FieldValue} instance representing a point in time with
 * millisecond precision. On the wire a timestamp is the object
 * <code>{"$date": millis}</code>, where millis is the number of milliseconds
 * since the epoch, UTC.
 */
public class TimestampValue extends FieldValue {

    /**
     * The name of the field that marks an object as a timestamp.
     */
    public static final String DATE_FIELD = "$date";

    private final long millis;

    /**
     * Creates a new instance from milliseconds since the epoch.
     *
     * @param millis the value to use
     */
    public TimestampValue(long millis) {
        super();
        this.millis = millis;
    }

    public TimestampValue(Timestamp value) {
        super();
        requireNonNull(value, "TimestampValue: value must be non-null");
        this.millis = value.getTime();
    }

    /**
     * Creates a new instance from an ISO 8601 string such as
     * "2025-01-01T00:00:00Z".
     *
     * @param value the value to use
     *
     * @throws java.time.format.DateTimeParseException if the value cannot
     * be parsed
     */
    public TimestampValue(String value) {
        this(Instant.parse(value).toEpochMilli());
    }

    @Override
    public Type getType() {
        return Type.TIMESTAMP;
    }

    public Timestamp getValue() {
        return new Timestamp(millis);
    }

    @Override
    public long getLong() {
        return millis;
    }

    @Override
    public BigDecimal getNumber() {
        return new BigDecimal(millis);
    }

    /**
     * Returns the value as an ISO 8601 string in UTC.
     */
    @Override
    public String getString() {
        return Instant.ofEpochMilli(millis).toString();
    }

    @Override
    public int compareTo(FieldValue other) {
        if (other instanceof TimestampValue) {
            return Long.compare(millis, ((TimestampValue)other).millis);
        }
        throw new ClassCastException("Object is not a TimestampValue");
    }

    @Override
    public String toJson() {
        return "{\"" + DATE_FIELD + "\":" + millis + "}";
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof TimestampValue) {
            return millis == ((TimestampValue)other).millis;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(millis);
    }
}
