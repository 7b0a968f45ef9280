/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.dataapi.driver.values.MapValue;

/**
 * Thrown when a command response carries an "errors" array. The service
 * may have applied part of the command before failing; results that report
 * partial progress are carried by the subclasses.
 */
public class DataAPIResponseException extends DataAPIException {

    private static final long serialVersionUID = 1L;

    private final List<ErrorDescriptor> errors;

    /* the full response, its status may report partial progress */
    private final transient MapValue response;

    /**
     * @hidden
     * @param command the command that failed
     * @param errors the errors reported, must not be empty
     */
    public DataAPIResponseException(String command,
                                    List<ErrorDescriptor> errors) {
        this(command, errors, (MapValue) null);
    }

    /**
     * @hidden
     * @param command the command that failed
     * @param errors the errors reported, must not be empty
     * @param response the response document, may be null
     */
    public DataAPIResponseException(String command,
                                    List<ErrorDescriptor> errors,
                                    MapValue response) {
        super(makeMessage(command, errors));
        this.errors = Collections.unmodifiableList(
            new ArrayList<ErrorDescriptor>(errors));
        this.response = response;
    }

    /**
     * @hidden
     * @param msg the message
     * @param errors the errors reported
     * @param cause the cause, may be null
     */
    protected DataAPIResponseException(String msg,
                                       List<ErrorDescriptor> errors,
                                       Throwable cause) {
        super(msg, cause);
        this.errors = Collections.unmodifiableList(
            new ArrayList<ErrorDescriptor>(errors));
        this.response = null;
    }

    /**
     * Returns the errors reported by the service.
     *
     * @return the errors
     */
    public List<ErrorDescriptor> getErrors() {
        return errors;
    }

    /**
     * Returns the response that carried the errors, or null if not
     * available.
     *
     * @return the response
     */
    public MapValue getResponse() {
        return response;
    }

    static String makeMessage(String command, List<ErrorDescriptor> errors) {
        StringBuilder sb = new StringBuilder();
        sb.append("Command \"").append(command).append("\" failed: ");
        if (errors.isEmpty()) {
            sb.append("unknown error");
        } else {
            sb.append(errors.get(0));
            if (errors.size() > 1) {
                sb.append(" (+").append(errors.size() - 1)
                    .append(" more errors)");
            }
        }
        return sb.toString();
    }
}
