/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops.serde;

import io.dataapi.driver.ops.Request;
import io.dataapi.driver.ops.Result;
import io.dataapi.driver.values.MapValue;

/**
 * @hidden
 *
 * Converts a request to the JSON command document sent to the service and
 * converts the response document to a typed result. Implementations are
 * stateless and shared.
 */
public interface Serializer {

    /**
     * Returns the command document, a single entry map keyed by the
     * command name.
     *
     * @param request the request
     *
     * @return the command
     */
    MapValue serialize(Request request);

    /**
     * Builds the result from a response without errors.
     *
     * @param request the request the response answers
     * @param response the response document
     *
     * @return the result
     */
    Result deserialize(Request request, MapValue response);
}
