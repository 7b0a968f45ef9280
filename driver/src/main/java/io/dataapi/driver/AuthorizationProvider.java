/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import static io.dataapi.driver.util.HttpConstants.TOKEN_HEADER;

import io.netty.handler.codec.http.HttpHeaders;
import io.dataapi.driver.ops.Request;

/**
 * A callback interface used by the driver to obtain the credential sent
 * with each request. The credential is opaque to the driver; it is passed
 * to the service in the {@code Token} header.
 *
 * @see StaticTokenProvider
 */
public interface AuthorizationProvider {

    /**
     * Returns the credential to send with a request.
     *
     * @param request the request being processed
     *
     * @return the credential
     */
    public String getAuthorizationString(Request request);

    /**
     * Release resources provider is using.
     */
    public void close();

    /**
     * Validates the credential returned by
     * {@link #getAuthorizationString}.
     *
     * @param input the credential
     *
     * @throws IllegalArgumentException if it is null
     */
    public default void validateAuthString(String input) {
        if (input == null) {
            throw new IllegalArgumentException(
                "Configured AuthorizationProvider acquired an " +
                "unexpected null authorization string");
        }
    }

    /**
     * Sets the headers the service requires to authorize the request.
     *
     * @param authString the credential
     * @param request the request being processed
     * @param headers the request headers
     */
    public default void setRequiredHeaders(String authString,
                                           Request request,
                                           HttpHeaders headers) {
        if (authString != null) {
            headers.set(TOKEN_HEADER, authString);
        }
    }
}
