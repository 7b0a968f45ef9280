/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import static io.dataapi.driver.util.CheckNull.requireNonEmpty;

import io.dataapi.driver.ops.Request;

/**
 * An {@link AuthorizationProvider} that sends the same application token
 * with every request.
 */
public class StaticTokenProvider implements AuthorizationProvider {

    private final String token;

    /**
     * Creates a provider for the token.
     *
     * @param token the application token
     *
     * @throws IllegalArgumentException if the token is null or empty
     */
    public StaticTokenProvider(String token) {
        requireNonEmpty(token, "StaticTokenProvider: token must be non-empty");
        this.token = token;
    }

    @Override
    public String getAuthorizationString(Request request) {
        return token;
    }

    @Override
    public void close() {
    }

    /* the token is a secret */
    @Override
    public String toString() {
        return "StaticTokenProvider[token=***]";
    }
}
