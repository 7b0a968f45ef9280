/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.util;

import io.dataapi.driver.SDKVersion;

/**
 * Header names, media types and path components used by the HTTP layer.
 */
public class HttpConstants {

    /**
     * The header carrying the request id, used to correlate logs.
     */
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    /**
     * The header carrying the application token.
     */
    public static final String TOKEN_HEADER = "Token";

    public static final String CONTENT_TYPE = "Content-Type";

    public static final String CONTENT_LENGTH = "Content-Length";

    public static final String ACCEPT = "Accept";

    public static final String USER_AGENT = "User-Agent";

    public static final String APPLICATION_JSON =
        "application/json; charset=UTF-8";

    /**
     * The default path prefix of the JSON API, before keyspace and
     * collection.
     */
    public static final String DEFAULT_API_PATH = "/api/json/v1";

    public static final String userAgent = makeUserAgent();

    /**
     * Creates a URI path from the arguments, joined with "/"
     *
     * @param s the path components
     * @return the path
     */
    public static String makePath(String ... s) {
        StringBuilder sb = new StringBuilder();
        sb.append(s[0]);
        for (int i = 1; i < s.length; i++) {
            if (sb.length() == 0 || sb.charAt(sb.length() - 1) != '/') {
                sb.append("/");
            }
            sb.append(s[i]);
        }
        return sb.toString();
    }

    /**
     * Format: "DataAPI-JavaSDK/version (os info)"
     */
    private static String makeUserAgent() {
        String os = System.getProperty("os.name");
        String osVersion = System.getProperty("os.version");
        String javaVersion = System.getProperty("java.version");
        String javaVmName = System.getProperty("java.vm.name");
        StringBuilder sb = new StringBuilder();
        sb.append("DataAPI-JavaSDK/").append(SDKVersion.VERSION)
            .append(" (").append(os).append("/").append(osVersion)
            .append("; ").append(javaVersion).append("/")
            .append(javaVmName).append(")");
        return sb.toString();
    }
}
