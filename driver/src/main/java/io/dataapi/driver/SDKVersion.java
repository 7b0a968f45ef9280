/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package io.dataapi.driver;
/**
 * Public class to manage SDK version information
 */
public class SDKVersion {
    /**
     * The full X.Y.Z version of the current SDK
     */
    public static final String VERSION = "1.0.0";
}
