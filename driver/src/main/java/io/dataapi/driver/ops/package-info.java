/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
/**
 * Request and result classes of the Data API commands, the typed
 * projection and sort specifications, and the {@link
 * io.dataapi.driver.ops.Cursor} that pages through the results of a find.
 */
package io.dataapi.driver.ops;
