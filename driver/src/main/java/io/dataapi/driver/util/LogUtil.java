/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods to facilitate Logging. All methods accept a null logger,
 * in which case nothing is logged.
 */
public class LogUtil {

    public static boolean isFineEnabled(Logger logger) {
        return logger != null && logger.isLoggable(Level.FINE);
    }

    public static void logWarning(Logger logger, String msg) {
        if (logger != null) {
            logger.log(Level.WARNING, msg);
        }
    }

    public static void logFine(Logger logger, String msg) {
        if (logger != null) {
            logger.log(Level.FINE, msg);
        }
    }

    /**
     * Logs a message at FINE tagged with the request id and command name,
     * as "[id] command: msg". The message is only assembled if FINE is
     * enabled.
     *
     * @param logger the logger, may be null
     * @param requestId the request id
     * @param command the Data API command name
     * @param msg the message
     */
    public static void logRequest(Logger logger,
                                  String requestId,
                                  String command,
                                  String msg) {
        if (isFineEnabled(logger)) {
            logger.log(Level.FINE,
                       "[" + requestId + "] " + command + ": " + msg);
        }
    }
}
