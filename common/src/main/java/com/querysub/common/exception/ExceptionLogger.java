package com.querysub.common.exception;

import org.slf4j.Logger;

/**
 * Structured exception logging shared by all modules.
 */
public class ExceptionLogger {

    public static void logError(Logger log, QuerySubException ex) {
        log.error(ex.getStructuredMessage(), ex.getCause() != null ? ex.getCause() : ex);
    }

    public static void logWarn(Logger log, QuerySubException ex) {
        log.warn(ex.getStructuredMessage(), ex.getCause() != null ? ex.getCause() : ex);
    }

    /**
     * Retriable: WARN, Non-retriable: ERROR
     */
    public static void logConditional(Logger log, QuerySubException ex) {
        if (ex.isRetriable()) {
            logWarn(log, ex);
        } else {
            logError(log, ex);
        }
    }

    /**
     * Log exception and rethrow it
     */
    public static <T extends QuerySubException> T logAndThrow(Logger log, T ex) throws T {
        logError(log, ex);
        throw ex;
    }
}
