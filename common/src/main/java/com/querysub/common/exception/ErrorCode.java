package com.querysub.common.exception;

/**
 * Error codes for the subscription engine.
 * Organized by category with structured codes for monitoring and alerting.
 */
public enum ErrorCode {

    // ==================== SESSION ERRORS (1xxx) ====================
    SESSION_DISCONNECTED(1001, "SESSION", false),

    // ==================== QUERY ERRORS (2xxx) ====================
    QUERY_PARSE_FAILED(2001, "QUERY", false),
    QUERY_INVALID_KIND(2002, "QUERY", false),
    QUERY_EXECUTION_FAILED(2003, "QUERY", true),
    QUERY_INTERRUPTED(2004, "QUERY", false),

    // ==================== SUBSCRIPTION ERRORS (3xxx) ====================
    SUBSCRIPTION_RESOLUTION_FAILED(3001, "SUBSCRIPTION", true),
    SUBSCRIPTION_TOPIC_IN_USE(3002, "SUBSCRIPTION", false),
    SUBSCRIPTION_RESOURCE_EXHAUSTED(3003, "SUBSCRIPTION", false),
    SUBSCRIPTION_SYNC_FAILED(3004, "SUBSCRIPTION", true),

    // ==================== PROGRESS ERRORS (4xxx) ====================
    PROGRESS_WRITE_FAILED(4001, "PROGRESS", true),
    PROGRESS_READ_FAILED(4002, "PROGRESS", true),
    PROGRESS_DELETE_FAILED(4003, "PROGRESS", true),
    PROGRESS_MALFORMED(4004, "PROGRESS", false),

    // ==================== VALIDATION ERRORS (8xxx) ====================
    VALIDATION_INVALID_TOPIC(8001, "VALIDATION", false),
    VALIDATION_INVALID_INTERVAL(8002, "VALIDATION", false),
    VALIDATION_INVALID_QUERY(8003, "VALIDATION", false);

    private final int code;
    private final String category;
    private final boolean retriable;

    ErrorCode(int code, String category, boolean retriable) {
        this.code = code;
        this.category = category;
        this.retriable = retriable;
    }

    public int getCode() {
        return code;
    }

    public String getCategory() {
        return category;
    }

    public boolean isRetriable() {
        return retriable;
    }
}
