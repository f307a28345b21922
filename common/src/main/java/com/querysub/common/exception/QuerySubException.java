package com.querysub.common.exception;

import java.util.HashMap;
import java.util.Map;

/**
 * Base exception for all subscription engine errors.
 * Carries an {@link ErrorCode} plus free-form context for logging and monitoring.
 */
public class QuerySubException extends Exception {

    private final ErrorCode errorCode;
    private final Map<String, Object> context;
    private final boolean retriable;

    public QuerySubException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.context = new HashMap<>();
        this.retriable = errorCode.isRetriable();
    }

    public QuerySubException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = new HashMap<>();
        this.retriable = errorCode.isRetriable();
    }

    public QuerySubException withContext(String key, Object value) {
        this.context.put(key, value);
        return this;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isRetriable() {
        return retriable;
    }

    /**
     * Single-line structured form used by {@link ExceptionLogger}.
     */
    public String getStructuredMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(errorCode.name()).append("]");
        sb.append(" category=").append(errorCode.getCategory());
        sb.append(", code=").append(errorCode.getCode());
        sb.append(", retriable=").append(retriable);
        sb.append(", message=").append(getMessage());

        if (!context.isEmpty()) {
            sb.append(", context={");
            context.forEach((k, v) -> sb.append(k).append("=").append(v).append(", "));
            sb.delete(sb.length() - 2, sb.length());
            sb.append("}");
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return getStructuredMessage();
    }
}
