package com.querysub.common.exception;

/**
 * Raised by {@link com.querysub.common.api.QueryEngine} implementations when a
 * statement cannot be prepared or executed.
 */
public class QueryException extends QuerySubException {

    private String sql;

    public QueryException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public QueryException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public QueryException withSql(String sql) {
        this.sql = sql;
        withContext("sql", sql);
        return this;
    }

    public String getSql() {
        return sql;
    }

    public static QueryException parseFailed(String sql, String reason) {
        return new QueryException(ErrorCode.QUERY_PARSE_FAILED, "Failed to parse sql statement: " + reason)
                .withSql(sql);
    }

    /**
     * Wraps a non-zero completion code reported by the engine.
     */
    public static QueryException executionFailed(String sql, int code) {
        QueryException ex = new QueryException(ErrorCode.QUERY_EXECUTION_FAILED,
                "Failed to query data, engine code: " + code)
                .withSql(sql);
        ex.withContext("engineCode", code);
        return ex;
    }
}
