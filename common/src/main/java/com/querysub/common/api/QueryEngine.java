package com.querysub.common.api;

import com.querysub.common.exception.QueryException;

/**
 * Query engine abstraction: parsing, planning and execution against the store.
 */
public interface QueryEngine {

    /**
     * Parse, plan and validate a statement
     * @param sql Statement text
     * @return Bound query ready for repeated execution
     * @throws QueryException if the text cannot be parsed or planned
     */
    BoundQuery prepare(String sql) throws QueryException;

    /**
     * Submit a bound query for asynchronous execution.
     * {@code callback} is invoked exactly once, on success or failure.
     */
    void executeAsync(BoundQuery query, QueryCallback callback);

    /**
     * Run a one-shot statement and return its rows
     * @throws QueryException if the statement fails
     */
    RowSequence query(String sql) throws QueryException;
}
