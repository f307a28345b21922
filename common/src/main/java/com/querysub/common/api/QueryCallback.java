package com.querysub.common.api;

/**
 * Completion handler for {@link QueryEngine#executeAsync}.
 * The engine invokes it exactly once per submission, from any thread.
 */
@FunctionalInterface
public interface QueryCallback {

    /**
     * @param rows Result rows, null when {@code code} is non-zero
     * @param code 0 on success, engine-specific error code otherwise
     */
    void onComplete(RowSequence rows, int code);
}
