package com.querysub.common.api;

/**
 * Per-session bookkeeping of in-flight queries.
 * The engine registers a query when it is submitted; subscriptions detach
 * their query before each resubmission and after a terminal failure.
 */
public interface ActiveQueryRegistry {

    void register(BoundQuery query);

    /**
     * @return true if the query was registered
     */
    boolean remove(BoundQuery query);

    boolean contains(BoundQuery query);
}
