package com.querysub.common.api;

/**
 * An authenticated connection to the store.
 */
public interface Session {

    String getId();

    /**
     * @return true while the connection is live and validated
     */
    boolean isConnected();

    QueryEngine getQueryEngine();

    ActiveQueryRegistry getActiveQueries();
}
