package com.querysub.common.model;

/**
 * Kind of statement reported by the query engine after preparation.
 */
public enum StatementKind {
    SELECT,
    INSERT,
    CREATE,
    DROP,
    ALTER,
    OTHER;

    /**
     * Only row-producing statements can back a subscription.
     */
    public boolean isRowProducing() {
        return this == SELECT;
    }
}
