package com.querysub.common.model;

/**
 * Kind of table a prepared query reads from.
 */
public enum TargetKind {
    /**
     * A plain table with a single, fixed entity id
     */
    NORMAL_TABLE,

    /**
     * A table created from a super table template
     */
    CHILD_TABLE,

    /**
     * A template whose set of child tables can change at any time
     */
    SUPER_TABLE;

    public boolean isSingleEntity() {
        return this == NORMAL_TABLE;
    }
}
