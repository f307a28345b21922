package com.querysub.storage.progress;

/**
 * Result of reading a progress file.
 * Anything other than {@link #LOADED} means the caller starts cold.
 */
public enum LoadOutcome {
    LOADED,
    NOT_FOUND,
    QUERY_MISMATCH,
    MALFORMED,
    READ_FAILED;

    public boolean isLoaded() {
        return this == LOADED;
    }
}
