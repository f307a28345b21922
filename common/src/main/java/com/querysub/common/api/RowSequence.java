package com.querysub.common.api;

import com.querysub.common.model.Row;

/**
 * Lazy, single-pass cursor over the rows of one query execution.
 * Not restartable: once a row is fetched it cannot be read again.
 */
public interface RowSequence extends AutoCloseable {

    /**
     * Fetch the next row
     * @return Next row, or null when the sequence is exhausted
     */
    Row fetchRow();

    /**
     * Release engine-side buffers held by this sequence
     */
    @Override
    void close();
}
