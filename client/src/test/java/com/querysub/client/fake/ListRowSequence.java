package com.querysub.client.fake;

import com.querysub.common.api.RowSequence;
import com.querysub.common.model.Row;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Single-pass row sequence over a fixed list.
 */
public class ListRowSequence implements RowSequence {
    private final Iterator<Row> iterator;
    private volatile boolean closed;

    public ListRowSequence(List<Row> rows) {
        this.iterator = new ArrayList<>(rows).iterator();
    }

    @Override
    public Row fetchRow() {
        if (closed || !iterator.hasNext()) {
            return null;
        }
        return iterator.next();
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
