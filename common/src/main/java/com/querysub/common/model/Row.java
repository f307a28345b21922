package com.querysub.common.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One row produced by the query engine.
 * {@code key} is the ordering column (typically a timestamp) used as the progress key.
 */
public class Row {
    private final long entityId;
    private final long key;
    private final List<Object> values;

    public Row(long entityId, long key, List<Object> values) {
        this.entityId = entityId;
        this.key = key;
        this.values = values == null ? Collections.emptyList() : Collections.unmodifiableList(values);
    }

    public long getEntityId() {
        return entityId;
    }

    public long getKey() {
        return key;
    }

    public List<Object> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Row row = (Row) o;
        return entityId == row.entityId &&
               key == row.key &&
               Objects.equals(values, row.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, key, values);
    }

    @Override
    public String toString() {
        return "Row{" +
               "entityId=" + entityId +
               ", key=" + key +
               ", values=" + values +
               '}';
    }
}
