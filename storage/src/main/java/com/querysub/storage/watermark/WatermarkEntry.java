package com.querysub.storage.watermark;

import java.util.Comparator;
import java.util.Objects;

/**
 * Last acknowledged progress key for one entity.
 * Rows with this key or earlier have been consumed for the entity.
 */
public final class WatermarkEntry {

    /**
     * Entries are ordered solely by entity id
     */
    public static final Comparator<WatermarkEntry> BY_ENTITY_ID = Comparator.comparingLong(WatermarkEntry::getEntityId);

    private final long entityId;
    private final long progressKey;

    public WatermarkEntry(long entityId, long progressKey) {
        this.entityId = entityId;
        this.progressKey = progressKey;
    }

    public long getEntityId() {
        return entityId;
    }

    public long getProgressKey() {
        return progressKey;
    }

    WatermarkEntry withProgressKey(long newKey) {
        return new WatermarkEntry(entityId, newKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WatermarkEntry that = (WatermarkEntry) o;
        return entityId == that.entityId && progressKey == that.progressKey;
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, progressKey);
    }

    @Override
    public String toString() {
        return entityId + ":" + progressKey;
    }
}
