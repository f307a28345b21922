package com.querysub.storage.watermark;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Sorted map of entity id to last acknowledged progress key, backed by a
 * sorted list with binary search.
 *
 * Contract relied on by reconciliation:
 * - {@link #rebuild} is the only way entities enter or leave the set
 * - {@link #advance} overwrites an existing key and never inserts
 *
 * Not thread-safe. The owning subscription serializes access.
 */
public class WatermarkSet {

    /**
     * Key meaning "never consumed"
     */
    public static final long MIN_SENTINEL = Long.MIN_VALUE;

    private List<WatermarkEntry> entries;

    public WatermarkSet() {
        this.entries = new ArrayList<>();
    }

    public WatermarkSet(int initialCapacity) {
        this.entries = new ArrayList<>(initialCapacity);
    }

    /**
     * @return Progress key for the entity, or {@code dflt} if the entity is not tracked
     */
    public long get(long entityId, long dflt) {
        int index = indexOf(entityId);
        if (index < 0) {
            return dflt;
        }
        return entries.get(index).getProgressKey();
    }

    public boolean contains(long entityId) {
        return indexOf(entityId) >= 0;
    }

    /**
     * Overwrite the key of a tracked entity. No monotonicity check.
     *
     * @return false if the entity is not tracked (set unchanged)
     */
    public boolean advance(long entityId, long newKey) {
        int index = indexOf(entityId);
        if (index < 0) {
            return false;
        }
        entries.set(index, entries.get(index).withProgressKey(newKey));
        return true;
    }

    /**
     * Replace the whole set, then sort by entity id.
     * When an entity id appears more than once the first occurrence wins.
     */
    public void rebuild(Collection<WatermarkEntry> newEntries) {
        List<WatermarkEntry> sorted = new ArrayList<>(newEntries);
        sorted.sort(WatermarkEntry.BY_ENTITY_ID);

        List<WatermarkEntry> unique = new ArrayList<>(sorted.size());
        for (WatermarkEntry entry : sorted) {
            if (unique.isEmpty() || unique.get(unique.size() - 1).getEntityId() != entry.getEntityId()) {
                unique.add(entry);
            }
        }
        this.entries = unique;
    }

    public void clear() {
        entries = new ArrayList<>();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Snapshot in ascending entity id order
     */
    public List<WatermarkEntry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    private int indexOf(long entityId) {
        int low = 0;
        int high = entries.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            long midId = entries.get(mid).getEntityId();
            if (midId < entityId) {
                low = mid + 1;
            } else if (midId > entityId) {
                high = mid - 1;
            } else {
                return mid;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "WatermarkSet" + entries;
    }
}
