package com.querysub.common.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A table matched by a subscription query together with its tag values.
 */
public class EntityTags {

    /**
     * Orders by entity id, the order partition membership is built in
     */
    public static final Comparator<EntityTags> BY_ENTITY_ID = Comparator.comparingLong(EntityTags::getEntityId);

    private final long entityId;
    private final List<Object> tags;

    public EntityTags(long entityId, List<Object> tags) {
        this.entityId = entityId;
        this.tags = tags == null ? Collections.emptyList() : Collections.unmodifiableList(tags);
    }

    public long getEntityId() {
        return entityId;
    }

    public List<Object> getTags() {
        return tags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityTags that = (EntityTags) o;
        return entityId == that.entityId && Objects.equals(tags, that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, tags);
    }

    @Override
    public String toString() {
        return "EntityTags{entityId=" + entityId + ", tags=" + tags + '}';
    }
}
