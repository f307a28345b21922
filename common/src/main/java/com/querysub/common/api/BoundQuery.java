package com.querysub.common.api;

import com.querysub.common.model.EntityTags;
import com.querysub.common.model.StatementKind;
import com.querysub.common.model.TargetKind;

import java.util.List;

/**
 * A parsed and validated query owned by one subscription.
 * Implementations are provided by the query engine.
 */
public interface BoundQuery extends AutoCloseable {

    /**
     * Query text as held by the engine. Persisted verbatim as the progress file guard.
     */
    String getSql();

    StatementKind getStatementKind();

    TargetKind getTargetKind();

    /**
     * Entity id of the target table. Meaningful only for {@link TargetKind#NORMAL_TABLE}.
     */
    long getEntityId();

    boolean isMultiEntity();

    void setMultiEntity(boolean multiEntity);

    /**
     * Cache per-partition table membership and tag bindings for a super table query.
     *
     * @param entities Matched tables, sorted by entity id
     */
    void bindEntities(List<EntityTags> entities);

    /**
     * Drop result buffers and rewind to the first partition.
     * Must keep the multi-entity flag.
     */
    void resetExecutionState();

    /**
     * Release engine resources held by this query
     */
    @Override
    void close();
}
