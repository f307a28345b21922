package com.querysub.client;

import com.querysub.common.api.BoundQuery;
import com.querysub.common.api.QueryEngine;
import com.querysub.common.api.RowSequence;
import com.querysub.common.exception.QueryException;
import com.querysub.common.exception.SubscriptionException;
import com.querysub.common.model.EntityTags;
import com.querysub.common.model.Row;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Discovers the tables currently matched by a subscription query.
 *
 * Runs a derived metadata query that keeps the original {@code from ...}
 * clause (and with it the filter predicate) but projects table id and tags
 * instead of data columns.
 */
@Singleton
public class EntityResolver {
    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    static final String TABLE_ID_PROJECTION = "select tbid(tbname)";
    private static final String FROM_CLAUSE = " from ";

    /**
     * @param engine Engine of the subscription's session
     * @param query Bound subscription query
     * @param topic Topic, for error context
     * @return Every matched table with its tag values, in engine order
     * @throws SubscriptionException if the tables cannot be resolved
     */
    public List<EntityTags> resolve(QueryEngine engine, BoundQuery query, String topic) throws SubscriptionException {
        String sql = deriveTableIdQuery(query.getSql(), topic);

        RowSequence rows;
        try {
            rows = engine.query(sql);
        } catch (QueryException e) {
            throw SubscriptionException.resolutionFailed(topic, e.getErrorCode().name(), e);
        }
        if (rows == null) {
            throw SubscriptionException.resolutionFailed(topic, "cannot create new sql object", null);
        }

        List<EntityTags> result = new ArrayList<>();
        try (RowSequence cursor = rows) {
            Row row;
            while ((row = cursor.fetchRow()) != null) {
                result.add(new EntityTags(row.getEntityId(), row.getValues()));
            }
        } catch (RuntimeException e) {
            throw SubscriptionException.resolutionFailed(topic, "failed reading table ids", e);
        }

        log.debug("Resolved {} tables for topic={}", result.size(), topic);
        return result;
    }

    /**
     * Replace the projection of {@code sql} with the table id projection.
     */
    static String deriveTableIdQuery(String sql, String topic) throws SubscriptionException {
        int from = sql.toLowerCase(Locale.ROOT).indexOf(FROM_CLAUSE);
        if (from < 0) {
            throw SubscriptionException.resolutionFailed(topic, "no from clause in: " + sql, null);
        }
        return TABLE_ID_PROJECTION + sql.substring(from);
    }
}
