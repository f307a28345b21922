package com.querysub.common.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class QuerySubExceptionTest {

    @Test
    void testStructuredMessage() {
        SubscriptionException ex = SubscriptionException.topicInUse("s1", "meters");

        String message = ex.getStructuredMessage();

        assertTrue(message.startsWith("[SUBSCRIPTION_TOPIC_IN_USE] category=SUBSCRIPTION, code=3002, retriable=false"));
        assertTrue(message.contains("topic=meters"));
        assertTrue(message.contains("sessionId=s1"));
        assertEquals(message, ex.toString());
    }

    @Test
    void testStructuredMessageWithoutContext() {
        QuerySubException ex = new QuerySubException(ErrorCode.QUERY_EXECUTION_FAILED, "boom");

        assertEquals("[QUERY_EXECUTION_FAILED] category=QUERY, code=2003, retriable=true, message=boom",
                ex.getStructuredMessage());
    }

    @Test
    void testQueryExecutionFailureCarriesEngineCode() {
        QueryException ex = QueryException.executionFailed("select * from meters", 0x0201);

        assertEquals(ErrorCode.QUERY_EXECUTION_FAILED, ex.getErrorCode());
        assertEquals("select * from meters", ex.getSql());
        assertTrue(ex.getStructuredMessage().contains("engineCode=513"));
        assertTrue(ex.isRetriable());
    }

    @Test
    void testResolutionFailureKeepsCause() {
        QueryException cause = QueryException.parseFailed("select tbid(tbname) from meters", "no such table");

        SubscriptionException ex = SubscriptionException.resolutionFailed("meters", "parse", cause);

        assertSame(cause, ex.getCause());
        assertEquals("meters", ex.getTopic());
        assertEquals(ErrorCode.SUBSCRIPTION_RESOLUTION_FAILED, ex.getErrorCode());
    }

    @Test
    void testProgressFailures() {
        ProgressStoreException write = ProgressStoreException.writeFailed("meters", "/data/subscribe/meters",
                new IOException("disk full"));
        ProgressStoreException malformed = ProgressStoreException.malformed("meters", "/data/subscribe/meters",
                3, "abc");

        assertEquals("/data/subscribe/meters", write.getPath());
        assertTrue(write.isRetriable());
        assertEquals(ErrorCode.PROGRESS_MALFORMED, malformed.getErrorCode());
        assertTrue(malformed.getStructuredMessage().contains("content=abc"));
        assertFalse(malformed.isRetriable());
    }
}
