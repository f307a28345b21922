package com.querysub.common.exception;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ErrorCodeTest {

    @Test
    void testCodesAreUnique() {
        Set<Integer> seen = new HashSet<>();
        for (ErrorCode errorCode : ErrorCode.values()) {
            assertTrue(seen.add(errorCode.getCode()), "duplicate code " + errorCode.getCode());
        }
    }

    @Test
    void testRetriableCodes() {
        assertTrue(ErrorCode.QUERY_EXECUTION_FAILED.isRetriable());
        assertTrue(ErrorCode.SUBSCRIPTION_RESOLUTION_FAILED.isRetriable());
        assertFalse(ErrorCode.QUERY_INVALID_KIND.isRetriable());
        assertFalse(ErrorCode.VALIDATION_INVALID_TOPIC.isRetriable());
    }
}
