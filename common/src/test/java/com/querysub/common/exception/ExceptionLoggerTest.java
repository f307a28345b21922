package com.querysub.common.exception;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class ExceptionLoggerTest {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger("com.querysub.test.ExceptionLoggerTest");
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        appender.stop();
    }

    @Test
    void testConditionalLevel() {
        ExceptionLogger.logConditional(logger, QueryException.executionFailed("select * from t", 1));
        ExceptionLogger.logConditional(logger, SubscriptionException.invalidTopic("a/b", "bad"));

        assertEquals(2, appender.list.size());
        assertEquals(Level.WARN, appender.list.get(0).getLevel());
        assertEquals(Level.ERROR, appender.list.get(1).getLevel());
        assertTrue(appender.list.get(1).getFormattedMessage().startsWith("[VALIDATION_INVALID_TOPIC]"));
    }

    @Test
    void testLogAndThrow() {
        SubscriptionException ex = SubscriptionException.disconnected("meters");

        SubscriptionException thrown = assertThrows(SubscriptionException.class,
                () -> ExceptionLogger.logAndThrow(logger, ex));

        assertSame(ex, thrown);
        assertEquals(1, appender.list.size());
        assertEquals(Level.ERROR, appender.list.get(0).getLevel());
    }
}
