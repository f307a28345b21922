package com.querysub.common.exception;

/**
 * Errors raised while creating a subscription or running one of its cycles.
 */
public class SubscriptionException extends QuerySubException {

    private String topic;

    public SubscriptionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public SubscriptionException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public SubscriptionException withTopic(String topic) {
        this.topic = topic;
        withContext("topic", topic);
        return this;
    }

    public String getTopic() {
        return topic;
    }

    public static SubscriptionException disconnected(String topic) {
        return new SubscriptionException(ErrorCode.SESSION_DISCONNECTED,
                "Connection disconnected, cannot subscribe to topic: " + topic)
                .withTopic(topic);
    }

    public static SubscriptionException invalidQueryKind(String topic, Object kind) {
        SubscriptionException ex = new SubscriptionException(ErrorCode.QUERY_INVALID_KIND,
                String.format("Only 'select' statement is allowed in subscription: topic=%s kind=%s", topic, kind))
                .withTopic(topic);
        ex.withContext("statementKind", kind);
        return ex;
    }

    public static SubscriptionException parseFailed(String topic, Throwable cause) {
        return new SubscriptionException(ErrorCode.QUERY_PARSE_FAILED,
                "Failed to parse sql statement for topic: " + topic, cause)
                .withTopic(topic);
    }

    public static SubscriptionException resolutionFailed(String topic, String reason, Throwable cause) {
        return new SubscriptionException(ErrorCode.SUBSCRIPTION_RESOLUTION_FAILED,
                String.format("Failed to retrieve table id: topic=%s reason=%s", topic, reason), cause)
                .withTopic(topic);
    }

    public static SubscriptionException syncFailed(String topic) {
        return new SubscriptionException(ErrorCode.SUBSCRIPTION_SYNC_FAILED,
                "Initial table synchronization failed for topic: " + topic)
                .withTopic(topic);
    }

    public static SubscriptionException invalidTopic(String topic, String reason) {
        return new SubscriptionException(ErrorCode.VALIDATION_INVALID_TOPIC,
                String.format("Invalid topic '%s': %s", topic, reason))
                .withTopic(topic);
    }

    public static SubscriptionException topicInUse(String sessionId, String topic) {
        SubscriptionException ex = new SubscriptionException(ErrorCode.SUBSCRIPTION_TOPIC_IN_USE,
                String.format("Topic already subscribed: session=%s topic=%s", sessionId, topic))
                .withTopic(topic);
        ex.withContext("sessionId", sessionId);
        return ex;
    }

    public static SubscriptionException resourceExhausted(String topic, Throwable cause) {
        return new SubscriptionException(ErrorCode.SUBSCRIPTION_RESOURCE_EXHAUSTED,
                "Out of memory while creating subscription: " + topic, cause)
                .withTopic(topic);
    }
}
