package com.querysub.common.exception;

/**
 * Exception for progress file I/O. Never escapes the progress store;
 * it exists so failures are logged with a consistent shape.
 */
public class ProgressStoreException extends QuerySubException {

    private String topic;
    private String path;

    public ProgressStoreException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ProgressStoreException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public ProgressStoreException withTopic(String topic) {
        this.topic = topic;
        withContext("topic", topic);
        return this;
    }

    public ProgressStoreException withPath(String path) {
        this.path = path;
        withContext("path", path);
        return this;
    }

    public String getTopic() {
        return topic;
    }

    public String getPath() {
        return path;
    }

    public static ProgressStoreException writeFailed(String topic, String path, Throwable cause) {
        return new ProgressStoreException(ErrorCode.PROGRESS_WRITE_FAILED,
                "Failed to create progress file for subscription: " + topic, cause)
                .withTopic(topic)
                .withPath(path);
    }

    public static ProgressStoreException readFailed(String topic, String path, Throwable cause) {
        return new ProgressStoreException(ErrorCode.PROGRESS_READ_FAILED,
                "Failed to read progress file for subscription: " + topic, cause)
                .withTopic(topic)
                .withPath(path);
    }

    public static ProgressStoreException deleteFailed(String topic, String path, Throwable cause) {
        return new ProgressStoreException(ErrorCode.PROGRESS_DELETE_FAILED,
                "Failed to remove progress file, topic = " + topic, cause)
                .withTopic(topic)
                .withPath(path);
    }

    public static ProgressStoreException malformed(String topic, String path, int lineNumber, String line) {
        ProgressStoreException ex = new ProgressStoreException(ErrorCode.PROGRESS_MALFORMED,
                String.format("Invalid subscription progress file: topic=%s line=%d", topic, lineNumber))
                .withTopic(topic)
                .withPath(path);
        ex.withContext("content", line);
        return ex;
    }
}
