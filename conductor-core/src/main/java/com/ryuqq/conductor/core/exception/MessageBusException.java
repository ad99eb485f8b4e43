package com.ryuqq.conductor.core.exception;

/**
 * 메시지 버스 publish 실패.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class MessageBusException extends RuntimeException {

    private final String topic;

    public MessageBusException(String topic, String message) {
        super(message);
        this.topic = topic;
    }

    public MessageBusException(String topic, String message, Throwable cause) {
        super(message, cause);
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}
