package com.ryuqq.conductor.core.exception;

/**
 * 선택 가능한 에이전트가 하나도 없는 경우.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class NoAgentsAvailableException extends RuntimeException {

    public NoAgentsAvailableException(String message) {
        super(message);
    }
}
