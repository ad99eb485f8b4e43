package com.ryuqq.conductor.core.contract;

import com.ryuqq.conductor.core.model.MessageRole;

import java.time.Instant;

/**
 * 실행 시작 시 모든 에이전트에게 전파되는 메시지.
 *
 * <p>생성 후 변경되지 않습니다.</p>
 *
 * @param role 발신 역할
 * @param content 메시지 본문
 * @param name 발신자 이름 (null 가능)
 * @param timestamp 생성 시각 (null 가능)
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record BroadcastMessage(
    MessageRole role,
    String content,
    String name,
    Instant timestamp
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException role 또는 content가 null인 경우
     */
    public BroadcastMessage {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }

    /**
     * 사용자 역할의 broadcast 메시지 생성 (현재 시각).
     *
     * @param content 메시지 본문
     * @return BroadcastMessage
     */
    public static BroadcastMessage fromUser(String content) {
        return new BroadcastMessage(MessageRole.USER, content, null, Instant.now());
    }
}
