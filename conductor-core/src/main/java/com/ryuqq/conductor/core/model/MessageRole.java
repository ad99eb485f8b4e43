package com.ryuqq.conductor.core.model;

/**
 * 메시지 발신 역할.
 *
 * <p>버스 위에서는 소문자 wire 값({@code user}, {@code assistant}, {@code system}, {@code tool})으로 표현됩니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public enum MessageRole {

    USER("user"),
    ASSISTANT("assistant"),
    SYSTEM("system"),
    TOOL("tool");

    private final String wireValue;

    MessageRole(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * wire 표현 조회.
     *
     * @return 소문자 역할 이름
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * wire 값으로부터 역할 복원 (대소문자 무시).
     *
     * @param value wire 값
     * @return MessageRole
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static MessageRole fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("role cannot be null or blank");
        }
        for (MessageRole role : values()) {
            if (role.wireValue.equalsIgnoreCase(value.trim())) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown message role: " + value);
    }
}
