package com.ryuqq.conductor.core.selection;

import java.util.Locale;

/**
 * 발화자 선택 전략 태그.
 *
 * <p>새 전략은 이 enum에 태그를 추가하고 {@link SelectionStrategy} 구현을 제공하는 방식으로 확장합니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public enum StrategyType {

    /**
     * 직전 발화자를 제외한 균등 무작위 선택.
     */
    RANDOM("random"),

    /**
     * 레지스트리 순서대로 순환 선택.
     */
    ROUND_ROBIN("roundrobin");

    private final String tag;

    StrategyType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * 태그 문자열로 전략 조회 (대소문자, '-', '_' 무시).
     *
     * @param value 태그 (예: "random", "round-robin", "ROUND_ROBIN")
     * @return StrategyType
     * @throws IllegalArgumentException value가 null이거나 알 수 없는 태그인 경우
     */
    public static StrategyType fromTag(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("strategy tag cannot be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (StrategyType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown strategy tag: " + value);
    }
}
