package com.ryuqq.conductor.core.state;

/**
 * Random 전략 상태.
 *
 * @param currentSpeaker 직전에 선택된 에이전트 (null 가능)
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record RandomState(String currentSpeaker) implements StrategyState {

    /**
     * 발화자가 없는 초기 상태.
     *
     * @return RandomState
     */
    public static RandomState initial() {
        return new RandomState(null);
    }

    /**
     * 직전 발화자 존재 여부.
     *
     * @return currentSpeaker가 설정된 경우 true
     */
    public boolean hasCurrentSpeaker() {
        return currentSpeaker != null && !currentSpeaker.isBlank();
    }
}
