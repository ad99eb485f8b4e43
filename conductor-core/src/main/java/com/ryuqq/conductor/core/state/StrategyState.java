package com.ryuqq.conductor.core.state;

/**
 * 선택 전략의 인스턴스별 상태.
 *
 * <p>오케스트레이터 필드가 아닌 {@link OrchestratorState}를 통해 턴마다 전달되므로,
 * 하나의 오케스트레이터 객체가 여러 인스턴스를 동시에 실행해도 상태가 섞이지 않습니다.</p>
 *
 * <ul>
 *   <li>{@link RandomState}: 직전 발화자</li>
 *   <li>{@link RoundRobinState}: 현재 인덱스와 고정된 에이전트 목록</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public sealed interface StrategyState permits RandomState, RoundRobinState {
}
