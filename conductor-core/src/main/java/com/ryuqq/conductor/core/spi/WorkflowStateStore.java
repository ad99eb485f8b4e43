package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.state.WorkflowState;

import java.util.Optional;

/**
 * 워크플로 상태 저장소 SPI.
 *
 * <p>오케스트레이터는 매 턴 종료와 인스턴스 종료 시 전체 {@link WorkflowState} 스냅샷을 저장합니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>동일 key에 대한 save는 덮어쓰기</li>
 *   <li>thread-safe (여러 인스턴스가 동시에 저장 가능)</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface WorkflowStateStore {

    /**
     * 상태 스냅샷 저장.
     *
     * @param key 상태 키 (예: workflow_state)
     * @param state 저장할 상태
     * @throws IllegalArgumentException key가 blank이거나 state가 null인 경우
     */
    void save(String key, WorkflowState state);

    /**
     * 상태 스냅샷 조회.
     *
     * @param key 상태 키
     * @return 저장된 상태 (없으면 empty)
     */
    Optional<WorkflowState> load(String key);
}
