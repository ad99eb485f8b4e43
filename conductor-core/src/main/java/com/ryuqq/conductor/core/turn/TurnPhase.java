package com.ryuqq.conductor.core.turn;

/**
 * 턴 루프의 진행 단계.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * INIT
 *   │
 *   ▼ (turn 1)
 * BROADCAST
 *   │
 *   ▼
 * SELECT ◄──────────────┐
 *   │                   │ (turn &lt; maxIterations)
 *   ▼                   │
 * TRIGGER               │
 *   │                   │
 *   ▼                   │
 * AWAIT                 │
 *   │                   │
 *   ├─► RESPONDED ──────┤
 *   │                   │
 *   └─► TIMED_OUT ──────┘
 *
 * RESPONDED, TIMED_OUT ─► TERMINAL (turn == maxIterations)
 * INIT ─► TERMINAL (선택 가능한 에이전트 없음)
 * </pre>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public enum TurnPhase {

    /**
     * 인스턴스 시작 직후.
     */
    INIT,

    /**
     * 첫 턴의 작업 브로드캐스트.
     */
    BROADCAST,

    /**
     * 다음 발화자 선택.
     */
    SELECT,

    /**
     * 선택된 에이전트에 trigger 발행.
     */
    TRIGGER,

    /**
     * 응답과 타이머 중 먼저 완료되는 쪽을 대기.
     */
    AWAIT,

    RESPONDED,

    TIMED_OUT,

    /**
     * 최종 출력 반환됨.
     */
    TERMINAL;

    /**
     * 턴 하나가 끝난 단계인지 확인.
     *
     * @return RESPONDED 또는 TIMED_OUT인 경우 true
     */
    public boolean isTurnEnd() {
        return this == RESPONDED || this == TIMED_OUT;
    }

    public boolean isTerminal() {
        return this == TERMINAL;
    }
}
