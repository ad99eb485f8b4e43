/**
 * 턴 루프 단계와 턴 결과.
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li>단계 전이는 {@link com.ryuqq.conductor.core.turn.TurnTransition}으로만 검증</li>
 *   <li>TERMINAL은 되돌릴 수 없음</li>
 *   <li>{@link com.ryuqq.conductor.core.turn.TurnResult}는 응답 또는 sentinel 중 하나만 보유</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.core.turn;
