/**
 * Conductor Application Layer - 워크플로 조정 API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.application.orchestrator.OrchestratorWorkflow} - 턴 루프 조정자</li>
 *   <li>{@link com.ryuqq.conductor.application.orchestrator.OrchestratorConfig} - 조정자 설정</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.application.orchestrator;
