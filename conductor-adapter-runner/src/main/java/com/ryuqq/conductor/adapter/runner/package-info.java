/**
 * Runner Adapter Layer - 워크플로 조정자 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.TurnBasedOrchestrator} - 턴 루프 공통 구현</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.RandomOrchestrator} - 무작위 발화자</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.RoundRobinOrchestrator} - 순환 발화자</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.TurnExecutor} - 응답/타임아웃 경쟁</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (TurnBasedOrchestrator)
 *   ↓ implements
 * application (OrchestratorWorkflow, TurnListener)
 *   ↓ depends on
 * core (state, selection, turn)
 *   ↓ depends on
 * core/spi (AgentRegistry, MessageBus, WorkflowRuntime, WorkflowStateStore)
 * </pre>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.adapter.runner;
