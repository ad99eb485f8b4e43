package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.contract.AgentTaskResponse;
import com.ryuqq.conductor.core.spi.WorkflowContext;
import com.ryuqq.conductor.core.turn.TurnResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Turn Executor.
 *
 * <p>trigger 이후 에이전트 응답 이벤트와 타이머를 경쟁시켜 먼저 완료된 쪽으로 턴 결과를 만듭니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>{@value #AGENT_RESPONSE_EVENT} 외부 이벤트 대기 등록</li>
 *   <li>timeoutMillis 타이머 시작</li>
 *   <li>먼저 완료된 쪽이 내부 결과 future를 완료 (이후 완료는 무시)</li>
 *   <li>다른 에이전트 이름의 응답(이전 턴에서 타임아웃된 늦은 응답)은 버리고, 같은 타이머로 다시 대기</li>
 *   <li>진 쪽은 취소하며, 그 결과는 어떤 경우에도 사용하지 않음</li>
 * </ol>
 *
 * <p>이름이 없는 응답은 trigger된 에이전트의 응답으로 간주합니다.</p>
 *
 * <p>응답이 이긴 경우 {@link TurnResult#responded}, 타이머가 이긴 경우
 * {@link AgentTaskResponse#timeout()} sentinel을 담은 {@link TurnResult#timedOut}을 반환합니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class TurnExecutor {

    /**
     * 에이전트 응답 외부 이벤트 이름.
     */
    public static final String AGENT_RESPONSE_EVENT = "AgentTaskResponse";

    private static final Logger log = LoggerFactory.getLogger(TurnExecutor.class);

    /**
     * 응답 또는 타임아웃까지 대기.
     *
     * @param context 워크플로 컨텍스트
     * @param turn 턴 번호
     * @param agentName trigger된 에이전트
     * @param timeoutMillis 응답 대기 시간 (밀리초)
     * @return 턴 결과
     * @throws IllegalArgumentException context 또는 agentName이 null이거나 timeoutMillis가 양수가 아닌 경우
     * @throws RuntimeException 대기가 인터럽트되거나 런타임이 이벤트 대기를 실패시킨 경우
     */
    public TurnResult awaitTurn(WorkflowContext context, int turn, String agentName, long timeoutMillis) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agentName cannot be null or blank");
        }
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeoutMillis must be positive (current: " + timeoutMillis + ")");
        }

        CompletableFuture<AgentTaskResponse> response = context.waitForExternalEvent(AGENT_RESPONSE_EVENT);
        CompletableFuture<Void> timer = context.createTimer(timeoutMillis);

        while (true) {
            TurnResult result = await(race(response, timer, turn, agentName));

            if (result.timedOut()) {
                response.cancel(false);
                log.warn("Turn {} timed out after {} ms waiting for {} (instance {})",
                    turn, timeoutMillis, agentName, context.instanceId());
                return result;
            }
            if (isFrom(agentName, result.response())) {
                timer.cancel(false);
                log.debug("Turn {} answered by {} (instance {})", turn, agentName, context.instanceId());
                return result;
            }

            log.warn("Turn {} discarded stale reply from {} while waiting for {} (instance {})",
                turn, result.response().name(), agentName, context.instanceId());
            response = context.waitForExternalEvent(AGENT_RESPONSE_EVENT);
        }
    }

    private CompletableFuture<TurnResult> race(
        CompletableFuture<AgentTaskResponse> response,
        CompletableFuture<Void> timer,
        int turn,
        String agentName
    ) {
        CompletableFuture<TurnResult> winner = new CompletableFuture<>();
        response.whenComplete((reply, error) -> {
            if (error == null) {
                winner.complete(TurnResult.responded(turn, agentName, reply));
            } else if (!(error instanceof CancellationException)) {
                winner.completeExceptionally(error);
            }
        });
        timer.whenComplete((ignored, error) -> {
            if (error == null) {
                winner.complete(TurnResult.timedOut(turn, agentName));
            } else if (!(error instanceof CancellationException)) {
                winner.completeExceptionally(error);
            }
        });
        return winner;
    }

    private static boolean isFrom(String agentName, AgentTaskResponse reply) {
        return reply.name() == null || agentName.equals(reply.name());
    }

    private TurnResult await(CompletableFuture<TurnResult> winner) {
        try {
            return winner.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Turn wait interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new RuntimeException("Turn wait failed", cause);
        }
    }
}
