package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.observe.TurnListener;
import com.ryuqq.conductor.core.turn.TurnResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * slf4j로 턴 진행 상황을 기록하는 리스너.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class LoggingTurnListener implements TurnListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingTurnListener.class);

    @Override
    public void onRunStarted(String instanceId, String task) {
        log.info("[{}] run started: {}", instanceId, task);
    }

    @Override
    public void onBroadcast(String instanceId, int delivered, int failed) {
        if (failed > 0) {
            log.warn("[{}] broadcast delivered to {} agents, {} failed", instanceId, delivered, failed);
        } else {
            log.info("[{}] broadcast delivered to {} agents", instanceId, delivered);
        }
    }

    @Override
    public void onAgentSelected(String instanceId, int turn, String agentName) {
        log.info("[{}] turn {}: {} selected", instanceId, turn, agentName);
    }

    @Override
    public void onTurnCompleted(String instanceId, TurnResult result) {
        if (result.timedOut()) {
            log.warn("[{}] turn {}: {} did not respond in time", instanceId, result.turn(), result.agentName());
        } else {
            log.info("[{}] turn {}: {} responded", instanceId, result.turn(), result.agentName());
        }
    }

    @Override
    public void onRunCompleted(String instanceId, String output) {
        log.info("[{}] run completed", instanceId);
    }

    @Override
    public void onRunFailed(String instanceId, Throwable cause) {
        log.error("[{}] run failed", instanceId, cause);
    }
}
