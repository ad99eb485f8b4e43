package com.ryuqq.conductor.core.state;

/**
 * 워크플로 인스턴스 실행 상태.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public enum InstanceStatus {

    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
