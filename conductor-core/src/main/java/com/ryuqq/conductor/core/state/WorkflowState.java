package com.ryuqq.conductor.core.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 저장소에 기록되는 워크플로 상태 스냅샷.
 *
 * @param instances 인스턴스 ID별 실행 기록 (시작 순서)
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record WorkflowState(Map<String, InstanceRecord> instances) {

    public WorkflowState {
        instances = instances == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(instances));
    }

    public static WorkflowState empty() {
        return new WorkflowState(Map.of());
    }

    public Optional<InstanceRecord> instance(String instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }
}
