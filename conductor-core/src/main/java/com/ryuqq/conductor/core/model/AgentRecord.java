package com.ryuqq.conductor.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Agent Registry에 등록된 에이전트 한 건.
 *
 * <p>레지스트리가 소유하며, 오케스트레이터는 스냅샷을 읽기만 합니다.</p>
 *
 * <p><strong>토픽 규칙:</strong></p>
 * <ul>
 *   <li>topic이 있으면 trigger/broadcast 모두 해당 토픽 사용</li>
 *   <li>없으면 trigger는 {@code <name>.trigger}, broadcast는 {@code <name>.events}</li>
 * </ul>
 *
 * @param name 에이전트 이름 (레지스트리 키)
 * @param topic 통신 토픽 (null 가능)
 * @param metadata 부가 메타데이터 (null이면 빈 맵)
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record AgentRecord(
    String name,
    String topic,
    Map<String, Object> metadata
) {

    /**
     * 오케스트레이터 여부를 표시하는 메타데이터 키.
     */
    public static final String ORCHESTRATOR_KEY = "orchestrator";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public AgentRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        // topic은 null 허용
    }

    /**
     * 메타데이터 없이 AgentRecord 생성.
     *
     * @param name 에이전트 이름
     * @param topic 통신 토픽 (null 가능)
     * @return AgentRecord
     */
    public static AgentRecord of(String name, String topic) {
        return new AgentRecord(name, topic, Map.of());
    }

    /**
     * 오케스트레이터 등록 레코드인지 확인.
     *
     * @return metadata.orchestrator가 true인 경우 true
     */
    public boolean isOrchestrator() {
        Object flag = metadata.get(ORCHESTRATOR_KEY);
        return Boolean.TRUE.equals(flag) || "true".equals(flag);
    }

    /**
     * Trigger 메시지를 보낼 토픽.
     *
     * @return topic 또는 {@code <name>.trigger}
     */
    public String triggerTopic() {
        return hasTopic() ? topic : name + ".trigger";
    }

    /**
     * Broadcast 메시지를 보낼 토픽.
     *
     * @return topic 또는 {@code <name>.events}
     */
    public String eventTopic() {
        return hasTopic() ? topic : name + ".events";
    }

    private boolean hasTopic() {
        return topic != null && !topic.isBlank();
    }
}
