package com.ryuqq.conductor.application.orchestrator;

import com.ryuqq.conductor.core.exception.ConfigurationException;

/**
 * 오케스트레이터 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>stateKey: {@value #DEFAULT_STATE_KEY}</li>
 *   <li>agentsRegistryKey: {@value #DEFAULT_AGENTS_REGISTRY_KEY}</li>
 *   <li>broadcastTopicName: null (name 사용)</li>
 *   <li>maxIterations: {@value #DEFAULT_MAX_ITERATIONS}</li>
 *   <li>timeoutSeconds: {@value #DEFAULT_TIMEOUT_SECONDS}</li>
 *   <li>saveStateLocally: true</li>
 *   <li>currentSpeaker: null (Random 전용)</li>
 *   <li>currentAgentIndex: 0 (RoundRobin 전용)</li>
 *   <li>maxRetainedInstances: {@value #DEFAULT_MAX_RETAINED_INSTANCES}</li>
 * </ul>
 *
 * <p>필수값 누락이나 범위를 벗어난 값은 생성 시점에 {@link ConfigurationException}으로 거부됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OrchestratorConfig config = OrchestratorConfig.of("writers-room", "messagepubsub", "statestore", "agentstatestore")
 *     .withMaxIterations(5)
 *     .withTimeoutSeconds(30);
 * </pre>
 *
 * @param name 오케스트레이터 이름 (레지스트리 키)
 * @param messageBusName 메시지 버스 컴포넌트 이름
 * @param stateStoreName 상태 저장소 컴포넌트 이름
 * @param stateKey 워크플로 상태 저장 키
 * @param agentsRegistryStoreName 레지스트리 저장소 컴포넌트 이름
 * @param agentsRegistryKey 레지스트리 키
 * @param broadcastTopicName 브로드캐스트 토픽 (null이면 name)
 * @param maxIterations 최대 턴 수
 * @param timeoutSeconds 턴당 응답 대기 시간 (초)
 * @param saveStateLocally 로컬 상태 저장소에도 스냅샷을 기록할지 여부
 * @param currentSpeaker Random 전략의 초기 직전 발화자
 * @param currentAgentIndex RoundRobin 전략의 시작 인덱스
 * @param maxRetainedInstances 상태에 보관할 인스턴스 기록 상한 (초과 시 오래된 종료 기록부터 제거)
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record OrchestratorConfig(
    String name,
    String messageBusName,
    String stateStoreName,
    String stateKey,
    String agentsRegistryStoreName,
    String agentsRegistryKey,
    String broadcastTopicName,
    int maxIterations,
    int timeoutSeconds,
    boolean saveStateLocally,
    String currentSpeaker,
    int currentAgentIndex,
    int maxRetainedInstances
) {

    public static final String DEFAULT_STATE_KEY = "workflow_state";
    public static final String DEFAULT_AGENTS_REGISTRY_KEY = "agents_registry";
    public static final int DEFAULT_MAX_ITERATIONS = 10;
    public static final int DEFAULT_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_MAX_RETAINED_INSTANCES = 100;

    /**
     * Compact Constructor.
     *
     * <p>stateKey, agentsRegistryKey가 null이면 기본값을 사용합니다.</p>
     *
     * @throws ConfigurationException 필수값이 비어 있거나 범위를 벗어난 경우
     */
    public OrchestratorConfig {
        requireText(name, "name");
        requireText(messageBusName, "messageBusName");
        requireText(stateStoreName, "stateStoreName");
        requireText(agentsRegistryStoreName, "agentsRegistryStoreName");

        stateKey = stateKey == null ? DEFAULT_STATE_KEY : stateKey;
        agentsRegistryKey = agentsRegistryKey == null ? DEFAULT_AGENTS_REGISTRY_KEY : agentsRegistryKey;
        requireText(stateKey, "stateKey");
        requireText(agentsRegistryKey, "agentsRegistryKey");

        if (maxIterations <= 0) {
            throw new ConfigurationException(
                "maxIterations must be positive (current: " + maxIterations + ")"
            );
        }
        if (timeoutSeconds <= 0) {
            throw new ConfigurationException(
                "timeoutSeconds must be positive (current: " + timeoutSeconds + ")"
            );
        }
        if (currentAgentIndex < 0) {
            throw new ConfigurationException(
                "currentAgentIndex must be non-negative (current: " + currentAgentIndex + ")"
            );
        }
        if (maxRetainedInstances <= 0) {
            throw new ConfigurationException(
                "maxRetainedInstances must be positive (current: " + maxRetainedInstances + ")"
            );
        }
    }

    /**
     * 필수값만 지정하고 나머지는 기본값으로 생성.
     *
     * @param name 오케스트레이터 이름
     * @param messageBusName 메시지 버스 컴포넌트 이름
     * @param stateStoreName 상태 저장소 컴포넌트 이름
     * @param agentsRegistryStoreName 레지스트리 저장소 컴포넌트 이름
     * @return OrchestratorConfig
     * @throws ConfigurationException 필수값이 비어 있는 경우
     */
    public static OrchestratorConfig of(
        String name,
        String messageBusName,
        String stateStoreName,
        String agentsRegistryStoreName
    ) {
        return new OrchestratorConfig(
            name, messageBusName, stateStoreName, DEFAULT_STATE_KEY,
            agentsRegistryStoreName, DEFAULT_AGENTS_REGISTRY_KEY, null,
            DEFAULT_MAX_ITERATIONS, DEFAULT_TIMEOUT_SECONDS, true, null, 0, DEFAULT_MAX_RETAINED_INSTANCES
        );
    }

    /**
     * 실제 브로드캐스트 토픽.
     *
     * @return broadcastTopicName이 비어 있으면 name
     */
    public String broadcastTopic() {
        return broadcastTopicName == null || broadcastTopicName.isBlank() ? name : broadcastTopicName;
    }

    public OrchestratorConfig withStateKey(String stateKey) {
        return new OrchestratorConfig(name, messageBusName, stateStoreName, stateKey, agentsRegistryStoreName,
            agentsRegistryKey, broadcastTopicName, maxIterations, timeoutSeconds, saveStateLocally,
            currentSpeaker, currentAgentIndex, maxRetainedInstances);
    }

    public OrchestratorConfig withAgentsRegistryKey(String agentsRegistryKey) {
        return new OrchestratorConfig(name, messageBusName, stateStoreName, stateKey, agentsRegistryStoreName,
            agentsRegistryKey, broadcastTopicName, maxIterations, timeoutSeconds, saveStateLocally,
            currentSpeaker, currentAgentIndex, maxRetainedInstances);
    }

    public OrchestratorConfig withBroadcastTopicName(String broadcastTopicName) {
        return new OrchestratorConfig(name, messageBusName, stateStoreName, stateKey, agentsRegistryStoreName,
            agentsRegistryKey, broadcastTopicName, maxIterations, timeoutSeconds, saveStateLocally,
            currentSpeaker, currentAgentIndex, maxRetainedInstances);
    }

    public OrchestratorConfig withMaxIterations(int maxIterations) {
        return new OrchestratorConfig(name, messageBusName, stateStoreName, stateKey, agentsRegistryStoreName,
            agentsRegistryKey, broadcastTopicName, maxIterations, timeoutSeconds, saveStateLocally,
            currentSpeaker, currentAgentIndex, maxRetainedInstances);
    }

    public OrchestratorConfig withTimeoutSeconds(int timeoutSeconds) {
        return new OrchestratorConfig(name, messageBusName, stateStoreName, stateKey, agentsRegistryStoreName,
            agentsRegistryKey, broadcastTopicName, maxIterations, timeoutSeconds, saveStateLocally,
            currentSpeaker, currentAgentIndex, maxRetainedInstances);
    }

    public OrchestratorConfig withSaveStateLocally(boolean saveStateLocally) {
        return new OrchestratorConfig(name, messageBusName, stateStoreName, stateKey, agentsRegistryStoreName,
            agentsRegistryKey, broadcastTopicName, maxIterations, timeoutSeconds, saveStateLocally,
            currentSpeaker, currentAgentIndex, maxRetainedInstances);
    }

    public OrchestratorConfig withCurrentSpeaker(String currentSpeaker) {
        return new OrchestratorConfig(name, messageBusName, stateStoreName, stateKey, agentsRegistryStoreName,
            agentsRegistryKey, broadcastTopicName, maxIterations, timeoutSeconds, saveStateLocally,
            currentSpeaker, currentAgentIndex, maxRetainedInstances);
    }

    public OrchestratorConfig withCurrentAgentIndex(int currentAgentIndex) {
        return new OrchestratorConfig(name, messageBusName, stateStoreName, stateKey, agentsRegistryStoreName,
            agentsRegistryKey, broadcastTopicName, maxIterations, timeoutSeconds, saveStateLocally,
            currentSpeaker, currentAgentIndex, maxRetainedInstances);
    }

    public OrchestratorConfig withMaxRetainedInstances(int maxRetainedInstances) {
        return new OrchestratorConfig(name, messageBusName, stateStoreName, stateKey, agentsRegistryStoreName,
            agentsRegistryKey, broadcastTopicName, maxIterations, timeoutSeconds, saveStateLocally,
            currentSpeaker, currentAgentIndex, maxRetainedInstances);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(field + " cannot be null or blank");
        }
    }
}
