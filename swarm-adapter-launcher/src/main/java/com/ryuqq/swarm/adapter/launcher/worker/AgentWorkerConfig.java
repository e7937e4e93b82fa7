package com.ryuqq.swarm.adapter.launcher.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.swarm.application.memory.MemoryCoordinator;
import com.ryuqq.swarm.core.error.ValidationException;
import com.ryuqq.swarm.core.model.AgentId;
import com.ryuqq.swarm.core.model.ResourceLimits;
import com.ryuqq.swarm.core.model.SessionId;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agent Worker 설정 (불변 record).
 *
 * <p>프로세스 모드에서는 {@link #fromEnvironment(Map)}로 환경 변수({@link AgentEnvironment})에서,
 * 스레드 모드에서는 Launcher가 직접 생성합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>heartbeatIntervalMs: heartbeat 주기 (기본 30000ms)</li>
 *   <li>maxTasks: 최대 동시 Task 수 (기본 1)</li>
 *   <li>pollIntervalMs: pending Task 조회 주기 (기본 1000ms)</li>
 *   <li>shutdownGraceMs: 종료 시 실행 중 Task 대기 시간 (기본 30000ms)</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record AgentWorkerConfig(
    AgentId agentId,
    SessionId sessionId,
    String name,
    List<String> capabilities,
    ResourceLimits resourceLimits,
    long heartbeatIntervalMs,
    int maxTasks,
    long pollIntervalMs,
    long shutdownGraceMs,
    String launchMode,
    String storeUrl
) {

    public static final String DEFAULT_STORE_URL = "redis://localhost:6379/0";
    public static final List<String> DEFAULT_CAPABILITIES = List.of("data_processing");

    private static final ObjectMapper OBJECT_MAPPER = MemoryCoordinator.createObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public AgentWorkerConfig {
        if (agentId == null) {
            throw new IllegalArgumentException("agentId cannot be null");
        }
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        name = name == null || name.isBlank() ? agentId.getValue() : name;
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("capabilities cannot be empty");
        }
        capabilities = List.copyOf(capabilities);
        resourceLimits = resourceLimits == null ? ResourceLimits.defaults() : resourceLimits;
        if (heartbeatIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "heartbeatIntervalMs must be positive (current: " + heartbeatIntervalMs + ")"
            );
        }
        if (maxTasks <= 0) {
            throw new IllegalArgumentException("maxTasks must be positive (current: " + maxTasks + ")");
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive (current: " + pollIntervalMs + ")");
        }
        if (shutdownGraceMs < 0) {
            throw new IllegalArgumentException("shutdownGraceMs cannot be negative (current: " + shutdownGraceMs + ")");
        }
        launchMode = launchMode == null || launchMode.isBlank() ? "process" : launchMode;
        storeUrl = storeUrl == null || storeUrl.isBlank() ? DEFAULT_STORE_URL : storeUrl;
    }

    /**
     * 기본값으로 설정 생성.
     *
     * @param agentId Agent ID
     * @param sessionId 세션 ID
     * @param name 표시 이름
     * @param capabilities capability
     * @return 설정
     */
    public static AgentWorkerConfig of(AgentId agentId, SessionId sessionId, String name, List<String> capabilities) {
        return new AgentWorkerConfig(
            agentId, sessionId, name, capabilities, ResourceLimits.defaults(),
            30000, 1, 1000, 30000, "process", DEFAULT_STORE_URL
        );
    }

    /**
     * 환경 변수에서 설정 생성.
     *
     * <p>{@code SWARM_AGENT_ID}, {@code SWARM_SESSION_ID}는 필수이며 나머지는 기본값이 있습니다.
     * {@code SWARM_CAPABILITIES}가 없으면 {@link #DEFAULT_CAPABILITIES}를 사용합니다.</p>
     *
     * @param environment 환경 변수
     * @return 설정
     * @throws ValidationException 필수 값이 없거나 형식이 잘못된 경우
     */
    public static AgentWorkerConfig fromEnvironment(Map<String, String> environment) {
        try {
            String agentId = required(environment, AgentEnvironment.AGENT_ID);
            String sessionId = required(environment, AgentEnvironment.SESSION_ID);
            return new AgentWorkerConfig(
                AgentId.of(agentId),
                SessionId.of(sessionId),
                environment.getOrDefault(AgentEnvironment.AGENT_NAME, agentId),
                parseCapabilities(environment.get(AgentEnvironment.CAPABILITIES)),
                new ResourceLimits(
                    Long.parseLong(environment.getOrDefault(AgentEnvironment.MEMORY_LIMIT_MB, "512")),
                    Double.parseDouble(environment.getOrDefault(AgentEnvironment.CPU_LIMIT_PERCENT, "80"))
                ),
                Long.parseLong(environment.getOrDefault(AgentEnvironment.HEARTBEAT_INTERVAL_MS, "30000")),
                Integer.parseInt(environment.getOrDefault(AgentEnvironment.MAX_TASKS, "1")),
                1000,
                30000,
                environment.getOrDefault(AgentEnvironment.LAUNCH_MODE, "process"),
                environment.getOrDefault(AgentEnvironment.STORE_URL, DEFAULT_STORE_URL)
            );
        } catch (ValidationException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid agent environment: " + e.getMessage(), e);
        }
    }

    /**
     * 프로세스 모드 Agent에 전달할 환경 변수.
     *
     * @return 환경 변수 이름 → 값
     */
    public Map<String, String> toEnvironment() {
        Map<String, String> environment = new LinkedHashMap<>();
        environment.put(AgentEnvironment.AGENT_ID, agentId.getValue());
        environment.put(AgentEnvironment.SESSION_ID, sessionId.getValue());
        environment.put(AgentEnvironment.AGENT_NAME, name);
        try {
            environment.put(AgentEnvironment.CAPABILITIES, OBJECT_MAPPER.writeValueAsString(capabilities));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode capabilities: " + capabilities, e);
        }
        environment.put(AgentEnvironment.MEMORY_LIMIT_MB, String.valueOf(resourceLimits.memoryMb()));
        environment.put(AgentEnvironment.CPU_LIMIT_PERCENT, String.valueOf(resourceLimits.cpuPercent()));
        environment.put(AgentEnvironment.HEARTBEAT_INTERVAL_MS, String.valueOf(heartbeatIntervalMs));
        environment.put(AgentEnvironment.MAX_TASKS, String.valueOf(maxTasks));
        environment.put(AgentEnvironment.LAUNCH_MODE, launchMode);
        environment.put(AgentEnvironment.STORE_URL, storeUrl);
        return environment;
    }

    private static String required(Map<String, String> environment, String name) {
        String value = environment.get(name);
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required environment variable: " + name);
        }
        return value;
    }

    private static List<String> parseCapabilities(String json) {
        if (json == null || json.isBlank()) {
            return DEFAULT_CAPABILITIES;
        }
        try {
            return OBJECT_MAPPER.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid " + AgentEnvironment.CAPABILITIES + " (expected JSON array): " + json, e);
        }
    }

    public AgentWorkerConfig withPollIntervalMs(long pollIntervalMs) {
        return new AgentWorkerConfig(agentId, sessionId, name, capabilities, resourceLimits, heartbeatIntervalMs, maxTasks, pollIntervalMs, shutdownGraceMs, launchMode, storeUrl);
    }

    public AgentWorkerConfig withShutdownGraceMs(long shutdownGraceMs) {
        return new AgentWorkerConfig(agentId, sessionId, name, capabilities, resourceLimits, heartbeatIntervalMs, maxTasks, pollIntervalMs, shutdownGraceMs, launchMode, storeUrl);
    }

    public AgentWorkerConfig withMaxTasks(int maxTasks) {
        return new AgentWorkerConfig(agentId, sessionId, name, capabilities, resourceLimits, heartbeatIntervalMs, maxTasks, pollIntervalMs, shutdownGraceMs, launchMode, storeUrl);
    }

    public AgentWorkerConfig withHeartbeatIntervalMs(long heartbeatIntervalMs) {
        return new AgentWorkerConfig(agentId, sessionId, name, capabilities, resourceLimits, heartbeatIntervalMs, maxTasks, pollIntervalMs, shutdownGraceMs, launchMode, storeUrl);
    }
}
