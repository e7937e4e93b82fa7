package com.ryuqq.swarm.adapter.launcher;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ryuqq.swarm.core.error.ValidationException;
import com.ryuqq.swarm.core.model.ResourceLimits;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 실행할 Agent 설정.
 *
 * <p>잘못된 값도 표현할 수 있으며, 범위 검증은 {@link #validate()}에서
 * Launch 직전에 수행합니다. null 값은 기본값으로 채워집니다.</p>
 *
 * @param id Agent ID
 * @param name 표시 이름
 * @param type 역할
 * @param launchMode 실행 모드 (기본 PROCESS)
 * @param capabilities capability 목록
 * @param resourceLimits 리소스 제한 (기본 512MB / 80%)
 * @param environment 프로세스 모드에서 추가로 전달할 환경 변수
 * @param heartbeatIntervalMs heartbeat 주기 (기본 30000ms)
 * @param maxTasks 최대 동시 Task 수 (기본 1)
 *
 * @author Swarm Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentConfig(
    String id,
    String name,
    AgentType type,
    LaunchMode launchMode,
    List<String> capabilities,
    ResourceLimits resourceLimits,
    Map<String, String> environment,
    long heartbeatIntervalMs,
    int maxTasks
) {

    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30000;
    public static final long MAX_MEMORY_MB = 8192;

    public AgentConfig {
        type = type == null ? AgentType.WORKER : type;
        launchMode = launchMode == null ? LaunchMode.PROCESS : launchMode;
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        resourceLimits = resourceLimits == null ? ResourceLimits.defaults() : resourceLimits;
        environment = environment == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(environment));
    }

    /**
     * 기본값으로 Agent 설정 생성.
     *
     * @param id Agent ID
     * @param name 표시 이름
     * @param capabilities capability 목록
     * @return 설정 (WORKER, PROCESS, 기본 리소스, 최대 1개 Task)
     */
    public static AgentConfig of(String id, String name, List<String> capabilities) {
        return new AgentConfig(
            id, name, AgentType.WORKER, LaunchMode.PROCESS, capabilities, ResourceLimits.defaults(),
            Map.of(), DEFAULT_HEARTBEAT_INTERVAL_MS, 1
        );
    }

    /**
     * Launch 전 검증.
     *
     * <ul>
     *   <li>id, name, capabilities가 비어 있지 않아야 함</li>
     *   <li>메모리 제한: (0, 8192] MB</li>
     *   <li>CPU 제한: (0, 100] %</li>
     *   <li>maxTasks, heartbeatIntervalMs 양수</li>
     * </ul>
     *
     * @throws ValidationException 검증 실패 시
     */
    public void validate() {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Agent id cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Agent name cannot be null or blank (agent: " + id + ")");
        }
        if (capabilities.isEmpty()) {
            throw new ValidationException("Agent capabilities cannot be empty (agent: " + id + ")");
        }
        long memoryMb = resourceLimits.memoryMb();
        if (memoryMb <= 0 || memoryMb > MAX_MEMORY_MB) {
            throw new ValidationException(
                "memoryMb must be in (0, " + MAX_MEMORY_MB + "] (current: " + memoryMb + ", agent: " + id + ")"
            );
        }
        double cpuPercent = resourceLimits.cpuPercent();
        if (cpuPercent <= 0 || cpuPercent > 100) {
            throw new ValidationException(
                "cpuPercent must be in (0, 100] (current: " + cpuPercent + ", agent: " + id + ")"
            );
        }
        if (maxTasks <= 0) {
            throw new ValidationException("maxTasks must be positive (current: " + maxTasks + ", agent: " + id + ")");
        }
        if (heartbeatIntervalMs <= 0) {
            throw new ValidationException(
                "heartbeatIntervalMs must be positive (current: " + heartbeatIntervalMs + ", agent: " + id + ")"
            );
        }
    }

    public AgentConfig withId(String id) {
        return new AgentConfig(id, name, type, launchMode, capabilities, resourceLimits, environment, heartbeatIntervalMs, maxTasks);
    }

    public AgentConfig withName(String name) {
        return new AgentConfig(id, name, type, launchMode, capabilities, resourceLimits, environment, heartbeatIntervalMs, maxTasks);
    }

    public AgentConfig withLaunchMode(LaunchMode launchMode) {
        return new AgentConfig(id, name, type, launchMode, capabilities, resourceLimits, environment, heartbeatIntervalMs, maxTasks);
    }

    public AgentConfig withCapabilities(List<String> capabilities) {
        return new AgentConfig(id, name, type, launchMode, capabilities, resourceLimits, environment, heartbeatIntervalMs, maxTasks);
    }

    public AgentConfig withResourceLimits(ResourceLimits resourceLimits) {
        return new AgentConfig(id, name, type, launchMode, capabilities, resourceLimits, environment, heartbeatIntervalMs, maxTasks);
    }

    public AgentConfig withMaxTasks(int maxTasks) {
        return new AgentConfig(id, name, type, launchMode, capabilities, resourceLimits, environment, heartbeatIntervalMs, maxTasks);
    }

    public AgentConfig withHeartbeatIntervalMs(long heartbeatIntervalMs) {
        return new AgentConfig(id, name, type, launchMode, capabilities, resourceLimits, environment, heartbeatIntervalMs, maxTasks);
    }
}
