package com.ryuqq.swarm.application.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ryuqq.swarm.core.model.ResourceLimits;
import com.ryuqq.swarm.core.statemachine.AgentStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 교차 프로세스 Agent 등록 정보.
 *
 * <p>heartbeat 패치는 snake_case 필드 이름을 키로 사용합니다
 * ({@link #STATUS}, {@link #CURRENT_TASKS} 등).</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentRegistration(
    String agentId,
    String sessionId,
    String name,
    List<String> capabilities,
    AgentStatus status,
    List<String> currentTasks,
    int maxTasks,
    ResourceLimits resourceLimits,
    String launchMode,
    int tasksCompleted,
    int tasksFailed,
    Instant registeredAt,
    Instant lastHeartbeat,
    Map<String, Object> metrics
) {

    public static final String STATUS = "status";
    public static final String CURRENT_TASKS = "current_tasks";
    public static final String TASKS_COMPLETED = "tasks_completed";
    public static final String TASKS_FAILED = "tasks_failed";
    public static final String METRICS = "metrics";

    public AgentRegistration {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        currentTasks = currentTasks == null ? List.of() : List.copyOf(currentTasks);
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    /**
     * 새 등록 정보 생성 (IDLE, 카운터 0).
     *
     * <p>등록 시각과 heartbeat는 {@link MemoryCoordinator#registerAgent}가 채웁니다.</p>
     *
     * @param agentId Agent ID
     * @param sessionId 세션 ID
     * @param name 표시 이름
     * @param capabilities capability
     * @param maxTasks 최대 동시 Task 수
     * @param resourceLimits 리소스 제한
     * @param launchMode 실행 모드 (선택)
     * @return 등록 정보
     */
    public static AgentRegistration of(
        String agentId,
        String sessionId,
        String name,
        Collection<String> capabilities,
        int maxTasks,
        ResourceLimits resourceLimits,
        String launchMode
    ) {
        return new AgentRegistration(
            agentId, sessionId, name, List.copyOf(capabilities), AgentStatus.IDLE, List.of(),
            maxTasks, resourceLimits, launchMode, 0, 0, null, null, Map.of()
        );
    }

    public boolean hasAnyCapability(Collection<String> required) {
        return !Collections.disjoint(capabilities, required);
    }

    AgentRegistration withTimestamps(Instant registeredAt, Instant lastHeartbeat) {
        return new AgentRegistration(
            agentId, sessionId, name, capabilities, status, currentTasks, maxTasks, resourceLimits,
            launchMode, tasksCompleted, tasksFailed, registeredAt, lastHeartbeat, metrics
        );
    }

    public AgentRegistration withStatus(AgentStatus status) {
        return new AgentRegistration(
            agentId, sessionId, name, capabilities, status, currentTasks, maxTasks, resourceLimits,
            launchMode, tasksCompleted, tasksFailed, registeredAt, lastHeartbeat, metrics
        );
    }
}
