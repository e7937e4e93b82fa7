package com.ryuqq.swarm.application.memory;

import com.ryuqq.swarm.core.model.Agent;
import com.ryuqq.swarm.core.model.ResourceLimits;
import com.ryuqq.swarm.core.statemachine.AgentStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Backing Store에 미러링되는 in-process Agent 표현.
 *
 * <p>{@link SessionRecord}에 포함되며, {@link MemoryCoordinator}의 Agent 등록 정보로도
 * 변환됩니다 ({@link #toRegistration(String)}, {@link #statePatch()}).</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record AgentRecord(
    String id,
    String name,
    List<String> capabilities,
    AgentStatus status,
    String currentTask,
    Instant lastHeartbeat,
    int tasksCompleted,
    int tasksFailed,
    ResourceLimits resourceLimits
) {

    public AgentRecord {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public static AgentRecord from(Agent agent) {
        return new AgentRecord(
            agent.getId().getValue(),
            agent.getName(),
            List.copyOf(agent.getCapabilities()),
            agent.getStatus(),
            agent.getCurrentTask() == null ? null : agent.getCurrentTask().getValue(),
            agent.getLastHeartbeat(),
            agent.getTasksCompleted(),
            agent.getTasksFailed(),
            agent.getResourceLimits()
        );
    }

    /**
     * 최초 등록용 등록 정보 (in-process Agent는 동시에 Task 하나만 실행).
     *
     * @param sessionId 세션 ID
     * @return 등록 정보
     */
    public AgentRegistration toRegistration(String sessionId) {
        return AgentRegistration.of(id, sessionId, name, capabilities, 1, resourceLimits, "in_process");
    }

    /**
     * 등록 정보 위에 덮어쓸 상태 항목.
     *
     * @return status, current_tasks, 카운터, last_heartbeat
     */
    public Map<String, Object> statePatch() {
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put(AgentRegistration.STATUS, status);
        patch.put(AgentRegistration.CURRENT_TASKS, currentTask == null ? List.of() : List.of(currentTask));
        patch.put(AgentRegistration.TASKS_COMPLETED, tasksCompleted);
        patch.put(AgentRegistration.TASKS_FAILED, tasksFailed);
        if (lastHeartbeat != null) {
            patch.put("last_heartbeat", lastHeartbeat);
        }
        return patch;
    }

    /**
     * heartbeat를 제외한 상태가 같은지 확인.
     *
     * @param other 비교 대상 (null 가능)
     * @return 상태, 현재 Task, 카운터가 모두 같으면 true
     */
    public boolean sameState(AgentRecord other) {
        return other != null
            && status == other.status
            && Objects.equals(currentTask, other.currentTask)
            && tasksCompleted == other.tasksCompleted
            && tasksFailed == other.tasksFailed;
    }
}
