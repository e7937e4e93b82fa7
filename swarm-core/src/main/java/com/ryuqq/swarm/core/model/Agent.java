package com.ryuqq.swarm.core.model;

import com.ryuqq.swarm.core.statemachine.AgentStatus;
import com.ryuqq.swarm.core.statemachine.StateTransition;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Capability 태그를 가진 작업 실행자.
 *
 * <p>Task와 마찬가지로 소속 세션의 잠금 아래에서만 변경됩니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class Agent {

    private final AgentId id;
    private final String name;
    private final Set<String> capabilities;
    private final ResourceLimits resourceLimits;

    private AgentStatus status = AgentStatus.IDLE;
    private TaskId currentTask;
    private Instant lastHeartbeat;
    private int tasksCompleted;
    private int tasksFailed;

    /**
     * Agent 생성 (IDLE).
     *
     * @param id Agent ID
     * @param name 표시 이름
     * @param capabilities capability 집합 (비어 있으면 안 됨)
     * @param resourceLimits 리소스 제한 (null이면 기본값)
     * @param now 생성 시각 (최초 heartbeat)
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public Agent(AgentId id, String name, Set<String> capabilities, ResourceLimits resourceLimits, Instant now) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("capabilities cannot be null or empty");
        }
        this.id = id;
        this.name = name;
        this.capabilities = Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
        this.resourceLimits = resourceLimits == null ? ResourceLimits.defaults() : resourceLimits;
        this.lastHeartbeat = now;
    }

    /**
     * 요구 capability와 하나 이상 겹치는지 확인.
     *
     * @param required 요구 capability
     * @return 교집합이 있으면 true
     */
    public boolean canHandle(Set<String> required) {
        return !Collections.disjoint(capabilities, required);
    }

    public boolean isIdle() {
        return status == AgentStatus.IDLE;
    }

    /**
     * Task 할당 (IDLE → BUSY).
     *
     * @param taskId 할당된 Task
     */
    public void assign(TaskId taskId) {
        this.status = StateTransition.transition(status, AgentStatus.BUSY);
        this.currentTask = taskId;
    }

    /**
     * IDLE로 복귀. 이미 IDLE이면 아무것도 하지 않습니다.
     */
    public void release() {
        if (status != AgentStatus.IDLE) {
            this.status = StateTransition.transition(status, AgentStatus.IDLE);
        }
        this.currentTask = null;
    }

    public void recordCompletion() {
        tasksCompleted++;
    }

    public void recordFailure() {
        tasksFailed++;
    }

    public void heartbeat(Instant now) {
        this.lastHeartbeat = now;
    }

    public void markOffline() {
        if (status != AgentStatus.OFFLINE) {
            this.status = StateTransition.transition(status, AgentStatus.OFFLINE);
        }
        this.currentTask = null;
    }

    public void markError() {
        if (status != AgentStatus.ERROR) {
            this.status = StateTransition.transition(status, AgentStatus.ERROR);
        }
    }

    public AgentId getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Set<String> getCapabilities() {
        return capabilities;
    }

    public ResourceLimits getResourceLimits() {
        return resourceLimits;
    }

    public AgentStatus getStatus() {
        return status;
    }

    public TaskId getCurrentTask() {
        return currentTask;
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    public int getTasksCompleted() {
        return tasksCompleted;
    }

    public int getTasksFailed() {
        return tasksFailed;
    }

    @Override
    public String toString() {
        return "Agent{" + id + ", " + capabilities + ", " + status + '}';
    }
}
