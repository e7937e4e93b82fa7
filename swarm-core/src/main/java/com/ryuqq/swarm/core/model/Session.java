package com.ryuqq.swarm.core.model;

import com.ryuqq.swarm.core.handler.SharedContext;
import com.ryuqq.swarm.core.statemachine.AgentStatus;
import com.ryuqq.swarm.core.statemachine.SessionStatus;
import com.ryuqq.swarm.core.statemachine.StateTransition;
import com.ryuqq.swarm.core.statemachine.TaskStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 하나의 오케스트레이션 작업 단위.
 *
 * <p>Session은 Task와 Agent를 소유하며, 모든 변경은 Orchestrator가 세션별 잠금을 잡은 상태에서
 * 수행합니다. 이 클래스 자체는 thread-safe 하지 않습니다.</p>
 *
 * <p><strong>준비 집합 (ready set):</strong></p>
 * <pre>
 * QUEUED 상태 + 재할당 지연 경과 + 모든 선행 Task가 COMPLETED
 *   → priority 내림차순, 동률이면 생성 순서 (stable)
 * </pre>
 *
 * <p><strong>버전:</strong> 상태가 바뀔 때마다 {@link #markChanged()}로 증가합니다.
 * 외부 저장소 미러링 시 오래된 스냅샷이 최신 스냅샷을 덮어쓰지 않도록 하는 데 사용됩니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class Session {

    private static final Comparator<Task> ASSIGNMENT_ORDER =
        Comparator.comparingInt(Task::getPriority).reversed()
            .thenComparingInt(Task::getSequence);

    private final SessionId id;
    private final String name;
    private final SessionConfig config;
    private final Instant createdAt;
    private final Map<TaskId, Task> tasks = new LinkedHashMap<>();
    private final Map<AgentId, Agent> agents = new LinkedHashMap<>();
    private final SharedContext sharedContext;

    private SessionStatus status = SessionStatus.INITIALIZING;
    private Instant startedAt;
    private Instant completedAt;
    private String failureReason;
    private Progress progress = Progress.empty();
    private long version;

    /**
     * Session 생성 (INITIALIZING).
     *
     * @param id Session ID
     * @param name 표시 이름
     * @param config 설정
     * @param tasks Task 목록 (생성 순서)
     * @param agents Agent 목록
     * @param sharedContext 공유 컨텍스트 (null이면 빈 컨텍스트)
     * @param createdAt 생성 시각
     */
    public Session(
        SessionId id,
        String name,
        SessionConfig config,
        Collection<Task> tasks,
        Collection<Agent> agents,
        SharedContext sharedContext,
        Instant createdAt
    ) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        this.id = id;
        this.name = name;
        this.config = config;
        this.createdAt = createdAt;
        this.sharedContext = sharedContext == null ? new SharedContext() : sharedContext;
        if (tasks != null) {
            tasks.forEach(task -> this.tasks.put(task.getId(), task));
        }
        if (agents != null) {
            agents.forEach(agent -> this.agents.put(agent.getId(), agent));
        }
        this.progress = Progress.of(this.tasks.size(), 0, 0);
    }

    // ============================================================
    // 생명주기
    // ============================================================

    /**
     * 시작 (INITIALIZING → ACTIVE).
     *
     * @param now 현재 시각
     * @throws IllegalStateException INITIALIZING이 아닌 경우
     */
    public void start(Instant now) {
        this.status = StateTransition.transition(status, SessionStatus.ACTIVE);
        this.startedAt = now;
        recomputeProgress();
        markChanged();
    }

    /**
     * 완료 (ACTIVE → COMPLETING → COMPLETED) 후 Agent를 IDLE로 반환.
     *
     * @param now 현재 시각
     */
    public void complete(Instant now) {
        this.status = StateTransition.transition(status, SessionStatus.COMPLETING);
        releaseAgents();
        recomputeProgress();
        this.status = StateTransition.transition(status, SessionStatus.COMPLETED);
        this.completedAt = now;
        markChanged();
    }

    /**
     * 중단 (→ CANCELLED). QUEUED/ASSIGNED Task는 CANCELLED, Agent는 IDLE.
     *
     * <p>IN_PROGRESS Task는 강제로 중단하지 않습니다. 결과가 도착하면 버려집니다.</p>
     *
     * @param now 현재 시각
     */
    public void cancel(Instant now) {
        this.status = StateTransition.transition(status, SessionStatus.CANCELLED);
        cancelPendingTasks(now);
        releaseAgents();
        recomputeProgress();
        this.completedAt = now;
        markChanged();
    }

    /**
     * 실패 (→ FAILED). 대기 중 Task는 취소하고 Agent는 IDLE로 반환.
     *
     * @param now 현재 시각
     * @param reason 실패 사유
     */
    public void fail(Instant now, String reason) {
        this.status = StateTransition.transition(status, SessionStatus.FAILED);
        this.failureReason = reason;
        cancelPendingTasks(now);
        releaseAgents();
        recomputeProgress();
        this.completedAt = now;
        markChanged();
    }

    private void cancelPendingTasks(Instant now) {
        for (Task task : tasks.values()) {
            if (task.getStatus() == TaskStatus.QUEUED || task.getStatus() == TaskStatus.ASSIGNED) {
                task.cancel(now);
            }
        }
    }

    private void releaseAgents() {
        for (Agent agent : agents.values()) {
            if (agent.getStatus() == AgentStatus.BUSY) {
                agent.release();
            }
        }
    }

    // ============================================================
    // 스케줄링
    // ============================================================

    /**
     * 준비된 Task를 할당 순서대로 반환.
     *
     * @param now 현재 시각
     * @return priority 내림차순 + 생성 순서
     */
    public List<Task> readyTasks(Instant now) {
        List<Task> ready = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (task.getStatus() == TaskStatus.QUEUED && task.isEligible(now) && dependenciesCompleted(task)) {
                ready.add(task);
            }
        }
        ready.sort(ASSIGNMENT_ORDER);
        return ready;
    }

    /**
     * 모든 선행 Task가 COMPLETED인지 확인.
     *
     * @param task 대상 Task
     * @return 선행 Task가 모두 완료되었으면 true
     */
    public boolean dependenciesCompleted(Task task) {
        for (TaskId dependency : task.getDependencies()) {
            Task upstream = tasks.get(dependency);
            if (upstream == null || upstream.getStatus() != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    /**
     * 요구 capability와 겹치는 첫 번째 IDLE Agent (first-match).
     *
     * @param requiredCapabilities 요구 capability
     * @return Agent (없으면 empty)
     */
    public Optional<Agent> findIdleAgent(Set<String> requiredCapabilities) {
        for (Agent agent : agents.values()) {
            if (agent.isIdle() && agent.canHandle(requiredCapabilities)) {
                return Optional.of(agent);
            }
        }
        return Optional.empty();
    }

    /**
     * Task를 Agent에 할당.
     *
     * @param task 대상 Task
     * @param agent 대상 Agent
     * @param now 현재 시각
     * @return attempt 번호
     * @throws IllegalStateException 선행 Task가 완료되지 않았거나 Agent가 IDLE이 아닌 경우
     */
    public int assign(Task task, Agent agent, Instant now) {
        if (!dependenciesCompleted(task)) {
            throw new IllegalStateException("Dependencies of " + task.getId() + " are not completed");
        }
        agent.assign(task.getId());
        int attempt = task.assign(agent.getId(), now);
        markChanged();
        return attempt;
    }

    /**
     * 모든 Agent의 heartbeat 갱신 (OFFLINE/ERROR 제외).
     *
     * @param now 현재 시각
     */
    public void refreshAgentLiveness(Instant now) {
        for (Agent agent : agents.values()) {
            if (agent.getStatus() == AgentStatus.IDLE || agent.getStatus() == AgentStatus.BUSY) {
                agent.heartbeat(now);
            }
        }
    }

    /**
     * 모든 Task가 종료 상태인지 확인 (Task가 없으면 true).
     *
     * @return 종료 여부
     */
    public boolean allTasksTerminal() {
        for (Task task : tasks.values()) {
            if (!task.isTerminal()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 진행률 재계산.
     *
     * @return 새 진행률
     */
    public Progress recomputeProgress() {
        int completed = 0;
        int failed = 0;
        for (Task task : tasks.values()) {
            if (task.getStatus() == TaskStatus.COMPLETED) {
                completed++;
            } else if (task.getStatus() == TaskStatus.FAILED) {
                failed++;
            }
        }
        this.progress = Progress.of(tasks.size(), completed, failed);
        return progress;
    }

    /**
     * 상태별 Task 수.
     *
     * @return 모든 TaskStatus 키를 포함하는 Map
     */
    public Map<TaskStatus, Integer> taskCountsByStatus() {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus taskStatus : TaskStatus.values()) {
            counts.put(taskStatus, 0);
        }
        for (Task task : tasks.values()) {
            counts.merge(task.getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * 상태 변경 표시 (버전 증가).
     *
     * @return 새 버전
     */
    public long markChanged() {
        return ++version;
    }

    // ============================================================
    // 조회
    // ============================================================

    public Optional<Task> findTask(TaskId taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public Optional<Agent> findAgent(AgentId agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public Collection<Task> getTasks() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    public Collection<Agent> getAgents() {
        return Collections.unmodifiableCollection(agents.values());
    }

    public SessionId getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public SessionConfig getConfig() {
        return config;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Progress getProgress() {
        return progress;
    }

    public SharedContext getSharedContext() {
        return sharedContext;
    }

    public long getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "Session{" + id + ", " + name + ", " + status + ", tasks=" + tasks.size() + '}';
    }
}
