package com.ryuqq.swarm.core.model;

import com.ryuqq.swarm.core.outcome.Fail;
import com.ryuqq.swarm.core.outcome.Ok;
import com.ryuqq.swarm.core.outcome.Outcome;
import com.ryuqq.swarm.core.outcome.Retry;
import com.ryuqq.swarm.core.statemachine.StateTransition;
import com.ryuqq.swarm.core.statemachine.TaskStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntToLongFunction;

/**
 * 세션 내 단일 작업 단위.
 *
 * <p>Task는 소속 세션의 잠금 아래에서만 변경됩니다 (이 클래스 자체는 thread-safe 하지 않음).
 * 모든 상태 변경은 {@link StateTransition}으로 검증되고 이력에 기록됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@code retryCount <= maxRetries}</li>
 *   <li>{@code retryCount == maxRetries}가 되는 실패는 종료 상태 FAILED</li>
 *   <li>ASSIGNED 진입 시 attempt가 증가하며, 이전 attempt의 실행 결과는 반영되지 않음</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class Task {

    private final TaskId id;
    private final String key;
    private final int sequence;
    private final String type;
    private final Map<String, Object> parameters;
    private final int priority;
    private final Set<String> requiredCapabilities;
    private final Set<TaskId> dependencies;
    private final int maxRetries;
    private final Instant createdAt;
    private final List<StatusChange> history = new ArrayList<>();

    private TaskStatus status = TaskStatus.QUEUED;
    private AgentId assignedAgent;
    private Instant assignedAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant eligibleAt;
    private Map<String, Object> result;
    private String error;
    private int retryCount;
    private int attempt;

    /**
     * Task 생성 (QUEUED).
     *
     * @param id Task ID
     * @param key 세션 내 고유 키
     * @param sequence 생성 순서 (우선순위 동률 시 tie-break)
     * @param type 핸들러 선택 태그
     * @param parameters 파라미터
     * @param priority 우선순위 (클수록 먼저)
     * @param requiredCapabilities 필요한 capability (비어 있으면 안 됨)
     * @param dependencies 선행 Task
     * @param maxRetries 최대 재시도 횟수 (1 이상)
     * @param createdAt 생성 시각
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public Task(
        TaskId id,
        String key,
        int sequence,
        String type,
        Map<String, Object> parameters,
        int priority,
        Set<String> requiredCapabilities,
        Set<TaskId> dependencies,
        int maxRetries,
        Instant createdAt
    ) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (requiredCapabilities == null || requiredCapabilities.isEmpty()) {
            throw new IllegalArgumentException("requiredCapabilities cannot be null or empty");
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be positive (current: " + maxRetries + ")");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        this.id = id;
        this.key = key;
        this.sequence = sequence;
        this.type = type;
        this.parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.priority = priority;
        this.requiredCapabilities = Collections.unmodifiableSet(new LinkedHashSet<>(requiredCapabilities));
        this.dependencies = dependencies == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        this.maxRetries = maxRetries;
        this.createdAt = createdAt;
        this.eligibleAt = createdAt;
        this.history.add(new StatusChange(TaskStatus.QUEUED, createdAt, 0));
    }

    // ============================================================
    // 상태 전이
    // ============================================================

    /**
     * Agent에 할당 (QUEUED → ASSIGNED).
     *
     * <p>선행 Task 완료 여부는 호출자(Session)가 검증합니다.</p>
     *
     * @param agentId 할당 Agent
     * @param now 현재 시각
     * @return 새 attempt 번호
     */
    public int assign(AgentId agentId, Instant now) {
        if (agentId == null) {
            throw new IllegalArgumentException("agentId cannot be null");
        }
        moveTo(TaskStatus.ASSIGNED, now);
        this.assignedAgent = agentId;
        this.assignedAt = now;
        this.attempt++;
        return attempt;
    }

    /**
     * 할당 취소 (ASSIGNED → QUEUED). 워커 풀이 실행을 거부한 경우 사용합니다.
     *
     * @param now 현재 시각
     */
    public void unassign(Instant now) {
        moveTo(TaskStatus.QUEUED, now);
        this.assignedAgent = null;
        this.assignedAt = null;
    }

    /**
     * 실행 시작 (ASSIGNED → IN_PROGRESS).
     *
     * @param now 현재 시각
     */
    public void start(Instant now) {
        moveTo(TaskStatus.IN_PROGRESS, now);
        this.startedAt = now;
    }

    /**
     * 성공 처리 (IN_PROGRESS → COMPLETED).
     *
     * @param result 핸들러 결과 (null 허용)
     * @param now 현재 시각
     * @return Ok
     */
    public Ok complete(Map<String, Object> result, Instant now) {
        moveTo(TaskStatus.COMPLETED, now);
        this.completedAt = now;
        this.error = null;
        Ok ok = new Ok(id, result);
        this.result = ok.result();
        return ok;
    }

    /**
     * 실패 처리 (IN_PROGRESS → FAILED, 예산이 남았으면 → QUEUED).
     *
     * <p>재시도 시 할당 Agent 참조를 같은 호출 안에서 해제하므로,
     * 재시도 지연이 0이면 다음 readiness 계산에서 바로 대상이 됩니다.</p>
     *
     * @param errorMessage 오류 메시지
     * @param now 현재 시각
     * @param retryDelayMs 증가된 retryCount → 재할당 지연(ms)
     * @return 재시도 예정이면 {@link Retry}, 예산 소진이면 {@link Fail}
     */
    public Outcome fail(String errorMessage, Instant now, IntToLongFunction retryDelayMs) {
        String message = errorMessage == null || errorMessage.isBlank() ? "unknown error" : errorMessage;
        this.retryCount++;
        this.error = message;
        moveTo(TaskStatus.FAILED, now);

        if (retryCount < maxRetries) {
            long delay = Math.max(0, retryDelayMs.applyAsLong(retryCount));
            moveTo(TaskStatus.QUEUED, now);
            this.assignedAgent = null;
            this.assignedAt = null;
            this.startedAt = null;
            this.eligibleAt = now.plusMillis(delay);
            return new Retry(id, message, retryCount, delay);
        }

        this.completedAt = now;
        return Fail.exhausted(id, message);
    }

    /**
     * 취소 (QUEUED/ASSIGNED/IN_PROGRESS → CANCELLED). 결과는 버립니다.
     *
     * @param now 현재 시각
     */
    public void cancel(Instant now) {
        moveTo(TaskStatus.CANCELLED, now);
        this.completedAt = now;
        this.result = null;
    }

    private void moveTo(TaskStatus next, Instant now) {
        this.status = StateTransition.transition(status, next);
        history.add(new StatusChange(next, now, retryCount));
    }

    // ============================================================
    // 조회
    // ============================================================

    /**
     * 재할당 지연이 지났는지 확인.
     *
     * @param now 현재 시각
     * @return eligibleAt 이후이면 true
     */
    public boolean isEligible(Instant now) {
        return !eligibleAt.isAfter(now);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public TaskId getId() {
        return id;
    }

    public String getKey() {
        return key;
    }

    public int getSequence() {
        return sequence;
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public int getPriority() {
        return priority;
    }

    public Set<String> getRequiredCapabilities() {
        return requiredCapabilities;
    }

    public Set<TaskId> getDependencies() {
        return dependencies;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public AgentId getAssignedAgent() {
        return assignedAgent;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getAssignedAt() {
        return assignedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getEligibleAt() {
        return eligibleAt;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public String getError() {
        return error;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getAttempt() {
        return attempt;
    }

    public List<StatusChange> getHistory() {
        return List.copyOf(history);
    }

    @Override
    public String toString() {
        return "Task{" + id + ", " + type + ", " + status + ", retry=" + retryCount + "/" + maxRetries + '}';
    }
}
