package com.ryuqq.swarm.application.report;

import com.ryuqq.swarm.application.memory.AgentRecord;
import com.ryuqq.swarm.application.memory.AgentRegistration;
import com.ryuqq.swarm.application.memory.MemoryCoordinator;
import com.ryuqq.swarm.application.memory.SessionRecord;
import com.ryuqq.swarm.application.memory.TaskRecord;
import com.ryuqq.swarm.core.model.SessionId;
import com.ryuqq.swarm.core.statemachine.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 미러링된 세션의 결과 집계.
 *
 * <p><strong>집계 항목:</strong></p>
 * <ul>
 *   <li>상태별, 유형별 Task 수와 성공률 (완료 / 전체)</li>
 *   <li>완료된 Task의 실행 시간 통계 (startedAt → completedAt)</li>
 *   <li>유형별 오류 메시지 (FAILED Task)</li>
 *   <li>Agent별 기여도: 세션 레코드의 in-process Agent와, 레코드에 없는 외부 등록 Agent</li>
 *   <li>권장 사항</li>
 * </ul>
 *
 * <p>진행 중인 세션도 집계할 수 있으며, 이때 총 실행 시간은 현재 시각까지입니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class SessionResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(SessionResultAggregator.class);

    private static final double RETRY_REVIEW_THRESHOLD = 0.9;
    private static final double CAPABILITY_REVIEW_THRESHOLD = 0.7;

    private final MemoryCoordinator memory;
    private final Clock clock;

    public SessionResultAggregator(MemoryCoordinator memory, Clock clock) {
        if (memory == null) {
            throw new IllegalArgumentException("memory cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.memory = memory;
        this.clock = clock;
    }

    /**
     * 저장된 세션 레코드와 등록 Agent로 집계.
     *
     * @param sessionId 세션 ID
     * @return 요약 (세션 레코드가 없으면 empty)
     * @throws com.ryuqq.swarm.core.error.StoreException 저장소 접근 실패 시
     */
    public Optional<SessionResultSummary> aggregate(SessionId sessionId) {
        Optional<SessionRecord> record = memory.getSession(sessionId);
        if (record.isEmpty()) {
            log.debug("No session record to aggregate: {}", sessionId);
            return Optional.empty();
        }
        return Optional.of(aggregate(record.get(), memory.listAgents(sessionId)));
    }

    /**
     * 세션 레코드 집계.
     *
     * @param record 세션 레코드
     * @param registrations 등록 Agent (레코드에 같은 ID가 있으면 레코드 값을 사용)
     * @return 요약
     */
    public SessionResultSummary aggregate(SessionRecord record, List<AgentRegistration> registrations) {
        Instant now = clock.instant();
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0);
        }
        Map<String, Integer> byType = new LinkedHashMap<>();
        Map<String, List<String>> errors = new LinkedHashMap<>();
        List<Long> durations = new ArrayList<>();

        for (TaskRecord task : record.tasks()) {
            counts.merge(task.status(), 1, Integer::sum);
            byType.merge(task.type(), 1, Integer::sum);
            if (task.status() == TaskStatus.COMPLETED && task.startedAt() != null && task.completedAt() != null) {
                durations.add(Duration.between(task.startedAt(), task.completedAt()).toMillis());
            } else if (task.status() == TaskStatus.FAILED) {
                errors.computeIfAbsent(task.type(), type -> new ArrayList<>())
                    .add(task.error() == null ? "Unknown error" : task.error());
            }
        }

        int total = record.tasks().size();
        double successRate = total == 0 ? 0.0 : (double) counts.get(TaskStatus.COMPLETED) / total;
        SessionResultSummary summary = new SessionResultSummary(
            record.id(),
            record.status(),
            now,
            totalExecutionMs(record, now),
            total,
            counts,
            byType,
            successRate,
            ExecutionStats.of(durations),
            errors,
            contributions(record, registrations),
            recommendations(total, successRate, errors)
        );
        log.debug("Aggregated session {}: {} task(s), success rate {}", record.id(), total, successRate);
        return summary;
    }

    private static long totalExecutionMs(SessionRecord record, Instant now) {
        if (record.startedAt() == null) {
            return 0;
        }
        Instant end = record.completedAt() != null ? record.completedAt() : now;
        return Math.max(0, Duration.between(record.startedAt(), end).toMillis());
    }

    private static Map<String, AgentContribution> contributions(
        SessionRecord record,
        List<AgentRegistration> registrations
    ) {
        Map<String, AgentContribution> byAgent = new LinkedHashMap<>();
        for (AgentRecord agent : record.agents()) {
            byAgent.put(agent.id(), contribution(
                agent.id(), agent.name(), agent.capabilities(), agent.tasksCompleted(), agent.tasksFailed()
            ));
        }
        if (registrations != null) {
            for (AgentRegistration agent : registrations) {
                byAgent.putIfAbsent(agent.agentId(), contribution(
                    agent.agentId(), agent.name(), agent.capabilities(), agent.tasksCompleted(), agent.tasksFailed()
                ));
            }
        }

        int completedTotal = 0;
        for (AgentContribution contribution : byAgent.values()) {
            completedTotal += contribution.tasksCompleted();
        }
        Map<String, AgentContribution> withShare = new LinkedHashMap<>();
        for (AgentContribution contribution : byAgent.values()) {
            double share = completedTotal == 0 ? 0.0 : (double) contribution.tasksCompleted() / completedTotal;
            withShare.put(contribution.agentId(), new AgentContribution(
                contribution.agentId(), contribution.name(), contribution.capabilities(),
                contribution.tasksCompleted(), contribution.tasksFailed(), contribution.successRate(), share
            ));
        }
        return withShare;
    }

    private static AgentContribution contribution(
        String agentId, String name, List<String> capabilities, int completed, int failed
    ) {
        int attempts = completed + failed;
        double successRate = attempts == 0 ? 0.0 : (double) completed / attempts;
        return new AgentContribution(agentId, name, capabilities, completed, failed, successRate, 0.0);
    }

    private static List<String> recommendations(int total, double successRate, Map<String, List<String>> errors) {
        List<String> recommendations = new ArrayList<>();
        if (total > 0 && successRate < RETRY_REVIEW_THRESHOLD) {
            recommendations.add("Review error handling and retry policy");
        }
        if (total > 0 && successRate < CAPABILITY_REVIEW_THRESHOLD) {
            recommendations.add("Review task parameters and agent capability matching");
        }
        String worstType = null;
        int worstCount = 0;
        for (Map.Entry<String, List<String>> entry : errors.entrySet()) {
            if (entry.getValue().size() > worstCount) {
                worstType = entry.getKey();
                worstCount = entry.getValue().size();
            }
        }
        if (worstType != null) {
            recommendations.add("Focus on resolving " + worstType + " task errors");
        }
        return recommendations;
    }
}
