package com.ryuqq.swarm.application.report;

import com.ryuqq.swarm.core.statemachine.SessionStatus;
import com.ryuqq.swarm.core.statemachine.TaskStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 세션 결과 요약.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record SessionResultSummary(
    String sessionId,
    SessionStatus status,
    Instant aggregatedAt,
    long totalExecutionMs,
    int totalTasks,
    Map<TaskStatus, Integer> taskCounts,
    Map<String, Integer> tasksByType,
    double successRate,
    ExecutionStats executionStats,
    Map<String, List<String>> errorsByType,
    Map<String, AgentContribution> agentContributions,
    List<String> recommendations
) {

    public SessionResultSummary {
        taskCounts = Collections.unmodifiableMap(new LinkedHashMap<>(taskCounts));
        tasksByType = Collections.unmodifiableMap(new LinkedHashMap<>(tasksByType));
        errorsByType = Collections.unmodifiableMap(new LinkedHashMap<>(errorsByType));
        agentContributions = Collections.unmodifiableMap(new LinkedHashMap<>(agentContributions));
        recommendations = List.copyOf(recommendations);
    }

    public int count(TaskStatus status) {
        return taskCounts.getOrDefault(status, 0);
    }
}
