package com.ryuqq.swarm.application.orchestrator;

import com.ryuqq.swarm.core.statemachine.TaskStatus;

import java.util.Map;

/**
 * 상태별 Task 수.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record TaskSummary(
    int total,
    int queued,
    int assigned,
    int inProgress,
    int completed,
    int failed,
    int cancelled
) {

    /**
     * 상태별 집계로부터 생성.
     *
     * @param counts 모든 TaskStatus 키를 포함하는 집계
     * @return 요약
     */
    public static TaskSummary from(Map<TaskStatus, Integer> counts) {
        int queued = counts.getOrDefault(TaskStatus.QUEUED, 0);
        int assigned = counts.getOrDefault(TaskStatus.ASSIGNED, 0);
        int inProgress = counts.getOrDefault(TaskStatus.IN_PROGRESS, 0);
        int completed = counts.getOrDefault(TaskStatus.COMPLETED, 0);
        int failed = counts.getOrDefault(TaskStatus.FAILED, 0);
        int cancelled = counts.getOrDefault(TaskStatus.CANCELLED, 0);
        return new TaskSummary(
            queued + assigned + inProgress + completed + failed + cancelled,
            queued, assigned, inProgress, completed, failed, cancelled
        );
    }
}
