package com.ryuqq.swarm.application.orchestrator;

import com.ryuqq.swarm.core.model.AgentId;
import com.ryuqq.swarm.core.model.StatusChange;
import com.ryuqq.swarm.core.model.Task;
import com.ryuqq.swarm.core.model.TaskId;
import com.ryuqq.swarm.core.statemachine.TaskStatus;

import java.util.List;
import java.util.Map;

/**
 * Task 스냅샷 (읽기 전용).
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record TaskSnapshot(
    TaskId id,
    String key,
    String type,
    TaskStatus status,
    int priority,
    int retryCount,
    int maxRetries,
    AgentId assignedAgent,
    Map<String, Object> result,
    String error,
    List<StatusChange> history
) {

    public static TaskSnapshot from(Task task) {
        return new TaskSnapshot(
            task.getId(),
            task.getKey(),
            task.getType(),
            task.getStatus(),
            task.getPriority(),
            task.getRetryCount(),
            task.getMaxRetries(),
            task.getAssignedAgent(),
            task.getResult(),
            task.getError(),
            task.getHistory()
        );
    }
}
