package com.ryuqq.swarm.application.memory;

import com.ryuqq.swarm.core.model.Task;
import com.ryuqq.swarm.core.model.TaskId;
import com.ryuqq.swarm.core.statemachine.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Backing Store에 미러링되는 Task 표현.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record TaskRecord(
    String id,
    String key,
    String type,
    TaskStatus status,
    int priority,
    Map<String, Object> parameters,
    List<String> dependencies,
    List<String> requiredCapabilities,
    String assignedAgent,
    int retryCount,
    int maxRetries,
    Map<String, Object> result,
    String error,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) {

    public static TaskRecord from(Task task) {
        return new TaskRecord(
            task.getId().getValue(),
            task.getKey(),
            task.getType(),
            task.getStatus(),
            task.getPriority(),
            task.getParameters(),
            task.getDependencies().stream().map(TaskId::getValue).toList(),
            List.copyOf(task.getRequiredCapabilities()),
            task.getAssignedAgent() == null ? null : task.getAssignedAgent().getValue(),
            task.getRetryCount(),
            task.getMaxRetries(),
            task.getResult(),
            task.getError(),
            task.getCreatedAt(),
            task.getStartedAt(),
            task.getCompletedAt()
        );
    }
}
