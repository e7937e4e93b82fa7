package com.ryuqq.swarm.core.error;

/**
 * 핸들러가 등록되지 않은 Task 타입.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public class UnregisteredTaskTypeException extends ValidationException {

    private final String taskType;

    public UnregisteredTaskTypeException(String taskType) {
        super("No handler registered for task type: " + taskType);
        this.taskType = taskType;
    }

    public String getTaskType() {
        return taskType;
    }
}
