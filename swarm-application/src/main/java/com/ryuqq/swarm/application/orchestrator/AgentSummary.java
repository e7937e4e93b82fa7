package com.ryuqq.swarm.application.orchestrator;

import com.ryuqq.swarm.core.model.Agent;
import com.ryuqq.swarm.core.statemachine.AgentStatus;

/**
 * Agent 상태 요약.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record AgentSummary(
    String id,
    String name,
    AgentStatus status,
    String currentTask,
    int tasksCompleted,
    int tasksFailed
) {

    public static AgentSummary from(Agent agent) {
        return new AgentSummary(
            agent.getId().getValue(),
            agent.getName(),
            agent.getStatus(),
            agent.getCurrentTask() == null ? null : agent.getCurrentTask().getValue(),
            agent.getTasksCompleted(),
            agent.getTasksFailed()
        );
    }
}
