package com.ryuqq.swarm.application.report;

import java.util.List;

/**
 * Agent 한 개의 세션 기여도.
 *
 * @param agentId Agent ID
 * @param name 표시 이름
 * @param capabilities capability
 * @param tasksCompleted 완료 Task 수
 * @param tasksFailed 실패 시도 수
 * @param successRate 완료 / (완료 + 실패), 시도가 없으면 0
 * @param share 세션 전체 완료 수 중 이 Agent의 비율, 완료가 없으면 0
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record AgentContribution(
    String agentId,
    String name,
    List<String> capabilities,
    int tasksCompleted,
    int tasksFailed,
    double successRate,
    double share
) {

    public AgentContribution {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }
}
