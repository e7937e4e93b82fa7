package com.ryuqq.swarm.core.model;

import com.ryuqq.swarm.core.statemachine.TaskStatus;

import java.time.Instant;

/**
 * Task 상태 이력 항목.
 *
 * @param status 전이된 상태
 * @param at 전이 시각
 * @param retryCount 전이 시점의 재시도 횟수
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record StatusChange(
    TaskStatus status,
    Instant at,
    int retryCount
) {
}
