package com.ryuqq.swarm.core.model;

import com.ryuqq.swarm.core.error.ValidationException;

/**
 * 세션 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAgents: 세션당 최대 Agent 수 (기본 10)</li>
 *   <li>taskTimeoutMs: IN_PROGRESS Task 최대 실행 시간 (기본 600000ms = 10분)</li>
 *   <li>retryPolicy: 재할당 지연 정책 (기본 IMMEDIATE)</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 * @param maxAgents 최대 Agent 수 (양수)
 * @param taskTimeoutMs Task 타임아웃 (밀리초, 양수)
 * @param retryPolicy 재시도 정책 (null 불가)
 */
public record SessionConfig(
    int maxAgents,
    long taskTimeoutMs,
    RetryPolicy retryPolicy
) {

    /**
     * 기본 설정 생성자.
     */
    public SessionConfig() {
        this(10, 600000, RetryPolicy.IMMEDIATE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws ValidationException 파라미터 검증 실패 시
     */
    public SessionConfig {
        if (maxAgents <= 0) {
            throw new ValidationException(
                "maxAgents must be positive (current: " + maxAgents + ")"
            );
        }
        if (taskTimeoutMs <= 0) {
            throw new ValidationException(
                "taskTimeoutMs must be positive (current: " + taskTimeoutMs + ")"
            );
        }
        if (retryPolicy == null) {
            throw new ValidationException("retryPolicy cannot be null");
        }
    }

    public SessionConfig withMaxAgents(int maxAgents) {
        return new SessionConfig(maxAgents, taskTimeoutMs, retryPolicy);
    }

    public SessionConfig withTaskTimeoutMs(long taskTimeoutMs) {
        return new SessionConfig(maxAgents, taskTimeoutMs, retryPolicy);
    }

    public SessionConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new SessionConfig(maxAgents, taskTimeoutMs, retryPolicy);
    }
}
