package com.ryuqq.swarm.core.model;

/**
 * 실패한 Task의 재할당 지연 정책.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public enum RetryPolicy {

    /**
     * 다음 tick에서 즉시 재할당 가능.
     */
    IMMEDIATE,

    /**
     * 고정 지연 (BackoffCalculator의 baseDelay).
     */
    FIXED,

    /**
     * 지수 백오프 + jitter.
     */
    EXPONENTIAL
}
