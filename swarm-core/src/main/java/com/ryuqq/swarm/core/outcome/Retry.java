package com.ryuqq.swarm.core.outcome;

import com.ryuqq.swarm.core.model.TaskId;

/**
 * 재시도 예정인 실패.
 *
 * <p>핸들러가 실패했지만 {@code retryCount < maxRetries} 이므로 Task가 QUEUED로 돌아갔음을 나타냅니다.</p>
 *
 * @param taskId Task ID
 * @param reason 실패 사유
 * @param retryCount 증가된 재시도 횟수 (1 이상)
 * @param nextRetryAfterMillis 재할당 가능해질 때까지 대기 시간 (밀리초, 0 이상)
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record Retry(
    TaskId taskId,
    String reason,
    int retryCount,
    long nextRetryAfterMillis
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Retry {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (retryCount < 1) {
            throw new IllegalArgumentException("retryCount must be positive (current: " + retryCount + ")");
        }
        if (nextRetryAfterMillis < 0) {
            throw new IllegalArgumentException("nextRetryAfterMillis must be non-negative (current: " + nextRetryAfterMillis + ")");
        }
    }
}
