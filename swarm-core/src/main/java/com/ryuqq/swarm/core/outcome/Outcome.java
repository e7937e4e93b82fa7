package com.ryuqq.swarm.core.outcome;

import com.ryuqq.swarm.core.model.TaskId;

/**
 * Task 실행 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공적으로 완료됨</li>
 *   <li>{@link Retry}: 핸들러 실패, 재시도 예산이 남아 다시 QUEUED 됨</li>
 *   <li>{@link Fail}: 재시도 예산 소진, 영구 실패</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Ok ok) {
 *     publishCompleted(ok.result());
 * } else if (outcome instanceof Retry retry) {
 *     log.warn("retry {} after {}ms", retry.retryCount(), retry.nextRetryAfterMillis());
 * } else if (outcome instanceof Fail fail) {
 *     publishFailed(fail.errorCode());
 * }
 * </pre>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Retry, Fail {

    /**
     * 결과 대상 Task.
     *
     * @return TaskId
     */
    TaskId taskId();

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 재시도 대기인지 확인.
     *
     * @return 재시도 여부
     */
    default boolean isRetry() {
        return this instanceof Retry;
    }

    /**
     * 결과가 영구 실패인지 확인.
     *
     * @return 영구 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
