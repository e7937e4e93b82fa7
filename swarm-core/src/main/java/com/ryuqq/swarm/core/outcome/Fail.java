package com.ryuqq.swarm.core.outcome;

import com.ryuqq.swarm.core.model.TaskId;

/**
 * 영구적 실패 (재시도 예산 소진).
 *
 * @param taskId Task ID
 * @param errorCode 오류 코드 (예: TASK-RETRY-EXHAUSTED)
 * @param message 마지막 오류 메시지
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record Fail(
    TaskId taskId,
    String errorCode,
    String message
) implements Outcome {

    /**
     * 재시도 소진 오류 코드.
     */
    public static final String RETRY_EXHAUSTED = "TASK-RETRY-EXHAUSTED";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * 재시도 소진 실패 생성.
     *
     * @param taskId Task ID
     * @param message 마지막 오류 메시지
     * @return Fail 인스턴스
     */
    public static Fail exhausted(TaskId taskId, String message) {
        return new Fail(taskId, RETRY_EXHAUSTED, message);
    }
}
