package com.ryuqq.swarm.core.model;

/**
 * 세션 진행률 요약.
 *
 * @param total 전체 Task 수
 * @param completed 완료된 Task 수
 * @param failed 영구 실패한 Task 수
 * @param percentage 완료율 (completed / total * 100, total이 0이면 0)
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record Progress(
    int total,
    int completed,
    int failed,
    double percentage
) {

    public Progress {
        if (total < 0 || completed < 0 || failed < 0) {
            throw new IllegalArgumentException(
                "Progress counts cannot be negative (total: " + total + ", completed: " + completed + ", failed: " + failed + ")"
            );
        }
    }

    /**
     * 카운트로부터 진행률 계산.
     *
     * @param total 전체
     * @param completed 완료
     * @param failed 실패
     * @return Progress
     */
    public static Progress of(int total, int completed, int failed) {
        double percentage = total > 0 ? (completed * 100.0) / total : 0.0;
        return new Progress(total, completed, failed, percentage);
    }

    /**
     * 빈 진행률.
     *
     * @return 모든 값이 0인 Progress
     */
    public static Progress empty() {
        return new Progress(0, 0, 0, 0.0);
    }
}
