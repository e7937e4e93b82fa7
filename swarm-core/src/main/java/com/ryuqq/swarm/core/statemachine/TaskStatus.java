package com.ryuqq.swarm.core.statemachine;

/**
 * Task의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * QUEUED ──► ASSIGNED ──► IN_PROGRESS ──► COMPLETED
 *   ▲  │        │   │          │
 *   │  │        │   │          ├─► FAILED ──► QUEUED (재시도 예산이 남은 경우)
 *   │  │        │   │          └─► CANCELLED (세션 중단 후 도착한 결과)
 *   │  └────────┴───┴─► CANCELLED (stopSession)
 *   └───────────┘ (워커 풀 제출 거부 시 되돌림)
 * </pre>
 *
 * <p>FAILED는 종료 상태로 취급합니다. 재시도 시의 FAILED → QUEUED 전이는
 * 실패 기록과 같은 임계 구역 안에서 일어나므로 외부 관찰자는 재시도 대기 중인
 * FAILED 상태를 보지 않습니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public enum TaskStatus {

    QUEUED,

    ASSIGNED,

    IN_PROGRESS,

    COMPLETED,

    FAILED,

    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
