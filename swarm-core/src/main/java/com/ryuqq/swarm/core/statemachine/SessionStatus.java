package com.ryuqq.swarm.core.statemachine;

/**
 * Session의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * INITIALIZING
 *    │
 *    ├─► CANCELLED (시작 전 중단)
 *    ▼ (startSession)
 * ACTIVE
 *    │
 *    ├─► CANCELLED (stopSession)
 *    ├─► FAILED (세션 처리 중 예기치 못한 오류)
 *    ▼ (모든 Task 종료)
 * COMPLETING
 *    │
 *    ├─► COMPLETED
 *    └─► FAILED
 * </pre>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public enum SessionStatus {

    /**
     * 생성됨, 아직 시작 안 됨.
     */
    INITIALIZING,

    /**
     * 실행 중 (Task 할당/실행 가능).
     */
    ACTIVE,

    /**
     * 모든 Task가 종료되어 완료 처리 중 (과도 상태).
     */
    COMPLETING,

    /**
     * 완료.
     */
    COMPLETED,

    /**
     * 실패.
     */
    FAILED,

    /**
     * 호출자에 의해 중단됨.
     */
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
