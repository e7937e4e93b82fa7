package com.ryuqq.swarm.core.statemachine;

/**
 * Agent 상태.
 *
 * <p>Agent는 종료 상태가 없습니다. OFFLINE/ERROR 상태의 Agent도 복구되면 IDLE로 돌아갑니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public enum AgentStatus {

    /**
     * 작업 할당 가능.
     */
    IDLE,

    /**
     * 작업 실행 중.
     */
    BUSY,

    /**
     * 연결 끊김 또는 정상 종료.
     */
    OFFLINE,

    /**
     * 비정상 상태 (프로세스 종료, heartbeat 타임아웃 등).
     */
    ERROR;

    /**
     * 새 작업을 받을 수 있는지 확인.
     *
     * @return IDLE인 경우 true
     */
    public boolean isAvailable() {
        return this == IDLE;
    }
}
