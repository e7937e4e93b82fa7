package com.ryuqq.swarm.adapter.launcher;

/**
 * Launcher가 관리하는 Agent 핸들 상태.
 *
 * <pre>
 * STARTING → RUNNING (시작 이후 heartbeat 수신)
 * STARTING/RUNNING → FAILED (프로세스 종료 또는 heartbeat timeout)
 * STARTING/RUNNING/FAILED → STOPPED (stopAgent)
 * </pre>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public enum ManagedAgentStatus {
    STARTING,
    RUNNING,
    STOPPED,
    FAILED;

    /**
     * 리소스 검사와 중복 ID 검사에서 살아있는 Agent로 집계되는 상태.
     */
    public boolean isActive() {
        return this == STARTING || this == RUNNING;
    }
}
