package com.ryuqq.swarm.adapter.launcher;

import java.util.OptionalLong;

/**
 * 실행된 Agent의 로컬 핸들 (OS 프로세스 또는 전용 스레드).
 *
 * <p>종료는 두 단계입니다: {@link #requestStop()}으로 정상 종료를 요청하고
 * {@link #awaitExit(long)}가 시간 안에 끝나지 않으면 {@link #forceStop()}.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public interface AgentHandle {

    boolean isAlive();

    /**
     * OS 프로세스 ID (스레드 핸들이면 비어 있음).
     */
    OptionalLong pid();

    /**
     * 현재 리소스 사용량 측정. CPU 사용률은 직전 측정 이후 구간 기준입니다.
     */
    AgentMetrics sampleMetrics();

    /**
     * 정상 종료 요청 (종료 신호).
     */
    void requestStop();

    /**
     * 종료 대기.
     *
     * @param timeoutMs 최대 대기 시간
     * @return 종료되었으면 true
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    boolean awaitExit(long timeoutMs) throws InterruptedException;

    /**
     * 강제 종료.
     */
    void forceStop();
}
