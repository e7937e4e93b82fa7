package com.ryuqq.swarm.adapter.launcher;

import com.ryuqq.swarm.adapter.launcher.worker.AgentWorkerConfig;
import com.ryuqq.swarm.core.error.AgentLaunchException;
import com.ryuqq.swarm.core.model.AgentId;
import com.ryuqq.swarm.core.model.SessionId;

/**
 * 실행 모드별 Agent 시작 방식.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public interface LaunchStrategy {

    /**
     * Agent 시작.
     *
     * @param sessionId 세션 ID
     * @param config 검증을 마친 Agent 설정
     * @return 로컬 핸들
     * @throws AgentLaunchException 프로세스/스레드를 시작하지 못했거나 시작 직후 종료된 경우
     * @throws com.ryuqq.swarm.core.error.UnsupportedLaunchModeException 지원하지 않는 모드인 경우
     */
    AgentHandle launch(SessionId sessionId, AgentConfig config);

    /**
     * Agent 설정을 워커 설정으로 변환.
     *
     * @param sessionId 세션 ID
     * @param config Agent 설정
     * @param storeUrl 워커가 접속할 Backing Store
     * @return 워커 설정
     */
    static AgentWorkerConfig workerConfig(SessionId sessionId, AgentConfig config, String storeUrl) {
        return new AgentWorkerConfig(
            AgentId.of(config.id()),
            sessionId,
            config.name(),
            config.capabilities(),
            config.resourceLimits(),
            config.heartbeatIntervalMs(),
            config.maxTasks(),
            1000,
            30000,
            config.launchMode().wireName(),
            storeUrl
        );
    }
}
