package com.ryuqq.swarm.adapter.launcher;

import com.ryuqq.swarm.core.model.ResourceLimits;

import java.time.Instant;
import java.util.List;

/**
 * Launcher가 관리하는 Agent의 상태 스냅샷.
 *
 * @param agentId Agent ID
 * @param sessionId 세션 ID
 * @param name 표시 이름
 * @param type 역할
 * @param launchMode 실행 모드
 * @param status 핸들 상태
 * @param capabilities capability
 * @param resourceLimits 리소스 제한
 * @param pid OS 프로세스 ID (스레드 모드면 null)
 * @param startedAt 시작 시각
 * @param lastHeartbeat 마지막으로 관측한 heartbeat (없으면 null)
 * @param restartCount 재시작 횟수
 * @param metrics 마지막 측정값
 * @param failureReason FAILED 사유 (없으면 null)
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record AgentStatusView(
    String agentId,
    String sessionId,
    String name,
    AgentType type,
    LaunchMode launchMode,
    ManagedAgentStatus status,
    List<String> capabilities,
    ResourceLimits resourceLimits,
    Long pid,
    Instant startedAt,
    Instant lastHeartbeat,
    int restartCount,
    AgentMetrics metrics,
    String failureReason
) {
}
