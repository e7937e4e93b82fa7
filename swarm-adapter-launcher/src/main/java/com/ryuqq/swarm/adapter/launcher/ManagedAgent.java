package com.ryuqq.swarm.adapter.launcher;

import com.ryuqq.swarm.core.model.SessionId;

import java.time.Instant;
import java.util.OptionalLong;

/**
 * Launcher가 추적하는 Agent 한 개 (핸들 + 상태).
 */
final class ManagedAgent {

    private final SessionId sessionId;
    private final AgentConfig config;
    private final AgentHandle handle;
    private final Instant startedAt;
    private final int restartCount;

    private ManagedAgentStatus status = ManagedAgentStatus.STARTING;
    private Instant lastHeartbeat;
    private AgentMetrics metrics = AgentMetrics.empty();
    private String failureReason;

    ManagedAgent(SessionId sessionId, AgentConfig config, AgentHandle handle, Instant startedAt, int restartCount) {
        this.sessionId = sessionId;
        this.config = config;
        this.handle = handle;
        this.startedAt = startedAt;
        this.restartCount = restartCount;
    }

    /**
     * 시작 이후의 heartbeat이면 기록하고 STARTING을 RUNNING으로 올림.
     *
     * @return STARTING에서 RUNNING으로 바뀌었으면 true
     */
    synchronized boolean observeHeartbeat(Instant heartbeat) {
        if (heartbeat == null || !heartbeat.isAfter(startedAt)) {
            return false;
        }
        if (lastHeartbeat == null || heartbeat.isAfter(lastHeartbeat)) {
            lastHeartbeat = heartbeat;
        }
        if (status == ManagedAgentStatus.STARTING) {
            status = ManagedAgentStatus.RUNNING;
            return true;
        }
        return false;
    }

    /**
     * 마지막 heartbeat 시각 (없으면 시작 시각).
     */
    synchronized Instant lastActivity() {
        return lastHeartbeat != null ? lastHeartbeat : startedAt;
    }

    synchronized void updateMetrics(AgentMetrics metrics) {
        this.metrics = metrics;
    }

    synchronized void markFailed(String reason) {
        status = ManagedAgentStatus.FAILED;
        failureReason = reason;
    }

    synchronized void markStopped() {
        status = ManagedAgentStatus.STOPPED;
    }

    synchronized ManagedAgentStatus status() {
        return status;
    }

    SessionId sessionId() {
        return sessionId;
    }

    AgentConfig config() {
        return config;
    }

    AgentHandle handle() {
        return handle;
    }

    int restartCount() {
        return restartCount;
    }

    synchronized AgentStatusView toView() {
        OptionalLong pid = handle.pid();
        return new AgentStatusView(
            config.id(),
            sessionId.getValue(),
            config.name(),
            config.type(),
            config.launchMode(),
            status,
            config.capabilities(),
            config.resourceLimits(),
            pid.isPresent() ? pid.getAsLong() : null,
            startedAt,
            lastHeartbeat,
            restartCount,
            metrics,
            failureReason
        );
    }
}
