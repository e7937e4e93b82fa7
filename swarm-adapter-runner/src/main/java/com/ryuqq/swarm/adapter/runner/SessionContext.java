package com.ryuqq.swarm.adapter.runner;

import com.ryuqq.swarm.application.memory.AgentRecord;
import com.ryuqq.swarm.core.model.Session;
import com.ryuqq.swarm.core.model.TaskId;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 세션 하나의 런타임 상태.
 *
 * <p>{@link Session}은 {@link #lock()}을 잡은 상태에서만 읽고 씁니다.
 * 잠금은 짧게 유지하며 핸들러 실행과 Backing Store 쓰기는 잠금 밖에서 수행합니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
final class SessionContext {

    private final Session session;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<TaskId, Future<?>> runningExecutions = new ConcurrentHashMap<>();
    private final Object mirrorMonitor = new Object();
    private final Map<String, AgentRecord> mirroredAgents = new HashMap<>();
    private long lastMirroredVersion;

    SessionContext(Session session) {
        this.session = session;
    }

    Session session() {
        return session;
    }

    ReentrantLock lock() {
        return lock;
    }

    Map<TaskId, Future<?>> runningExecutions() {
        return runningExecutions;
    }

    Object mirrorMonitor() {
        return mirrorMonitor;
    }

    /**
     * 마지막으로 미러링한 버전 (mirrorMonitor 보유 시에만 접근).
     */
    long lastMirroredVersion() {
        return lastMirroredVersion;
    }

    void lastMirroredVersion(long version) {
        this.lastMirroredVersion = version;
    }

    /**
     * Agent ID별 마지막으로 기록한 상태 (mirrorMonitor 보유 시에만 접근).
     */
    Map<String, AgentRecord> mirroredAgents() {
        return mirroredAgents;
    }
}
