package com.ryuqq.swarm.adapter.runner;

import com.ryuqq.swarm.application.memory.MemoryCoordinator;
import com.ryuqq.swarm.core.error.StoreException;
import com.ryuqq.swarm.core.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * 종료 세션 정리 컴포넌트.
 *
 * <p>종료 상태(COMPLETED, FAILED, CANCELLED)에 도달한 지 보존 기간이 지난 세션을
 * 메모리와 Memory Coordinator에서 제거합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 등록된 모든 세션 순회
 * 2. 종료 상태 + completedAt &lt; now - sessionRetention 인 세션 선별
 * 3. SessionRegistry에서 제거 → memory.deleteSession()
 * 4. memory.cleanupExpiredSessions() (다른 인스턴스가 남긴 만료 세션 정리)
 * </pre>
 *
 * <p>개별 세션 정리 실패는 로그만 남기고 다음 세션으로 진행합니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
final class SessionReaper {

    private static final Logger log = LoggerFactory.getLogger(SessionReaper.class);

    private final SessionRegistry registry;
    private final MemoryCoordinator memory;
    private final long retentionMs;
    private final Clock clock;

    SessionReaper(SessionRegistry registry, MemoryCoordinator memory, long retentionMs, Clock clock) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (memory == null) {
            throw new IllegalArgumentException("memory cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.registry = registry;
        this.memory = memory;
        this.retentionMs = retentionMs;
        this.clock = clock;
    }

    /**
     * 보존 기간이 지난 종료 세션 정리.
     *
     * @return 제거된 세션 수 (이 인스턴스 소유분)
     */
    int scan() {
        Instant cutoff = clock.instant().minusMillis(retentionMs);
        int purged = 0;
        for (SessionContext context : registry.all()) {
            if (tryPurge(context, cutoff)) {
                purged++;
            }
        }

        try {
            memory.cleanupExpiredSessions();
        } catch (StoreException e) {
            log.warn("Backing store cleanup failed: {}", e.getMessage());
        }

        log.info("Session reaper scan completed: {} purged, {} remaining", purged, registry.size());
        return purged;
    }

    private boolean tryPurge(SessionContext context, Instant cutoff) {
        Session session = context.session();
        context.lock().lock();
        try {
            if (!session.getStatus().isTerminal()
                || session.getCompletedAt() == null
                || !session.getCompletedAt().isBefore(cutoff)) {
                return false;
            }
            registry.remove(session.getId());
        } finally {
            context.lock().unlock();
        }

        try {
            memory.deleteSession(session.getId());
        } catch (StoreException e) {
            log.warn("Failed to delete session {} from backing store: {}", session.getId(), e.getMessage());
        }
        log.info("Session {} purged (status: {}, completed at: {})",
            session.getId(), session.getStatus(), session.getCompletedAt());
        return true;
    }
}
