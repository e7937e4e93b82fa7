package com.ryuqq.swarm.adapter.runner;

import com.ryuqq.swarm.core.model.SessionId;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Orchestrator 인스턴스가 소유하는 세션 저장소.
 *
 * <p>맵 자체는 동시 접근에 안전하며, 개별 세션의 변경은 {@link SessionContext#lock()}으로 보호됩니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
final class SessionRegistry {

    private final Map<SessionId, SessionContext> sessions = new ConcurrentHashMap<>();

    void register(SessionContext context) {
        SessionContext previous = sessions.putIfAbsent(context.session().getId(), context);
        if (previous != null) {
            throw new IllegalStateException("Session already registered: " + context.session().getId());
        }
    }

    Optional<SessionContext> find(SessionId sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    boolean remove(SessionId sessionId) {
        return sessions.remove(sessionId) != null;
    }

    /**
     * 현재 세션 목록의 사본.
     */
    Collection<SessionContext> all() {
        return List.copyOf(sessions.values());
    }

    int size() {
        return sessions.size();
    }
}
