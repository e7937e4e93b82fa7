package com.ryuqq.swarm.application.memory;

import com.ryuqq.swarm.core.statemachine.SessionStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 네임스페이스 단위 저장소 사용 통계.
 *
 * @param namespace 키 접두사
 * @param totalSessions 세션 인덱스 항목 수 (만료된 레코드 포함)
 * @param sessionsByStatus 상태별 세션 수 (레코드가 남아 있는 세션만)
 * @param expiredSessions 레코드가 만료되었지만 인덱스에 남은 세션 수
 * @param totalAgents 등록된 Agent 수 (모든 세션 합계)
 * @param totalEvents 세션 이벤트 로그 항목 수 (모든 세션 합계)
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record MemoryStats(
    String namespace,
    int totalSessions,
    Map<SessionStatus, Integer> sessionsByStatus,
    int expiredSessions,
    int totalAgents,
    long totalEvents
) {

    public MemoryStats {
        Map<SessionStatus, Integer> counts = new EnumMap<>(SessionStatus.class);
        for (SessionStatus status : SessionStatus.values()) {
            counts.put(status, 0);
        }
        if (sessionsByStatus != null) {
            counts.putAll(sessionsByStatus);
        }
        sessionsByStatus = Collections.unmodifiableMap(counts);
    }

    /**
     * 종료되지 않은 세션 수.
     */
    public int activeSessions() {
        int active = 0;
        for (Map.Entry<SessionStatus, Integer> entry : sessionsByStatus.entrySet()) {
            if (!entry.getKey().isTerminal()) {
                active += entry.getValue();
            }
        }
        return active;
    }
}
