package com.ryuqq.swarm.application.orchestrator;

import com.ryuqq.swarm.core.model.Agent;
import com.ryuqq.swarm.core.model.Progress;
import com.ryuqq.swarm.core.model.Session;
import com.ryuqq.swarm.core.model.SessionId;
import com.ryuqq.swarm.core.statemachine.SessionStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 세션 상태 스냅샷 (읽기 전용).
 *
 * <p>세션 잠금 아래에서 복사되므로 반환 이후의 변경은 반영되지 않습니다.</p>
 *
 * @param id 세션 ID
 * @param name 세션 이름
 * @param status 세션 상태
 * @param progress 진행률
 * @param agents Agent ID → 요약 (등록 순서)
 * @param taskSummary 상태별 Task 수
 * @param createdAt 생성 시각
 * @param startedAt 시작 시각 (null 가능)
 * @param completedAt 종료 시각 (null 가능)
 * @param failureReason 실패 사유 (FAILED가 아니면 null)
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record SessionStatusView(
    SessionId id,
    String name,
    SessionStatus status,
    Progress progress,
    Map<String, AgentSummary> agents,
    TaskSummary taskSummary,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    String failureReason
) {

    public SessionStatusView {
        agents = agents == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(agents));
    }

    /**
     * 세션 스냅샷 생성. 호출자는 세션 잠금을 보유해야 합니다.
     *
     * @param session 세션
     * @return 스냅샷
     */
    public static SessionStatusView from(Session session) {
        Map<String, AgentSummary> agents = new LinkedHashMap<>();
        for (Agent agent : session.getAgents()) {
            agents.put(agent.getId().getValue(), AgentSummary.from(agent));
        }
        return new SessionStatusView(
            session.getId(),
            session.getName(),
            session.getStatus(),
            session.getProgress(),
            agents,
            TaskSummary.from(session.taskCountsByStatus()),
            session.getCreatedAt(),
            session.getStartedAt(),
            session.getCompletedAt(),
            session.getFailureReason()
        );
    }
}
