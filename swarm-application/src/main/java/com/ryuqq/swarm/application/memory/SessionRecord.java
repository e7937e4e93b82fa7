package com.ryuqq.swarm.application.memory;

import com.ryuqq.swarm.core.model.Progress;
import com.ryuqq.swarm.core.model.RetryPolicy;
import com.ryuqq.swarm.core.model.Session;
import com.ryuqq.swarm.core.model.SessionConfig;
import com.ryuqq.swarm.core.statemachine.SessionStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backing Store에 미러링되는 세션 스냅샷.
 *
 * <p>Orchestrator가 소유하는 {@link Session}의 교차 프로세스 가시성용 사본입니다.
 * Agent 상태와 공유 컨텍스트 스냅샷을 함께 담습니다.
 * {@code version}은 세션의 변경 버전으로, 오래된 스냅샷이 최신 스냅샷을 덮어쓰지 않도록 합니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record SessionRecord(
    String id,
    String name,
    SessionStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Progress progress,
    Config config,
    List<TaskRecord> tasks,
    List<AgentRecord> agents,
    Map<String, Object> sharedContext,
    String failureReason,
    long version
) {

    public SessionRecord {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        agents = agents == null ? List.of() : List.copyOf(agents);
        sharedContext = sharedContext == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sharedContext));
    }

    /**
     * 세션 스냅샷 생성. 호출자는 세션 잠금을 보유해야 합니다.
     *
     * @param session 세션
     * @return 스냅샷
     */
    public static SessionRecord from(Session session) {
        return new SessionRecord(
            session.getId().getValue(),
            session.getName(),
            session.getStatus(),
            session.getCreatedAt(),
            session.getStartedAt(),
            session.getCompletedAt(),
            session.getProgress(),
            Config.from(session.getConfig()),
            session.getTasks().stream().map(TaskRecord::from).toList(),
            session.getAgents().stream().map(AgentRecord::from).toList(),
            session.getSharedContext().snapshot(),
            session.getFailureReason(),
            session.getVersion()
        );
    }

    /**
     * 세션 설정 직렬화 형태.
     */
    public record Config(int maxAgents, long taskTimeoutMs, RetryPolicy retryPolicy) {

        public static Config from(SessionConfig config) {
            return new Config(config.maxAgents(), config.taskTimeoutMs(), config.retryPolicy());
        }
    }
}
