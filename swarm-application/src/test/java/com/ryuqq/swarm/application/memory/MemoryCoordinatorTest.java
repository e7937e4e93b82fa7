package com.ryuqq.swarm.application.memory;

import com.ryuqq.swarm.adapter.inmemory.store.InMemoryBackingStore;
import com.ryuqq.swarm.core.error.StoreException;
import com.ryuqq.swarm.core.model.AgentId;
import com.ryuqq.swarm.core.model.Progress;
import com.ryuqq.swarm.core.model.ResourceLimits;
import com.ryuqq.swarm.core.model.RetryPolicy;
import com.ryuqq.swarm.core.model.SessionId;
import com.ryuqq.swarm.core.spi.Subscription;
import com.ryuqq.swarm.core.statemachine.AgentStatus;
import com.ryuqq.swarm.core.statemachine.SessionStatus;
import com.ryuqq.swarm.testkit.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MemoryCoordinator 테스트 (InMemoryBackingStore + MutableClock).
 *
 * @author Swarm Team
 * @since 1.0.0
 */
class MemoryCoordinatorTest {

    private static final SessionId SESSION = SessionId.of("session-1");

    private MutableClock clock;
    private InMemoryBackingStore store;
    private MemoryCoordinator memory;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAtEpochOfTests();
        store = new InMemoryBackingStore(clock);
        memory = new MemoryCoordinator(store, new MemoryConfig(), clock);
    }

    private SessionRecord record(String id, SessionStatus status, Instant completedAt, long version) {
        return new SessionRecord(
            id, "import", status, clock.instant(), null, completedAt,
            Progress.of(2, 0, 0), new SessionRecord.Config(10, 600000, RetryPolicy.IMMEDIATE),
            List.of(), List.of(agentRecord("agent-1")), Map.of("rows", 3), null, version
        );
    }

    private AgentRecord agentRecord(String agentId) {
        return new AgentRecord(agentId, "Agent " + agentId, List.of("upload"), AgentStatus.IDLE, null,
            clock.instant(), 0, 0, ResourceLimits.defaults());
    }

    private AgentRegistration registration(String agentId, String... capabilities) {
        return AgentRegistration.of(agentId, SESSION.getValue(), "Agent " + agentId, List.of(capabilities), 1,
            ResourceLimits.defaults(), "IN_PROCESS");
    }

    // ============================================================
    // 세션
    // ============================================================

    @Test
    void 세션_생성_후_조회() {
        // when
        memory.createSession(record("session-1", SessionStatus.INITIALIZING, null, 1));

        // then
        SessionRecord loaded = memory.getSession(SESSION).orElseThrow();
        assertThat(loaded.name()).isEqualTo("import");
        assertThat(loaded.status()).isEqualTo(SessionStatus.INITIALIZING);
        assertThat(loaded.config().retryPolicy()).isEqualTo(RetryPolicy.IMMEDIATE);
        assertThat(loaded.agents()).extracting(AgentRecord::id).containsExactly("agent-1");
        assertThat(loaded.agents().get(0).capabilities()).containsExactly("upload");
        assertThat(loaded.sharedContext()).containsEntry("rows", 3);
        assertThat(loaded.createdAt()).isEqualTo(clock.instant());
        assertThat(memory.listSessions(null)).hasSize(1);
    }

    @Test
    void 세션_생성은_SESSION_CREATED_이벤트를_남김() {
        // when
        memory.createSession(record("session-1", SessionStatus.INITIALIZING, null, 1));

        // then
        List<MemoryEvent> events = memory.getSessionEvents(SESSION, 10);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).type()).isEqualTo(MemoryEventType.SESSION_CREATED);
        assertThat(events.get(0).sessionId()).isEqualTo("session-1");
        assertThat(events.get(0).data()).containsEntry("task_count", 0);
    }

    @Test
    void 세션_레코드는_snake_case_JSON으로_저장됨() {
        // when
        memory.createSession(record("session-1", SessionStatus.ACTIVE, null, 3));

        // then
        String json = store.get("swarm:session:session-1").orElseThrow();
        assertThat(json).contains("\"created_at\":\"2024-01-01T00:00:00Z\"");
        assertThat(json).contains("\"status\":\"ACTIVE\"");
        assertThat(json).contains("\"version\":3");
    }

    @Test
    void 세션_레코드는_TTL이_지나면_사라짐() {
        // given
        memory.createSession(record("session-1", SessionStatus.ACTIVE, null, 1));

        // when
        clock.advance(Duration.ofHours(2).plusSeconds(1));

        // then
        assertThat(memory.getSession(SESSION)).isEmpty();
    }

    @Test
    void 세션_목록은_상태로_필터링됨() {
        // given
        memory.createSession(record("s-active", SessionStatus.ACTIVE, null, 1));
        memory.createSession(record("s-done", SessionStatus.COMPLETED, clock.instant(), 1));

        // when
        List<SessionRecord> completed = memory.listSessions(SessionStatus.COMPLETED);

        // then
        assertThat(completed).extracting(SessionRecord::id).containsExactly("s-done");
        assertThat(memory.listSessions(null)).hasSize(2);
    }

    @Test
    void 세션_삭제는_세션_범위_키를_모두_제거() {
        // given
        memory.createSession(record("session-1", SessionStatus.ACTIVE, null, 1));
        memory.setContext(SESSION, "k", "v");
        memory.registerAgent(SESSION, registration("agent-1", "upload"));
        memory.updateProgress(SESSION, Progress.of(2, 1, 0));
        memory.putTaskResult(SESSION, "t1", Map.of("rows", 1));

        // when
        boolean deleted = memory.deleteSession(SESSION);

        // then
        assertThat(deleted).isTrue();
        assertThat(memory.getSession(SESSION)).isEmpty();
        assertThat(memory.getContext(SESSION)).isEmpty();
        assertThat(memory.listAgents(SESSION)).isEmpty();
        assertThat(memory.getProgress(SESSION)).isEmpty();
        assertThat(memory.getTaskResults(SESSION, Object.class)).isEmpty();
        assertThat(memory.getSessionEvents(SESSION, 100)).isEmpty();
        assertThat(memory.listSessions(null)).isEmpty();
    }

    @Test
    void atomicUpdate는_레코드와_컨텍스트를_함께_기록() {
        // when
        memory.atomicUpdate(
            record("session-1", SessionStatus.ACTIVE, null, 7),
            Map.of("pending_tasks", List.of("a", "b"))
        );

        // then
        assertThat(memory.getSession(SESSION).orElseThrow().version()).isEqualTo(7);
        assertThat(memory.getContextList(SESSION, "pending_tasks", String.class)).containsExactly("a", "b");
        assertThat(memory.getSessionEvents(SESSION, 1).get(0).type()).isEqualTo(MemoryEventType.SESSION_UPDATED);
    }

    // ============================================================
    // 정리
    // ============================================================

    @Test
    void cleanup_보존기간이_지난_종료_세션_제거() {
        // given
        memory.createSession(record("s-old", SessionStatus.COMPLETED, clock.instant().minus(Duration.ofHours(3)), 1));
        memory.createSession(record("s-recent", SessionStatus.COMPLETED, clock.instant(), 1));
        memory.createSession(record("s-active", SessionStatus.ACTIVE, null, 1));

        // when
        int removed = memory.cleanupExpiredSessions();

        // then
        assertThat(removed).isEqualTo(1);
        assertThat(memory.listSessions(null)).extracting(SessionRecord::id)
            .containsExactlyInAnyOrder("s-recent", "s-active");
    }

    @Test
    void cleanup_레코드가_만료된_인덱스_항목_제거() {
        // given
        memory.createSession(record("session-1", SessionStatus.ACTIVE, null, 1));
        clock.advance(Duration.ofHours(3));

        // when
        int removed = memory.cleanupExpiredSessions();

        // then
        assertThat(removed).isEqualTo(1);
        assertThat(store.setMembers("swarm:sessions")).isEmpty();
    }

    // ============================================================
    // 컨텍스트
    // ============================================================

    @Test
    void 컨텍스트_키_생략시_전체_맵_반환() {
        // given
        memory.setContext(SESSION, "count", 3);
        memory.setContext(SESSION, "file", Map.of("path", "/tmp/a.csv"));

        // when
        Map<String, Object> context = memory.getContext(SESSION);

        // then
        assertThat(context).containsEntry("count", 3);
        assertThat(context.get("file")).isEqualTo(Map.of("path", "/tmp/a.csv"));
        assertThat(memory.getContext(SESSION, "count")).contains(3);
        assertThat(memory.getContext(SESSION, "missing")).isEmpty();
    }

    @Test
    void 컨텍스트_변경은_CONTEXT_UPDATED_이벤트를_남김() {
        // when
        memory.setContext(SESSION, "k", "v");

        // then
        MemoryEvent event = memory.getSessionEvents(SESSION, 1).get(0);
        assertThat(event.type()).isEqualTo(MemoryEventType.CONTEXT_UPDATED);
        assertThat(event.data()).containsEntry("key", "k");
    }

    @Test
    void 여러_컨텍스트_값을_한번에_기록하면_이벤트는_하나() {
        // given
        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put("rows", 10);
        updates.put("file", "/tmp/a.csv");

        // when
        memory.updateContext(SESSION, updates);

        // then
        assertThat(memory.getContext(SESSION)).containsEntry("rows", 10).containsEntry("file", "/tmp/a.csv");
        List<MemoryEvent> events = memory.getSessionEvents(SESSION, 10);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).type()).isEqualTo(MemoryEventType.CONTEXT_UPDATED);
        assertThat(events.get(0).data()).containsEntry("keys", List.of("rows", "file"));
    }

    @Test
    void 빈_컨텍스트_갱신은_아무것도_하지_않음() {
        // when
        memory.updateContext(SESSION, Map.of());

        // then
        assertThat(memory.getContext(SESSION)).isEmpty();
        assertThat(memory.getSessionEvents(SESSION, 10)).isEmpty();
    }

    @Test
    void 타입_지정_컨텍스트_조회() {
        // given
        memory.setContext(SESSION, "results", Map.of("t1", 10, "t2", 20));

        // when
        Map<String, Integer> results = memory.getContextMap(SESSION, "results", Integer.class);

        // then
        assertThat(results).containsEntry("t1", 10).containsEntry("t2", 20);
        assertThat(memory.getContextMap(SESSION, "missing", Integer.class)).isEmpty();
        assertThat(memory.getContextList(SESSION, "missing", String.class)).isEmpty();
    }

    @Test
    void 잘못된_JSON_컨텍스트는_StoreException() {
        // given
        store.hashSet("swarm:session:session-1:context", Map.of("raw", "{not json"));

        // when & then
        assertThatThrownBy(() -> memory.getContext(SESSION, "raw"))
            .isInstanceOf(StoreException.class);
    }

    // ============================================================
    // Task 결과
    // ============================================================

    @Test
    void Task_결과는_Task별로_기록되어_서로_덮어쓰지_않음() {
        // when
        memory.putTaskResult(SESSION, "t1", Map.of("agent", "worker-1"));
        memory.putTaskResult(SESSION, "t2", Map.of("agent", "worker-2"));

        // then
        Map<String, Object> results = memory.getTaskResults(SESSION, Object.class);
        assertThat(results).containsOnlyKeys("t1", "t2");
        assertThat(results.get("t1")).isEqualTo(Map.of("agent", "worker-1"));
        assertThat(memory.getTaskResult(SESSION, "t2", Map.class)).hasValue(Map.of("agent", "worker-2"));
        assertThat(memory.getContext(SESSION)).isEmpty();
    }

    @Test
    void Task_결과_기록은_task_id를_담은_CONTEXT_UPDATED_이벤트를_남김() {
        // when
        memory.putTaskResult(SESSION, "t1", Map.of());

        // then
        MemoryEvent event = memory.getSessionEvents(SESSION, 1).get(0);
        assertThat(event.type()).isEqualTo(MemoryEventType.CONTEXT_UPDATED);
        assertThat(event.data())
            .containsEntry("key", MemoryCoordinator.TASK_RESULTS)
            .containsEntry("task_id", "t1");
    }

    // ============================================================
    // Agent
    // ============================================================

    @Test
    void Agent_등록시_등록시각과_heartbeat가_기록됨() {
        // when
        memory.registerAgent(SESSION, registration("agent-1", "upload"));

        // then
        AgentRegistration agent = memory.getAgent(SESSION, AgentId.of("agent-1")).orElseThrow();
        assertThat(agent.status()).isEqualTo(AgentStatus.IDLE);
        assertThat(agent.registeredAt()).isEqualTo(clock.instant());
        assertThat(agent.lastHeartbeat()).isEqualTo(clock.instant());
        assertThat(agent.launchMode()).isEqualTo("IN_PROCESS");
        assertThat(memory.getSessionEvents(SESSION, 1).get(0).sourceAgent()).isEqualTo("agent-1");
    }

    @Test
    void heartbeat_패치가_등록정보에_병합됨() {
        // given
        memory.registerAgent(SESSION, registration("agent-1", "upload"));
        clock.advanceMillis(5000);

        // when
        boolean updated = memory.updateAgentHeartbeat(SESSION, AgentId.of("agent-1"), Map.of(
            AgentRegistration.STATUS, "BUSY",
            AgentRegistration.CURRENT_TASKS, List.of("t1"),
            AgentRegistration.TASKS_COMPLETED, 4
        ));

        // then
        assertThat(updated).isTrue();
        AgentRegistration agent = memory.getAgent(SESSION, AgentId.of("agent-1")).orElseThrow();
        assertThat(agent.status()).isEqualTo(AgentStatus.BUSY);
        assertThat(agent.currentTasks()).containsExactly("t1");
        assertThat(agent.tasksCompleted()).isEqualTo(4);
        assertThat(agent.lastHeartbeat()).isEqualTo(clock.instant());
        assertThat(agent.capabilities()).containsExactly("upload");
    }

    @Test
    void updateAgent는_패치를_병합하고_이벤트를_남기지_않음() {
        // given
        memory.registerAgent(SESSION, registration("agent-1", "upload"));
        Instant registeredAt = clock.instant();
        int eventsBefore = memory.getSessionEvents(SESSION, 100).size();
        clock.advanceMillis(2000);

        // when
        boolean updated = memory.updateAgent(SESSION, AgentId.of("agent-1"), Map.of(
            AgentRegistration.STATUS, AgentStatus.BUSY,
            AgentRegistration.TASKS_FAILED, 2
        ));

        // then
        assertThat(updated).isTrue();
        AgentRegistration agent = memory.getAgent(SESSION, AgentId.of("agent-1")).orElseThrow();
        assertThat(agent.status()).isEqualTo(AgentStatus.BUSY);
        assertThat(agent.tasksFailed()).isEqualTo(2);
        assertThat(agent.lastHeartbeat()).isEqualTo(registeredAt);
        assertThat(memory.getSessionEvents(SESSION, 100)).hasSize(eventsBefore);
        assertThat(memory.updateAgent(SESSION, AgentId.of("ghost"), Map.of())).isFalse();
    }

    @Test
    void 등록되지_않은_Agent_heartbeat는_false() {
        // when & then
        assertThat(memory.updateAgentHeartbeat(SESSION, AgentId.of("ghost"), Map.of())).isFalse();
    }

    @Test
    void 사용가능_Agent는_IDLE이고_heartbeat가_신선해야함() {
        // given
        memory.registerAgent(SESSION, registration("agent-idle", "upload"));
        memory.registerAgent(SESSION, registration("agent-busy", "upload"));
        memory.registerAgent(SESSION, registration("agent-other", "analysis"));
        memory.updateAgentStatus(SESSION, AgentId.of("agent-busy"), AgentStatus.BUSY);

        // when
        List<AgentRegistration> available = memory.findAvailableAgents(SESSION, Set.of("upload"));

        // then
        assertThat(available).extracting(AgentRegistration::agentId).containsExactly("agent-idle");
        assertThat(memory.findAvailableAgents(SESSION, null)).hasSize(2);
    }

    @Test
    void heartbeat가_60초보다_오래되면_사용불가() {
        // given
        memory.registerAgent(SESSION, registration("agent-1", "upload"));

        // when
        clock.advance(Duration.ofSeconds(61));

        // then
        assertThat(memory.findAvailableAgents(SESSION, Set.of("upload"))).isEmpty();

        memory.updateAgentHeartbeat(SESSION, AgentId.of("agent-1"), Map.of());
        assertThat(memory.findAvailableAgents(SESSION, Set.of("upload"))).hasSize(1);
    }

    @Test
    void updateAgentStatus는_heartbeat를_갱신하지_않음() {
        // given
        memory.registerAgent(SESSION, registration("agent-1", "upload"));
        Instant registeredAt = clock.instant();
        clock.advanceMillis(1000);

        // when
        memory.updateAgentStatus(SESSION, AgentId.of("agent-1"), AgentStatus.OFFLINE);

        // then
        AgentRegistration agent = memory.getAgent(SESSION, AgentId.of("agent-1")).orElseThrow();
        assertThat(agent.status()).isEqualTo(AgentStatus.OFFLINE);
        assertThat(agent.lastHeartbeat()).isEqualTo(registeredAt);
    }

    @Test
    void Agent_등록_해제() {
        // given
        memory.registerAgent(SESSION, registration("agent-1", "upload"));

        // when
        boolean removed = memory.unregisterAgent(SESSION, AgentId.of("agent-1"));

        // then
        assertThat(removed).isTrue();
        assertThat(memory.listAgents(SESSION)).isEmpty();
    }

    @Test
    void Task_claim은_한_Agent만_성공() {
        // when
        boolean first = memory.claimTask(SESSION, "task-1", AgentId.of("agent-1"));
        boolean second = memory.claimTask(SESSION, "task-1", AgentId.of("agent-2"));

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(memory.getSessionEvents(SESSION, 10))
            .extracting(MemoryEvent::type)
            .containsExactly(MemoryEventType.TASK_ASSIGNED);
    }

    // ============================================================
    // 진행률 / 이벤트
    // ============================================================

    @Test
    void 진행률_저장_후_조회() {
        // when
        memory.updateProgress(SESSION, Progress.of(4, 1, 1));

        // then
        Progress progress = memory.getProgress(SESSION).orElseThrow();
        assertThat(progress.total()).isEqualTo(4);
        assertThat(progress.completed()).isEqualTo(1);
        assertThat(progress.failed()).isEqualTo(1);
        assertThat(progress.percentage()).isEqualTo(25.0);
    }

    @Test
    void 이벤트_로그는_용량으로_잘리고_최신이_앞() {
        // given
        memory = new MemoryCoordinator(store, new MemoryConfig().withEventLogCapacity(3), clock);

        // when
        for (int i = 0; i < 5; i++) {
            memory.emitEvent(MemoryEventType.TASK_COMPLETED, SESSION, Map.of("seq", i), null);
        }

        // then
        List<MemoryEvent> events = memory.getSessionEvents(SESSION, 10);
        assertThat(events).extracting(event -> event.data().get("seq")).containsExactly(4, 3, 2);
        assertThat(memory.getSessionEvents(SESSION, 2)).hasSize(2);
    }

    @Test
    void 만료된_이벤트는_로그_조회에서_제외() {
        // given
        memory.emitEvent(MemoryEventType.TASK_FAILED, SESSION, Map.of(), null);

        // when
        clock.advance(Duration.ofHours(1).plusSeconds(1));

        // then
        assertThat(memory.getSessionEvents(SESSION, 10)).isEmpty();
    }

    @Test
    void 구독자는_세션_채널의_이벤트를_수신() {
        // given
        List<MemoryEvent> received = new ArrayList<>();
        Subscription subscription = memory.subscribe(SESSION, received::add);

        // when
        memory.emitEvent(MemoryEventType.TASK_COMPLETED, SESSION, Map.of("task_id", "t1"), "agent-1");
        memory.emitEvent(MemoryEventType.TASK_COMPLETED, SessionId.of("other"), Map.of(), null);
        subscription.close();
        memory.emitEvent(MemoryEventType.TASK_COMPLETED, SESSION, Map.of(), null);

        // then
        assertThat(received).hasSize(1);
        assertThat(received.get(0).type()).isEqualTo(MemoryEventType.TASK_COMPLETED);
        assertThat(received.get(0).data()).containsEntry("task_id", "t1");
        assertThat(received.get(0).sourceAgent()).isEqualTo("agent-1");
    }

    @Test
    void 저장소_통계는_세션_상태별_수와_만료_항목을_집계() {
        // given
        memory.createSession(record("s-active", SessionStatus.ACTIVE, null, 1));
        memory.createSession(record("s-done", SessionStatus.COMPLETED, clock.instant(), 1));
        memory.registerAgent(SessionId.of("s-active"), registration("agent-1", "upload"));
        store.delete("swarm:session:s-done");

        // when
        MemoryStats stats = memory.getMemoryStats();

        // then
        assertThat(stats.namespace()).isEqualTo("swarm");
        assertThat(stats.totalSessions()).isEqualTo(2);
        assertThat(stats.sessionsByStatus()).containsEntry(SessionStatus.ACTIVE, 1)
            .containsEntry(SessionStatus.COMPLETED, 0);
        assertThat(stats.activeSessions()).isEqualTo(1);
        assertThat(stats.expiredSessions()).isEqualTo(1);
        assertThat(stats.totalAgents()).isEqualTo(1);
        assertThat(stats.totalEvents()).isEqualTo(3);
    }

    @Test
    void 이벤트_유형은_소문자_wire_이름으로_직렬화() {
        // when
        MemoryEvent event = memory.emitEvent(MemoryEventType.AGENT_HEARTBEAT, SESSION, Map.of(), null);

        // then
        assertThat(store.get("swarm:event:" + event.id()).orElseThrow()).contains("\"type\":\"agent_heartbeat\"");
    }

    @Test
    void 네임스페이스가_키_접두사로_사용됨() {
        // given
        memory = new MemoryCoordinator(store, new MemoryConfig().withNamespace("tenant-a"), clock);

        // when
        memory.setContext(SESSION, "k", "v");

        // then
        assertThat(store.exists("tenant-a:session:session-1:context")).isTrue();
        assertThat(store.exists("swarm:session:session-1:context")).isFalse();
    }
}
