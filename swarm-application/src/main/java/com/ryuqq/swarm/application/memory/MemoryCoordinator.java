package com.ryuqq.swarm.application.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.swarm.core.error.StoreException;
import com.ryuqq.swarm.core.model.AgentId;
import com.ryuqq.swarm.core.model.Progress;
import com.ryuqq.swarm.core.model.SessionId;
import com.ryuqq.swarm.core.spi.BackingStore;
import com.ryuqq.swarm.core.spi.Subscription;
import com.ryuqq.swarm.core.statemachine.AgentStatus;
import com.ryuqq.swarm.core.statemachine.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * 교차 프로세스 세션 상태 조정자.
 *
 * <p>세션 레코드, 세션별 공유 컨텍스트, Agent 등록 정보, 진행률, 세션별 이벤트 로그와
 * pub/sub 채널을 {@link BackingStore} 위에 네임스페이스로 구분하여 저장합니다.</p>
 *
 * <p><strong>키 구조 (ns = namespace):</strong></p>
 * <pre>
 * ns:sessions                          세션 ID 집합
 * ns:session:{id}                      SessionRecord (JSON)
 * ns:session:{id}:context              공유 컨텍스트 (hash, 값은 JSON)
 * ns:session:{id}:results              Task 결과 (hash, Task ID → JSON)
 * ns:session:{id}:progress             진행률 (hash)
 * ns:session:{id}:agents               Agent ID 집합
 * ns:session:{id}:agent:{agentId}      AgentRegistration (JSON)
 * ns:session:{id}:events               이벤트 ID 목록 (최신이 앞, 길이 제한)
 * ns:session:{id}:claim:{taskId}       Task claim
 * ns:event:{eventId}                   MemoryEvent (JSON)
 * ns:events:{id}                       pub/sub 채널
 * </pre>
 *
 * <p><strong>일관성:</strong> 키 단위 last-writer-wins. 여러 키를 원자적으로 갱신해야 하면
 * {@link #atomicUpdate(SessionRecord, Map)}를 사용합니다.</p>
 *
 * <p><strong>오류:</strong> 저장소 접근 또는 (역)직렬화 실패는 {@link StoreException}으로 전파됩니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class MemoryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MemoryCoordinator.class);

    /**
     * Task 결과 변경 이벤트의 {@code key} 값.
     */
    public static final String TASK_RESULTS = "task_results";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final BackingStore store;
    private final MemoryConfig config;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    /**
     * 기본 설정과 시스템 UTC 시계로 생성.
     *
     * @param store Backing Store
     */
    public MemoryCoordinator(BackingStore store) {
        this(store, new MemoryConfig(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param store Backing Store
     * @param config 설정
     * @param clock 시계
     */
    public MemoryCoordinator(BackingStore store, MemoryConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.objectMapper = createObjectMapper();
    }

    /**
     * 저장소 값 직렬화에 사용하는 ObjectMapper 구성.
     *
     * @return snake_case, ISO-8601 날짜, 알 수 없는 속성 무시
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    // ============================================================
    // 세션
    // ============================================================

    /**
     * 세션 레코드 저장 후 SESSION_CREATED 이벤트 발행.
     *
     * @param record 세션 레코드
     */
    public void createSession(SessionRecord record) {
        store.set(sessionKey(record.id()), write(record), sessionTtl());
        store.setAdd(sessionsKey(), record.id());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", record.name());
        data.put("status", record.status());
        data.put("task_count", record.tasks().size());
        emitEvent(MemoryEventType.SESSION_CREATED, SessionId.of(record.id()), data, null);
        log.debug("Session record created: {}", record.id());
    }

    public Optional<SessionRecord> getSession(SessionId sessionId) {
        return store.get(sessionKey(sessionId.getValue())).map(json -> read(json, SessionRecord.class));
    }

    /**
     * 세션 레코드 갱신 (TTL 연장) 후 SESSION_UPDATED 이벤트 발행.
     *
     * @param record 세션 레코드
     */
    public void updateSession(SessionRecord record) {
        store.set(sessionKey(record.id()), write(record), sessionTtl());
        store.setAdd(sessionsKey(), record.id());
        emitEvent(MemoryEventType.SESSION_UPDATED, SessionId.of(record.id()), sessionUpdateData(record), null);
    }

    /**
     * 세션 레코드와 컨텍스트 항목을 하나의 원자적 배치로 기록.
     *
     * @param record 세션 레코드
     * @param contextEntries 컨텍스트 항목 (비어 있을 수 있음)
     */
    public void atomicUpdate(SessionRecord record, Map<String, Object> contextEntries) {
        String recordJson = write(record);
        Map<String, String> encoded = new LinkedHashMap<>();
        contextEntries.forEach((key, value) -> encoded.put(key, write(value)));
        String contextKey = sessionKey(record.id()) + ":context";

        store.executeAtomically(batch -> {
            batch.set(sessionKey(record.id()), recordJson, sessionTtl());
            batch.setAdd(sessionsKey(), record.id());
            if (!encoded.isEmpty()) {
                batch.hashSet(contextKey, encoded);
                batch.expire(contextKey, sessionTtl());
            }
        });
        emitEvent(MemoryEventType.SESSION_UPDATED, SessionId.of(record.id()), sessionUpdateData(record), null);
    }

    /**
     * 세션과 세션 범위의 모든 키 삭제.
     *
     * @param sessionId 세션 ID
     * @return 세션 레코드가 존재했으면 true
     */
    public boolean deleteSession(SessionId sessionId) {
        String id = sessionId.getValue();
        String base = sessionKey(id);
        boolean existed = store.exists(base);

        List<String> keys = new ArrayList<>();
        keys.add(base);
        keys.add(base + ":context");
        keys.add(base + ":results");
        keys.add(base + ":progress");
        keys.add(base + ":agents");
        keys.add(base + ":events");
        for (String agentId : store.setMembers(base + ":agents")) {
            keys.add(agentKey(id, agentId));
        }
        for (String eventId : store.listRange(base + ":events", 0, -1)) {
            keys.add(eventKey(eventId));
        }
        store.delete(keys.toArray(new String[0]));
        store.setRemove(sessionsKey(), id);
        log.debug("Session record deleted: {} (keys: {})", id, keys.size());
        return existed;
    }

    /**
     * 세션 목록 조회.
     *
     * @param status 상태 필터 (null이면 전체)
     * @return 세션 레코드 (만료된 항목 제외)
     */
    public List<SessionRecord> listSessions(SessionStatus status) {
        List<SessionRecord> sessions = new ArrayList<>();
        for (String id : store.setMembers(sessionsKey())) {
            store.get(sessionKey(id))
                .map(json -> read(json, SessionRecord.class))
                .filter(record -> status == null || record.status() == status)
                .ifPresent(sessions::add);
        }
        return sessions;
    }

    /**
     * 보존 기간이 지난 세션 정리.
     *
     * <p>종료 시각이 sessionTtl보다 오래된 세션과, 레코드가 이미 만료된 인덱스 항목을 제거합니다.</p>
     *
     * @return 제거된 세션 수
     */
    public int cleanupExpiredSessions() {
        Instant cutoff = clock.instant().minusMillis(config.sessionTtlMs());
        int removed = 0;
        for (String id : store.setMembers(sessionsKey())) {
            try {
                Optional<SessionRecord> record = getSession(SessionId.of(id));
                if (record.isEmpty()) {
                    deleteSession(SessionId.of(id));
                    removed++;
                } else if (record.get().completedAt() != null && record.get().completedAt().isBefore(cutoff)) {
                    deleteSession(SessionId.of(id));
                    removed++;
                }
            } catch (StoreException e) {
                log.warn("Failed to clean up session {}: {}", id, e.getMessage());
            }
        }
        if (removed > 0) {
            log.info("Cleaned up {} expired session(s)", removed);
        }
        return removed;
    }

    // ============================================================
    // 공유 컨텍스트
    // ============================================================

    /**
     * 컨텍스트 값 기록 후 CONTEXT_UPDATED 이벤트 발행.
     *
     * @param sessionId 세션 ID
     * @param key 컨텍스트 키
     * @param value 값 (JSON 직렬화 가능)
     */
    public void setContext(SessionId sessionId, String key, Object value) {
        String contextKey = contextKey(sessionId);
        store.hashSet(contextKey, Map.of(key, write(value)));
        store.expire(contextKey, sessionTtl());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("key", key);
        emitEvent(MemoryEventType.CONTEXT_UPDATED, sessionId, data, null);
    }

    /**
     * 여러 컨텍스트 값을 한 번에 기록 후 CONTEXT_UPDATED 이벤트 하나 발행.
     *
     * @param sessionId 세션 ID
     * @param updates 키 → 값 (비어 있으면 아무것도 하지 않음)
     */
    public void updateContext(SessionId sessionId, Map<String, Object> updates) {
        if (updates == null || updates.isEmpty()) {
            return;
        }
        Map<String, String> encoded = new LinkedHashMap<>();
        updates.forEach((key, value) -> encoded.put(key, write(value)));
        String contextKey = contextKey(sessionId);
        store.hashSet(contextKey, encoded);
        store.expire(contextKey, sessionTtl());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("keys", new ArrayList<>(encoded.keySet()));
        emitEvent(MemoryEventType.CONTEXT_UPDATED, sessionId, data, null);
    }

    /**
     * 컨텍스트 값 조회 (JSON 트리를 Map/List/기본형으로 변환).
     *
     * @param sessionId 세션 ID
     * @param key 컨텍스트 키
     * @return 값 (없으면 empty)
     */
    public Optional<Object> getContext(SessionId sessionId, String key) {
        return store.hashGet(contextKey(sessionId), key).map(json -> read(json, Object.class));
    }

    public <T> Optional<T> getContext(SessionId sessionId, String key, Class<T> type) {
        return store.hashGet(contextKey(sessionId), key).map(json -> read(json, type));
    }

    /**
     * 목록 컨텍스트 값 조회.
     *
     * @return 값 (없으면 빈 목록)
     */
    public <T> List<T> getContextList(SessionId sessionId, String key, Class<T> elementType) {
        JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
        return store.hashGet(contextKey(sessionId), key)
            .<List<T>>map(json -> read(json, listType))
            .orElseGet(List::of);
    }

    /**
     * 맵 컨텍스트 값 조회.
     *
     * @return 값 (없으면 빈 맵)
     */
    public <V> Map<String, V> getContextMap(SessionId sessionId, String key, Class<V> valueType) {
        JavaType mapType = objectMapper.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, valueType);
        return store.hashGet(contextKey(sessionId), key)
            .<Map<String, V>>map(json -> read(json, mapType))
            .orElseGet(LinkedHashMap::new);
    }

    /**
     * 전체 컨텍스트 조회.
     *
     * @param sessionId 세션 ID
     * @return 키 → 값
     */
    public Map<String, Object> getContext(SessionId sessionId) {
        Map<String, Object> context = new LinkedHashMap<>();
        store.hashGetAll(contextKey(sessionId))
            .forEach((key, json) -> context.put(key, read(json, Object.class)));
        return context;
    }

    // ============================================================
    // Task 결과
    // ============================================================

    /**
     * Task 결과 기록. Task마다 별도 hash 필드를 사용하므로 여러 Agent가 동시에 기록해도
     * 서로의 결과를 덮어쓰지 않습니다.
     *
     * @param sessionId 세션 ID
     * @param taskId Task ID
     * @param result 결과 (JSON 직렬화 가능)
     */
    public void putTaskResult(SessionId sessionId, String taskId, Object result) {
        String resultsKey = resultsKey(sessionId);
        store.hashSet(resultsKey, Map.of(taskId, write(result)));
        store.expire(resultsKey, sessionTtl());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("key", TASK_RESULTS);
        data.put("task_id", taskId);
        emitEvent(MemoryEventType.CONTEXT_UPDATED, sessionId, data, null);
    }

    /**
     * 세션의 모든 Task 결과 조회.
     *
     * @return Task ID → 결과 (없으면 빈 맵)
     */
    public <V> Map<String, V> getTaskResults(SessionId sessionId, Class<V> valueType) {
        Map<String, V> results = new LinkedHashMap<>();
        store.hashGetAll(resultsKey(sessionId))
            .forEach((taskId, json) -> results.put(taskId, read(json, valueType)));
        return results;
    }

    public <V> Optional<V> getTaskResult(SessionId sessionId, String taskId, Class<V> valueType) {
        return store.hashGet(resultsKey(sessionId), taskId).map(json -> read(json, valueType));
    }

    // ============================================================
    // Agent
    // ============================================================

    /**
     * Agent 등록 (등록 시각과 heartbeat를 현재 시각으로 설정) 후 AGENT_REGISTERED 이벤트 발행.
     *
     * @param sessionId 세션 ID
     * @param registration 등록 정보
     */
    public void registerAgent(SessionId sessionId, AgentRegistration registration) {
        Instant now = clock.instant();
        AgentRegistration stamped = registration.withTimestamps(now, now);
        store.set(agentKey(sessionId.getValue(), stamped.agentId()), write(stamped), sessionTtl());
        String agentsKey = sessionKey(sessionId.getValue()) + ":agents";
        store.setAdd(agentsKey, stamped.agentId());
        store.expire(agentsKey, sessionTtl());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agent_id", stamped.agentId());
        data.put("name", stamped.name());
        data.put("capabilities", stamped.capabilities());
        emitEvent(MemoryEventType.AGENT_REGISTERED, sessionId, data, stamped.agentId());
        log.info("Agent registered: {} (session: {})", stamped.agentId(), sessionId);
    }

    /**
     * heartbeat 갱신. 패치 항목은 등록 정보의 snake_case 필드 위에 덮어씁니다.
     *
     * @param sessionId 세션 ID
     * @param agentId Agent ID
     * @param statusPatch 변경 항목 (예: {@link AgentRegistration#STATUS}, {@link AgentRegistration#CURRENT_TASKS})
     * @return 등록된 Agent이면 true
     */
    public boolean updateAgentHeartbeat(SessionId sessionId, AgentId agentId, Map<String, Object> statusPatch) {
        Optional<AgentRegistration> current = getAgent(sessionId, agentId);
        if (current.isEmpty()) {
            log.warn("Heartbeat from unregistered agent {} (session: {})", agentId, sessionId);
            return false;
        }
        Map<String, Object> patch = new LinkedHashMap<>();
        if (statusPatch != null) {
            patch.putAll(statusPatch);
        }
        patch.put("last_heartbeat", clock.instant());
        AgentRegistration updated = merge(sessionId, current.get(), patch);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agent_id", agentId.getValue());
        data.put("status", updated.status());
        emitEvent(MemoryEventType.AGENT_HEARTBEAT, sessionId, data, agentId.getValue());
        return true;
    }

    /**
     * 등록 정보에 패치 병합 (heartbeat 시각은 패치에 있을 때만 변경, 이벤트 없음).
     *
     * <p>Orchestrator가 in-process Agent 상태를 미러링할 때 사용합니다.</p>
     *
     * @param sessionId 세션 ID
     * @param agentId Agent ID
     * @param patch 변경 항목
     * @return 등록된 Agent이면 true
     */
    public boolean updateAgent(SessionId sessionId, AgentId agentId, Map<String, Object> patch) {
        Optional<AgentRegistration> current = getAgent(sessionId, agentId);
        if (current.isEmpty()) {
            return false;
        }
        merge(sessionId, current.get(), patch == null ? Map.of() : patch);
        return true;
    }

    /**
     * Agent 상태만 변경 (heartbeat는 갱신하지 않음).
     *
     * @return 등록된 Agent이면 true
     */
    public boolean updateAgentStatus(SessionId sessionId, AgentId agentId, AgentStatus status) {
        Optional<AgentRegistration> current = getAgent(sessionId, agentId);
        if (current.isEmpty()) {
            return false;
        }
        store.set(agentKey(sessionId.getValue(), agentId.getValue()), write(current.get().withStatus(status)), sessionTtl());
        return true;
    }

    public Optional<AgentRegistration> getAgent(SessionId sessionId, AgentId agentId) {
        return store.get(agentKey(sessionId.getValue(), agentId.getValue()))
            .map(json -> read(json, AgentRegistration.class));
    }

    /**
     * 세션의 Agent 목록 (만료된 등록 제외).
     */
    public List<AgentRegistration> listAgents(SessionId sessionId) {
        List<AgentRegistration> agents = new ArrayList<>();
        for (String agentId : store.setMembers(sessionKey(sessionId.getValue()) + ":agents")) {
            store.get(agentKey(sessionId.getValue(), agentId))
                .map(json -> read(json, AgentRegistration.class))
                .ifPresent(agents::add);
        }
        return agents;
    }

    /**
     * 사용 가능한 Agent 조회.
     *
     * <p>IDLE 상태이면서 heartbeat가 freshness 기간 안에 수신된 Agent만 반환합니다.</p>
     *
     * @param sessionId 세션 ID
     * @param capabilities 요구 capability (null 또는 비어 있으면 필터 없음)
     * @return 사용 가능 Agent
     */
    public List<AgentRegistration> findAvailableAgents(SessionId sessionId, Collection<String> capabilities) {
        Instant freshAfter = clock.instant().minusMillis(config.heartbeatFreshnessMs());
        List<AgentRegistration> available = new ArrayList<>();
        for (AgentRegistration agent : listAgents(sessionId)) {
            if (agent.status() != AgentStatus.IDLE) {
                continue;
            }
            if (agent.lastHeartbeat() == null || agent.lastHeartbeat().isBefore(freshAfter)) {
                continue;
            }
            if (capabilities != null && !capabilities.isEmpty() && !agent.hasAnyCapability(capabilities)) {
                continue;
            }
            available.add(agent);
        }
        return available;
    }

    /**
     * Agent 등록 해제.
     *
     * @return 등록 정보가 존재했으면 true
     */
    public boolean unregisterAgent(SessionId sessionId, AgentId agentId) {
        long deleted = store.delete(agentKey(sessionId.getValue(), agentId.getValue()));
        store.setRemove(sessionKey(sessionId.getValue()) + ":agents", agentId.getValue());
        return deleted > 0;
    }

    /**
     * Task claim (set-if-absent). 같은 Task를 두 Agent가 실행하지 않도록 합니다.
     *
     * @param sessionId 세션 ID
     * @param taskId Task ID
     * @param agentId claim하는 Agent
     * @return claim에 성공하면 true
     */
    public boolean claimTask(SessionId sessionId, String taskId, AgentId agentId) {
        boolean claimed = store.setIfAbsent(
            sessionKey(sessionId.getValue()) + ":claim:" + taskId, agentId.getValue(), sessionTtl()
        );
        if (claimed) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("task_id", taskId);
            data.put("agent_id", agentId.getValue());
            emitEvent(MemoryEventType.TASK_ASSIGNED, sessionId, data, agentId.getValue());
        }
        return claimed;
    }

    // ============================================================
    // 진행률
    // ============================================================

    public void updateProgress(SessionId sessionId, Progress progress) {
        String progressKey = sessionKey(sessionId.getValue()) + ":progress";
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("total", String.valueOf(progress.total()));
        fields.put("completed", String.valueOf(progress.completed()));
        fields.put("failed", String.valueOf(progress.failed()));
        fields.put("percentage", String.valueOf(progress.percentage()));
        fields.put("updated_at", clock.instant().toString());
        store.hashSet(progressKey, fields);
        store.expire(progressKey, sessionTtl());
    }

    public Optional<Progress> getProgress(SessionId sessionId) {
        Map<String, String> fields = store.hashGetAll(sessionKey(sessionId.getValue()) + ":progress");
        if (fields.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Progress(
                Integer.parseInt(fields.getOrDefault("total", "0")),
                Integer.parseInt(fields.getOrDefault("completed", "0")),
                Integer.parseInt(fields.getOrDefault("failed", "0")),
                Double.parseDouble(fields.getOrDefault("percentage", "0"))
            ));
        } catch (NumberFormatException e) {
            throw new StoreException("Malformed progress for session " + sessionId, e);
        }
    }

    // ============================================================
    // 이벤트
    // ============================================================

    /**
     * 이벤트 저장, 세션 이벤트 로그에 추가 (길이 제한), 세션 채널로 발행.
     *
     * @param type 유형
     * @param sessionId 세션 ID
     * @param data 페이로드
     * @param sourceAgent 발생 Agent (선택)
     * @return 발행된 이벤트
     */
    public MemoryEvent emitEvent(MemoryEventType type, SessionId sessionId, Map<String, Object> data, String sourceAgent) {
        MemoryEvent event = new MemoryEvent(
            UUID.randomUUID().toString(), type, sessionId.getValue(), clock.instant(), data, sourceAgent
        );
        String json = write(event);
        String eventsKey = sessionKey(sessionId.getValue()) + ":events";

        store.set(eventKey(event.id()), json, Duration.ofMillis(config.eventTtlMs()));
        store.listPush(eventsKey, event.id());
        store.listTrim(eventsKey, 0, config.eventLogCapacity() - 1L);
        store.expire(eventsKey, sessionTtl());
        store.publish(channel(sessionId), json);
        return event;
    }

    /**
     * 최근 이벤트 조회 (최신이 앞).
     *
     * @param sessionId 세션 ID
     * @param limit 최대 개수
     * @return 이벤트 (만료된 이벤트 제외)
     */
    public List<MemoryEvent> getSessionEvents(SessionId sessionId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<MemoryEvent> events = new ArrayList<>();
        for (String eventId : store.listRange(sessionKey(sessionId.getValue()) + ":events", 0, limit - 1L)) {
            store.get(eventKey(eventId))
                .map(json -> read(json, MemoryEvent.class))
                .ifPresent(events::add);
        }
        return events;
    }

    /**
     * 세션 채널 구독.
     *
     * <p>역직렬화할 수 없는 메시지는 경고 로그 후 건너뜁니다.</p>
     *
     * @param sessionId 세션 ID
     * @param listener 이벤트 리스너
     * @return 구독 (close로 해제)
     */
    public Subscription subscribe(SessionId sessionId, Consumer<MemoryEvent> listener) {
        return store.subscribe(channel(sessionId), (channel, message) -> {
            MemoryEvent event;
            try {
                event = objectMapper.readValue(message, MemoryEvent.class);
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed event on {}: {}", channel, e.getOriginalMessage());
                return;
            }
            listener.accept(event);
        });
    }

    // ============================================================
    // 통계
    // ============================================================

    /**
     * 네임스페이스의 저장소 사용 통계.
     *
     * <p>세션 인덱스를 순회하며 계산하므로 세션 수에 비례하는 비용이 듭니다.</p>
     *
     * @return 통계
     */
    public MemoryStats getMemoryStats() {
        Set<String> ids = store.setMembers(sessionsKey());
        Map<SessionStatus, Integer> byStatus = new EnumMap<>(SessionStatus.class);
        int expired = 0;
        int agents = 0;
        long events = 0;
        for (String id : ids) {
            Optional<SessionRecord> record = store.get(sessionKey(id)).map(json -> read(json, SessionRecord.class));
            if (record.isPresent()) {
                byStatus.merge(record.get().status(), 1, Integer::sum);
            } else {
                expired++;
            }
            agents += store.setMembers(sessionKey(id) + ":agents").size();
            events += store.listRange(sessionKey(id) + ":events", 0, -1).size();
        }
        return new MemoryStats(config.namespace(), ids.size(), byStatus, expired, agents, events);
    }

    public MemoryConfig getConfig() {
        return config;
    }

    // ============================================================
    // 내부
    // ============================================================

    private Map<String, Object> sessionUpdateData(SessionRecord record) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", record.status());
        data.put("progress", record.progress());
        data.put("version", record.version());
        return data;
    }

    private Duration sessionTtl() {
        return Duration.ofMillis(config.sessionTtlMs());
    }

    private String sessionsKey() {
        return config.namespace() + ":sessions";
    }

    private String sessionKey(String sessionId) {
        return config.namespace() + ":session:" + sessionId;
    }

    private String contextKey(SessionId sessionId) {
        return sessionKey(sessionId.getValue()) + ":context";
    }

    private String resultsKey(SessionId sessionId) {
        return sessionKey(sessionId.getValue()) + ":results";
    }

    private String agentKey(String sessionId, String agentId) {
        return sessionKey(sessionId) + ":agent:" + agentId;
    }

    private String eventKey(String eventId) {
        return config.namespace() + ":event:" + eventId;
    }

    private String channel(SessionId sessionId) {
        return config.namespace() + ":events:" + sessionId.getValue();
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    private <T> T read(String json, JavaType type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize " + type, e);
        }
    }

    private AgentRegistration merge(SessionId sessionId, AgentRegistration current, Map<String, Object> patch) {
        Map<String, Object> merged = objectMapper.convertValue(current, MAP_TYPE);
        merged.putAll(patch);
        AgentRegistration updated = convert(merged, AgentRegistration.class);
        store.set(agentKey(sessionId.getValue(), current.agentId()), write(updated), sessionTtl());
        return updated;
    }

    private <T> T convert(Map<String, Object> value, Class<T> type) {
        try {
            return objectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new StoreException("Failed to convert to " + type.getSimpleName(), e);
        }
    }
}
