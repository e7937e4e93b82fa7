package com.ryuqq.swarm.application.memory;

import java.util.Properties;

/**
 * Memory Coordinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>namespace: 모든 키와 채널의 접두사 (기본 "swarm")</li>
 *   <li>sessionTtlMs: 세션 범위 키의 TTL, 종료 세션 보존 기간 (기본 7200000ms = 2시간)</li>
 *   <li>eventTtlMs: 개별 이벤트 TTL (기본 3600000ms = 1시간)</li>
 *   <li>eventLogCapacity: 세션별 이벤트 로그 최대 길이 (기본 1000)</li>
 *   <li>heartbeatFreshnessMs: 사용 가능 Agent 판단 기준 (기본 60000ms)</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record MemoryConfig(
    String namespace,
    long sessionTtlMs,
    long eventTtlMs,
    int eventLogCapacity,
    long heartbeatFreshnessMs
) {

    private static final String PREFIX = "swarm.memory.";

    /**
     * 기본 설정 생성자.
     */
    public MemoryConfig() {
        this("swarm", 7200000, 3600000, 1000, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MemoryConfig {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be null or blank");
        }
        if (namespace.contains(":")) {
            throw new IllegalArgumentException("namespace cannot contain ':' (current: " + namespace + ")");
        }
        if (sessionTtlMs <= 0) {
            throw new IllegalArgumentException(
                "sessionTtlMs must be positive (current: " + sessionTtlMs + ")"
            );
        }
        if (eventTtlMs <= 0) {
            throw new IllegalArgumentException(
                "eventTtlMs must be positive (current: " + eventTtlMs + ")"
            );
        }
        if (eventLogCapacity <= 0) {
            throw new IllegalArgumentException(
                "eventLogCapacity must be positive (current: " + eventLogCapacity + ")"
            );
        }
        if (heartbeatFreshnessMs <= 0) {
            throw new IllegalArgumentException(
                "heartbeatFreshnessMs must be positive (current: " + heartbeatFreshnessMs + ")"
            );
        }
    }

    /**
     * {@code swarm.memory.*} 속성에서 설정 생성 (없는 키는 기본값).
     *
     * @param properties 속성
     * @return 설정
     */
    public static MemoryConfig fromProperties(Properties properties) {
        MemoryConfig defaults = new MemoryConfig();
        return new MemoryConfig(
            properties.getProperty(PREFIX + "namespace", defaults.namespace()),
            Long.parseLong(properties.getProperty(PREFIX + "session-ttl-ms", String.valueOf(defaults.sessionTtlMs()))),
            Long.parseLong(properties.getProperty(PREFIX + "event-ttl-ms", String.valueOf(defaults.eventTtlMs()))),
            Integer.parseInt(properties.getProperty(PREFIX + "event-log-capacity", String.valueOf(defaults.eventLogCapacity()))),
            Long.parseLong(properties.getProperty(PREFIX + "heartbeat-freshness-ms", String.valueOf(defaults.heartbeatFreshnessMs())))
        );
    }

    public MemoryConfig withNamespace(String namespace) {
        return new MemoryConfig(namespace, sessionTtlMs, eventTtlMs, eventLogCapacity, heartbeatFreshnessMs);
    }

    public MemoryConfig withSessionTtlMs(long sessionTtlMs) {
        return new MemoryConfig(namespace, sessionTtlMs, eventTtlMs, eventLogCapacity, heartbeatFreshnessMs);
    }

    public MemoryConfig withEventTtlMs(long eventTtlMs) {
        return new MemoryConfig(namespace, sessionTtlMs, eventTtlMs, eventLogCapacity, heartbeatFreshnessMs);
    }

    public MemoryConfig withEventLogCapacity(int eventLogCapacity) {
        return new MemoryConfig(namespace, sessionTtlMs, eventTtlMs, eventLogCapacity, heartbeatFreshnessMs);
    }

    public MemoryConfig withHeartbeatFreshnessMs(long heartbeatFreshnessMs) {
        return new MemoryConfig(namespace, sessionTtlMs, eventTtlMs, eventLogCapacity, heartbeatFreshnessMs);
    }
}
