package com.ryuqq.swarm.application.memory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 세션 이벤트 (이벤트 로그 항목이자 pub/sub 메시지).
 *
 * @param id 이벤트 ID
 * @param type 유형
 * @param sessionId 세션 ID
 * @param timestamp 발생 시각
 * @param data 페이로드
 * @param sourceAgent 발생 Agent (선택)
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record MemoryEvent(
    String id,
    MemoryEventType type,
    String sessionId,
    Instant timestamp,
    Map<String, Object> data,
    String sourceAgent
) {

    public MemoryEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
