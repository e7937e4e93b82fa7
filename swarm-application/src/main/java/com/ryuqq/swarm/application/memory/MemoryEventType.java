package com.ryuqq.swarm.application.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 세션 이벤트 유형. 직렬화 시 소문자 wire 이름을 사용합니다.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public enum MemoryEventType {

    SESSION_CREATED("session_created"),
    SESSION_UPDATED("session_updated"),
    TASK_ASSIGNED("task_assigned"),
    TASK_COMPLETED("task_completed"),
    TASK_FAILED("task_failed"),
    AGENT_REGISTERED("agent_registered"),
    AGENT_HEARTBEAT("agent_heartbeat"),
    CONTEXT_UPDATED("context_updated");

    private final String wireName;

    MemoryEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * wire 이름으로 조회.
     *
     * @param wireName 소문자 이름
     * @return 이벤트 유형
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    @JsonCreator
    public static MemoryEventType fromWireName(String wireName) {
        for (MemoryEventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + wireName);
    }
}
