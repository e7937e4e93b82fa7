package com.ryuqq.swarm.adapter.launcher;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Agent 역할 구분 (표시/분류용, 스케줄링에는 영향 없음).
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public enum AgentType {
    WORKER("worker"),
    SPECIALIST("specialist"),
    COORDINATOR("coordinator"),
    MONITOR("monitor");

    private final String wireName;

    AgentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AgentType fromWireName(String wireName) {
        String normalized = wireName == null ? "" : wireName.trim().toLowerCase(Locale.ROOT);
        for (AgentType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown agent type: " + wireName);
    }
}
