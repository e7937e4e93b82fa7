package com.ryuqq.swarm.adapter.launcher;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Agent 실행 모드. 직렬화 시 소문자 wire 이름을 사용합니다.
 *
 * <p>CONTAINER, REMOTE는 명시적으로 지원하지 않으며
 * {@link com.ryuqq.swarm.core.error.UnsupportedLaunchModeException}으로 거부됩니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public enum LaunchMode {
    PROCESS("process"),
    IN_PROCESS("in_process"),
    CONTAINER("container"),
    REMOTE("remote");

    private final String wireName;

    LaunchMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * wire 이름으로 조회 (대소문자 무시).
     *
     * @param wireName 이름
     * @return 실행 모드
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    @JsonCreator
    public static LaunchMode fromWireName(String wireName) {
        String normalized = wireName == null ? "" : wireName.trim().toLowerCase(Locale.ROOT);
        for (LaunchMode mode : values()) {
            if (mode.wireName.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown launch mode: " + wireName);
    }
}
