package com.ryuqq.swarm.adapter.launcher;

import com.ryuqq.swarm.core.error.UnsupportedLaunchModeException;
import com.ryuqq.swarm.core.model.SessionId;

/**
 * 구현되지 않은 실행 모드 (CONTAINER, REMOTE). 항상 거부합니다.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class UnsupportedLaunchStrategy implements LaunchStrategy {

    private final LaunchMode mode;

    public UnsupportedLaunchStrategy(LaunchMode mode) {
        this.mode = mode;
    }

    @Override
    public AgentHandle launch(SessionId sessionId, AgentConfig config) {
        throw new UnsupportedLaunchModeException(mode.wireName());
    }
}
