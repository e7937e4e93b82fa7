package com.ryuqq.swarm.core.error;

/**
 * Agent 프로세스/스레드 시작 실패 또는 시작 직후 종료.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public class AgentLaunchException extends RuntimeException {

    public AgentLaunchException(String message) {
        super(message);
    }

    public AgentLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
